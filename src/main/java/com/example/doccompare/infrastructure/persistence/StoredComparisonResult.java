package com.example.doccompare.infrastructure.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.SequenceGenerator;
import jakarta.persistence.Table;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "COMPARE_RESULTS")
public class StoredComparisonResult {

    @Id
    @GeneratedValue(
            strategy = GenerationType.SEQUENCE,
            generator = "compare_result_sequence")
    @SequenceGenerator(
            name = "compare_result_sequence",
            sequenceName = "COMPARE_RESULT_SEQ",
            allocationSize = 1)
    private Long id;

    @Column(name = "NAME", nullable = false)
    private String name;

    @Column(name = "IP_REQUEST", nullable = false)
    private String ipRequest;

    @CreationTimestamp
    @Column(name = "CREATED", updatable = false)
    private LocalDateTime created;

    @Column(name = "MATCHED_ROWS")
    private int matchedRows;

    @Column(name = "MISSING_ROWS")
    private int missingRows;

    @Column(name = "EXTRA_ROWS")
    private int extraRows;

    @Lob
    @Column(name = "REPORT", nullable = false)
    private String reportJson;

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getIpRequest() {
        return ipRequest;
    }

    public void setIpRequest(String ipRequest) {
        this.ipRequest = ipRequest;
    }

    public LocalDateTime getCreated() {
        return created;
    }

    public void setCreated(LocalDateTime created) {
        this.created = created;
    }

    public int getMatchedRows() {
        return matchedRows;
    }

    public void setMatchedRows(int matchedRows) {
        this.matchedRows = matchedRows;
    }

    public int getMissingRows() {
        return missingRows;
    }

    public void setMissingRows(int missingRows) {
        this.missingRows = missingRows;
    }

    public int getExtraRows() {
        return extraRows;
    }

    public void setExtraRows(int extraRows) {
        this.extraRows = extraRows;
    }

    public String getReportJson() {
        return reportJson;
    }

    public void setReportJson(String reportJson) {
        this.reportJson = reportJson;
    }
}
