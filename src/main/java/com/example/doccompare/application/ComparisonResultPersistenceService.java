package com.example.doccompare.application;

import com.example.doccompare.domain.ComparisonResult;
import com.example.doccompare.domain.ComparisonSummary;
import com.example.doccompare.infrastructure.persistence.StoredComparisonResult;
import com.example.doccompare.infrastructure.persistence.StoredComparisonResultRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Stores comparison reports and serves them back for viewing and export.
 */
@Service
public class ComparisonResultPersistenceService {
    private static final Logger log = LogManager.getLogger(ComparisonResultPersistenceService.class);

    private static final int DEFAULT_PAGE_SIZE = 20;
    private static final int MAX_PAGE_SIZE = 100;

    private final StoredComparisonResultRepository repository;
    private final ObjectMapper objectMapper;

    public ComparisonResultPersistenceService(
            StoredComparisonResultRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public long saveComparison(String name, String ipRequest, ComparisonResult result) {
        StoredComparisonResult entity = new StoredComparisonResult();
        entity.setName(name);
        entity.setIpRequest(ipRequest);
        ComparisonSummary summary = result.getSummary();
        if (summary != null) {
            entity.setMatchedRows(summary.getMatched());
            entity.setMissingRows(summary.getMissing());
            entity.setExtraRows(summary.getExtra());
        }
        entity.setReportJson(toJson(result));
        StoredComparisonResult saved = repository.save(entity);
        log.info("Stored comparison '{}' as #{}", name, saved.getId());
        return saved.getId();
    }

    @Transactional(readOnly = true)
    public StoredComparisonResultView loadComparison(long id) {
        StoredComparisonResult entity = findOrThrow(id);
        return new StoredComparisonResultView(
                entity.getId(),
                entity.getName(),
                entity.getIpRequest(),
                entity.getCreated(),
                fromJson(entity.getReportJson()));
    }

    @Transactional(readOnly = true)
    public Page<StoredComparisonResultSummary> searchComparisons(
            String nameFilter, String ipFilter, int page, int size) {
        String nameQuery = sanitizeFilter(nameFilter);
        String ipQuery = sanitizeFilter(ipFilter);
        Pageable pageable =
                PageRequest.of(sanitizePage(page), sanitizeSize(size), sortByCreatedDesc());

        return repository
                .findByNameContainingIgnoreCaseAndIpRequestContainingIgnoreCase(
                        nameQuery, ipQuery, pageable)
                .map(
                        result ->
                                new StoredComparisonResultSummary(
                                        result.getId(),
                                        result.getName(),
                                        result.getIpRequest(),
                                        result.getCreated(),
                                        result.getMatchedRows(),
                                        result.getMissingRows(),
                                        result.getExtraRows()));
    }

    @Transactional
    public void deleteComparison(long id, String requesterIp) {
        StoredComparisonResult entity = findOrThrow(id);
        if (!Objects.equals(entity.getIpRequest(), requesterIp)) {
            throw new ResponseStatusException(
                    HttpStatus.FORBIDDEN, "Not allowed to delete this comparison");
        }
        repository.delete(entity);
        log.info("Deleted comparison #{}", id);
    }

    private StoredComparisonResult findOrThrow(long id) {
        return repository
                .findById(id)
                .orElseThrow(
                        () -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Comparison not found"));
    }

    private String toJson(ComparisonResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException ex) {
            throw new ResponseStatusException(
                    HttpStatus.INTERNAL_SERVER_ERROR, "Failed to store comparison result", ex);
        }
    }

    private ComparisonResult fromJson(String json) {
        try {
            return objectMapper.readValue(json, ComparisonResult.class);
        } catch (JsonProcessingException ex) {
            throw new ResponseStatusException(
                    HttpStatus.INTERNAL_SERVER_ERROR, "Failed to read comparison result", ex);
        }
    }

    public record StoredComparisonResultView(
            Long id,
            String name,
            String ipRequest,
            LocalDateTime created,
            ComparisonResult result) {}

    public record StoredComparisonResultSummary(
            Long id,
            String name,
            String ipRequest,
            LocalDateTime created,
            int matchedRows,
            int missingRows,
            int extraRows) {}

    private Sort sortByCreatedDesc() {
        return Sort.by(Sort.Direction.DESC, "created");
    }

    private int sanitizePage(int page) {
        return Math.max(page, 0);
    }

    private int sanitizeSize(int requestedSize) {
        if (requestedSize <= 0) {
            return DEFAULT_PAGE_SIZE;
        }
        return Math.min(requestedSize, MAX_PAGE_SIZE);
    }

    private String sanitizeFilter(String filter) {
        if (filter == null) {
            return "";
        }
        return filter.trim();
    }
}
