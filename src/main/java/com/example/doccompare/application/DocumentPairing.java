package com.example.doccompare.application;

import com.example.doccompare.domain.DocumentInput;
import com.example.doccompare.domain.DocumentPair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Joins source documents with their renderings on the filename stem.
 */
@Component
public class DocumentPairing {
    private static final Logger log = LogManager.getLogger(DocumentPairing.class);

    public PairingResult pair(List<DocumentInput> leftDocuments, List<DocumentInput> rightDocuments) {
        Map<String, DocumentInput> left = byStem(leftDocuments);
        Map<String, DocumentInput> right = byStem(rightDocuments);

        List<DocumentPair> pairs = new ArrayList<>();
        List<String> unpairedLeft = new ArrayList<>();
        for (Map.Entry<String, DocumentInput> entry : left.entrySet()) {
            DocumentInput rendering = right.get(entry.getKey());
            if (rendering == null) {
                unpairedLeft.add(entry.getValue().filename());
            } else {
                pairs.add(new DocumentPair(entry.getKey(), entry.getValue(), rendering));
            }
        }
        List<String> unpairedRight = new ArrayList<>();
        for (Map.Entry<String, DocumentInput> entry : right.entrySet()) {
            if (!left.containsKey(entry.getKey())) {
                unpairedRight.add(entry.getValue().filename());
            }
        }
        if (!unpairedLeft.isEmpty() || !unpairedRight.isEmpty()) {
            log.warn("Unpaired uploads, left: {}, right: {}", unpairedLeft, unpairedRight);
        }
        return new PairingResult(pairs, unpairedLeft, unpairedRight);
    }

    // later uploads with the same stem replace earlier ones
    private Map<String, DocumentInput> byStem(List<DocumentInput> documents) {
        Map<String, DocumentInput> result = new TreeMap<>();
        for (DocumentInput document : documents) {
            result.put(document.stem(), document);
        }
        return result;
    }

    public record PairingResult(
            List<DocumentPair> pairs, List<String> unpairedLeft, List<String> unpairedRight) {}
}
