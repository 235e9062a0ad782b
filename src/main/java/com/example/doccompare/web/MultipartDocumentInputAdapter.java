package com.example.doccompare.web;

import com.example.doccompare.domain.DocumentInput;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.util.ArrayList;
import java.util.List;

@Component
public class MultipartDocumentInputAdapter {
    private static final String FALLBACK_NAME = "upload";

    public DocumentInput adapt(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("File must not be null or empty");
        }
        return new DocumentInput(sanitizeFilename(file.getOriginalFilename()), file::getInputStream);
    }

    public List<DocumentInput> adapt(MultipartFile[] files) {
        if (files == null || files.length == 0) {
            throw new IllegalArgumentException("At least one file must be provided");
        }
        List<DocumentInput> documents = new ArrayList<>(files.length);
        for (MultipartFile file : files) {
            if (file != null && !file.isEmpty()) {
                documents.add(adapt(file));
            }
        }
        if (documents.isEmpty()) {
            throw new IllegalArgumentException("At least one non-empty file must be provided");
        }
        return documents;
    }

    /**
     * Reduces an uploaded filename to a safe flat name: directories are dropped, whitespace and
     * unsafe characters become underscores, and leading or trailing dots and underscores are
     * removed.
     */
    String sanitizeFilename(String originalFilename) {
        if (originalFilename == null || originalFilename.isBlank()) {
            return FALLBACK_NAME;
        }
        String name = originalFilename.trim();
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        String sanitized =
                name.replaceAll("\\s+", "_")
                        .replaceAll("[^A-Za-z0-9._-]", "_")
                        .replaceAll("^[._]+|[._]+$", "");
        return sanitized.isEmpty() ? FALLBACK_NAME : sanitized;
    }
}
