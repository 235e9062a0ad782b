package com.example.doccompare.domain;

/**
 * Raised when a comparison is requested with settings that cannot produce a meaningful result.
 */
public class InvalidConfigurationException extends RuntimeException {
    public InvalidConfigurationException(String message) {
        super(message);
    }
}
