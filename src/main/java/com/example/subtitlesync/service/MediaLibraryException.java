package com.example.subtitlesync.service;

/**
 * Raised when the media server cannot be reached or answers with an error.
 */
public class MediaLibraryException extends RuntimeException {

    public MediaLibraryException(String message) {
        super(message);
    }

    public MediaLibraryException(String message, Throwable cause) {
        super(message, cause);
    }
}
