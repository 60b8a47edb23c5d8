package com.example.main_image_selection.exception;

/**
 * Raised when the data would break a uniqueness guarantee that downstream outputs depend on.
 * A run that hits it must not publish anything.
 */
public class StructuralViolationException extends RuntimeException {
    public StructuralViolationException(String message) {
        super(message);
    }
}
