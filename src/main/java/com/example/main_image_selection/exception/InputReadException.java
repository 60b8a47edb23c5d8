package com.example.main_image_selection.exception;

public class InputReadException extends RuntimeException {
    public InputReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
