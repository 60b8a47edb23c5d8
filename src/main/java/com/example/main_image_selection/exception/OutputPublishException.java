package com.example.main_image_selection.exception;

public class OutputPublishException extends RuntimeException {
    public OutputPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
