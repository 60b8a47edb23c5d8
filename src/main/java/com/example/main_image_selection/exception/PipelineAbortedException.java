package com.example.main_image_selection.exception;

public class PipelineAbortedException extends RuntimeException {
    public PipelineAbortedException(String message) {
        super(message);
    }

    public PipelineAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
