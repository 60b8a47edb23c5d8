package com.example.main_image_selection.pipeline;

public enum RunStatus {
    COMPLETED,
    ABORTED
}
