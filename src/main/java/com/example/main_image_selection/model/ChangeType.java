package com.example.main_image_selection.model;

public enum ChangeType {
    UNCHANGED,
    ASSIGNED,
    REASSIGNED,
    REMOVED
}
