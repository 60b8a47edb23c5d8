package com.example.main_image_selection.io;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Maps one parsed JSONL object to zero or more records.
 * Anomalies are recorded on the counter instead of being thrown.
 */
@FunctionalInterface
public interface RecordParser<T> {
    List<T> parse(JsonNode node, AnomalyCounter anomalies);
}
