package com.example.main_image_selection.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;

/**
 * Writes one JSON object per line.
 */
@Component
public class JsonlWriter {
    private final ObjectMapper objectMapper;

    public JsonlWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(Path target, Collection<?> records) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            for (Object record : records) {
                writer.write(objectMapper.writeValueAsString(record));
                writer.newLine();
            }
        }
    }
}
