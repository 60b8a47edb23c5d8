package com.example.main_image_selection.io;

import com.example.main_image_selection.exception.InputReadException;
import com.example.main_image_selection.model.AnomalyType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads line-delimited JSON. Blank lines are skipped; a line that is not a JSON object is counted as
 * {@link AnomalyType#UNPARSEABLE_RECORD} and skipped.
 */
@Component
public class JsonlReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonlReader.class);

    private final ObjectMapper objectMapper;

    public JsonlReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public <T> ReadResult<T> read(Path path, RecordParser<T> parser) {
        if (!Files.isRegularFile(path)) {
            throw new InputReadException("Input file not found: " + path, null);
        }
        AnomalyCounter anomalies = new AnomalyCounter();
        List<T> records = new ArrayList<>();
        int lineNo = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                JsonNode node = parseLine(line, path, lineNo);
                if (node == null || !node.isObject()) {
                    anomalies.record(AnomalyType.UNPARSEABLE_RECORD);
                    continue;
                }
                records.addAll(parser.parse(node, anomalies));
            }
        } catch (IOException e) {
            throw new InputReadException("Cannot read " + path, e);
        }
        ReadResult<T> result = new ReadResult<>(List.copyOf(records), lineNo, anomalies.toReport());
        LOGGER.info("INPUT read path={} lines={} records={} anomalies={}", path, lineNo, records.size(), result.report().total());
        return result;
    }

    private JsonNode parseLine(String line, Path path, int lineNo) {
        try {
            return objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            LOGGER.warn("INPUT skip unparseable line path={} line={} err={}", path, lineNo, e.getOriginalMessage());
            return null;
        }
    }
}
