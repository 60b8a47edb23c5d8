package com.example.main_image_selection.io;

import com.example.main_image_selection.model.AnomalyType;
import com.example.main_image_selection.model.ImageRecord;
import com.example.main_image_selection.model.PriorAssignment;
import com.example.main_image_selection.model.TagRecord;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsers for the images, tags and main-images feeds.
 * <p>
 * A field with the wrong type counts as {@link AnomalyType#UNPARSEABLE_RECORD} and is read as absent. Missing
 * join keys on images and tags are left for the assembler to judge.
 */
public final class InputRecordParsers {
    private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;
    private static final int ISO_DATE_LENGTH = 10;
    private static final String[] TAG_NAME_FIELDS = {"tag", "name", "label"};
    private static final String[] CONFIDENCE_FIELDS = {"confidence", "probability", "score"};

    private InputRecordParsers() {
    }

    public static RecordParser<ImageRecord> images() {
        return (node, anomalies) -> List.of(new ImageRecord(
                text(node, "image_id"),
                text(node, "hotel_id"),
                integer(node, "width", anomalies),
                integer(node, "height", anomalies),
                instant(node, "created_at", anomalies),
                text(node, "source"),
                integer(node, "priority_rank", anomalies),
                text(node, "url")));
    }

    /**
     * Accepts a single tag per line or the grouped form {@code {"image_id": .., "tags": [{..}, ..]}}.
     */
    public static RecordParser<TagRecord> tags() {
        return (node, anomalies) -> {
            String imageId = text(node, "image_id");
            JsonNode grouped = node.get("tags");
            if (grouped == null || grouped.isNull()) {
                return List.of(new TagRecord(imageId, firstText(node, TAG_NAME_FIELDS), firstNumber(node, CONFIDENCE_FIELDS, anomalies)));
            }
            if (!grouped.isArray()) {
                anomalies.record(AnomalyType.UNPARSEABLE_RECORD);
                return List.of();
            }
            List<TagRecord> records = new ArrayList<>(grouped.size());
            for (JsonNode entry : grouped) {
                if (entry.isTextual()) {
                    records.add(new TagRecord(imageId, entry.asText(), null));
                } else if (entry.isObject()) {
                    records.add(new TagRecord(imageId, firstText(entry, TAG_NAME_FIELDS), firstNumber(entry, CONFIDENCE_FIELDS, anomalies)));
                } else {
                    anomalies.record(AnomalyType.UNPARSEABLE_RECORD);
                }
            }
            return records;
        };
    }

    public static RecordParser<PriorAssignment> priorAssignments() {
        return (node, anomalies) -> {
            String hotelId = text(node, "hotel_id");
            String imageId = text(node, "image_id");
            if (hotelId == null || hotelId.isBlank() || imageId == null || imageId.isBlank()) {
                anomalies.record(AnomalyType.MISSING_JOIN_KEY);
                return List.of();
            }
            return List.of(new PriorAssignment(hotelId, imageId));
        };
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }

    static Integer integer(JsonNode node, String field, AnomalyCounter anomalies) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            if (value.isIntegralNumber() && value.canConvertToInt()) {
                return value.intValue();
            }
            anomalies.record(AnomalyType.UNPARSEABLE_RECORD);
            return null;
        }
        if (value.isTextual()) {
            try {
                return Integer.valueOf(value.asText().trim());
            } catch (NumberFormatException e) {
                anomalies.record(AnomalyType.UNPARSEABLE_RECORD);
                return null;
            }
        }
        anomalies.record(AnomalyType.UNPARSEABLE_RECORD);
        return null;
    }

    static Instant instant(JsonNode node, String field, AnomalyCounter anomalies) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            if (!value.canConvertToLong()) {
                anomalies.record(AnomalyType.UNPARSEABLE_RECORD);
                return null;
            }
            long epoch = value.longValue();
            try {
                return epoch >= EPOCH_MILLIS_THRESHOLD ? Instant.ofEpochMilli(epoch) : Instant.ofEpochSecond(epoch);
            } catch (DateTimeException e) {
                anomalies.record(AnomalyType.UNPARSEABLE_RECORD);
                return null;
            }
        }
        if (!value.isTextual()) {
            anomalies.record(AnomalyType.UNPARSEABLE_RECORD);
            return null;
        }
        String raw = value.asText().trim();
        try {
            if (raw.length() <= ISO_DATE_LENGTH) {
                return LocalDate.parse(raw).atStartOfDay().toInstant(ZoneOffset.UTC);
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(raw.replace(' ', 'T'),
                    OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offset) {
                return offset.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            anomalies.record(AnomalyType.UNPARSEABLE_RECORD);
            return null;
        }
    }

    private static String firstText(JsonNode node, String[] fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static Double firstNumber(JsonNode node, String[] fields, AnomalyCounter anomalies) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isNumber()) {
                return value.doubleValue();
            }
            if (value.isTextual()) {
                try {
                    return Double.valueOf(value.asText().trim());
                } catch (NumberFormatException e) {
                    anomalies.record(AnomalyType.UNPARSEABLE_RECORD);
                    return null;
                }
            }
            anomalies.record(AnomalyType.UNPARSEABLE_RECORD);
            return null;
        }
        return null;
    }
}
