package com.example.main_image_selection.assembler;

import com.example.main_image_selection.model.AnomalyType;
import com.example.main_image_selection.model.DataQualityReport;
import com.example.main_image_selection.model.EnrichedImage;
import com.example.main_image_selection.model.ImageRecord;
import com.example.main_image_selection.model.TagRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Left outer join of image records with their tags on {@code image_id}.
 */
@Component
public class CandidateAssembler {
    private static final Logger LOGGER = LoggerFactory.getLogger(CandidateAssembler.class);
    private static final int ORPHAN_SAMPLE_SIZE = 5;

    public AssemblyResult assemble(Collection<ImageRecord> images, Collection<TagRecord> tags) {
        Map<String, ImageRecord> accepted = new LinkedHashMap<>();
        int missingKeys = 0;
        int duplicates = 0;
        for (ImageRecord image : images) {
            if (!image.hasJoinKeys()) {
                missingKeys++;
                continue;
            }
            if (accepted.putIfAbsent(image.imageId(), image) != null) {
                duplicates++;
                LOGGER.debug("assembler duplicate imageId={} hotelId={} kept first", image.imageId(), image.hotelId());
            }
        }

        Map<String, Map<String, Double>> tagsByImage = new HashMap<>();
        int orphans = 0;
        int blankTags = 0;
        TreeSet<String> orphanSample = new TreeSet<>();
        for (TagRecord tag : tags) {
            if (tag.tag() == null || tag.tag().isBlank()) {
                blankTags++;
                continue;
            }
            if (tag.imageId() == null || !accepted.containsKey(tag.imageId())) {
                orphans++;
                if (orphanSample.size() < ORPHAN_SAMPLE_SIZE) {
                    orphanSample.add(String.valueOf(tag.imageId()));
                }
                continue;
            }
            Map<String, Double> merged = tagsByImage.computeIfAbsent(tag.imageId(), id -> new HashMap<>());
            mergeTag(merged, normalize(tag.tag()), tag.confidence());
        }

        List<EnrichedImage> candidates = new ArrayList<>(accepted.size());
        for (ImageRecord image : accepted.values()) {
            Map<String, Double> imageTags = tagsByImage.get(image.imageId());
            candidates.add(imageTags == null ? EnrichedImage.untagged(image) : new EnrichedImage(image, imageTags));
        }

        if (orphans > 0) {
            LOGGER.warn("assembler discarded orphan tags count={} sampleImageIds={}", orphans, orphanSample);
        }
        if (missingKeys > 0 || duplicates > 0) {
            LOGGER.warn("assembler dropped images missingJoinKey={} duplicateImageId={}", missingKeys, duplicates);
        }
        LOGGER.debug("assembler images={} tags={} candidates={} tagged={}",
                images.size(), tags.size(), candidates.size(), tagsByImage.size());

        DataQualityReport report = DataQualityReport.empty()
                .plus(AnomalyType.ORPHAN_TAG, orphans)
                .plus(AnomalyType.MISSING_JOIN_KEY, missingKeys)
                .plus(AnomalyType.DUPLICATE_IMAGE, duplicates)
                .plus(AnomalyType.UNPARSEABLE_RECORD, blankTags);
        return new AssemblyResult(List.copyOf(candidates), missingKeys + duplicates, report);
    }

    // a present confidence always wins over an absent one
    private static void mergeTag(Map<String, Double> merged, String tag, Double confidence) {
        if (!merged.containsKey(tag)) {
            merged.put(tag, confidence);
            return;
        }
        Double current = merged.get(tag);
        if (confidence == null) {
            return;
        }
        if (current == null || confidence > current) {
            merged.put(tag, confidence);
        }
    }

    private static String normalize(String tag) {
        return tag.trim().toLowerCase(Locale.ROOT);
    }
}
