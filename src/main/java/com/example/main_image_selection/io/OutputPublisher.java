package com.example.main_image_selection.io;

import com.example.main_image_selection.exception.OutputPublishException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Publishes several JSONL outputs together: every output is first written to a temporary file next to its
 * target, and only when all of them were written are they moved into place. Existing targets are moved aside
 * first and restored if any move fails, so a failed publish leaves the previous outputs in place.
 */
@Component
public class OutputPublisher {
    private static final Logger LOGGER = LoggerFactory.getLogger(OutputPublisher.class);
    private static final String TEMP_SUFFIX = ".tmp";
    private static final String BACKUP_SUFFIX = ".bak";

    private final JsonlWriter writer;

    public OutputPublisher(JsonlWriter writer) {
        this.writer = writer;
    }

    public void publish(Map<Path, ? extends Collection<?>> outputs) {
        Map<Path, Path> staged = new LinkedHashMap<>();
        try {
            for (Map.Entry<Path, ? extends Collection<?>> entry : outputs.entrySet()) {
                Path target = entry.getKey().toAbsolutePath().normalize();
                Path parent = target.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Path temp = Files.createTempFile(parent, target.getFileName().toString() + ".", TEMP_SUFFIX);
                staged.put(temp, target);
                writer.write(temp, entry.getValue());
            }
        } catch (IOException e) {
            discard(staged.keySet());
            throw new OutputPublishException("Staging outputs failed", e);
        }

        Map<Path, Path> backups = new LinkedHashMap<>();
        List<Path> published = new ArrayList<>();
        try {
            for (Map.Entry<Path, Path> entry : staged.entrySet()) {
                Path target = entry.getValue();
                if (Files.isRegularFile(target)) {
                    Path backup = Files.createTempFile(target.getParent(), target.getFileName().toString() + ".", BACKUP_SUFFIX);
                    move(target, backup);
                    backups.put(target, backup);
                }
                move(entry.getKey(), target);
                published.add(target);
            }
        } catch (IOException e) {
            OutputPublishException failure = new OutputPublishException("Publishing outputs failed, restoring previous files", e);
            rollback(published, backups, failure);
            discard(staged.keySet());
            throw failure;
        }
        discard(backups.values());
        LOGGER.info("OUTPUT published files={}", published);
    }

    // puts every replaced target back the way it was before publish started
    private static void rollback(List<Path> published, Map<Path, Path> backups, OutputPublishException failure) {
        for (Path target : published) {
            try {
                if (!backups.containsKey(target)) {
                    Files.deleteIfExists(target);
                }
            } catch (IOException e) {
                failure.addSuppressed(e);
            }
        }
        for (Map.Entry<Path, Path> backup : backups.entrySet()) {
            try {
                move(backup.getValue(), backup.getKey());
            } catch (IOException e) {
                LOGGER.error("OUTPUT restore failed target={} backup={} err={}", backup.getKey(), backup.getValue(), e.toString());
                failure.addSuppressed(e);
            }
        }
        LOGGER.warn("OUTPUT rolled back replaced={} restored={}", published, backups.keySet());
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discard(Collection<Path> temps) {
        for (Path temp : temps) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                LOGGER.warn("OUTPUT cleanup failed path={} err={}", temp, e.toString());
            }
        }
    }
}
