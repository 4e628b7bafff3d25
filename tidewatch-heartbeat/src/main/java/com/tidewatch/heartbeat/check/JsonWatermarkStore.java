package com.tidewatch.heartbeat.check;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tidewatch.common.infra.AtomicFiles;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Watermarks kept in a small JSON object on disk. Best effort: an unreadable
 * file reads as empty and a failed write is only logged, so the worst case
 * is re-reporting some messages.
 */
@Slf4j
public class JsonWatermarkStore implements WatermarkStore {

    private static final TypeReference<Map<String, Long>> TYPE = new TypeReference<>() {
    };

    private final Path path;
    private final ObjectMapper objectMapper;

    public JsonWatermarkStore(Path path, ObjectMapper objectMapper) {
        this.path = path;
        this.objectMapper = objectMapper;
    }

    @Override
    public Map<String, Long> read() {
        if (!Files.exists(path)) {
            return new HashMap<>();
        }
        try {
            Map<String, Long> marks = objectMapper.readValue(path.toFile(), TYPE);
            return marks == null ? new HashMap<>() : new HashMap<>(marks);
        } catch (IOException e) {
            log.debug("Unreadable watermark file {}: {}", path, e.getMessage());
            return new HashMap<>();
        }
    }

    @Override
    public void write(Map<String, Long> watermarks) {
        try {
            AtomicFiles.writeString(path, objectMapper.writeValueAsString(watermarks));
        } catch (IOException e) {
            log.debug("Failed to write watermark file {}: {}", path, e.getMessage());
        }
    }
}
