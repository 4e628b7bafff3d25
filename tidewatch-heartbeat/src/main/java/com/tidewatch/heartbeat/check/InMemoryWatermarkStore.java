package com.tidewatch.heartbeat.check;

import java.util.HashMap;
import java.util.Map;

public class InMemoryWatermarkStore implements WatermarkStore {

    private Map<String, Long> watermarks = Map.of();

    @Override
    public synchronized Map<String, Long> read() {
        return new HashMap<>(watermarks);
    }

    @Override
    public synchronized void write(Map<String, Long> watermarks) {
        this.watermarks = Map.copyOf(watermarks);
    }
}
