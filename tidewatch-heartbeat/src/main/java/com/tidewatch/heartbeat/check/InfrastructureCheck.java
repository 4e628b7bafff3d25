package com.tidewatch.heartbeat.check;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Probes configured dependencies and disk usage.
 * <p>
 * Fails when any dependency is down or the disk holding {@code diskPath} is
 * at least {@code thresholdPercent} full.
 */
@Slf4j
public class InfrastructureCheck implements AwarenessCheck {

    public static final String NAME = "Infra";
    public static final String DATA_SERVICES = "services";
    static final String DISK_PCT = "disk_pct";
    static final String DISK_FREE_GB = "disk_free_gb";

    private final List<DependencyProbe> probes;
    private final Path diskPath;
    private final int thresholdPercent;
    private final Executor executor;

    public InfrastructureCheck(List<DependencyProbe> probes, Path diskPath, int thresholdPercent, Executor executor) {
        this.probes = List.copyOf(probes);
        this.diskPath = diskPath;
        this.thresholdPercent = thresholdPercent;
        this.executor = executor;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckResult run(CheckContext context) {
        return Checks.timed(NAME, this::check);
    }

    private Checks.Outcome check() {
        List<CompletableFuture<Boolean>> pending = new ArrayList<>();
        for (DependencyProbe probe : probes) {
            pending.add(CompletableFuture.supplyAsync(probe::isUp, executor).exceptionally(e -> false));
        }

        Map<String, Object> services = new LinkedHashMap<>();
        List<String> down = new ArrayList<>();
        for (int i = 0; i < probes.size(); i++) {
            boolean up = pending.get(i).join();
            services.put(probes.get(i).name(), up);
            if (!up) {
                down.add(probes.get(i).name());
            }
        }

        DiskUsage disk = diskUsage();
        services.put(DISK_PCT, disk.percentUsed());
        services.put(DISK_FREE_GB, disk.freeGb());

        boolean diskWarning = disk.percentUsed() >= thresholdPercent;
        List<String> parts = new ArrayList<>();
        if (!down.isEmpty()) {
            parts.add(String.join(", ", down) + " down");
        }
        if (diskWarning) {
            parts.add("disk " + disk.percentUsed() + "%");
        }
        if (parts.isEmpty()) {
            parts.add(String.format(Locale.ROOT, "all up, disk %d%% (%.1fGB free)", disk.percentUsed(), disk.freeGb()));
        }

        boolean ok = down.isEmpty() && !diskWarning;
        return new Checks.Outcome(ok, String.join("; ", parts), Map.of(DATA_SERVICES, services));
    }

    record DiskUsage(int percentUsed, double freeGb) {
    }

    /** Percent used is -1 when the file store cannot be read. */
    DiskUsage diskUsage() {
        try {
            FileStore store = Files.getFileStore(diskPath);
            long total = store.getTotalSpace();
            long free = store.getUsableSpace();
            if (total <= 0) {
                return new DiskUsage(-1, 0);
            }
            int pct = (int) Math.round((1 - (double) free / total) * 100);
            double freeGb = Math.round(free / (1024.0 * 1024 * 1024) * 10) / 10.0;
            return new DiskUsage(pct, freeGb);
        } catch (IOException e) {
            log.debug("Disk usage unavailable for {}: {}", diskPath, e.getMessage());
            return new DiskUsage(-1, 0);
        }
    }
}
