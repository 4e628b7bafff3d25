package com.tidewatch.cron;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Watches the schedule file and invokes a callback whenever it is created,
 * modified, replaced or deleted. The parent directory is watched rather than
 * the file itself so that atomic renames are seen.
 */
@Slf4j
public class ScheduleWatcher implements AutoCloseable {

    /** Let a burst of events from one write settle before reacting. */
    private static final long SETTLE_MS = 50;

    private final Path file;
    private final Runnable onChange;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile WatchService watchService;
    private volatile Thread watchThread;

    public ScheduleWatcher(Path file, Runnable onChange) {
        this.file = file.toAbsolutePath();
        this.onChange = onChange;
    }

    /**
     * Start watching. A directory that cannot be watched is logged and the
     * watcher stays inactive.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        Path parentDir = file.getParent();
        String fileName = file.getFileName().toString();

        try {
            Files.createDirectories(parentDir);
            watchService = FileSystems.getDefault().newWatchService();
            parentDir.register(watchService,
                    StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY,
                    StandardWatchEventKinds.ENTRY_DELETE);
        } catch (IOException e) {
            log.warn("Failed to watch schedule file {}: {}", file, e.getMessage());
            running.set(false);
            return;
        }

        watchThread = new Thread(() -> {
            log.debug("Schedule watcher started for: {}", file);
            while (running.get()) {
                try {
                    WatchKey key = watchService.take();
                    boolean relevant = false;
                    for (var event : key.pollEvents()) {
                        if (event.kind() == StandardWatchEventKinds.OVERFLOW
                                || (event.context() instanceof Path changed
                                        && fileName.equals(changed.toString()))) {
                            relevant = true;
                        }
                    }
                    key.reset();
                    if (!relevant)
                        continue;

                    Thread.sleep(SETTLE_MS);
                    drainPending();
                    onChange.run();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (ClosedWatchServiceException e) {
                    break;
                } catch (Exception e) {
                    log.error("Schedule watcher error: {}", e.getMessage(), e);
                }
            }
            log.debug("Schedule watcher stopped");
        }, "cron-schedule-watcher");
        watchThread.setDaemon(true);
        watchThread.start();
    }

    public boolean isRunning() {
        return running.get();
    }

    private void drainPending() {
        WatchKey pending;
        while ((pending = watchService.poll()) != null) {
            pending.pollEvents();
            pending.reset();
        }
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            try {
                if (watchService != null) {
                    watchService.close();
                }
            } catch (IOException e) {
                log.warn("Error closing schedule watch service: {}", e.getMessage());
            }
            if (watchThread != null) {
                watchThread.interrupt();
            }
        }
    }
}
