package com.tidewatch.cron;

import com.tidewatch.common.infra.AtomicFiles;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * CRUD over the schedule file. The file is the single source of truth: every
 * call reads it afresh and every mutation rewrites it atomically, so hand
 * edits and API edits never diverge.
 */
@Slf4j
public class ScheduleStore {

    private final Path path;
    private final Object writeLock = new Object();

    public ScheduleStore(Path path) {
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    /**
     * Current jobs; an absent file is an empty schedule.
     *
     * @throws ScheduleStoreException if the file exists but cannot be read
     */
    public List<CronJob> load() {
        try {
            return ScheduleFile.parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return new ArrayList<>();
        } catch (IOException e) {
            throw new ScheduleStoreException("Failed to read schedule file " + path, e);
        }
    }

    /**
     * Rewrite the whole file.
     *
     * @throws ScheduleStoreException if the file cannot be written
     */
    public void save(List<CronJob> jobs) {
        try {
            AtomicFiles.writeString(path, ScheduleFile.serialize(jobs));
        } catch (IOException e) {
            throw new ScheduleStoreException("Failed to write schedule file " + path, e);
        }
    }

    /**
     * Create the file with its documentation header when missing.
     *
     * @throws ScheduleStoreException if the file can neither be read nor created
     */
    public void ensureFile() {
        if (Files.exists(path)) {
            if (!Files.isReadable(path)) {
                throw new ScheduleStoreException("Schedule file is not readable: " + path, null);
            }
            return;
        }
        save(List.of());
        log.info("Created schedule file {}", path);
    }

    /**
     * @return false if a job with the same name exists; the file is untouched
     * @throws CronValidationException if the schedule is malformed or the job
     *         would not read back unchanged
     */
    public boolean add(CronJob job) {
        CronExpression.parse(job.getSchedule());
        checkRepresentable(job);
        synchronized (writeLock) {
            List<CronJob> jobs = load();
            if (jobs.stream().anyMatch(j -> j.getName().equals(job.getName()))) {
                return false;
            }
            jobs.add(job.toBuilder().build());
            save(jobs);
        }
        log.info("Added cron job: {} ({})", job.getName(), job.getSchedule());
        return true;
    }

    public boolean remove(String name) {
        synchronized (writeLock) {
            List<CronJob> jobs = load();
            if (!jobs.removeIf(j -> j.getName().equals(name))) {
                return false;
            }
            save(jobs);
        }
        log.info("Removed cron job: {}", name);
        return true;
    }

    /**
     * @return false if no job has that name
     * @throws CronValidationException if the update carries a malformed schedule
     *         or leaves the job unrepresentable; the file is untouched
     */
    public boolean update(String name, CronJobUpdate update) {
        if (update.getSchedule() != null) {
            CronExpression.parse(update.getSchedule());
        }
        synchronized (writeLock) {
            List<CronJob> jobs = load();
            Optional<CronJob> job = jobs.stream().filter(j -> j.getName().equals(name)).findFirst();
            if (job.isEmpty()) {
                return false;
            }
            update.applyTo(job.get());
            checkRepresentable(job.get());
            save(jobs);
        }
        log.debug("Updated cron job: {}", name);
        return true;
    }

    public Optional<CronJob> get(String name) {
        return load().stream().filter(j -> j.getName().equals(name)).findFirst();
    }

    private static void checkRepresentable(CronJob job) {
        ScheduleFile.problem(job).ifPresent(problem -> {
            throw new CronValidationException(problem);
        });
    }
}
