package com.tidewatch.cron;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleStoreTest {

    @TempDir
    Path tempDir;
    private ScheduleStore store;

    @BeforeEach
    void setUp() {
        store = new ScheduleStore(tempDir.resolve(".tidewatch/cron.tab"));
    }

    private static CronJob job(String name, String schedule) {
        return CronJob.builder().name(name).schedule(schedule).task("do " + name).build();
    }

    @Test
    void missingFileIsEmptySchedule() {
        assertTrue(store.load().isEmpty());
        assertTrue(store.get("anything").isEmpty());
    }

    @Test
    void ensureFile_createsCommentedFileOnce() throws IOException {
        store.ensureFile();
        String created = Files.readString(store.getPath());
        assertTrue(created.startsWith("# cron.tab"));

        store.add(job("a", "0 9 * * *"));
        store.ensureFile();
        assertEquals(1, store.load().size());
    }

    @Test
    void add_persistsAndRejectsDuplicateNameWithoutMutation() throws IOException {
        assertTrue(store.add(job("brief", "0 9 * * 1-5")));
        String before = Files.readString(store.getPath());

        assertFalse(store.add(job("brief", "0 10 * * *")));

        assertEquals(before, Files.readString(store.getPath()));
        assertEquals("0 9 * * 1-5", store.get("brief").orElseThrow().getSchedule());
    }

    @Test
    void add_rejectsInvalidExpression() {
        assertThrows(CronValidationException.class, () -> store.add(job("bad", "0 25 * * *")));
        assertFalse(Files.exists(store.getPath()));
    }

    @Test
    void add_rejectsTaskThatWouldReadBackAsFlags() throws IOException {
        store.add(job("keep", "0 8 * * *"));
        String before = Files.readString(store.getPath());

        for (String task : List.of("disabled accounts need review", "channel:ops restart", "timeout:5 wait")) {
            CronJob job = CronJob.builder().name("remind").schedule("0 9 * * *").task(task).build();
            assertThrows(CronValidationException.class, () -> store.add(job), task);
        }

        assertEquals(before, Files.readString(store.getPath()));
        assertTrue(store.get("remind").isEmpty());
    }

    @Test
    void add_rejectsNameWithWhitespaceAndMultiLineTask() {
        CronJob spaced = CronJob.builder().name("daily report").schedule("0 9 * * *").task("Write it").build();
        CronJob multiLine = CronJob.builder().name("notes").schedule("0 9 * * *").task("first\nsecond").build();
        CronJob blank = CronJob.builder().name("empty").schedule("0 9 * * *").task("  ").build();

        assertThrows(CronValidationException.class, () -> store.add(spaced));
        assertThrows(CronValidationException.class, () -> store.add(multiLine));
        assertThrows(CronValidationException.class, () -> store.add(blank));
        assertFalse(Files.exists(store.getPath()));
    }

    @Test
    void flagWordsLaterInTheTaskAndShortTimeoutsSurviveStorage() {
        CronJob job = CronJob.builder().name("remind").schedule("0 9 * * *")
                .task("review disabled accounts").channel("ops").timeout(Duration.ofSeconds(20)).build();
        assertTrue(store.add(job));

        CronJob stored = store.get("remind").orElseThrow();
        assertEquals("review disabled accounts", stored.getTask());
        assertEquals("ops", stored.getChannel());
        assertFalse(stored.isDisabled());
        assertEquals(Duration.ofMinutes(1), stored.getTimeout());
    }

    @Test
    void remove() {
        store.add(job("a", "0 9 * * *"));
        store.add(job("b", "0 10 * * *"));

        assertTrue(store.remove("a"));
        assertFalse(store.remove("a"));
        assertEquals(1, store.load().size());
        assertEquals("b", store.load().get(0).getName());
    }

    @Test
    void update_changesOnlyGivenFields() {
        store.add(job("a", "0 9 * * *"));

        assertTrue(store.update("a", CronJobUpdate.builder()
                .schedule("30 9 * * *").timeout(Duration.ofMinutes(20)).build()));
        assertTrue(store.update("a", CronJobUpdate.disabled(true)));

        CronJob updated = store.get("a").orElseThrow();
        assertEquals("30 9 * * *", updated.getSchedule());
        assertEquals(Duration.ofMinutes(20), updated.getTimeout());
        assertTrue(updated.isDisabled());
        assertEquals("do a", updated.getTask());
        assertEquals("general", updated.getChannel());
    }

    @Test
    void update_unknownOrInvalid() {
        store.add(job("a", "0 9 * * *"));
        assertFalse(store.update("missing", CronJobUpdate.disabled(true)));
        assertThrows(CronValidationException.class,
                () -> store.update("a", CronJobUpdate.builder().schedule("nope").build()));
        assertEquals("0 9 * * *", store.get("a").orElseThrow().getSchedule());
    }

    @Test
    void update_rejectsTaskOrChannelTheFileCannotHold() throws IOException {
        store.add(job("a", "0 9 * * *"));
        String before = Files.readString(store.getPath());

        assertThrows(CronValidationException.class,
                () -> store.update("a", CronJobUpdate.builder().task("disabled for now").build()));
        assertThrows(CronValidationException.class,
                () -> store.update("a", CronJobUpdate.builder().task("line one\r\nline two").build()));
        assertThrows(CronValidationException.class,
                () -> store.update("a", CronJobUpdate.builder().channel("two words").build()));

        assertEquals(before, Files.readString(store.getPath()));
        assertEquals("do a", store.get("a").orElseThrow().getTask());
    }

    @Test
    void handEditsAreVisibleImmediately() throws IOException {
        store.ensureFile();
        Files.writeString(store.getPath(), "0 9 * * *  manual  added by hand\n");
        assertEquals("added by hand", store.get("manual").orElseThrow().getTask());
    }
}
