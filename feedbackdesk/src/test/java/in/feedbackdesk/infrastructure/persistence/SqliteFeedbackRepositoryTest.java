package in.feedbackdesk.infrastructure.persistence;

import com.zaxxer.hikari.HikariDataSource;
import in.feedbackdesk.config.FeedbackConfig;
import in.feedbackdesk.domain.exception.StorageUnavailableException;
import in.feedbackdesk.domain.model.FeedbackRecord;
import in.feedbackdesk.domain.model.ValidatedMessage;
import in.feedbackdesk.migration.FeedbackSchemaMigration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SqliteFeedbackRepository against a real SQLite file.
 */
@DisplayName("SQLite Feedback Repository Tests")
public class SqliteFeedbackRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-10-17T10:00:00.123456Z");

    @TempDir
    Path tempDir;

    private HikariDataSource dataSource;
    private SqliteFeedbackRepository repository;

    @BeforeEach
    public void setUp() {
        FeedbackConfig config = FeedbackConfig.defaults(tempDir.resolve("db/feedback.db").toString());
        dataSource = SqliteDataSourceFactory.create(config);
        new FeedbackSchemaMigration(dataSource).migrate();
        repository = new SqliteFeedbackRepository(dataSource, Duration.ofSeconds(5), Duration.ofSeconds(5));
    }

    @AfterEach
    public void tearDown() {
        dataSource.close();
    }

    private static ValidatedMessage msg(String text) {
        return new ValidatedMessage(text);
    }

    @Test
    @DisplayName("Create assigns an id and equal timestamps")
    public void testCreate() {
        FeedbackRecord record = repository.create(msg("Great service!"), T0);

        assertTrue(record.id() > 0);
        assertEquals("Great service!", record.message());
        assertEquals(T0, record.createdAt());
        assertEquals(record.createdAt(), record.updatedAt());
        assertEquals(Optional.of(record), repository.findById(record.id()));
    }

    @Test
    @DisplayName("Timestamps are truncated to microseconds")
    public void testTimestampTruncation() {
        Instant withNanos = Instant.parse("2026-10-17T10:00:00.123456789Z");
        FeedbackRecord record = repository.create(msg("hi"), withNanos);

        assertEquals(withNanos.truncatedTo(ChronoUnit.MICROS), record.createdAt());
        assertEquals(record.createdAt(), repository.findById(record.id()).orElseThrow().createdAt());
    }

    @Test
    @DisplayName("Repeated reads return the same record")
    public void testIdempotentRead() {
        FeedbackRecord record = repository.create(msg("same"), T0);

        assertEquals(repository.findById(record.id()), repository.findById(record.id()));
        assertEquals(repository.findAll(), repository.findAll());
    }

    @Test
    @DisplayName("Ids keep increasing and are not reused after delete")
    public void testIdMonotonicAcrossDeletes() {
        long a = repository.create(msg("a"), T0).id();
        long b = repository.create(msg("b"), T0).id();
        long c = repository.create(msg("c"), T0).id();
        assertTrue(a < b && b < c);

        assertTrue(repository.delete(c));
        assertTrue(repository.delete(b));

        long d = repository.create(msg("d"), T0).id();
        assertTrue(d > c, "id " + d + " must be greater than deleted id " + c);
    }

    @Test
    @DisplayName("Update keeps id and created_at and advances updated_at")
    public void testUpdatePreservesIdentity() {
        FeedbackRecord created = repository.create(msg("before"), T0);
        Instant later = T0.plusSeconds(30);

        FeedbackRecord updated = repository.update(created.id(), msg("after"), later).orElseThrow();

        assertEquals(created.id(), updated.id());
        assertEquals(created.createdAt(), updated.createdAt());
        assertEquals("after", updated.message());
        assertEquals(later, updated.updatedAt());
        assertEquals(updated, repository.findById(created.id()).orElseThrow());
    }

    @Test
    @DisplayName("Update advances updated_at even when the clock has not moved")
    public void testUpdateWithStalledClock() {
        FeedbackRecord created = repository.create(msg("one"), T0);

        FeedbackRecord first = repository.update(created.id(), msg("two"), T0).orElseThrow();
        FeedbackRecord second = repository.update(created.id(), msg("three"), T0.minusSeconds(60)).orElseThrow();

        assertTrue(first.updatedAt().isAfter(created.updatedAt()));
        assertTrue(second.updatedAt().isAfter(first.updatedAt()));
        assertFalse(second.updatedAt().isBefore(second.createdAt()));
    }

    @Test
    @DisplayName("Update of an absent id returns empty and writes nothing")
    public void testUpdateMissing() {
        assertTrue(repository.update(999, msg("x"), T0).isEmpty());
        assertEquals(0, repository.count());
    }

    @Test
    @DisplayName("Deleted record is gone for every operation")
    public void testDeleteFinality() {
        FeedbackRecord record = repository.create(msg("temp"), T0);

        assertTrue(repository.delete(record.id()));

        assertTrue(repository.findById(record.id()).isEmpty());
        assertTrue(repository.update(record.id(), msg("again"), T0).isEmpty());
        assertFalse(repository.delete(record.id()));
        assertTrue(repository.findAll().isEmpty());
    }

    @Test
    @DisplayName("List is ordered by id ascending")
    public void testListOrder() {
        List<Long> ids = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            ids.add(repository.create(msg("m" + i), T0.plusSeconds(5 - i)).id());
        }
        repository.update(ids.get(0), msg("touched"), T0.plusSeconds(100));

        List<Long> listed = repository.findAll().stream().map(FeedbackRecord::id).toList();
        assertEquals(ids, listed);
        assertEquals(5, repository.count());
    }

    @Test
    @DisplayName("Schema migration can run repeatedly without losing data")
    public void testMigrationIdempotent() {
        FeedbackRecord record = repository.create(msg("kept"), T0);

        new FeedbackSchemaMigration(dataSource).migrate();
        new FeedbackSchemaMigration(dataSource).migrate();

        assertEquals(Optional.of(record), repository.findById(record.id()));
    }

    @Test
    @DisplayName("Concurrent creates all succeed with distinct ids")
    public void testConcurrentCreates() throws Exception {
        int writers = 32;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<FeedbackRecord>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < writers; i++) {
                String text = "concurrent-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return repository.create(msg(text), Instant.now());
                }));
            }
            start.countDown();

            Set<Long> ids = new HashSet<>();
            for (Future<FeedbackRecord> f : futures) {
                ids.add(f.get(30, TimeUnit.SECONDS).id());
            }
            assertEquals(writers, ids.size());
            assertEquals(writers, repository.count());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Busy write path times out with StorageUnavailableException and writes nothing")
    public void testWriteLockTimeout() throws Exception {
        SqliteFeedbackRepository impatient =
            new SqliteFeedbackRepository(dataSource, Duration.ofMillis(100), Duration.ofSeconds(5));
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Thread holder = new Thread(() -> {
            impatient.writeLock().lock();
            try {
                held.countDown();
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                impatient.writeLock().unlock();
            }
        });
        holder.start();
        try {
            assertTrue(held.await(5, TimeUnit.SECONDS));

            StorageUnavailableException e = assertThrows(StorageUnavailableException.class,
                () -> impatient.create(msg("blocked"), T0));
            assertEquals("create", e.getOperation());
            assertEquals(0, impatient.count());
        } finally {
            release.countDown();
            holder.join(5000);
        }

        assertNotNull(impatient.create(msg("after release"), T0));
    }

    @Test
    @DisplayName("Closed store surfaces StorageUnavailableException")
    public void testClosedStore() {
        dataSource.close();

        assertThrows(StorageUnavailableException.class, () -> repository.findAll());
        assertThrows(StorageUnavailableException.class, () -> repository.count());
        assertThrows(StorageUnavailableException.class, () -> repository.create(msg("x"), T0));
    }

    @Test
    @DisplayName("nextUpdatedAt moves strictly forward")
    public void testNextUpdatedAt() {
        assertEquals(T0.plusSeconds(1), SqliteFeedbackRepository.nextUpdatedAt(T0, T0.plusSeconds(1)));
        assertEquals(T0.plus(1, ChronoUnit.MICROS), SqliteFeedbackRepository.nextUpdatedAt(T0, T0));
        assertEquals(T0.plus(1, ChronoUnit.MICROS), SqliteFeedbackRepository.nextUpdatedAt(T0, T0.minusSeconds(3)));
        assertEquals(T0.plus(1, ChronoUnit.MICROS), SqliteFeedbackRepository.nextUpdatedAt(T0, T0.plusNanos(500)));
    }
}
