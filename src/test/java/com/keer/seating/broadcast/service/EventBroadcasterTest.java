package com.keer.seating.broadcast.service;

import com.keer.seating.broadcast.model.Delta;
import com.keer.seating.broadcast.model.DeltaType;
import com.keer.seating.broadcast.model.StreamMessage;
import com.keer.seating.common.exception.ConflictException;
import com.keer.seating.common.exception.NotFoundException;
import com.keer.seating.config.SeatingProperties;
import com.keer.seating.seating.dto.SeatingSnapshot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.stream.LongStream;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class EventBroadcasterTest {

    private static final long EVENT_ID = 7L;
    private static final int LOG_CAPACITY = 5;
    private static final int QUEUE_CAPACITY = 4;

    private SeatingProperties properties;
    private EventBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        properties = new SeatingProperties();
        properties.getBroadcast().setLogCapacity(LOG_CAPACITY);
        properties.getBroadcast().setSubscriberQueueCapacity(QUEUE_CAPACITY);
        broadcaster = new EventBroadcaster(Runnable::run, properties);
    }

    private static Delta delta(long sequence) {
        return new Delta(EVENT_ID, sequence, DeltaType.CHECKED_IN, Instant.EPOCH, null, null, null);
    }

    private static List<Delta> deltas(long from, long to) {
        return LongStream.rangeClosed(from, to).mapToObj(EventBroadcasterTest::delta).toList();
    }

    private static Supplier<SeatingSnapshot> snapshotAt(long sequence, AtomicInteger loads) {
        return () -> {
            loads.incrementAndGet();
            return new SeatingSnapshot(EVENT_ID, "Ana & Ben", sequence, List.of(), List.of());
        };
    }

    @Nested
    class Bootstrap {

        @Test
        void shouldStartWithSnapshotWhenNoCheckpointGiven() {
            broadcaster.publish(EVENT_ID, deltas(1, 3));
            RecordingSink sink = new RecordingSink();
            AtomicInteger loads = new AtomicInteger();

            broadcaster.subscribe(EVENT_ID, null, sink, snapshotAt(3, loads));
            broadcaster.publish(EVENT_ID, deltas(4, 4));

            assertEquals(1, loads.get());
            assertEquals(StreamMessage.Type.SNAPSHOT, sink.messages().get(0).type());
            assertEquals(List.of(3L, 4L), sink.sequences());
        }

        @Test
        void shouldReplayDeltasNewerThanAnOlderSnapshot() {
            broadcaster.publish(EVENT_ID, deltas(1, 8));
            RecordingSink sink = new RecordingSink();

            broadcaster.subscribe(EVENT_ID, null, sink, snapshotAt(5, new AtomicInteger()));

            assertEquals(List.of(5L, 6L, 7L, 8L), sink.sequences());
        }

        @Test
        void shouldSkipDeltasAlreadyContainedInSnapshot() {
            // committed up to 4 but only 1..2 published so far
            broadcaster.publish(EVENT_ID, deltas(1, 2));
            RecordingSink sink = new RecordingSink();

            broadcaster.subscribe(EVENT_ID, null, sink, snapshotAt(4, new AtomicInteger()));
            broadcaster.publish(EVENT_ID, deltas(3, 5));

            assertEquals(List.of(4L, 5L), sink.sequences());
        }

        @Test
        void shouldGiveUpAfterThreeSnapshotsOlderThanTheLog() {
            broadcaster.publish(EVENT_ID, deltas(1, 8));
            RecordingSink sink = new RecordingSink();
            AtomicInteger loads = new AtomicInteger();

            assertThrows(ConflictException.class,
                    () -> broadcaster.subscribe(EVENT_ID, null, sink, snapshotAt(1, loads)));

            assertEquals(3, loads.get());
            assertTrue(sink.messages().isEmpty());
            assertEquals(0, broadcaster.subscriberCount(EVENT_ID));
        }
    }

    @Nested
    class CatchUp {

        @Test
        void shouldReplayExactlyTheMissedDeltas() {
            broadcaster.publish(EVENT_ID, deltas(1, 5));
            RecordingSink sink = new RecordingSink();
            AtomicInteger loads = new AtomicInteger();

            broadcaster.subscribe(EVENT_ID, 2L, sink, snapshotAt(5, loads));
            broadcaster.publish(EVENT_ID, deltas(6, 6));

            assertEquals(0, loads.get(), "catch-up must not load a snapshot");
            assertEquals(List.of(3L, 4L, 5L, 6L), sink.sequences());
            assertTrue(sink.messages().stream().allMatch(m -> m.type() == StreamMessage.Type.DELTA));
        }

        @Test
        void shouldAttachWithoutReplayWhenCheckpointIsHead() {
            broadcaster.publish(EVENT_ID, deltas(1, 3));
            RecordingSink sink = new RecordingSink();

            broadcaster.subscribe(EVENT_ID, 3L, sink, snapshotAt(3, new AtomicInteger()));
            broadcaster.publish(EVENT_ID, deltas(4, 5));

            assertEquals(List.of(4L, 5L), sink.sequences());
        }

        @Test
        void shouldFallBackToSnapshotWhenCheckpointLeftTheLog() {
            broadcaster.publish(EVENT_ID, deltas(1, 8));
            RecordingSink sink = new RecordingSink();
            AtomicInteger loads = new AtomicInteger();

            broadcaster.subscribe(EVENT_ID, 2L, sink, snapshotAt(8, loads));

            assertEquals(1, loads.get());
            assertEquals(StreamMessage.Type.SNAPSHOT, sink.messages().get(0).type());
            assertEquals(List.of(8L), sink.sequences());
        }

        @Test
        void shouldFallBackToSnapshotWhenMissedDeltasExceedTheQueue() {
            properties.getBroadcast().setLogCapacity(10);
            List<Runnable> pending = new ArrayList<>();
            broadcaster = new EventBroadcaster(pending::add, properties);
            broadcaster.publish(EVENT_ID, deltas(1, 10));
            AtomicInteger loads = new AtomicInteger();

            // the log still covers sequence 3 but eight deltas do not fit a queue of four
            for (int reconnect = 0; reconnect < 3; reconnect++) {
                RecordingSink sink = new RecordingSink();
                Subscription subscription = broadcaster.subscribe(EVENT_ID, 2L, sink, snapshotAt(10, loads));
                runAll(pending);

                assertFalse(sink.isClosed());
                assertEquals(StreamMessage.Type.SNAPSHOT, sink.messages().get(0).type());
                assertEquals(List.of(10L), sink.sequences());
                subscription.cancel();
            }
            assertEquals(3, loads.get());

            RecordingSink live = new RecordingSink();
            broadcaster.subscribe(EVENT_ID, 7L, live, snapshotAt(10, loads));
            broadcaster.publish(EVENT_ID, deltas(11, 11));
            runAll(pending);

            assertEquals(3, loads.get(), "a gap smaller than the queue is replayed from the log");
            assertEquals(List.of(8L, 9L, 10L, 11L), live.sequences());
            assertFalse(live.isClosed());
        }

        private void runAll(List<Runnable> pending) {
            while (!pending.isEmpty()) {
                pending.remove(0).run();
            }
        }

        @Test
        void shouldFallBackToSnapshotWhenCheckpointIsUnknown() {
            broadcaster.publish(EVENT_ID, deltas(1, 3));
            RecordingSink sink = new RecordingSink();

            broadcaster.subscribe(EVENT_ID, 42L, sink, snapshotAt(3, new AtomicInteger()));

            assertEquals(StreamMessage.Type.SNAPSHOT, sink.messages().get(0).type());
        }

        @Test
        void shouldIgnoreDeltasPublishedTwice() {
            RecordingSink sink = new RecordingSink();
            broadcaster.subscribe(EVENT_ID, null, sink, snapshotAt(0, new AtomicInteger()));

            broadcaster.publish(EVENT_ID, deltas(1, 3));
            broadcaster.publish(EVENT_ID, deltas(3, 4));

            assertEquals(List.of(0L, 1L, 2L, 3L, 4L), sink.sequences());
        }

        @Test
        void shouldDisconnectSubscribersOnSequenceGap() {
            RecordingSink sink = new RecordingSink();
            broadcaster.subscribe(EVENT_ID, null, sink, snapshotAt(0, new AtomicInteger()));
            broadcaster.publish(EVENT_ID, deltas(1, 2));

            broadcaster.publish(EVENT_ID, deltas(5, 5));

            assertTrue(sink.isClosed());
            assertEquals(List.of(0L, 1L, 2L), sink.sequences());
            assertEquals(5L, broadcaster.headSequence(EVENT_ID));
        }
    }

    @Nested
    class Disconnects {

        private ExecutorService executor;

        @AfterEach
        void tearDown() {
            if (executor != null) {
                executor.shutdownNow();
            }
        }

        @Test
        void shouldDisconnectOnlyTheSubscriberWhoseTransportFailed() {
            RecordingSink broken = new RecordingSink();
            RecordingSink healthy = new RecordingSink();
            broadcaster.subscribe(EVENT_ID, null, healthy, snapshotAt(0, new AtomicInteger()));
            broadcaster.subscribe(EVENT_ID, null, broken, snapshotAt(0, new AtomicInteger()));
            broken.failSends();

            broadcaster.publish(EVENT_ID, deltas(1, 3));

            assertTrue(broken.isClosed());
            assertFalse(healthy.isClosed());
            assertEquals(List.of(0L, 1L, 2L, 3L), healthy.sequences());
            assertEquals(1, broadcaster.subscriberCount(EVENT_ID));
        }

        @Test
        void shouldDisconnectOverflowingSubscriberWhileOthersKeepReceiving() {
            executor = Executors.newFixedThreadPool(4);
            broadcaster = new EventBroadcaster(executor, properties);
            CountDownLatch release = new CountDownLatch(1);

            RecordingSink slow = new RecordingSink();
            slow.blockUntil(release);
            RecordingSink fast = new RecordingSink();
            broadcaster.subscribe(EVENT_ID, null, slow, snapshotAt(0, new AtomicInteger()));
            broadcaster.subscribe(EVENT_ID, null, fast, snapshotAt(0, new AtomicInteger()));

            for (long sequence = 1; sequence <= 10; sequence++) {
                broadcaster.publish(EVENT_ID, List.of(delta(sequence)));
                long published = sequence;
                // keep the fast subscriber's queue short
                await().atMost(Duration.ofSeconds(5))
                        .until(() -> fast.sequences().contains(published));
            }

            await().atMost(Duration.ofSeconds(5)).until(slow::isClosed);
            release.countDown();

            assertEquals(LongStream.rangeClosed(0, 10).boxed().toList(), fast.sequences());
            assertFalse(fast.isClosed());
            assertEquals(1, broadcaster.subscriberCount(EVENT_ID));
        }

        @Test
        void shouldCloseEverySubscriberWhenEventIsTornDown() {
            RecordingSink first = new RecordingSink();
            RecordingSink second = new RecordingSink();
            broadcaster.subscribe(EVENT_ID, null, first, snapshotAt(0, new AtomicInteger()));
            broadcaster.subscribe(EVENT_ID, null, second, snapshotAt(0, new AtomicInteger()));

            broadcaster.closeEvent(EVENT_ID);

            assertTrue(first.isClosed());
            assertTrue(second.isClosed());
            assertEquals(0, broadcaster.subscriberCount(EVENT_ID));
        }

        @Test
        void shouldRefuseSubscribersOfATornDownEvent() {
            broadcaster.publish(EVENT_ID, deltas(1, 2));
            broadcaster.closeEvent(EVENT_ID);
            AtomicInteger loads = new AtomicInteger();

            assertThrows(NotFoundException.class,
                    () -> broadcaster.subscribe(EVENT_ID, 2L, new RecordingSink(), snapshotAt(2, loads)));
            broadcaster.publish(EVENT_ID, deltas(3, 3));

            assertEquals(0, loads.get());
            assertEquals(-1L, broadcaster.headSequence(EVENT_ID), "no channel may be recreated");
        }

        @Test
        void shouldCloseSubscriberAttachingWhileEventIsTornDown() {
            broadcaster.publish(EVENT_ID, deltas(1, 2));
            RecordingSink sink = new RecordingSink();
            Supplier<SeatingSnapshot> loaderRacingTeardown = () -> {
                broadcaster.closeEvent(EVENT_ID);
                return new SeatingSnapshot(EVENT_ID, "Ana & Ben", 2, List.of(), List.of());
            };

            Subscription subscription = broadcaster.subscribe(EVENT_ID, null, sink, loaderRacingTeardown);

            assertTrue(subscription.isClosed());
            assertTrue(sink.isClosed());
            assertTrue(sink.messages().isEmpty());
            assertEquals(0, broadcaster.subscriberCount(EVENT_ID));
            assertEquals(-1L, broadcaster.headSequence(EVENT_ID));
        }

        @Test
        void shouldStopDeliveringAfterClientCancels() {
            RecordingSink sink = new RecordingSink();
            Subscription subscription = broadcaster.subscribe(EVENT_ID, null, sink, snapshotAt(0, new AtomicInteger()));

            subscription.cancel();
            broadcaster.publish(EVENT_ID, deltas(1, 2));

            assertEquals(List.of(0L), sink.sequences());
            assertFalse(sink.isClosed(), "cancel must not touch the sink again");
            assertEquals(0, broadcaster.subscriberCount(EVENT_ID));
        }
    }
}
