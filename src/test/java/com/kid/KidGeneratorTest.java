package com.kid;

import com.kid.util.StubClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

class KidGeneratorTest {

    @Test
    @DisplayName("Should pack tick and random bytes big-endian")
    void shouldPackTickAndRandom() {
        StubClock clock = StubClock.at(1741456227758L, 152L << 8);
        KidGenerator generator = new KidGenerator(new TickGenerator(clock), new Random(12345L));
        int expectedRandom = new Random(12345L).nextInt() & 0xFFFF;

        Kid kid = generator.next();

        assertEquals(1741456227758L, kid.timestamp());
        assertEquals(152, kid.sequence());
        assertEquals(expectedRandom, kid.random());
        assertTrue(kid.toString().startsWith("06bqer9xnr09"), kid.toString());
    }

    @Test
    @DisplayName("Same seed and clock should produce the same kids")
    void shouldBeDeterministicWithSameSeed() {
        KidGenerator a = new KidGenerator(new TickGenerator(StubClock.at(1_000L, 0L)), new Random(7L));
        KidGenerator b = new KidGenerator(new TickGenerator(StubClock.at(1_000L, 0L)), new Random(7L));

        for (int i = 0; i < 10; i++) {
            assertEquals(a.next(), b.next());
        }
    }

    @Test
    @DisplayName("Should generate non-nil unique kids")
    void shouldGenerateNonNilUniqueKids() {
        KidGenerator generator = new KidGenerator();
        Set<Kid> kids = new HashSet<>();
        for (int i = 0; i < 10_000; i++) {
            Kid kid = generator.next();
            assertFalse(kid.isNil());
            assertTrue(kids.add(kid), "Kid should be unique: " + kid);
        }
    }

    @Test
    @DisplayName("Generated timestamps should track the wall clock")
    void generatedTimestampsShouldTrackWallClock() {
        KidGenerator generator = new KidGenerator();
        long before = System.currentTimeMillis();
        Kid kid = generator.next();
        long after = System.currentTimeMillis();

        assertTrue(kid.timestamp() >= before, "Timestamp should not be before the call");
        assertTrue(kid.timestamp() <= after + 1, "Timestamp should be close to the call");
    }

    @Test
    @Timeout(60)
    @DisplayName("A million sequential kids should strictly increase")
    void millionSequentialKidsShouldIncrease() {
        KidGenerator generator = new KidGenerator();
        Kid previous = generator.next();
        for (int i = 1; i < 1_000_000; i++) {
            Kid kid = generator.next();
            assertTrue(kid.timestamp() >= previous.timestamp(), "Timestamp went backwards");
            if (kid.timestamp() == previous.timestamp()) {
                assertTrue(kid.sequence() > previous.sequence(), "Sequence should increase within a millisecond");
            }
            assertEquals(1, kid.compareTo(previous));
            previous = kid;
        }
    }

    @Test
    @Timeout(60)
    @DisplayName("Concurrent threads should get unique and increasing kids")
    void concurrentThreadsShouldGetUniqueIncreasingKids() throws InterruptedException {
        int threads = 8;
        int perThread = 20_000;
        KidGenerator generator = new KidGenerator();
        Set<Long> seen = ConcurrentHashMap.newKeySet();
        List<String> failures = new ArrayList<>();
        CountDownLatch start = new CountDownLatch(1);

        List<Thread> workers = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            Thread worker = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                Kid previous = null;
                for (int i = 0; i < perThread; i++) {
                    Kid kid = generator.next();
                    if (previous != null && kid.compareTo(previous) <= 0) {
                        synchronized (failures) {
                            failures.add("Kid did not increase: " + previous + " -> " + kid);
                        }
                    }
                    seen.add(kid.timestamp() << 16 | kid.sequence());
                    previous = kid;
                }
            });
            workers.add(worker);
            worker.start();
        }
        start.countDown();
        for (Thread worker : workers) {
            worker.join();
        }

        assertTrue(failures.isEmpty(), String.join("\n", failures));
        assertEquals(threads * perThread, seen.size(), "Timestamp and sequence should be unique across threads");
    }
}
