package com.github.tubetune.service.session;

import com.github.tubetune.MutableClock;
import com.github.tubetune.exception.InvalidSelectionException;
import com.github.tubetune.exception.SessionExpiredException;
import com.github.tubetune.model.CandidateItem;
import com.github.tubetune.model.SearchPage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SearchSessionStore")
class SearchSessionStoreTest {

    private static final String OWNER = "1001";

    private MutableClock clock;
    private SearchSessionStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        store = new SearchSessionStore(clock, Duration.ofMinutes(30), 8, 3);
    }

    private static List<CandidateItem> items(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> CandidateItem.builder()
                        .id(String.format("vid%08d", i))
                        .title("Song " + i)
                        .uploader("Artist")
                        .build())
                .collect(Collectors.toList());
    }

    @Nested
    @DisplayName("put")
    class PutTests {

        @Test
        @DisplayName("should return increasing generations")
        void shouldReturnIncreasingGenerations() {
            long first = store.put(OWNER, "a", items(3));
            long second = store.put(OWNER, "b", items(3));

            assertTrue(second > first);
            assertEquals(1, store.size());
        }

        @Test
        @DisplayName("should cap items at page size times max pages")
        void shouldCapItems() {
            long generation = store.put(OWNER, "many", items(40));

            SearchPage last = store.getPage(OWNER, generation, 2);
            assertEquals(3, last.getTotalPages());
            assertEquals(8, last.getItems().size());
            assertEquals("Song 23", last.getItems().get(7).getTitle());
            assertThrows(InvalidSelectionException.class, () -> store.select(OWNER, generation, 24));
        }

        @Test
        @DisplayName("should keep owners independent")
        void shouldKeepOwnersIndependent() {
            long mine = store.put(OWNER, "a", items(3));
            store.put("other", "b", items(3));

            assertEquals("Song 1", store.select(OWNER, mine, 1).getTitle());
            assertEquals(2, store.size());
        }
    }

    @Nested
    @DisplayName("getPage")
    class GetPageTests {

        @Test
        @DisplayName("should slice pages with absolute first index")
        void shouldSlicePages() {
            long generation = store.put(OWNER, "q", items(20));

            SearchPage first = store.getPage(OWNER, generation, 0);
            SearchPage third = store.getPage(OWNER, generation, 2);

            assertEquals(0, first.getFirstIndex());
            assertFalse(first.hasPrevious());
            assertTrue(first.hasNext());
            assertEquals(16, third.getFirstIndex());
            assertEquals(4, third.getItems().size());
            assertTrue(third.hasPrevious());
            assertFalse(third.hasNext());
            assertEquals("q", third.getQuery());
        }

        @Test
        @DisplayName("should report a single page for short result lists")
        void shouldReportSinglePage() {
            long generation = store.put(OWNER, "q", items(5));

            SearchPage page = store.getPage(OWNER, generation, 0);

            assertEquals(1, page.getTotalPages());
            assertFalse(page.hasNext());
        }

        @Test
        @DisplayName("should reject pages out of range")
        void shouldRejectOutOfRange() {
            long generation = store.put(OWNER, "q", items(10));

            assertThrows(InvalidSelectionException.class, () -> store.getPage(OWNER, generation, 2));
            assertThrows(InvalidSelectionException.class, () -> store.getPage(OWNER, generation, -1));
        }
    }

    @Nested
    @DisplayName("select")
    class SelectTests {

        @Test
        @DisplayName("should return the item at an absolute index")
        void shouldSelectByAbsoluteIndex() {
            long generation = store.put(OWNER, "q", items(20));

            assertEquals("Song 17", store.select(OWNER, generation, 17).getTitle());
        }

        @Test
        @DisplayName("should keep the session live after selection")
        void shouldKeepSessionLive() {
            long generation = store.put(OWNER, "q", items(5));

            store.select(OWNER, generation, 0);

            assertEquals("Song 4", store.select(OWNER, generation, 4).getTitle());
        }
    }

    @Nested
    @DisplayName("expiry")
    class ExpiryTests {

        @Test
        @DisplayName("a superseded generation should be expired")
        void supersededGenerationShouldExpire() {
            long old = store.put(OWNER, "first", items(5));
            long current = store.put(OWNER, "second", items(5));

            SessionExpiredException ex = assertThrows(SessionExpiredException.class,
                    () -> store.select(OWNER, old, 0));
            assertEquals(old, ex.getGeneration());
            assertThrows(SessionExpiredException.class, () -> store.getPage(OWNER, old, 0));
            assertEquals("Song 0", store.select(OWNER, current, 0).getTitle());
        }

        @Test
        @DisplayName("a session past its TTL should be expired")
        void sessionPastTtlShouldExpire() {
            long generation = store.put(OWNER, "q", items(5));

            clock.advance(Duration.ofMinutes(29));
            assertNotNull(store.select(OWNER, generation, 0));

            clock.advance(Duration.ofMinutes(1));
            assertThrows(SessionExpiredException.class, () -> store.select(OWNER, generation, 0));
        }

        @Test
        @DisplayName("an unknown owner should be expired")
        void unknownOwnerShouldExpire() {
            assertThrows(SessionExpiredException.class, () -> store.select("nobody", 1, 0));
            assertEquals(0, store.size());
        }

        @Test
        @DisplayName("evictExpired should drop only sessions past their TTL")
        void evictExpiredShouldDropExpired() {
            store.put("a", "q", items(2));
            clock.advance(Duration.ofMinutes(20));
            long fresh = store.put("b", "q", items(2));
            clock.advance(Duration.ofMinutes(15));

            assertEquals(1, store.evictExpired());
            assertEquals(1, store.size());
            assertNotNull(store.select("b", fresh, 0));
        }
    }

    @Nested
    @DisplayName("concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("concurrent searches by one owner should leave exactly the last generation live")
        void concurrentSearchesShouldLeaveOneLive() throws InterruptedException {
            int threads = 16;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Long> generations = Collections.synchronizedList(new ArrayList<>());

            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    start.await();
                    generations.add(store.put(OWNER, "q", items(3)));
                    return null;
                });
            }
            start.countDown();
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

            int live = 0;
            for (long generation : generations) {
                try {
                    store.select(OWNER, generation, 0);
                    live++;
                } catch (SessionExpiredException e) {
                    // superseded
                }
            }
            assertEquals(threads, generations.size());
            assertEquals(1, live);
        }
    }
}
