package io.github.drompincen.javaclawsessions.persistence.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionLocksTest {

    @TempDir
    Path root;

    @Test
    void failedActionsOnUnknownSessionsLeaveNoLocksBehind() {
        SessionPathResolver resolver = new SessionPathResolver(root);
        SessionLocks locks = new SessionLocks();

        for (int i = 0; i < 1000; i++) {
            String id = "ghost-" + i;
            assertThatThrownBy(() -> locks.run(resolver.resolve(id), () -> {
                throw new SessionNotFoundException(id);
            })).isInstanceOf(SessionNotFoundException.class);
        }

        assertThat(locks.size()).isZero();
    }

    @Test
    void metadataUpdatesOnUnknownSessionsDoNotAccumulate() {
        SessionPathResolver resolver = new SessionPathResolver(root);
        SessionMetadataStore store = new SessionMetadataStore(new SessionJsonCodec(), "/w");

        for (int i = 0; i < 1000; i++) {
            SessionLocation ghost = resolver.resolve("ghost-" + i);
            assertThatThrownBy(() -> store.update(ghost, m -> m.withDescription("x")))
                    .isInstanceOf(SessionNotFoundException.class);
        }

        assertThat(store.lockCount()).isZero();
    }

    @Test
    void sameSessionIsMutuallyExclusiveAndReleasedAfterwards() throws Exception {
        SessionLocation location = new SessionPathResolver(root).resolve("shared");
        SessionLocks locks = new SessionLocks();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 50; i++) {
                        locks.run(location, () -> {
                            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                            inside.decrementAndGet();
                        });
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(locks.size()).isZero();
    }

    @Test
    void distinctSessionsDoNotBlockEachOther() throws Exception {
        SessionPathResolver resolver = new SessionPathResolver(root);
        SessionLocks locks = new SessionLocks();
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> holder = executor.submit(() -> locks.run(resolver.resolve("a"), () -> {
                held.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            assertThat(held.await(10, TimeUnit.SECONDS)).isTrue();

            String result = locks.call(resolver.resolve("b"), () -> "done");

            assertThat(result).isEqualTo("done");
            assertThat(locks.size()).isEqualTo(1);
            release.countDown();
            holder.get(10, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
        assertThat(locks.size()).isZero();
    }
}
