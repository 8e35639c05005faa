package io.github.drompincen.javaclawsessions.persistence.store;

import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per session directory; sessions never share a lock. An entry lives only while some
 * thread holds or waits on it.
 */
class SessionLocks {

    private final ConcurrentHashMap<Path, Holder> locks = new ConcurrentHashMap<>();

    <T> T call(SessionLocation location, Supplier<T> action) {
        Path key = location.directory();
        Holder holder = locks.compute(key, (k, existing) -> {
            Holder h = existing == null ? new Holder() : existing;
            h.users++;
            return h;
        });
        holder.lock.lock();
        try {
            return action.get();
        } finally {
            holder.lock.unlock();
            locks.compute(key, (k, h) -> --h.users == 0 ? null : h);
        }
    }

    void run(SessionLocation location, Runnable action) {
        call(location, () -> {
            action.run();
            return null;
        });
    }

    int size() {
        return locks.size();
    }

    // users is only touched inside compute, which serialises per key
    private static final class Holder {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
