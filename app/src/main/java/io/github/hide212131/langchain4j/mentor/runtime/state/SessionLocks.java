package io.github.hide212131.langchain4j.mentor.runtime.state;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One fair lock per session so that work on a session is serialized while different sessions
 * proceed in parallel. A lock is dropped once its last holder or waiter leaves.
 */
public final class SessionLocks {

    private final ConcurrentHashMap<String, Holder> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String sessionId, Supplier<T> action) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(action, "action");
        Holder holder = locks.compute(sessionId, (id, current) -> {
            Holder next = current != null ? current : new Holder();
            next.users++;
            return next;
        });
        holder.lock.lock();
        try {
            return action.get();
        } finally {
            holder.lock.unlock();
            locks.computeIfPresent(sessionId, (id, current) -> --current.users == 0 ? null : current);
        }
    }

    int size() {
        return locks.size();
    }

    private static final class Holder {
        private final ReentrantLock lock = new ReentrantLock(true);
        // only changed inside compute for this session's key
        private int users;
    }
}
