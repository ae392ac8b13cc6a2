package com.mockinterview.platform.service;

import com.mockinterview.platform.exception.InterviewPlatformException;
import com.mockinterview.platform.model.MediaKind;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-session critical sections. Each (session, scope) pair gets its own lock so that
 * a whiteboard save never waits on a chat message append.
 * <p>
 * A lock entry lives only while some thread holds or waits for it. Sessions that are
 * being ended carry an input fence that conversation and media writers check under
 * their lock.
 */
@Component
public class SessionLockRegistry {

    public static final String CONVERSATION = "conversation";
    public static final String TOKENS = "tokens";
    public static final String LIFECYCLE = "lifecycle";
    public static final String MODES = "modes";
    public static final String MEDIA = "media:";

    private final Map<String, LockEntry> locks = new ConcurrentHashMap<>();
    private final Set<String> fenced = ConcurrentHashMap.newKeySet();

    public <T> T withLock(String sessionId, String scope, Supplier<T> action) {
        String key = sessionId + ":" + scope;
        LockEntry entry = locks.compute(key, (k, existing) -> {
            LockEntry current = existing == null ? new LockEntry() : existing;
            current.users++;
            return current;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(key, (k, current) -> --current.users == 0 ? null : current);
        }
    }

    /**
     * Stops conversation and media input for a session. Returns once every writer that
     * entered its critical section before the fence has left it.
     */
    public void fenceInput(String sessionId) {
        fenced.add(sessionId);
        withLock(sessionId, CONVERSATION, () -> null);
        for (MediaKind kind : MediaKind.values()) {
            withLock(sessionId, MEDIA + kind.value(), () -> null);
        }
    }

    public void liftFence(String sessionId) {
        fenced.remove(sessionId);
    }

    /** Called by writers while holding their conversation or media lock. */
    public void requireInputOpen(String sessionId) {
        if (fenced.contains(sessionId)) {
            throw InterviewPlatformException.configuration("session lifecycle",
                    "Session " + sessionId + " is ending, new input is not accepted");
        }
    }

    int size() {
        return locks.size();
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
