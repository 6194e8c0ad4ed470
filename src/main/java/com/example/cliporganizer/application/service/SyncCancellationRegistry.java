package com.example.cliporganizer.application.service;

import com.example.cliporganizer.common.exception.BusinessException;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Cancellation flags of running sync sessions, keyed by a caller-chosen session id.
 */
@Component
public class SyncCancellationRegistry {

    private final ConcurrentMap<String, AtomicBoolean> flags = new ConcurrentHashMap<>();

    /**
     * Registers a running session. A blank id is replaced by a generated one.
     *
     * @return the id under which the session is registered
     */
    public String register(String sessionId) {
        String id = StringUtils.hasText(sessionId) ? sessionId.trim() : UUID.randomUUID().toString().replace("-", "");
        if (flags.putIfAbsent(id, new AtomicBoolean(false)) != null) {
            throw new BusinessException("SYNC_SESSION_ACTIVE", "A sync session with this id is already running");
        }
        return id;
    }

    public boolean isCancelRequested(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            return false;
        }
        AtomicBoolean flag = flags.get(sessionId);
        return flag != null && flag.get();
    }

    /**
     * @return false when no running session has this id
     */
    public boolean cancel(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            return false;
        }
        AtomicBoolean flag = flags.get(sessionId.trim());
        if (flag == null) {
            return false;
        }
        flag.set(true);
        return true;
    }

    public void unregister(String sessionId) {
        if (sessionId != null) {
            flags.remove(sessionId);
        }
    }
}
