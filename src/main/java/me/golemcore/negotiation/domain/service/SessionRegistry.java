package me.golemcore.negotiation.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.negotiation.domain.exception.NoSuchSessionException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Process-wide table of live negotiation sessions keyed by session id.
 *
 * <p>
 * The map is the only state shared between sessions and is guarded by a single
 * lock. Sessions stay registered after they finish, so their history remains
 * readable, until {@link #stop(String)} or shutdown evicts them.
 */
@Component
@Slf4j
public class SessionRegistry {

    private final Object lock = new Object();
    private final Map<String, NegotiationSession> sessions = new LinkedHashMap<>();

    /**
     * Registers the session built by {@code factory} unless one with the same
     * id already exists.
     *
     * @return the registered session and whether it was created by this call
     */
    public Registration register(String sessionId, Supplier<NegotiationSession> factory) {
        synchronized (lock) {
            NegotiationSession existing = sessions.get(sessionId);
            if (existing != null) {
                return new Registration(existing, false);
            }
            NegotiationSession session = factory.get();
            sessions.put(sessionId, session);
            log.info("[Registry] registered: sessionId={}, active={}", sessionId, sessions.size());
            return new Registration(session, true);
        }
    }

    public Optional<NegotiationSession> find(String sessionId) {
        synchronized (lock) {
            return Optional.ofNullable(sessions.get(sessionId));
        }
    }

    public NegotiationSession require(String sessionId) {
        return find(sessionId).orElseThrow(() -> new NoSuchSessionException(sessionId));
    }

    public List<NegotiationSession> list() {
        synchronized (lock) {
            return new ArrayList<>(sessions.values());
        }
    }

    /**
     * Evicts and stops the session. Absent sessions are a no-op.
     *
     * @return {@code true} if a session was evicted by this call
     */
    public boolean stop(String sessionId) {
        NegotiationSession session;
        synchronized (lock) {
            session = sessions.remove(sessionId);
        }
        if (session == null) {
            log.debug("[Registry] stop ignored, no session: sessionId={}", sessionId);
            return false;
        }
        session.stop();
        log.info("[Registry] stopped: sessionId={}, state={}", sessionId, session.getState());
        return true;
    }

    @PreDestroy
    public void stopAll() {
        List<NegotiationSession> toStop;
        synchronized (lock) {
            toStop = new ArrayList<>(sessions.values());
            sessions.clear();
        }
        for (NegotiationSession session : toStop) {
            session.stop();
        }
        if (!toStop.isEmpty()) {
            log.info("[Registry] stopped {} sessions on shutdown", toStop.size());
        }
    }

    public record Registration(NegotiationSession session, boolean created) {
    }
}
