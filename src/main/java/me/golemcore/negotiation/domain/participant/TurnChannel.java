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
package me.golemcore.negotiation.domain.participant;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.negotiation.domain.exception.InputQueueFullException;
import me.golemcore.negotiation.domain.exception.SessionCancelledException;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Hand-off of a manual participant's text from an external operator to the
 * session task.
 *
 * <p>
 * Input fed before the participant's turn is buffered in FIFO order, up to
 * {@code depth} entries. {@link #release()} wakes a waiting reader with a
 * cancellation and rejects later feeds.
 */
@Slf4j
public class TurnChannel {

    private final String participantId;
    private final int depth;
    private final Object lock = new Object();
    private final Deque<String> pending = new ArrayDeque<>();

    private boolean released = false;
    private boolean awaiting = false;

    public TurnChannel(String participantId, int depth) {
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be positive");
        }
        this.participantId = participantId;
        this.depth = depth;
    }

    public String getParticipantId() {
        return participantId;
    }

    public int getDepth() {
        return depth;
    }

    public void feed(String text) {
        synchronized (lock) {
            if (released) {
                throw new SessionCancelledException("Session stopped, input for " + participantId + " rejected");
            }
            if (pending.size() >= depth) {
                log.warn("[TurnChannel] input rejected, queue full: participant={}, depth={}", participantId, depth);
                throw new InputQueueFullException(participantId, depth);
            }
            pending.addLast(text != null ? text : "");
            if (!awaiting) {
                log.debug("[TurnChannel] buffered out-of-turn input: participant={}, pending={}",
                        participantId, pending.size());
            }
            lock.notifyAll();
        }
    }

    public String await() throws InterruptedException {
        synchronized (lock) {
            awaiting = true;
            try {
                while (pending.isEmpty() && !released) {
                    lock.wait();
                }
                if (released) {
                    throw new SessionCancelledException("Session stopped while waiting for " + participantId);
                }
                return pending.removeFirst();
            } finally {
                awaiting = false;
            }
        }
    }

    public void release() {
        synchronized (lock) {
            if (released) {
                return;
            }
            released = true;
            if (!pending.isEmpty()) {
                log.debug("[TurnChannel] discarding {} pending inputs: participant={}", pending.size(),
                        participantId);
            }
            pending.clear();
            lock.notifyAll();
        }
    }

    public boolean isAwaiting() {
        synchronized (lock) {
            return awaiting;
        }
    }

    public int getPendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    public boolean isReleased() {
        synchronized (lock) {
            return released;
        }
    }
}
