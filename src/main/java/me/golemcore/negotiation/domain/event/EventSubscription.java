package me.golemcore.negotiation.domain.event;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.negotiation.domain.model.SessionEvent;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-listener stream of session events. Owned by the caller that subscribed;
 * the bus only emits into it.
 *
 * <p>
 * Emission never blocks and holds no reader thread. Events are buffered in a
 * unicast sink until the single reader of {@link #toFlux()} requests them.
 * With a positive limit a reader that falls behind loses its oldest pending
 * events. The end marker is always the last element and is never dropped.
 */
@Slf4j
public class EventSubscription {

    private final String id = UUID.randomUUID().toString();
    private final String sessionId;
    private final int limit;
    private final Sinks.Many<SessionEvent> sink = Sinks.many().unicast().onBackpressureBuffer();
    private final AtomicLong dropped = new AtomicLong();

    private boolean ended = false;

    EventSubscription(String sessionId, List<SessionEvent> replay, int limit) {
        this.sessionId = sessionId;
        this.limit = limit;
        for (SessionEvent event : replay) {
            sink.tryEmitNext(event);
        }
    }

    public String getId() {
        return id;
    }

    public String getSessionId() {
        return sessionId;
    }

    synchronized void offer(SessionEvent event) {
        if (ended) {
            return;
        }
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_CANCELLED) {
            log.warn("[EventBus] event not delivered: sessionId={}, subscription={}, result={}",
                    sessionId, id, result);
        }
    }

    synchronized void end(SessionEvent endEvent) {
        if (ended) {
            return;
        }
        ended = true;
        sink.tryEmitNext(endEvent);
        sink.tryEmitComplete();
    }

    public synchronized boolean isEnded() {
        return ended;
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    /**
     * Streams the replay followed by live events, completing after the end
     * marker. May be subscribed to once.
     */
    public Flux<SessionEvent> toFlux() {
        Flux<SessionEvent> events = sink.asFlux();
        if (limit <= 0) {
            return events;
        }
        return events.onBackpressureBuffer(limit, this::onDropped, BufferOverflowStrategy.DROP_OLDEST);
    }

    private void onDropped(SessionEvent event) {
        dropped.incrementAndGet();
        log.warn("[EventBus] subscriber queue limit reached ({}), dropped oldest event: sessionId={}, "
                + "subscription={}, type={}", limit, sessionId, id, event.type());
    }
}
