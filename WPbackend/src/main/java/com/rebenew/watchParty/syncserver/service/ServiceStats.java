package com.rebenew.watchParty.syncserver.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Contadores de vida del proceso alimentados por los {@link RoomHealthSystem.Event}.
 */
@Component
public class ServiceStats {
    private static final Logger logger = LoggerFactory.getLogger(ServiceStats.class);

    private final Clock clock;
    private final Instant startedAt;
    private final Map<RoomHealthSystem.Action, AtomicLong> counters = new EnumMap<>(RoomHealthSystem.Action.class);

    public ServiceStats(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
        for (RoomHealthSystem.Action action : RoomHealthSystem.Action.values()) {
            counters.put(action, new AtomicLong());
        }
    }

    @EventListener
    public void onHealthEvent(RoomHealthSystem.Event event) {
        counters.get(event.getAction()).incrementAndGet();
        logger.debug("🩺 {}", event);
    }

    public long count(RoomHealthSystem.Action action) {
        return counters.get(action).get();
    }

    public long getUptimeSeconds() {
        return Duration.between(startedAt, clock.instant()).getSeconds();
    }
}
