package me.golemcore.consult.domain.service;

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
import me.golemcore.consult.domain.system.RunStatsFormatter;
import me.golemcore.consult.port.outbound.RunOutput;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Emits periodic "still waiting" lines while a model call is outstanding.
 * Purely observational; never affects the call itself.
 */
@Component
@Slf4j
public class HeartbeatScheduler {

    private static final long MS_PER_MINUTE = 60_000L;

    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    public HeartbeatScheduler(@Qualifier("heartbeatScheduler") ScheduledExecutorService scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * Start a heartbeat; the returned handle stops it and is safe to stop twice.
     */
    public Heartbeat start(Duration interval, long startMillis, Duration timeout, RunOutput output) {
        return schedule(interval, output, () -> buildMessage(clock.millis() - startMillis, timeout));
    }

    /**
     * Start a heartbeat for a background run, which reports elapsed time only.
     */
    public Heartbeat startBackground(Duration interval, long startMillis, RunOutput output) {
        return schedule(interval, output, () -> buildBackgroundMessage(clock.millis() - startMillis));
    }

    private Heartbeat schedule(Duration interval, RunOutput output, Supplier<String> message) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            return Heartbeat.NONE;
        }
        AtomicBoolean active = new AtomicBoolean(true);
        long periodMs = interval.toMillis();
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(() -> {
            if (!active.get()) {
                return;
            }
            try {
                output.writeLine(message.get());
            } catch (RuntimeException e) { // NOSONAR
                log.debug("[Heartbeat] Failed to write heartbeat: {}", e.getMessage());
            }
        }, periodMs, periodMs, TimeUnit.MILLISECONDS);
        return () -> {
            if (active.compareAndSet(true, false)) {
                future.cancel(false);
            }
        };
    }

    static String buildMessage(long elapsedMs, Duration timeout) {
        long remainingMs = Math.max(timeout.toMillis() - elapsedMs, 0);
        String remainingLabel = remainingMs >= MS_PER_MINUTE
                ? ((remainingMs + MS_PER_MINUTE - 1) / MS_PER_MINUTE) + " min"
                : Math.max(1, (remainingMs + 999) / 1000) + "s";
        return "API connection active: " + RunStatsFormatter.formatElapsed(elapsedMs)
                + " elapsed. Timeout in ~" + remainingLabel + " if no response.";
    }

    static String buildBackgroundMessage(long elapsedMs) {
        return "API background run still in progress, " + RunStatsFormatter.formatElapsed(elapsedMs) + " elapsed.";
    }

    /**
     * Handle of a running heartbeat.
     */
    @FunctionalInterface
    public interface Heartbeat extends AutoCloseable {

        Heartbeat NONE = () -> {
        };

        void stop();

        @Override
        default void close() {
            stop();
        }
    }
}
