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

import me.golemcore.consult.domain.model.ResponseStreamEvent;
import reactor.core.Disposable;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Pull-style view over a streaming backend flux, so that the caller can bound
 * every wait by its own deadline.
 */
final class ResponseStreamReader implements AutoCloseable {

    private static final Object END = new Object();

    private final BlockingQueue<Object> signals = new LinkedBlockingQueue<>();
    private final Disposable subscription;
    private boolean finished;

    private ResponseStreamReader(Flux<ResponseStreamEvent> events) {
        this.subscription = events.subscribe(
                signals::add,
                error -> signals.add(new Failure(error)),
                () -> signals.add(END));
    }

    static ResponseStreamReader open(Flux<ResponseStreamEvent> events) {
        return new ResponseStreamReader(events);
    }

    /**
     * Next event, or {@code null} once the stream has ended.
     *
     * @throws TimeoutException
     *             when nothing arrives within {@code maxWait}
     */
    ResponseStreamEvent next(Duration maxWait) throws InterruptedException, TimeoutException {
        if (finished) {
            return null;
        }
        Object signal = signals.poll(Math.max(maxWait.toMillis(), 0), TimeUnit.MILLISECONDS);
        if (signal == null) {
            throw new TimeoutException("No stream event within " + maxWait.toMillis() + "ms");
        }
        if (signal == END) {
            finished = true;
            return null;
        }
        if (signal instanceof Failure failure) {
            finished = true;
            throw Exceptions.propagate(failure.error());
        }
        return (ResponseStreamEvent) signal;
    }

    @Override
    public void close() {
        subscription.dispose();
    }

    private record Failure(Throwable error) {
    }
}
