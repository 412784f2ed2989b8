package me.golemcore.consult.domain.system;

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

import me.golemcore.consult.domain.exception.TransportException;
import me.golemcore.consult.domain.model.TransportFailure;
import me.golemcore.consult.domain.model.TransportFailureReason;

import java.io.EOFException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.ClosedByInterruptException;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Maps failures raised by backend clients onto {@link TransportFailureReason}.
 * Never throws; anything unrecognized is {@code unknown}.
 */
public final class TransportErrorClassifier {

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_LANGCHAIN4J_TIMEOUT = LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException";

    private static final List<String> CONNECTION_LOST_MARKERS = List.of(
            "connection reset",
            "broken pipe",
            "unexpected end of stream",
            "stream was reset",
            "connection closed",
            "premature eof",
            "connection refused");

    private static final List<String> TIMEOUT_MARKERS = List.of(
            "timed out",
            "timeout");

    private TransportErrorClassifier() {
    }

    /**
     * Classify a failure by walking its cause chain.
     */
    public static TransportFailure classify(Throwable throwable) {
        if (throwable == null) {
            return new TransportFailure(TransportFailureReason.UNKNOWN, "Unknown transport failure");
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            if (current instanceof TransportException transportException) {
                return transportException.getFailure();
            }

            TransportFailureReason byType = classifyKnownThrowable(current);
            if (byType != TransportFailureReason.UNKNOWN) {
                return new TransportFailure(byType, messageOf(throwable, byType));
            }

            TransportFailureReason byMessage = classifyFromMessage(current.getMessage());
            if (byMessage != TransportFailureReason.UNKNOWN) {
                return new TransportFailure(byMessage, messageOf(throwable, byMessage));
            }

            current = current.getCause();
        }
        return new TransportFailure(TransportFailureReason.UNKNOWN, messageOf(throwable,
                TransportFailureReason.UNKNOWN));
    }

    /**
     * Wrap a failure into a {@link TransportException}, keeping an existing one
     * as-is.
     */
    public static TransportException toTransportException(Throwable throwable) {
        if (throwable instanceof TransportException transportException) {
            return transportException;
        }
        TransportFailure failure = classify(throwable);
        return new TransportException(failure.reason(), failure.message(), throwable);
    }

    /**
     * Human-readable description for run output.
     */
    public static String describe(TransportFailure failure, Duration timeout) {
        return switch (failure.reason()) {
        case CLIENT_TIMEOUT -> "Timed out waiting for API response after "
                + RunStatsFormatter.formatElapsed(timeout.toMillis()) + ".";
        case CONNECTION_LOST -> "Connection to API lost before the response finished.";
        case CLIENT_ABORT -> "Request to API was aborted.";
        case UNKNOWN -> failure.message() != null && !failure.message().isBlank()
                ? "API request failed: " + failure.message()
                : "API request failed.";
        };
    }

    private static TransportFailureReason classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof CancellationException
                || throwable instanceof InterruptedException
                || throwable instanceof ClosedByInterruptException) {
            return TransportFailureReason.CLIENT_ABORT;
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException
                || CLASS_LANGCHAIN4J_TIMEOUT.equals(throwable.getClass().getName())) {
            return TransportFailureReason.CLIENT_TIMEOUT;
        }
        if (throwable instanceof ConnectException
                || throwable instanceof NoRouteToHostException
                || throwable instanceof UnknownHostException
                || throwable instanceof EOFException
                || throwable instanceof SocketException) {
            return TransportFailureReason.CONNECTION_LOST;
        }
        if (throwable instanceof InterruptedIOException) {
            // OkHttp reports call timeouts as a bare InterruptedIOException("timeout")
            return TransportFailureReason.CLIENT_TIMEOUT;
        }
        return TransportFailureReason.UNKNOWN;
    }

    private static TransportFailureReason classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return TransportFailureReason.UNKNOWN;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        for (String marker : CONNECTION_LOST_MARKERS) {
            if (normalized.contains(marker)) {
                return TransportFailureReason.CONNECTION_LOST;
            }
        }
        for (String marker : TIMEOUT_MARKERS) {
            if (normalized.contains(marker)) {
                return TransportFailureReason.CLIENT_TIMEOUT;
            }
        }
        return TransportFailureReason.UNKNOWN;
    }

    private static String messageOf(Throwable throwable, TransportFailureReason reason) {
        String message = throwable.getMessage();
        if (message != null && !message.isBlank()) {
            return message;
        }
        return switch (reason) {
        case CLIENT_TIMEOUT -> "Request timed out";
        case CONNECTION_LOST -> "Connection lost";
        case CLIENT_ABORT -> "Request aborted";
        case UNKNOWN -> throwable.getClass().getSimpleName();
        };
    }
}
