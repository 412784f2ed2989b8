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
import me.golemcore.consult.domain.exception.ConsultException;
import me.golemcore.consult.domain.exception.ResponseFailureException;
import me.golemcore.consult.domain.exception.TransportException;
import me.golemcore.consult.domain.model.BackendResponse;
import me.golemcore.consult.domain.model.ResolvedCredential;
import me.golemcore.consult.domain.model.TransportFailureReason;
import me.golemcore.consult.domain.system.RunStatsFormatter;
import me.golemcore.consult.domain.system.TransportErrorClassifier;
import me.golemcore.consult.infrastructure.config.ConsultProperties;
import me.golemcore.consult.port.outbound.ResponsesClient;
import me.golemcore.consult.port.outbound.RunOutput;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Waits for an accepted background job to finish.
 *
 * <p>
 * Polls at a fixed interval. A retrieval that fails with a retryable transport
 * error is retried with exponential backoff; the attempt counter starts over
 * after every successful retrieval. The absolute deadline is checked before
 * and after every sleep.
 */
@Service
@Slf4j
public class BackgroundResponsePoller {

    private static final String TIMEOUT_MESSAGE = "Timed out waiting for API background response to finish.";

    private final Clock clock;
    private final Sleeper sleeper;
    private final ConsultProperties properties;

    public BackgroundResponsePoller(Clock clock, Sleeper sleeper, ConsultProperties properties) {
        this.clock = clock;
        this.sleeper = sleeper;
        this.properties = properties;
    }

    /**
     * Poll until the job completes.
     *
     * @param deadlineMillis
     *            absolute deadline on {@link #clock}
     * @param timeout
     *            total budget, used only for messages
     * @throws ResponseFailureException
     *             when the job reaches a terminal non-success status
     * @throws TransportException
     *             on deadline expiry or a non-retryable retrieval failure
     */
    public BackendResponse awaitCompletion(ResponsesClient client, ResolvedCredential credential,
            BackendResponse initial, long deadlineMillis, Duration timeout, RunOutput output) {
        String responseId = initial.getId();
        BackendResponse response = initial;
        boolean firstCycle = true;
        String lastStatus = response.getStatus();

        while (true) {
            String status = response.getStatus() != null ? response.getStatus() : BackendResponse.STATUS_COMPLETED;
            if (firstCycle) {
                firstCycle = false;
                output.writeLine("API background response status=" + status
                        + ". We'll keep retrying automatically.");
            } else if (!status.equals(lastStatus) && !BackendResponse.STATUS_COMPLETED.equals(status)) {
                output.writeLine("API background response status=" + status + ".");
            }
            lastStatus = status;

            if (BackendResponse.STATUS_COMPLETED.equals(status)) {
                return response;
            }
            if (!BackendResponse.STATUS_IN_PROGRESS.equals(status) && !BackendResponse.STATUS_QUEUED.equals(status)) {
                throw responseFailure(response);
            }

            checkDeadline(deadlineMillis);
            sleep(properties.getBackground().getPollInterval());
            checkDeadline(deadlineMillis);

            Retrieval next = retrieveWithRetry(client, credential, responseId, deadlineMillis, timeout, output);
            if (next.reconnected()) {
                String nextStatus = next.response().getStatus() != null
                        ? next.response().getStatus()
                        : BackendResponse.STATUS_IN_PROGRESS;
                output.writeLine("Reconnected to API background response (status=" + nextStatus
                        + "). API is still working...");
            }
            response = next.response();
        }
    }

    /**
     * Delay before retry number {@code attempt} (1-based):
     * {@code min(base * 2^(attempt-1), max)}.
     */
    public static Duration backoffDelay(int attempt, Duration base, Duration max) {
        if (attempt <= 1) {
            return base.compareTo(max) <= 0 ? base : max;
        }
        int shift = Math.min(attempt - 1, 30);
        long candidate = base.toMillis() * (1L << shift);
        if (candidate < 0 || candidate > max.toMillis()) {
            return max;
        }
        return Duration.ofMillis(candidate);
    }

    private Retrieval retrieveWithRetry(ResponsesClient client, ResolvedCredential credential, String responseId,
            long deadlineMillis, Duration timeout, RunOutput output) {
        int retries = 0;
        while (true) {
            try {
                BackendResponse next = client.retrieve(responseId, credential);
                return new Retrieval(next, retries > 0);
            } catch (ConsultException e) {
                if (!(e instanceof TransportException transportException) || !transportException.isRetryable()) {
                    throw e;
                }
                retries++;
                backOff(retries, transportException, deadlineMillis, timeout, output);
            } catch (RuntimeException e) {
                TransportException transportException = TransportErrorClassifier.toTransportException(e);
                if (!transportException.isRetryable()) {
                    throw transportException;
                }
                retries++;
                backOff(retries, transportException, deadlineMillis, timeout, output);
            }
        }
    }

    private void backOff(int attempt, TransportException failure, long deadlineMillis, Duration timeout,
            RunOutput output) {
        ConsultProperties.BackgroundProperties background = properties.getBackground();
        Duration delay = backoffDelay(attempt, background.getRetryBaseDelay(), background.getRetryMaxDelay());
        String line = TransportErrorClassifier.describe(failure.getFailure(), timeout)
                + " Retrying in " + RunStatsFormatter.formatElapsed(delay.toMillis()) + "...";
        log.warn("[Poller] {} (attempt {}, reason={})", line, attempt, failure.getReason().getCode());
        output.writeLine(line);
        sleep(delay);
        checkDeadline(deadlineMillis);
    }

    private void checkDeadline(long deadlineMillis) {
        if (clock.millis() >= deadlineMillis) {
            throw new TransportException(TransportFailureReason.CLIENT_TIMEOUT, TIMEOUT_MESSAGE);
        }
    }

    private void sleep(Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(TransportFailureReason.CLIENT_ABORT,
                    "Interrupted while waiting for API background response.", e);
        }
    }

    static ResponseFailureException responseFailure(BackendResponse response) {
        String detail = response.getError() != null && response.getError().getMessage() != null
                ? response.getError().getMessage()
                : response.getIncompleteDetails() != null && response.getIncompleteDetails().getReason() != null
                        ? response.getIncompleteDetails().getReason()
                        : response.getStatus();
        return new ResponseFailureException("Response did not complete: " + detail, response.metadata());
    }

    private record Retrieval(BackendResponse response, boolean reconnected) {
    }
}
