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
import me.golemcore.consult.domain.model.ModelRequest;
import me.golemcore.consult.domain.model.ModelRunResult;
import me.golemcore.consult.domain.model.ResponseStreamEvent;
import me.golemcore.consult.domain.model.TransportFailureReason;
import me.golemcore.consult.domain.model.UsageSummary;
import me.golemcore.consult.domain.system.RunStatsFormatter;
import me.golemcore.consult.domain.system.TransportErrorClassifier;
import me.golemcore.consult.infrastructure.config.ConsultProperties;
import me.golemcore.consult.port.outbound.RunOutput;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Issues exactly one request to one backend model.
 *
 * <p>
 * Two modes:
 * <ul>
 * <li>streaming: text deltas are forwarded to the output as they arrive, and
 * every wait for the next event is bounded by the absolute deadline</li>
 * <li>background: the job is submitted once and handed to
 * {@link BackgroundResponsePoller}</li>
 * </ul>
 *
 * <p>
 * Every failure leaves this class either as a {@link ConsultException} raised
 * on purpose or as a classified {@link TransportException}.
 */
@Service
@Slf4j
public class ModelCallExecutor {

    private static final String NO_TEXT_OUTPUT = "(no text output)";

    private final Clock clock;
    private final Sleeper sleeper;
    private final BackgroundResponsePoller poller;
    private final HeartbeatScheduler heartbeatScheduler;
    private final ConsultProperties properties;

    public ModelCallExecutor(Clock clock, Sleeper sleeper, BackgroundResponsePoller poller,
            HeartbeatScheduler heartbeatScheduler, ConsultProperties properties) {
        this.clock = clock;
        this.sleeper = sleeper;
        this.poller = poller;
        this.heartbeatScheduler = heartbeatScheduler;
        this.properties = properties;
    }

    public ModelRunResult execute(ModelCall call, RunOutput output) {
        long start = clock.millis();
        long deadline = start + call.getTimeout().toMillis();
        String model = call.getRequest().getModel();
        try {
            if (call.isUseBackground()) {
                return executeBackground(call, output, start, deadline);
            }
            return executeStreaming(call, output, start, deadline);
        } catch (TransportException e) {
            log.warn("[Executor] {} transport failure: {} ({})", model, e.getMessage(), e.getReason().getCode());
            reportTransportFailure(e, call, output);
            throw e;
        } catch (ConsultException e) {
            log.warn("[Executor] {} failed: {}", model, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            TransportException classified = TransportErrorClassifier.toTransportException(e);
            log.warn("[Executor] {} failed: {} ({})", model, classified.getMessage(),
                    classified.getReason().getCode());
            reportTransportFailure(classified, call, output);
            throw classified;
        }
    }

    private ModelRunResult executeStreaming(ModelCall call, RunOutput output, long start, long deadline) {
        ModelRequest request = call.getRequest();
        AnswerPrinter printer = new AnswerPrinter(request, output);
        BackendResponse finalResponse = null;

        try (HeartbeatScheduler.Heartbeat heartbeat = heartbeatScheduler.start(
                call.getHeartbeatInterval(), start, call.getTimeout(), output);
                ResponseStreamReader reader = ResponseStreamReader.open(
                        call.getClient().stream(call.getBackendRequest(), call.getCredential()))) {
            while (true) {
                ResponseStreamEvent event = nextEvent(reader, deadline, call.getTimeout());
                if (event == null) {
                    break;
                }
                throwIfTimedOut(deadline, call.getTimeout());
                if (event.type() == ResponseStreamEvent.Type.TEXT_DELTA) {
                    heartbeat.stop();
                    printer.delta(event.delta());
                } else if (event.type() == ResponseStreamEvent.Type.COMPLETED) {
                    finalResponse = event.response();
                }
            }
            throwIfTimedOut(deadline, call.getTimeout());
        }

        if (finalResponse == null) {
            throw new ResponseFailureException("API did not return a response.", null);
        }
        printer.endOfStream();

        BackendResponse response = awaitLateCompletion(call, finalResponse, deadline, output);
        ensureCompleted(response, output);
        printer.finish(response.extractText());

        long elapsed = clock.millis() - start;
        UsageSummary usage = UsageSummary.from(response.getUsage(), call.getEstimatedInputTokens(),
                call.getPricing());
        return new ModelRunResult.Streamed(usage, elapsed, response);
    }

    private ModelRunResult executeBackground(ModelCall call, RunOutput output, long start, long deadline) {
        BackendResponse initial = call.getClient().create(call.getBackendRequest(), call.getCredential());
        if (initial == null || initial.getId() == null || initial.getId().isBlank()) {
            throw new ResponseFailureException("API did not return a response ID for the background run.",
                    initial != null ? initial.metadata() : null);
        }
        output.writeLine("API scheduled background response " + initial.getId() + " (status="
                + (initial.getStatus() != null ? initial.getStatus() : BackendResponse.STATUS_QUEUED)
                + "). Monitoring up to " + RunStatsFormatter.formatElapsed(call.getTimeout().toMillis())
                + " for completion...");
        log.info("[Executor] {} scheduled background response {}", call.getRequest().getModel(), initial.getId());

        BackendResponse response;
        try (HeartbeatScheduler.Heartbeat ignored = heartbeatScheduler.startBackground(
                call.getHeartbeatInterval(), start, output)) {
            response = poller.awaitCompletion(call.getClient(), call.getCredential(), initial, deadline,
                    call.getTimeout(), output);
        }

        AnswerPrinter printer = new AnswerPrinter(call.getRequest(), output);
        printer.finish(response.extractText());

        long elapsed = clock.millis() - start;
        UsageSummary usage = UsageSummary.from(response.getUsage(), call.getEstimatedInputTokens(),
                call.getPricing());
        return new ModelRunResult.Backgrounded(usage, elapsed, response);
    }

    private ResponseStreamEvent nextEvent(ResponseStreamReader reader, long deadline, Duration timeout) {
        long remaining = deadline - clock.millis();
        if (remaining <= 0) {
            throw timeoutError(timeout);
        }
        try {
            return reader.next(Duration.ofMillis(remaining));
        } catch (TimeoutException e) {
            throw timeoutError(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(TransportFailureReason.CLIENT_ABORT,
                    "Interrupted while waiting for API response.", e);
        }
    }

    /**
     * The stream can close while the response is still {@code in_progress};
     * give it a short grace poll to catch late finalization. The grace poll
     * never outlives the call deadline.
     */
    private BackendResponse awaitLateCompletion(ModelCall call, BackendResponse response, long deadline,
            RunOutput output) {
        if (!BackendResponse.STATUS_IN_PROGRESS.equals(response.getStatus()) || response.getId() == null) {
            return response;
        }
        ConsultProperties.GracePollProperties gracePoll = properties.getGracePoll();
        output.writeLine("Response still in_progress; polling until completion...");
        long graceEnd = Math.min(clock.millis() + gracePoll.getMaxWait().toMillis(), deadline);
        BackendResponse current = response;
        while (clock.millis() < graceEnd) {
            throwIfTimedOut(deadline, call.getTimeout());
            try {
                sleeper.sleep(gracePoll.getInterval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException(TransportFailureReason.CLIENT_ABORT,
                        "Interrupted while waiting for API response.", e);
            }
            throwIfTimedOut(deadline, call.getTimeout());
            BackendResponse refreshed = call.getClient().retrieve(response.getId(), call.getCredential());
            if (refreshed != null && refreshed.isCompleted()) {
                current = refreshed;
                break;
            }
        }
        if (!current.isCompleted()) {
            throwIfTimedOut(deadline, call.getTimeout());
        }
        return current;
    }

    private void ensureCompleted(BackendResponse response, RunOutput output) {
        if (response.getStatus() == null || response.isCompleted()) {
            return;
        }
        String reason = response.getIncompleteDetails() != null
                ? response.getIncompleteDetails().getReason()
                : null;
        output.writeLine("API ended the run early (status=" + response.getStatus()
                + (reason != null ? ", reason=" + reason : "") + ").");
        throw BackgroundResponsePoller.responseFailure(response);
    }

    private void throwIfTimedOut(long deadline, Duration timeout) {
        if (clock.millis() >= deadline) {
            throw timeoutError(timeout);
        }
    }

    private static TransportException timeoutError(Duration timeout) {
        return new TransportException(TransportFailureReason.CLIENT_TIMEOUT,
                "Timed out waiting for API response after " + RunStatsFormatter.formatElapsed(timeout.toMillis())
                        + ".");
    }

    private static void reportTransportFailure(TransportException e, ModelCall call, RunOutput output) {
        output.writeLine(TransportErrorClassifier.describe(e.getFailure(), call.getTimeout()));
    }

    /**
     * Writes the answer header once, streamed deltas, and the closing
     * separator or the full answer when nothing was streamed.
     */
    private static final class AnswerPrinter {

        private final ModelRequest request;
        private final RunOutput output;
        private boolean headerPrinted;
        private boolean sawTextDelta;

        AnswerPrinter(ModelRequest request, RunOutput output) {
            this.request = request;
            this.output = output;
        }

        void delta(String text) {
            sawTextDelta = true;
            ensureHeader();
            if (!request.isSilent() && text != null) {
                output.writeChunk(text);
            }
        }

        void endOfStream() {
            if (sawTextDelta && !request.isSilent()) {
                output.writeChunk("\n");
                output.writeLine("");
            }
        }

        void finish(String answerText) {
            if (request.isSilent()) {
                return;
            }
            if (sawTextDelta) {
                output.writeChunk("\n");
                return;
            }
            ensureHeader();
            output.writeLine(answerText != null && !answerText.isEmpty() ? answerText : NO_TEXT_OUTPUT);
            output.writeLine("");
        }

        private void ensureHeader() {
            if (request.isSilent() || request.isSuppressAnswerHeader() || headerPrinted) {
                return;
            }
            output.writeLine("");
            output.writeLine("Answer:");
            headerPrinted = true;
        }
    }
}
