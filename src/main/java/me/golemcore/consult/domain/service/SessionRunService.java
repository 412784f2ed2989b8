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
import me.golemcore.consult.domain.model.ErrorCategory;
import me.golemcore.consult.domain.model.FailureDetails;
import me.golemcore.consult.domain.model.ModelExecutionOutcome;
import me.golemcore.consult.domain.model.ModelRequest;
import me.golemcore.consult.domain.model.ModelRunResult;
import me.golemcore.consult.domain.model.ModelRunState;
import me.golemcore.consult.domain.model.ModelRunUpdate;
import me.golemcore.consult.domain.model.MultiModelRunSummary;
import me.golemcore.consult.domain.model.ResponseMetadata;
import me.golemcore.consult.domain.model.RunStatus;
import me.golemcore.consult.domain.model.SessionMetadata;
import me.golemcore.consult.domain.model.SessionUpdate;
import me.golemcore.consult.domain.model.UsageSummary;
import me.golemcore.consult.domain.system.RunStatsFormatter;
import me.golemcore.consult.port.outbound.ModelLogWriter;
import me.golemcore.consult.port.outbound.RunOutput;
import me.golemcore.consult.port.outbound.SessionStorePort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

/**
 * Session-level runs: creates the session record, executes one or several
 * models and records the outcome so that callers can reattach later.
 */
@Service
@Slf4j
public class SessionRunService {

    private final SessionStorePort sessionStore;
    private final ConsultRunService runService;
    private final MultiModelOrchestrator orchestrator;
    private final ExecutorService sessionExecutor;
    private final Clock clock;

    public SessionRunService(SessionStorePort sessionStore, ConsultRunService runService,
            MultiModelOrchestrator orchestrator,
            @Qualifier("sessionRunExecutorService") ExecutorService sessionExecutor, Clock clock) {
        this.sessionStore = sessionStore;
        this.runService = runService;
        this.orchestrator = orchestrator;
        this.sessionExecutor = sessionExecutor;
        this.clock = clock;
    }

    /**
     * Create a session and run it in the background. Returns as soon as the
     * session is persisted.
     *
     * @throws IllegalArgumentException
     *             when no model or no prompt is given
     */
    public SessionMetadata startSession(ModelRequest request, List<String> models) {
        SessionMetadata session = sessionStore.createSession(newSession(request, models));
        log.info("[Session] Created {} for models {}", session.getId(), session.getModels());
        sessionExecutor.submit(() -> {
            try (ModelLogWriter output = sessionStore.createSessionLogWriter(session.getId())) {
                performSessionRun(session, request, output);
            } catch (Exception e) { // NOSONAR
                log.warn("[Session] {} finished with error: {}", session.getId(), e.getMessage());
            }
        });
        return session;
    }

    /**
     * Run a session to completion in the calling thread.
     *
     * <p>
     * Multi-model sessions print one shared banner, then each model's log as it
     * settles, then aggregate stats. If any model failed, the first failure is
     * rethrown after the session status has been written.
     */
    public void performSessionRun(SessionMetadata session, ModelRequest request, RunOutput output) {
        String sessionId = session.getId();
        List<String> models = session.getModels();
        boolean multiModel = models.size() > 1;
        String singleModel = multiModel ? null : models.get(0);

        sessionStore.updateSession(sessionId, SessionUpdate.builder()
                .status(RunStatus.RUNNING)
                .clearError(true)
                .build());
        try {
            if (multiModel) {
                runMultiModel(sessionId, request, models, output);
            } else {
                runSingleModel(sessionId, request.withModel(singleModel), output);
            }
        } catch (RuntimeException e) {
            recordFailure(sessionId, singleModel, e, output);
            throw e;
        }
    }

    private void runSingleModel(String sessionId, ModelRequest request, RunOutput output) {
        String model = request.getModel();
        sessionStore.updateModelRun(sessionId, model, ModelRunUpdate.builder()
                .status(RunStatus.RUNNING)
                .clearError(true)
                .build());

        ModelRunResult result = runService.runSingleModel(request, output);
        ResponseMetadata metadata = result.response().metadata();

        sessionStore.updateSession(sessionId, SessionUpdate.builder()
                .status(RunStatus.COMPLETED)
                .usage(result.usage())
                .elapsedMs(result.elapsedMs())
                .response(metadata)
                .clearError(true)
                .build());
        sessionStore.updateModelRun(sessionId, model, ModelRunUpdate.builder()
                .status(RunStatus.COMPLETED)
                .usage(result.usage())
                .response(metadata)
                .build());
    }

    private void runMultiModel(String sessionId, ModelRequest request, List<String> models, RunOutput output) {
        String primaryModel = models.get(0);
        int estimatedTokens = runService.estimateInputTokens(request.withModel(primaryModel));
        output.writeLine(runService.headerLine(String.join(", ", models), estimatedTokens));
        runService.printTips(request, null, output);

        Map<String, String> answers = new LinkedHashMap<>();
        MultiModelRunSummary summary = orchestrator.runMultiModel(sessionId, request, models, outcome -> {
            if (outcome instanceof ModelExecutionOutcome.Fulfilled fulfilled) {
                answers.put(fulfilled.model(), fulfilled.answerText());
            }
            printModelLog(sessionId, outcome.model(), answers.get(outcome.model()), output);
        });

        UsageSummary usage = summary.aggregateUsage();
        List<RunStatus> statuses = new ArrayList<>();
        summary.fulfilled().forEach(outcome -> statuses.add(RunStatus.COMPLETED));
        summary.rejected().forEach(outcome -> statuses.add(RunStatus.ERROR));
        RunStatus status = RunStatus.aggregate(statuses);

        output.writeLine("Finished in " + RunStatsFormatter.formatElapsed(summary.elapsedMs()) + " ("
                + summary.fulfilled().size() + "/" + models.size() + " models | "
                + (usage.hasCost() ? RunStatsFormatter.formatUsd(usage.cost()) : "cost=N/A")
                + " | tok(i/o/r/t)=" + usage.inputTokens() + "/" + usage.outputTokens() + "/"
                + usage.reasoningTokens() + "/" + usage.totalTokens() + ")");

        sessionStore.updateSession(sessionId, SessionUpdate.builder()
                .status(status)
                .usage(usage)
                .elapsedMs(summary.elapsedMs())
                .clearError(true)
                .build());

        if (summary.hasFailures()) {
            Throwable first = summary.rejected().get(0).reason();
            if (first instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException(first.getMessage(), first);
        }
    }

    private void printModelLog(String sessionId, String model, String fallback, RunOutput output) {
        String body = sessionStore.readModelLog(sessionId, model).orElse("");
        output.writeLine("");
        if (body.isEmpty() && (fallback == null || fallback.isEmpty())) {
            output.writeLine(model + ": (no output recorded)");
            return;
        }
        output.writeLine("[" + model + "]");
        String content = !body.isEmpty() ? body : fallback;
        output.writeChunk(content);
        if (!content.endsWith("\n")) {
            output.writeLine("");
        }
    }

    private void recordFailure(String sessionId, String singleModel, RuntimeException error, RunOutput output) {
        FailureDetails details = FailureDetails.of(error);
        output.writeLine("ERROR: " + details.message());
        if (details.category() == ErrorCategory.VALIDATION) {
            output.writeLine("User error (validation): " + details.message());
        }
        if (details.response() != null) {
            output.writeLine("Response metadata: " + formatResponseMetadata(details.response()));
        }
        if (details.transportReason() != null) {
            output.writeLine("Transport: " + details.transportReason().getCode());
        }
        log.warn("[Session] {} failed ({}): {}", sessionId, details.category(), details.message());

        try {
            sessionStore.updateSession(sessionId, SessionUpdate.builder()
                    .status(RunStatus.ERROR)
                    .errorMessage(details.message())
                    .errorCategory(details.category())
                    .transportReason(details.transportReason())
                    .response(details.response())
                    .build());
            if (singleModel != null) {
                sessionStore.updateModelRun(sessionId, singleModel, ModelRunUpdate.builder()
                        .status(RunStatus.ERROR)
                        .errorMessage(details.message())
                        .transportReason(details.transportReason())
                        .response(details.response())
                        .build());
            }
        } catch (RuntimeException storeError) {
            log.error("[Session] Failed to record error for {}: {}", sessionId, storeError.getMessage());
        }
    }

    private SessionMetadata newSession(ModelRequest request, List<String> models) {
        if (request.getPrompt() == null || request.getPrompt().isBlank()) {
            throw new IllegalArgumentException("Prompt is required");
        }
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        if (models != null) {
            models.stream()
                    .filter(model -> model != null && !model.isBlank())
                    .map(String::trim)
                    .forEach(unique::add);
        }
        if (unique.isEmpty()) {
            throw new IllegalArgumentException("At least one model is required");
        }
        Map<String, ModelRunState> runs = new LinkedHashMap<>();
        for (String model : unique) {
            runs.put(model, ModelRunState.builder().model(model).status(RunStatus.PENDING).build());
        }
        Duration timeout = request.getTimeout();
        return SessionMetadata.builder()
                .id(UUID.randomUUID().toString())
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .status(RunStatus.PENDING)
                .prompt(request.getPrompt())
                .systemPrompt(request.getSystemPrompt())
                .maxOutputTokens(request.getMaxOutputTokens())
                .search(request.isSearchEnabled())
                .background(request.getBackground())
                .timeoutSeconds(timeout != null ? timeout.toSeconds() : null)
                .models(new ArrayList<>(unique))
                .modelRuns(runs)
                .build();
    }

    private static String formatResponseMetadata(ResponseMetadata metadata) {
        List<String> parts = new ArrayList<>();
        if (metadata.responseId() != null) {
            parts.add("response=" + metadata.responseId());
        }
        if (metadata.requestId() != null) {
            parts.add("request=" + metadata.requestId());
        }
        if (metadata.status() != null) {
            parts.add("status=" + metadata.status());
        }
        if (metadata.incompleteReason() != null) {
            parts.add("incomplete=" + metadata.incompleteReason());
        }
        return String.join(" | ", parts);
    }
}
