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
import me.golemcore.consult.domain.exception.TransportException;
import me.golemcore.consult.domain.model.FailureDetails;
import me.golemcore.consult.domain.model.ModelExecutionOutcome;
import me.golemcore.consult.domain.model.ModelRequest;
import me.golemcore.consult.domain.model.ModelRunResult;
import me.golemcore.consult.domain.model.ModelRunUpdate;
import me.golemcore.consult.domain.model.MultiModelRunSummary;
import me.golemcore.consult.domain.model.RunStatus;
import me.golemcore.consult.domain.model.TransportFailureReason;
import me.golemcore.consult.port.outbound.ModelLogWriter;
import me.golemcore.consult.port.outbound.SessionStorePort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Sends one prompt to several models concurrently.
 *
 * <p>
 * Each model runs in isolation: a failure of one never cancels the others. All
 * models are marked {@code running} before the first dispatch; each is marked
 * {@code completed} or {@code error} as it settles, and the completion listener
 * is called on the orchestrating thread in settlement order.
 */
@Service
@Slf4j
public class MultiModelOrchestrator {

    private final ConsultRunService runService;
    private final SessionStorePort sessionStore;
    private final ExecutorService executorService;
    private final Clock clock;

    public MultiModelOrchestrator(ConsultRunService runService, SessionStorePort sessionStore,
            @Qualifier("modelCallExecutorService") ExecutorService executorService, Clock clock) {
        this.runService = runService;
        this.sessionStore = sessionStore;
        this.executorService = executorService;
        this.clock = clock;
    }

    /**
     * Run every model and wait for all of them.
     *
     * @param listener
     *            optional, may be {@code null}
     * @throws IllegalArgumentException
     *             when no model is given
     */
    public MultiModelRunSummary runMultiModel(String sessionId, ModelRequest request, List<String> models,
            ModelCompletionListener listener) {
        List<String> uniqueModels = dedupe(models);
        if (uniqueModels.isEmpty()) {
            throw new IllegalArgumentException("At least one model is required for a multi-model run");
        }

        for (String model : uniqueModels) {
            sessionStore.updateModelRun(sessionId, model, ModelRunUpdate.builder()
                    .status(RunStatus.RUNNING)
                    .clearError(true)
                    .build());
        }

        long start = clock.millis();
        CompletionService<ModelExecutionOutcome> completionService = new ExecutorCompletionService<>(
                executorService);
        List<Future<ModelExecutionOutcome>> futures = new ArrayList<>();
        for (String model : uniqueModels) {
            ModelRequest perModel = request.forMultiModelDispatch(model);
            futures.add(completionService.submit(() -> runModel(sessionId, perModel)));
        }
        log.info("[MultiModel] Dispatched {} models for session {}", uniqueModels.size(), sessionId);

        List<ModelExecutionOutcome.Fulfilled> fulfilled = new ArrayList<>();
        List<ModelExecutionOutcome.Rejected> rejected = new ArrayList<>();
        try {
            for (int i = 0; i < uniqueModels.size(); i++) {
                ModelExecutionOutcome outcome = completionService.take().get();
                if (outcome instanceof ModelExecutionOutcome.Fulfilled success) {
                    fulfilled.add(success);
                } else if (outcome instanceof ModelExecutionOutcome.Rejected failure) {
                    rejected.add(failure);
                }
                notifyListener(listener, outcome);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(future -> future.cancel(true));
            throw new TransportException(TransportFailureReason.CLIENT_ABORT,
                    "Interrupted while waiting for models to finish.", e);
        } catch (ExecutionException e) {
            futures.forEach(future -> future.cancel(true));
            throw new IllegalStateException("Model task failed outside its own error handling", e.getCause());
        }

        long elapsed = clock.millis() - start;
        log.info("[MultiModel] Session {} finished: {} fulfilled, {} rejected in {}ms",
                sessionId, fulfilled.size(), rejected.size(), elapsed);
        return new MultiModelRunSummary(fulfilled, rejected, elapsed);
    }

    private ModelExecutionOutcome runModel(String sessionId, ModelRequest request) {
        String model = request.getModel();
        ModelLogWriter logWriter = null;
        try {
            logWriter = sessionStore.createLogWriter(sessionId, model);
            ModelRunResult result = runService.runSingleModel(request, logWriter);
            sessionStore.updateModelRun(sessionId, model, ModelRunUpdate.builder()
                    .status(RunStatus.COMPLETED)
                    .usage(result.usage())
                    .response(result.response().metadata())
                    .logLocator(logWriter.location())
                    .build());
            return new ModelExecutionOutcome.Fulfilled(model, result.usage(), result.answerText(),
                    logWriter.location());
        } catch (Exception e) { // NOSONAR
            log.warn("[MultiModel] {} failed: {}", model, e.getMessage());
            markError(sessionId, model, e, logWriter);
            return new ModelExecutionOutcome.Rejected(model, e);
        } finally {
            if (logWriter != null) {
                logWriter.close();
            }
        }
    }

    private void markError(String sessionId, String model, Exception error, ModelLogWriter logWriter) {
        FailureDetails details = FailureDetails.of(error);
        if (logWriter != null) {
            logWriter.writeLine("ERROR: " + details.message());
        }
        try {
            sessionStore.updateModelRun(sessionId, model, ModelRunUpdate.builder()
                    .status(RunStatus.ERROR)
                    .errorMessage(details.message())
                    .transportReason(details.transportReason())
                    .response(details.response())
                    .logLocator(logWriter != null ? logWriter.location() : null)
                    .build());
        } catch (RuntimeException storeError) {
            log.error("[MultiModel] Failed to record error for {}: {}", model, storeError.getMessage());
        }
    }

    private static void notifyListener(ModelCompletionListener listener, ModelExecutionOutcome outcome) {
        if (listener == null) {
            return;
        }
        try {
            listener.onModelDone(outcome);
        } catch (RuntimeException e) {
            log.warn("[MultiModel] Completion listener failed for {}: {}", outcome.model(), e.getMessage());
        }
    }

    private static List<String> dedupe(List<String> models) {
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        if (models != null) {
            for (String model : models) {
                if (model != null && !model.isBlank()) {
                    unique.add(model.trim());
                }
            }
        }
        return new ArrayList<>(unique);
    }
}
