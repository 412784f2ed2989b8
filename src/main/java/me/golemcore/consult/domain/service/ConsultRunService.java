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
import me.golemcore.consult.domain.exception.PromptValidationException;
import me.golemcore.consult.domain.model.BackendRequest;
import me.golemcore.consult.domain.model.ModelRequest;
import me.golemcore.consult.domain.model.ModelRunResult;
import me.golemcore.consult.domain.model.ResolvedCredential;
import me.golemcore.consult.domain.system.RunStatsFormatter;
import me.golemcore.consult.infrastructure.config.ConsultProperties;
import me.golemcore.consult.infrastructure.config.ModelConfigService;
import me.golemcore.consult.infrastructure.config.ModelConfigService.ModelSettings;
import me.golemcore.consult.port.outbound.ResponsesClient;
import me.golemcore.consult.port.outbound.RunOutput;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Runs one prompt against one model: validation, request assembly, the call
 * itself and the closing stats line.
 */
@Service
@Slf4j
public class ConsultRunService {

    private final ModelConfigService modelConfigService;
    private final CredentialResolver credentialResolver;
    private final ResponsesClientRegistry clientRegistry;
    private final ResponseRequestFactory requestFactory;
    private final TokenEstimator tokenEstimator;
    private final ModelCallExecutor executor;
    private final ConsultProperties properties;

    public ConsultRunService(ModelConfigService modelConfigService, CredentialResolver credentialResolver,
            ResponsesClientRegistry clientRegistry, ResponseRequestFactory requestFactory,
            TokenEstimator tokenEstimator, ModelCallExecutor executor, ConsultProperties properties) {
        this.modelConfigService = modelConfigService;
        this.credentialResolver = credentialResolver;
        this.clientRegistry = clientRegistry;
        this.requestFactory = requestFactory;
        this.tokenEstimator = tokenEstimator;
        this.executor = executor;
        this.properties = properties;
    }

    /**
     * Run a single model and return its normalized result.
     *
     * @throws PromptValidationException
     *             before any dispatch when the request is invalid
     * @throws me.golemcore.consult.domain.exception.TransportException
     *             on classified transport failures
     * @throws me.golemcore.consult.domain.exception.ResponseFailureException
     *             when the backend ends the run without success
     */
    public ModelRunResult runSingleModel(ModelRequest request, RunOutput output) {
        String model = request.getModel();
        ModelSettings settings = modelConfigService.getModelSettings(model);
        ResolvedCredential credential = credentialResolver.resolve(settings.getProvider());
        validatePromptLength(request, settings);

        ResponsesClient client = clientRegistry.getClient(settings.getProvider());
        boolean useBackground = resolveBackground(request, settings, client);
        BackendRequest backendRequest = requestFactory.build(request, model, settings, useBackground);
        int estimatedInputTokens = tokenEstimator.estimate(backendRequest);
        int inputBudget = request.getMaxInputTokens() != null ? request.getMaxInputTokens() : settings.getInputLimit();
        Duration timeout = resolveTimeout(request, settings);

        if (!request.isSuppressHeader()) {
            output.writeLine(headerLine(model, estimatedInputTokens));
            logCredential(request, settings, credential, estimatedInputTokens);
        }
        if (!request.isSuppressTips()) {
            printTips(request, settings, output);
        }

        if (estimatedInputTokens > inputBudget) {
            throw new PromptValidationException(String.format(Locale.ROOT,
                    "Input too large (%,d tokens). Limit is %,d tokens.", estimatedInputTokens, inputBudget),
                    Map.of("estimatedInputTokens", estimatedInputTokens, "inputTokenBudget", inputBudget));
        }

        log.info("[Run] Dispatching {} (background={}, timeout={})", model, useBackground,
                RunStatsFormatter.formatElapsed(timeout.toMillis()));
        ModelCall call = ModelCall.builder()
                .request(request)
                .backendRequest(backendRequest)
                .client(client)
                .credential(credential)
                .timeout(timeout)
                .useBackground(useBackground)
                .heartbeatInterval(properties.getExecution().getHeartbeatInterval())
                .estimatedInputTokens(estimatedInputTokens)
                .pricing(settings.modelPricing())
                .build();
        ModelRunResult result = executor.execute(call, output);

        String modelLabel = settings.getReasoningEffort() != null
                ? model + "[" + settings.getReasoningEffort() + "]"
                : model;
        String finishedLine = RunStatsFormatter.formatFinishedLine(result.elapsedMs(), modelLabel, result.usage(),
                result.response().getUsage(), request.isSearchEnabled());
        output.writeLine(finishedLine);
        log.info("[Run] {}", finishedLine);
        return result;
    }

    /**
     * Input-token estimate of the request as it would be sent to its model.
     */
    public int estimateInputTokens(ModelRequest request) {
        ModelSettings settings = modelConfigService.getModelSettings(request.getModel());
        return tokenEstimator.estimate(requestFactory.build(request, request.getModel(), settings, false));
    }

    /**
     * Banner line shared by single-model and multi-model runs.
     */
    public String headerLine(String modelLabel, int estimatedInputTokens) {
        return "Calling " + modelLabel + ": " + formatTokenEstimate(estimatedInputTokens) + " tokens.";
    }

    /**
     * Tips printed before dispatch unless suppressed.
     */
    public void printTips(ModelRequest request, ModelSettings settings, RunOutput output) {
        int promptLength = request.getPrompt() != null ? request.getPrompt().trim().length() : 0;
        if (promptLength < properties.getValidation().getShortPromptTipChars()) {
            output.writeLine("Tip: brief prompts often yield generic answers; aim for 6-30 sentences "
                    + "and include the relevant code or docs.");
        }
        if (settings != null && settings.isLongRunning()) {
            output.writeLine("This model can take up to 60 minutes (usually replies much faster).");
        }
    }

    private void logCredential(ModelRequest request, ModelSettings settings, ResolvedCredential credential,
            int estimatedInputTokens) {
        String maskedKey = CredentialResolver.maskApiKey(credential.apiKey());
        log.info("[Run] Using {}={} for model {} (api model {}, ~{} input tokens)",
                credentialResolver.envVarFor(settings.getProvider()), maskedKey, request.getModel(),
                settings.apiModelOr(request.getModel()), estimatedInputTokens);
        if (credential.baseUrl() != null) {
            log.info("[Run] Base URL: {}", credential.baseUrl());
        }
    }

    private void validatePromptLength(ModelRequest request, ModelSettings settings) {
        if (!settings.isLongRunning()) {
            return;
        }
        int minPromptChars = properties.getValidation().getMinPromptChars();
        int promptLength = request.getPrompt() != null ? request.getPrompt().trim().length() : 0;
        if (promptLength < minPromptChars) {
            throw new PromptValidationException("Prompt is too short (<" + minPromptChars
                    + " chars). This was likely accidental; please provide more detail.",
                    Map.of("minPromptLength", minPromptChars, "promptLength", promptLength));
        }
    }

    private boolean resolveBackground(ModelRequest request, ModelSettings settings, ResponsesClient client) {
        boolean requested = request.getBackground() != null ? request.getBackground() : settings.isLongRunning();
        if (!requested) {
            return false;
        }
        if (!settings.isSupportsBackground() || !client.supportsBackground()) {
            if (Boolean.TRUE.equals(request.getBackground())) {
                throw new PromptValidationException("Model \"" + request.getModel()
                        + "\" does not support background execution.",
                        Map.of("model", request.getModel()));
            }
            return false;
        }
        return true;
    }

    private Duration resolveTimeout(ModelRequest request, ModelSettings settings) {
        if (request.getTimeout() != null && !request.getTimeout().isZero() && !request.getTimeout().isNegative()) {
            return request.getTimeout();
        }
        ConsultProperties.ExecutionProperties execution = properties.getExecution();
        return settings.isLongRunning() ? execution.getLongRunningTimeout() : execution.getDefaultTimeout();
    }

    private static String formatTokenEstimate(int value) {
        if (value >= 1000) {
            double abbreviated = Math.floor(value / 100d) / 10d;
            String text = String.format(Locale.ROOT, "%.1f", abbreviated);
            return (text.endsWith(".0") ? text.substring(0, text.length() - 2) : text) + "k";
        }
        return Integer.toString(value);
    }
}
