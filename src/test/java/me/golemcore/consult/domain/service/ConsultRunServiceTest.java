package me.golemcore.consult.domain.service;

import me.golemcore.consult.domain.exception.PromptValidationException;
import me.golemcore.consult.domain.model.BackendResponse;
import me.golemcore.consult.domain.model.BackendUsage;
import me.golemcore.consult.domain.model.ModelRequest;
import me.golemcore.consult.domain.model.ModelRunResult;
import me.golemcore.consult.domain.model.UsageSummary;
import me.golemcore.consult.infrastructure.config.ConsultProperties;
import me.golemcore.consult.infrastructure.config.ModelConfigService;
import me.golemcore.consult.infrastructure.config.ModelConfigService.ModelSettings;
import me.golemcore.consult.port.outbound.ResponsesClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConsultRunServiceTest {

    private static final String MODEL = "gpt-5.1";
    private static final String PRO_MODEL = "gpt-5.1-pro";
    private static final String LONG_PROMPT = "Review this retry loop and explain whether the backoff can overflow "
            + "when the attempt counter grows past thirty on a long outage.";

    private ConsultProperties properties;
    private ModelConfigService modelConfigService;
    private ResponsesClient client;
    private TokenEstimator tokenEstimator;
    private ModelCallExecutor executor;
    private RecordingOutput output;
    private ConsultRunService service;

    @BeforeEach
    void setUp() {
        properties = new ConsultProperties();
        ConsultProperties.ProviderProperties openai = new ConsultProperties.ProviderProperties();
        openai.setApiKey("sk-test-1234567890");
        properties.getProviders().put("openai", openai);

        modelConfigService = mock(ModelConfigService.class);
        when(modelConfigService.getModelSettings(MODEL)).thenReturn(settings(false, "high"));
        when(modelConfigService.getModelSettings(PRO_MODEL)).thenReturn(settings(true, null));

        client = mock(ResponsesClient.class);
        when(client.getProviderId()).thenReturn("openai");
        when(client.supportsBackground()).thenReturn(true);
        ResponsesClientRegistry registry = new ResponsesClientRegistry(List.of(client));
        registry.init();

        tokenEstimator = mock(TokenEstimator.class);
        when(tokenEstimator.estimate(any())).thenReturn(4_200);
        executor = mock(ModelCallExecutor.class);
        output = new RecordingOutput();

        service = new ConsultRunService(modelConfigService, new CredentialResolver(properties), registry,
                new ResponseRequestFactory(properties), tokenEstimator, executor, properties);
    }

    @Test
    void shouldPrintHeaderTipsAndFinishedLine() {
        when(executor.execute(any(), any())).thenReturn(result());

        ModelRunResult result = service.runSingleModel(request(MODEL, "Why is my cache slow?").build(), output);

        assertEquals(4_300, result.usage().totalTokens());
        List<String> lines = output.lines();
        assertEquals("Calling gpt-5.1: 4.2k tokens.", lines.get(0));
        assertTrue(lines.get(1).startsWith("Tip: brief prompts often yield generic answers"));
        assertEquals("Finished in 25ms (gpt-5.1[high] | $0.0125 | tok(i/o/r/t)=4.2k/100/0/4.3k)",
                lines.get(lines.size() - 1));
    }

    @Test
    void shouldOmitHeaderAndTipsWhenSuppressed() {
        when(executor.execute(any(), any())).thenReturn(result());

        service.runSingleModel(request(MODEL, "Why is my cache slow?")
                .suppressHeader(true)
                .suppressTips(true)
                .build(), output);

        assertEquals(1, output.lines().size());
        assertTrue(output.lines().get(0).startsWith("Finished in"));
    }

    @Test
    void shouldStreamShortRunningModelWithDefaultTimeout() {
        when(executor.execute(any(), any())).thenReturn(result());

        service.runSingleModel(request(MODEL, LONG_PROMPT).build(), output);

        ModelCall call = capturedCall();
        assertFalse(call.isUseBackground());
        assertEquals(Duration.ofSeconds(120), call.getTimeout());
        assertEquals("high", call.getBackendRequest().getReasoning().getEffort());
        assertEquals("web_search_preview", call.getBackendRequest().getTools().get(0).getType());
        assertNull(call.getBackendRequest().getBackground());
        assertEquals(4_200, call.getEstimatedInputTokens());
    }

    @Test
    void shouldRunLongRunningModelInBackgroundWithLongTimeout() {
        when(executor.execute(any(), any())).thenReturn(result());

        service.runSingleModel(request(PRO_MODEL, LONG_PROMPT).build(), output);

        ModelCall call = capturedCall();
        assertTrue(call.isUseBackground());
        assertEquals(Duration.ofMinutes(60), call.getTimeout());
        assertEquals(Boolean.TRUE, call.getBackendRequest().getBackground());
        assertEquals(Boolean.TRUE, call.getBackendRequest().getStore());
        assertTrue(output.lines().contains("This model can take up to 60 minutes (usually replies much faster)."));
    }

    @Test
    void shouldHonorExplicitTimeoutAndBackgroundOverride() {
        when(executor.execute(any(), any())).thenReturn(result());

        service.runSingleModel(request(PRO_MODEL, LONG_PROMPT)
                .timeout(Duration.ofMinutes(5))
                .background(false)
                .search(false)
                .build(), output);

        ModelCall call = capturedCall();
        assertFalse(call.isUseBackground());
        assertEquals(Duration.ofMinutes(5), call.getTimeout());
        assertNull(call.getBackendRequest().getTools());
    }

    @Test
    void shouldRejectMissingCredentialBeforeDispatch() {
        properties.getProviders().clear();

        PromptValidationException error = assertThrows(PromptValidationException.class,
                () -> service.runSingleModel(request(MODEL, LONG_PROMPT).build(), output));

        assertTrue(error.getMessage().startsWith("Missing OPENAI_API_KEY."));
        verify(executor, never()).execute(any(), any());
        assertTrue(output.lines().isEmpty());
    }

    @Test
    void shouldRejectShortPromptForLongRunningModel() {
        PromptValidationException error = assertThrows(PromptValidationException.class,
                () -> service.runSingleModel(request(PRO_MODEL, "hi").build(), output));

        assertEquals("Prompt is too short (<20 chars). This was likely accidental; please provide more detail.",
                error.getMessage());
        assertEquals(2, error.getDetails().get("promptLength"));
        verify(executor, never()).execute(any(), any());
    }

    @Test
    void shouldAllowShortPromptForRegularModel() {
        when(executor.execute(any(), any())).thenReturn(result());

        service.runSingleModel(request(MODEL, "hi").build(), output);

        verify(executor).execute(any(), any());
    }

    @Test
    void shouldRejectInputOverBudget() {
        when(tokenEstimator.estimate(any())).thenReturn(200_000);

        PromptValidationException error = assertThrows(PromptValidationException.class,
                () -> service.runSingleModel(request(MODEL, LONG_PROMPT).build(), output));

        assertEquals("Input too large (200,000 tokens). Limit is 196,000 tokens.", error.getMessage());
        verify(executor, never()).execute(any(), any());
    }

    @Test
    void shouldUseExplicitInputBudget() {
        PromptValidationException error = assertThrows(PromptValidationException.class,
                () -> service.runSingleModel(request(MODEL, LONG_PROMPT).maxInputTokens(1_000).build(), output));

        assertEquals("Input too large (4,200 tokens). Limit is 1,000 tokens.", error.getMessage());
    }

    @Test
    void shouldRejectExplicitBackgroundOnUnsupportedBackend() {
        when(client.supportsBackground()).thenReturn(false);

        assertThrows(PromptValidationException.class,
                () -> service.runSingleModel(request(MODEL, LONG_PROMPT).background(true).build(), output));
    }

    @Test
    void shouldFallBackToStreamingWhenDefaultBackgroundUnsupported() {
        when(client.supportsBackground()).thenReturn(false);
        when(executor.execute(any(), any())).thenReturn(result());

        service.runSingleModel(request(PRO_MODEL, LONG_PROMPT).build(), output);

        assertFalse(capturedCall().isUseBackground());
    }

    @Test
    void shouldPassClientAndCredentialToExecutor() {
        when(executor.execute(any(), any())).thenReturn(result());

        service.runSingleModel(request(MODEL, LONG_PROMPT).build(), output);

        ModelCall call = capturedCall();
        assertSame(client, call.getClient());
        assertEquals("sk-test-1234567890", call.getCredential().apiKey());
        assertEquals(1.25, call.getPricing().inputPerMillion(), 1e-9);
    }

    private ModelCall capturedCall() {
        ArgumentCaptor<ModelCall> captor = ArgumentCaptor.forClass(ModelCall.class);
        verify(executor).execute(captor.capture(), any());
        return captor.getValue();
    }

    private static ModelRequest.ModelRequestBuilder request(String model, String prompt) {
        return ModelRequest.builder().model(model).prompt(prompt);
    }

    private static ModelSettings settings(boolean longRunning, String reasoningEffort) {
        ModelSettings settings = new ModelSettings();
        settings.setLongRunning(longRunning);
        settings.setReasoningEffort(reasoningEffort);
        settings.setPricing(new ModelConfigService.PricingConfig(1.25, 10.0));
        return settings;
    }

    private static ModelRunResult result() {
        BackendResponse response = BackendResponse.completedText("resp_1", "answer",
                BackendUsage.of(4_200, 100, 0, 4_300));
        return new ModelRunResult.Streamed(new UsageSummary(4_200, 100, 0, 4_300, 0.0125), 25, response);
    }
}
