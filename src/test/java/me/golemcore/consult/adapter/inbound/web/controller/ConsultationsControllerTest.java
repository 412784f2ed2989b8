package me.golemcore.consult.adapter.inbound.web.controller;

import me.golemcore.consult.adapter.inbound.web.dto.ConsultationRequest;
import me.golemcore.consult.adapter.inbound.web.dto.ConsultationStartedResponse;
import me.golemcore.consult.domain.exception.PromptValidationException;
import me.golemcore.consult.domain.model.ModelRequest;
import me.golemcore.consult.domain.model.RunStatus;
import me.golemcore.consult.domain.model.SessionMetadata;
import me.golemcore.consult.domain.service.SessionRunService;
import me.golemcore.consult.infrastructure.config.ModelConfigService;
import me.golemcore.consult.port.outbound.SessionStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConsultationsControllerTest {

    private static final String PROMPT = "Explain the difference between a mutex and a semaphore.";

    private SessionRunService sessionRunService;
    private SessionStorePort sessionStore;
    private ModelConfigService modelConfigService;
    private ConsultationsController controller;

    @BeforeEach
    void setUp() {
        sessionRunService = mock(SessionRunService.class);
        sessionStore = mock(SessionStorePort.class);
        modelConfigService = mock(ModelConfigService.class);
        controller = new ConsultationsController(sessionRunService, sessionStore, modelConfigService);
    }

    @Test
    void shouldStartConsultationAndReturnAccepted() {
        when(sessionRunService.startSession(any(), anyList())).thenReturn(session("s1", "gpt-5.1", "gpt-5.1-pro"));
        ConsultationRequest request = ConsultationRequest.builder()
                .prompt(PROMPT)
                .models(List.of("gpt-5.1", "gpt-5.1-pro"))
                .search(false)
                .timeoutSeconds(90L)
                .build();

        StepVerifier.create(controller.startConsultation(request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
                    ConsultationStartedResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("s1", body.getId());
                    assertEquals(RunStatus.PENDING, body.getStatus());
                    assertEquals(List.of("gpt-5.1", "gpt-5.1-pro"), body.getModels());
                })
                .verifyComplete();

        ArgumentCaptor<ModelRequest> captor = ArgumentCaptor.forClass(ModelRequest.class);
        verify(sessionRunService).startSession(captor.capture(), eq(List.of("gpt-5.1", "gpt-5.1-pro")));
        assertEquals(PROMPT, captor.getValue().getPrompt());
        assertFalse(captor.getValue().isSearchEnabled());
        assertEquals(Duration.ofSeconds(90), captor.getValue().getTimeout());
    }

    @Test
    void shouldRejectUnknownModelBeforeStarting() {
        when(modelConfigService.getModelSettings("gpt-9"))
                .thenThrow(new PromptValidationException("Unsupported model \"gpt-9\"."));
        ConsultationRequest request = ConsultationRequest.builder()
                .prompt(PROMPT)
                .models(List.of("gpt-9"))
                .build();

        assertThrows(PromptValidationException.class, () -> controller.startConsultation(request));
        verify(sessionRunService, never()).startSession(any(), anyList());
    }

    @Test
    void shouldListConsultations() {
        when(sessionStore.listSessions()).thenReturn(List.of(session("s1", "gpt-5.1")));

        StepVerifier.create(controller.listConsultations())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(1, response.getBody().size());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnNotFoundForUnknownConsultation() {
        when(sessionStore.readSession("missing")).thenReturn(Optional.empty());

        ResponseStatusException error = assertThrows(ResponseStatusException.class,
                () -> controller.getConsultation("missing"));

        assertEquals(HttpStatus.NOT_FOUND, error.getStatusCode());
    }

    @Test
    void shouldReturnSessionLogAsText() {
        when(sessionStore.readSession("s1")).thenReturn(Optional.of(session("s1", "gpt-5.1")));
        when(sessionStore.readSessionLog("s1")).thenReturn(Optional.of("Calling gpt-5.1: 1k tokens.\n"));

        StepVerifier.create(controller.getSessionLog("s1"))
                .assertNext(response -> assertEquals("Calling gpt-5.1: 1k tokens.\n", response.getBody()))
                .verifyComplete();
    }

    @Test
    void shouldReturnModelLog() {
        when(sessionStore.readSession("s1")).thenReturn(Optional.of(session("s1", "gpt-5.1")));
        when(sessionStore.readModelLog("s1", "gpt-5.1")).thenReturn(Optional.empty());

        StepVerifier.create(controller.getModelLog("s1", "gpt-5.1"))
                .assertNext(response -> assertEquals("", response.getBody()))
                .verifyComplete();
    }

    @Test
    void shouldReturnNotFoundForModelOutsideConsultation() {
        when(sessionStore.readSession("s1")).thenReturn(Optional.of(session("s1", "gpt-5.1")));

        ResponseStatusException error = assertThrows(ResponseStatusException.class,
                () -> controller.getModelLog("s1", "gpt-5.1-pro"));

        assertEquals(HttpStatus.NOT_FOUND, error.getStatusCode());
    }

    private static SessionMetadata session(String id, String... models) {
        return SessionMetadata.builder()
                .id(id)
                .status(RunStatus.PENDING)
                .prompt(PROMPT)
                .models(List.of(models))
                .build();
    }
}
