package me.golemcore.consult.adapter.inbound.web;

import me.golemcore.consult.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.consult.domain.exception.PromptValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import reactor.test.StepVerifier;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldHandleResponseStatusException() {
        ResponseStatusException ex = new ResponseStatusException(HttpStatus.NOT_FOUND, "Consultation not found: x");

        StepVerifier.create(handler.handleResponseStatus(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(404, body.getStatus());
                    assertEquals("Consultation not found: x", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHandlePromptValidationWithDetails() {
        PromptValidationException ex = new PromptValidationException("Input too large (200,000 tokens).",
                Map.of("inputTokens", 200000, "limit", 196000));

        StepVerifier.create(handler.handlePromptValidation(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals("Input too large (200,000 tokens).", body.getMessage());
                    assertEquals(196000, body.getDetails().get("limit"));
                })
                .verifyComplete();
    }

    @Test
    void shouldOmitEmptyValidationDetails() {
        StepVerifier.create(handler.handlePromptValidation(new PromptValidationException("Prompt is required")))
                .assertNext(response -> assertNull(response.getBody().getDetails()))
                .verifyComplete();
    }

    @Test
    void shouldHandleIllegalArgumentException() {
        IllegalArgumentException ex = new IllegalArgumentException("At least one model is required");

        StepVerifier.create(handler.handleIllegalArgument(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals(400, response.getBody().getStatus());
                    assertEquals("At least one model is required", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideInternalErrorDetails() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("NPE in store")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
