package me.golemcore.consult.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.consult.adapter.inbound.web.dto.ConsultationRequest;
import me.golemcore.consult.adapter.inbound.web.dto.ConsultationStartedResponse;
import me.golemcore.consult.domain.model.ModelRequest;
import me.golemcore.consult.domain.model.SessionMetadata;
import me.golemcore.consult.domain.service.SessionRunService;
import me.golemcore.consult.infrastructure.config.ModelConfigService;
import me.golemcore.consult.port.outbound.SessionStorePort;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Start consultations and reattach to running or finished ones.
 */
@RestController
@RequestMapping("/api/consultations")
@RequiredArgsConstructor
@Slf4j
public class ConsultationsController {

    private final SessionRunService sessionRunService;
    private final SessionStorePort sessionStore;
    private final ModelConfigService modelConfigService;

    @PostMapping
    public Mono<ResponseEntity<ConsultationStartedResponse>> startConsultation(
            @RequestBody ConsultationRequest request) {
        List<String> models = request.getModels() != null ? request.getModels() : List.of();
        models.stream()
                .filter(model -> model != null && !model.isBlank())
                .forEach(model -> modelConfigService.getModelSettings(model.trim()));
        ModelRequest modelRequest = ModelRequest.builder()
                .prompt(request.getPrompt())
                .systemPrompt(request.getSystem())
                .maxOutputTokens(request.getMaxOutputTokens())
                .search(request.getSearch())
                .background(request.getBackground())
                .timeout(request.getTimeoutSeconds() != null ? Duration.ofSeconds(request.getTimeoutSeconds()) : null)
                .build();

        SessionMetadata session = sessionRunService.startSession(modelRequest, models);
        ConsultationStartedResponse body = ConsultationStartedResponse.builder()
                .id(session.getId())
                .status(session.getStatus())
                .models(session.getModels())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).body(body));
    }

    @GetMapping
    public Mono<ResponseEntity<List<SessionMetadata>>> listConsultations() {
        return Mono.just(ResponseEntity.ok(sessionStore.listSessions()));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<SessionMetadata>> getConsultation(@PathVariable String id) {
        SessionMetadata session = sessionStore.readSession(id)
                .orElseThrow(() -> notFound(id));
        return Mono.just(ResponseEntity.ok(session));
    }

    @GetMapping(value = "/{id}/log", produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<ResponseEntity<String>> getSessionLog(@PathVariable String id) {
        sessionStore.readSession(id).orElseThrow(() -> notFound(id));
        return Mono.just(ResponseEntity.ok(sessionStore.readSessionLog(id).orElse("")));
    }

    @GetMapping(value = "/{id}/models/{model}/log", produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<ResponseEntity<String>> getModelLog(@PathVariable String id, @PathVariable String model) {
        SessionMetadata session = sessionStore.readSession(id).orElseThrow(() -> notFound(id));
        if (!session.getModels().contains(model)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND,
                    "Model " + model + " is not part of consultation " + id);
        }
        return Mono.just(ResponseEntity.ok(sessionStore.readModelLog(id, model).orElse("")));
    }

    private static ResponseStatusException notFound(String id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Consultation not found: " + id);
    }
}
