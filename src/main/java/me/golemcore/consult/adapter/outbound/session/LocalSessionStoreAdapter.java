package me.golemcore.consult.adapter.outbound.session;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.consult.domain.model.ModelRunState;
import me.golemcore.consult.domain.model.ModelRunUpdate;
import me.golemcore.consult.domain.model.RunStatus;
import me.golemcore.consult.domain.model.SessionMetadata;
import me.golemcore.consult.domain.model.SessionUpdate;
import me.golemcore.consult.port.outbound.ModelLogWriter;
import me.golemcore.consult.port.outbound.SessionStorePort;
import me.golemcore.consult.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Session store on top of {@link StoragePort}.
 *
 * <p>
 * Layout under the {@code sessions} directory:
 * <ul>
 * <li>{@code <id>/meta.json} - {@link SessionMetadata}, written atomically
 * <li>{@code <id>/output.log} - session-level output
 * <li>{@code <id>/models/<model>.log} - per-model output
 * </ul>
 *
 * <p>
 * Read-modify-write cycles are serialized per session id through a fixed set
 * of striped locks.
 */
@Component
@Slf4j
public class LocalSessionStoreAdapter implements SessionStorePort {

    private static final String SESSIONS_DIR = "sessions";
    private static final String META_FILE = "meta.json";
    private static final String SESSION_LOG_FILE = "output.log";
    private static final String MODELS_DIR = "models";
    private static final String LOG_SUFFIX = ".log";
    private static final int LOCK_STRIPES = 64;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Object[] locks = new Object[LOCK_STRIPES];

    public LocalSessionStoreAdapter(StoragePort storagePort, ObjectMapper objectMapper, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new Object();
        }
    }

    @Override
    public SessionMetadata createSession(SessionMetadata session) {
        if (session.getId() == null || session.getId().isBlank()) {
            throw new IllegalArgumentException("Session id is required");
        }
        synchronized (lockFor(session.getId())) {
            Instant now = clock.instant();
            if (session.getCreatedAt() == null) {
                session.setCreatedAt(now);
            }
            session.setUpdatedAt(now);
            if (session.getStatus() == null) {
                session.setStatus(RunStatus.PENDING);
            }
            Map<String, ModelRunState> runs = new LinkedHashMap<>(session.getModelRuns());
            for (String model : session.getModels()) {
                runs.computeIfAbsent(model, key -> ModelRunState.builder()
                        .model(key)
                        .status(RunStatus.PENDING)
                        .build());
            }
            session.setModelRuns(runs);
            write(session);
            log.debug("[SessionStore] Created session {}", session.getId());
            return session;
        }
    }

    @Override
    public SessionMetadata updateSession(String sessionId, SessionUpdate update) {
        return modify(sessionId, session -> applySessionUpdate(session, update));
    }

    @Override
    public SessionMetadata updateModelRun(String sessionId, String model, ModelRunUpdate update) {
        return modify(sessionId, session -> applyModelRunUpdate(session, model, update));
    }

    @Override
    public ModelLogWriter createLogWriter(String sessionId, String model) {
        return new StorageLogWriter(storagePort, SESSIONS_DIR,
                sessionId + "/" + MODELS_DIR + "/" + safeFileName(model) + LOG_SUFFIX);
    }

    @Override
    public ModelLogWriter createSessionLogWriter(String sessionId) {
        return new StorageLogWriter(storagePort, SESSIONS_DIR, sessionId + "/" + SESSION_LOG_FILE);
    }

    @Override
    public Optional<SessionMetadata> readSession(String sessionId) {
        String json = storagePort.getText(SESSIONS_DIR, metaPath(sessionId)).join();
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, SessionMetadata.class));
        } catch (JsonProcessingException e) {
            log.warn("[SessionStore] Failed to parse session {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<String> readModelLog(String sessionId, String model) {
        return Optional.ofNullable(storagePort.getText(SESSIONS_DIR,
                sessionId + "/" + MODELS_DIR + "/" + safeFileName(model) + LOG_SUFFIX).join());
    }

    @Override
    public Optional<String> readSessionLog(String sessionId) {
        return Optional.ofNullable(storagePort.getText(SESSIONS_DIR, sessionId + "/" + SESSION_LOG_FILE).join());
    }

    @Override
    public List<SessionMetadata> listSessions() {
        List<String> files = storagePort.listObjects(SESSIONS_DIR, null).join();
        List<SessionMetadata> sessions = new ArrayList<>();
        for (String file : files) {
            if (!file.endsWith("/" + META_FILE)) {
                continue;
            }
            String sessionId = file.substring(0, file.length() - META_FILE.length() - 1);
            readSession(sessionId).ifPresent(sessions::add);
        }
        sessions.sort(Comparator.comparing(SessionMetadata::getCreatedAt,
                Comparator.nullsLast(Comparator.reverseOrder())));
        return sessions;
    }

    /**
     * File name for a model id. Sanitized names get a hash suffix so that ids
     * such as {@code a/b} and {@code a_b} never share a log file.
     */
    static String safeFileName(String model) {
        String sanitized = model.replaceAll("[^A-Za-z0-9._-]", "_");
        if (sanitized.equals(model)) {
            return sanitized;
        }
        return sanitized + "-" + shortHash(model);
    }

    private static String shortHash(String value) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest, 0, 4);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private SessionMetadata modify(String sessionId, Consumer<SessionMetadata> mutation) {
        synchronized (lockFor(sessionId)) {
            SessionMetadata session = readSession(sessionId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown session: " + sessionId));
            mutation.accept(session);
            session.setUpdatedAt(clock.instant());
            write(session);
            return session;
        }
    }

    private void applySessionUpdate(SessionMetadata session, SessionUpdate update) {
        if (update.isClearError()) {
            session.setErrorMessage(null);
            session.setErrorCategory(null);
            session.setTransportReason(null);
            session.setResponse(null);
        }
        if (update.getStatus() != null) {
            session.setStatus(update.getStatus());
        }
        if (update.getUsage() != null) {
            session.setUsage(update.getUsage());
        }
        if (update.getElapsedMs() != null) {
            session.setElapsedMs(update.getElapsedMs());
        }
        if (update.getErrorMessage() != null) {
            session.setErrorMessage(update.getErrorMessage());
        }
        if (update.getErrorCategory() != null) {
            session.setErrorCategory(update.getErrorCategory());
        }
        if (update.getTransportReason() != null) {
            session.setTransportReason(update.getTransportReason());
        }
        if (update.getResponse() != null) {
            session.setResponse(update.getResponse());
        }
    }

    private void applyModelRunUpdate(SessionMetadata session, String model, ModelRunUpdate update) {
        if (!session.getModels().contains(model)) {
            session.getModels().add(model);
        }
        ModelRunState run = session.getModelRuns().computeIfAbsent(model, key -> ModelRunState.builder()
                .model(key)
                .status(RunStatus.PENDING)
                .build());
        if (update.isClearError()) {
            run.setErrorMessage(null);
            run.setTransportReason(null);
            run.setResponse(null);
        }
        Instant now = clock.instant();
        if (update.getStatus() != null) {
            run.setStatus(update.getStatus());
            if (update.getStatus() == RunStatus.RUNNING) {
                run.setStartedAt(now);
                run.setCompletedAt(null);
            } else if (update.getStatus().isTerminal()) {
                run.setCompletedAt(now);
            }
        }
        if (update.getUsage() != null) {
            run.setUsage(update.getUsage());
        }
        if (update.getErrorMessage() != null) {
            run.setErrorMessage(update.getErrorMessage());
        }
        if (update.getTransportReason() != null) {
            run.setTransportReason(update.getTransportReason());
        }
        if (update.getResponse() != null) {
            run.setResponse(update.getResponse());
        }
        if (update.getLogLocator() != null) {
            run.setLogLocator(update.getLogLocator());
        }
    }

    private void write(SessionMetadata session) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(session);
            storagePort.putTextAtomic(SESSIONS_DIR, metaPath(session.getId()), json).join();
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize session " + session.getId(), e);
        }
    }

    Object lockFor(String sessionId) {
        return locks[Math.floorMod(sessionId.hashCode(), locks.length)];
    }

    private static String metaPath(String sessionId) {
        return sessionId + "/" + META_FILE;
    }
}
