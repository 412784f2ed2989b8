package me.golemcore.consult.port.outbound;

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

import me.golemcore.consult.domain.model.ModelRunUpdate;
import me.golemcore.consult.domain.model.SessionMetadata;
import me.golemcore.consult.domain.model.SessionUpdate;

import java.util.List;
import java.util.Optional;

/**
 * Port for persisting session and per-model run state so callers can reattach
 * to in-flight or finished work.
 */
public interface SessionStorePort {

    /**
     * Persist a new session. Every listed model starts as {@code pending}.
     */
    SessionMetadata createSession(SessionMetadata session);

    SessionMetadata updateSession(String sessionId, SessionUpdate update);

    SessionMetadata updateModelRun(String sessionId, String model, ModelRunUpdate update);

    ModelLogWriter createLogWriter(String sessionId, String model);

    /**
     * Writer for the session-level output (banner, per-model sections, final
     * stats).
     */
    ModelLogWriter createSessionLogWriter(String sessionId);

    Optional<SessionMetadata> readSession(String sessionId);

    Optional<String> readModelLog(String sessionId, String model);

    Optional<String> readSessionLog(String sessionId);

    List<SessionMetadata> listSessions();
}
