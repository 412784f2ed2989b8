package me.golemcore.consult.adapter.outbound.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.consult.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.consult.domain.model.ErrorCategory;
import me.golemcore.consult.domain.model.ModelRunState;
import me.golemcore.consult.domain.model.ModelRunUpdate;
import me.golemcore.consult.domain.model.ResponseMetadata;
import me.golemcore.consult.domain.model.RunStatus;
import me.golemcore.consult.domain.model.SessionMetadata;
import me.golemcore.consult.domain.model.SessionUpdate;
import me.golemcore.consult.domain.model.TransportFailureReason;
import me.golemcore.consult.domain.model.UsageSummary;
import me.golemcore.consult.infrastructure.config.AutoConfiguration;
import me.golemcore.consult.infrastructure.config.ConsultProperties;
import me.golemcore.consult.port.outbound.ModelLogWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalSessionStoreAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private LocalSessionStoreAdapter store;

    @BeforeEach
    void setUp() {
        ConsultProperties properties = new ConsultProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        ObjectMapper objectMapper = AutoConfiguration.objectMapper();
        store = new LocalSessionStoreAdapter(storage, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldCreateSessionWithPendingModelRuns() {
        store.createSession(session("s1", "gpt-5.1", "gpt-5.1-pro"));

        SessionMetadata stored = store.readSession("s1").orElseThrow();

        assertEquals(RunStatus.PENDING, stored.getStatus());
        assertEquals(List.of("gpt-5.1", "gpt-5.1-pro"), stored.getModels());
        assertEquals(RunStatus.PENDING, stored.getModelRuns().get("gpt-5.1-pro").getStatus());
        assertEquals(NOW, stored.getCreatedAt());
    }

    @Test
    void shouldReturnEmptyForUnknownSession() {
        assertEquals(Optional.empty(), store.readSession("missing"));
        assertEquals(Optional.empty(), store.readModelLog("missing", "gpt-5.1"));
    }

    @Test
    void shouldApplyModelRunTransitionsWithTimestamps() {
        store.createSession(session("s1", "gpt-5.1"));

        store.updateModelRun("s1", "gpt-5.1", ModelRunUpdate.status(RunStatus.RUNNING));
        store.updateModelRun("s1", "gpt-5.1", ModelRunUpdate.builder()
                .status(RunStatus.COMPLETED)
                .usage(new UsageSummary(10, 5, 0, 15, 0.001))
                .response(new ResponseMetadata("resp_1", "req_1", "completed", null))
                .logLocator("sessions/s1/models/gpt-5.1.log")
                .build());

        ModelRunState run = store.readSession("s1").orElseThrow().getModelRuns().get("gpt-5.1");
        assertEquals(RunStatus.COMPLETED, run.getStatus());
        assertEquals(NOW, run.getStartedAt());
        assertEquals(NOW, run.getCompletedAt());
        assertEquals(15, run.getUsage().totalTokens());
        assertEquals(0.001, run.getUsage().cost(), 1e-12);
        assertEquals("resp_1", run.getResponse().responseId());
        assertEquals("sessions/s1/models/gpt-5.1.log", run.getLogLocator());
    }

    @Test
    void shouldRecordAndClearSessionError() {
        store.createSession(session("s1", "gpt-5.1"));

        store.updateSession("s1", SessionUpdate.builder()
                .status(RunStatus.ERROR)
                .errorMessage("Connection lost")
                .errorCategory(ErrorCategory.TRANSPORT)
                .transportReason(TransportFailureReason.CONNECTION_LOST)
                .build());
        SessionMetadata failed = store.readSession("s1").orElseThrow();
        assertEquals(RunStatus.ERROR, failed.getStatus());
        assertEquals(ErrorCategory.TRANSPORT, failed.getErrorCategory());
        assertEquals(TransportFailureReason.CONNECTION_LOST, failed.getTransportReason());

        store.updateSession("s1", SessionUpdate.builder()
                .status(RunStatus.RUNNING)
                .clearError(true)
                .build());
        SessionMetadata retried = store.readSession("s1").orElseThrow();
        assertEquals(RunStatus.RUNNING, retried.getStatus());
        assertNull(retried.getErrorMessage());
        assertNull(retried.getErrorCategory());
        assertNull(retried.getTransportReason());
    }

    @Test
    void shouldRejectUpdateOfUnknownSession() {
        assertThrows(IllegalArgumentException.class,
                () -> store.updateSession("missing", SessionUpdate.status(RunStatus.RUNNING)));
    }

    @Test
    void shouldAppendToModelAndSessionLogs() {
        store.createSession(session("s1", "gpt-5.1-pro"));

        try (ModelLogWriter writer = store.createLogWriter("s1", "gpt-5.1-pro")) {
            writer.writeChunk("Hello ");
            writer.writeChunk("world");
            writer.writeLine("");
        }
        try (ModelLogWriter writer = store.createSessionLogWriter("s1")) {
            writer.writeLine("Calling gpt-5.1-pro: 1k tokens.");
        }

        assertEquals("Hello world\n", store.readModelLog("s1", "gpt-5.1-pro").orElseThrow());
        assertEquals("Calling gpt-5.1-pro: 1k tokens.\n", store.readSessionLog("s1").orElseThrow());
    }

    @Test
    void shouldDropWritesAfterClose() {
        store.createSession(session("s1", "gpt-5.1"));
        ModelLogWriter writer = store.createLogWriter("s1", "gpt-5.1");
        writer.writeLine("kept");
        writer.close();

        writer.writeLine("dropped");

        assertEquals("kept\n", store.readModelLog("s1", "gpt-5.1").orElseThrow());
    }

    @Test
    void shouldSanitizeModelNamesForLogFiles() {
        String sanitized = LocalSessionStoreAdapter.safeFileName("vendor/model 1");

        assertTrue(sanitized.matches("vendor_model_1-[0-9a-f]{8}"), sanitized);
        assertEquals(sanitized, LocalSessionStoreAdapter.safeFileName("vendor/model 1"));
        assertEquals("gpt-5.1-pro", LocalSessionStoreAdapter.safeFileName("gpt-5.1-pro"));
    }

    @Test
    void shouldKeepLogsApartForModelsThatSanitizeAlike() {
        store.createSession(session("s1", "a/b", "a_b"));
        try (ModelLogWriter slashed = store.createLogWriter("s1", "a/b");
                ModelLogWriter underscored = store.createLogWriter("s1", "a_b")) {
            slashed.writeLine("from slashed");
            underscored.writeLine("from underscored");
        }

        assertNotEquals(LocalSessionStoreAdapter.safeFileName("a/b"), LocalSessionStoreAdapter.safeFileName("a_b"));
        assertEquals("from slashed\n", store.readModelLog("s1", "a/b").orElseThrow());
        assertEquals("from underscored\n", store.readModelLog("s1", "a_b").orElseThrow());
    }

    @Test
    void shouldUseBoundedSetOfSessionLocks() {
        Set<Object> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int i = 0; i < 1000; i++) {
            distinct.add(store.lockFor("session-" + i));
        }

        assertSame(store.lockFor("session-7"), store.lockFor("session-7"));
        assertTrue(distinct.size() <= 64, "locks: " + distinct.size());
    }

    @Test
    void shouldListSessionsNewestFirst() {
        SessionMetadata older = session("older", "gpt-5.1");
        older.setCreatedAt(NOW.minusSeconds(60));
        SessionMetadata newer = session("newer", "gpt-5.1");
        newer.setCreatedAt(NOW);
        store.createSession(older);
        store.createSession(newer);
        store.createLogWriter("newer", "gpt-5.1").close();

        List<SessionMetadata> sessions = store.listSessions();

        assertEquals(List.of("newer", "older"), sessions.stream().map(SessionMetadata::getId).toList());
    }

    @Test
    void shouldAddModelRunForModelNotListedAtCreation() {
        store.createSession(session("s1", "gpt-5.1"));

        store.updateModelRun("s1", "gpt-5.1-codex", ModelRunUpdate.status(RunStatus.RUNNING));

        SessionMetadata stored = store.readSession("s1").orElseThrow();
        assertTrue(stored.getModels().contains("gpt-5.1-codex"));
        assertNotNull(stored.getModelRuns().get("gpt-5.1-codex").getStartedAt());
    }

    private static SessionMetadata session(String id, String... models) {
        return SessionMetadata.builder()
                .id(id)
                .prompt("Explain the difference between a mutex and a semaphore.")
                .models(new java.util.ArrayList<>(List.of(models)))
                .build();
    }
}
