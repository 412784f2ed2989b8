package me.golemcore.consult.domain.service;

import me.golemcore.consult.domain.exception.PromptValidationException;
import me.golemcore.consult.domain.model.BackendResponse;
import me.golemcore.consult.domain.model.ModelExecutionOutcome;
import me.golemcore.consult.domain.model.ModelRequest;
import me.golemcore.consult.domain.model.ModelRunResult;
import me.golemcore.consult.domain.model.ModelRunUpdate;
import me.golemcore.consult.domain.model.MultiModelRunSummary;
import me.golemcore.consult.domain.model.RunStatus;
import me.golemcore.consult.domain.model.UsageSummary;
import me.golemcore.consult.port.outbound.RunOutput;
import me.golemcore.consult.port.outbound.SessionStorePort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MultiModelOrchestratorTest {

    private static final String SESSION_ID = "session-1";
    private static final ModelRequest REQUEST = ModelRequest.builder()
            .prompt("Compare optimistic and pessimistic locking for our order service.")
            .build();

    private ConsultRunService runService;
    private SessionStorePort sessionStore;
    private ExecutorService executorService;
    private Map<String, InMemoryLogWriter> logWriters;
    private MultiModelOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        runService = mock(ConsultRunService.class);
        sessionStore = mock(SessionStorePort.class);
        executorService = Executors.newFixedThreadPool(4);
        logWriters = new ConcurrentHashMap<>();
        when(sessionStore.createLogWriter(eq(SESSION_ID), anyString())).thenAnswer(invocation -> {
            String model = invocation.getArgument(1);
            return logWriters.computeIfAbsent(model, key -> new InMemoryLogWriter("sessions/" + key + ".log"));
        });
        orchestrator = new MultiModelOrchestrator(runService, sessionStore, executorService, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    @Test
    void shouldPartitionEveryRequestedModelExactlyOnce() {
        when(runService.runSingleModel(any(), any())).thenAnswer(invocation -> {
            ModelRequest request = invocation.getArgument(0);
            if ("b".equals(request.getModel())) {
                throw new IllegalStateException("b exploded");
            }
            return result(request.getModel());
        });

        MultiModelRunSummary summary = orchestrator.runMultiModel(SESSION_ID, REQUEST,
                List.of("a", "b", "a", " c "), null);

        Set<String> settled = Stream.concat(
                summary.fulfilled().stream().map(ModelExecutionOutcome::model),
                summary.rejected().stream().map(ModelExecutionOutcome::model))
                .collect(Collectors.toSet());
        assertEquals(3, summary.fulfilled().size() + summary.rejected().size());
        assertEquals(Set.of("a", "b", "c"), settled);
        verify(runService, times(3)).runSingleModel(any(), any());
    }

    @Test
    void shouldNotifyListenerInCompletionOrder() {
        CountDownLatch fastDone = new CountDownLatch(1);
        when(runService.runSingleModel(argThat(request -> request != null && "slow".equals(request.getModel())),
                any())).thenAnswer(invocation -> {
                    assertTrue(fastDone.await(5, TimeUnit.SECONDS));
                    return result("slow");
                });
        when(runService.runSingleModel(argThat(request -> request != null && "fast".equals(request.getModel())),
                any())).thenReturn(result("fast"));

        List<String> order = Collections.synchronizedList(new ArrayList<>());
        orchestrator.runMultiModel(SESSION_ID, REQUEST, List.of("slow", "fast"), outcome -> {
            order.add(outcome.model());
            if ("fast".equals(outcome.model())) {
                fastDone.countDown();
            }
        });

        assertEquals(List.of("fast", "slow"), order);
    }

    @Test
    void shouldIsolateFailingModelAndReportErrorState() {
        when(runService.runSingleModel(any(), any())).thenAnswer(invocation -> {
            ModelRequest request = invocation.getArgument(0);
            if ("model-2".equals(request.getModel())) {
                throw new PromptValidationException("Prompt is too short (<20 chars).");
            }
            return result(request.getModel());
        });

        MultiModelRunSummary summary = orchestrator.runMultiModel(SESSION_ID, REQUEST,
                List.of("model-1", "model-2", "model-3"), null);

        assertEquals(1, summary.rejected().size());
        assertEquals("model-2", summary.rejected().get(0).model());
        assertInstanceOf(PromptValidationException.class, summary.rejected().get(0).reason());
        assertEquals(Set.of("model-1", "model-3"), summary.fulfilled().stream()
                .map(ModelExecutionOutcome::model)
                .collect(Collectors.toSet()));

        List<RunStatus> statuses = new ArrayList<>();
        summary.fulfilled().forEach(outcome -> statuses.add(RunStatus.COMPLETED));
        summary.rejected().forEach(outcome -> statuses.add(RunStatus.ERROR));
        assertEquals(RunStatus.ERROR, RunStatus.aggregate(statuses));

        verify(sessionStore).updateModelRun(eq(SESSION_ID), eq("model-2"),
                argThat(update -> update.getStatus() == RunStatus.ERROR
                        && "Prompt is too short (<20 chars).".equals(update.getErrorMessage())));
        assertTrue(logWriters.get("model-2").content().contains("ERROR: Prompt is too short (<20 chars)."));
        assertTrue(logWriters.values().stream().allMatch(InMemoryLogWriter::isClosed));
    }

    @Test
    void shouldMarkAllModelsRunningBeforeDispatch() {
        when(runService.runSingleModel(any(), any())).thenAnswer(invocation -> result(
                ((ModelRequest) invocation.getArgument(0)).getModel()));

        orchestrator.runMultiModel(SESSION_ID, REQUEST, List.of("a", "b"), null);

        InOrder inOrder = inOrder(sessionStore, runService);
        inOrder.verify(sessionStore).updateModelRun(eq(SESSION_ID), eq("a"), argThat(this::isRunning));
        inOrder.verify(sessionStore).updateModelRun(eq(SESSION_ID), eq("b"), argThat(this::isRunning));
        inOrder.verify(runService, atLeastOnce()).runSingleModel(any(), any());
    }

    @Test
    void shouldDispatchWithSharedOutputSuppressed() {
        when(runService.runSingleModel(any(), any())).thenAnswer(invocation -> result(
                ((ModelRequest) invocation.getArgument(0)).getModel()));

        orchestrator.runMultiModel(SESSION_ID, REQUEST, List.of("a", "b"), null);

        ArgumentCaptor<ModelRequest> captor = ArgumentCaptor.forClass(ModelRequest.class);
        verify(runService, times(2)).runSingleModel(captor.capture(), any(RunOutput.class));
        assertTrue(captor.getAllValues().stream().allMatch(request -> request.isSuppressHeader()
                && request.isSuppressAnswerHeader()
                && request.isSuppressTips()));
    }

    @Test
    void shouldRecordCompletedRunWithUsageAndLogLocation() {
        when(runService.runSingleModel(any(), any())).thenReturn(result("a"));

        MultiModelRunSummary summary = orchestrator.runMultiModel(SESSION_ID, REQUEST, List.of("a"), null);

        assertEquals("sessions/a.log", summary.fulfilled().get(0).logLocator());
        assertEquals("answer from a", summary.fulfilled().get(0).answerText());
        verify(sessionStore).updateModelRun(eq(SESSION_ID), eq("a"),
                argThat(update -> update.getStatus() == RunStatus.COMPLETED
                        && update.getUsage() != null
                        && "sessions/a.log".equals(update.getLogLocator())));
    }

    @Test
    void shouldSurviveFailingListener() {
        when(runService.runSingleModel(any(), any())).thenAnswer(invocation -> result(
                ((ModelRequest) invocation.getArgument(0)).getModel()));

        MultiModelRunSummary summary = orchestrator.runMultiModel(SESSION_ID, REQUEST, List.of("a", "b"),
                outcome -> {
                    throw new IllegalStateException("listener broke");
                });

        assertEquals(2, summary.fulfilled().size());
    }

    @Test
    void shouldRejectEmptyModelList() {
        assertThrows(IllegalArgumentException.class,
                () -> orchestrator.runMultiModel(SESSION_ID, REQUEST, List.of(" "), null));
    }

    private boolean isRunning(ModelRunUpdate update) {
        return update != null && update.getStatus() == RunStatus.RUNNING && update.isClearError();
    }

    private static ModelRunResult result(String model) {
        return new ModelRunResult.Streamed(new UsageSummary(10, 5, 0, 15, 0.01), 25,
                BackendResponse.completedText("resp-" + model, "answer from " + model, null));
    }
}
