package me.golemcore.agent.domain.service;

import me.golemcore.agent.domain.exception.SessionCancelledException;
import me.golemcore.agent.domain.exception.SessionNotFoundException;
import me.golemcore.agent.domain.exception.SessionTerminatedException;
import me.golemcore.agent.domain.loop.AgentLoop;
import me.golemcore.agent.domain.model.AgentFailure;
import me.golemcore.agent.domain.model.AgentSession;
import me.golemcore.agent.domain.model.ErrorKind;
import me.golemcore.agent.domain.model.SessionHandle;
import me.golemcore.agent.domain.model.SessionStatus;
import me.golemcore.agent.domain.model.TurnInput;
import me.golemcore.agent.domain.model.TurnResult;
import me.golemcore.agent.port.outbound.MemoryStorePort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentSessionServiceTest {

    private SessionRegistry sessionRegistry;
    private AgentLoop agentLoop;
    private MemoryStorePort memoryStore;
    private ExecutorService runner;
    private AgentSessionService service;

    @BeforeEach
    void setUp() {
        sessionRegistry = new SessionRegistry(Clock.systemUTC());
        agentLoop = mock(AgentLoop.class);
        memoryStore = mock(MemoryStorePort.class);
        runner = Executors.newSingleThreadExecutor();
        service = new AgentSessionService(sessionRegistry, agentLoop, memoryStore, runner);
    }

    @AfterEach
    void tearDown() {
        runner.shutdownNow();
    }

    @Test
    void shouldStartSessionAndRunLoopWithInitialInput() {
        when(agentLoop.run(any(AgentSession.class), any(TurnInput.class)))
                .thenAnswer(inv -> completed(inv.getArgument(0)));

        String sessionId = service.startSession("hello");

        assertNotNull(sessionId);
        AgentSession session = service.getSession(sessionId);
        verify(agentLoop).run(session, TurnInput.user("hello"));
        assertEquals(SessionStatus.COMPLETED, service.getStatus(sessionId));
        assertEquals("done", service.getResult(sessionId).getAnswer());
    }

    @Test
    void shouldStartSessionAsynchronously() throws Exception {
        when(agentLoop.run(any(AgentSession.class), any(TurnInput.class)))
                .thenAnswer(inv -> completed(inv.getArgument(0)));

        SessionHandle handle = service.startSessionAsync("hello");
        TurnResult result = handle.result().get(2, TimeUnit.SECONDS);

        assertTrue(result.isCompleted());
        assertEquals(handle.sessionId(), result.getSessionId());
        assertEquals(SessionStatus.COMPLETED, service.getStatus(handle.sessionId()));
    }

    @Test
    void shouldCancelSessionWhenAsyncStartIsCancelledMidRun() throws Exception {
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch sawCancellation = new CountDownLatch(1);
        when(agentLoop.run(any(AgentSession.class), any(TurnInput.class))).thenAnswer(inv -> {
            AgentSession session = inv.getArgument(0);
            running.countDown();
            if (session.getCancellationToken().sleep(Duration.ofSeconds(5))) {
                sawCancellation.countDown();
            }
            return TurnResult.of(session);
        });
        when(agentLoop.failIdle(any(AgentSession.class), any(SessionCancelledException.class))).thenReturn(false);

        SessionHandle handle = service.startSessionAsync("long job");
        AgentSession session = service.getSession(handle.sessionId());
        assertTrue(running.await(2, TimeUnit.SECONDS));

        assertTrue(handle.cancel());

        assertTrue(handle.result().isCancelled());
        assertTrue(session.getCancellationToken().isCancelled());
        assertTrue(sawCancellation.await(2, TimeUnit.SECONDS));
        verify(agentLoop).failIdle(eq(session), any(SessionCancelledException.class));
    }

    @Test
    void shouldFailQueuedSessionWhenAsyncStartIsCancelled() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        runner.submit(() -> {
            release.await();
            return null;
        });
        when(agentLoop.failIdle(any(AgentSession.class), any(SessionCancelledException.class))).thenReturn(true);

        SessionHandle handle = service.startSessionAsync("queued");
        handle.cancel();
        release.countDown();
        runner.shutdown();
        assertTrue(runner.awaitTermination(2, TimeUnit.SECONDS));

        AgentSession session = service.getSession(handle.sessionId());
        assertTrue(session.getCancellationToken().isCancelled());
        verify(agentLoop).failIdle(eq(session), any(SessionCancelledException.class));
        verify(agentLoop, never()).run(any(), any());
    }

    @Test
    void shouldContinueWaitingSession() {
        AgentSession session = sessionRegistry.create();
        when(agentLoop.run(eq(session), any(TurnInput.class))).thenAnswer(inv -> completed(session));

        TurnResult result = service.continueSession(session.getId(), "more");

        assertTrue(result.isCompleted());
        verify(agentLoop).run(session, TurnInput.user("more"));
    }

    @Test
    void shouldRejectContinueOnTerminalSession() {
        AgentSession session = sessionRegistry.create();
        session.fail(AgentFailure.of(ErrorKind.INTERNAL, "x"), Instant.now());

        assertThrows(SessionTerminatedException.class, () -> service.continueSession(session.getId(), "more"));
        verify(agentLoop, never()).run(any(), any());
    }

    @Test
    void shouldThrowNotFoundForUnknownSession() {
        assertThrows(SessionNotFoundException.class, () -> service.getStatus("nope"));
        assertThrows(SessionNotFoundException.class, () -> service.continueSession("nope", "x"));
        assertThrows(SessionNotFoundException.class, () -> service.cancelSession("nope"));
        assertThrows(SessionNotFoundException.class, () -> service.closeSession("nope"));
    }

    @Test
    void shouldSignalTokenAndFailIdleSessionOnCancel() {
        AgentSession session = sessionRegistry.create();
        when(agentLoop.failIdle(eq(session), any(SessionCancelledException.class))).thenReturn(true);

        service.cancelSession(session.getId());

        assertTrue(session.getCancellationToken().isCancelled());
        verify(agentLoop).failIdle(eq(session), any(SessionCancelledException.class));
    }

    @Test
    void shouldIgnoreCancelOfTerminalSession() {
        AgentSession session = sessionRegistry.create();
        session.fail(AgentFailure.of(ErrorKind.INTERNAL, "x"), Instant.now());

        service.cancelSession(session.getId());

        assertFalse(session.getCancellationToken().isCancelled());
        verify(agentLoop, never()).failIdle(any(), any());
    }

    @Test
    void shouldCloseSessionAndDeleteMemory() {
        AgentSession session = sessionRegistry.create();

        service.closeSession(session.getId());

        assertTrue(session.getCancellationToken().isCancelled());
        assertTrue(sessionRegistry.find(session.getId()).isEmpty());
        verify(memoryStore).delete(session.getId());
        assertThrows(SessionNotFoundException.class, () -> service.getStatus(session.getId()));
    }

    private static TurnResult completed(AgentSession session) {
        session.transitionTo(SessionStatus.REASONING, Instant.now());
        session.complete("done", Instant.now());
        return TurnResult.of(session);
    }
}
