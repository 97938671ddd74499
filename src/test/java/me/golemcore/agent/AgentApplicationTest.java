package me.golemcore.agent;

import me.golemcore.agent.domain.model.ErrorKind;
import me.golemcore.agent.domain.model.SessionStatus;
import me.golemcore.agent.domain.model.TurnResult;
import me.golemcore.agent.domain.tool.ToolRegistry;
import me.golemcore.agent.port.inbound.AgentSessionPort;
import me.golemcore.agent.port.outbound.ReasoningEnginePort;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "agent.engine.retry.max-attempts=1",
        "agent.session.ttl=0s"
})
class AgentApplicationTest {

    @Autowired
    private AgentSessionPort sessionPort;

    @Autowired
    private ToolRegistry toolRegistry;

    @Autowired
    private ReasoningEnginePort reasoningEngine;

    @Test
    void shouldWireBuiltInTools() {
        assertTrue(toolRegistry.contains("datetime"));
        assertTrue(toolRegistry.contains("memory_recall"));
        assertEquals("none", reasoningEngine.getEngineId());
    }

    @Test
    void shouldFailSessionWhenNoEngineConfigured() {
        String sessionId = sessionPort.startSession("hello");

        TurnResult result = sessionPort.getResult(sessionId);
        assertEquals(SessionStatus.FAILED, result.getStatus());
        assertEquals(ErrorKind.ENGINE_UNAVAILABLE, result.getFailure().kind());
        assertEquals(1, result.getTurnCount());

        sessionPort.closeSession(sessionId);
    }
}
