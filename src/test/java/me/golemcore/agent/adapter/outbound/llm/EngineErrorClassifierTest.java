package me.golemcore.agent.adapter.outbound.llm;

import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.ContentFilteredException;
import dev.langchain4j.exception.InternalServerException;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.exception.TimeoutException;
import me.golemcore.agent.domain.exception.AgentException;
import me.golemcore.agent.domain.exception.EngineRejectedException;
import me.golemcore.agent.domain.exception.EngineUnavailableException;
import me.golemcore.agent.domain.exception.ToolFailureException;
import me.golemcore.agent.domain.model.ErrorKind;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class EngineErrorClassifierTest {

    @Test
    void shouldClassifyWrappedRateLimitAsTransient() {
        Throwable throwable = new CompletionException(
                new RuntimeException("wrapper", new RateLimitException("too many requests")));

        String code = EngineErrorClassifier.classify(throwable);

        assertEquals(EngineErrorClassifier.RATE_LIMIT, code);
        assertTrue(EngineErrorClassifier.isTransientCode(code));
    }

    @Test
    void shouldClassifyLangchain4jExceptions() {
        assertEquals(EngineErrorClassifier.TIMEOUT, EngineErrorClassifier.classify(new TimeoutException("timeout")));
        assertEquals(EngineErrorClassifier.INTERNAL_SERVER,
                EngineErrorClassifier.classify(new InternalServerException("internal")));
        assertEquals(EngineErrorClassifier.RETRIABLE,
                EngineErrorClassifier.classify(new RetriableException("retry")));
        assertEquals(EngineErrorClassifier.AUTHENTICATION,
                EngineErrorClassifier.classify(new AuthenticationException("auth")));
        assertEquals(EngineErrorClassifier.INVALID_REQUEST,
                EngineErrorClassifier.classify(new InvalidRequestException("invalid")));
        assertEquals(EngineErrorClassifier.MODEL_NOT_FOUND,
                EngineErrorClassifier.classify(new ModelNotFoundException("not-found")));
        assertEquals(EngineErrorClassifier.CONTENT_FILTERED,
                EngineErrorClassifier.classify(new ContentFilteredException("filtered")));
    }

    @Test
    void shouldClassifyNetworkFailuresAsTransient() {
        assertEquals(EngineErrorClassifier.TIMEOUT,
                EngineErrorClassifier.classify(new RuntimeException(new SocketTimeoutException("read"))));
        assertEquals(EngineErrorClassifier.CONNECTION,
                EngineErrorClassifier.classify(new RuntimeException(new ConnectException("refused"))));
    }

    @Test
    void shouldNotTrustFreeFormMessages() {
        assertEquals(EngineErrorClassifier.UNKNOWN,
                EngineErrorClassifier.classify(new RuntimeException("rate limit exceeded")));
        assertEquals(EngineErrorClassifier.UNKNOWN, EngineErrorClassifier.classify(null));
    }

    @Test
    void shouldMapTransientFailuresToEngineUnavailable() {
        AgentException error = EngineErrorClassifier.toAgentException(new RateLimitException("slow down"));

        assertInstanceOf(EngineUnavailableException.class, error);
        assertEquals(ErrorKind.ENGINE_UNAVAILABLE, error.getKind());
        assertTrue(error.isRetryable());
        assertEquals("[engine.rate_limit] slow down", error.getMessage());
    }

    @Test
    void shouldMapOtherFailuresToEngineRejected() {
        AgentException rejected = EngineErrorClassifier.toAgentException(new InvalidRequestException("bad prompt"));
        AgentException unknown = EngineErrorClassifier.toAgentException(new IllegalStateException("weird"));

        assertInstanceOf(EngineRejectedException.class, rejected);
        assertFalse(rejected.isRetryable());
        assertEquals(ErrorKind.ENGINE_REJECTED, unknown.getKind());
    }

    @Test
    void shouldPassThroughAgentExceptions() {
        ToolFailureException original = new ToolFailureException("t", "already classified");

        assertSame(original, EngineErrorClassifier.toAgentException(original));
    }

    @Test
    void shouldPrefixCodeOnce() {
        assertEquals("[engine.timeout]", EngineErrorClassifier.withCode(EngineErrorClassifier.TIMEOUT, null));
        assertEquals("[engine.timeout] slow", EngineErrorClassifier.withCode(EngineErrorClassifier.TIMEOUT, "slow"));
    }
}
