package me.golemcore.agent.domain.loop;

import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void shouldGrowBackoffExponentially() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(100), 2.0, Duration.ofSeconds(10));

        assertEquals(Duration.ZERO, policy.backoffBefore(1));
        assertEquals(Duration.ofMillis(100), policy.backoffBefore(2));
        assertEquals(Duration.ofMillis(200), policy.backoffBefore(3));
        assertEquals(Duration.ofMillis(400), policy.backoffBefore(4));
    }

    @Test
    void shouldCapBackoff() {
        RetryPolicy policy = new RetryPolicy(10, Duration.ofMillis(100), 3.0, Duration.ofMillis(500));

        assertEquals(Duration.ofMillis(500), policy.backoffBefore(5));
        assertEquals(Duration.ofMillis(500), policy.backoffBefore(9));
    }

    @Test
    void shouldRejectInvalidSettings() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(0, Duration.ZERO, 2.0, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(3, Duration.ZERO, 0.5, Duration.ZERO));
    }

    @Test
    void shouldBuildFromProperties() {
        AgentProperties.RetryProperties properties = new AgentProperties.RetryProperties();
        properties.setMaxAttempts(4);
        properties.setInitialBackoff(Duration.ofMillis(50));

        RetryPolicy policy = RetryPolicy.from(properties);

        assertEquals(4, policy.maxAttempts());
        assertEquals(Duration.ofMillis(50), policy.backoffBefore(2));
        assertEquals(2, policy.withMaxAttempts(2).maxAttempts());
        assertEquals(1, RetryPolicy.noRetry().maxAttempts());
    }
}
