package me.golemcore.agent.adapter.outbound.llm;

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

import me.golemcore.agent.domain.exception.AgentException;
import me.golemcore.agent.domain.exception.EngineRejectedException;
import me.golemcore.agent.domain.exception.EngineUnavailableException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Stable, machine-readable classification of reasoning engine failures.
 *
 * <p>
 * Classification walks the cause chain and matches structured exception
 * types. langchain4j exceptions are matched by class name, so the classifier
 * keeps working when a provider module wraps them.
 */
public final class EngineErrorClassifier {

    public static final String RATE_LIMIT = "engine.rate_limit";
    public static final String TIMEOUT = "engine.timeout";
    public static final String INTERNAL_SERVER = "engine.internal_server";
    public static final String RETRIABLE = "engine.retriable";
    public static final String CONNECTION = "engine.connection";
    public static final String AUTHENTICATION = "engine.authentication";
    public static final String INVALID_REQUEST = "engine.invalid_request";
    public static final String MODEL_NOT_FOUND = "engine.model_not_found";
    public static final String CONTENT_FILTERED = "engine.content_filtered";
    public static final String UNSUPPORTED_FEATURE = "engine.unsupported_feature";
    public static final String NON_RETRIABLE = "engine.non_retriable";
    public static final String UNKNOWN = "engine.error.unknown";

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_RATE_LIMIT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException";
    private static final String CLASS_TIMEOUT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException";
    private static final String CLASS_INTERNAL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InternalServerException";
    private static final String CLASS_RETRIABLE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RetriableException";
    private static final String CLASS_AUTHENTICATION_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "AuthenticationException";
    private static final String CLASS_INVALID_REQUEST_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InvalidRequestException";
    private static final String CLASS_MODEL_NOT_FOUND_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ModelNotFoundException";
    private static final String CLASS_CONTENT_FILTERED_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ContentFilteredException";
    private static final String CLASS_UNSUPPORTED_FEATURE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "UnsupportedFeatureException";
    private static final String CLASS_NON_RETRIABLE_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "NonRetriableException";

    private EngineErrorClassifier() {
    }

    /**
     * Classify an engine failure based on structured throwable types/cause chain.
     */
    public static String classify(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);
            String byType = classifyKnownThrowable(current);
            if (!UNKNOWN.equals(byType)) {
                return byType;
            }
            current = current.getCause();
        }
        return UNKNOWN;
    }

    public static boolean isTransientCode(String code) {
        return RATE_LIMIT.equals(code)
                || TIMEOUT.equals(code)
                || INTERNAL_SERVER.equals(code)
                || RETRIABLE.equals(code)
                || CONNECTION.equals(code);
    }

    /**
     * Maps a provider failure onto the orchestrator's error taxonomy. Transient
     * codes become {@link EngineUnavailableException}; everything else,
     * unknown failures included, is a rejection.
     */
    public static AgentException toAgentException(Throwable throwable) {
        if (throwable instanceof AgentException agentException) {
            return agentException;
        }
        String code = classify(throwable);
        String message = withCode(code, throwable.getMessage());
        if (isTransientCode(code)) {
            return new EngineUnavailableException(message, throwable);
        }
        return new EngineRejectedException(message, throwable);
    }

    /**
     * Prefix a human diagnostic with a machine-readable code.
     */
    public static String withCode(String code, String message) {
        if (message == null || message.isBlank()) {
            return "[" + code + "]";
        }
        return "[" + code + "] " + message;
    }

    private static String classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return TIMEOUT;
        }
        String className = throwable.getClass().getName();
        if (className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return classifyLangchain4j(className);
        }
        if (throwable instanceof IOException) {
            return CONNECTION;
        }
        return UNKNOWN;
    }

    private static String classifyLangchain4j(String className) {
        return switch (className) {
        case CLASS_RATE_LIMIT_EXCEPTION -> RATE_LIMIT;
        case CLASS_TIMEOUT_EXCEPTION -> TIMEOUT;
        case CLASS_INTERNAL_SERVER_EXCEPTION -> INTERNAL_SERVER;
        case CLASS_RETRIABLE_EXCEPTION -> RETRIABLE;
        case CLASS_AUTHENTICATION_EXCEPTION -> AUTHENTICATION;
        case CLASS_INVALID_REQUEST_EXCEPTION -> INVALID_REQUEST;
        case CLASS_MODEL_NOT_FOUND_EXCEPTION -> MODEL_NOT_FOUND;
        case CLASS_CONTENT_FILTERED_EXCEPTION -> CONTENT_FILTERED;
        case CLASS_UNSUPPORTED_FEATURE_EXCEPTION -> UNSUPPORTED_FEATURE;
        case CLASS_NON_RETRIABLE_EXCEPTION -> NON_RETRIABLE;
        default -> UNKNOWN;
        };
    }
}
