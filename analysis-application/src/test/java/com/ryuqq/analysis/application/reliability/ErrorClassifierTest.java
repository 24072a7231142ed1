package com.ryuqq.analysis.application.reliability;

import com.ryuqq.analysis.core.exception.ProviderErrorType;
import com.ryuqq.analysis.core.exception.TerminalProviderException;
import com.ryuqq.analysis.core.model.ModelId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "HTTP 429 Too Many Requests|RATE_LIMIT",
        "Rate limit reached for requests|RATE_LIMIT",
        "401 Unauthorized|AUTHENTICATION",
        "403 Forbidden|AUTHENTICATION",
        "Invalid API key provided|AUTHENTICATION",
        "500 Internal Server Error|SERVER_ERROR",
        "502 Bad Gateway|SERVER_ERROR",
        "503 Service Unavailable|SERVER_ERROR",
        "Model is overloaded, try again|OVERLOADED",
        "Request timed out|TIMEOUT",
        "400 Bad Request: prompt too long|MALFORMED_REQUEST",
        "Connection reset by peer|NETWORK",
        "something odd happened|UNKNOWN"
    })
    void classifyMessage_MapsKnownPatterns(String message, ProviderErrorType expected) {
        assertEquals(expected, classifier.classifyMessage(message));
    }

    @Test
    void classify_ProviderException_UsesDeclaredType() {
        TerminalProviderException exception = new TerminalProviderException(
            ModelId.of("openai/gpt"), ProviderErrorType.MALFORMED_REQUEST, "500 in message is ignored");

        assertEquals(ProviderErrorType.MALFORMED_REQUEST, classifier.classify(exception));
    }

    @Test
    void classify_ExceptionTypes_MapWithoutMessage() {
        assertEquals(ProviderErrorType.TIMEOUT, classifier.classify(new TimeoutException()));
        assertEquals(ProviderErrorType.TIMEOUT, classifier.classify(new SocketTimeoutException()));
        assertEquals(ProviderErrorType.NETWORK, classifier.classify(new ConnectException()));
        assertEquals(ProviderErrorType.NETWORK, classifier.classify(new IOException("eof")));
        assertEquals(ProviderErrorType.UNKNOWN, classifier.classify(null));
    }

    @Test
    void classify_WrappedCause_UsesCauseMessage() {
        RuntimeException wrapped = new RuntimeException("call failed", new IllegalStateException("HTTP 503"));

        assertEquals(ProviderErrorType.SERVER_ERROR, classifier.classify(wrapped));
    }

    @Test
    void retryable_MatchesErrorType() {
        assertTrue(ProviderErrorType.RATE_LIMIT.isRetryable());
        assertTrue(ProviderErrorType.OVERLOADED.isRetryable());
        assertFalse(ProviderErrorType.AUTHENTICATION.isRetryable());
        assertFalse(ProviderErrorType.UNKNOWN.isRetryable());
    }
}
