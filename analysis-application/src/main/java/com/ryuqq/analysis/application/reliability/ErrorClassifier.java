package com.ryuqq.analysis.application.reliability;

import com.ryuqq.analysis.core.exception.ProviderErrorType;
import com.ryuqq.analysis.core.exception.ProviderException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Provider 오류 분류기.
 *
 * <p>Gateway가 타입이 있는 {@link ProviderException}을 던지면 그 분류를 그대로 사용하고,
 * 그 외 예외는 타입과 메시지로 판단합니다. 판단할 수 없으면 UNKNOWN(재시도 안 함)입니다.</p>
 *
 * <p><strong>메시지 규칙 (우선순위 순):</strong></p>
 * <ol>
 *   <li>429, "rate limit", "quota", "too many requests" → RATE_LIMIT</li>
 *   <li>401, 403, "unauthorized", "forbidden", "api key" → AUTHENTICATION</li>
 *   <li>"timeout", "timed out", "deadline" → TIMEOUT</li>
 *   <li>"overloaded", "capacity", "temporarily unavailable" → OVERLOADED</li>
 *   <li>5xx, "internal server error", "bad gateway", "service unavailable" → SERVER_ERROR</li>
 *   <li>400, 422, "bad request", "invalid request", "malformed" → MALFORMED_REQUEST</li>
 *   <li>"connection reset", "connection refused", "network" → NETWORK</li>
 * </ol>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ErrorClassifier {

    private static final Pattern RATE_LIMIT = Pattern.compile("\\b429\\b|rate[ _-]?limit|quota|too many requests");
    private static final Pattern AUTHENTICATION = Pattern.compile("\\b40[13]\\b|unauthori[sz]ed|forbidden|authenticat|api[ _-]?key|permission denied");
    private static final Pattern TIMEOUT = Pattern.compile("time[ _-]?out|timed out|deadline");
    private static final Pattern OVERLOADED = Pattern.compile("overload|capacity|temporarily unavailable");
    private static final Pattern SERVER_ERROR = Pattern.compile("\\b5\\d\\d\\b|internal server error|bad gateway|service unavailable|gateway timeout");
    private static final Pattern MALFORMED = Pattern.compile("\\b4(00|22)\\b|bad request|invalid request|malformed|invalid_request");
    private static final Pattern NETWORK = Pattern.compile("connection (reset|refused|closed)|network|broken pipe|unreachable");

    /**
     * 예외 분류.
     *
     * @param throwable 발생한 예외
     * @return 분류 결과 (null이면 UNKNOWN)
     */
    public ProviderErrorType classify(Throwable throwable) {
        if (throwable == null) {
            return ProviderErrorType.UNKNOWN;
        }
        if (throwable instanceof ProviderException providerException) {
            return providerException.getErrorType();
        }
        if (throwable instanceof TimeoutException
            || throwable instanceof SocketTimeoutException
            || throwable instanceof HttpTimeoutException) {
            return ProviderErrorType.TIMEOUT;
        }
        if (throwable instanceof ConnectException) {
            return ProviderErrorType.NETWORK;
        }

        ProviderErrorType byMessage = classifyMessage(throwable.getMessage());
        if (byMessage != ProviderErrorType.UNKNOWN) {
            return byMessage;
        }
        if (throwable.getCause() != null && throwable.getCause() != throwable) {
            return classify(throwable.getCause());
        }
        return throwable instanceof IOException ? ProviderErrorType.NETWORK : ProviderErrorType.UNKNOWN;
    }

    /**
     * 메시지만으로 분류.
     *
     * @param message 오류 메시지
     * @return 분류 결과
     */
    public ProviderErrorType classifyMessage(String message) {
        if (message == null || message.isBlank()) {
            return ProviderErrorType.UNKNOWN;
        }
        String text = message.toLowerCase(Locale.ROOT);
        if (RATE_LIMIT.matcher(text).find()) {
            return ProviderErrorType.RATE_LIMIT;
        }
        if (AUTHENTICATION.matcher(text).find()) {
            return ProviderErrorType.AUTHENTICATION;
        }
        if (TIMEOUT.matcher(text).find()) {
            return ProviderErrorType.TIMEOUT;
        }
        if (OVERLOADED.matcher(text).find()) {
            return ProviderErrorType.OVERLOADED;
        }
        if (SERVER_ERROR.matcher(text).find()) {
            return ProviderErrorType.SERVER_ERROR;
        }
        if (MALFORMED.matcher(text).find()) {
            return ProviderErrorType.MALFORMED_REQUEST;
        }
        if (NETWORK.matcher(text).find()) {
            return ProviderErrorType.NETWORK;
        }
        return ProviderErrorType.UNKNOWN;
    }
}
