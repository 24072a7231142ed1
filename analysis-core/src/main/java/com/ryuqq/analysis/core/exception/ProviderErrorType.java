package com.ryuqq.analysis.core.exception;

/**
 * Provider 오류 분류.
 *
 * <p>재시도 가능 여부와 대기 정책을 결정하는 기준입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ProviderErrorType {

    /** 429 또는 quota 초과. 고정 장기 대기 후 재시도. */
    RATE_LIMIT(true),

    /** 호출 deadline 초과. */
    TIMEOUT(true),

    /** 5xx 응답. */
    SERVER_ERROR(true),

    /** 모델 과부하 또는 일시적 사용 불가. */
    OVERLOADED(true),

    /** 연결 실패 등 네트워크 오류. */
    NETWORK(true),

    /** 인증 또는 권한 오류. */
    AUTHENTICATION(false),

    /** 잘못된 요청 (스키마 오류, 입력 초과 등). */
    MALFORMED_REQUEST(false),

    /** 분류 불가. 재시도하지 않음. */
    UNKNOWN(false);

    private final boolean retryable;

    ProviderErrorType(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
