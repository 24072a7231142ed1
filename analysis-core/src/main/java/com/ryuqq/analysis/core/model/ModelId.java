package com.ryuqq.analysis.core.model;

/**
 * 모델 식별자 ({@code provider/model} 형식).
 *
 * <p>Circuit Breaker, 재시도 통계, 캐시 키가 모두 이 값을 기준으로 분리됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ModelId {

    private final String value;

    private ModelId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ModelId cannot be null or blank");
        }
        int slash = value.indexOf('/');
        if (slash <= 0 || slash == value.length() - 1) {
            throw new IllegalArgumentException("ModelId must be in 'provider/model' form (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * ModelId 생성.
     *
     * @param value {@code provider/model} 형식 문자열 (예: "anthropic/claude-sonnet")
     * @return ModelId 인스턴스
     * @throws IllegalArgumentException 형식이 잘못된 경우
     */
    public static ModelId of(String value) {
        return new ModelId(value);
    }

    /**
     * Provider 이름 조회 (슬래시 앞부분).
     */
    public String provider() {
        return value.substring(0, value.indexOf('/'));
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ModelId modelId = (ModelId) o;
        return value.equals(modelId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
