package com.ryuqq.analysis.core.model;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * 검증 캐시 키 ({@code validation_<해시 접두사 12자리>}).
 *
 * <p>키는 framework ‖ experiment ‖ corpus ‖ model 순서로 이어 붙인 전체 내용의
 * SHA-256에서 만들어집니다. 파일 경로, 이름, 시각은 포함되지 않습니다.</p>
 *
 * <p>각 입력 앞에 8바이트 길이를 붙여 해시하므로, 필드 경계를 넘어 바이트를
 * 옮긴 입력도 다른 키가 됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CacheKey {

    /**
     * 키 접두사.
     */
    public static final String PREFIX = "validation_";

    /**
     * 키에 사용하는 해시 길이 (16진수 자릿수).
     */
    public static final int HASH_LENGTH = 12;

    private final String value;

    private CacheKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CacheKey cannot be null or blank");
        }
        if (!value.matches("^" + PREFIX + "[0-9a-f]{" + HASH_LENGTH + "}$")) {
            throw new IllegalArgumentException("CacheKey must match '" + PREFIX + "<12 hex>' (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * 저장된 문자열로부터 CacheKey 복원.
     *
     * @param value {@code validation_xxxxxxxxxxxx} 형식
     * @return CacheKey 인스턴스
     * @throws IllegalArgumentException 형식이 잘못된 경우
     */
    public static CacheKey of(String value) {
        return new CacheKey(value);
    }

    /**
     * 네 입력의 전체 내용으로부터 캐시 키 계산.
     *
     * @param framework 프레임워크 내용
     * @param experiment 실험 정의 내용
     * @param corpus 코퍼스 내용
     * @param model 검증을 수행할 모델
     * @return 결정적 CacheKey
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public static CacheKey derive(byte[] framework, byte[] experiment, byte[] corpus, ModelId model) {
        if (framework == null || experiment == null || corpus == null) {
            throw new IllegalArgumentException("framework, experiment and corpus cannot be null");
        }
        if (model == null) {
            throw new IllegalArgumentException("model cannot be null");
        }

        MessageDigest digest = ContentHash.newDigest();
        update(digest, framework);
        update(digest, experiment);
        update(digest, corpus);
        update(digest, model.getValue().getBytes(StandardCharsets.UTF_8));

        String hex = HexFormat.of().formatHex(digest.digest());
        return new CacheKey(PREFIX + hex.substring(0, HASH_LENGTH));
    }

    private static void update(MessageDigest digest, byte[] field) {
        digest.update(ByteBuffer.allocate(Long.BYTES).putLong(field.length).array());
        digest.update(field);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CacheKey cacheKey = (CacheKey) o;
        return value.equals(cacheKey.value);
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
