package com.ryuqq.analysis.core.model;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 콘텐츠 주소(SHA-256 해시).
 *
 * <p>Artifact의 식별자이며, 같은 바이트열은 언제나 같은 ContentHash를 가집니다.
 * 파일 경로나 생성 시각과 무관한 순수 함수입니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>64자리 소문자 16진수</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ContentHash {

    private static final String ALGORITHM = "SHA-256";
    private static final HexFormat HEX = HexFormat.of();

    private final String value;

    private ContentHash(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ContentHash cannot be null or blank");
        }
        if (!value.matches("^[0-9a-f]{64}$")) {
            throw new IllegalArgumentException("ContentHash must be 64 lowercase hex characters (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * 16진수 문자열로부터 ContentHash 생성.
     *
     * @param value 64자리 소문자 16진수
     * @return ContentHash 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ContentHash of(String value) {
        return new ContentHash(value);
    }

    /**
     * 바이트열의 SHA-256 해시 계산.
     *
     * @param bytes 원본 바이트열
     * @return 계산된 ContentHash
     * @throws IllegalArgumentException bytes가 null인 경우
     */
    public static ContentHash digest(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        return new ContentHash(HEX.formatHex(newDigest().digest(bytes)));
    }

    /**
     * SHA-256 MessageDigest 생성.
     *
     * <p>여러 필드를 이어서 해시해야 하는 호출자(CacheKey 등)가 사용합니다.</p>
     *
     * @return 새 MessageDigest 인스턴스
     */
    public static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available in this JVM", e);
        }
    }

    /**
     * 해시 앞부분 조회.
     *
     * @param length 접두사 길이 (1 ~ 64)
     * @return 해시 접두사
     */
    public String prefix(int length) {
        if (length <= 0 || length > value.length()) {
            throw new IllegalArgumentException("length must be between 1 and 64 (current: " + length + ")");
        }
        return value.substring(0, length);
    }

    /**
     * 해시 값 조회.
     *
     * @return 64자리 16진수 문자열
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ContentHash that = (ContentHash) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ContentHash{" + value.substring(0, 12) + '}';
    }
}
