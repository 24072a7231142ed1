package com.ryuqq.analysis.core.model;

import java.time.Instant;
import java.util.Arrays;

/**
 * 불변 콘텐츠 주소 Blob.
 *
 * <p>캐시된 검증 결과, 문서별 분석 결과, 종합 결과 등 파이프라인이 만드는
 * 모든 산출물은 Artifact로 저장되고 해시로만 참조됩니다.</p>
 *
 * <p><strong>불변식:</strong> {@code hash == ContentHash.digest(bytes)}</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Artifact {

    private final ContentHash hash;
    private final byte[] bytes;
    private final Instant createdAt;

    private Artifact(ContentHash hash, byte[] bytes, Instant createdAt) {
        this.hash = hash;
        this.bytes = bytes;
        this.createdAt = createdAt;
    }

    /**
     * 바이트열로부터 Artifact 생성 (해시는 자동 계산).
     *
     * @param bytes 원본 바이트열
     * @param createdAt 최초 저장 시각
     * @return Artifact 인스턴스
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public static Artifact of(byte[] bytes, Instant createdAt) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        byte[] copy = bytes.clone();
        return new Artifact(ContentHash.digest(copy), copy, createdAt);
    }

    public ContentHash getHash() {
        return hash;
    }

    /**
     * 내용 조회 (방어적 복사본).
     *
     * @return 바이트열 복사본
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    public int size() {
        return bytes.length;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Artifact artifact = (Artifact) o;
        return hash.equals(artifact.hash) && Arrays.equals(bytes, artifact.bytes);
    }

    @Override
    public int hashCode() {
        return hash.hashCode();
    }

    @Override
    public String toString() {
        return "Artifact{" + hash + ", size=" + bytes.length + ", createdAt=" + createdAt + '}';
    }
}
