package com.ryuqq.analysis.application.transaction;

import com.ryuqq.analysis.core.model.ContentHash;

import java.util.Arrays;

/**
 * 검증을 통과해 Run에 사용되는 프레임워크.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param name 프레임워크 이름 (Registry 기준)
 * @param version Registry 버전
 * @param contentHash 내용 해시
 * @param content 내용 (캐시 키와 프롬프트에 사용)
 * @param definition 파싱된 정의
 * @param minted 이번 트랜잭션에서 새로 발급된 버전인지 여부
 */
public record ValidatedFramework(
    String name,
    int version,
    ContentHash contentHash,
    byte[] content,
    FrameworkDefinition definition,
    boolean minted
) {

    public ValidatedFramework {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (contentHash == null) {
            throw new IllegalArgumentException("contentHash cannot be null");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        content = content.clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValidatedFramework that = (ValidatedFramework) o;
        return version == that.version
            && minted == that.minted
            && name.equals(that.name)
            && contentHash.equals(that.contentHash)
            && Arrays.equals(content, that.content)
            && definition.equals(that.definition);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + contentHash.hashCode();
    }

    @Override
    public String toString() {
        return "ValidatedFramework{" + name + " v" + version + ", " + contentHash + (minted ? ", minted" : "") + '}';
    }
}
