package com.ryuqq.analysis.core.model;

import java.util.Arrays;

/**
 * 이름이 있는 바이트 콘텐츠 (분석 대상 문서, 실험 정의, 코퍼스 매니페스트).
 *
 * <p>Core는 파일 형식을 알지 못하며 전체 내용과 안정적인 이름만 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param name 안정적인 식별 이름
 * @param content 전체 내용
 */
public record Document(String name, byte[] content) {

    public Document {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        content = content.clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public ContentHash contentHash() {
        return ContentHash.digest(content);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Document document = (Document) o;
        return name.equals(document.name) && Arrays.equals(content, document.content);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "Document{" + name + ", size=" + content.length + '}';
    }
}
