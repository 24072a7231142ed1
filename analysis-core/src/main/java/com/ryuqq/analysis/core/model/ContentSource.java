package com.ryuqq.analysis.core.model;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 지연 로딩되는 바이트 콘텐츠.
 *
 * <p>프레임워크 로컬 사본처럼 읽기 자체가 실패할 수 있는 입력을 표현합니다.
 * 읽기 실패는 검증 단계에서 MISSING 상태로 기록됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ContentSource {

    /**
     * 전체 내용 읽기.
     *
     * @return 바이트열
     * @throws IOException 읽을 수 없는 경우
     */
    byte[] read() throws IOException;

    /**
     * 메모리 상의 바이트열.
     */
    static ContentSource of(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        byte[] copy = bytes.clone();
        return copy::clone;
    }

    /**
     * 파일 시스템 경로.
     */
    static ContentSource of(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        return () -> Files.readAllBytes(path);
    }
}
