package com.ryuqq.analysis.core.model;

/**
 * Run이 참조하는 프레임워크.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param name 프레임워크 이름
 * @param localCopy 로컬 작업 사본 (null이면 Registry 내용 사용)
 * @param expectedVersion 고정할 버전 (null이면 최신 버전 기준)
 */
public record FrameworkRef(
    String name,
    ContentSource localCopy,
    Integer expectedVersion
) {

    public FrameworkRef {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (expectedVersion != null && expectedVersion <= 0) {
            throw new IllegalArgumentException("expectedVersion must be positive (current: " + expectedVersion + ")");
        }
    }

    /**
     * Registry 최신 버전을 그대로 사용하는 참조.
     */
    public static FrameworkRef registered(String name) {
        return new FrameworkRef(name, null, null);
    }

    /**
     * 로컬 사본과 Registry를 비교하는 참조.
     */
    public static FrameworkRef withLocalCopy(String name, ContentSource localCopy) {
        if (localCopy == null) {
            throw new IllegalArgumentException("localCopy cannot be null");
        }
        return new FrameworkRef(name, localCopy, null);
    }

    /**
     * 특정 버전으로 고정한 새 인스턴스.
     */
    public FrameworkRef pinnedTo(int version) {
        return new FrameworkRef(name, localCopy, version);
    }

    public boolean hasLocalCopy() {
        return localCopy != null;
    }

    public boolean isPinned() {
        return expectedVersion != null;
    }
}
