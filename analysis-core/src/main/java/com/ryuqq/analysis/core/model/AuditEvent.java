package com.ryuqq.analysis.core.model;

import java.time.Instant;

/**
 * 추가 전용 감사 이벤트.
 *
 * <p>이벤트는 그것이 설명하는 상태가 외부에 보이기 전에 기록됩니다.
 * 따라서 감사 로그를 역순으로 재생하면 어떤 쓰기가 있었는지 복원할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param runId 이벤트가 속한 Run
 * @param phase 이벤트가 발생한 단계
 * @param type 이벤트 종류
 * @param payloadHash 관련 Artifact 해시 (없으면 null)
 * @param detail 사람이 읽는 부가 정보 (없으면 빈 문자열)
 * @param timestamp 기록 시각
 */
public record AuditEvent(
    RunId runId,
    Phase phase,
    AuditEventType type,
    ContentHash payloadHash,
    String detail,
    Instant timestamp
) {

    public AuditEvent {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        detail = detail == null ? "" : detail;
    }
}
