/**
 * 파일 어댑터 공용 유틸리티 (원자적 쓰기, JSON 매퍼).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.analysis.adapter.file.support;
