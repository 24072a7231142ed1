/**
 * 문서 분석 결과 타입 패키지.
 *
 * <p>문서 하나의 결과를 sealed interface로 표현해 성공과 기록된 실패를
 * 타입 수준에서 구분합니다.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.analysis.core.outcome;
