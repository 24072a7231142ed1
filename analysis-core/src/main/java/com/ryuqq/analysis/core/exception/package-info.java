/**
 * 예외 계층 패키지.
 *
 * <p>모든 도메인 예외는 unchecked이며, 복구 가능한 결과(캐시 Miss, 문서 단위 실패,
 * 낮은 신뢰도 추출)는 예외가 아닌 sealed 결과 타입으로 표현합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.analysis.core.exception.TransientProviderException} - 재시도 대상</li>
 *   <li>{@link com.ryuqq.analysis.core.exception.TerminalProviderException} - 즉시 실패</li>
 *   <li>{@link com.ryuqq.analysis.core.exception.FrameworkValidationException} - Run 중단, 롤백 완료</li>
 *   <li>{@link com.ryuqq.analysis.core.exception.FailureThresholdExceededException} - 문서 실패율 초과</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.analysis.core.exception;
