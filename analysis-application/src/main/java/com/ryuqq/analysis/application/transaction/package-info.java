/**
 * 프레임워크 트랜잭션 패키지.
 *
 * <p>Registry가 유일한 기준이며 로컬 사본은 참고용입니다. 검증은 fail-closed로 동작하고,
 * 애매한 경우는 모두 해당 프레임워크의 실패로 처리합니다.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.analysis.application.transaction;
