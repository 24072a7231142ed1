/**
 * 상태 머신 패키지.
 *
 * <p>프레임워크 검증 상태({@link com.ryuqq.analysis.core.statemachine.FrameworkValidationState})와
 * Run 생명주기({@link com.ryuqq.analysis.core.statemachine.RunStatus})의 허용 전이를 정의합니다.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.analysis.core.statemachine;
