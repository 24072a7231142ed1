/**
 * 공용 지원 유틸리티 (JSON 직렬화).
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.analysis.application.support;
