/**
 * 파일 기반 감사 로그.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.analysis.adapter.file.audit;
