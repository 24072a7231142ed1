/**
 * 실행 어댑터.
 *
 * <ul>
 *   <li>{@link com.ryuqq.analysis.adapter.runner.PipelineRunner} - 단계 순서와 문서 분석 worker pool</li>
 *   <li>{@link com.ryuqq.analysis.adapter.runner.CacheCommand} - 파일 저장소 기반 캐시 관리 CLI</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.analysis.adapter.runner;
