/**
 * 파일 시스템 기반 Artifact Store와 캐시 인덱스.
 *
 * <p>같은 루트를 공유하는 여러 프로세스(파이프라인, cache CLI)가 같은 데이터를 봅니다.</p>
 *
 * <pre>
 * &lt;root&gt;/
 *   artifacts/&lt;aa&gt;/&lt;hash&gt;
 *   cache/validation_cache_index.json
 *   audit/&lt;runId&gt;.jsonl
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.analysis.adapter.file.store;
