package com.ryuqq.analysis.application.pipeline;

import com.ryuqq.analysis.core.model.Document;
import com.ryuqq.analysis.core.model.FrameworkRef;
import com.ryuqq.analysis.core.model.RunId;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Run 실행 요청.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param runId Run 식별자
 * @param frameworks 사용할 프레임워크 참조 (1개 이상)
 * @param experiment 실험 정의
 * @param corpus 코퍼스 설명 (manifest)
 * @param documents 분석할 문서 (이름 중복 불가)
 */
public record RunRequest(
    RunId runId,
    List<FrameworkRef> frameworks,
    Document experiment,
    Document corpus,
    List<Document> documents
) {

    public RunRequest {
        if (runId == null) {
            throw new IllegalArgumentException("runId cannot be null");
        }
        if (frameworks == null || frameworks.isEmpty()) {
            throw new IllegalArgumentException("frameworks cannot be null or empty");
        }
        if (experiment == null) {
            throw new IllegalArgumentException("experiment cannot be null");
        }
        if (corpus == null) {
            throw new IllegalArgumentException("corpus cannot be null");
        }
        if (documents == null || documents.isEmpty()) {
            throw new IllegalArgumentException("documents cannot be null or empty");
        }
        Set<String> names = new HashSet<>();
        for (Document document : documents) {
            if (!names.add(document.name())) {
                throw new IllegalArgumentException("Duplicate document name: " + document.name());
            }
        }
        frameworks = List.copyOf(frameworks);
        documents = List.copyOf(documents);
    }

    /**
     * 새 RunId로 요청 생성.
     */
    public static RunRequest of(List<FrameworkRef> frameworks, Document experiment, Document corpus, List<Document> documents) {
        return new RunRequest(RunId.generate(), frameworks, experiment, corpus, documents);
    }
}
