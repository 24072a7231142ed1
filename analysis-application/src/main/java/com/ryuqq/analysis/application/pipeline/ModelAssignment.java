package com.ryuqq.analysis.application.pipeline;

import com.ryuqq.analysis.core.model.ModelId;

import java.util.List;

/**
 * 단계별 모델 배정.
 *
 * <p>검증은 결정적 재계산이므로 모델을 사용하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param validationModel Coherence 검증 모델 (캐시 키에 포함)
 * @param analysisModel 문서 분석 모델
 * @param synthesisModel 종합 모델
 * @param failover 1순위 모델의 Circuit이 열렸을 때 순서대로 시도할 모델
 */
public record ModelAssignment(
    ModelId validationModel,
    ModelId analysisModel,
    ModelId synthesisModel,
    List<ModelId> failover
) {

    public ModelAssignment {
        if (validationModel == null) {
            throw new IllegalArgumentException("validationModel cannot be null");
        }
        if (analysisModel == null) {
            throw new IllegalArgumentException("analysisModel cannot be null");
        }
        if (synthesisModel == null) {
            throw new IllegalArgumentException("synthesisModel cannot be null");
        }
        failover = failover == null ? List.of() : List.copyOf(failover);
    }

    /**
     * 모든 단계에 같은 모델 사용.
     */
    public static ModelAssignment single(ModelId model) {
        return new ModelAssignment(model, model, model, List.of());
    }

    public ModelAssignment withFailover(List<ModelId> failover) {
        return new ModelAssignment(validationModel, analysisModel, synthesisModel, failover);
    }
}
