package com.ryuqq.analysis.application.pipeline;

import com.ryuqq.analysis.core.outcome.Analyzed;
import com.ryuqq.analysis.core.outcome.DocumentOutcome;

import java.util.ArrayList;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 문서별 분석 결과 병합.
 *
 * <p>실패한 문서는 제외하고, 결과 순서는 문서 완료 순서와 무관하게
 * 문서 이름과 차원 키 순으로 고정됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class Consolidator {

    public ConsolidatedAnalysis consolidate(List<DocumentOutcome> outcomes) {
        if (outcomes == null) {
            throw new IllegalArgumentException("outcomes cannot be null");
        }

        List<String> documents = new ArrayList<>();
        Map<String, DoubleSummaryStatistics> statistics = new TreeMap<>();

        for (DocumentOutcome outcome : outcomes) {
            if (outcome instanceof Analyzed analyzed) {
                documents.add(analyzed.documentName());
                accumulate(statistics, analyzed.scores());
            }
        }
        documents.sort(String::compareTo);

        return new ConsolidatedAnalysis(documents, summarize(statistics));
    }

    static void accumulate(Map<String, DoubleSummaryStatistics> statistics, Map<String, Double> scores) {
        scores.forEach((key, value) -> {
            if (value != null) {
                statistics.computeIfAbsent(key, k -> new DoubleSummaryStatistics()).accept(value);
            }
        });
    }

    static List<ConsolidatedAnalysis.DimensionSummary> summarize(Map<String, DoubleSummaryStatistics> statistics) {
        List<ConsolidatedAnalysis.DimensionSummary> summaries = new ArrayList<>();
        statistics.forEach((key, stats) -> summaries.add(new ConsolidatedAnalysis.DimensionSummary(
            key, (int) stats.getCount(), stats.getAverage(), stats.getMin(), stats.getMax())));
        return summaries;
    }
}
