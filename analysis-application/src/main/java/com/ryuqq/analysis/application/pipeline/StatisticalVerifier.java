package com.ryuqq.analysis.application.pipeline;

import com.ryuqq.analysis.application.support.JsonCodec;
import com.ryuqq.analysis.core.exception.ArtifactNotFoundException;
import com.ryuqq.analysis.core.exception.VerificationException;
import com.ryuqq.analysis.core.outcome.Analyzed;
import com.ryuqq.analysis.core.spi.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 결정적 통계 검증.
 *
 * <p>저장된 문서별 Artifact에서 차원 평균을 다시 계산하고, 병합 결과와 종합 보고서가
 * 인용한 값을 허용 오차 안에서 비교합니다. 모델을 호출하지 않습니다.</p>
 *
 * <pre>
 * For each Analyzed:
 *   artifact → DocumentAnalysisRecord → 점수 누적
 * recomputed mean vs consolidated mean   (count도 일치해야 함)
 * recomputed mean vs synthesis metrics   (인용한 키만, 모르는 키는 불일치)
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StatisticalVerifier {

    private static final Logger log = LoggerFactory.getLogger(StatisticalVerifier.class);

    private final ArtifactStore artifactStore;

    public StatisticalVerifier(ArtifactStore artifactStore) {
        if (artifactStore == null) {
            throw new IllegalArgumentException("artifactStore cannot be null");
        }
        this.artifactStore = artifactStore;
    }

    /**
     * 검증 실행.
     *
     * @param analyzed 성공한 문서 결과
     * @param consolidated 병합 결과
     * @param synthesis 종합 결과
     * @param tolerance 허용 오차
     * @return 검증 보고서
     * @throws VerificationException Artifact를 읽을 수 없는 경우
     */
    public VerificationReport verify(List<Analyzed> analyzed, ConsolidatedAnalysis consolidated,
                                     SynthesisResult synthesis, double tolerance) {
        Map<String, DoubleSummaryStatistics> recomputed = new TreeMap<>();
        for (Analyzed document : analyzed) {
            Consolidator.accumulate(recomputed, load(document).scores());
        }

        List<VerificationReport.Check> checks = new ArrayList<>();

        recomputed.forEach((key, stats) -> {
            double expected = stats.getAverage();
            double reported = consolidated.dimension(key)
                .filter(summary -> summary.count() == stats.getCount())
                .map(ConsolidatedAnalysis.DimensionSummary::mean)
                .orElse(Double.NaN);
            checks.add(check(key, VerificationReport.Target.CONSOLIDATION, expected, reported, tolerance));
        });

        for (ConsolidatedAnalysis.DimensionSummary summary : consolidated.dimensions()) {
            if (!recomputed.containsKey(summary.key())) {
                checks.add(check(summary.key(), VerificationReport.Target.CONSOLIDATION, Double.NaN, summary.mean(), tolerance));
            }
        }

        synthesis.claimedMetrics().forEach((key, claimed) -> {
            DoubleSummaryStatistics stats = recomputed.get(key);
            double expected = stats == null ? Double.NaN : stats.getAverage();
            checks.add(check(key, VerificationReport.Target.SYNTHESIS, expected, claimed, tolerance));
        });

        VerificationReport report = new VerificationReport(tolerance, analyzed.size(), checks);
        if (report.passed()) {
            log.info("Verification passed: {} checks over {} documents", checks.size(), analyzed.size());
        } else {
            log.warn("Verification found {} discrepancies: {}", report.discrepancies().size(), report.discrepancies());
        }
        return report;
    }

    private DocumentAnalysisRecord load(Analyzed document) {
        try {
            return JsonCodec.read(artifactStore.get(document.artifactRef()), DocumentAnalysisRecord.class);
        } catch (ArtifactNotFoundException | UncheckedIOException e) {
            throw new VerificationException("Cannot recompute statistics for " + document.documentName()
                + " from " + document.artifactRef(), e);
        }
    }

    private static VerificationReport.Check check(String key, VerificationReport.Target target, double expected,
                                                  double reported, double tolerance) {
        boolean passed = !Double.isNaN(expected) && !Double.isNaN(reported) && Math.abs(expected - reported) <= tolerance;
        return new VerificationReport.Check(key, target, expected, reported, passed);
    }
}
