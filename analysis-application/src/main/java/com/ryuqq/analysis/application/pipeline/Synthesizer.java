package com.ryuqq.analysis.application.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.analysis.application.reliability.ReliableModelClient;
import com.ryuqq.analysis.core.exception.CircuitOpenException;
import com.ryuqq.analysis.core.exception.ProviderException;
import com.ryuqq.analysis.core.exception.ProviderExhaustedException;
import com.ryuqq.analysis.core.exception.SynthesisException;
import com.ryuqq.analysis.core.model.Document;
import com.ryuqq.analysis.core.model.ModelRequest;
import com.ryuqq.analysis.core.model.ModelResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;

/**
 * 종합 단계.
 *
 * <p>1차 분석 호출로 보고서와 인용 지표를 받고, 설정에 따라 근거 통합 2차 호출을 수행합니다.
 * 재시도 예산이 소진되거나 응답을 해석할 수 없으면 {@link SynthesisException}으로 Run을 중단합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class Synthesizer {

    private static final Logger log = LoggerFactory.getLogger(Synthesizer.class);

    private final ReliableModelClient client;
    private final AnalysisPrompts prompts;
    private final ResponseExtractor extractor;

    public Synthesizer(ReliableModelClient client, AnalysisPrompts prompts, ResponseExtractor extractor) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (prompts == null) {
            throw new IllegalArgumentException("prompts cannot be null");
        }
        if (extractor == null) {
            throw new IllegalArgumentException("extractor cannot be null");
        }
        this.client = client;
        this.prompts = prompts;
        this.extractor = extractor;
    }

    /**
     * 종합 실행.
     *
     * @param consolidated 병합 결과
     * @param experiment 실험 정의
     * @param models 모델 배정
     * @param evidenceIntegration 2차 호출 수행 여부
     * @return 종합 결과
     * @throws SynthesisException 호출 실패 또는 응답 해석 불가
     */
    public SynthesisResult synthesize(ConsolidatedAnalysis consolidated, Document experiment, ModelAssignment models,
                                      boolean evidenceIntegration) {
        ModelResponse analytical = invoke(models, prompts.synthesisPrompt(consolidated, experiment), prompts.synthesisSchema());
        JsonNode payload = parse(analytical, "analytical synthesis");
        String analyticalReport = requireReport(payload, "analytical synthesis");
        Map<String, Double> metrics = readMetrics(payload);

        if (!evidenceIntegration) {
            return new SynthesisResult(analyticalReport, analyticalReport, metrics, false, analytical.model().getValue());
        }

        ModelResponse integrated = invoke(models, prompts.evidencePrompt(analyticalReport, consolidated), prompts.evidenceSchema());
        String report = requireReport(parse(integrated, "evidence integration"), "evidence integration");
        log.info("Synthesis completed with evidence integration ({} metrics cited)", metrics.size());
        return new SynthesisResult(report, analyticalReport, metrics, true, analytical.model().getValue());
    }

    private ModelResponse invoke(ModelAssignment models, String prompt, String schema) {
        ModelRequest request = new ModelRequest(models.synthesisModel(), prompt, schema, client.getPolicy().callDeadline());
        try {
            return client.call(request, models.failover());
        } catch (ProviderException | ProviderExhaustedException | CircuitOpenException e) {
            throw new SynthesisException("Synthesis call failed: " + e.getMessage(), e);
        }
    }

    private JsonNode parse(ModelResponse response, String pass) {
        Extraction extraction = extractor.extract(response);
        if (extraction instanceof Extraction.Parsed parsed) {
            return parsed.payload();
        }
        throw new SynthesisException("Could not parse " + pass + " response: "
            + ((Extraction.LowConfidence) extraction).reason(), null);
    }

    private static String requireReport(JsonNode payload, String pass) {
        JsonNode report = payload.get("report");
        if (report == null || !report.isTextual() || report.asText().isBlank()) {
            throw new SynthesisException("The " + pass + " response has no report", null);
        }
        return report.asText();
    }

    private static Map<String, Double> readMetrics(JsonNode payload) {
        Map<String, Double> metrics = new TreeMap<>();
        JsonNode node = payload.path("metrics");
        if (node.isObject()) {
            node.fields().forEachRemaining(field -> {
                if (field.getValue().isNumber()) {
                    metrics.put(field.getKey(), field.getValue().doubleValue());
                }
            });
        }
        return metrics;
    }
}
