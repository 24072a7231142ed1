package com.ryuqq.analysis.application.pipeline;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.analysis.application.support.JsonCodec;
import com.ryuqq.analysis.application.transaction.FrameworkDefinition;
import com.ryuqq.analysis.application.transaction.ValidatedFramework;
import com.ryuqq.analysis.core.model.Document;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 기본 Prompt 구현.
 *
 * <p>입력 원문을 그대로 포함하고 응답 형식만 지시하는 최소 구현입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DefaultAnalysisPrompts implements AnalysisPrompts {

    @Override
    public String coherencePrompt(ValidatedFramework framework, Document experiment, Document corpus) {
        return "Check that the framework, experiment and corpus below are coherent enough to run an analysis.\n"
            + "Report every structural problem as an issue.\n\n"
            + section("FRAMEWORK " + framework.name() + " v" + framework.version(), framework.content())
            + section("EXPERIMENT " + experiment.name(), experiment.content())
            + section("CORPUS " + corpus.name(), corpus.content());
    }

    @Override
    public String coherenceSchema() {
        ObjectNode schema = objectSchema();
        ObjectNode properties = schema.putObject("properties");
        properties.putObject("coherent").put("type", "boolean");
        properties.putObject("summary").put("type", "string");
        properties.putObject("issues").put("type", "array").putObject("items").put("type", "string");
        schema.putArray("required").add("coherent").add("summary");
        return schema.toString();
    }

    @Override
    public String analysisPrompt(List<ValidatedFramework> frameworks, Document document) {
        StringBuilder prompt = new StringBuilder()
            .append("Score the document against every dimension of each framework.\n")
            .append("Stay within each dimension's range and quote the passages you relied on as evidence.\n\n");
        for (ValidatedFramework framework : frameworks) {
            FrameworkDefinition definition = framework.definition();
            prompt.append("=== FRAMEWORK ").append(definition.name()).append(" ===\n");
            for (FrameworkDefinition.Dimension dimension : definition.dimensions()) {
                prompt.append("- ").append(dimension.name())
                    .append(" [").append(dimension.minScore()).append(", ").append(dimension.maxScore()).append("] ")
                    .append(dimension.description()).append('\n');
            }
            prompt.append('\n');
        }
        return prompt.append(section("DOCUMENT " + document.name(), document.content())).toString();
    }

    @Override
    public String analysisSchema(List<ValidatedFramework> frameworks) {
        ObjectNode schema = objectSchema();
        ObjectNode properties = schema.putObject("properties");
        ObjectNode scores = properties.putObject("scores");
        scores.put("type", "object");
        ObjectNode frameworkProperties = scores.putObject("properties");
        for (ValidatedFramework framework : frameworks) {
            ObjectNode frameworkSchema = frameworkProperties.putObject(framework.name());
            frameworkSchema.put("type", "object");
            ObjectNode dimensionProperties = frameworkSchema.putObject("properties");
            ArrayNode required = frameworkSchema.putArray("required");
            for (FrameworkDefinition.Dimension dimension : framework.definition().dimensions()) {
                dimensionProperties.putObject(dimension.name())
                    .put("type", "number")
                    .put("minimum", dimension.minScore())
                    .put("maximum", dimension.maxScore());
                required.add(dimension.name());
            }
        }
        properties.putObject("evidence").put("type", "array").putObject("items").put("type", "string");
        schema.putArray("required").add("scores");
        return schema.toString();
    }

    @Override
    public String synthesisPrompt(ConsolidatedAnalysis consolidated, Document experiment) {
        return "Write an analytical report for the experiment using the consolidated scores.\n"
            + "Report every dimension mean you cite under metrics, keyed as framework.dimension.\n\n"
            + section("EXPERIMENT " + experiment.name(), experiment.content())
            + "=== CONSOLIDATED SCORES ===\n"
            + new String(JsonCodec.write(consolidated), StandardCharsets.UTF_8) + "\n";
    }

    @Override
    public String synthesisSchema() {
        ObjectNode schema = objectSchema();
        ObjectNode properties = schema.putObject("properties");
        properties.putObject("report").put("type", "string");
        properties.putObject("metrics").put("type", "object")
            .putObject("additionalProperties").put("type", "number");
        schema.putArray("required").add("report");
        return schema.toString();
    }

    @Override
    public String evidencePrompt(String draftReport, ConsolidatedAnalysis consolidated) {
        return "Integrate supporting evidence into the draft report without changing any reported number.\n\n"
            + "=== DRAFT ===\n" + draftReport + "\n\n"
            + "=== CONSOLIDATED SCORES ===\n"
            + new String(JsonCodec.write(consolidated), StandardCharsets.UTF_8) + "\n";
    }

    @Override
    public String evidenceSchema() {
        ObjectNode schema = objectSchema();
        schema.putObject("properties").putObject("report").put("type", "string");
        schema.putArray("required").add("report");
        return schema.toString();
    }

    private static ObjectNode objectSchema() {
        ObjectNode schema = JsonCodec.canonical().createObjectNode();
        schema.put("type", "object");
        return schema;
    }

    private static String section(String title, byte[] content) {
        return "=== " + title + " ===\n" + new String(content, StandardCharsets.UTF_8) + "\n\n";
    }
}
