package com.ryuqq.analysis.application.transaction;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.analysis.application.support.JsonCodec;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 프레임워크 정의 파서 (JSON).
 *
 * <p><strong>필수 구조:</strong></p>
 * <pre>
 * {
 *   "name": "moral_foundations",
 *   "description": "...",
 *   "dimensions": [
 *     {"name": "care", "description": "...", "min": 0.0, "max": 1.0}
 *   ]
 * }
 * </pre>
 *
 * <p>min/max가 없으면 0.0/1.0을 사용합니다. 차원 이름은 중복될 수 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FrameworkDefinitionParser {

    private static final double DEFAULT_MIN = 0.0;
    private static final double DEFAULT_MAX = 1.0;

    /**
     * 정의 파싱.
     *
     * @param content 프레임워크 내용 (UTF-8 JSON)
     * @return 파싱된 정의
     * @throws MalformedFrameworkException 구조가 잘못된 경우
     */
    public FrameworkDefinition parse(byte[] content) {
        if (content == null || content.length == 0) {
            throw new MalformedFrameworkException("Framework content is empty");
        }

        JsonNode root;
        try {
            root = JsonCodec.canonical().readTree(content);
        } catch (IOException e) {
            throw new MalformedFrameworkException("Framework content is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedFrameworkException("Framework content must be a JSON object");
        }

        String name = text(root, "name");
        if (name.isBlank()) {
            throw new MalformedFrameworkException("Framework 'name' is required");
        }

        JsonNode dimensionsNode = root.get("dimensions");
        if (dimensionsNode == null || !dimensionsNode.isArray() || dimensionsNode.isEmpty()) {
            throw new MalformedFrameworkException("Framework '" + name + "' must declare a non-empty 'dimensions' list");
        }

        List<FrameworkDefinition.Dimension> dimensions = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (JsonNode node : dimensionsNode) {
            if (!node.isObject()) {
                throw new MalformedFrameworkException("Framework '" + name + "' has a dimension that is not an object");
            }
            String dimensionName = text(node, "name");
            if (dimensionName.isBlank()) {
                throw new MalformedFrameworkException("Framework '" + name + "' has a dimension without a name");
            }
            if (!seen.add(dimensionName)) {
                throw new MalformedFrameworkException("Framework '" + name + "' declares dimension '" + dimensionName + "' twice");
            }
            try {
                dimensions.add(new FrameworkDefinition.Dimension(
                    dimensionName,
                    text(node, "description"),
                    node.path("min").asDouble(DEFAULT_MIN),
                    node.path("max").asDouble(DEFAULT_MAX)
                ));
            } catch (IllegalArgumentException e) {
                throw new MalformedFrameworkException(e.getMessage(), e);
            }
        }

        return new FrameworkDefinition(name, text(root, "description"), dimensions);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText();
    }
}
