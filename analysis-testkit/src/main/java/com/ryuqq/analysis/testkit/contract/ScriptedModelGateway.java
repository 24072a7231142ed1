package com.ryuqq.analysis.testkit.contract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.analysis.core.model.ModelId;
import com.ryuqq.analysis.core.model.ModelRequest;
import com.ryuqq.analysis.core.model.ModelResponse;
import com.ryuqq.analysis.core.spi.ModelGateway;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic {@link ModelGateway} for pipeline contract tests.
 *
 * <p>Recognises the four call kinds from the tool schema the pipeline sends and answers each
 * with a well-formed structured payload:</p>
 * <ul>
 *   <li>COHERENCE: coherent unless the framework was marked incoherent</li>
 *   <li>ANALYSIS: in-range scores derived from the document name, so reruns agree</li>
 *   <li>SYNTHESIS: cites every consolidated mean found in the prompt</li>
 *   <li>EVIDENCE: echoes a report</li>
 * </ul>
 *
 * <p>Each call advances the shared {@link MutableClock} by the latency configured for its kind
 * before any scripted failure is raised, so phase timings reflect provider work.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ScriptedModelGateway implements ModelGateway {

    private static final Pattern DOCUMENT_HEADER = Pattern.compile("=== DOCUMENT (.+?) ===");
    private static final Pattern FRAMEWORK_HEADER = Pattern.compile("=== FRAMEWORK (\\S+) v\\d+ ===");
    private static final String CONSOLIDATED_MARKER = "=== CONSOLIDATED SCORES ===\n";

    private final ObjectMapper mapper = new ObjectMapper();
    private final MutableClock clock;
    private final Map<CallKind, Duration> latencies = new EnumMap<>(CallKind.class);
    private final List<Rule> rules = new CopyOnWriteArrayList<>();
    private final Set<String> incoherent = ConcurrentHashMap.newKeySet();
    private final Set<String> garbled = ConcurrentHashMap.newKeySet();
    private final List<Call> calls = Collections.synchronizedList(new ArrayList<>());
    private final List<Consumer<Call>> listeners = new CopyOnWriteArrayList<>();

    public ScriptedModelGateway(MutableClock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
        for (CallKind kind : CallKind.values()) {
            latencies.put(kind, Duration.ZERO);
        }
    }

    // ============================================================
    // Scripting
    // ============================================================

    public ScriptedModelGateway latency(CallKind kind, Duration latency) {
        latencies.put(kind, latency);
        return this;
    }

    /**
     * Every analysis call for the document fails.
     */
    public ScriptedModelGateway failDocument(String documentName, Supplier<RuntimeException> failure) {
        rules.add(new Rule(call -> documentName.equals(call.documentName()), -1, failure));
        return this;
    }

    /**
     * The first {@code times} analysis calls for the document fail, later calls succeed.
     */
    public ScriptedModelGateway failDocument(String documentName, int times, Supplier<RuntimeException> failure) {
        rules.add(new Rule(call -> documentName.equals(call.documentName()), times, failure));
        return this;
    }

    /**
     * Every call routed to the model fails.
     */
    public ScriptedModelGateway failModel(ModelId model, Supplier<RuntimeException> failure) {
        rules.add(new Rule(call -> model.equals(call.model()), -1, failure));
        return this;
    }

    public ScriptedModelGateway failKind(CallKind kind, Supplier<RuntimeException> failure) {
        rules.add(new Rule(call -> call.kind() == kind, -1, failure));
        return this;
    }

    public ScriptedModelGateway incoherent(String frameworkName) {
        incoherent.add(frameworkName);
        return this;
    }

    /**
     * Analysis responses for the document are free text with no JSON in them.
     */
    public ScriptedModelGateway garble(String documentName) {
        garbled.add(documentName);
        return this;
    }

    /**
     * Runs on the calling thread after the latency is applied, before the response is built.
     */
    public ScriptedModelGateway onCall(Consumer<Call> listener) {
        listeners.add(listener);
        return this;
    }

    // ============================================================
    // Inspection
    // ============================================================

    public List<Call> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    public long callCount(CallKind kind) {
        return calls().stream().filter(call -> call.kind() == kind).count();
    }

    public long callCount(ModelId model) {
        return calls().stream().filter(call -> call.model().equals(model)).count();
    }

    public long callCount(String documentName) {
        return calls().stream().filter(call -> documentName.equals(call.documentName())).count();
    }

    public void reset() {
        rules.clear();
        incoherent.clear();
        garbled.clear();
        listeners.clear();
        calls.clear();
        for (CallKind kind : CallKind.values()) {
            latencies.put(kind, Duration.ZERO);
        }
    }

    // ============================================================
    // ModelGateway
    // ============================================================

    @Override
    public ModelResponse invoke(ModelRequest request) {
        Call call = classify(request);
        calls.add(call);
        clock.advance(latencies.get(call.kind()));
        listeners.forEach(listener -> listener.accept(call));

        for (Rule rule : rules) {
            if (rule.matches(call)) {
                throw rule.failure.get();
            }
        }

        return switch (call.kind()) {
            case COHERENCE -> coherence(call);
            case ANALYSIS -> analysis(call);
            case SYNTHESIS -> synthesis(call);
            case EVIDENCE -> structured(call.model(), mapper.createObjectNode()
                .put("report", "Report with integrated evidence for " + call.model()));
        };
    }

    private ModelResponse coherence(Call call) {
        boolean coherent = !incoherent.contains(call.frameworkName());
        ObjectNode payload = mapper.createObjectNode()
            .put("coherent", coherent)
            .put("summary", coherent ? "Inputs are coherent" : "Framework does not fit the corpus");
        if (!coherent) {
            payload.putArray("issues").add("dimension definitions do not match the corpus");
        }
        return structured(call.model(), payload);
    }

    private ModelResponse analysis(Call call) {
        if (garbled.contains(call.documentName())) {
            return ModelResponse.text(call.model(), "I am not able to score this document.");
        }
        JsonNode frameworks = readTree(call.request().toolSchema()).path("properties").path("scores").path("properties");
        ObjectNode payload = mapper.createObjectNode();
        ObjectNode scores = payload.putObject("scores");
        frameworks.fields().forEachRemaining(framework -> {
            ObjectNode frameworkScores = scores.putObject(framework.getKey());
            framework.getValue().path("properties").fields().forEachRemaining(dimension -> {
                double min = dimension.getValue().path("minimum").asDouble(0.0);
                double max = dimension.getValue().path("maximum").asDouble(1.0);
                frameworkScores.put(dimension.getKey(),
                    scoreFor(call.documentName(), framework.getKey() + "." + dimension.getKey(), min, max));
            });
        });
        payload.putArray("evidence").add("passage from " + call.documentName());
        return structured(call.model(), payload);
    }

    private ModelResponse synthesis(Call call) {
        String prompt = call.request().prompt();
        int start = prompt.indexOf(CONSOLIDATED_MARKER);
        ObjectNode payload = mapper.createObjectNode();
        payload.put("report", "Analytical report by " + call.model());
        ObjectNode metrics = payload.putObject("metrics");
        if (start >= 0) {
            JsonNode consolidated = readTree(prompt.substring(start + CONSOLIDATED_MARKER.length()).trim());
            for (JsonNode dimension : consolidated.path("dimensions")) {
                metrics.put(dimension.path("key").asText(), dimension.path("mean").asDouble());
            }
        }
        return structured(call.model(), payload);
    }

    /**
     * Score used for a document and dimension. Public so tests can compute expected means.
     */
    public static double scoreFor(String documentName, String dimensionKey, double min, double max) {
        int bucket = Math.floorMod((documentName + "|" + dimensionKey).hashCode(), 101);
        return min + (max - min) * bucket / 100.0;
    }

    private ModelResponse structured(ModelId model, JsonNode payload) {
        return ModelResponse.structured(model, payload.toString());
    }

    private JsonNode readTree(String json) {
        try {
            return mapper.readTree(json == null ? "{}" : json);
        } catch (IOException e) {
            throw new UncheckedIOException("Scripted gateway could not read " + json, e);
        }
    }

    private Call classify(ModelRequest request) {
        JsonNode properties = readTree(request.toolSchema()).path("properties");
        CallKind kind;
        if (properties.has("coherent")) {
            kind = CallKind.COHERENCE;
        } else if (properties.has("scores")) {
            kind = CallKind.ANALYSIS;
        } else if (properties.has("metrics")) {
            kind = CallKind.SYNTHESIS;
        } else {
            kind = CallKind.EVIDENCE;
        }
        String document = kind == CallKind.ANALYSIS ? firstGroup(DOCUMENT_HEADER, request.prompt()) : null;
        String framework = kind == CallKind.COHERENCE ? firstGroup(FRAMEWORK_HEADER, request.prompt()) : null;
        return new Call(kind, request.model(), document, framework, request);
    }

    private static String firstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    /**
     * Kind of pipeline call, recognised from the tool schema.
     */
    public enum CallKind {
        COHERENCE, ANALYSIS, SYNTHESIS, EVIDENCE
    }

    /**
     * One recorded gateway invocation.
     *
     * @param kind call kind
     * @param model model the call was routed to
     * @param documentName analysed document, for ANALYSIS calls
     * @param frameworkName validated framework, for COHERENCE calls
     * @param request original request
     */
    public record Call(CallKind kind, ModelId model, String documentName, String frameworkName, ModelRequest request) {
    }

    private static final class Rule {

        private final Predicate<Call> predicate;
        private final AtomicInteger remaining;
        private final Supplier<RuntimeException> failure;

        private Rule(Predicate<Call> predicate, int times, Supplier<RuntimeException> failure) {
            this.predicate = predicate;
            this.remaining = new AtomicInteger(times);
            this.failure = failure;
        }

        boolean matches(Call call) {
            if (!predicate.test(call)) {
                return false;
            }
            if (remaining.get() < 0) {
                return true;
            }
            return remaining.getAndUpdate(value -> value > 0 ? value - 1 : 0) > 0;
        }
    }
}
