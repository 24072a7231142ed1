/**
 * Pipeline contract test support.
 *
 * <p>{@link com.ryuqq.analysis.testkit.contract.AbstractPipelineContractTest} wires the runner against
 * in-memory adapters, a {@link com.ryuqq.analysis.testkit.contract.ScriptedModelGateway} and a
 * {@link com.ryuqq.analysis.testkit.contract.MutableClock}. Adapter modules can extend it to run the
 * same scenarios against their own storage.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.analysis.testkit.contract;
