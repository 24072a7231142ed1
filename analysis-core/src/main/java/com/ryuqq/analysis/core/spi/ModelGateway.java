package com.ryuqq.analysis.core.spi;

import com.ryuqq.analysis.core.model.ModelRequest;
import com.ryuqq.analysis.core.model.ModelResponse;

/**
 * Model provider gateway SPI.
 *
 * <p>Adapts a vendor API (HTTP client, SDK, proxy) to a single blocking call. The
 * reliability layer wraps every invocation with deadline enforcement, retry, circuit
 * breaking and failover; gateways therefore perform exactly one network attempt per call.</p>
 *
 * <p><strong>Error Contract:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.analysis.core.exception.TransientProviderException} for timeouts,
 *       5xx, rate limits and overload</li>
 *   <li>{@link com.ryuqq.analysis.core.exception.TerminalProviderException} for
 *       authentication failures and malformed requests</li>
 *   <li>Any other runtime exception is classified from its message</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ModelGateway {

    /**
     * Performs one model call.
     *
     * @param request the request including model, prompt, optional tool schema and deadline
     * @return the text or structured response
     */
    ModelResponse invoke(ModelRequest request);
}
