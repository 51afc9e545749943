package com.agentdaemon.common.spi;

import com.agentdaemon.common.model.DecisionVerdict;
import reactor.core.publisher.Mono;

/**
 * Approves or denies a sensitive action before the unit of work performs it.
 * The daemon itself never calls the gate; it only tolerates cycles that fail because
 * the gate said no.
 */
@FunctionalInterface
public interface DecisionGate {

    /**
     * @param kind    action category, e.g. {@code mode_change}
     * @param content free-form description of the proposed action
     */
    Mono<DecisionVerdict> checkDecision(String kind, String content);
}
