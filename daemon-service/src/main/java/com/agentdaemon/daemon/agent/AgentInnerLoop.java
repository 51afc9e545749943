package com.agentdaemon.daemon.agent;

import com.agentdaemon.common.integrity.FingerprintHasher;
import com.agentdaemon.common.model.CycleResult;
import com.agentdaemon.common.model.CycleTrigger;
import com.agentdaemon.common.model.RealityMetricsSummary;
import com.agentdaemon.common.spi.DecisionGate;
import com.agentdaemon.common.spi.UnitOfWork;
import com.agentdaemon.common.trace.TraceContextUtil;
import com.agentdaemon.daemon.state.LiveAgentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The agent's cycle body: pick a focus, clear it with the decision gate, then update
 * confidence, energy, memory and evolution.
 *
 * <p>A denied decision fails the cycle. The cycle count itself belongs to the daemon and
 * is never written here.
 */
@Component
public class AgentInnerLoop implements UnitOfWork {

    private static final Logger log = LoggerFactory.getLogger(AgentInnerLoop.class);

    static final List<String> FOCUS_ROTATION = List.of(
        "review recent outcomes", "refine strategy", "consolidate lessons", "check constraints");

    static final double ENERGY_COST_PER_CYCLE = 2.0;
    static final double LOW_ENERGY            = 20.0;
    static final int    LESSON_EVERY_CYCLES   = 5;

    private final LiveAgentState  liveState;
    private final DecisionGate    gate;
    private final EvolutionKernel evolution;
    private final MemoryDistiller memory;

    public AgentInnerLoop(LiveAgentState liveState, DecisionGate gate,
                          EvolutionKernel evolution, MemoryDistiller memory) {
        this.liveState = liveState;
        this.gate      = gate;
        this.evolution = evolution;
        this.memory    = memory;
    }

    @Override
    public Mono<CycleResult> runOneCycle(CycleTrigger trigger) {
        long cycle = trigger.cycle();
        String focus = FOCUS_ROTATION.get((int) (cycle % FOCUS_ROTATION.size()));

        return Mono.deferContextual(ctx -> {
            String traceId = TraceContextUtil.getTraceId(ctx);
            if (trigger.afterRestart()) {
                memory.observe("Resumed after restart at cycle " + cycle);
                TraceContextUtil.withMdc(traceId, () ->
                    log.info("[InnerLoop] First cycle after restart. cycle={} confidence={}",
                        cycle, liveState.confidence()));
            }
            return gate.checkDecision("strategy", "Cycle " + cycle + ": " + focus)
                .map(verdict -> {
                    if (!verdict.approved()) {
                        liveState.setDoubts(liveState.doubts() + 1);
                        liveState.setConfidence(liveState.confidence() - 5.0);
                        return CycleResult.failure(cycle, "Decision denied: " + verdict.recommendation());
                    }
                    return CycleResult.success(cycle, apply(cycle, focus));
                });
        });
    }

    private Map<String, Object> apply(long cycle, String focus) {
        double energy = liveState.energyLevel() - ENERGY_COST_PER_CYCLE;
        String mode = energy < LOW_ENERGY ? "rest" : "active";
        if ("rest".equals(mode)) {
            energy = 100.0;
        }
        liveState.setEnergyLevel(energy);
        liveState.setMode(mode);
        liveState.setCurrentFocus(focus);
        liveState.setDoubts(Math.max(0, liveState.doubts() - 1));
        liveState.setConfidence(liveState.confidence() + 0.5);

        double selfScore = liveState.confidence() / 100.0;
        boolean evolved = evolution.evolve(cycle, selfScore);
        memory.observe(focus);
        if (cycle % LESSON_EVERY_CYCLES == 0) {
            memory.learn("Cycle " + cycle + ": " + focus + " held at confidence "
                         + Math.round(liveState.confidence()));
        }

        Map<String, Object> pattern = new LinkedHashMap<>();
        pattern.put("mode", mode);
        pattern.put("focus", focus);
        liveState.setBehaviorPatternHash(FingerprintHasher.hash(pattern));
        liveState.setRealityMetrics(new RealityMetricsSummary(
            liveState.energyLevel() / 100.0, evolution.evolutionCount(),
            liveState.autonomyLevel() / 100.0, 0));
        liveState.putDesire("currentFocus", focus);

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("focus", focus);
        stats.put("mode", mode);
        stats.put("confidence", liveState.confidence());
        stats.put("evolved", evolved);
        stats.put("evolutionVersion", evolution.version());
        return stats;
    }
}
