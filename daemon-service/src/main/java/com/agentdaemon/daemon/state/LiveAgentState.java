package com.agentdaemon.daemon.state;

import com.agentdaemon.common.model.AgentState;
import com.agentdaemon.common.model.RealityMetricsSummary;
import com.agentdaemon.common.model.StateSnapshot;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * The agent's in-memory working state: what a snapshot captures and what a cold start
 * restores.
 *
 * <p>Written by the unit of work and by cold-start recovery, read by the snapshot
 * store and the status surface. All access is synchronised on the instance.
 */
@Component
public class LiveAgentState {

    public static final double DEFAULT_CONFIDENCE     = 75.0;
    public static final double DEFAULT_ENERGY         = 100.0;
    public static final int    DEFAULT_AUTONOMY_LEVEL = 50;
    public static final String DEFAULT_MODE           = "idle";

    private long    cycleCount;
    private double  confidence    = DEFAULT_CONFIDENCE;
    private int     doubts;
    private double  energyLevel   = DEFAULT_ENERGY;
    private String  mode          = DEFAULT_MODE;
    private String  currentFocus;
    private int     autonomyLevel = DEFAULT_AUTONOMY_LEVEL;
    private String  behaviorPatternHash;

    private final Set<String>         activeConstraints  = new TreeSet<>();
    private RealityMetricsSummary     realityMetrics     = RealityMetricsSummary.empty();
    private final Map<String, Object> desireSummary      = new LinkedHashMap<>();
    private final Map<String, Object> governanceState    = new LinkedHashMap<>();

    // ── snapshot projection ────────────────────────────────────────────────

    public synchronized AgentState toAgentState() {
        return new AgentState(cycleCount, confidence, doubts, energyLevel, mode, currentFocus);
    }

    /**
     * Applies the values a cold start carries over: cycle count, confidence, autonomy
     * level and behaviour pattern hash. Nothing else is touched.
     */
    public synchronized void restoreFrom(StateSnapshot snapshot) {
        AgentState saved = snapshot.agentState();
        this.cycleCount          = Math.max(cycleCount, saved.cycleCount());
        this.confidence          = saved.confidence();
        this.autonomyLevel       = snapshot.autonomyLevel();
        this.behaviorPatternHash = snapshot.behaviorPatternHash();
    }

    /** Records that {@code cycle} completed; the count never moves backwards. */
    public synchronized void advanceCycle(long cycle) {
        this.cycleCount = Math.max(cycleCount, cycle);
    }

    // ── mutators used by the unit of work ──────────────────────────────────

    public synchronized void setConfidence(double confidence) {
        this.confidence = clamp(confidence, 0.0, 100.0);
    }

    public synchronized void setDoubts(int doubts) {
        this.doubts = Math.max(0, doubts);
    }

    public synchronized void setEnergyLevel(double energyLevel) {
        this.energyLevel = clamp(energyLevel, 0.0, 100.0);
    }

    public synchronized void setMode(String mode) {
        this.mode = mode;
    }

    public synchronized void setCurrentFocus(String currentFocus) {
        this.currentFocus = currentFocus;
    }

    public synchronized void setAutonomyLevel(int autonomyLevel) {
        this.autonomyLevel = (int) clamp(autonomyLevel, 0, 100);
    }

    public synchronized void setBehaviorPatternHash(String behaviorPatternHash) {
        this.behaviorPatternHash = behaviorPatternHash;
    }

    public synchronized void setRealityMetrics(RealityMetricsSummary realityMetrics) {
        this.realityMetrics = realityMetrics != null ? realityMetrics : RealityMetricsSummary.empty();
    }

    public synchronized void addConstraint(String constraint) {
        activeConstraints.add(constraint);
    }

    public synchronized void removeConstraint(String constraint) {
        activeConstraints.remove(constraint);
    }

    public synchronized void putDesire(String key, Object value) {
        desireSummary.put(key, value);
    }

    public synchronized void putGovernance(String key, Object value) {
        governanceState.put(key, value);
    }

    // ── accessors ──────────────────────────────────────────────────────────

    public synchronized long   cycleCount()          { return cycleCount; }
    public synchronized double confidence()          { return confidence; }
    public synchronized int    doubts()              { return doubts; }
    public synchronized double energyLevel()         { return energyLevel; }
    public synchronized String mode()                { return mode; }
    public synchronized String currentFocus()        { return currentFocus; }
    public synchronized int    autonomyLevel()       { return autonomyLevel; }
    public synchronized String behaviorPatternHash() { return behaviorPatternHash; }

    public synchronized RealityMetricsSummary realityMetrics() { return realityMetrics; }

    public synchronized Set<String> activeConstraints() {
        return Collections.unmodifiableSet(new TreeSet<>(activeConstraints));
    }

    public synchronized Map<String, Object> desireSummary() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(desireSummary));
    }

    public synchronized Map<String, Object> governanceState() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(governanceState));
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
