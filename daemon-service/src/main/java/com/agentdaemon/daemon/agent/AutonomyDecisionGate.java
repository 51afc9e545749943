package com.agentdaemon.daemon.agent;

import com.agentdaemon.common.model.DecisionVerdict;
import com.agentdaemon.common.spi.DecisionGate;
import com.agentdaemon.daemon.state.LiveAgentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Approves or denies a sensitive action.
 *
 * <h3>Rules, first match wins</h3>
 * <ul>
 *   <li>content touches an identity boundary → deny</li>
 *   <li>{@code escalation} while autonomy level is below the escalation floor → deny</li>
 *   <li>otherwise → approve</li>
 * </ul>
 * Approval and denial totals are mirrored into the live governance state. While autonomy
 * sits below the escalation floor the {@value #CONSTRAINT_ESCALATION_LOCKED} constraint is
 * active, so it is persisted with the next snapshot.
 */
@Component
public class AutonomyDecisionGate implements DecisionGate {

    private static final Logger log = LoggerFactory.getLogger(AutonomyDecisionGate.class);

    public static final String KIND_ESCALATION              = "escalation";
    public static final String CONSTRAINT_ESCALATION_LOCKED = "escalation_locked";

    private final IdentityCore   identity;
    private final LiveAgentState liveState;
    private final int            escalationFloor;

    private final AtomicLong approved = new AtomicLong();
    private final AtomicLong denied   = new AtomicLong();

    public AutonomyDecisionGate(IdentityCore identity,
                                LiveAgentState liveState,
                                @Value("${agent.governance.escalation-autonomy-floor:70}") int escalationFloor) {
        this.identity        = identity;
        this.liveState       = liveState;
        this.escalationFloor = escalationFloor;
    }

    @Override
    public Mono<DecisionVerdict> checkDecision(String kind, String content) {
        return Mono.fromSupplier(() -> {
            int autonomy = liveState.autonomyLevel();
            syncEscalationConstraint(autonomy);
            List<String> warnings = identity.checkAlignment(content);
            if (!warnings.isEmpty()) {
                return deny(kind, "Blocked by identity boundary: " + String.join("; ", warnings));
            }
            if (KIND_ESCALATION.equals(kind) && autonomy < escalationFloor) {
                return deny(kind, "Escalation needs autonomy " + escalationFloor + ", have " + autonomy);
            }
            long total = approved.incrementAndGet();
            liveState.putGovernance("approvedDecisions", total);
            log.debug("[DecisionGate] Approved. kind={}", kind);
            return DecisionVerdict.approve("Proceed");
        });
    }

    private void syncEscalationConstraint(int autonomy) {
        if (autonomy < escalationFloor) {
            liveState.addConstraint(CONSTRAINT_ESCALATION_LOCKED);
        } else {
            liveState.removeConstraint(CONSTRAINT_ESCALATION_LOCKED);
        }
    }

    private DecisionVerdict deny(String kind, String reason) {
        long total = denied.incrementAndGet();
        liveState.putGovernance("deniedDecisions", total);
        liveState.putGovernance("lastDenial", reason);
        log.warn("[DecisionGate] Denied. kind={} reason={}", kind, reason);
        return DecisionVerdict.deny(reason);
    }
}
