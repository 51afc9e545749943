package com.agentdaemon.daemon.notification;

import com.agentdaemon.common.model.RebirthEvent;
import com.agentdaemon.common.model.RecoveryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;

/**
 * Pushes recovery and continuity alerts to an operator webhook.
 *
 * <p>Fire-and-forget: delivery failures are logged, never propagated, and never block the
 * caller. With alerts disabled or no webhook configured the alert is only logged.
 */
@Component
public class OperatorAlertSender {

    private static final Logger log = LoggerFactory.getLogger(OperatorAlertSender.class);

    private final WebClient webClient;
    private final String    webhookUrl;
    private final boolean   enabled;

    public OperatorAlertSender(
            @Qualifier("alertWebClient") WebClient webClient,
            @Value("${notification.alerts.webhook-url:}") String webhookUrl,
            @Value("${notification.alerts.enabled:false}") boolean enabled) {
        this.webClient  = webClient;
        this.webhookUrl = webhookUrl != null ? webhookUrl : "";
        this.enabled    = enabled;
    }

    public void sendRecoveryAlert(RecoveryEvent event) {
        String message = String.format("*Daemon recovery* `%s` | type=%s | snapshot=%s | cycle=%d%n_%s_",
            event.id(), event.type().wireName(),
            event.snapshotUsed() != null ? event.snapshotUsed() : "none",
            event.cycleRestored(), event.notes());
        send("recovery", event.id(), message);
    }

    public void sendContinuityAlert(RebirthEvent event) {
        String message = String.format("*Continuity %s* `%s` | source=%s | gaps=%s%n_%s_",
            event.newStatus(), event.id(), event.recoverySource().wireName(),
            event.remainingGaps(), event.cause());
        send("continuity", event.id(), message);
    }

    public boolean isEnabled() {
        return enabled && !webhookUrl.isBlank();
    }

    private void send(String kind, String eventId, String message) {
        if (!isEnabled()) {
            log.info("[Alert] Alerts disabled or no webhook configured. kind={} eventId={} message={}",
                kind, eventId, message);
            return;
        }

        webClient.post()
            .uri(webhookUrl)
            .bodyValue(Map.of("text", message))
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r -> log.info("[Alert] Sent. kind={} eventId={} status={}", kind, eventId, r.getStatusCode()),
                e -> log.error("[Alert] Delivery failed. kind={} eventId={}", kind, eventId, e)
            );
    }
}
