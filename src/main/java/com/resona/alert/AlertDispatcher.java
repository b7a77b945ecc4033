package com.resona.alert;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.resona.config.ResonaProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * Formats failover and recovery alerts and hands them to the notification channel.
 * Never propagates a publication failure.
 */
@Slf4j
public class AlertDispatcher {

    private final NotificationChannel channel;
    private final ObjectMapper objectMapper;
    private final String serviceName;
    private final String region;
    private final Clock clock;

    public AlertDispatcher(NotificationChannel channel, ObjectMapper objectMapper,
                           ResonaProperties properties, Clock clock) {
        this.channel = channel;
        this.objectMapper = objectMapper;
        this.serviceName = properties.getAlerts().getServiceName();
        this.region = properties.getSynthesis().getRegion();
        this.clock = clock;
    }

    /**
     * @param dependency failed dependency name
     * @param reason     why failover happened
     * @param mode       degraded mode now installed
     * @return true if the channel accepted the alert
     */
    public boolean dispatchFailover(String dependency, String reason, String mode) {
        return dispatch(serviceName + " - Service Failover: " + dependency, dependency, reason, mode, true);
    }

    public boolean dispatchRecovery(String dependency, String mode) {
        return dispatch(serviceName + " - Service Recovered: " + dependency, dependency, "Dependency healthy again",
                mode, false);
    }

    private boolean dispatch(String subject, String dependency, String reason, String mode,
                             boolean failoverTriggered) {
        try {
            ObjectNode body = objectMapper.createObjectNode();
            body.put("service", dependency);
            body.put("reason", reason);
            body.put("mode", mode);
            body.put("timestamp", clock.instant().toString());
            body.put("region", region);
            body.put("failoverTriggered", failoverTriggered);

            channel.publish(subject, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(body));
            log.info("Alert sent via {}: {}", channel.getName(), subject);
            return true;
        } catch (JsonProcessingException e) {
            log.warn("Failed to format alert '{}'", subject, e);
            return false;
        } catch (RuntimeException e) {
            log.warn("Failed to send alert '{}' via {}: {}", subject, channel.getName(), e.getMessage());
            return false;
        }
    }
}
