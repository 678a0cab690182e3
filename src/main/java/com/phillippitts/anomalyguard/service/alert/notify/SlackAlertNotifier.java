package com.phillippitts.anomalyguard.service.alert.notify;

import com.phillippitts.anomalyguard.config.properties.AlertProperties;
import com.phillippitts.anomalyguard.domain.Alert;
import com.phillippitts.anomalyguard.domain.SeriesKey;
import com.phillippitts.anomalyguard.service.alert.AlertEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Posts alert openings and resolutions to a Slack incoming webhook.
 *
 * <p>Inactive while {@code pipeline.alert.slack.webhook-url} is blank. Notifications for the
 * same series are rate limited by {@code notification-cooldown}; a resolution is always sent
 * when the opening of that alert was. Delivery failures are logged and never reach the
 * pipeline.
 */
@Component
public class SlackAlertNotifier {

    private static final Logger LOG = LogManager.getLogger(SlackAlertNotifier.class);

    private final AlertProperties.Slack props;
    private final RestClient restClient;
    private final Clock clock;

    private final ConcurrentMap<SeriesKey, Instant> lastNotified = new ConcurrentHashMap<>();
    private final Set<UUID> notifiedAlerts = ConcurrentHashMap.newKeySet();

    public SlackAlertNotifier(AlertProperties props, RestClient.Builder restClientBuilder, Clock clock) {
        this.props = Objects.requireNonNull(props, "props").getSlack();
        this.restClient = Objects.requireNonNull(restClientBuilder, "restClientBuilder").build();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @EventListener
    public void onAlert(AlertEvent event) {
        if (!props.isEnabled()) {
            return;
        }
        Alert alert = event.alert();
        switch (event.type()) {
            case CREATED -> {
                if (claimSlot(alert.seriesKey())) {
                    notifiedAlerts.add(alert.id());
                    send(alert, ":rotating_light: Anomaly detected on *" + alert.seriesKey().canonical()
                            + "* since " + alert.rangeStart() + " (score " + format(alert.peakScore()) + ")");
                } else {
                    LOG.debug("Slack notification for {} suppressed by cooldown", alert.seriesKey());
                }
            }
            case RESOLVED -> {
                if (notifiedAlerts.remove(alert.id())) {
                    send(alert, ":white_check_mark: Resolved anomaly on *" + alert.seriesKey().canonical()
                            + "* [" + alert.rangeStart() + " - " + alert.rangeEnd() + "), "
                            + alert.windowCount() + " windows, peak score " + format(alert.peakScore()));
                }
            }
            default -> {
                // updates and acknowledgements are not forwarded
            }
        }
    }

    private boolean claimSlot(SeriesKey seriesKey) {
        Instant now = clock.instant();
        Instant[] claimed = new Instant[1];
        lastNotified.compute(seriesKey, (key, last) -> {
            if (last == null || !now.isBefore(last.plus(props.getNotificationCooldown()))) {
                claimed[0] = now;
                return now;
            }
            return last;
        });
        return claimed[0] != null;
    }

    private void send(Alert alert, String text) {
        try {
            restClient.post()
                    .uri(props.getWebhookUrl())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("text", text))
                    .retrieve()
                    .toBodilessEntity();
            LOG.debug("Slack notification sent for alert {}", alert.id());
        } catch (RestClientException e) {
            LOG.warn("Slack notification for alert {} failed: {}", alert.id(), e.getMessage());
        }
    }

    private static String format(double score) {
        return String.format(Locale.ROOT, "%.3f", score);
    }
}
