package com.phillippitts.anomalyguard.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for alert emission and notification.
 */
@ConfigurationProperties(prefix = "pipeline.alert")
@Validated
public class AlertProperties {

    /** Consecutive non-anomalous results required to resolve an alert. */
    @Positive(message = "Cool-down count must be positive")
    private int coolDownCount = 3;

    private Slack slack = new Slack();

    public int getCoolDownCount() {
        return coolDownCount;
    }

    public void setCoolDownCount(int coolDownCount) {
        this.coolDownCount = coolDownCount;
    }

    public Slack getSlack() {
        return slack;
    }

    public void setSlack(Slack slack) {
        this.slack = slack;
    }

    /**
     * Slack incoming-webhook notification. Disabled while the webhook URL is blank.
     */
    public static class Slack {
        private String webhookUrl = "";

        /** Minimum time between two notifications for the same series. */
        @NotNull
        private Duration notificationCooldown = Duration.ofHours(1);

        public String getWebhookUrl() {
            return webhookUrl;
        }

        public void setWebhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
        }

        public Duration getNotificationCooldown() {
            return notificationCooldown;
        }

        public void setNotificationCooldown(Duration notificationCooldown) {
            this.notificationCooldown = notificationCooldown;
        }

        public boolean isEnabled() {
            return webhookUrl != null && !webhookUrl.isBlank();
        }
    }
}
