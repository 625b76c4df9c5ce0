package com.fooddash.orderservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Thresholds for the maintenance sweeps.
 * Defaults mirror application.yml so a missing key never disables a threshold. The cron
 * keys under the same prefix are read by {@link com.fooddash.orderservice.job.MaintenanceScheduler}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "maintenance")
public class MaintenanceProperties {

    // Maximum rows a single run touches; the next run picks up the rest
    private int batchSize = 500;

    private final Scheduling scheduling = new Scheduling();
    private final UnconfirmedOrders unconfirmedOrders = new UnconfirmedOrders();
    private final CompletedOrders completedOrders = new CompletedOrders();
    private final StaleAvailability staleAvailability = new StaleAvailability();

    @Getter
    @Setter
    public static class Scheduling {
        private boolean enabled = true;
    }

    @Getter
    @Setter
    public static class UnconfirmedOrders {
        private Duration maxAge = Duration.ofMinutes(30);
        private String reason = "Order not confirmed by vendor within 30 minutes";
    }

    @Getter
    @Setter
    public static class CompletedOrders {
        private Duration retention = Duration.ofDays(90);
    }

    @Getter
    @Setter
    public static class StaleAvailability {
        private Duration maxSilence = Duration.ofMinutes(30);
    }
}
