package com.williamcallahan.inference.config;

import com.williamcallahan.inference.service.ProviderHealthMonitor;
import java.util.Map;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Exposes provider health through {@code /actuator/health}.
 *
 * <p>UP while at least one monitored provider is usable, DOWN when every provider is unhealthy.</p>
 */
@Component
public class ProviderHealthIndicator implements HealthIndicator {

    private static final String DETAIL_KEY_PROVIDERS = "providers";
    private static final String DETAIL_KEY_STATUS = "status";

    private final ProviderHealthMonitor healthMonitor;

    public ProviderHealthIndicator(ProviderHealthMonitor healthMonitor) {
        this.healthMonitor = healthMonitor;
    }

    @Override
    public Health health() {
        Map<String, ProviderHealthMonitor.ProviderHealthReport> report = healthMonitor.getStatusReport();
        if (report.isEmpty()) {
            return Health.unknown().withDetail(DETAIL_KEY_STATUS, "No providers monitored").build();
        }
        boolean anyAvailable = report.values().stream().anyMatch(ProviderHealthMonitor.ProviderHealthReport::available);
        Health.Builder builder = anyAvailable ? Health.up() : Health.down();
        return builder
                .withDetail(DETAIL_KEY_STATUS, anyAvailable ? "At least one provider available" : "All providers unhealthy")
                .withDetail(DETAIL_KEY_PROVIDERS, report)
                .build();
    }
}
