package com.phillippitts.airplay.service.health;

import com.phillippitts.airplay.service.adapter.CircuitBreaker;
import com.phillippitts.airplay.service.adapter.RecognitionAdapter;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.List;

/**
 * Health indicator for the external recognition adapters.
 *
 * <p>Reports adapter status for monitoring and alerting:
 * <ul>
 *   <li>UP: every enabled adapter has a closed circuit</li>
 *   <li>DEGRADED: at least one enabled adapter is usable</li>
 *   <li>DOWN: no enabled adapter is usable (only the local tier can resolve)</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
public class AdapterHealthIndicator implements HealthIndicator {

    private final List<RecognitionAdapter> adapters;

    public AdapterHealthIndicator(List<RecognitionAdapter> adapters) {
        this.adapters = List.copyOf(adapters);
    }

    @Override
    public Health health() {
        Health.Builder builder = new Health.Builder();
        int enabled = 0;
        int usable = 0;
        int closed = 0;
        for (RecognitionAdapter adapter : adapters) {
            String status = adapterStatus(adapter);
            builder.withDetail(adapter.name(), status);
            if (adapter.isEnabled()) {
                enabled++;
                CircuitBreaker.State state = adapter.circuitState();
                if (state != CircuitBreaker.State.OPEN) {
                    usable++;
                }
                if (state == CircuitBreaker.State.CLOSED) {
                    closed++;
                }
            }
        }

        if (enabled > 0 && closed == enabled) {
            builder.up().withDetail("status", "All enabled adapters operational");
        } else if (usable > 0) {
            builder.status("DEGRADED").withDetail("status", "Partial adapter availability");
        } else {
            builder.down().withDetail("status", "No external adapters available");
        }
        return builder.build();
    }

    static String adapterStatus(RecognitionAdapter adapter) {
        if (!adapter.isEnabled()) {
            return "disabled";
        }
        return switch (adapter.circuitState()) {
            case CLOSED -> "ready";
            case HALF_OPEN -> "recovering";
            case OPEN -> "circuit-open";
        };
    }
}
