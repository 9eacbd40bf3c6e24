package com.phillippitts.airplay.service.health;

import com.phillippitts.airplay.service.adapter.CircuitBreaker;
import com.phillippitts.airplay.service.adapter.RecognitionAdapter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AdapterHealthIndicatorTest {

    @Test
    void shouldReportUpWhenAllEnabledAdaptersClosed() {
        RecognitionAdapter audd = adapter("audd", true, CircuitBreaker.State.CLOSED);
        RecognitionAdapter acoustid = adapter("acoustid", false, CircuitBreaker.State.CLOSED);

        Health health = new AdapterHealthIndicator(List.of(audd, acoustid)).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("audd", "ready");
        assertThat(health.getDetails()).containsEntry("acoustid", "disabled");
        assertThat(health.getDetails()).containsEntry("status", "All enabled adapters operational");
    }

    @Test
    void shouldReportDegradedWhenSomeCircuitOpen() {
        RecognitionAdapter audd = adapter("audd", true, CircuitBreaker.State.OPEN);
        RecognitionAdapter musicbrainz = adapter("musicbrainz", true, CircuitBreaker.State.HALF_OPEN);

        Health health = new AdapterHealthIndicator(List.of(audd, musicbrainz)).health();

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("audd", "circuit-open");
        assertThat(health.getDetails()).containsEntry("musicbrainz", "recovering");
    }

    @Test
    void shouldReportDownWhenNoAdapterUsable() {
        RecognitionAdapter audd = adapter("audd", true, CircuitBreaker.State.OPEN);
        RecognitionAdapter acoustid = adapter("acoustid", false, CircuitBreaker.State.CLOSED);

        Health health = new AdapterHealthIndicator(List.of(audd, acoustid)).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("status", "No external adapters available");
    }

    @Test
    void shouldReportDownWhenAllDisabled() {
        Health health = new AdapterHealthIndicator(
                List.of(adapter("audd", false, CircuitBreaker.State.CLOSED))).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    }

    private static RecognitionAdapter adapter(String name, boolean enabled, CircuitBreaker.State state) {
        RecognitionAdapter adapter = mock(RecognitionAdapter.class);
        when(adapter.name()).thenReturn(name);
        when(adapter.isEnabled()).thenReturn(enabled);
        when(adapter.circuitState()).thenReturn(state);
        return adapter;
    }
}
