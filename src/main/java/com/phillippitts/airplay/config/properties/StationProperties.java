package com.phillippitts.airplay.config.properties;

import com.phillippitts.airplay.domain.Station;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Monitored stations, loaded from {@code airplay.stations[n].*}.
 *
 * <pre>
 * airplay.stations[0].id=1
 * airplay.stations[0].name=Radio Sénégal
 * airplay.stations[0].stream-url=https://stream.example.sn/live.mp3
 * airplay.stations[0].poll-interval=60s
 * </pre>
 */
@ConfigurationProperties(prefix = "airplay")
@Validated
public class StationProperties {

    @Valid
    private List<StationDefinition> stations = new ArrayList<>();

    public List<StationDefinition> getStations() {
        return stations;
    }

    public void setStations(List<StationDefinition> stations) {
        this.stations = stations;
    }

    public List<Station> toStations() {
        return stations.stream().map(StationDefinition::toStation).toList();
    }

    public static class StationDefinition {
        @Positive
        private long id;
        @NotBlank
        private String name;
        @NotBlank
        private String streamUrl;
        private boolean active = true;
        private Duration pollInterval = Duration.ofSeconds(60);
        private int priority = 0;

        public long getId() {
            return id;
        }

        public void setId(long id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getStreamUrl() {
            return streamUrl;
        }

        public void setStreamUrl(String streamUrl) {
            this.streamUrl = streamUrl;
        }

        public boolean isActive() {
            return active;
        }

        public void setActive(boolean active) {
            this.active = active;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public int getPriority() {
            return priority;
        }

        public void setPriority(int priority) {
            this.priority = priority;
        }

        Station toStation() {
            return new Station(id, name, streamUrl, active, null, pollInterval, priority);
        }
    }
}
