package com.phillippitts.airplay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        com.phillippitts.airplay.config.properties.AdapterProperties.class,
        com.phillippitts.airplay.config.properties.CaptureProperties.class,
        com.phillippitts.airplay.config.properties.DetectionProperties.class,
        com.phillippitts.airplay.config.properties.FingerprintProperties.class,
        com.phillippitts.airplay.config.properties.RecorderProperties.class,
        com.phillippitts.airplay.config.properties.RegistryProperties.class,
        com.phillippitts.airplay.config.properties.SchedulerProperties.class,
        com.phillippitts.airplay.config.properties.StationProperties.class,
        com.phillippitts.airplay.config.properties.ThreadPoolProperties.class
})
@EnableScheduling
public class AirplayApplication {

    public static void main(String[] args) {
        SpringApplication.run(AirplayApplication.class, args);
    }

}
