package com.plantwatch.detector;

import com.plantwatch.detector.config.DetectorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties(DetectorProperties.class)
@EnableScheduling
public class DetectorServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(DetectorServiceApplication.class, args);
    }
}
