package com.sensorplatform.analysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SensorAnalysisApplication {

    public static void main(String[] args) {
        SpringApplication.run(SensorAnalysisApplication.class, args);
    }
}
