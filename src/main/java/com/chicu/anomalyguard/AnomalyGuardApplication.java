package com.chicu.anomalyguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.chicu.anomalyguard")
public class AnomalyGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnomalyGuardApplication.class, args);
    }
}
