package com.kotsin.scanner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot application that scans configured symbols for multi-timeframe signals and
 * tracks the resulting trades.
 */
@SpringBootApplication(exclude = KafkaAutoConfiguration.class)
@EnableScheduling
public class ScannerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScannerApplication.class, args);
    }
}
