package com.darksite.metering;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Dark Site Metering Engine
 *
 * Polls an air-gapped virtualization control plane, normalizes three API
 * generations into one snapshot model, serves it as exposition text and
 * writes a daily billing export.
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class MeteringApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeteringApplication.class, args);
    }
}
