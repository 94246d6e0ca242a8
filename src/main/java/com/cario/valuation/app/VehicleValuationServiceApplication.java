package com.cario.valuation.app;

import com.cario.valuation.app.config.ValuationProperties;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the Vehicle Valuation Service Spring Boot application.
 *
 * <p>This service prices used vehicles for resale and computes the insured declared value (IDV) for
 * motor insurance, caching externally discovered prices so repeated requests stay stable.
 *
 * <pre>
 *   mvn spring-boot:run
 * </pre>
 */
@Log4j2
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(ValuationProperties.class)
public class VehicleValuationServiceApplication {

  public static void main(String[] args) {
    log.info("Starting Vehicle Valuation Service application...");
    SpringApplication.run(VehicleValuationServiceApplication.class, args);
    log.info("Vehicle Valuation Service application started successfully.");
  }
}
