package com.skintip.placement.app;

import lombok.extern.log4j.Log4j2;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the tattoo placement service.
 *
 * <p>Exposes the final-render endpoint and the hill-climb admin endpoints. Shape analysis and
 * guide baking run in-process; rendering is delegated to the external generation API and
 * finished images are stored in S3.
 *
 * <pre>
 *   mvn spring-boot:run -Dspring-boot.run.profiles=local
 * </pre>
 */
@Log4j2
@SpringBootApplication
public class PlacementServiceApplication {

  public static void main(String[] args) {
    log.info("Starting Tattoo Placement Service application...");
    SpringApplication.run(PlacementServiceApplication.class, args);
    log.info("Tattoo Placement Service application started successfully.");
  }
}
