package com.shelfedge.detector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Spring Boot entrypoint for the detector service.
 *
 * <p>The detector reads parsed ground-track profiles, locates the ice-front crossing and the
 * rampart-moat structure on each one, and writes one result record per profile.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class DetectorApplication {
  /**
   * Starts the detector application.
   *
   * @param args CLI arguments
   */
  public static void main(String[] args) {
    SpringApplication.run(DetectorApplication.class, args);
  }
}
