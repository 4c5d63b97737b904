package com.shelfedge.detector.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shelfedge.detector.batch.ProfileBatchJob;
import com.shelfedge.detector.correction.HeightCorrector;
import com.shelfedge.detector.correction.ProfileCleaner;
import com.shelfedge.detector.detection.AcquisitionClock;
import com.shelfedge.detector.detection.FeatureMetricsCalculator;
import com.shelfedge.detector.detection.FrontCriteria;
import com.shelfedge.detector.detection.FrontDetector;
import com.shelfedge.detector.detection.RampartMoatCriteria;
import com.shelfedge.detector.detection.RampartMoatDetector;
import com.shelfedge.detector.io.JsonLinesResultWriter;
import com.shelfedge.detector.io.JsonProfileReader;
import com.shelfedge.detector.pipeline.ProfilePipeline;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the detection pipeline from {@link DetectorProperties}. */
@Configuration
public class AppConfig {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  @Bean
  public AcquisitionClock acquisitionClock(DetectorProperties properties) {
    try {
      return new AcquisitionClock(Instant.parse(properties.getRefTime()));
    } catch (DateTimeParseException ex) {
      throw new IllegalStateException("detector.ref-time must be an ISO-8601 instant: " + properties.getRefTime(), ex);
    }
  }

  @Bean
  public ProfilePipeline profilePipeline(DetectorProperties properties, AcquisitionClock clock) {
    DetectorProperties.Correction correction = properties.getCorrection();
    DetectorProperties.Front front = properties.getFront();
    DetectorProperties.RampartMoat rampartMoat = properties.getRampartMoat();

    FrontCriteria frontCriteria = new FrontCriteria(
        front.getHAUpperLimit(),
        front.getHDiffLowerLimit(),
        front.getHDiffUpperLimit(),
        front.getJumpXDistUpperLimit(),
        front.isStopOnRejectedGap());
    RampartMoatCriteria rampartMoatCriteria = new RampartMoatCriteria(
        rampartMoat.getMoatHLowerLimit(),
        rampartMoat.getMoatSearchDist(),
        rampartMoat.getRampartMaxSearchDist(),
        properties.getStepSize(),
        rampartMoat.getRampartSearchDirection());
    log.info(
        "Detector configured: front={}, rampartMoat={}, mdt={}, h_ss=[{}, {}]",
        frontCriteria,
        rampartMoatCriteria,
        correction.getMdt(),
        correction.getHSsLow(),
        correction.getHSsHigh());

    return new ProfilePipeline(
        new ProfileCleaner(),
        new HeightCorrector(correction.getMdt(), correction.getHSsLow(), correction.getHSsHigh()),
        new FrontDetector(frontCriteria),
        new RampartMoatDetector(rampartMoatCriteria),
        new FeatureMetricsCalculator(clock),
        clock);
  }

  @Bean
  public ProfileBatchJob profileBatchJob(
      ProfilePipeline pipeline, MeterRegistry meterRegistry, DetectorProperties properties) {
    return new ProfileBatchJob(pipeline, meterRegistry, properties.getBatch().getParallelism());
  }

  @Bean
  public JsonProfileReader jsonProfileReader(ObjectMapper objectMapper) {
    return new JsonProfileReader(objectMapper);
  }

  @Bean
  public JsonLinesResultWriter jsonLinesResultWriter(ObjectMapper objectMapper) {
    return new JsonLinesResultWriter(objectMapper);
  }
}
