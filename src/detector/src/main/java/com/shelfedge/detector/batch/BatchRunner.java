package com.shelfedge.detector.batch;

import com.shelfedge.detector.config.DetectorProperties;
import com.shelfedge.detector.io.JsonLinesResultWriter;
import com.shelfedge.detector.io.JsonProfileReader;
import com.shelfedge.detector.model.GroundTrackProfile;
import com.shelfedge.detector.pipeline.ProfileResult;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Reads the configured input, runs the batch and writes one result line per profile.
 *
 * <p>Disabled with {@code detector.batch.enabled=false}.
 */
@Component
@ConditionalOnProperty(prefix = "detector.batch", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BatchRunner implements ApplicationRunner {
  private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

  private final JsonProfileReader reader;
  private final JsonLinesResultWriter writer;
  private final ProfileBatchJob job;
  private final DetectorProperties properties;

  public BatchRunner(
      JsonProfileReader reader,
      JsonLinesResultWriter writer,
      ProfileBatchJob job,
      DetectorProperties properties) {
    this.reader = reader;
    this.writer = writer;
    this.job = job;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    DetectorProperties.Batch batch = properties.getBatch();
    if (batch.getInput() == null || batch.getInput().isBlank()) {
      throw new IllegalStateException("detector.batch.enabled=true but detector.batch.input is empty");
    }
    if (batch.getOutput() == null || batch.getOutput().isBlank()) {
      throw new IllegalStateException("detector.batch.enabled=true but detector.batch.output is empty");
    }

    Path input = Path.of(batch.getInput());
    Path output = Path.of(batch.getOutput());
    List<GroundTrackProfile> profiles = reader.read(input);
    log.info("Read {} profiles from {}, processing with {} workers", profiles.size(), input, job.parallelism());

    List<ProfileResult> results = job.run(profiles);
    writer.write(output, results);

    BatchSummary summary = BatchSummary.of(results);
    log.info(
        "Wrote {} results to {}: fronts={}, rampart-moat={}, failed={}",
        summary.profiles(),
        output,
        summary.frontsFound(),
        summary.featuresFound(),
        summary.failed());
  }
}
