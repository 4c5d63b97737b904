package com.shelfedge.detector.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shelfedge.detector.config.AppConfig;
import com.shelfedge.detector.config.DetectorProperties;
import com.shelfedge.detector.io.JsonLinesResultWriter;
import com.shelfedge.detector.io.JsonProfileReader;
import com.shelfedge.detector.pipeline.ProfilePipeline;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

class BatchRunnerTest {
  private final ObjectMapper objectMapper = new ObjectMapper();

  @TempDir
  Path tempDir;

  private BatchRunner runner(DetectorProperties properties) {
    AppConfig config = new AppConfig();
    ProfilePipeline pipeline = config.profilePipeline(properties, config.acquisitionClock(properties));
    return new BatchRunner(
        new JsonProfileReader(objectMapper),
        new JsonLinesResultWriter(objectMapper),
        new ProfileBatchJob(pipeline, new SimpleMeterRegistry(), 2),
        properties);
  }

  @Test
  void processesInputFileIntoJsonLines() throws Exception {
    Path input = tempDir.resolve("profiles.json");
    Path output = tempDir.resolve("results.jsonl");
    // h_li is 1.4 m below h_ss because of the default MDT of -1.4 m.
    Files.writeString(input, """
        [
          {"file": "g1.h5", "beam": "gt1l", "cycle": 3, "direction": "D", "samples": [
            {"x_atc": 1000, "h_li": -0.9, "geoid_h": 0, "tide_ocean": 0, "dac": 0, "mask": 0, "delta_time": 10},
            {"x_atc": 1020, "h_li": 49.1, "geoid_h": 0, "tide_ocean": 0, "dac": 0, "mask": 2, "delta_time": 11},
            {"x_atc": 1040, "h_li": 38.6, "geoid_h": 0, "tide_ocean": 0, "dac": 0, "mask": 2, "delta_time": 12},
            {"x_atc": 1060, "h_li": 40.6, "geoid_h": 0, "tide_ocean": 0, "dac": 0, "mask": 2, "delta_time": 13}
          ]},
          {"file": "g1.h5", "beam": "gt1r", "cycle": 3, "direction": "?", "samples": []}
        ]
        """);
    DetectorProperties properties = new DetectorProperties();
    properties.getBatch().setInput(input.toString());
    properties.getBatch().setOutput(output.toString());

    runner(properties).run(new DefaultApplicationArguments());

    List<String> lines = Files.readAllLines(output);
    assertThat(lines).hasSize(2);
    JsonNode first = objectMapper.readTree(lines.get(0));
    assertThat(first.get("found").asBoolean()).isTrue();
    assertThat(first.get("point_a").get("index").asInt()).isZero();
    assertThat(first.get("point_b").get("index").asInt()).isEqualTo(1);
    assertThat(first.get("rm_flag").asBoolean()).isTrue();
    assertThat(first.get("moat").get("index").asInt()).isEqualTo(2);
    assertThat(first.get("dh_rm").asDouble()).isCloseTo(10.5, within(1e-9));
    assertThat(first.get("time_rm").asText()).isEqualTo("2018-01-01T00:00:11.500Z");
    JsonNode second = objectMapper.readTree(lines.get(1));
    assertThat(second.get("track_node").asInt()).isZero();
    assertThat(second.get("found").asBoolean()).isFalse();
  }

  @Test
  void missingInputPathFailsFast() {
    DetectorProperties properties = new DetectorProperties();
    properties.getBatch().setOutput(tempDir.resolve("out.jsonl").toString());

    assertThatThrownBy(() -> runner(properties).run(new DefaultApplicationArguments()))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("detector.batch.input");
  }
}
