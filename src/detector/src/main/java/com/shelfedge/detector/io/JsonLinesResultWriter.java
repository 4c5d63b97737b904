package com.shelfedge.detector.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.shelfedge.detector.pipeline.ProfileResult;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Writes one compact JSON object per profile result, newline separated. */
public class JsonLinesResultWriter {
  private final ObjectWriter objectWriter;

  public JsonLinesResultWriter(ObjectMapper objectMapper) {
    this.objectWriter = objectMapper.writerFor(ProfileResult.class)
        .without(SerializationFeature.INDENT_OUTPUT);
  }

  public void write(Path path, List<ProfileResult> results) {
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
        write(out, results);
      }
    } catch (IOException ex) {
      throw new ProfileIoException("Failed to write results to " + path, ex);
    }
  }

  public void write(Writer out, List<ProfileResult> results) throws IOException {
    for (ProfileResult result : results) {
      out.write(objectWriter.writeValueAsString(result));
      out.write('\n');
    }
    out.flush();
  }
}
