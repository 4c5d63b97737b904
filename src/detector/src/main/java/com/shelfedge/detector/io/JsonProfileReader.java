package com.shelfedge.detector.io;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shelfedge.detector.model.GroundTrackProfile;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads parsed ground-track profiles from JSON.
 *
 * <p>Accepts either a top-level array of profiles or a sequence of profile objects (for example
 * one per line).
 */
public class JsonProfileReader {
  private final ObjectMapper objectMapper;

  public JsonProfileReader(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public List<GroundTrackProfile> read(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new ProfileIoException("Profile input not found at " + path, null);
    }
    try (InputStream in = Files.newInputStream(path)) {
      return read(in);
    } catch (IOException ex) {
      throw new ProfileIoException("Failed to read profiles from " + path, ex);
    }
  }

  public List<GroundTrackProfile> read(InputStream in) throws IOException {
    try (MappingIterator<GroundTrackProfile> values =
        objectMapper.readerFor(GroundTrackProfile.class).readValues(in)) {
      return values.readAll();
    }
  }
}
