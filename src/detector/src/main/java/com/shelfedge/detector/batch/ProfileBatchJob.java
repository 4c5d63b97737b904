package com.shelfedge.detector.batch;

import com.shelfedge.detector.model.GroundTrackProfile;
import com.shelfedge.detector.pipeline.ProfilePipeline;
import com.shelfedge.detector.pipeline.ProfileResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Processes a collection of profiles on a fixed worker pool.
 *
 * <p>Profiles are independent: a failure is logged, counted and reported in that profile's result
 * without affecting the others. Results keep the input order.
 */
public class ProfileBatchJob {
  private static final Logger log = LoggerFactory.getLogger(ProfileBatchJob.class);

  private final ProfilePipeline pipeline;
  private final int parallelism;
  private final Counter processedCounter;
  private final Counter failedCounter;
  private final Counter frontCounter;
  private final Counter featureCounter;

  public ProfileBatchJob(ProfilePipeline pipeline, MeterRegistry meterRegistry, int parallelism) {
    this.pipeline = pipeline;
    this.parallelism = parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
    this.processedCounter = meterRegistry.counter("detector.profiles.processed");
    this.failedCounter = meterRegistry.counter("detector.profiles.failed");
    this.frontCounter = meterRegistry.counter("detector.fronts.found");
    this.featureCounter = meterRegistry.counter("detector.rampart_moat.found");
  }

  public int parallelism() {
    return parallelism;
  }

  /**
   * Runs the pipeline over every profile.
   *
   * @param profiles input profiles
   * @return one result per profile, in input order
   */
  public List<ProfileResult> run(List<GroundTrackProfile> profiles) {
    if (profiles.isEmpty()) {
      return List.of();
    }
    AtomicInteger threadIds = new AtomicInteger();
    ExecutorService executor = Executors.newFixedThreadPool(
        Math.min(parallelism, profiles.size()),
        runnable -> {
          Thread thread = new Thread(runnable, "detector-worker-" + threadIds.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        });
    try {
      List<Future<ProfileResult>> futures = new ArrayList<>(profiles.size());
      for (GroundTrackProfile profile : profiles) {
        futures.add(executor.submit(() -> processOne(profile)));
      }
      List<ProfileResult> results = new ArrayList<>(profiles.size());
      for (int i = 0; i < futures.size(); i++) {
        results.add(await(futures.get(i), profiles.get(i)));
      }
      return results;
    } finally {
      executor.shutdownNow();
    }
  }

  private ProfileResult processOne(GroundTrackProfile profile) {
    ProfileResult result;
    try {
      result = pipeline.process(profile);
    } catch (RuntimeException ex) {
      log.warn("Profile {} failed", profile.describe(), ex);
      result = ProfileResult.failed(profile, ex.getMessage());
    }
    record(result);
    return result;
  }

  private ProfileResult await(Future<ProfileResult> future, GroundTrackProfile profile) {
    try {
      return future.get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Batch interrupted while waiting for " + profile.describe(), ex);
    } catch (ExecutionException ex) {
      log.warn("Profile {} failed", profile.describe(), ex.getCause());
      ProfileResult result = ProfileResult.failed(profile, String.valueOf(ex.getCause()));
      record(result);
      return result;
    }
  }

  private void record(ProfileResult result) {
    processedCounter.increment();
    if (result.hasError()) {
      failedCounter.increment();
    }
    if (result.found()) {
      frontCounter.increment();
    }
    if (result.rmFlag()) {
      featureCounter.increment();
    }
  }
}
