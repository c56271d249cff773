package com.scholary.audio.pipeline.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.audio.pipeline.config.PipelineProperties;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * Jobs currently running on this instance, keyed by job id.
 *
 * <p>Holds the cancellation token of each running job so a job can be cancelled from outside, and
 * refuses to start a second job with an id that is still in flight. Entries expire a little after
 * the job timeout so a job whose cleanup never ran cannot block its id forever.
 */
@Repository
public class ActiveJobRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(ActiveJobRegistry.class);

  private final Cache<String, CancellationToken> active;

  @Autowired
  public ActiveJobRegistry(PipelineProperties properties) {
    this(Duration.ofSeconds(properties.job().timeoutSeconds()).plusMinutes(1));
  }

  ActiveJobRegistry(Duration expireAfter) {
    this.active = Caffeine.newBuilder().expireAfterWrite(expireAfter).build();
  }

  /**
   * Register a job and hand out its token.
   *
   * @throws JobAlreadyRunningException if the id is already registered
   */
  public CancellationToken register(String jobId) {
    CancellationToken token = new CancellationToken();
    CancellationToken existing = active.asMap().putIfAbsent(jobId, token);
    if (existing != null) {
      throw new JobAlreadyRunningException("Job is already running: " + jobId);
    }
    LOGGER.debug("Registered active job: {}", jobId);
    return token;
  }

  /** Remove the job, but only if the registered token is still the one given. */
  public void unregister(String jobId, CancellationToken token) {
    if (active.asMap().remove(jobId, token)) {
      LOGGER.debug("Unregistered active job: {}", jobId);
    }
  }

  public boolean cancel(String jobId, String reason) {
    CancellationToken token = active.getIfPresent(jobId);
    if (token == null) {
      return false;
    }
    token.requestCancellation(reason);
    return true;
  }

  public Optional<CancellationToken> find(String jobId) {
    return Optional.ofNullable(active.getIfPresent(jobId));
  }

  public boolean isActive(String jobId) {
    return active.getIfPresent(jobId) != null;
  }
}
