package com.scholary.audio.pipeline.stage;

import com.scholary.audio.pipeline.job.CancellationToken;
import com.scholary.audio.pipeline.job.CancelledException;
import com.scholary.audio.pipeline.job.PipelineException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Downloads intro and outro clips over HTTP.
 *
 * <p>Transient failures (I/O errors, 5xx) are retried with exponential backoff and jitter. Client
 * errors fail immediately: a 404 on a clip URL will not fix itself. A download in flight is
 * abandoned as soon as the job is cancelled.
 */
@Component
public class ClipFetcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClipFetcher.class);

  private static final Duration REQUEST_TIMEOUT = Duration.ofMinutes(5);

  private final HttpClient httpClient;
  private final int maxAttempts;
  private final long baseBackoffMs;

  @Autowired
  public ClipFetcher(@Qualifier("clipHttpClient") HttpClient httpClient) {
    this(httpClient, 3, 1000);
  }

  ClipFetcher(HttpClient httpClient, int maxAttempts, long baseBackoffMs) {
    this.httpClient = httpClient;
    this.maxAttempts = maxAttempts;
    this.baseBackoffMs = baseBackoffMs;
  }

  /**
   * Download a clip to the given file.
   *
   * @throws PipelineException if the clip cannot be fetched after retries
   */
  public Path fetch(String url, Path target, CancellationToken token) {
    LOGGER.info("Fetching clip: url={}, target={}", url, target.getFileName());

    int attempt = 0;
    Exception lastException = null;

    while (attempt < maxAttempts) {
      token.throwIfRequested("Clip download");
      try {
        attemptFetch(url, target, token);
        return target;
      } catch (ClipRejectedException e) {
        throw new PipelineException(e.getMessage(), e);
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < maxAttempts) {
          // Exponential backoff with jitter
          long backoffMs =
              (long) (Math.pow(2, attempt - 1) * baseBackoffMs + Math.random() * baseBackoffMs);
          LOGGER.warn(
              "Clip download attempt {} failed, retrying in {}ms: {}",
              attempt,
              backoffMs,
              e.getMessage());
          sleep(backoffMs);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new PipelineException("Clip download interrupted: " + url, e);
      }
    }

    throw new PipelineException(
        String.format("Clip download failed after %d attempts: %s", maxAttempts, url),
        lastException);
  }

  private void attemptFetch(String url, Path target, CancellationToken token)
      throws IOException, InterruptedException {
    HttpRequest request =
        HttpRequest.newBuilder().uri(URI.create(url)).timeout(REQUEST_TIMEOUT).GET().build();

    CompletableFuture<HttpResponse<Path>> exchange =
        httpClient.sendAsync(
            request,
            HttpResponse.BodyHandlers.ofFile(
                target,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE));
    Runnable registration = token.onCancel(() -> exchange.cancel(true));
    HttpResponse<Path> response;
    try {
      response = exchange.get();
    } catch (CancellationException e) {
      throw new CancelledException("Clip download cancelled: " + token.reason(), e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof IOException) {
        throw (IOException) cause;
      }
      throw new PipelineException(
          "Clip download failed: " + url + ": " + cause.getMessage(), cause);
    } finally {
      registration.run();
    }

    int status = response.statusCode();
    if (status >= 200 && status < 300) {
      LOGGER.info("Fetched clip: url={}, bytes={}", url, Files.size(target));
      return;
    }
    if (status >= 400 && status < 500) {
      throw new ClipRejectedException(
          String.format("Clip URL returned status %d: %s", status, url));
    }
    throw new IOException(String.format("Clip URL returned status %d: %s", status, url));
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new PipelineException("Clip download interrupted", ie);
    }
  }

  /** Non-retryable HTTP answer. */
  private static final class ClipRejectedException extends IOException {

    ClipRejectedException(String message) {
      super(message);
    }
  }
}
