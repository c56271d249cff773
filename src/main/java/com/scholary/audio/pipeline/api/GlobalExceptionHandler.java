package com.scholary.audio.pipeline.api;

import com.scholary.audio.pipeline.document.DocumentNotFoundException;
import com.scholary.audio.pipeline.job.CancelledException;
import com.scholary.audio.pipeline.job.InvalidSourceException;
import com.scholary.audio.pipeline.job.JobAlreadyRunningException;
import com.scholary.audio.pipeline.job.PipelineException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps pipeline failures to HTTP responses; the detail is the failure message. */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
    String detail =
        ex.getBindingResult().getAllErrors().stream()
            .map(GlobalExceptionHandler::describe)
            .sorted()
            .collect(Collectors.joining("; "));
    LOGGER.warn("Invalid request: {}", detail);
    return problem(HttpStatus.BAD_REQUEST, "Invalid body: " + detail);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
    LOGGER.warn("Unreadable request: {}", ex.getMessage());
    return problem(HttpStatus.BAD_REQUEST, "Invalid body: request must be a JSON object");
  }

  @ExceptionHandler({InvalidSourceException.class, IllegalArgumentException.class})
  public ProblemDetail handleInvalidSource(RuntimeException ex) {
    LOGGER.warn("Rejected request: {}", ex.getMessage());
    return problem(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(JobAlreadyRunningException.class)
  public ProblemDetail handleAlreadyRunning(JobAlreadyRunningException ex) {
    LOGGER.warn(ex.getMessage());
    return problem(HttpStatus.CONFLICT, ex.getMessage());
  }

  @ExceptionHandler(DocumentNotFoundException.class)
  public ProblemDetail handleNotFound(DocumentNotFoundException ex) {
    LOGGER.warn(ex.getMessage());
    return problem(HttpStatus.NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(CancelledException.class)
  public ProblemDetail handleCancelled(CancelledException ex) {
    LOGGER.warn("Job cancelled: {}", ex.getMessage());
    return problem(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
  }

  @ExceptionHandler(PipelineException.class)
  public ProblemDetail handlePipeline(PipelineException ex) {
    LOGGER.error("Job failed: {}", ex.getMessage(), ex);
    return problem(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
  }

  private static ProblemDetail problem(HttpStatus status, String detail) {
    ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);
    problemDetail.setTitle(status.getReasonPhrase());
    return problemDetail;
  }

  private static String describe(ObjectError error) {
    if (error instanceof FieldError) {
      FieldError fieldError = (FieldError) error;
      return fieldError.getField() + " " + fieldError.getDefaultMessage();
    }
    return error.getDefaultMessage();
  }
}
