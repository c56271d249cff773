package com.scholary.audio.pipeline.logging;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.core.task.TaskDecorator;

/** Copies the submitting thread's MDC onto pool threads so job fields follow stream readers. */
public class MdcTaskDecorator implements TaskDecorator {

  @Override
  public Runnable decorate(Runnable runnable) {
    Map<String, String> context = MDC.getCopyOfContextMap();
    return () -> {
      if (context != null) {
        MDC.setContextMap(context);
      }
      try {
        runnable.run();
      } finally {
        MDC.clear();
      }
    };
  }
}
