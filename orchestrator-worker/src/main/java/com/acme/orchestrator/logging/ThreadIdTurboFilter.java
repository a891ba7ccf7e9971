package com.acme.orchestrator.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import org.slf4j.MDC;
import org.slf4j.Marker;

/**
 * Tags every log call with the thread id and the worker component the thread belongs to, derived
 * from the thread name: batch flushers, the OTLP receiver, the scheduler, HTTP event loops, or
 * {@code worker} for anything else.
 */
public class ThreadIdTurboFilter extends TurboFilter {
  static final String THREAD_ID_KEY = "threadId";
  static final String COMPONENT_KEY = "component";

  @Override
  public FilterReply decide(
      Marker marker, Logger logger, Level level, String format, Object[] params, Throwable t) {
    Thread current = Thread.currentThread();
    String threadId = Long.toString(current.getId());
    if (!threadId.equals(MDC.get(THREAD_ID_KEY))) {
      MDC.put(THREAD_ID_KEY, threadId);
      MDC.put(COMPONENT_KEY, componentOf(current.getName()));
    }
    return FilterReply.NEUTRAL;
  }

  static String componentOf(String threadName) {
    if (threadName.endsWith("-flusher")) {
      return "flusher";
    }
    if (threadName.startsWith("grpc-")) {
      return "otlp";
    }
    if (threadName.startsWith("scheduled-executor")) {
      return "scheduler";
    }
    if (threadName.startsWith("default-nioEventLoopGroup")
        || threadName.startsWith("default-epollEventLoopGroup")) {
      return "http";
    }
    return "worker";
  }
}
