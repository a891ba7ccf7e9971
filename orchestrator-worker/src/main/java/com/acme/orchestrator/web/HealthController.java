package com.acme.orchestrator.web;

import com.acme.orchestrator.otlp.OtlpReceiverServer;
import com.acme.orchestrator.repository.EventRepository;
import com.acme.orchestrator.repository.LogRepository;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import java.util.LinkedHashMap;
import java.util.Map;

@Controller
public class HealthController {

  private final LogRepository logRepository;
  private final EventRepository eventRepository;
  private final OtlpReceiverServer receiverServer;

  public HealthController(
      LogRepository logRepository,
      EventRepository eventRepository,
      @Nullable OtlpReceiverServer receiverServer) {
    this.logRepository = logRepository;
    this.eventRepository = eventRepository;
    this.receiverServer = receiverServer;
  }

  @Get("/health")
  public HttpResponse<Map<String, Object>> health() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "UP");
    body.put("otlpReceiver", receiverServer != null && receiverServer.isRunning() ? "UP" : "DOWN");
    body.put("pendingLogs", logRepository.pendingCount());
    body.put("pendingEvents", eventRepository.pendingCount());
    return HttpResponse.ok(body);
  }
}
