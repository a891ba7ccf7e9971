package com.acme.orchestrator.otlp;

import io.grpc.BindableService;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.health.v1.HealthCheckResponse;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import io.grpc.protobuf.services.HealthStatusManager;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * gRPC server hosting the OTLP receiver services plus the standard health service. Closing stops
 * accepting calls, waits a bounded time for in-flight exports, then forces shutdown.
 */
public class OtlpReceiverServer implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(OtlpReceiverServer.class);
  static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofSeconds(5);

  private final Server server;
  private final HealthStatusManager health = new HealthStatusManager();
  private final String description;
  private final Duration shutdownGrace;
  private volatile boolean started;
  private volatile boolean closed;

  public OtlpReceiverServer(
      OtlpReceiver receiver, ServerBuilder<?> builder, String description, Duration shutdownGrace) {
    for (BindableService service : receiver.services()) {
      builder.addService(service);
      health.setStatus(
          service.bindService().getServiceDescriptor().getName(),
          HealthCheckResponse.ServingStatus.SERVING);
    }
    builder.addService(health.getHealthService());
    this.server = builder.build();
    this.description = description;
    this.shutdownGrace = shutdownGrace;
  }

  /** Server listening on {@code host:port}; port 0 picks a free port. */
  public static OtlpReceiverServer forAddress(OtlpReceiver receiver, String host, int port) {
    return new OtlpReceiverServer(
        receiver,
        NettyServerBuilder.forAddress(new InetSocketAddress(host, port)),
        host + ":" + port,
        DEFAULT_SHUTDOWN_GRACE);
  }

  public synchronized OtlpReceiverServer start() {
    if (closed) {
      throw new IllegalStateException("OTLP receiver server is closed");
    }
    if (started) {
      return this;
    }
    try {
      server.start();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to start OTLP receiver on " + description, e);
    }
    started = true;
    LOG.info("OTLP receiver started on {}", description);
    return this;
  }

  /** Bound port, or -1 when not started or not bound to a network port. */
  public int getPort() {
    return started ? server.getPort() : -1;
  }

  public boolean isRunning() {
    return started && !closed;
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (!started) {
      return;
    }
    health.enterTerminalState();
    server.shutdown();
    try {
      if (!server.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
        LOG.warn("OTLP receiver did not stop within {}, forcing shutdown", shutdownGrace);
        server.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      server.shutdownNow();
    }
    LOG.info("OTLP receiver on {} stopped", description);
  }
}
