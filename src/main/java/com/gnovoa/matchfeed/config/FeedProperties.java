package com.gnovoa.matchfeed.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Live feed tuning: queue sizes, socket deadlines, broker addressing.
 *
 * <p>Bound from {@code feed.*}. Values are checked once at startup so a bad deployment fails before
 * it accepts viewers.
 */
@ConfigurationProperties(prefix = "feed")
public record FeedProperties(
    int sendBufferSize,
    int intakeBufferSize,
    int writeWaitSeconds,
    int pongWaitSeconds,
    int maxMessageBytes,
    long bridgeBackoffMillis,
    String channelPattern,
    long streamMaxLen,
    String allowedOrigins,
    boolean autoStartOnBoot,
    Redis redis) {

  public FeedProperties {
    requirePositive("send-buffer-size", sendBufferSize);
    requirePositive("intake-buffer-size", intakeBufferSize);
    requirePositive("write-wait-seconds", writeWaitSeconds);
    requirePositive("pong-wait-seconds", pongWaitSeconds);
    requirePositive("max-message-bytes", maxMessageBytes);
    requirePositive("bridge-backoff-millis", bridgeBackoffMillis);
    if (streamMaxLen < 0) throw new IllegalArgumentException("feed.stream-max-len must be >= 0");
    if (channelPattern == null || channelPattern.isBlank()) channelPattern = "match:*:events";
    if (allowedOrigins == null || allowedOrigins.isBlank()) allowedOrigins = "*";
    if (redis == null) redis = new Redis("localhost", 6379, null, 0, 2000);
  }

  public record Redis(String host, int port, String password, int database, int timeoutMillis) {
    public Redis {
      if (host == null || host.isBlank()) host = "localhost";
      if (port <= 0) port = 6379;
      if (timeoutMillis <= 0) timeoutMillis = 2000;
    }
  }

  public Duration writeWait() {
    return Duration.ofSeconds(writeWaitSeconds);
  }

  public Duration pongWait() {
    return Duration.ofSeconds(pongWaitSeconds);
  }

  /** Keepalive period, 90% of the pong window so a ping always lands before the peer times out. */
  public Duration pingPeriod() {
    return pongWait().multipliedBy(9).dividedBy(10);
  }

  public Duration bridgeBackoff() {
    return Duration.ofMillis(bridgeBackoffMillis);
  }

  /** Defaults matching {@code application.yml}; used where no Spring context exists. */
  public static FeedProperties defaults() {
    return new FeedProperties(
        256, 256, 10, 60, 512, 1000, "match:*:events", 0, "*", true, null);
  }

  private static void requirePositive(String name, long value) {
    if (value <= 0) throw new IllegalArgumentException("feed." + name + " must be > 0");
  }
}
