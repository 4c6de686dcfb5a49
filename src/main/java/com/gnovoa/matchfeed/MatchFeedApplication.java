// Namespace
package com.gnovoa.matchfeed;

// Imports
import com.gnovoa.matchfeed.config.FeedProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/** Live match feed: WebSocket fan-out of match updates relayed from Redis. */
@SpringBootApplication
@EnableConfigurationProperties(FeedProperties.class)
public class MatchFeedApplication {

  public static void main(String[] args) {
    SpringApplication.run(MatchFeedApplication.class, args);
  }
}
