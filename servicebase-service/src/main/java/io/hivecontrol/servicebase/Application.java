package io.hivecontrol.servicebase;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Base worker: the lifecycle substrate with no domain work of its own. Heartbeats and obeys
 * start/stop commands under the configured sid ({@code servicebase} unless overridden).
 */
@SpringBootApplication
public class Application {

  private static final Logger log = LoggerFactory.getLogger(Application.class);

  public static void main(String[] args) {
    log.info("Starting service base worker");
    SpringApplication.run(Application.class, args);
  }

}
