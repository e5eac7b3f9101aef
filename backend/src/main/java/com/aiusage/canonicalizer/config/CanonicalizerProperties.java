package com.aiusage.canonicalizer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "canonicalizer")
public class CanonicalizerProperties {

  private Rules rules = new Rules();
  private Cache cache = new Cache();
  private Storage storage = new Storage();
  private Feedback feedback = new Feedback();

  @Data
  public static class Rules {
    /** Classpath location of the default rule set. */
    private String resource = "/reference/canonicalization-rules.json";

    /** Optional file system path that replaces the classpath rule set. */
    private String overrideFile;
  }

  /** Compiled inline rule sets sent with a request. */
  @Data
  public static class Cache {
    private boolean enabled;
    private long maxSize;
    private long expireAfterWriteMinutes;
  }

  @Data
  public static class Storage {
    private int maxAnalyses = 20;
  }

  @Data
  public static class Feedback {
    private int topResponses = 10;
  }
}
