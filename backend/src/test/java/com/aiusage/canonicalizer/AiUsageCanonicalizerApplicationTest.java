package com.aiusage.canonicalizer;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

@SpringBootTest
@TestPropertySource(properties = {"spring.profiles.active=test", "server.port=0"})
public class AiUsageCanonicalizerApplicationTest {

  @Test
  public void contextLoads() {
    // Fails if the shipped rule set does not compile
  }
}
