package com.aiusage.canonicalizer.UnitTests.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import com.aiusage.canonicalizer.config.CanonicalizerProperties;

@SpringBootTest(classes = CanonicalizerProperties.class)
@EnableConfigurationProperties
@TestPropertySource(
    properties = {
      "canonicalizer.rules.resource=/reference/test-rules.json",
      "canonicalizer.rules.override-file=/etc/survey/rules.json",
      "canonicalizer.cache.enabled=true",
      "canonicalizer.cache.max-size=5",
      "canonicalizer.cache.expire-after-write-minutes=15",
      "canonicalizer.storage.max-analyses=3",
      "canonicalizer.feedback.top-responses=7"
    })
public class CanonicalizerPropertiesTest {

  @Autowired private CanonicalizerProperties properties;

  @Test
  public void testPropertiesLoading() {
    assertNotNull(properties);
    assertEquals("/reference/test-rules.json", properties.getRules().getResource());
    assertEquals("/etc/survey/rules.json", properties.getRules().getOverrideFile());
    assertEquals(3, properties.getStorage().getMaxAnalyses());
    assertEquals(7, properties.getFeedback().getTopResponses());
  }

  @Test
  public void testCacheProperties() {
    assertTrue(properties.getCache().isEnabled());
    assertEquals(5, properties.getCache().getMaxSize());
    assertEquals(15, properties.getCache().getExpireAfterWriteMinutes());
  }

  @Test
  public void testDefaults() {
    CanonicalizerProperties defaults = new CanonicalizerProperties();
    assertEquals("/reference/canonicalization-rules.json", defaults.getRules().getResource());
    assertNull(defaults.getRules().getOverrideFile());
    assertFalse(defaults.getCache().isEnabled());
    assertEquals(20, defaults.getStorage().getMaxAnalyses());
    assertEquals(10, defaults.getFeedback().getTopResponses());
  }
}
