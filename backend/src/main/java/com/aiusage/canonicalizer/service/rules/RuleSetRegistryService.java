package com.aiusage.canonicalizer.service.rules;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import org.springframework.stereotype.Service;

import com.aiusage.canonicalizer.config.CanonicalizerProperties;
import com.aiusage.canonicalizer.dto.rules.RuleSetDefinition;
import com.aiusage.canonicalizer.exception.InvalidRuleSetException;
import com.aiusage.canonicalizer.model.RuleSet;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.UncheckedExecutionException;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Holds the active rule set. The definition is read once at startup from the configured override
 * file, or from the classpath resource when no override is set, and compiled into an immutable
 * {@link RuleSet} that every analysis shares. Inline definitions sent with a request are compiled
 * on demand and cached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RuleSetRegistryService {

  private final ObjectMapper objectMapper;
  private final RuleSetCompiler ruleSetCompiler;
  private final CanonicalizerProperties properties;

  private volatile RuleSetDefinition activeDefinition;
  private volatile RuleSet activeRuleSet;

  private Cache<RuleSetDefinition, RuleSet> inlineRuleSets;

  @PostConstruct
  public void init() {
    initializeCache();
    loadConfiguredRuleSet();
  }

  private void initializeCache() {
    CanonicalizerProperties.Cache cache = properties.getCache();
    if (cache.isEnabled()) {
      inlineRuleSets =
          CacheBuilder.newBuilder()
              .maximumSize(cache.getMaxSize())
              .expireAfterWrite(cache.getExpireAfterWriteMinutes(), TimeUnit.MINUTES)
              .build();
    }
  }

  private void loadConfiguredRuleSet() {
    RuleSetDefinition definition = readConfiguredDefinition();
    RuleSet compiled = ruleSetCompiler.compile(definition);
    activeDefinition = definition;
    activeRuleSet = compiled;
    log.info(
        "Loaded rule set {} with {} canonical fields",
        compiled.getVersion(),
        compiled.getAliasTable().getFields().size());
  }

  private RuleSetDefinition readConfiguredDefinition() {
    String overrideFile = properties.getRules().getOverrideFile();
    if (overrideFile != null && !overrideFile.isBlank()) {
      Path path = Path.of(overrideFile);
      try (InputStream is = Files.newInputStream(path)) {
        log.info("Reading rule set from {}", path);
        return objectMapper.readValue(is, RuleSetDefinition.class);
      } catch (IOException e) {
        log.error("Failed to read rule set from {}", path, e);
        throw new IllegalStateException("Failed to read rule set file " + path, e);
      }
    }

    String resource = properties.getRules().getResource();
    try (InputStream is = RuleSetRegistryService.class.getResourceAsStream(resource)) {
      if (is == null) {
        throw new IllegalStateException("Rule set resource not found: " + resource);
      }
      return objectMapper.readValue(is, RuleSetDefinition.class);
    } catch (IOException e) {
      log.error("Failed to read rule set resource {}", resource, e);
      throw new IllegalStateException("Failed to read rule set resource " + resource, e);
    }
  }

  public RuleSet getActiveRuleSet() {
    return activeRuleSet;
  }

  public RuleSetDefinition getActiveDefinition() {
    return activeDefinition;
  }

  /**
   * Rule set for one request: the active one, or the compiled inline definition when given.
   *
   * @throws InvalidRuleSetException if the inline definition does not compile
   */
  public RuleSet resolve(RuleSetDefinition inlineDefinition) {
    if (inlineDefinition == null) {
      return activeRuleSet;
    }
    if (inlineRuleSets == null) {
      return ruleSetCompiler.compile(inlineDefinition);
    }
    try {
      return inlineRuleSets.get(inlineDefinition, () -> ruleSetCompiler.compile(inlineDefinition));
    } catch (UncheckedExecutionException e) {
      if (e.getCause() instanceof InvalidRuleSetException) {
        throw (InvalidRuleSetException) e.getCause();
      }
      throw e;
    } catch (ExecutionException e) {
      throw new IllegalStateException("Failed to compile inline rule set", e.getCause());
    }
  }

  /** Re-reads the configured definition. The previous rule set stays active if this fails. */
  public RuleSet reload() {
    loadConfiguredRuleSet();
    if (inlineRuleSets != null) {
      inlineRuleSets.invalidateAll();
    }
    log.info("Reloaded rule set {}", activeRuleSet.getVersion());
    return activeRuleSet;
  }
}
