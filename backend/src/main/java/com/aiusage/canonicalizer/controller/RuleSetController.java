package com.aiusage.canonicalizer.controller;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.aiusage.canonicalizer.dto.rules.RuleSetDefinition;
import com.aiusage.canonicalizer.model.RuleSet;
import com.aiusage.canonicalizer.service.rules.RuleSetRegistryService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/rules")
@RequiredArgsConstructor
@Tag(name = "Rule Set", description = "Active alias, value and feedback rules")
public class RuleSetController {

  private final RuleSetRegistryService ruleSetRegistry;

  @GetMapping
  @Operation(
      summary = "Get the active rule set",
      description = "Returns the rule set definition every analysis uses by default")
  @ApiResponses(value = {@ApiResponse(responseCode = "200", description = "Active rule set")})
  public ResponseEntity<RuleSetDefinition> getActiveRules() {
    return ResponseEntity.ok(ruleSetRegistry.getActiveDefinition());
  }

  @PostMapping("/reload")
  @Operation(
      summary = "Reload the rule set",
      description = "Re-reads the configured rule file; the current rules stay active on failure")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Rule set reloaded"),
        @ApiResponse(responseCode = "400", description = "Configured rule set is invalid"),
        @ApiResponse(responseCode = "500", description = "Rule file could not be read")
      })
  public ResponseEntity<Map<String, Object>> reload() {
    RuleSet ruleSet = ruleSetRegistry.reload();
    log.info("Rule set reloaded on request: {}", ruleSet.getVersion());
    return ResponseEntity.ok(
        Map.of(
            "status", "RELOADED",
            "version", ruleSet.getVersion() != null ? ruleSet.getVersion() : "",
            "canonical_fields", ruleSet.getAliasTable().canonicalNames()));
  }
}
