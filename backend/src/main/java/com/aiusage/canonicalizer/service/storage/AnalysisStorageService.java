package com.aiusage.canonicalizer.service.storage;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

import org.springframework.stereotype.Service;

import com.aiusage.canonicalizer.config.CanonicalizerProperties;
import com.aiusage.canonicalizer.dto.analysis.SurveyAnalysisResponse;
import com.aiusage.canonicalizer.model.HeaderResolution;

import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** In-memory store of recent analyses, used by the inspection and debug endpoints. */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisStorageService {

  private final CanonicalizerProperties properties;

  private final Map<String, StoredAnalysis> analysisStorage = new ConcurrentHashMap<>();
  private final ConcurrentLinkedDeque<String> insertionOrder = new ConcurrentLinkedDeque<>();

  @Data
  public static class StoredAnalysis {
    private String analysisId;
    private String fileName;
    private LocalDateTime timestamp;
    private SurveyAnalysisResponse response;
  }

  public synchronized String storeAnalysis(String fileName, SurveyAnalysisResponse response) {
    String analysisId = UUID.randomUUID().toString();

    StoredAnalysis analysis = new StoredAnalysis();
    analysis.setAnalysisId(analysisId);
    analysis.setFileName(fileName);
    analysis.setTimestamp(LocalDateTime.now());
    analysis.setResponse(response);

    analysisStorage.put(analysisId, analysis);
    insertionOrder.addLast(analysisId);
    evictOldest();
    log.info("Stored analysis {} for file {}", analysisId, fileName);

    return analysisId;
  }

  public StoredAnalysis getAnalysis(String analysisId) {
    return analysisStorage.get(analysisId);
  }

  /** Oldest first. */
  public List<StoredAnalysis> getAllAnalyses() {
    List<StoredAnalysis> analyses = new ArrayList<>();
    for (String id : insertionOrder) {
      StoredAnalysis analysis = analysisStorage.get(id);
      if (analysis != null) {
        analyses.add(analysis);
      }
    }
    return analyses;
  }

  public Optional<StoredAnalysis> getLatestAnalysis() {
    Iterator<String> newestFirst = insertionOrder.descendingIterator();
    while (newestFirst.hasNext()) {
      StoredAnalysis analysis = analysisStorage.get(newestFirst.next());
      if (analysis != null) {
        return Optional.of(analysis);
      }
    }
    return Optional.empty();
  }

  /** Original headers, canonical headers and the per-header mapping of the last analysis. */
  public Optional<HeaderResolution> getLatestHeaderResolution() {
    return getLatestAnalysis()
        .map(StoredAnalysis::getResponse)
        .map(SurveyAnalysisResponse::getHeaderResolution);
  }

  public synchronized void clearAnalyses() {
    analysisStorage.clear();
    insertionOrder.clear();
    log.info("Cleared all stored analyses");
  }

  public synchronized boolean deleteAnalysis(String analysisId) {
    StoredAnalysis removed = analysisStorage.remove(analysisId);
    if (removed != null) {
      insertionOrder.remove(analysisId);
      log.info("Deleted analysis {} for file {}", analysisId, removed.getFileName());
      return true;
    }
    log.warn("Analysis not found for deletion: {}", analysisId);
    return false;
  }

  public int size() {
    return analysisStorage.size();
  }

  private void evictOldest() {
    int limit = Math.max(1, properties.getStorage().getMaxAnalyses());
    while (insertionOrder.size() > limit) {
      String evicted = insertionOrder.pollFirst();
      if (evicted != null) {
        analysisStorage.remove(evicted);
        log.debug("Evicted analysis {} to stay within {} stored analyses", evicted, limit);
      }
    }
  }
}
