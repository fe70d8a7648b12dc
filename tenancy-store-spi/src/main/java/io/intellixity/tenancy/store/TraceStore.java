package io.intellixity.tenancy.store;

import io.intellixity.tenancy.store.entity.TraceInfo;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Optional tracking capability: trace metadata attached to experiments. */
public interface TraceStore {
  int SEARCH_TRACES_DEFAULT_MAX_RESULTS = 100;

  TraceInfo startTrace(String experimentId, long timestampMs, Map<String, String> tags);

  Optional<TraceInfo> getTraceInfo(String traceId);

  PagedList<TraceInfo> searchTraces(List<String> experimentIds,
                                    String filterString,
                                    int maxResults,
                                    List<String> orderBy,
                                    String pageToken);

  void setTraceTag(String traceId, String key, String value);

  void deleteTraceTag(String traceId, String key);
}
