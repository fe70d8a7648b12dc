package io.intellixity.tenancy.server.web;

import io.intellixity.tenancy.core.ErrorCode;
import io.intellixity.tenancy.store.MetadataStoreException;
import io.intellixity.tenancy.store.PagedList;
import io.intellixity.tenancy.store.TraceStore;
import io.intellixity.tenancy.store.TrackingStore;
import io.intellixity.tenancy.store.entity.TraceInfo;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping({"/api/2.0/mlflow/traces", "/ajax-api/2.0/mlflow/traces"})
public final class TraceController {
  private final TrackingStore tracking;

  public TraceController(TrackingStore tracking) {
    this.tracking = tracking;
  }

  public record StartTraceRequest(String experimentId, Long timestampMs, Map<String, String> tags) {}

  public record SearchTracesRequest(List<String> experimentIds,
                                    String filter,
                                    Integer maxResults,
                                    List<String> orderBy,
                                    String pageToken) {}

  public record TraceTagRequest(String key, String value) {}

  @PostMapping
  public Map<String, TraceInfo> start(@RequestBody StartTraceRequest req) {
    long ts = req.timestampMs() == null ? System.currentTimeMillis() : req.timestampMs();
    return Map.of("trace_info", traces().startTrace(req.experimentId(), ts, req.tags()));
  }

  @GetMapping("/{traceId}/info")
  public Map<String, TraceInfo> info(@PathVariable("traceId") String traceId) {
    TraceInfo t = traces().getTraceInfo(traceId)
        .orElseThrow(() -> MetadataStoreException.notFound("Trace with ID '" + traceId + "' not found"));
    return Map.of("trace_info", t);
  }

  @PostMapping("/search")
  public PagedList<TraceInfo> search(@RequestBody SearchTracesRequest req) {
    int max = req.maxResults() == null ? TraceStore.SEARCH_TRACES_DEFAULT_MAX_RESULTS : req.maxResults();
    return traces().searchTraces(req.experimentIds(), req.filter(), max, req.orderBy(), req.pageToken());
  }

  @PatchMapping("/{traceId}/tags")
  public Map<String, Object> setTag(@PathVariable("traceId") String traceId, @RequestBody TraceTagRequest req) {
    traces().setTraceTag(traceId, req.key(), req.value());
    return Map.of();
  }

  @DeleteMapping("/{traceId}/tags")
  public Map<String, Object> deleteTag(@PathVariable("traceId") String traceId, @RequestParam("key") String key) {
    traces().deleteTraceTag(traceId, key);
    return Map.of();
  }

  private TraceStore traces() {
    return tracking.traces()
        .orElseThrow(() -> new MetadataStoreException(ErrorCode.NOT_IMPLEMENTED, "Traces are not supported by this store"));
  }
}
