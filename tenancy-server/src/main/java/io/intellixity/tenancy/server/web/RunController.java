package io.intellixity.tenancy.server.web;

import io.intellixity.tenancy.store.PagedList;
import io.intellixity.tenancy.store.TrackingStore;
import io.intellixity.tenancy.store.ViewType;
import io.intellixity.tenancy.store.entity.*;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping({"/api/2.0/mlflow", "/ajax-api/2.0/mlflow"})
public final class RunController {
  private final TrackingStore tracking;

  public RunController(TrackingStore tracking) {
    this.tracking = tracking;
  }

  public record CreateRunRequest(String experimentId, String userId, Long startTime, List<Tag> tags, String runName) {}

  public record RunIdRequest(String runId) {}

  public record UpdateRunRequest(String runId, RunStatus status, Long endTime, String runName) {}

  public record RunTagRequest(String runId, String key, String value) {}

  public record LogMetricRequest(String runId, String key, double value, Long timestamp, Long step) {}

  public record LogBatchRequest(String runId, List<Metric> metrics, List<Param> params, List<Tag> tags) {}

  public record SearchRunsRequest(List<String> experimentIds,
                                  String filter,
                                  ViewType runViewType,
                                  Integer maxResults,
                                  List<String> orderBy,
                                  String pageToken) {}

  @PostMapping("/runs/create")
  public Map<String, Run> create(@RequestBody CreateRunRequest req) {
    long start = req.startTime() == null ? System.currentTimeMillis() : req.startTime();
    return Map.of("run", tracking.createRun(req.experimentId(), req.userId(), start, req.tags(), req.runName()));
  }

  @GetMapping("/runs/get")
  public Map<String, Run> get(@RequestParam("run_id") String runId) {
    return Map.of("run", tracking.getRun(runId));
  }

  @PostMapping("/runs/delete")
  public Map<String, Object> delete(@RequestBody RunIdRequest req) {
    tracking.deleteRun(req.runId());
    return Map.of();
  }

  @PostMapping("/runs/restore")
  public Map<String, Object> restore(@RequestBody RunIdRequest req) {
    tracking.restoreRun(req.runId());
    return Map.of();
  }

  @PostMapping("/runs/update")
  public Map<String, RunInfo> update(@RequestBody UpdateRunRequest req) {
    return Map.of("run_info", tracking.updateRunInfo(req.runId(), req.status(), req.endTime(), req.runName()));
  }

  @PostMapping("/runs/set-tag")
  public Map<String, Object> setTag(@RequestBody RunTagRequest req) {
    tracking.setTag(req.runId(), new Tag(req.key(), req.value()));
    return Map.of();
  }

  @PostMapping("/runs/delete-tag")
  public Map<String, Object> deleteTag(@RequestBody RunTagRequest req) {
    tracking.deleteTag(req.runId(), req.key());
    return Map.of();
  }

  @PostMapping("/runs/log-metric")
  public Map<String, Object> logMetric(@RequestBody LogMetricRequest req) {
    long ts = req.timestamp() == null ? System.currentTimeMillis() : req.timestamp();
    long step = req.step() == null ? 0L : req.step();
    tracking.logMetric(req.runId(), new Metric(req.key(), req.value(), ts, step));
    return Map.of();
  }

  @PostMapping("/runs/log-parameter")
  public Map<String, Object> logParam(@RequestBody RunTagRequest req) {
    tracking.logParam(req.runId(), new Param(req.key(), req.value()));
    return Map.of();
  }

  @PostMapping("/runs/log-batch")
  public Map<String, Object> logBatch(@RequestBody LogBatchRequest req) {
    tracking.logBatch(req.runId(), req.metrics(), req.params(), req.tags());
    return Map.of();
  }

  @GetMapping("/runs/search")
  public PagedList<Run> searchGet(@RequestParam(value = "experiment_ids") List<String> experimentIds,
                                  @RequestParam(value = "filter", required = false) String filter,
                                  @RequestParam(value = "run_view_type", required = false) ViewType viewType,
                                  @RequestParam(value = "max_results", required = false) Integer maxResults,
                                  @RequestParam(value = "order_by", required = false) List<String> orderBy,
                                  @RequestParam(value = "page_token", required = false) String pageToken) {
    return search(new SearchRunsRequest(experimentIds, filter, viewType, maxResults, orderBy, pageToken));
  }

  @PostMapping("/runs/search")
  public PagedList<Run> search(@RequestBody SearchRunsRequest req) {
    int max = req.maxResults() == null ? TrackingStore.SEARCH_MAX_RESULTS_DEFAULT : req.maxResults();
    return tracking.searchRuns(req.experimentIds(), req.filter(), req.runViewType(), max, req.orderBy(), req.pageToken());
  }

  @GetMapping("/metrics/get-history")
  public Map<String, List<Metric>> metricHistory(@RequestParam("run_id") String runId,
                                                 @RequestParam("metric_key") String metricKey) {
    return Map.of("metrics", tracking.getMetricHistory(runId, metricKey));
  }
}
