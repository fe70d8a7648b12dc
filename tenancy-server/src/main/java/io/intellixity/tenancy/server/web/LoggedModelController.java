package io.intellixity.tenancy.server.web;

import io.intellixity.tenancy.core.ErrorCode;
import io.intellixity.tenancy.store.LoggedModelStore;
import io.intellixity.tenancy.store.MetadataStoreException;
import io.intellixity.tenancy.store.PagedList;
import io.intellixity.tenancy.store.TrackingStore;
import io.intellixity.tenancy.store.entity.LoggedModel;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping({"/api/2.0/mlflow/logged-models", "/ajax-api/2.0/mlflow/logged-models"})
public final class LoggedModelController {
  private final TrackingStore tracking;

  public LoggedModelController(TrackingStore tracking) {
    this.tracking = tracking;
  }

  public record CreateLoggedModelRequest(String experimentId, String name, Map<String, String> tags) {}

  public record SearchLoggedModelsRequest(List<String> experimentIds,
                                          String filter,
                                          Integer maxResults,
                                          List<String> orderBy,
                                          String pageToken) {}

  @PostMapping
  public Map<String, LoggedModel> create(@RequestBody CreateLoggedModelRequest req) {
    return Map.of("model", models().createLoggedModel(req.experimentId(), req.name(), req.tags()));
  }

  @GetMapping("/{modelId}")
  public Map<String, LoggedModel> get(@PathVariable("modelId") String modelId) {
    return Map.of("model", models().getLoggedModel(modelId));
  }

  @DeleteMapping("/{modelId}")
  public Map<String, Object> delete(@PathVariable("modelId") String modelId) {
    models().deleteLoggedModel(modelId);
    return Map.of();
  }

  @PostMapping("/search")
  public PagedList<LoggedModel> search(@RequestBody SearchLoggedModelsRequest req) {
    int max = req.maxResults() == null ? TrackingStore.SEARCH_MAX_RESULTS_DEFAULT : req.maxResults();
    return models().searchLoggedModels(req.experimentIds(), req.filter(), max, req.orderBy(), req.pageToken());
  }

  private LoggedModelStore models() {
    return tracking.loggedModels()
        .orElseThrow(() -> new MetadataStoreException(ErrorCode.NOT_IMPLEMENTED, "Logged models are not supported by this store"));
  }
}
