package io.intellixity.tenancy.server.web;

import io.intellixity.tenancy.store.MetadataStoreException;
import io.intellixity.tenancy.store.PagedList;
import io.intellixity.tenancy.store.TrackingStore;
import io.intellixity.tenancy.store.ViewType;
import io.intellixity.tenancy.store.entity.Experiment;
import io.intellixity.tenancy.store.entity.Tag;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping({"/api/2.0/mlflow/experiments", "/ajax-api/2.0/mlflow/experiments"})
public final class ExperimentController {
  private final TrackingStore tracking;

  public ExperimentController(TrackingStore tracking) {
    this.tracking = tracking;
  }

  public record CreateExperimentRequest(String name, String artifactLocation, List<Tag> tags) {}

  public record ExperimentIdRequest(String experimentId) {}

  public record UpdateExperimentRequest(String experimentId, String newName) {}

  public record ExperimentTagRequest(String experimentId, String key, String value) {}

  public record SearchExperimentsRequest(Integer maxResults,
                                         String filter,
                                         ViewType viewType,
                                         List<String> orderBy,
                                         String pageToken) {}

  @PostMapping("/create")
  public Map<String, String> create(@RequestBody CreateExperimentRequest req) {
    return Map.of("experiment_id", tracking.createExperiment(req.name(), req.artifactLocation(), req.tags()));
  }

  @GetMapping("/get")
  public Map<String, Experiment> get(@RequestParam("experiment_id") String experimentId) {
    return Map.of("experiment", tracking.getExperiment(experimentId));
  }

  @GetMapping("/get-by-name")
  public Map<String, Experiment> getByName(@RequestParam("experiment_name") String name) {
    Experiment e = tracking.getExperimentByName(name)
        .orElseThrow(() -> MetadataStoreException.notFound("Could not find experiment with name '" + name + "'"));
    return Map.of("experiment", e);
  }

  @GetMapping("/search")
  public PagedList<Experiment> searchGet(@RequestParam(value = "max_results", required = false) Integer maxResults,
                                         @RequestParam(value = "filter", required = false) String filter,
                                         @RequestParam(value = "view_type", required = false) ViewType viewType,
                                         @RequestParam(value = "order_by", required = false) List<String> orderBy,
                                         @RequestParam(value = "page_token", required = false) String pageToken) {
    return search(new SearchExperimentsRequest(maxResults, filter, viewType, orderBy, pageToken));
  }

  @PostMapping("/search")
  public PagedList<Experiment> search(@RequestBody SearchExperimentsRequest req) {
    int max = req.maxResults() == null ? TrackingStore.SEARCH_MAX_RESULTS_DEFAULT : req.maxResults();
    return tracking.searchExperiments(req.viewType(), max, req.filter(), req.orderBy(), req.pageToken());
  }

  @PostMapping("/delete")
  public Map<String, Object> delete(@RequestBody ExperimentIdRequest req) {
    tracking.deleteExperiment(req.experimentId());
    return Map.of();
  }

  @PostMapping("/restore")
  public Map<String, Object> restore(@RequestBody ExperimentIdRequest req) {
    tracking.restoreExperiment(req.experimentId());
    return Map.of();
  }

  @PostMapping("/update")
  public Map<String, Object> update(@RequestBody UpdateExperimentRequest req) {
    tracking.renameExperiment(req.experimentId(), req.newName());
    return Map.of();
  }

  @PostMapping("/set-experiment-tag")
  public Map<String, Object> setTag(@RequestBody ExperimentTagRequest req) {
    tracking.setExperimentTag(req.experimentId(), new Tag(req.key(), req.value()));
    return Map.of();
  }

  @PostMapping("/delete-experiment-tag")
  public Map<String, Object> deleteTag(@RequestBody ExperimentTagRequest req) {
    tracking.deleteExperimentTag(req.experimentId(), req.key());
    return Map.of();
  }
}
