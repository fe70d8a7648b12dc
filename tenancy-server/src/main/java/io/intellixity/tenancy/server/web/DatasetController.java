package io.intellixity.tenancy.server.web;

import io.intellixity.tenancy.core.ErrorCode;
import io.intellixity.tenancy.store.DatasetStore;
import io.intellixity.tenancy.store.MetadataStoreException;
import io.intellixity.tenancy.store.PagedList;
import io.intellixity.tenancy.store.TrackingStore;
import io.intellixity.tenancy.store.entity.EvaluationDataset;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping({"/api/3.0/mlflow/datasets", "/ajax-api/3.0/mlflow/datasets"})
public final class DatasetController {
  private final TrackingStore tracking;

  public DatasetController(TrackingStore tracking) {
    this.tracking = tracking;
  }

  public record CreateDatasetRequest(String name, List<String> experimentIds, Map<String, String> tags) {}

  public record SearchDatasetsRequest(List<String> experimentIds,
                                      String filter,
                                      Integer maxResults,
                                      List<String> orderBy,
                                      String pageToken) {}

  @PostMapping("/create")
  public Map<String, EvaluationDataset> create(@RequestBody CreateDatasetRequest req) {
    return Map.of("dataset", datasets().createDataset(req.name(), req.experimentIds(), req.tags()));
  }

  @GetMapping("/{datasetId}")
  public Map<String, EvaluationDataset> get(@PathVariable("datasetId") String datasetId) {
    return Map.of("dataset", datasets().getDataset(datasetId));
  }

  @DeleteMapping("/{datasetId}")
  public Map<String, Object> delete(@PathVariable("datasetId") String datasetId) {
    datasets().deleteDataset(datasetId);
    return Map.of();
  }

  @PostMapping("/search")
  public PagedList<EvaluationDataset> search(@RequestBody SearchDatasetsRequest req) {
    int max = req.maxResults() == null ? TrackingStore.SEARCH_MAX_RESULTS_DEFAULT : req.maxResults();
    return datasets().searchDatasets(req.experimentIds(), req.filter(), max, req.orderBy(), req.pageToken());
  }

  private DatasetStore datasets() {
    return tracking.datasets()
        .orElseThrow(() -> new MetadataStoreException(ErrorCode.NOT_IMPLEMENTED, "Datasets are not supported by this store"));
  }
}
