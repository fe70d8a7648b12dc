package io.intellixity.tenancy.store;

import io.intellixity.tenancy.store.entity.EvaluationDataset;

import java.util.List;
import java.util.Map;

/** Optional tracking capability: evaluation datasets linked to one or more experiments. */
public interface DatasetStore {
  EvaluationDataset createDataset(String name, List<String> experimentIds, Map<String, String> tags);

  EvaluationDataset getDataset(String datasetId);

  void deleteDataset(String datasetId);

  PagedList<EvaluationDataset> searchDatasets(List<String> experimentIds,
                                              String filterString,
                                              int maxResults,
                                              List<String> orderBy,
                                              String pageToken);
}
