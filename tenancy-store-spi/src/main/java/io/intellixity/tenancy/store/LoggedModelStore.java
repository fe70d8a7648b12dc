package io.intellixity.tenancy.store;

import io.intellixity.tenancy.store.entity.LoggedModel;

import java.util.List;
import java.util.Map;

/** Optional tracking capability: models logged under an experiment. */
public interface LoggedModelStore {
  LoggedModel createLoggedModel(String experimentId, String name, Map<String, String> tags);

  LoggedModel getLoggedModel(String modelId);

  void deleteLoggedModel(String modelId);

  PagedList<LoggedModel> searchLoggedModels(List<String> experimentIds,
                                            String filterString,
                                            int maxResults,
                                            List<String> orderBy,
                                            String pageToken);
}
