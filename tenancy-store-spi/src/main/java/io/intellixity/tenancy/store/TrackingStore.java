package io.intellixity.tenancy.store;

import io.intellixity.tenancy.store.entity.*;

import java.util.List;
import java.util.Optional;

/**
 * Tracking metadata store: experiments (containers) and the runs, metrics, params and tags they own.\n
 *
 * Optional capabilities are exposed through {@link #traces()}, {@link #loggedModels()} and {@link #datasets()};
 * a store that does not implement one returns {@link Optional#empty()}. Callers resolve them once.
 */
public interface TrackingStore {
  int SEARCH_MAX_RESULTS_DEFAULT = 1000;

  /** Read-only description of the backing implementation (not tenant data). */
  String backend();

  /** Create an experiment and return its id. */
  String createExperiment(String name, String artifactLocation, List<Tag> tags);

  /** Throws {@link MetadataStoreException} with RESOURCE_DOES_NOT_EXIST when absent. */
  Experiment getExperiment(String experimentId);

  Optional<Experiment> getExperimentByName(String name);

  PagedList<Experiment> searchExperiments(ViewType viewType,
                                          int maxResults,
                                          String filterString,
                                          List<String> orderBy,
                                          String pageToken);

  void deleteExperiment(String experimentId);

  void restoreExperiment(String experimentId);

  void renameExperiment(String experimentId, String newName);

  void setExperimentTag(String experimentId, Tag tag);

  void deleteExperimentTag(String experimentId, String key);

  Run createRun(String experimentId, String userId, long startTime, List<Tag> tags, String runName);

  Run getRun(String runId);

  void deleteRun(String runId);

  void restoreRun(String runId);

  RunInfo updateRunInfo(String runId, RunStatus status, Long endTime, String runName);

  void setTag(String runId, Tag tag);

  void deleteTag(String runId, String key);

  void logMetric(String runId, Metric metric);

  void logParam(String runId, Param param);

  void logBatch(String runId, List<Metric> metrics, List<Param> params, List<Tag> tags);

  List<Metric> getMetricHistory(String runId, String metricKey);

  PagedList<Run> searchRuns(List<String> experimentIds,
                            String filterString,
                            ViewType runViewType,
                            int maxResults,
                            List<String> orderBy,
                            String pageToken);

  default Optional<TraceStore> traces() {
    return Optional.empty();
  }

  default Optional<LoggedModelStore> loggedModels() {
    return Optional.empty();
  }

  default Optional<DatasetStore> datasets() {
    return Optional.empty();
  }
}
