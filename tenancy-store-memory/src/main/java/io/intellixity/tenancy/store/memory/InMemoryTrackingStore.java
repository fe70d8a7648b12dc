package io.intellixity.tenancy.store.memory;

import io.intellixity.tenancy.store.*;
import io.intellixity.tenancy.store.entity.*;
import io.intellixity.tenancy.store.filter.FilterClause;
import io.intellixity.tenancy.store.filter.SearchFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe in-memory {@link TrackingStore}.\n
 *
 * Backs the embedded server and the tests. Every optional capability is implemented, and each one can be left out
 * at construction to behave like a backing store that does not support it.
 */
public final class InMemoryTrackingStore implements TrackingStore, TraceStore, LoggedModelStore, DatasetStore {
  private static final Logger log = LoggerFactory.getLogger(InMemoryTrackingStore.class);

  private final Set<TrackingCapability> capabilities;
  private final AtomicLong ids = new AtomicLong();

  private final Map<String, ExperimentRow> experiments = new LinkedHashMap<>();
  private final Map<String, RunRow> runs = new LinkedHashMap<>();
  private final Map<String, TraceInfo> traces = new LinkedHashMap<>();
  private final Map<String, LoggedModel> loggedModels = new LinkedHashMap<>();
  private final Map<String, EvaluationDataset> datasets = new LinkedHashMap<>();

  private static final class ExperimentRow {
    final String id;
    String name;
    final String artifactLocation;
    LifecycleStage stage = LifecycleStage.ACTIVE;
    final Map<String, String> tags = new LinkedHashMap<>();

    ExperimentRow(String id, String name, String artifactLocation) {
      this.id = id;
      this.name = name;
      this.artifactLocation = artifactLocation;
    }

    Experiment toEntity() {
      return new Experiment(id, name, artifactLocation, stage, tags);
    }
  }

  private static final class RunRow {
    final String id;
    final String experimentId;
    final String userId;
    final long startTime;
    String runName;
    RunStatus status = RunStatus.RUNNING;
    Long endTime;
    LifecycleStage stage = LifecycleStage.ACTIVE;
    final List<Metric> metricHistory = new ArrayList<>();
    final Map<String, String> params = new LinkedHashMap<>();
    final Map<String, String> tags = new LinkedHashMap<>();

    RunRow(String id, String experimentId, String userId, long startTime, String runName) {
      this.id = id;
      this.experimentId = experimentId;
      this.userId = userId;
      this.startTime = startTime;
      this.runName = runName;
    }

    RunInfo info() {
      return new RunInfo(id, experimentId, runName, userId, status, startTime, endTime, stage);
    }

    Run toEntity() {
      Map<String, Metric> latest = new LinkedHashMap<>();
      for (Metric m : metricHistory) {
        Metric prev = latest.get(m.key());
        if (prev == null || m.step() > prev.step() || (m.step() == prev.step() && m.timestamp() >= prev.timestamp())) {
          latest.put(m.key(), m);
        }
      }
      return new Run(info(), new RunData(List.copyOf(latest.values()), params, tags));
    }

    Map<String, String> attributes() {
      Map<String, String> a = new HashMap<>();
      a.put("run_id", id);
      a.put("run_name", runName);
      a.put("status", status.name());
      a.put("user_id", userId);
      return a;
    }
  }

  public InMemoryTrackingStore() {
    this(EnumSet.allOf(TrackingCapability.class));
  }

  public InMemoryTrackingStore(Set<TrackingCapability> capabilities) {
    this.capabilities = capabilities == null || capabilities.isEmpty()
        ? EnumSet.noneOf(TrackingCapability.class)
        : EnumSet.copyOf(capabilities);
  }

  @Override
  public String backend() {
    return "memory";
  }

  @Override
  public Optional<TraceStore> traces() {
    return capabilities.contains(TrackingCapability.TRACES) ? Optional.of(this) : Optional.empty();
  }

  @Override
  public Optional<LoggedModelStore> loggedModels() {
    return capabilities.contains(TrackingCapability.LOGGED_MODELS) ? Optional.of(this) : Optional.empty();
  }

  @Override
  public Optional<DatasetStore> datasets() {
    return capabilities.contains(TrackingCapability.DATASETS) ? Optional.of(this) : Optional.empty();
  }

  // ---------- experiments ----------

  @Override
  public synchronized String createExperiment(String name, String artifactLocation, List<Tag> tags) {
    if (name == null || name.isBlank()) throw MetadataStoreException.invalidParameter("Experiment name must not be empty");
    for (ExperimentRow e : experiments.values()) {
      if (e.name.equals(name)) throw MetadataStoreException.alreadyExists("Experiment '" + name + "' already exists.");
    }
    String id = nextId();
    ExperimentRow row = new ExperimentRow(id, name, artifactLocation == null ? "memory:/" + id : artifactLocation);
    row.tags.putAll(Tags.toMap(tags));
    experiments.put(id, row);
    log.debug("tenancy.memory op=createExperiment id={} name={}", id, name);
    return id;
  }

  @Override
  public synchronized Experiment getExperiment(String experimentId) {
    return experimentRow(experimentId).toEntity();
  }

  @Override
  public synchronized Optional<Experiment> getExperimentByName(String name) {
    for (ExperimentRow e : experiments.values()) {
      if (e.name.equals(name)) return Optional.of(e.toEntity());
    }
    return Optional.empty();
  }

  @Override
  public synchronized PagedList<Experiment> searchExperiments(ViewType viewType,
                                                              int maxResults,
                                                              String filterString,
                                                              List<String> orderBy,
                                                              String pageToken) {
    List<FilterClause> clauses = SearchFilter.parse(filterString);
    List<Experiment> hits = new ArrayList<>();
    for (ExperimentRow e : experiments.values()) {
      if (!MemoryQueries.visible(viewType, e.stage)) continue;
      Map<String, String> attrs = new HashMap<>();
      attrs.put("name", e.name);
      attrs.put("experiment_id", e.id);
      if (MemoryQueries.matches(clauses, attrs, e.tags)) hits.add(e.toEntity());
    }
    return MemoryQueries.page(hits, maxResults, pageToken);
  }

  @Override
  public synchronized void deleteExperiment(String experimentId) {
    experimentRow(experimentId).stage = LifecycleStage.DELETED;
  }

  @Override
  public synchronized void restoreExperiment(String experimentId) {
    experimentRow(experimentId).stage = LifecycleStage.ACTIVE;
  }

  @Override
  public synchronized void renameExperiment(String experimentId, String newName) {
    ExperimentRow row = experimentRow(experimentId);
    if (newName == null || newName.isBlank()) throw MetadataStoreException.invalidParameter("Experiment name must not be empty");
    for (ExperimentRow e : experiments.values()) {
      if (e != row && e.name.equals(newName)) {
        throw MetadataStoreException.alreadyExists("Experiment '" + newName + "' already exists.");
      }
    }
    row.name = newName;
  }

  @Override
  public synchronized void setExperimentTag(String experimentId, Tag tag) {
    experimentRow(experimentId).tags.put(tag.key(), tag.value());
  }

  @Override
  public synchronized void deleteExperimentTag(String experimentId, String key) {
    ExperimentRow row = experimentRow(experimentId);
    if (!row.tags.containsKey(key)) {
      throw MetadataStoreException.notFound("No tag with name: " + key + " in experiment " + experimentId);
    }
    row.tags.remove(key);
  }

  // ---------- runs ----------

  @Override
  public synchronized Run createRun(String experimentId, String userId, long startTime, List<Tag> tags, String runName) {
    ExperimentRow exp = experimentRow(experimentId);
    if (exp.stage != LifecycleStage.ACTIVE) {
      throw MetadataStoreException.invalidParameter("Experiment " + experimentId + " is not active");
    }
    String id = "run-" + nextId();
    RunRow row = new RunRow(id, experimentId, userId, startTime, runName == null ? id : runName);
    row.tags.putAll(Tags.toMap(tags));
    runs.put(id, row);
    log.debug("tenancy.memory op=createRun id={} experimentId={}", id, experimentId);
    return row.toEntity();
  }

  @Override
  public synchronized Run getRun(String runId) {
    return runRow(runId).toEntity();
  }

  @Override
  public synchronized void deleteRun(String runId) {
    runRow(runId).stage = LifecycleStage.DELETED;
  }

  @Override
  public synchronized void restoreRun(String runId) {
    runRow(runId).stage = LifecycleStage.ACTIVE;
  }

  @Override
  public synchronized RunInfo updateRunInfo(String runId, RunStatus status, Long endTime, String runName) {
    RunRow row = runRow(runId);
    if (status != null) row.status = status;
    if (endTime != null) row.endTime = endTime;
    if (runName != null && !runName.isBlank()) row.runName = runName;
    return row.info();
  }

  @Override
  public synchronized void setTag(String runId, Tag tag) {
    runRow(runId).tags.put(tag.key(), tag.value());
  }

  @Override
  public synchronized void deleteTag(String runId, String key) {
    RunRow row = runRow(runId);
    if (!row.tags.containsKey(key)) throw MetadataStoreException.notFound("No tag with name: " + key + " in run " + runId);
    row.tags.remove(key);
  }

  @Override
  public synchronized void logMetric(String runId, Metric metric) {
    activeRun(runId).metricHistory.add(Objects.requireNonNull(metric, "metric"));
  }

  @Override
  public synchronized void logParam(String runId, Param param) {
    RunRow row = activeRun(runId);
    String existing = row.params.get(param.key());
    if (existing != null && !existing.equals(param.value())) {
      throw MetadataStoreException.invalidParameter("Changing param values is not allowed. Param with key='"
          + param.key() + "' was already logged with value='" + existing + "'");
    }
    row.params.put(param.key(), param.value());
  }

  @Override
  public synchronized void logBatch(String runId, List<Metric> metrics, List<Param> params, List<Tag> tags) {
    activeRun(runId);
    if (params != null) for (Param p : params) logParam(runId, p);
    if (metrics != null) for (Metric m : metrics) logMetric(runId, m);
    if (tags != null) for (Tag t : tags) setTag(runId, t);
  }

  @Override
  public synchronized List<Metric> getMetricHistory(String runId, String metricKey) {
    return runRow(runId).metricHistory.stream().filter(m -> m.key().equals(metricKey)).toList();
  }

  @Override
  public synchronized PagedList<Run> searchRuns(List<String> experimentIds,
                                                String filterString,
                                                ViewType runViewType,
                                                int maxResults,
                                                List<String> orderBy,
                                                String pageToken) {
    List<FilterClause> clauses = SearchFilter.parse(filterString);
    Set<String> wanted = experimentIds == null ? Set.of() : new HashSet<>(experimentIds);
    List<Run> hits = new ArrayList<>();
    for (RunRow r : runs.values()) {
      if (!wanted.contains(r.experimentId)) continue;
      if (!MemoryQueries.visible(runViewType, r.stage)) continue;
      if (MemoryQueries.matches(clauses, r.attributes(), r.tags)) hits.add(r.toEntity());
    }
    return MemoryQueries.page(hits, maxResults, pageToken);
  }

  // ---------- traces ----------

  @Override
  public synchronized TraceInfo startTrace(String experimentId, long timestampMs, Map<String, String> tags) {
    experimentRow(experimentId);
    String id = "tr-" + nextId();
    TraceInfo t = new TraceInfo(id, experimentId, timestampMs, tags);
    traces.put(id, t);
    return t;
  }

  @Override
  public synchronized Optional<TraceInfo> getTraceInfo(String traceId) {
    return Optional.ofNullable(traces.get(traceId));
  }

  @Override
  public synchronized PagedList<TraceInfo> searchTraces(List<String> experimentIds,
                                                        String filterString,
                                                        int maxResults,
                                                        List<String> orderBy,
                                                        String pageToken) {
    List<FilterClause> clauses = SearchFilter.parse(filterString);
    Set<String> wanted = experimentIds == null ? Set.of() : new HashSet<>(experimentIds);
    List<TraceInfo> hits = new ArrayList<>();
    for (TraceInfo t : traces.values()) {
      if (!wanted.contains(t.experimentId())) continue;
      if (MemoryQueries.matches(clauses, Map.of("trace_id", t.traceId()), t.tags())) hits.add(t);
    }
    return MemoryQueries.page(hits, maxResults, pageToken);
  }

  @Override
  public synchronized void setTraceTag(String traceId, String key, String value) {
    TraceInfo t = traceRow(traceId);
    Map<String, String> tags = new LinkedHashMap<>(t.tags());
    tags.put(key, value);
    traces.put(traceId, new TraceInfo(traceId, t.experimentId(), t.timestampMs(), tags));
  }

  @Override
  public synchronized void deleteTraceTag(String traceId, String key) {
    TraceInfo t = traceRow(traceId);
    if (!t.tags().containsKey(key)) throw MetadataStoreException.notFound("No tag with name: " + key + " in trace " + traceId);
    Map<String, String> tags = new LinkedHashMap<>(t.tags());
    tags.remove(key);
    traces.put(traceId, new TraceInfo(traceId, t.experimentId(), t.timestampMs(), tags));
  }

  // ---------- logged models ----------

  @Override
  public synchronized LoggedModel createLoggedModel(String experimentId, String name, Map<String, String> tags) {
    experimentRow(experimentId);
    String id = "m-" + nextId();
    LoggedModel m = new LoggedModel(id, experimentId, name == null ? id : name, tags);
    loggedModels.put(id, m);
    return m;
  }

  @Override
  public synchronized LoggedModel getLoggedModel(String modelId) {
    LoggedModel m = loggedModels.get(modelId);
    if (m == null) throw MetadataStoreException.notFound("Logged model with ID '" + modelId + "' not found.");
    return m;
  }

  @Override
  public synchronized void deleteLoggedModel(String modelId) {
    getLoggedModel(modelId);
    loggedModels.remove(modelId);
  }

  @Override
  public synchronized PagedList<LoggedModel> searchLoggedModels(List<String> experimentIds,
                                                                String filterString,
                                                                int maxResults,
                                                                List<String> orderBy,
                                                                String pageToken) {
    List<FilterClause> clauses = SearchFilter.parse(filterString);
    Set<String> wanted = experimentIds == null ? Set.of() : new HashSet<>(experimentIds);
    List<LoggedModel> hits = new ArrayList<>();
    for (LoggedModel m : loggedModels.values()) {
      if (!wanted.contains(m.experimentId())) continue;
      if (MemoryQueries.matches(clauses, Map.of("name", m.name(), "model_id", m.modelId()), m.tags())) hits.add(m);
    }
    return MemoryQueries.page(hits, maxResults, pageToken);
  }

  // ---------- datasets ----------

  @Override
  public synchronized EvaluationDataset createDataset(String name, List<String> experimentIds, Map<String, String> tags) {
    if (experimentIds != null) for (String id : experimentIds) experimentRow(id);
    String id = "d-" + nextId();
    EvaluationDataset d = new EvaluationDataset(id, name, experimentIds, tags);
    datasets.put(id, d);
    return d;
  }

  @Override
  public synchronized EvaluationDataset getDataset(String datasetId) {
    EvaluationDataset d = datasets.get(datasetId);
    if (d == null) throw MetadataStoreException.notFound("Dataset '" + datasetId + "' not found.");
    return d;
  }

  @Override
  public synchronized void deleteDataset(String datasetId) {
    getDataset(datasetId);
    datasets.remove(datasetId);
  }

  @Override
  public synchronized PagedList<EvaluationDataset> searchDatasets(List<String> experimentIds,
                                                                  String filterString,
                                                                  int maxResults,
                                                                  List<String> orderBy,
                                                                  String pageToken) {
    List<FilterClause> clauses = SearchFilter.parse(filterString);
    Set<String> wanted = experimentIds == null ? Set.of() : new HashSet<>(experimentIds);
    List<EvaluationDataset> hits = new ArrayList<>();
    for (EvaluationDataset d : datasets.values()) {
      boolean linked = wanted.isEmpty() || d.experimentIds().stream().anyMatch(wanted::contains);
      if (!linked) continue;
      Map<String, String> attrs = new HashMap<>();
      attrs.put("name", d.name());
      attrs.put("dataset_id", d.datasetId());
      if (MemoryQueries.matches(clauses, attrs, d.tags())) hits.add(d);
    }
    return MemoryQueries.page(hits, maxResults, pageToken);
  }

  // ---------- internals ----------

  private String nextId() {
    return String.valueOf(ids.incrementAndGet());
  }

  private ExperimentRow experimentRow(String experimentId) {
    ExperimentRow row = experimentId == null ? null : experiments.get(experimentId);
    if (row == null) throw MetadataStoreException.notFound("No Experiment with id=" + experimentId + " exists");
    return row;
  }

  private RunRow runRow(String runId) {
    RunRow row = runId == null ? null : runs.get(runId);
    if (row == null) throw MetadataStoreException.notFound("Run with id=" + runId + " not found");
    return row;
  }

  private RunRow activeRun(String runId) {
    RunRow row = runRow(runId);
    if (row.stage != LifecycleStage.ACTIVE) {
      throw MetadataStoreException.invalidParameter("The run " + runId + " must be in the 'active' state.");
    }
    return row;
  }

  private TraceInfo traceRow(String traceId) {
    TraceInfo t = traceId == null ? null : traces.get(traceId);
    if (t == null) throw MetadataStoreException.notFound("Trace with id=" + traceId + " not found");
    return t;
  }
}
