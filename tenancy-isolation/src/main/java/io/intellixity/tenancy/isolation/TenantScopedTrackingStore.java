package io.intellixity.tenancy.isolation;

import io.intellixity.tenancy.core.ErrorCode;
import io.intellixity.tenancy.core.TenancyException;
import io.intellixity.tenancy.core.TenantContext;
import io.intellixity.tenancy.core.TenantScope;
import io.intellixity.tenancy.store.*;
import io.intellixity.tenancy.store.entity.*;
import io.intellixity.tenancy.store.filter.SearchFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Tenant isolation over a {@link TrackingStore}.\n
 *
 * Experiments are the tenant containers: they carry the tenant tag, and every run, trace and logged model is
 * checked through the experiment that owns it. Cross-container searches only ever reach experiments visible to the
 * active tenant.\n
 *
 * Optional capabilities are resolved once at construction. When the wrapped store lacks one, the scoped view
 * answers reads with empty results and rejects writes with {@link ErrorCode#NOT_IMPLEMENTED}, the same way an
 * unwrapped store without the feature would.
 */
public final class TenantScopedTrackingStore implements TrackingStore {
  private static final Logger log = LoggerFactory.getLogger(TenantScopedTrackingStore.class);

  private final TrackingStore delegate;
  private final TenantScope scope;
  private final TraceStore traces;
  private final LoggedModelStore loggedModels;
  private final DatasetStore datasets;

  public TenantScopedTrackingStore(TrackingStore delegate, TenantScope scope) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.scope = Objects.requireNonNull(scope, "scope");
    this.traces = new ScopedTraces(delegate.traces().orElse(null));
    this.loggedModels = new ScopedLoggedModels(delegate.loggedModels().orElse(null));
    this.datasets = new ScopedDatasets(delegate.datasets().orElse(null));
  }

  @Override
  public String backend() {
    return delegate.backend();
  }

  @Override
  public Optional<TraceStore> traces() {
    return Optional.of(traces);
  }

  @Override
  public Optional<LoggedModelStore> loggedModels() {
    return Optional.of(loggedModels);
  }

  @Override
  public Optional<DatasetStore> datasets() {
    return Optional.of(datasets);
  }

  // ---------- experiments ----------

  @Override
  public String createExperiment(String name, String artifactLocation, List<Tag> tags) {
    String tenant = tenant();
    String id = delegate.createExperiment(name, artifactLocation, TenantTags.ensure(tags, tenant));
    log.debug("tenancy.isolation op=createExperiment tenant={} experimentId={}", tenant, id);
    return id;
  }

  @Override
  public Experiment getExperiment(String experimentId) {
    return requireExperiment(experimentId);
  }

  @Override
  public Optional<Experiment> getExperimentByName(String name) {
    String tenant = tenant();
    return delegate.getExperimentByName(name).filter(e -> TenantTags.owns(e.tags(), tenant));
  }

  @Override
  public PagedList<Experiment> searchExperiments(ViewType viewType,
                                                 int maxResults,
                                                 String filterString,
                                                 List<String> orderBy,
                                                 String pageToken) {
    String scoped = SearchFilter.and(filterString, TenantTags.predicate(tenant()));
    return delegate.searchExperiments(viewType, maxResults, scoped, orderBy, pageToken);
  }

  @Override
  public void deleteExperiment(String experimentId) {
    requireExperiment(experimentId);
    delegate.deleteExperiment(experimentId);
  }

  @Override
  public void restoreExperiment(String experimentId) {
    requireExperiment(experimentId);
    delegate.restoreExperiment(experimentId);
  }

  @Override
  public void renameExperiment(String experimentId, String newName) {
    requireExperiment(experimentId);
    delegate.renameExperiment(experimentId, newName);
  }

  @Override
  public void setExperimentTag(String experimentId, Tag tag) {
    TenantTags.rejectReservedKey(tag.key());
    requireExperiment(experimentId);
    delegate.setExperimentTag(experimentId, tag);
  }

  @Override
  public void deleteExperimentTag(String experimentId, String key) {
    TenantTags.rejectReservedKey(key);
    requireExperiment(experimentId);
    delegate.deleteExperimentTag(experimentId, key);
  }

  // ---------- runs ----------

  @Override
  public Run createRun(String experimentId, String userId, long startTime, List<Tag> tags, String runName) {
    TenantTags.rejectReservedKeys(tags);
    requireExperiment(experimentId);
    String user = userId != null && !userId.isBlank() ? userId : scope.current().user();
    return delegate.createRun(experimentId, user, startTime, tags, runName);
  }

  @Override
  public Run getRun(String runId) {
    Run run = delegate.getRun(runId);
    requireExperiment(run.info().experimentId());
    return run;
  }

  @Override
  public void deleteRun(String runId) {
    requireRun(runId);
    delegate.deleteRun(runId);
  }

  @Override
  public void restoreRun(String runId) {
    requireRun(runId);
    delegate.restoreRun(runId);
  }

  @Override
  public RunInfo updateRunInfo(String runId, RunStatus status, Long endTime, String runName) {
    requireRun(runId);
    return delegate.updateRunInfo(runId, status, endTime, runName);
  }

  @Override
  public void setTag(String runId, Tag tag) {
    TenantTags.rejectReservedKey(tag.key());
    requireRun(runId);
    delegate.setTag(runId, tag);
  }

  @Override
  public void deleteTag(String runId, String key) {
    TenantTags.rejectReservedKey(key);
    requireRun(runId);
    delegate.deleteTag(runId, key);
  }

  @Override
  public void logMetric(String runId, Metric metric) {
    requireRun(runId);
    delegate.logMetric(runId, metric);
  }

  @Override
  public void logParam(String runId, Param param) {
    requireRun(runId);
    delegate.logParam(runId, param);
  }

  @Override
  public void logBatch(String runId, List<Metric> metrics, List<Param> params, List<Tag> tags) {
    TenantTags.rejectReservedKeys(tags);
    requireRun(runId);
    delegate.logBatch(runId, metrics, params, tags);
  }

  @Override
  public List<Metric> getMetricHistory(String runId, String metricKey) {
    requireRun(runId);
    return delegate.getMetricHistory(runId, metricKey);
  }

  @Override
  public PagedList<Run> searchRuns(List<String> experimentIds,
                                   String filterString,
                                   ViewType runViewType,
                                   int maxResults,
                                   List<String> orderBy,
                                   String pageToken) {
    List<String> allowed = visibleAmong(experimentIds);
    if (allowed.isEmpty()) return PagedList.empty();
    return delegate.searchRuns(allowed, filterString, runViewType, maxResults, orderBy, pageToken);
  }

  // ---------- internals ----------

  private String tenant() {
    TenantContext ctx = scope.current();
    return ctx.tenant();
  }

  private Experiment requireExperiment(String experimentId) {
    Experiment e = delegate.getExperiment(experimentId);
    String tenant = tenant();
    if (!TenantTags.owns(e.tags(), tenant)) {
      log.info("tenancy.isolation denied entity=experiment id={} tenant={}", experimentId, tenant);
      throw TenancyException.permissionDenied("Experiment not in namespace");
    }
    return e;
  }

  private void requireRun(String runId) {
    requireExperiment(delegate.getRun(runId).info().experimentId());
  }

  /** Requested ids that belong to the tenant, in request order. Empty when nothing requested is visible. */
  private List<String> visibleAmong(List<String> requested) {
    if (requested == null || requested.isEmpty()) return List.of();
    Set<String> visible = visibleExperimentIds();
    List<String> out = new ArrayList<>();
    for (String id : requested) {
      if (id != null && visible.contains(id) && !out.contains(id)) out.add(id);
    }
    return out;
  }

  private Set<String> visibleExperimentIds() {
    Set<String> ids = new HashSet<>();
    String token = null;
    do {
      PagedList<Experiment> page = searchExperiments(ViewType.ALL, SEARCH_MAX_RESULTS_DEFAULT, null, null, token);
      for (Experiment e : page.items()) ids.add(e.experimentId());
      token = page.nextPageToken();
    } while (token != null);
    return ids;
  }

  private static MetadataStoreException notImplemented(String feature) {
    return new MetadataStoreException(ErrorCode.NOT_IMPLEMENTED, feature + " are not supported by this tracking store");
  }

  private final class ScopedTraces implements TraceStore {
    private final TraceStore base;

    ScopedTraces(TraceStore base) {
      this.base = base;
    }

    @Override
    public TraceInfo startTrace(String experimentId, long timestampMs, Map<String, String> tags) {
      if (base == null) throw notImplemented("Traces");
      TenantTags.rejectReservedKeys(tags);
      requireExperiment(experimentId);
      return base.startTrace(experimentId, timestampMs, tags);
    }

    @Override
    public Optional<TraceInfo> getTraceInfo(String traceId) {
      if (base == null) return Optional.empty();
      Optional<TraceInfo> info = base.getTraceInfo(traceId);
      info.ifPresent(t -> requireExperiment(t.experimentId()));
      return info;
    }

    @Override
    public PagedList<TraceInfo> searchTraces(List<String> experimentIds,
                                             String filterString,
                                             int maxResults,
                                             List<String> orderBy,
                                             String pageToken) {
      if (base == null) return PagedList.empty();
      List<String> allowed = visibleAmong(experimentIds);
      if (allowed.isEmpty()) return PagedList.empty();
      return base.searchTraces(allowed, filterString, maxResults, orderBy, pageToken);
    }

    @Override
    public void setTraceTag(String traceId, String key, String value) {
      TenantTags.rejectReservedKey(key);
      if (base == null) return;
      requireTrace(traceId);
      base.setTraceTag(traceId, key, value);
    }

    @Override
    public void deleteTraceTag(String traceId, String key) {
      TenantTags.rejectReservedKey(key);
      if (base == null) return;
      requireTrace(traceId);
      base.deleteTraceTag(traceId, key);
    }

    private void requireTrace(String traceId) {
      TraceInfo info = base.getTraceInfo(traceId)
          .orElseThrow(() -> MetadataStoreException.notFound("Trace with ID " + traceId + " not found."));
      requireExperiment(info.experimentId());
    }
  }

  private final class ScopedLoggedModels implements LoggedModelStore {
    private final LoggedModelStore base;

    ScopedLoggedModels(LoggedModelStore base) {
      this.base = base;
    }

    @Override
    public LoggedModel createLoggedModel(String experimentId, String name, Map<String, String> tags) {
      if (base == null) throw notImplemented("Logged models");
      TenantTags.rejectReservedKeys(tags);
      requireExperiment(experimentId);
      return base.createLoggedModel(experimentId, name, tags);
    }

    @Override
    public LoggedModel getLoggedModel(String modelId) {
      if (base == null) throw MetadataStoreException.notFound("Logged model '" + modelId + "' not found.");
      LoggedModel m = base.getLoggedModel(modelId);
      requireExperiment(m.experimentId());
      return m;
    }

    @Override
    public void deleteLoggedModel(String modelId) {
      if (base == null) throw notImplemented("Logged models");
      getLoggedModel(modelId);
      base.deleteLoggedModel(modelId);
    }

    @Override
    public PagedList<LoggedModel> searchLoggedModels(List<String> experimentIds,
                                                     String filterString,
                                                     int maxResults,
                                                     List<String> orderBy,
                                                     String pageToken) {
      if (base == null) return PagedList.empty();
      List<String> allowed = visibleAmong(experimentIds);
      if (allowed.isEmpty()) return PagedList.empty();
      return base.searchLoggedModels(allowed, filterString, maxResults, orderBy, pageToken);
    }
  }

  /** Datasets carry the tenant tag themselves and may link several experiments, all of which must be visible. */
  private final class ScopedDatasets implements DatasetStore {
    private final DatasetStore base;

    ScopedDatasets(DatasetStore base) {
      this.base = base;
    }

    @Override
    public EvaluationDataset createDataset(String name, List<String> experimentIds, Map<String, String> tags) {
      if (base == null) throw notImplemented("Datasets");
      if (experimentIds != null) for (String id : experimentIds) requireExperiment(id);
      return base.createDataset(name, experimentIds, TenantTags.ensure(tags, tenant()));
    }

    @Override
    public EvaluationDataset getDataset(String datasetId) {
      if (base == null) throw MetadataStoreException.notFound("Dataset '" + datasetId + "' not found.");
      EvaluationDataset d = base.getDataset(datasetId);
      String tenant = tenant();
      if (!TenantTags.owns(d.tags(), tenant)) {
        log.info("tenancy.isolation denied entity=dataset id={} tenant={}", datasetId, tenant);
        throw TenancyException.permissionDenied("Dataset not in namespace");
      }
      return d;
    }

    @Override
    public void deleteDataset(String datasetId) {
      if (base == null) throw notImplemented("Datasets");
      getDataset(datasetId);
      base.deleteDataset(datasetId);
    }

    @Override
    public PagedList<EvaluationDataset> searchDatasets(List<String> experimentIds,
                                                       String filterString,
                                                       int maxResults,
                                                       List<String> orderBy,
                                                       String pageToken) {
      if (base == null) return PagedList.empty();
      List<String> allowed = null;
      if (experimentIds != null && !experimentIds.isEmpty()) {
        allowed = visibleAmong(experimentIds);
        if (allowed.isEmpty()) return PagedList.empty();
      }
      String scoped = SearchFilter.and(filterString, TenantTags.predicate(tenant()));
      return base.searchDatasets(allowed, scoped, maxResults, orderBy, pageToken);
    }
  }
}
