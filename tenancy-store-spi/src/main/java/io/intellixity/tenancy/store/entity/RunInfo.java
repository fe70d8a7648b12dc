package io.intellixity.tenancy.store.entity;

import java.util.Objects;

public record RunInfo(String runId,
                      String experimentId,
                      String runName,
                      String userId,
                      RunStatus status,
                      long startTime,
                      Long endTime,
                      LifecycleStage lifecycleStage) {
  public RunInfo {
    Objects.requireNonNull(runId, "runId");
    Objects.requireNonNull(experimentId, "experimentId");
  }
}
