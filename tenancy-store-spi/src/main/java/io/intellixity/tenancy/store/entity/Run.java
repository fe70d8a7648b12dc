package io.intellixity.tenancy.store.entity;

import java.util.Objects;

public record Run(RunInfo info, RunData data) {
  public Run {
    Objects.requireNonNull(info, "info");
    if (data == null) data = RunData.empty();
  }
}
