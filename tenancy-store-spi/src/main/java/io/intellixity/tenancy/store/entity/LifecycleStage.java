package io.intellixity.tenancy.store.entity;

public enum LifecycleStage {
  ACTIVE,
  DELETED
}
