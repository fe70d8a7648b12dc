package io.intellixity.tenancy.store;

public enum ViewType {
  ACTIVE_ONLY,
  DELETED_ONLY,
  ALL
}
