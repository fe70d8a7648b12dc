package io.intellixity.tenancy.store.memory;

/** Optional capabilities an {@link InMemoryTrackingStore} can be built with. */
public enum TrackingCapability {
  TRACES,
  LOGGED_MODELS,
  DATASETS
}
