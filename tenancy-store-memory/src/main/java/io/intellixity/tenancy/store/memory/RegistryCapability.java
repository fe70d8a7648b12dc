package io.intellixity.tenancy.store.memory;

/** Optional capabilities an {@link InMemoryModelRegistryStore} can be built with. */
public enum RegistryCapability {
  PROMPTS,
  WEBHOOKS
}
