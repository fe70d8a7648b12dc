package io.intellixity.tenancy.core;

/**
 * Source of the active request's tenant context, injected into the tenant-scoped stores.
 * <p>
 * {@link Tenancy#scope()} reads the context bound by {@link Tenancy#inContext}; {@link #fixed} pins one context.
 */
@FunctionalInterface
public interface TenantScope {

  /** Return the active context or throw if none is bound. */
  TenantContext current();

  static TenantScope fixed(TenantContext ctx) {
    java.util.Objects.requireNonNull(ctx, "ctx");
    return () -> ctx;
  }
}
