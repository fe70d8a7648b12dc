package io.intellixity.tenancy.core;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Request-scoped tenant context boundary.\n
 *
 * A context is bound for the duration of {@link #inContext} on the calling thread only and the previous binding
 * is restored on exit, so nested or reused request threads never observe another request's tenant.
 */
public final class Tenancy {
  private Tenancy() {}

  private static final ThreadLocal<TenantContext> CTX = new ThreadLocal<>();

  private static final TenantScope SCOPE = Tenancy::currentOrThrow;

  /** Execute work within a tenant context boundary. */
  public static <T> T inContext(TenantContext ctx, Supplier<T> work) {
    Objects.requireNonNull(ctx, "ctx");
    Objects.requireNonNull(work, "work");
    TenantContext previous = CTX.get();
    CTX.set(ctx);
    try {
      return work.get();
    } finally {
      if (previous == null) CTX.remove();
      else CTX.set(previous);
    }
  }

  public static void runInContext(TenantContext ctx, Runnable work) {
    Objects.requireNonNull(work, "work");
    inContext(ctx, () -> {
      work.run();
      return null;
    });
  }

  public static TenantContext currentOrNull() {
    return CTX.get();
  }

  public static TenantContext currentOrThrow() {
    TenantContext c = currentOrNull();
    if (c == null) throw new IllegalStateException("Namespace not found in request context");
    return c;
  }

  /** Scope view over the bound context, for injection into components that must not read it statically. */
  public static TenantScope scope() {
    return SCOPE;
  }
}
