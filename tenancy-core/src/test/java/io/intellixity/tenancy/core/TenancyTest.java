package io.intellixity.tenancy.core;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class TenancyTest {

  @Test
  void contextIsBoundOnlyInsideBoundary() {
    assertNull(Tenancy.currentOrNull());
    String seen = Tenancy.inContext(TenantContext.of("team-a"), () -> Tenancy.scope().current().tenant());
    assertEquals("team-a", seen);
    assertNull(Tenancy.currentOrNull());
  }

  @Test
  void nestedBoundaryRestoresOuterContext() {
    Tenancy.runInContext(TenantContext.of("outer"), () -> {
      Tenancy.runInContext(TenantContext.of("inner"), () -> assertEquals("inner", Tenancy.currentOrThrow().tenant()));
      assertEquals("outer", Tenancy.currentOrThrow().tenant());
    });
  }

  @Test
  void missingContext_fails() {
    IllegalStateException ex = assertThrows(IllegalStateException.class, () -> Tenancy.scope().current());
    assertTrue(ex.getMessage().contains("Namespace not found"));
  }

  @Test
  void concurrentRequestsSeeTheirOwnTenant() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(2);
    CountDownLatch bothBound = new CountDownLatch(2);
    try {
      CompletableFuture<String> a = CompletableFuture.supplyAsync(() -> Tenancy.inContext(TenantContext.of("a"), () -> {
        bothBound.countDown();
        await(bothBound);
        return Tenancy.currentOrThrow().tenant();
      }), pool);
      CompletableFuture<String> b = CompletableFuture.supplyAsync(() -> Tenancy.inContext(TenantContext.of("b"), () -> {
        bothBound.countDown();
        await(bothBound);
        return Tenancy.currentOrThrow().tenant();
      }), pool);

      assertEquals("a", a.get(5, TimeUnit.SECONDS));
      assertEquals("b", b.get(5, TimeUnit.SECONDS));
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void fixedScope_pinsContext() {
    TenantContext ctx = new TenantContext("team-a", "alice");
    assertSame(ctx, TenantScope.fixed(ctx).current());
    assertEquals("alice", ctx.userOptional().orElseThrow());
    assertEquals("team-a::", ctx.names().prefix());
  }

  private static void await(CountDownLatch latch) {
    try {
      assertTrue(latch.await(5, TimeUnit.SECONDS));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }
}
