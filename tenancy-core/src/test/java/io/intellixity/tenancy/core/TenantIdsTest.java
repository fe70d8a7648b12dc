package io.intellixity.tenancy.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class TenantIdsTest {

  @Test
  void acceptsLowercaseHyphenatedSegments() {
    assertTrue(TenantIds.isValid("team-a"));
    assertTrue(TenantIds.isValid("a"));
    assertTrue(TenantIds.isValid("ml-team-01"));
    assertTrue(TenantIds.isValid("x".repeat(253)));
  }

  @Test
  void rejectsMalformedIdentities() {
    assertFalse(TenantIds.isValid("Team_A"));
    assertFalse(TenantIds.isValid("-team"));
    assertFalse(TenantIds.isValid("team-"));
    assertFalse(TenantIds.isValid("team--a"));
    assertFalse(TenantIds.isValid("x".repeat(254)));
    assertFalse(TenantIds.isValid(""));
    assertFalse(TenantIds.isValid(null));
  }

  @Test
  void requireValid_throwsInvalidParameter() {
    TenancyException ex = assertThrows(TenancyException.class, () -> TenantIds.requireValid("Bad"));
    assertEquals(ErrorCode.INVALID_PARAMETER_VALUE, ex.errorCode());
    assertEquals("team-a", TenantIds.requireValid("team-a"));
  }
}
