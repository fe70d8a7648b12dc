package io.intellixity.tenancy.authz.kubernetes;

public record ReviewStatus(boolean allowed, String reason) {}
