package io.intellixity.tenancy.authz.kubernetes;

/** The {@code spec.resourceAttributes} of a self subject access review. */
public record ResourceAttributes(String group, String resource, String verb, String namespace) {}
