package io.intellixity.tenancy.store.entity;

public record Param(String key, String value) {}
