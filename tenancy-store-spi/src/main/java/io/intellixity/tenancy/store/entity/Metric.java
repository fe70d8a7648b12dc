package io.intellixity.tenancy.store.entity;

public record Metric(String key, double value, long timestamp, long step) {}
