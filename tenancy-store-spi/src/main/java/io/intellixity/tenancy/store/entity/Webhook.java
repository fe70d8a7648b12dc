package io.intellixity.tenancy.store.entity;

import java.util.List;

public record Webhook(String webhookId, String name, String url, List<String> events) {
  public Webhook {
    events = events == null ? List.of() : List.copyOf(events);
  }
}
