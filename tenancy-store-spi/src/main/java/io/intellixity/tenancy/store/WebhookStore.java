package io.intellixity.tenancy.store;

import io.intellixity.tenancy.store.entity.Webhook;

/** Optional registry capability: webhook subscriptions. */
public interface WebhookStore {
  PagedList<Webhook> listWebhooksByEvent(String event, int maxResults, String pageToken);
}
