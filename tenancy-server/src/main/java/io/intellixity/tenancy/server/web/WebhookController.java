package io.intellixity.tenancy.server.web;

import io.intellixity.tenancy.store.ModelRegistryStore;
import io.intellixity.tenancy.store.PagedList;
import io.intellixity.tenancy.store.entity.Webhook;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping({"/api/2.0/mlflow/webhooks", "/ajax-api/2.0/mlflow/webhooks"})
public final class WebhookController {
  private final ModelRegistryStore registry;

  public WebhookController(ModelRegistryStore registry) {
    this.registry = registry;
  }

  @GetMapping("/list-by-event")
  public PagedList<Webhook> listByEvent(@RequestParam("event") String event,
                                        @RequestParam(value = "max_results", required = false) Integer maxResults,
                                        @RequestParam(value = "page_token", required = false) String pageToken) {
    return registry.webhooks()
        .map(w -> w.listWebhooksByEvent(event, maxResults == null ? 100 : maxResults, pageToken))
        .orElseGet(PagedList::empty);
  }
}
