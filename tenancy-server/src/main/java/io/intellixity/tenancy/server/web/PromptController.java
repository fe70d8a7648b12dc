package io.intellixity.tenancy.server.web;

import io.intellixity.tenancy.core.ErrorCode;
import io.intellixity.tenancy.store.MetadataStoreException;
import io.intellixity.tenancy.store.ModelRegistryStore;
import io.intellixity.tenancy.store.PagedList;
import io.intellixity.tenancy.store.PromptStore;
import io.intellixity.tenancy.store.entity.Prompt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping({"/api/2.0/mlflow/prompts", "/ajax-api/2.0/mlflow/prompts"})
public final class PromptController {
  private final ModelRegistryStore registry;

  public PromptController(ModelRegistryStore registry) {
    this.registry = registry;
  }

  public record CreatePromptRequest(String name, String description, Map<String, String> tags) {}

  public record PromptNameRequest(String name) {}

  @PostMapping("/create")
  public Map<String, Prompt> create(@RequestBody CreatePromptRequest req) {
    return Map.of("prompt", prompts().createPrompt(req.name(), req.description(), req.tags()));
  }

  @GetMapping("/get")
  public Map<String, Prompt> get(@RequestParam("name") String name) {
    Prompt p = prompts().getPrompt(name)
        .orElseThrow(() -> MetadataStoreException.notFound("Prompt '" + name + "' not found"));
    return Map.of("prompt", p);
  }

  @DeleteMapping("/delete")
  public Map<String, Object> delete(@RequestBody PromptNameRequest req) {
    prompts().deletePrompt(req.name());
    return Map.of();
  }

  @GetMapping("/search")
  public PagedList<Prompt> search(@RequestParam(value = "filter", required = false) String filter,
                                  @RequestParam(value = "max_results", required = false) Integer maxResults,
                                  @RequestParam(value = "order_by", required = false) List<String> orderBy,
                                  @RequestParam(value = "page_token", required = false) String pageToken) {
    return prompts().searchPrompts(filter, maxResults == null ? 100 : maxResults, orderBy, pageToken);
  }

  private PromptStore prompts() {
    return registry.prompts()
        .orElseThrow(() -> new MetadataStoreException(ErrorCode.NOT_IMPLEMENTED, "Prompts are not supported by this store"));
  }
}
