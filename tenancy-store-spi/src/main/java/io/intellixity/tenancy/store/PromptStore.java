package io.intellixity.tenancy.store;

import io.intellixity.tenancy.store.entity.Prompt;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Optional registry capability: prompts addressed by globally unique name. */
public interface PromptStore {
  Prompt createPrompt(String name, String description, Map<String, String> tags);

  Optional<Prompt> getPrompt(String name);

  void deletePrompt(String name);

  PagedList<Prompt> searchPrompts(String filterString, int maxResults, List<String> orderBy, String pageToken);
}
