package io.intellixity.tenancy.store;

import io.intellixity.tenancy.store.entity.ModelVersion;
import io.intellixity.tenancy.store.entity.RegisteredModel;
import io.intellixity.tenancy.store.entity.Tag;

import java.util.List;
import java.util.Optional;

/**
 * Model registry store: registered models addressed by globally unique name, and their versions.\n
 *
 * Prompts and webhooks are optional capabilities.
 */
public interface ModelRegistryStore {

  /** Read-only description of the backing implementation (not tenant data). */
  String backend();

  RegisteredModel createRegisteredModel(String name, List<Tag> tags, String description);

  /** Throws {@link MetadataStoreException} with RESOURCE_DOES_NOT_EXIST when absent. */
  RegisteredModel getRegisteredModel(String name);

  RegisteredModel updateRegisteredModel(String name, String description);

  RegisteredModel renameRegisteredModel(String name, String newName);

  void deleteRegisteredModel(String name);

  PagedList<RegisteredModel> searchRegisteredModels(String filterString,
                                                    int maxResults,
                                                    List<String> orderBy,
                                                    String pageToken);

  List<ModelVersion> getLatestVersions(String name, List<String> stages);

  void setRegisteredModelTag(String name, Tag tag);

  void deleteRegisteredModelTag(String name, String key);

  void setRegisteredModelAlias(String name, String alias, String version);

  void deleteRegisteredModelAlias(String name, String alias);

  ModelVersion getModelVersionByAlias(String name, String alias);

  /** Some backends do not echo the created version; they may return {@code null}. */
  ModelVersion createModelVersion(String name, String source, String runId, List<Tag> tags, String description);

  ModelVersion getModelVersion(String name, String version);

  ModelVersion updateModelVersion(String name, String version, String description);

  ModelVersion transitionModelVersionStage(String name, String version, String stage, boolean archiveExistingVersions);

  void deleteModelVersion(String name, String version);

  String getModelVersionDownloadUri(String name, String version);

  PagedList<ModelVersion> searchModelVersions(String filterString,
                                              int maxResults,
                                              List<String> orderBy,
                                              String pageToken);

  void setModelVersionTag(String name, String version, Tag tag);

  void deleteModelVersionTag(String name, String version, String key);

  default Optional<PromptStore> prompts() {
    return Optional.empty();
  }

  default Optional<WebhookStore> webhooks() {
    return Optional.empty();
  }
}
