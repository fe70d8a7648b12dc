package io.intellixity.tenancy.server.web;

import io.intellixity.tenancy.store.ModelRegistryStore;
import io.intellixity.tenancy.store.PagedList;
import io.intellixity.tenancy.store.entity.ModelVersion;
import io.intellixity.tenancy.store.entity.RegisteredModel;
import io.intellixity.tenancy.store.entity.Tag;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping({"/api/2.0/mlflow", "/ajax-api/2.0/mlflow"})
public final class RegisteredModelController {
  private static final int SEARCH_DEFAULT_MAX_RESULTS = 100;

  private final ModelRegistryStore registry;

  public RegisteredModelController(ModelRegistryStore registry) {
    this.registry = registry;
  }

  public record CreateModelRequest(String name, List<Tag> tags, String description) {}

  public record ModelNameRequest(String name) {}

  public record UpdateModelRequest(String name, String description) {}

  public record RenameModelRequest(String name, String newName) {}

  public record ModelTagRequest(String name, String key, String value) {}

  public record AliasRequest(String name, String alias, String version) {}

  public record LatestVersionsRequest(String name, List<String> stages) {}

  public record CreateVersionRequest(String name, String source, String runId, List<Tag> tags, String description) {}

  public record VersionRequest(String name, String version, String description) {}

  public record TransitionRequest(String name, String version, String stage, boolean archiveExistingVersions) {}

  public record VersionTagRequest(String name, String version, String key, String value) {}

  // registered models

  @PostMapping("/registered-models/create")
  public Map<String, RegisteredModel> create(@RequestBody CreateModelRequest req) {
    return Map.of("registered_model", registry.createRegisteredModel(req.name(), req.tags(), req.description()));
  }

  @GetMapping("/registered-models/get")
  public Map<String, RegisteredModel> get(@RequestParam("name") String name) {
    return Map.of("registered_model", registry.getRegisteredModel(name));
  }

  @PatchMapping("/registered-models/update")
  public Map<String, RegisteredModel> update(@RequestBody UpdateModelRequest req) {
    return Map.of("registered_model", registry.updateRegisteredModel(req.name(), req.description()));
  }

  @PostMapping("/registered-models/rename")
  public Map<String, RegisteredModel> rename(@RequestBody RenameModelRequest req) {
    return Map.of("registered_model", registry.renameRegisteredModel(req.name(), req.newName()));
  }

  @DeleteMapping("/registered-models/delete")
  public Map<String, Object> delete(@RequestBody ModelNameRequest req) {
    registry.deleteRegisteredModel(req.name());
    return Map.of();
  }

  @GetMapping("/registered-models/search")
  public PagedList<RegisteredModel> searchGet(@RequestParam(value = "filter", required = false) String filter,
                                              @RequestParam(value = "max_results", required = false) Integer maxResults,
                                              @RequestParam(value = "order_by", required = false) List<String> orderBy,
                                              @RequestParam(value = "page_token", required = false) String pageToken) {
    return registry.searchRegisteredModels(filter, max(maxResults), orderBy, pageToken);
  }

  @PostMapping("/registered-models/get-latest-versions")
  public Map<String, List<ModelVersion>> latestVersions(@RequestBody LatestVersionsRequest req) {
    return Map.of("model_versions", registry.getLatestVersions(req.name(), req.stages()));
  }

  @PostMapping("/registered-models/set-tag")
  public Map<String, Object> setTag(@RequestBody ModelTagRequest req) {
    registry.setRegisteredModelTag(req.name(), new Tag(req.key(), req.value()));
    return Map.of();
  }

  @DeleteMapping("/registered-models/delete-tag")
  public Map<String, Object> deleteTag(@RequestBody ModelTagRequest req) {
    registry.deleteRegisteredModelTag(req.name(), req.key());
    return Map.of();
  }

  @PostMapping("/registered-models/alias")
  public Map<String, Object> setAlias(@RequestBody AliasRequest req) {
    registry.setRegisteredModelAlias(req.name(), req.alias(), req.version());
    return Map.of();
  }

  @DeleteMapping("/registered-models/alias")
  public Map<String, Object> deleteAlias(@RequestBody AliasRequest req) {
    registry.deleteRegisteredModelAlias(req.name(), req.alias());
    return Map.of();
  }

  @GetMapping("/registered-models/alias")
  public Map<String, ModelVersion> versionByAlias(@RequestParam("name") String name,
                                                  @RequestParam("alias") String alias) {
    return Map.of("model_version", registry.getModelVersionByAlias(name, alias));
  }

  // model versions

  @PostMapping("/model-versions/create")
  public Map<String, ModelVersion> createVersion(@RequestBody CreateVersionRequest req) {
    return Map.of("model_version",
        registry.createModelVersion(req.name(), req.source(), req.runId(), req.tags(), req.description()));
  }

  @GetMapping("/model-versions/get")
  public Map<String, ModelVersion> getVersion(@RequestParam("name") String name,
                                              @RequestParam("version") String version) {
    return Map.of("model_version", registry.getModelVersion(name, version));
  }

  @PatchMapping("/model-versions/update")
  public Map<String, ModelVersion> updateVersion(@RequestBody VersionRequest req) {
    return Map.of("model_version", registry.updateModelVersion(req.name(), req.version(), req.description()));
  }

  @PostMapping("/model-versions/transition-stage")
  public Map<String, ModelVersion> transition(@RequestBody TransitionRequest req) {
    return Map.of("model_version", registry.transitionModelVersionStage(
        req.name(), req.version(), req.stage(), req.archiveExistingVersions()));
  }

  @DeleteMapping("/model-versions/delete")
  public Map<String, Object> deleteVersion(@RequestBody VersionRequest req) {
    registry.deleteModelVersion(req.name(), req.version());
    return Map.of();
  }

  @GetMapping("/model-versions/get-download-uri")
  public Map<String, String> downloadUri(@RequestParam("name") String name,
                                         @RequestParam("version") String version) {
    return Map.of("artifact_uri", registry.getModelVersionDownloadUri(name, version));
  }

  @GetMapping("/model-versions/search")
  public PagedList<ModelVersion> searchVersions(@RequestParam(value = "filter", required = false) String filter,
                                                @RequestParam(value = "max_results", required = false) Integer maxResults,
                                                @RequestParam(value = "order_by", required = false) List<String> orderBy,
                                                @RequestParam(value = "page_token", required = false) String pageToken) {
    return registry.searchModelVersions(filter, max(maxResults), orderBy, pageToken);
  }

  @PostMapping("/model-versions/set-tag")
  public Map<String, Object> setVersionTag(@RequestBody VersionTagRequest req) {
    registry.setModelVersionTag(req.name(), req.version(), new Tag(req.key(), req.value()));
    return Map.of();
  }

  @DeleteMapping("/model-versions/delete-tag")
  public Map<String, Object> deleteVersionTag(@RequestBody VersionTagRequest req) {
    registry.deleteModelVersionTag(req.name(), req.version(), req.key());
    return Map.of();
  }

  private static int max(Integer requested) {
    return requested == null ? SEARCH_DEFAULT_MAX_RESULTS : requested;
  }
}
