package io.intellixity.tenancy.isolation;

import io.intellixity.tenancy.core.ErrorCode;
import io.intellixity.tenancy.core.NameTransformer;
import io.intellixity.tenancy.core.TenancyException;
import io.intellixity.tenancy.core.TenantScope;
import io.intellixity.tenancy.store.*;
import io.intellixity.tenancy.store.entity.*;
import io.intellixity.tenancy.store.filter.SearchFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Tenant isolation over a {@link ModelRegistryStore}.\n
 *
 * Registered models and prompts have globally unique names, so they are stored as {@code "<tenant>::<name>"} and
 * additionally carry the tenant tag. Callers only ever see the unprefixed name.
 */
public final class TenantScopedModelRegistryStore implements ModelRegistryStore {
  private static final Logger log = LoggerFactory.getLogger(TenantScopedModelRegistryStore.class);

  private final ModelRegistryStore delegate;
  private final TenantScope scope;
  private final PromptStore prompts;
  private final WebhookStore webhooks;

  public TenantScopedModelRegistryStore(ModelRegistryStore delegate, TenantScope scope) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.scope = Objects.requireNonNull(scope, "scope");
    this.prompts = new ScopedPrompts(delegate.prompts().orElse(null));
    WebhookStore hooks = delegate.webhooks().orElse(null);
    this.webhooks = hooks != null ? hooks : (event, maxResults, pageToken) -> PagedList.empty();
  }

  @Override
  public String backend() {
    return delegate.backend();
  }

  @Override
  public Optional<PromptStore> prompts() {
    return Optional.of(prompts);
  }

  /** Webhooks are not tenant-scoped; subscriptions are shared by the whole deployment. */
  @Override
  public Optional<WebhookStore> webhooks() {
    return Optional.of(webhooks);
  }

  // ---------- registered models ----------

  @Override
  public RegisteredModel createRegisteredModel(String name, List<Tag> tags, String description) {
    NameTransformer names = names();
    RegisteredModel created = delegate.createRegisteredModel(
        names.toInternal(name), TenantTags.ensure(tags, names.tenant()), description);
    log.debug("tenancy.isolation op=createRegisteredModel tenant={} name={}", names.tenant(), name);
    return created.withName(names.fromInternal(created.name()));
  }

  @Override
  public RegisteredModel getRegisteredModel(String name) {
    NameTransformer names = names();
    RegisteredModel m = requireModel(names, name);
    return m.withName(names.fromInternal(m.name()));
  }

  @Override
  public RegisteredModel updateRegisteredModel(String name, String description) {
    NameTransformer names = names();
    requireModel(names, name);
    RegisteredModel updated = delegate.updateRegisteredModel(names.toInternal(name), description);
    return updated.withName(names.fromInternal(updated.name()));
  }

  @Override
  public RegisteredModel renameRegisteredModel(String name, String newName) {
    NameTransformer names = names();
    requireModel(names, name);
    RegisteredModel renamed = delegate.renameRegisteredModel(names.toInternal(name), names.toInternal(newName));
    return renamed.withName(names.fromInternal(renamed.name()));
  }

  @Override
  public void deleteRegisteredModel(String name) {
    NameTransformer names = names();
    requireModel(names, name);
    delegate.deleteRegisteredModel(names.toInternal(name));
  }

  @Override
  public PagedList<RegisteredModel> searchRegisteredModels(String filterString,
                                                           int maxResults,
                                                           List<String> orderBy,
                                                           String pageToken) {
    NameTransformer names = names();
    String scoped = SearchFilter.and(
        SearchFilter.rewriteNameValues(filterString, names::toInternal), TenantTags.predicate(names.tenant()));
    return delegate.searchRegisteredModels(scoped, maxResults, orderBy, pageToken)
        .map(m -> m.withName(names.fromInternal(m.name())));
  }

  @Override
  public List<ModelVersion> getLatestVersions(String name, List<String> stages) {
    NameTransformer names = names();
    requireModel(names, name);
    return strip(names, delegate.getLatestVersions(names.toInternal(name), stages));
  }

  @Override
  public void setRegisteredModelTag(String name, Tag tag) {
    TenantTags.rejectReservedKey(tag.key());
    NameTransformer names = names();
    requireModel(names, name);
    delegate.setRegisteredModelTag(names.toInternal(name), tag);
  }

  @Override
  public void deleteRegisteredModelTag(String name, String key) {
    TenantTags.rejectReservedKey(key);
    NameTransformer names = names();
    requireModel(names, name);
    delegate.deleteRegisteredModelTag(names.toInternal(name), key);
  }

  @Override
  public void setRegisteredModelAlias(String name, String alias, String version) {
    NameTransformer names = names();
    requireModel(names, name);
    delegate.setRegisteredModelAlias(names.toInternal(name), alias, version);
  }

  @Override
  public void deleteRegisteredModelAlias(String name, String alias) {
    NameTransformer names = names();
    requireModel(names, name);
    delegate.deleteRegisteredModelAlias(names.toInternal(name), alias);
  }

  @Override
  public ModelVersion getModelVersionByAlias(String name, String alias) {
    NameTransformer names = names();
    requireModel(names, name);
    return strip(names, delegate.getModelVersionByAlias(names.toInternal(name), alias));
  }

  // ---------- model versions ----------

  /** Falls back to the highest latest version when the backing store does not echo the created version. */
  @Override
  public ModelVersion createModelVersion(String name, String source, String runId, List<Tag> tags, String description) {
    TenantTags.rejectReservedKeys(tags);
    NameTransformer names = names();
    requireModel(names, name);
    String internal = names.toInternal(name);
    ModelVersion created = delegate.createModelVersion(internal, source, runId, tags, description);
    if (created == null) {
      created = delegate.getLatestVersions(internal, null).stream()
          .max(Comparator.comparingLong(ModelVersion::versionNumber))
          .orElseThrow(() -> new MetadataStoreException(ErrorCode.INTERNAL_ERROR,
              "Model version for '" + name + "' was not returned by the store"));
      log.debug("tenancy.isolation op=createModelVersion fallback=latest name={} version={}", name, created.version());
    }
    return strip(names, created);
  }

  @Override
  public ModelVersion getModelVersion(String name, String version) {
    NameTransformer names = names();
    requireModel(names, name);
    return strip(names, delegate.getModelVersion(names.toInternal(name), version));
  }

  @Override
  public ModelVersion updateModelVersion(String name, String version, String description) {
    NameTransformer names = names();
    requireModel(names, name);
    return strip(names, delegate.updateModelVersion(names.toInternal(name), version, description));
  }

  @Override
  public ModelVersion transitionModelVersionStage(String name,
                                                  String version,
                                                  String stage,
                                                  boolean archiveExistingVersions) {
    NameTransformer names = names();
    requireModel(names, name);
    return strip(names, delegate.transitionModelVersionStage(names.toInternal(name), version, stage, archiveExistingVersions));
  }

  @Override
  public void deleteModelVersion(String name, String version) {
    NameTransformer names = names();
    requireModel(names, name);
    delegate.deleteModelVersion(names.toInternal(name), version);
  }

  @Override
  public String getModelVersionDownloadUri(String name, String version) {
    NameTransformer names = names();
    requireModel(names, name);
    return delegate.getModelVersionDownloadUri(names.toInternal(name), version);
  }

  /** Versions carry no tenant tag of their own, so the name prefix is the boundary. */
  @Override
  public PagedList<ModelVersion> searchModelVersions(String filterString,
                                                     int maxResults,
                                                     List<String> orderBy,
                                                     String pageToken) {
    NameTransformer names = names();
    String scoped = SearchFilter.and(
        SearchFilter.rewriteNameValues(filterString, names::toInternal), SearchFilter.nameStartsWith(names.prefix()));
    return delegate.searchModelVersions(scoped, maxResults, orderBy, pageToken)
        .map(v -> v.withName(names.fromInternal(v.name())));
  }

  @Override
  public void setModelVersionTag(String name, String version, Tag tag) {
    TenantTags.rejectReservedKey(tag.key());
    NameTransformer names = names();
    requireModel(names, name);
    delegate.setModelVersionTag(names.toInternal(name), version, tag);
  }

  @Override
  public void deleteModelVersionTag(String name, String version, String key) {
    TenantTags.rejectReservedKey(key);
    NameTransformer names = names();
    requireModel(names, name);
    delegate.deleteModelVersionTag(names.toInternal(name), version, key);
  }

  // ---------- internals ----------

  private NameTransformer names() {
    return scope.current().names();
  }

  private RegisteredModel requireModel(NameTransformer names, String name) {
    if (name == null || name.isBlank()) {
      throw MetadataStoreException.invalidParameter("Missing value for required parameter 'name'.");
    }
    RegisteredModel m = delegate.getRegisteredModel(names.toInternal(name));
    if (!TenantTags.owns(m.tags(), names.tenant())) {
      log.info("tenancy.isolation denied entity=registered_model name={} tenant={}", name, names.tenant());
      throw TenancyException.permissionDenied("Registered model not in namespace");
    }
    return m;
  }

  private static ModelVersion strip(NameTransformer names, ModelVersion v) {
    return v == null ? null : v.withName(names.fromInternal(v.name()));
  }

  private static List<ModelVersion> strip(NameTransformer names, List<ModelVersion> versions) {
    return versions.stream().map(v -> strip(names, v)).toList();
  }

  private final class ScopedPrompts implements PromptStore {
    private final PromptStore base;

    ScopedPrompts(PromptStore base) {
      this.base = base;
    }

    @Override
    public Prompt createPrompt(String name, String description, Map<String, String> tags) {
      if (base == null) throw notImplemented();
      NameTransformer names = names();
      Prompt p = base.createPrompt(names.toInternal(name), description, TenantTags.ensure(tags, names.tenant()));
      return p.withName(names.fromInternal(p.name()));
    }

    /** A prompt stored under the tenant's prefix but tagged for someone else is a violation, not a miss. */
    @Override
    public Optional<Prompt> getPrompt(String name) {
      if (base == null) return Optional.empty();
      NameTransformer names = names();
      Optional<Prompt> found = base.getPrompt(names.toInternal(name));
      if (found.isPresent() && !TenantTags.owns(found.get().tags(), names.tenant())) {
        log.info("tenancy.isolation denied entity=prompt name={} tenant={}", name, names.tenant());
        throw TenancyException.permissionDenied("Prompt not in namespace");
      }
      return found.map(p -> p.withName(names.fromInternal(p.name())));
    }

    @Override
    public void deletePrompt(String name) {
      if (base == null) throw notImplemented();
      if (getPrompt(name).isEmpty()) throw MetadataStoreException.notFound("Prompt (name=" + name + ") not found.");
      base.deletePrompt(names().toInternal(name));
    }

    @Override
    public PagedList<Prompt> searchPrompts(String filterString, int maxResults, List<String> orderBy, String pageToken) {
      if (base == null) return PagedList.empty();
      NameTransformer names = names();
      String scoped = SearchFilter.and(
          SearchFilter.rewriteNameValues(filterString, names::toInternal), TenantTags.predicate(names.tenant()));
      return base.searchPrompts(scoped, maxResults, orderBy, pageToken)
          .map(p -> p.withName(names.fromInternal(p.name())));
    }

    private MetadataStoreException notImplemented() {
      return new MetadataStoreException(ErrorCode.NOT_IMPLEMENTED, "Prompts are not supported by this registry store");
    }
  }
}
