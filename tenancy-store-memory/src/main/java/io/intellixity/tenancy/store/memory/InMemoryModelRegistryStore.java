package io.intellixity.tenancy.store.memory;

import io.intellixity.tenancy.store.*;
import io.intellixity.tenancy.store.entity.*;
import io.intellixity.tenancy.store.filter.FilterClause;
import io.intellixity.tenancy.store.filter.SearchFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Thread-safe in-memory {@link ModelRegistryStore} with optional prompt and webhook support.
 */
public final class InMemoryModelRegistryStore implements ModelRegistryStore, PromptStore, WebhookStore {
  private static final Logger log = LoggerFactory.getLogger(InMemoryModelRegistryStore.class);

  public static final String STAGE_NONE = "None";
  public static final String STAGE_ARCHIVED = "Archived";
  private static final List<String> STAGES = List.of(STAGE_NONE, "Staging", "Production", STAGE_ARCHIVED);

  private final Set<RegistryCapability> capabilities;
  private final Map<String, ModelRow> models = new LinkedHashMap<>();
  private final Map<String, Prompt> prompts = new LinkedHashMap<>();
  private final Map<String, Webhook> webhooks = new LinkedHashMap<>();
  private long clock;

  private static final class ModelRow {
    String name;
    String description;
    final long created;
    final Map<String, String> tags = new LinkedHashMap<>();
    final Map<String, String> aliases = new LinkedHashMap<>();
    final TreeMap<Long, VersionRow> versions = new TreeMap<>();

    ModelRow(String name, String description, long created) {
      this.name = name;
      this.description = description;
      this.created = created;
    }

    RegisteredModel toEntity() {
      return new RegisteredModel(name, description, tags, aliases, created);
    }
  }

  private static final class VersionRow {
    final long version;
    final String source;
    final String runId;
    String description;
    String stage = STAGE_NONE;
    final Map<String, String> tags = new LinkedHashMap<>();

    VersionRow(long version, String source, String runId, String description) {
      this.version = version;
      this.source = source;
      this.runId = runId;
      this.description = description;
    }

    ModelVersion toEntity(ModelRow model) {
      List<String> aliases = new ArrayList<>();
      for (var e : model.aliases.entrySet()) {
        if (e.getValue().equals(String.valueOf(version))) aliases.add(e.getKey());
      }
      return new ModelVersion(model.name, String.valueOf(version), source, runId, description, stage, tags, aliases);
    }
  }

  public InMemoryModelRegistryStore() {
    this(EnumSet.of(RegistryCapability.PROMPTS));
  }

  public InMemoryModelRegistryStore(Set<RegistryCapability> capabilities) {
    this.capabilities = capabilities == null || capabilities.isEmpty()
        ? EnumSet.noneOf(RegistryCapability.class)
        : EnumSet.copyOf(capabilities);
  }

  @Override
  public String backend() {
    return "memory";
  }

  @Override
  public Optional<PromptStore> prompts() {
    return capabilities.contains(RegistryCapability.PROMPTS) ? Optional.of(this) : Optional.empty();
  }

  @Override
  public Optional<WebhookStore> webhooks() {
    return capabilities.contains(RegistryCapability.WEBHOOKS) ? Optional.of(this) : Optional.empty();
  }

  // ---------- registered models ----------

  @Override
  public synchronized RegisteredModel createRegisteredModel(String name, List<Tag> tags, String description) {
    requireName(name);
    if (models.containsKey(name)) throw MetadataStoreException.alreadyExists("Registered Model (name=" + name + ") already exists.");
    ModelRow row = new ModelRow(name, description, ++clock);
    row.tags.putAll(Tags.toMap(tags));
    models.put(name, row);
    log.debug("tenancy.memory op=createRegisteredModel name={}", name);
    return row.toEntity();
  }

  @Override
  public synchronized RegisteredModel getRegisteredModel(String name) {
    return model(name).toEntity();
  }

  @Override
  public synchronized RegisteredModel updateRegisteredModel(String name, String description) {
    ModelRow row = model(name);
    row.description = description;
    return row.toEntity();
  }

  @Override
  public synchronized RegisteredModel renameRegisteredModel(String name, String newName) {
    requireName(newName);
    ModelRow row = model(name);
    if (models.containsKey(newName)) throw MetadataStoreException.alreadyExists("Registered Model (name=" + newName + ") already exists.");
    models.remove(name);
    row.name = newName;
    models.put(newName, row);
    return row.toEntity();
  }

  @Override
  public synchronized void deleteRegisteredModel(String name) {
    model(name);
    models.remove(name);
  }

  @Override
  public synchronized PagedList<RegisteredModel> searchRegisteredModels(String filterString,
                                                                        int maxResults,
                                                                        List<String> orderBy,
                                                                        String pageToken) {
    List<FilterClause> clauses = SearchFilter.parse(filterString);
    List<RegisteredModel> hits = new ArrayList<>();
    for (ModelRow m : models.values()) {
      if (MemoryQueries.matches(clauses, Map.of("name", m.name), m.tags)) hits.add(m.toEntity());
    }
    return MemoryQueries.page(hits, maxResults, pageToken);
  }

  @Override
  public synchronized List<ModelVersion> getLatestVersions(String name, List<String> stages) {
    ModelRow row = model(name);
    List<String> wanted = stages == null || stages.isEmpty() ? STAGES : stages;
    List<ModelVersion> out = new ArrayList<>();
    for (String stage : wanted) {
      VersionRow latest = null;
      for (VersionRow v : row.versions.values()) {
        if (v.stage.equalsIgnoreCase(stage)) latest = v;
      }
      if (latest != null) out.add(latest.toEntity(row));
    }
    return out;
  }

  @Override
  public synchronized void setRegisteredModelTag(String name, Tag tag) {
    model(name).tags.put(tag.key(), tag.value());
  }

  @Override
  public synchronized void deleteRegisteredModelTag(String name, String key) {
    model(name).tags.remove(key);
  }

  @Override
  public synchronized void setRegisteredModelAlias(String name, String alias, String version) {
    ModelRow row = model(name);
    version(row, version);
    row.aliases.put(alias, version);
  }

  @Override
  public synchronized void deleteRegisteredModelAlias(String name, String alias) {
    model(name).aliases.remove(alias);
  }

  @Override
  public synchronized ModelVersion getModelVersionByAlias(String name, String alias) {
    ModelRow row = model(name);
    String version = row.aliases.get(alias);
    if (version == null) throw MetadataStoreException.notFound("Registered model alias " + alias + " not found.");
    return version(row, version).toEntity(row);
  }

  // ---------- model versions ----------

  @Override
  public synchronized ModelVersion createModelVersion(String name, String source, String runId, List<Tag> tags, String description) {
    ModelRow row = model(name);
    long next = row.versions.isEmpty() ? 1L : row.versions.lastKey() + 1;
    VersionRow v = new VersionRow(next, source, runId, description);
    v.tags.putAll(Tags.toMap(tags));
    row.versions.put(next, v);
    return v.toEntity(row);
  }

  @Override
  public synchronized ModelVersion getModelVersion(String name, String version) {
    ModelRow row = model(name);
    return version(row, version).toEntity(row);
  }

  @Override
  public synchronized ModelVersion updateModelVersion(String name, String version, String description) {
    ModelRow row = model(name);
    VersionRow v = version(row, version);
    v.description = description;
    return v.toEntity(row);
  }

  @Override
  public synchronized ModelVersion transitionModelVersionStage(String name,
                                                               String version,
                                                               String stage,
                                                               boolean archiveExistingVersions) {
    ModelRow row = model(name);
    VersionRow v = version(row, version);
    String canonical = STAGES.stream().filter(s -> s.equalsIgnoreCase(stage)).findFirst()
        .orElseThrow(() -> MetadataStoreException.invalidParameter("Invalid Model Version stage: " + stage));
    if (archiveExistingVersions) {
      for (VersionRow other : row.versions.values()) {
        if (other != v && other.stage.equals(canonical)) other.stage = STAGE_ARCHIVED;
      }
    }
    v.stage = canonical;
    return v.toEntity(row);
  }

  @Override
  public synchronized void deleteModelVersion(String name, String version) {
    ModelRow row = model(name);
    VersionRow v = version(row, version);
    row.versions.remove(v.version);
    row.aliases.values().removeIf(a -> a.equals(String.valueOf(v.version)));
  }

  @Override
  public synchronized String getModelVersionDownloadUri(String name, String version) {
    return version(model(name), version).source;
  }

  @Override
  public synchronized PagedList<ModelVersion> searchModelVersions(String filterString,
                                                                  int maxResults,
                                                                  List<String> orderBy,
                                                                  String pageToken) {
    List<FilterClause> clauses = SearchFilter.parse(filterString);
    List<ModelVersion> hits = new ArrayList<>();
    for (ModelRow m : models.values()) {
      for (VersionRow v : m.versions.values()) {
        Map<String, String> attrs = new HashMap<>();
        attrs.put("name", m.name);
        attrs.put("version", String.valueOf(v.version));
        attrs.put("run_id", v.runId);
        attrs.put("source", v.source);
        if (MemoryQueries.matches(clauses, attrs, v.tags)) hits.add(v.toEntity(m));
      }
    }
    return MemoryQueries.page(hits, maxResults, pageToken);
  }

  @Override
  public synchronized void setModelVersionTag(String name, String version, Tag tag) {
    version(model(name), version).tags.put(tag.key(), tag.value());
  }

  @Override
  public synchronized void deleteModelVersionTag(String name, String version, String key) {
    version(model(name), version).tags.remove(key);
  }

  // ---------- prompts ----------

  @Override
  public synchronized Prompt createPrompt(String name, String description, Map<String, String> tags) {
    requireName(name);
    if (prompts.containsKey(name)) throw MetadataStoreException.alreadyExists("Prompt (name=" + name + ") already exists.");
    Prompt p = new Prompt(name, description, tags);
    prompts.put(name, p);
    return p;
  }

  @Override
  public synchronized Optional<Prompt> getPrompt(String name) {
    return Optional.ofNullable(prompts.get(name));
  }

  @Override
  public synchronized void deletePrompt(String name) {
    if (prompts.remove(name) == null) throw MetadataStoreException.notFound("Prompt (name=" + name + ") not found.");
  }

  @Override
  public synchronized PagedList<Prompt> searchPrompts(String filterString, int maxResults, List<String> orderBy, String pageToken) {
    List<FilterClause> clauses = SearchFilter.parse(filterString);
    List<Prompt> hits = new ArrayList<>();
    for (Prompt p : prompts.values()) {
      if (MemoryQueries.matches(clauses, Map.of("name", p.name()), p.tags())) hits.add(p);
    }
    return MemoryQueries.page(hits, maxResults, pageToken);
  }

  // ---------- webhooks ----------

  public synchronized Webhook createWebhook(String name, String url, List<String> events) {
    String id = "wh-" + (++clock);
    Webhook w = new Webhook(id, name, url, events);
    webhooks.put(id, w);
    return w;
  }

  @Override
  public synchronized PagedList<Webhook> listWebhooksByEvent(String event, int maxResults, String pageToken) {
    List<Webhook> hits = webhooks.values().stream().filter(w -> w.events().contains(event)).toList();
    return MemoryQueries.page(hits, maxResults, pageToken);
  }

  // ---------- internals ----------

  private static void requireName(String name) {
    if (name == null || name.isBlank()) throw MetadataStoreException.invalidParameter("Missing value for required parameter 'name'.");
  }

  private ModelRow model(String name) {
    ModelRow row = name == null ? null : models.get(name);
    if (row == null) throw MetadataStoreException.notFound("Registered Model with name=" + name + " not found");
    return row;
  }

  private static VersionRow version(ModelRow row, String version) {
    long number;
    try {
      number = Long.parseLong(String.valueOf(version));
    } catch (NumberFormatException e) {
      throw MetadataStoreException.invalidParameter("Model version must be an integer, got: " + version);
    }
    VersionRow v = row.versions.get(number);
    if (v == null) throw MetadataStoreException.notFound("Model Version (name=" + row.name + ", version=" + version + ") not found");
    return v;
  }
}
