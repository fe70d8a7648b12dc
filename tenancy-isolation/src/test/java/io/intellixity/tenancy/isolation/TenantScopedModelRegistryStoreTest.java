package io.intellixity.tenancy.isolation;

import io.intellixity.tenancy.core.ErrorCode;
import io.intellixity.tenancy.core.TenancyException;
import io.intellixity.tenancy.core.TenantContext;
import io.intellixity.tenancy.core.TenantScope;
import io.intellixity.tenancy.store.*;
import io.intellixity.tenancy.store.entity.*;
import io.intellixity.tenancy.store.memory.InMemoryModelRegistryStore;
import io.intellixity.tenancy.store.memory.RegistryCapability;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class TenantScopedModelRegistryStoreTest {

  private final InMemoryModelRegistryStore base = new InMemoryModelRegistryStore();
  private final ModelRegistryStore teamA = scoped(base, "team-a");
  private final ModelRegistryStore teamB = scoped(base, "team-b");

  private static ModelRegistryStore scoped(ModelRegistryStore store, String tenant) {
    return new TenantScopedModelRegistryStore(store, TenantScope.fixed(TenantContext.of(tenant)));
  }

  @Test
  void createRegisteredModel_prefixesAndTags() {
    RegisteredModel created = teamA.createRegisteredModel("churn", List.of(), "d");

    assertEquals("churn", created.name());
    RegisteredModel stored = base.getRegisteredModel("team-a::churn");
    assertEquals("team-a", stored.tag(TenantTags.TENANT_TAG_KEY));
  }

  @Test
  void sameNameInTwoTenants_doesNotCollide() {
    teamA.createRegisteredModel("churn", List.of(), "a");
    teamB.createRegisteredModel("churn", List.of(), "b");

    assertEquals("a", teamA.getRegisteredModel("churn").description());
    assertEquals("b", teamB.getRegisteredModel("churn").description());
  }

  @Test
  void getRegisteredModel_untaggedEntryIsDenied() {
    base.createRegisteredModel("team-a::legacy", List.of(), null);

    TenancyException ex = assertThrows(TenancyException.class, () -> teamA.getRegisteredModel("legacy"));
    assertEquals(ErrorCode.PERMISSION_DENIED, ex.errorCode());
  }

  @Test
  void foreignPrefixInName_staysInsideOwnTenant() {
    teamB.createRegisteredModel("secret", List.of(), null);

    MetadataStoreException ex = assertThrows(MetadataStoreException.class,
        () -> teamA.getRegisteredModel("team-b::secret"));
    assertEquals(ErrorCode.RESOURCE_DOES_NOT_EXIST, ex.errorCode());
  }

  @Test
  void searchRegisteredModels_onlyOwnTenantWithVisibleNames() {
    teamA.createRegisteredModel("m1", List.of(), null);
    teamA.createRegisteredModel("m2", List.of(), null);
    teamB.createRegisteredModel("m1", List.of(), null);

    List<String> names = teamA.searchRegisteredModels(null, 100, null, null).items().stream()
        .map(RegisteredModel::name).toList();
    assertEquals(List.of("m1", "m2"), names);

    List<String> byName = teamB.searchRegisteredModels("name = 'm1'", 100, null, null).items().stream()
        .map(RegisteredModel::name).toList();
    assertEquals(List.of("m1"), byName);
  }

  @Test
  void searchRegisteredModels_tagValueQuotingNamePatternIsUntouched() {
    teamA.createRegisteredModel("churn", List.of(new Tag("note", "old name = 'x'")), null);
    teamA.createRegisteredModel("other", List.of(new Tag("note", "fresh")), null);

    List<String> names = teamA.searchRegisteredModels("tags.note = 'old name = ''x'''", 100, null, null).items().stream()
        .map(RegisteredModel::name).toList();

    assertEquals(List.of("churn"), names);
  }

  @Test
  void renameRegisteredModel_staysInTenant() {
    teamA.createRegisteredModel("old", List.of(), null);

    RegisteredModel renamed = teamA.renameRegisteredModel("old", "new");

    assertEquals("new", renamed.name());
    assertEquals("new", teamA.getRegisteredModel("new").name());
    assertNotNull(base.getRegisteredModel("team-a::new"));
  }

  @Test
  void modelVersions_areStrippedAndScoped() {
    teamA.createRegisteredModel("churn", List.of(), null);
    teamB.createRegisteredModel("churn", List.of(), null);
    ModelVersion v1 = teamA.createModelVersion("churn", "s3://a/1", "run-1", List.of(), null);
    teamB.createModelVersion("churn", "s3://b/1", "run-9", List.of(), null);

    assertEquals("churn", v1.name());
    assertEquals("1", v1.version());
    assertEquals("s3://a/1", teamA.getModelVersionDownloadUri("churn", "1"));

    ModelVersion staged = teamA.transitionModelVersionStage("churn", "1", "production", false);
    assertEquals("Production", staged.currentStage());
    assertEquals("churn", teamA.getLatestVersions("churn", List.of("Production")).get(0).name());
  }

  @Test
  void searchModelVersions_neverReachesOtherTenants() {
    teamA.createRegisteredModel("churn", List.of(), null);
    teamB.createRegisteredModel("churn", List.of(), null);
    teamA.createModelVersion("churn", "s3://a/1", "run-1", List.of(), null);
    teamB.createModelVersion("churn", "s3://b/1", "run-9", List.of(), null);

    List<ModelVersion> all = teamA.searchModelVersions(null, 100, null, null).items();
    assertEquals(1, all.size());
    assertEquals("churn", all.get(0).name());
    assertEquals("s3://a/1", all.get(0).source());

    List<ModelVersion> byName = teamB.searchModelVersions("name = 'churn'", 100, null, null).items();
    assertEquals(List.of("s3://b/1"), byName.stream().map(ModelVersion::source).toList());

    assertTrue(teamA.searchModelVersions("run_id = 'run-9'", 100, null, null).isEmpty());
  }

  @Test
  void createModelVersion_fallsBackToLatestWhenStoreReturnsNull() {
    ModelRegistryStore scoped = scoped(new NonEchoingRegistry(base), "team-a");
    scoped.createRegisteredModel("churn", List.of(), null);
    scoped.createModelVersion("churn", "s3://a/1", null, List.of(), null);

    ModelVersion v2 = scoped.createModelVersion("churn", "s3://a/2", null, List.of(), null);

    assertEquals("churn", v2.name());
    assertEquals("2", v2.version());
  }

  @Test
  void reservedTag_cannotBeChanged() {
    teamA.createRegisteredModel("churn", List.of(), null);

    assertThrows(TenancyException.class,
        () -> teamA.setRegisteredModelTag("churn", new Tag(TenantTags.TENANT_TAG_KEY, "team-b")));
    assertThrows(TenancyException.class, () -> teamA.deleteRegisteredModelTag("churn", TenantTags.TENANT_TAG_KEY));
    teamA.setRegisteredModelTag("churn", new Tag("owner", "ana"));
    assertEquals("ana", teamA.getRegisteredModel("churn").tag("owner"));
  }

  @Test
  void reservedTag_cannotBeWrittenOnModelVersions() {
    teamA.createRegisteredModel("churn", List.of(), null);
    teamA.createModelVersion("churn", "s3://a/1", null, List.of(), null);

    TenancyException ex = assertThrows(TenancyException.class,
        () -> teamA.setModelVersionTag("churn", "1", new Tag(TenantTags.TENANT_TAG_KEY, "team-b")));
    assertEquals(ErrorCode.PERMISSION_DENIED, ex.errorCode());
    assertThrows(TenancyException.class, () -> teamA.deleteModelVersionTag("churn", "1", TenantTags.TENANT_TAG_KEY));
    assertThrows(TenancyException.class, () -> teamA.createModelVersion("churn", "s3://a/2", null,
        List.of(new Tag(TenantTags.TENANT_TAG_KEY, "team-b")), null));
    assertNull(base.getModelVersion("team-a::churn", "1").tags().get(TenantTags.TENANT_TAG_KEY));
    assertEquals(1, teamA.searchModelVersions(null, 100, null, null).items().size());
  }

  @Test
  void aliases_resolveWithinTenant() {
    teamA.createRegisteredModel("churn", List.of(), null);
    teamA.createModelVersion("churn", "s3://a/1", null, List.of(), null);
    teamA.setRegisteredModelAlias("churn", "champion", "1");

    ModelVersion v = teamA.getModelVersionByAlias("churn", "champion");

    assertEquals("churn", v.name());
    assertEquals(List.of("champion"), v.aliases());
  }

  @Test
  void prompts_prefixedTaggedAndScoped() {
    PromptStore promptsA = teamA.prompts().orElseThrow();
    PromptStore promptsB = teamB.prompts().orElseThrow();

    Prompt p = promptsA.createPrompt("greeting", "hi", Map.of());

    assertEquals("greeting", p.name());
    assertEquals("team-a", p.tag(TenantTags.TENANT_TAG_KEY));
    assertTrue(base.getPrompt("team-a::greeting").isPresent());
    assertTrue(promptsB.getPrompt("greeting").isEmpty());
    assertEquals(List.of("greeting"),
        promptsA.searchPrompts(null, 10, null, null).items().stream().map(Prompt::name).toList());
    assertTrue(promptsB.searchPrompts(null, 10, null, null).isEmpty());
  }

  @Test
  void prompt_underOwnPrefixButForeignTagIsDenied() {
    base.createPrompt("team-a::planted", null, Map.of(TenantTags.TENANT_TAG_KEY, "team-b"));

    TenancyException ex = assertThrows(TenancyException.class,
        () -> teamA.prompts().orElseThrow().getPrompt("planted"));
    assertEquals(ErrorCode.PERMISSION_DENIED, ex.errorCode());
  }

  @Test
  void missingCapabilities_answerNeutrally() {
    InMemoryModelRegistryStore bare = new InMemoryModelRegistryStore(EnumSet.noneOf(RegistryCapability.class));
    ModelRegistryStore scoped = scoped(bare, "team-a");

    assertTrue(scoped.prompts().orElseThrow().searchPrompts(null, 10, null, null).isEmpty());
    assertTrue(scoped.prompts().orElseThrow().getPrompt("x").isEmpty());
    assertTrue(scoped.webhooks().orElseThrow().listWebhooksByEvent("MODEL_VERSION_CREATED", 10, null).isEmpty());
  }

  @Test
  void webhooks_passThroughUnscoped() {
    InMemoryModelRegistryStore withHooks = new InMemoryModelRegistryStore(EnumSet.allOf(RegistryCapability.class));
    withHooks.createWebhook("notify", "https://hooks.example/1", List.of("MODEL_VERSION_CREATED"));

    PagedList<Webhook> hooks = scoped(withHooks, "team-a").webhooks().orElseThrow()
        .listWebhooksByEvent("MODEL_VERSION_CREATED", 10, null);

    assertEquals(1, hooks.items().size());
  }

  /** A registry that stores versions but does not echo them back from create. */
  private static final class NonEchoingRegistry implements ModelRegistryStore {
    private final ModelRegistryStore target;

    NonEchoingRegistry(ModelRegistryStore target) {
      this.target = target;
    }

    @Override public String backend() { return target.backend(); }
    @Override public RegisteredModel createRegisteredModel(String name, List<Tag> tags, String description) {
      return target.createRegisteredModel(name, tags, description);
    }
    @Override public RegisteredModel getRegisteredModel(String name) { return target.getRegisteredModel(name); }
    @Override public RegisteredModel updateRegisteredModel(String name, String description) {
      return target.updateRegisteredModel(name, description);
    }
    @Override public RegisteredModel renameRegisteredModel(String name, String newName) {
      return target.renameRegisteredModel(name, newName);
    }
    @Override public void deleteRegisteredModel(String name) { target.deleteRegisteredModel(name); }
    @Override public PagedList<RegisteredModel> searchRegisteredModels(String filterString, int maxResults,
                                                                       List<String> orderBy, String pageToken) {
      return target.searchRegisteredModels(filterString, maxResults, orderBy, pageToken);
    }
    @Override public List<ModelVersion> getLatestVersions(String name, List<String> stages) {
      return target.getLatestVersions(name, stages);
    }
    @Override public void setRegisteredModelTag(String name, Tag tag) { target.setRegisteredModelTag(name, tag); }
    @Override public void deleteRegisteredModelTag(String name, String key) { target.deleteRegisteredModelTag(name, key); }
    @Override public void setRegisteredModelAlias(String name, String alias, String version) {
      target.setRegisteredModelAlias(name, alias, version);
    }
    @Override public void deleteRegisteredModelAlias(String name, String alias) { target.deleteRegisteredModelAlias(name, alias); }
    @Override public ModelVersion getModelVersionByAlias(String name, String alias) {
      return target.getModelVersionByAlias(name, alias);
    }
    @Override public ModelVersion createModelVersion(String name, String source, String runId, List<Tag> tags,
                                                     String description) {
      target.createModelVersion(name, source, runId, tags, description);
      return null;
    }
    @Override public ModelVersion getModelVersion(String name, String version) { return target.getModelVersion(name, version); }
    @Override public ModelVersion updateModelVersion(String name, String version, String description) {
      return target.updateModelVersion(name, version, description);
    }
    @Override public ModelVersion transitionModelVersionStage(String name, String version, String stage,
                                                              boolean archiveExistingVersions) {
      return target.transitionModelVersionStage(name, version, stage, archiveExistingVersions);
    }
    @Override public void deleteModelVersion(String name, String version) { target.deleteModelVersion(name, version); }
    @Override public String getModelVersionDownloadUri(String name, String version) {
      return target.getModelVersionDownloadUri(name, version);
    }
    @Override public PagedList<ModelVersion> searchModelVersions(String filterString, int maxResults,
                                                                 List<String> orderBy, String pageToken) {
      return target.searchModelVersions(filterString, maxResults, orderBy, pageToken);
    }
    @Override public void setModelVersionTag(String name, String version, Tag tag) {
      target.setModelVersionTag(name, version, tag);
    }
    @Override public void deleteModelVersionTag(String name, String version, String key) {
      target.deleteModelVersionTag(name, version, key);
    }
  }
}
