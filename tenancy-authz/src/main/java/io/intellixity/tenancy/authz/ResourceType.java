package io.intellixity.tenancy.authz;

/** Resource types of the authorization tuple, named as the authority's role bindings name them. */
public enum ResourceType {
  EXPERIMENTS("experiments"),
  MODELS("models"),
  PROMPTS("prompts");

  private final String wireName;

  ResourceType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() { return wireName; }
}
