package io.intellixity.tenancy.authz;

import java.util.Locale;

/**
 * Derives the (resource type, verb) pair of a request from its path and method.\n
 *
 * Substring matching over the lower-cased path. The tracking REST surface declares no resource metadata of its
 * own, so a newly added path falls into whichever bucket its segments happen to match.
 */
public final class RequestClassifier {
  private RequestClassifier() {}

  public static Classification classify(String path, String method) {
    String p = path == null ? "" : path.toLowerCase(Locale.ROOT);
    String m = method == null ? "" : method.toUpperCase(Locale.ROOT);
    return new Classification(resource(p), verb(p, m));
  }

  static ResourceType resource(String path) {
    if (path.contains("/registered-models") || path.contains("/model-versions")) return ResourceType.MODELS;
    if (path.contains("/prompts") || path.contains("/prompt-versions")) return ResourceType.PROMPTS;
    return ResourceType.EXPERIMENTS;
  }

  static Verb verb(String path, String method) {
    switch (method) {
      case "GET":
        return path.contains("search") ? Verb.LIST : Verb.GET;
      case "POST":
      case "PUT":
      case "PATCH":
      case "DELETE":
        if (path.contains("delete") || method.equals("DELETE")) return Verb.DELETE;
        if (path.contains("create")) return Verb.CREATE;
        if (path.contains("update") || method.equals("PUT") || method.equals("PATCH")) return Verb.UPDATE;
        return Verb.CREATE;
      default:
        return Verb.GET;
    }
  }
}
