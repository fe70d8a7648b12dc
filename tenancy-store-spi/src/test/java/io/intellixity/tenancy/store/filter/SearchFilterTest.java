package io.intellixity.tenancy.store.filter;

import io.intellixity.tenancy.core.ErrorCode;
import io.intellixity.tenancy.store.MetadataStoreException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SearchFilterTest {

  @Test
  void parse_splitsConjunctionOutsideQuotes() {
    List<FilterClause> clauses = SearchFilter.parse("name = 'a AND b' and tags.`mlflow.namespace` = 'team-a'");

    assertEquals(2, clauses.size());
    assertEquals(new FilterClause("name", FilterOperator.EQ, "a AND b"), clauses.get(0));
    assertTrue(clauses.get(1).isTag());
    assertEquals("mlflow.namespace", clauses.get(1).tagKey());
    assertEquals("team-a", clauses.get(1).value());
  }

  @Test
  void parse_unescapesDoubledQuotes() {
    FilterClause c = SearchFilter.parse("tags.owner = 'o''brien'").get(0);
    assertEquals("o'brien", c.value());
    assertEquals("owner", c.tagKey());
  }

  @Test
  void parse_blankFilter_isEmpty() {
    assertTrue(SearchFilter.parse(null).isEmpty());
    assertTrue(SearchFilter.parse("  ").isEmpty());
  }

  @Test
  void parse_malformedClause_isInvalidParameter() {
    MetadataStoreException ex = assertThrows(MetadataStoreException.class, () -> SearchFilter.parse("name ~ 1"));
    assertEquals(ErrorCode.INVALID_PARAMETER_VALUE, ex.errorCode());
  }

  @Test
  void and_composesWithCallerFilter() {
    String tenant = SearchFilter.tagEquals("mlflow.namespace", "team-a");
    assertEquals(tenant, SearchFilter.and(null, tenant));
    assertEquals("name = 'x' AND " + tenant, SearchFilter.and("name = 'x'", tenant));
  }

  @Test
  void tagEquals_escapesValue() {
    assertEquals("tags.`k` = 'it''s'", SearchFilter.tagEquals("k", "it's"));
  }

  @Test
  void rewriteNameValues_onlyTouchesNameAttribute() {
    String rewritten = SearchFilter.rewriteNameValues(
        "name = 'm1' AND run_name = 'r' AND tags.`name` = 'n' AND name LIKE 'churn%'", n -> "team-a::" + n);
    assertEquals("name = 'team-a::m1' AND run_name = 'r' AND tags.`name` = 'n' AND name LIKE 'team-a::churn%'", rewritten);
  }

  @Test
  void rewriteNameValues_leavesNamePatternInsideQuotedValueAlone() {
    String filter = "tags.note = 'old name = ''x''' AND name = 'm1'";
    String rewritten = SearchFilter.rewriteNameValues(filter, n -> "team-a::" + n);

    assertEquals("tags.note = 'old name = ''x''' AND name = 'team-a::m1'", rewritten);
    List<FilterClause> clauses = SearchFilter.parse(rewritten);
    assertEquals("old name = 'x'", clauses.get(0).value());
    assertEquals("team-a::m1", clauses.get(1).value());
  }

  @Test
  void like_matchesPrefixLiterally() {
    FilterClause c = SearchFilter.parse(SearchFilter.nameStartsWith("team_a::")).get(0);
    assertTrue(c.test("team_a::model"));
    assertFalse(c.test("teamXa::model"));
  }

  @Test
  void notEquals_requiresPresence() {
    FilterClause c = new FilterClause("tags.k", FilterOperator.NE, "v");
    assertFalse(c.test(null));
    assertTrue(c.test("w"));
  }
}
