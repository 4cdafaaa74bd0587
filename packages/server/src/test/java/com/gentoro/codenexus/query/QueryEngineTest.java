package com.gentoro.codenexus.query;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.codenexus.exception.CodeNexusErrorCode;
import com.gentoro.codenexus.exception.ValidationException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class QueryEngineTest {

  private TagIndexView view;

  @BeforeEach
  void setUp() {
    Map<String, Set<String>> tagToFiles = new HashMap<>();
    tagToFiles.put("category:api", Set.of("a.go", "b.go", "c.rs"));
    tagToFiles.put("category:cli", Set.of("d.go"));
    tagToFiles.put("lang:go", Set.of("a.go", "b.go", "d.go"));
    tagToFiles.put("lang:rust", Set.of("c.rs"));
    tagToFiles.put("status:deprecated", Set.of("b.go"));
    tagToFiles.put("owner:api-team", Set.of("e.md"));
    view = new TagIndexView(tagToFiles, Set.of("a.go", "b.go", "c.rs", "d.go", "e.md"));
  }

  private List<String> query(String q) {
    return QueryEngine.query(q, view);
  }

  private static List<String> union(List<String> a, List<String> b) {
    TreeSet<String> set = new TreeSet<>(a);
    set.addAll(b);
    return List.copyOf(set);
  }

  @Test
  @DisplayName("OR is the union of its operands")
  void orIsUnion() {
    assertEquals(
        union(query("lang:rust"), query("category:cli")), query("lang:rust OR category:cli"));
    assertEquals(
        List.of("c.rs", "d.go", "e.md"), query("lang:rust OR category:cli OR owner:api-team"));
  }

  @Test
  @DisplayName("AND is the intersection of its operands")
  void andIsIntersection() {
    assertEquals(List.of("a.go", "b.go"), query("category:api AND lang:go"));
    assertEquals(List.of("b.go"), query("category:api AND lang:go AND status:deprecated"));
    assertTrue(query("lang:rust AND lang:go").isEmpty());
  }

  @Test
  @DisplayName("NOT complements against every tagged file")
  void notIsComplement() {
    assertEquals(List.of("a.go", "c.rs", "d.go", "e.md"), query("NOT status:deprecated"));
    assertEquals(List.of("a.go", "b.go", "c.rs", "d.go", "e.md"), query("NOT unknown:tag"));
    assertEquals(List.of("a.go"), query("category:api AND lang:go AND NOT status:deprecated"));
  }

  @Test
  @DisplayName("wildcards match prefix, suffix and interior positions")
  void wildcards() {
    assertEquals(union(query("category:api"), query("category:cli")), query("category:*"));
    assertEquals(List.of("a.go", "b.go", "d.go"), query("*:go"));
    assertEquals(List.of("e.md"), query("owner:*-team"));
    assertEquals(List.of("a.go", "b.go", "c.rs", "d.go", "e.md"), query("*"));
    assertTrue(query("nothing:*").isEmpty());
  }

  @Test
  @DisplayName("operators inside parentheses do not split the outer expression")
  void parenthesesRespectDepth() {
    assertEquals(List.of("a.go", "b.go", "c.rs"), query("category:api AND (lang:go OR lang:rust)"));
    assertEquals(List.of("c.rs", "d.go"), query("(lang:rust) OR (category:cli)"));
    assertEquals(List.of("a.go", "c.rs"), query("category:api AND NOT (status:deprecated)"));
    assertEquals(List.of("c.rs"), query("((lang:rust))"));
  }

  @Test
  @DisplayName("blank queries and unknown tags give empty results")
  void emptyResults() {
    assertTrue(query("").isEmpty());
    assertTrue(query("   ").isEmpty());
    assertTrue(query(null).isEmpty());
    assertTrue(query("lang:cobol").isEmpty());
  }

  @Test
  @DisplayName("unbalanced parentheses are rejected")
  void unbalancedParentheses() {
    ValidationException ex =
        assertThrows(ValidationException.class, () -> query("(lang:go AND category:api"));
    assertEquals(CodeNexusErrorCode.INVALID_QUERY_SYNTAX, ex.getCode());
    assertThrows(ValidationException.class, () -> query("lang:go)"));
  }

  @Test
  @DisplayName("validateQuerySyntax catches the shallow malformed cases only")
  void validateQuerySyntax() {
    assertThrows(ValidationException.class, () -> QueryEngine.validateQuerySyntax(""));
    assertThrows(ValidationException.class, () -> QueryEngine.validateQuerySyntax("  "));
    assertThrows(
        ValidationException.class, () -> QueryEngine.validateQuerySyntax("a:b AND  AND c:d"));
    assertThrows(ValidationException.class, () -> QueryEngine.validateQuerySyntax("a:b:c"));

    assertDoesNotThrow(() -> QueryEngine.validateQuerySyntax("category:api"));
    assertDoesNotThrow(() -> QueryEngine.validateQuerySyntax("a:"));
    assertDoesNotThrow(() -> QueryEngine.validateQuerySyntax(":b"));
    assertDoesNotThrow(() -> QueryEngine.validateQuerySyntax("category:api AND lang:go"));
    assertDoesNotThrow(() -> QueryEngine.validateQuerySyntax("NOT status:deprecated"));
  }
}
