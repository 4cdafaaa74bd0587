package com.gentoro.codenexus.query;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class WildcardPatternTest {

  @Test
  @DisplayName("prefix pattern anchors the head only")
  void prefix() {
    WildcardPattern p = WildcardPattern.compile("category:*");
    assertTrue(p.matches("category:api"));
    assertTrue(p.matches("category:"));
    assertFalse(p.matches("xcategory:api"));
  }

  @Test
  @DisplayName("suffix pattern anchors the tail only")
  void suffix() {
    WildcardPattern p = WildcardPattern.compile("*:go");
    assertTrue(p.matches("lang:go"));
    assertFalse(p.matches("lang:gopher"));
  }

  @Test
  @DisplayName("interior star needs head and tail to fit without overlapping")
  void interior() {
    WildcardPattern p = WildcardPattern.compile("ab*ba");
    assertTrue(p.matches("abba"));
    assertTrue(p.matches("ab-x-ba"));
    assertFalse(p.matches("aba"));
    assertTrue(WildcardPattern.compile("a*b*c").matches("a-b-c"));
    assertFalse(WildcardPattern.compile("a*b*c").matches("a-c-b"));
  }

  @Test
  @DisplayName("matching is case-sensitive and a lone star matches anything")
  void caseAndStar() {
    assertFalse(WildcardPattern.compile("Lang:*").matches("lang:go"));
    assertTrue(WildcardPattern.compile("*").matches(""));
    assertTrue(WildcardPattern.compile("**").matches("anything"));
    assertFalse(WildcardPattern.compile("*").matches(null));
    assertFalse(WildcardPattern.isWildcard("lang:go"));
  }
}
