package com.gentoro.codenexus.query;

import com.gentoro.codenexus.exception.ValidationException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parser for the tag query language.
 *
 * <p>Forms, from the loosest binding to the tightest:
 *
 * <ol>
 *   <li>{@code a OR b [OR c ...]}: union
 *   <li>{@code a AND b [AND c ...]}: intersection
 *   <li>{@code NOT a}: complement against all tagged files
 *   <li>{@code (a)}: grouping
 *   <li>{@code type:*}, {@code *:value}, {@code a*b}: wildcard over known tags
 *   <li>{@code type:value}: exact tag
 * </ol>
 *
 * <p>Operators are the literal, space-delimited words {@code " OR "} and {@code " AND "}. They only
 * split an expression outside of parentheses, so {@code a AND (b OR c)} is an intersection whose
 * second operand is a union.
 */
public final class QueryParser {
  private static final String OR = " OR ";
  private static final String AND = " AND ";
  private static final String NOT = "NOT ";

  private QueryParser() {}

  /**
   * @throws ValidationException with {@code INVALID_QUERY_SYNTAX} for unbalanced parentheses
   */
  public static QueryExpression parse(String query) {
    if (query == null || query.isBlank()) {
      return new QueryExpression.Empty();
    }
    checkBalanced(query);
    return parseExpression(query);
  }

  private static QueryExpression parseExpression(String input) {
    String expr = input.trim();
    if (expr.isEmpty()) {
      return new QueryExpression.Empty();
    }

    List<String> orParts = splitTopLevel(expr, OR);
    if (orParts.size() > 1) {
      return new QueryExpression.Or(parseAll(orParts));
    }

    List<String> andParts = splitTopLevel(expr, AND);
    if (andParts.size() > 1) {
      return new QueryExpression.And(parseAll(andParts));
    }

    if (expr.startsWith(NOT)) {
      return new QueryExpression.Not(parseExpression(expr.substring(NOT.length())));
    }

    if (expr.startsWith("(") && closingParenthesis(expr, 0) == expr.length() - 1) {
      return parseExpression(expr.substring(1, expr.length() - 1));
    }

    if (WildcardPattern.isWildcard(expr)) {
      return new QueryExpression.Wildcard(WildcardPattern.compile(expr));
    }
    return new QueryExpression.Tag(expr);
  }

  private static List<QueryExpression> parseAll(List<String> parts) {
    List<QueryExpression> operands = new ArrayList<>(parts.size());
    for (String part : parts) {
      operands.add(parseExpression(part));
    }
    return operands;
  }

  /** Splits on {@code operator} occurrences at parenthesis depth zero. */
  static List<String> splitTopLevel(String expr, String operator) {
    List<String> parts = new ArrayList<>();
    int depth = 0;
    int start = 0;
    int i = 0;
    while (i < expr.length()) {
      char c = expr.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
      } else if (depth == 0 && expr.startsWith(operator, i)) {
        parts.add(expr.substring(start, i));
        i += operator.length();
        start = i;
        continue;
      }
      i++;
    }
    parts.add(expr.substring(start));
    return parts;
  }

  /** Index of the parenthesis closing the one at {@code open}, or -1. */
  private static int closingParenthesis(String expr, int open) {
    int depth = 0;
    for (int i = open; i < expr.length(); i++) {
      char c = expr.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
        if (depth == 0) return i;
      }
    }
    return -1;
  }

  private static void checkBalanced(String query) {
    int depth = 0;
    for (int i = 0; i < query.length(); i++) {
      char c = query.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
        if (depth < 0) {
          throw ValidationException.querySyntax(query, "unexpected ')' at position " + i);
        }
      }
    }
    if (depth != 0) {
      throw ValidationException.querySyntax(query, "missing ')'");
    }
  }
}
