package com.gentoro.codenexus.query;

import com.gentoro.codenexus.exception.ValidationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Stateless evaluator for tag queries. See {@link QueryParser} for the grammar.
 *
 * <p>Evaluation reads only the supplied {@link TagIndexView}; callers are responsible for holding
 * whatever lock protects the underlying maps for the duration of the call.
 */
public final class QueryEngine {
  private static final Pattern AND_SPLIT = Pattern.compile(Pattern.quote(" AND "));

  private QueryEngine() {}

  /**
   * Evaluate {@code query} against {@code view}.
   *
   * @return matching files in ascending order; empty for a blank query or unknown tags
   */
  public static List<String> query(String query, TagIndexView view) {
    QueryExpression expression = QueryParser.parse(query);
    List<String> files = new ArrayList<>(expression.evaluate(view));
    Collections.sort(files);
    return files;
  }

  /**
   * Shallow syntax check for the cheapest malformed cases. Passing it does not guarantee the query
   * selects anything.
   *
   * @throws ValidationException with {@code INVALID_QUERY_SYNTAX}
   */
  public static void validateQuerySyntax(String query) {
    if (query == null || query.isBlank()) {
      throw ValidationException.querySyntax(query, "query must not be empty");
    }
    String trimmed = query.trim();

    if (trimmed.contains(" AND ")) {
      for (String part : AND_SPLIT.split(trimmed, -1)) {
        if (part.trim().isEmpty()) {
          throw ValidationException.querySyntax(query, "AND operands must not be empty");
        }
      }
    }

    if (trimmed.indexOf(':') >= 0 && trimmed.indexOf(' ') < 0) {
      if (trimmed.split(":", -1).length != 2) {
        throw ValidationException.querySyntax(query, "tag must have the form type:value");
      }
    }
  }
}
