package com.gentoro.codenexus.query;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Parsed tag query. Each node evaluates to the set of files it selects. */
public interface QueryExpression {

  Set<String> evaluate(TagIndexView view);

  /** Blank query or blank operand: selects nothing. */
  record Empty() implements QueryExpression {
    @Override
    public Set<String> evaluate(TagIndexView view) {
      return Set.of();
    }
  }

  record Or(List<QueryExpression> operands) implements QueryExpression {
    @Override
    public Set<String> evaluate(TagIndexView view) {
      Set<String> result = new HashSet<>();
      for (QueryExpression operand : operands) {
        result.addAll(operand.evaluate(view));
      }
      return result;
    }
  }

  record And(List<QueryExpression> operands) implements QueryExpression {
    @Override
    public Set<String> evaluate(TagIndexView view) {
      Set<String> result = null;
      for (QueryExpression operand : operands) {
        Set<String> files = operand.evaluate(view);
        if (result == null) {
          result = new HashSet<>(files);
        } else {
          result.retainAll(files);
        }
        if (result.isEmpty()) break;
      }
      return result == null ? Set.of() : result;
    }
  }

  record Not(QueryExpression operand) implements QueryExpression {
    @Override
    public Set<String> evaluate(TagIndexView view) {
      Set<String> result = new HashSet<>(view.universe());
      result.removeAll(operand.evaluate(view));
      return result;
    }
  }

  record Tag(String tag) implements QueryExpression {
    @Override
    public Set<String> evaluate(TagIndexView view) {
      return Collections.unmodifiableSet(view.filesWithTag(tag));
    }
  }

  record Wildcard(WildcardPattern pattern) implements QueryExpression {
    @Override
    public Set<String> evaluate(TagIndexView view) {
      Set<String> result = new HashSet<>();
      view.tagToFiles()
          .forEach(
              (tag, files) -> {
                if (pattern.matches(tag)) result.addAll(files);
              });
      return result;
    }
  }
}
