package org.hypertrace.core.cloudwatch.query.metadata;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses variable queries of the form {@code function(arg, arg, ...)}. Commas nested inside json
 * objects, arrays or strings do not separate arguments, so filters such as {@code
 * ec2_instance_attribute(us-east-1, InstanceId, {"tag:Env":["a","b"]})} keep their json intact.
 * Anything after the closing parenthesis is ignored.
 */
public class MetricFindQueryParser {

  public Optional<MetricFindQuery> parse(String query) {
    if (query == null) {
      return Optional.empty();
    }
    int openParenthesis = query.indexOf('(');
    if (openParenthesis <= 0) {
      return Optional.empty();
    }

    Optional<MetricFindQueryType> type =
        MetricFindQueryType.fromFunctionName(query.substring(0, openParenthesis));
    if (type.isEmpty()) {
      return Optional.empty();
    }

    Optional<List<String>> arguments = parseArguments(query, openParenthesis + 1);
    if (arguments.isEmpty()
        || !type.get().acceptsArgumentCount(arguments.get().size())
        || arguments.get().stream().anyMatch(String::isEmpty)) {
      return Optional.empty();
    }
    return Optional.of(new MetricFindQuery(type.get(), arguments.get()));
  }

  /** Splits the argument list at top level commas, empty if it is never closed. */
  private Optional<List<String>> parseArguments(String query, int start) {
    List<String> arguments = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    int depth = 0;
    boolean inString = false;

    for (int i = start; i < query.length(); i++) {
      char c = query.charAt(i);
      if (inString) {
        current.append(c);
        if (c == '\\' && i + 1 < query.length()) {
          current.append(query.charAt(++i));
        } else if (c == '"') {
          inString = false;
        }
        continue;
      }

      switch (c) {
        case '"':
          inString = true;
          current.append(c);
          break;
        case '{':
        case '[':
          depth++;
          current.append(c);
          break;
        case '}':
        case ']':
          depth--;
          current.append(c);
          break;
        case ',':
          if (depth == 0) {
            arguments.add(current.toString().trim());
            current.setLength(0);
          } else {
            current.append(c);
          }
          break;
        case ')':
          if (depth == 0) {
            String last = current.toString().trim();
            if (!last.isEmpty() || !arguments.isEmpty()) {
              arguments.add(last);
            }
            return Optional.of(arguments);
          }
          current.append(c);
          break;
        default:
          current.append(c);
      }
    }
    return Optional.empty();
  }
}
