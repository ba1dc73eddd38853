package io.texmark.token;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A resolved call: {@code Name(arg, key=value)}. Appears in the refined token sequence and, when
 * nested, as an argument value.
 *
 * @param name call name, case-sensitive
 * @param positionalArgs positional arguments in source order
 * @param keywordArgs keyword arguments, unique keys
 * @param line line of the call name
 */
public record CallNode(
    String name, List<Value> positionalArgs, Map<String, Value> keywordArgs, int line)
    implements Token, Value {

  public CallNode {
    positionalArgs = List.copyOf(positionalArgs);
    keywordArgs = Collections.unmodifiableMap(new LinkedHashMap<>(keywordArgs));
  }

  /** The positional argument at {@code index}, or null if absent. */
  public Value arg(int index) {
    return index < positionalArgs.size() ? positionalArgs.get(index) : null;
  }

  /** The keyword argument {@code key}, or null if absent. */
  public Value kwarg(String key) {
    return keywordArgs.get(key);
  }

  @Override
  public String repr() {
    return Stream.concat(
            positionalArgs.stream().map(Value::repr),
            keywordArgs.entrySet().stream().map(e -> e.getKey() + "=" + e.getValue().repr()))
        .collect(Collectors.joining(", ", "FnCall(" + name + ": ", ")"));
  }
}
