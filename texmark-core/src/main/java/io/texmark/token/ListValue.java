package io.texmark.token;

import java.util.List;
import java.util.stream.Collectors;

/** A list literal, {@code [a, b, c]}. */
public record ListValue(List<Value> items, int line) implements Value {

  public ListValue {
    items = List.copyOf(items);
  }

  @Override
  public String repr() {
    return items.stream().map(Value::repr).collect(Collectors.joining(", ", "[", "]"));
  }
}
