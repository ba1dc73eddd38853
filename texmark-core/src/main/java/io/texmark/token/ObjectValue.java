package io.texmark.token;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/** An object literal, {@code {key: value, ...}}. Keys are unique. */
public record ObjectValue(Map<String, Value> entries, int line) implements Value {

  public ObjectValue {
    entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
  }

  @Override
  public String repr() {
    return entries.entrySet().stream()
        .map(e -> e.getKey() + ": " + e.getValue().repr())
        .collect(Collectors.joining(", ", "{", "}"));
  }
}
