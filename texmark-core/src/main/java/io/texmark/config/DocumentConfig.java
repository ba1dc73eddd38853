package io.texmark.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Document header fields consumed by the {@code Header} handler.
 *
 * <p>Two file formats are accepted by {@link #load(Path)}:
 *
 * <ul>
 *   <li>{@code *.properties} with the keys {@code title, name, id, course, semester, instructor}
 *   <li>anything else: one field per line, in the order above
 * </ul>
 *
 * @param title assignment title
 * @param name student name
 * @param id student id
 * @param course class name
 * @param semester semester
 * @param instructor instructor
 */
public record DocumentConfig(
    String title, String name, String id, String course, String semester, String instructor) {

  /** Field keys in header order. */
  public static final List<String> KEYS =
      List.of("title", "name", "id", "course", "semester", "instructor");

  public DocumentConfig {
    title = nullToEmpty(title);
    name = nullToEmpty(name);
    id = nullToEmpty(id);
    course = nullToEmpty(course);
    semester = nullToEmpty(semester);
    instructor = nullToEmpty(instructor);
  }

  /** All fields blank. */
  public static DocumentConfig empty() {
    return new DocumentConfig("", "", "", "", "", "");
  }

  /**
   * Loads the header fields from {@code path}.
   *
   * @throws IOException if the file cannot be read
   */
  public static DocumentConfig load(Path path) throws IOException {
    if (path.getFileName().toString().endsWith(".properties")) {
      Properties props = new Properties();
      try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        props.load(reader);
      }
      return fromProperties(props);
    }
    return fromLines(Files.readAllLines(path, StandardCharsets.UTF_8));
  }

  public static DocumentConfig fromProperties(Properties props) {
    return new DocumentConfig(
        props.getProperty("title", ""),
        props.getProperty("name", ""),
        props.getProperty("id", ""),
        props.getProperty("course", ""),
        props.getProperty("semester", ""),
        props.getProperty("instructor", ""));
  }

  /** One field per line in {@link #KEYS} order; missing trailing lines are blank. */
  public static DocumentConfig fromLines(List<String> lines) {
    String[] f = new String[KEYS.size()];
    for (int i = 0; i < f.length; i++) {
      f[i] = i < lines.size() ? lines.get(i).trim() : "";
    }
    return new DocumentConfig(f[0], f[1], f[2], f[3], f[4], f[5]);
  }

  /** Returns a copy with the given keys replaced; unknown keys are ignored. */
  public DocumentConfig withOverrides(Map<String, String> overrides) {
    return new DocumentConfig(
        overrides.getOrDefault("title", title),
        overrides.getOrDefault("name", name),
        overrides.getOrDefault("id", id),
        overrides.getOrDefault("course", course),
        overrides.getOrDefault("semester", semester),
        overrides.getOrDefault("instructor", instructor));
  }

  private static String nullToEmpty(String s) {
    return s == null ? "" : s;
  }
}
