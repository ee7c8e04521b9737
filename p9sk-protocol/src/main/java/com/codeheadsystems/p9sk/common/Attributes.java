package com.codeheadsystems.p9sk.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Immutable, ordered set of factotum-style attributes such as
 * {@code proto=p9sk1 dom=example user=alice !password=secret role=client}.
 * <p>
 * An attribute is either a value ({@code name=value}) or a query ({@code name?}) asking that the
 * attribute be present. Names starting with {@code !} are private: their values are never
 * included in {@link #toString()}.
 */
public final class Attributes {

  private static final Attributes EMPTY = new Attributes(Map.of());

  // name -> value, or name -> null for a query
  private final Map<String, String> entries;

  private Attributes(Map<String, String> entries) {
    this.entries = entries;
  }

  /**
   * The empty attribute set.
   *
   * @return the attributes
   */
  public static Attributes empty() {
    return EMPTY;
  }

  /**
   * Parses a whitespace-separated attribute string. Values may be single-quoted, with
   * {@code ''} standing for a literal quote inside a quoted value.
   *
   * @param text the text
   * @return the attributes
   * @throws IllegalArgumentException on an unterminated quote or an empty name
   */
  public static Attributes parse(String text) {
    Map<String, String> parsed = new LinkedHashMap<>();
    int i = 0;
    int n = text.length();
    while (i < n) {
      while (i < n && Character.isWhitespace(text.charAt(i))) {
        i++;
      }
      if (i >= n) {
        break;
      }
      StringBuilder token = new StringBuilder();
      boolean quotedValue = false;
      while (i < n && !Character.isWhitespace(text.charAt(i))) {
        char c = text.charAt(i);
        if (c == '\'') {
          quotedValue = true;
          i++;
          boolean closed = false;
          while (i < n) {
            char q = text.charAt(i);
            if (q == '\'') {
              if (i + 1 < n && text.charAt(i + 1) == '\'') {
                token.append('\'');
                i += 2;
                continue;
              }
              i++;
              closed = true;
              break;
            }
            token.append(q);
            i++;
          }
          if (!closed) {
            throw new IllegalArgumentException("Unterminated quote in attributes: " + redact(text));
          }
          continue;
        }
        token.append(c);
        i++;
      }
      addToken(parsed, token.toString(), quotedValue);
    }
    return new Attributes(Collections.unmodifiableMap(parsed));
  }

  private static void addToken(Map<String, String> parsed, String token, boolean quotedValue) {
    int eq = token.indexOf('=');
    if (eq < 0) {
      if (!quotedValue && token.endsWith("?")) {
        String name = token.substring(0, token.length() - 1);
        requireName(name);
        parsed.putIfAbsent(name, null);
      } else {
        requireName(token);
        parsed.put(token, "");
      }
      return;
    }
    String name = token.substring(0, eq);
    requireName(name);
    parsed.put(name, token.substring(eq + 1));
  }

  private static void requireName(String name) {
    if (name.isEmpty() || "!".equals(name)) {
      throw new IllegalArgumentException("Attribute with empty name");
    }
  }

  private static String redact(String text) {
    int bang = text.indexOf('!');
    return bang < 0 ? text : text.substring(0, bang) + "...";
  }

  /**
   * Returns true when the name denotes a private attribute.
   *
   * @param name the name
   * @return the boolean
   */
  public static boolean isPrivate(String name) {
    return name.startsWith("!");
  }

  /**
   * Looks up the value of an attribute. Queries have no value.
   *
   * @param name the name
   * @return the value, or empty if absent or only queried
   */
  public Optional<String> find(String name) {
    return Optional.ofNullable(entries.get(name));
  }

  /**
   * Returns true when the attribute is present as a value.
   *
   * @param name the name
   * @return the boolean
   */
  public boolean has(String name) {
    return entries.get(name) != null;
  }

  /**
   * Returns a copy with {@code name=value} set, replacing any previous value or query.
   *
   * @param name  the name
   * @param value the value
   * @return the attributes
   */
  public Attributes with(String name, String value) {
    requireName(name);
    Map<String, String> copy = new LinkedHashMap<>(entries);
    copy.put(name, value == null ? "" : value);
    return new Attributes(Collections.unmodifiableMap(copy));
  }

  /**
   * Returns a copy with a query for {@code name}, unless a value is already present.
   *
   * @param name the name
   * @return the attributes
   */
  public Attributes query(String name) {
    requireName(name);
    if (entries.containsKey(name)) {
      return this;
    }
    Map<String, String> copy = new LinkedHashMap<>(entries);
    copy.put(name, null);
    return new Attributes(Collections.unmodifiableMap(copy));
  }

  /**
   * Returns a copy without the named attribute.
   *
   * @param name the name
   * @return the attributes
   */
  public Attributes without(String name) {
    if (!entries.containsKey(name)) {
      return this;
    }
    Map<String, String> copy = new LinkedHashMap<>(entries);
    copy.remove(name);
    return new Attributes(Collections.unmodifiableMap(copy));
  }

  /**
   * Returns a copy with every entry of {@code other} applied on top of this set.
   * Values in {@code other} replace values here; queries in {@code other} only add a query.
   *
   * @param other the other
   * @return the attributes
   */
  public Attributes plus(Attributes other) {
    Attributes result = this;
    for (Map.Entry<String, String> e : other.entries.entrySet()) {
      result = e.getValue() == null ? result.query(e.getKey()) : result.with(e.getKey(), e.getValue());
    }
    return result;
  }

  /**
   * Returns true when every value in {@code pattern} is present here with the same value and
   * every query in {@code pattern} names an attribute that has a value here.
   *
   * @param pattern the pattern
   * @return the boolean
   */
  public boolean satisfies(Attributes pattern) {
    for (Map.Entry<String, String> e : pattern.entries.entrySet()) {
      String mine = entries.get(e.getKey());
      if (mine == null) {
        return false;
      }
      if (e.getValue() != null && !e.getValue().equals(mine)) {
        return false;
      }
    }
    return true;
  }

  /**
   * The names of all queried attributes.
   *
   * @return the list
   */
  public List<String> queries() {
    List<String> out = new ArrayList<>();
    entries.forEach((k, v) -> {
      if (v == null) {
        out.add(k);
      }
    });
    return out;
  }

  /**
   * Copy of this set without private attributes.
   *
   * @return the attributes
   */
  public Attributes publicAttributes() {
    Map<String, String> copy = new LinkedHashMap<>();
    entries.forEach((k, v) -> {
      if (!isPrivate(k)) {
        copy.put(k, v);
      }
    });
    return new Attributes(Collections.unmodifiableMap(copy));
  }

  /**
   * Returns true when there are no attributes.
   *
   * @return the boolean
   */
  public boolean isEmpty() {
    return entries.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Attributes other && entries.equals(other.entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  /**
   * Formats the set back into attribute syntax. Private values print as queries.
   */
  @Override
  public String toString() {
    StringJoiner joiner = new StringJoiner(" ");
    entries.forEach((k, v) -> {
      if (v == null || isPrivate(k)) {
        joiner.add(k + "?");
      } else {
        joiner.add(k + "=" + quote(v));
      }
    });
    return joiner.toString();
  }

  private static String quote(String value) {
    if (!value.isEmpty() && value.chars().noneMatch(c -> Character.isWhitespace(c) || c == '\'' || c == '=')) {
      return value;
    }
    return "'" + value.replace("'", "''") + "'";
  }
}
