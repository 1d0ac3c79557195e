package org.waabox.metricat.namespace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.waabox.metricat.InvalidNamespaceException;

/**
 * Validates namespaces advertised by plugins before they are registered.
 *
 * <p>A namespace is rejected when it has no segments, when any of its
 * segments contains a character from one of the {@link #notAllowed()}
 * groups, or when it ends with {@value Namespace#WILDCARD}. Wildcards are
 * only meaningful in query namespaces; a wildcard in the middle of a
 * registered namespace marks a dynamic element and is allowed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NamespaceValidator {

  /** The characters a registered namespace may not contain, by group. */
  private static final Map<String, List<String>> NOT_ALLOWED;

  static {
    final Map<String, List<String>> groups = new LinkedHashMap<>();
    groups.put("brackets", List.of("(", ")", "[", "]", "{", "}"));
    groups.put("spaces", List.of(" "));
    groups.put("punctuations", List.of(".", ",", ";", "?", "!"));
    groups.put("slashes", List.of("|", "\\", "/"));
    groups.put("carets", List.of("^"));
    groups.put("quotations", List.of("\"", "`", "'"));
    NOT_ALLOWED = Collections.unmodifiableMap(groups);
  }

  /** Private constructor to prevent instantiation. */
  private NamespaceValidator() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Validates that the given namespace can be registered.
   *
   * @param namespace the namespace to validate, never null
   *
   * @throws InvalidNamespaceException if the namespace is empty, contains
   *                                   a character that is not allowed, or
   *                                   ends with a wildcard
   */
  public static void validate(final Namespace namespace) {
    Objects.requireNonNull(namespace, "namespace must not be null");

    if (namespace.isRoot()) {
      throw new InvalidNamespaceException(namespace, "is empty");
    }

    final String name = String.join("", namespace.segments());
    for (final List<String> chars : NOT_ALLOWED.values()) {
      for (final String ch : chars) {
        if (name.contains(ch)) {
          throw notAllowedChars(namespace);
        }
      }
    }
    for (int i = 0; i < name.length(); i++) {
      if (Character.isWhitespace(name.charAt(i))) {
        throw notAllowedChars(namespace);
      }
    }

    if (name.endsWith(Namespace.WILDCARD)) {
      throw new InvalidNamespaceException(namespace,
          "ends with an asterisk, which is not allowed");
    }
  }

  /**
   * Returns the characters a registered namespace may not contain, grouped
   * by kind.
   *
   * @return an unmodifiable map from group name to characters, never null
   */
  public static Map<String, List<String>> notAllowed() {
    return NOT_ALLOWED;
  }

  /**
   * Describes the disallowed characters, e.g.
   * {@code brackets [(, ), [, ], {, }], spaces [ ], ...}.
   *
   * @return the description, never null
   */
  public static String describeNotAllowed() {
    final StringBuilder sb = new StringBuilder();
    for (final Map.Entry<String, List<String>> group
        : NOT_ALLOWED.entrySet()) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append(group.getKey()).append(' ').append(group.getValue());
    }
    return sb.toString();
  }

  /**
   * Creates the error for a namespace with disallowed characters.
   *
   * @param namespace the rejected namespace, never null
   *
   * @return the exception, never null
   */
  private static InvalidNamespaceException notAllowedChars(
      final Namespace namespace) {
    return new InvalidNamespaceException(namespace,
        "contains not allowed characters. Avoid using "
            + describeNotAllowed());
  }
}
