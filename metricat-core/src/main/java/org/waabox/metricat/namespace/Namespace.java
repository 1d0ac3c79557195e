package org.waabox.metricat.namespace;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * An ordered sequence of non-empty string segments identifying a metric,
 * e.g. {@code /intel/mock/foo}.
 *
 * <p>A namespace has two textual forms:
 * <ul>
 *   <li>the canonical key, produced by {@link #key()}: the segments joined
 *       by {@value #SEPARATOR}. This is the catalog's primary lookup key and
 *       is turned back into a namespace by {@link #fromKey(String)}.</li>
 *   <li>the slash path, produced by {@link #toString()} and read by
 *       {@link #parse(String)}, used for display and user input.</li>
 * </ul>
 *
 * <p>The separator is one of the characters a registered namespace may not
 * contain, so splitting a canonical key is unambiguous for every namespace
 * that passed {@link NamespaceValidator#validate(Namespace)}.
 *
 * <p>Query namespaces may also contain {@value #WILDCARD} segments and tuple
 * segments such as {@code (foo|bar)}.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Namespace implements Iterable<String> {

  /** The canonical key separator. */
  public static final String SEPARATOR = ".";

  /** The wildcard segment, matching any characters in a query. */
  public static final String WILDCARD = "*";

  /** The namespace with no segments. */
  private static final Namespace ROOT = new Namespace(List.of());

  /** The segments, never null, unmodifiable. */
  private final List<String> segments;

  /**
   * Creates a new namespace.
   *
   * @param theSegments the segments, already validated and copied
   */
  private Namespace(final List<String> theSegments) {
    segments = theSegments;
  }

  /**
   * Creates a namespace from the given segments.
   *
   * @param segments the segments, never null, none of them null or empty
   *
   * @return the namespace, never null
   *
   * @throws NullPointerException     if segments or any segment is null
   * @throws IllegalArgumentException if any segment is empty
   */
  public static Namespace of(final String... segments) {
    Objects.requireNonNull(segments, "segments must not be null");
    return of(Arrays.asList(segments));
  }

  /**
   * Creates a namespace from the given segments.
   *
   * @param segments the segments, never null, none of them null or empty
   *
   * @return the namespace, never null
   *
   * @throws NullPointerException     if segments or any segment is null
   * @throws IllegalArgumentException if any segment is empty
   */
  public static Namespace of(final List<String> segments) {
    Objects.requireNonNull(segments, "segments must not be null");
    if (segments.isEmpty()) {
      return ROOT;
    }
    final List<String> copy = new ArrayList<>(segments.size());
    for (final String segment : segments) {
      Objects.requireNonNull(segment, "segment must not be null");
      if (segment.isEmpty()) {
        throw new IllegalArgumentException(
            "Namespace segments must not be empty: " + segments);
      }
      copy.add(segment);
    }
    return new Namespace(Collections.unmodifiableList(copy));
  }

  /**
   * Returns the root namespace, the one with no segments.
   *
   * <p>Fetching the root namespace returns the whole catalog.
   *
   * @return the root namespace, never null
   */
  public static Namespace root() {
    return ROOT;
  }

  /**
   * Parses a slash separated path such as {@code /intel/mock/foo}.
   *
   * <p>Empty pieces are ignored, so {@code /intel/mock/} and
   * {@code intel//mock} both yield {@code [intel, mock]}, and {@code "/"}
   * yields the root namespace.
   *
   * @param path the slash path, never null
   *
   * @return the namespace, never null
   */
  public static Namespace parse(final String path) {
    Objects.requireNonNull(path, "path must not be null");
    final List<String> segments = new ArrayList<>();
    for (final String piece : path.split("/")) {
      if (!piece.isEmpty()) {
        segments.add(piece);
      }
    }
    return of(segments);
  }

  /**
   * Rebuilds a namespace from its canonical key.
   *
   * <p>The empty key yields the root namespace.
   *
   * @param key the canonical key, never null
   *
   * @return the namespace, never null
   *
   * @throws IllegalArgumentException if the key contains empty segments
   */
  public static Namespace fromKey(final String key) {
    Objects.requireNonNull(key, "key must not be null");
    if (key.isEmpty()) {
      return ROOT;
    }
    return of(Arrays.asList(key.split("\\.", -1)));
  }

  /**
   * Returns the canonical key of this namespace.
   *
   * @return the segments joined by {@value #SEPARATOR}, never null
   */
  public String key() {
    return String.join(SEPARATOR, segments);
  }

  /**
   * Returns the segments of this namespace.
   *
   * @return an unmodifiable list of segments, never null
   */
  public List<String> segments() {
    return segments;
  }

  /**
   * Returns the segment at the given position.
   *
   * @param index the zero based position
   *
   * @return the segment, never null
   */
  public String segment(final int index) {
    return segments.get(index);
  }

  /**
   * Returns the number of segments.
   *
   * @return the number of segments
   */
  public int size() {
    return segments.size();
  }

  /**
   * Returns whether this is the root namespace.
   *
   * @return true if this namespace has no segments
   */
  public boolean isRoot() {
    return segments.isEmpty();
  }

  /**
   * Returns whether this namespace is a query, that is, whether any of its
   * segments contains a wildcard or is a tuple.
   *
   * @return true if this namespace can match more than one key
   */
  public boolean isQuery() {
    for (final String segment : segments) {
      if (segment.contains(WILDCARD) || isTuple(segment)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns whether the given segment is a tuple such as {@code (foo|bar)}
   * or {@code (foo;bar)}.
   *
   * @param segment the segment, never null
   *
   * @return true if the segment lists alternatives
   */
  public static boolean isTuple(final String segment) {
    return segment.length() > 2
        && segment.startsWith("(")
        && segment.endsWith(")")
        && (segment.contains("|") || segment.contains(";"));
  }

  /** {@inheritDoc} */
  @Override
  public Iterator<String> iterator() {
    return segments.iterator();
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Namespace)) {
      return false;
    }
    return segments.equals(((Namespace) other).segments);
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    return segments.hashCode();
  }

  /**
   * Returns the slash path of this namespace, e.g. {@code /intel/mock/foo}.
   *
   * @return the slash path, {@code "/"} for the root namespace
   */
  @Override
  public String toString() {
    return "/" + String.join("/", segments);
  }
}
