package org.waabox.metricat;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import org.waabox.metricat.namespace.Namespace;

/**
 * Maps query keys, namespaces that may hold wildcard or tuple segments, to
 * the catalog keys they matched when last computed.
 *
 * <p>A query is translated segment by segment into an anchored regular
 * expression: literal text matches itself, {@code *} matches any
 * characters (separators included, so a trailing {@code *} reaches every
 * key below its prefix) and a tuple segment such as {@code (foo|bar)} or
 * {@code (foo;bar)} matches any of its members.
 *
 * <p>A query whose match set becomes empty is dropped, never kept as an
 * empty list. The compiled pattern of each query is kept next to its
 * matches, so refreshing the cache after a catalog mutation only pays for
 * the matching.
 *
 * <p>This class is not thread-safe: every method must be called while
 * holding the owning catalog's lock.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class QueryMatchCache {

  /** The cached queries keyed by query key. */
  private final Map<String, Query> queries = new HashMap<>();

  /**
   * Computes the keys matched by the given query, caching the result, or
   * dropping the query if nothing matches.
   *
   * @param queryKey the query key, never null
   * @param keys     the catalog keys, in catalog order, never null
   *
   * @return the matched keys in catalog order, empty if none
   */
  List<String> match(final String queryKey, final Collection<String> keys) {
    Query query = queries.get(queryKey);
    final Pattern pattern = query != null
        ? query.pattern : compile(queryKey);
    final List<String> matched = matchAll(pattern, keys);
    if (matched.isEmpty()) {
      queries.remove(queryKey);
    } else {
      query = new Query(pattern, matched);
      queries.put(queryKey, query);
    }
    return matched;
  }

  /**
   * Returns the keys last matched by the given query, without computing
   * anything.
   *
   * @param queryKey the query key, never null
   *
   * @return the matched keys, or empty if the query is not cached
   */
  Optional<List<String>> cached(final String queryKey) {
    final Query query = queries.get(queryKey);
    return query == null ? Optional.empty() : Optional.of(query.matched);
  }

  /**
   * Re-derives every cached query against the given keys, dropping the
   * queries that no longer match anything.
   *
   * @param keys the catalog keys, in catalog order, never null
   */
  void refreshAll(final Collection<String> keys) {
    final Iterator<Map.Entry<String, Query>> it =
        queries.entrySet().iterator();
    while (it.hasNext()) {
      final Map.Entry<String, Query> entry = it.next();
      final Pattern pattern = entry.getValue().pattern;
      final List<String> matched = matchAll(pattern, keys);
      if (matched.isEmpty()) {
        it.remove();
      } else {
        entry.setValue(new Query(pattern, matched));
      }
    }
  }

  /**
   * Removes the given catalog key from every cached query, dropping the
   * queries left without matches.
   *
   * @param key the catalog key that no longer exists, never null
   */
  void purge(final String key) {
    final Iterator<Map.Entry<String, Query>> it =
        queries.entrySet().iterator();
    while (it.hasNext()) {
      final Map.Entry<String, Query> entry = it.next();
      final Query query = entry.getValue();
      if (!query.matched.contains(key)) {
        continue;
      }
      final List<String> remaining = new ArrayList<>(query.matched);
      remaining.remove(key);
      if (remaining.isEmpty()) {
        it.remove();
      } else {
        entry.setValue(new Query(query.pattern, List.copyOf(remaining)));
      }
    }
  }

  /**
   * Returns the number of cached queries.
   *
   * @return the query count
   */
  int size() {
    return queries.size();
  }

  /**
   * Translates a query key into an anchored regular expression.
   *
   * @param queryKey the query key, never null
   *
   * @return the compiled pattern, never null
   */
  static Pattern compile(final String queryKey) {
    final StringBuilder regex = new StringBuilder("^");
    final List<String> segments = queryKey.isEmpty()
        ? List.of() : List.of(queryKey.split(Pattern.quote(
            Namespace.SEPARATOR), -1));
    for (int i = 0; i < segments.size(); i++) {
      if (i > 0) {
        regex.append(Pattern.quote(Namespace.SEPARATOR));
      }
      regex.append(translate(segments.get(i)));
    }
    return Pattern.compile(regex.append('$').toString());
  }

  /**
   * Translates a single query segment.
   *
   * @param segment the segment, never null
   *
   * @return the regular expression for the segment, never null
   */
  private static String translate(final String segment) {
    if (Namespace.isTuple(segment)) {
      final String members = segment.substring(1, segment.length() - 1);
      final StringBuilder alternation = new StringBuilder("(?:");
      final String[] split = members.split("[|;]", -1);
      for (int i = 0; i < split.length; i++) {
        if (i > 0) {
          alternation.append('|');
        }
        alternation.append(translateWildcards(split[i]));
      }
      return alternation.append(')').toString();
    }
    return translateWildcards(segment);
  }

  /**
   * Quotes the literal parts of the text and turns every wildcard into
   * {@code .*}.
   *
   * @param text the text, never null
   *
   * @return the regular expression, never null
   */
  private static String translateWildcards(final String text) {
    final StringBuilder sb = new StringBuilder();
    final String[] literals = text.split(Pattern.quote(Namespace.WILDCARD),
        -1);
    for (int i = 0; i < literals.length; i++) {
      if (i > 0) {
        sb.append(".*");
      }
      if (!literals[i].isEmpty()) {
        sb.append(Pattern.quote(literals[i]));
      }
    }
    return sb.toString();
  }

  /**
   * Returns the keys matched by the pattern.
   *
   * @param pattern the query pattern, never null
   * @param keys    the catalog keys, never null
   *
   * @return an unmodifiable list of matched keys, never null
   */
  private static List<String> matchAll(final Pattern pattern,
      final Collection<String> keys) {
    final List<String> matched = new ArrayList<>();
    for (final String key : keys) {
      if (pattern.matcher(key).matches()) {
        matched.add(key);
      }
    }
    return List.copyOf(matched);
  }

  /** A cached query: its compiled pattern and last matches.
   *
   * @param pattern the compiled query, never null
   * @param matched the matched keys, never null or empty
   */
  private record Query(Pattern pattern, List<String> matched) {
  }
}
