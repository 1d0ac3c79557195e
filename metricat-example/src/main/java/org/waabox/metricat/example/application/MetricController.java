package org.waabox.metricat.example.application;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import org.waabox.metricat.MetricCatalog;
import org.waabox.metricat.MetricCatalogException;
import org.waabox.metricat.MetricEntry;
import org.waabox.metricat.MetricNotFoundException;
import org.waabox.metricat.namespace.Namespace;
import org.waabox.metricat.policy.ConfigRule;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/** REST controller that exposes the metric catalog through HTTP endpoints
 * for listing and describing registered metrics.
 *
 * <p>This controller provides two endpoints:
 * <ul>
 *   <li>{@code GET /metrics} - lists every metric under a namespace with
 *       its versions</li>
 *   <li>{@code GET /metrics/detail} - describes one metric version,
 *       including its collection rules</li>
 * </ul>
 *
 * <p>Catalog errors are returned as a JSON body with an {@code error}
 * message: 404 when the metric does not exist, 400 otherwise.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@RestController
@RequestMapping("/metrics")
public class MetricController {

  /** The suffix turning a namespace into a query for everything below it. */
  private static final String ALL = "/" + Namespace.WILDCARD;

  /** The catalog to read from, never null. */
  private final MetricCatalog catalog;

  /** Creates a new MetricController.
   *
   * @param theCatalog the catalog to read from, never null
   */
  public MetricController(final MetricCatalog theCatalog) {
    catalog = Objects.requireNonNull(theCatalog, "catalog cannot be null");
  }

  /** Lists the metrics under a namespace.
   *
   * <p>The namespace is turned into a query matching everything below it,
   * so {@code /intel/mock} lists {@code /intel/mock/foo} and every other
   * metric under {@code /intel/mock}. Without a namespace every metric is
   * listed.
   *
   * @param ns the namespace, e.g. {@code /intel/mock}, may be null
   * @param ver the version to list, 0 for every version
   *
   * @return one row per namespace with {@code namespace} and the
   *         comma-joined {@code versions}, ordered by namespace, never null
   */
  @GetMapping
  public List<Map<String, Object>> list(
      @RequestParam(value = "ns", required = false) final String ns,
      @RequestParam(value = "ver", defaultValue = "0") final int ver) {

    final Namespace query = Namespace.parse(normalize(ns));
    final List<Map<String, Object>> rows = new ArrayList<>();

    for (final Namespace namespace : catalog.matchQuery(query)) {
      final StringJoiner versions = new StringJoiner(",");
      for (final MetricEntry entry : catalog.getVersions(namespace)) {
        if (ver <= 0 || entry.version() == ver) {
          versions.add(String.valueOf(entry.version()));
        }
      }
      if (versions.length() > 0) {
        final Map<String, Object> row = new LinkedHashMap<>();
        row.put("namespace", namespace.toString());
        row.put("versions", versions.toString());
        rows.add(row);
      }
    }
    if (rows.isEmpty()) {
      throw ver > 0
          ? new MetricNotFoundException(query, ver)
          : new MetricNotFoundException(query);
    }
    rows.sort(Comparator.comparing(row -> (String) row.get("namespace")));
    return rows;
  }

  /** Describes one metric version.
   *
   * <p>The response includes:
   * <ul>
   *   <li>{@code namespace} and {@code version}</li>
   *   <li>{@code plugin} - the plugin that advertised it</li>
   *   <li>{@code lastAdvertisedTime} and {@code subscriptions}</li>
   *   <li>{@code tags} and {@code labels}</li>
   *   <li>{@code rules} - the collection rules, each with its name, type,
   *       default, required flag and bounds</li>
   * </ul>
   *
   * @param ns the exact namespace, never null
   * @param ver the version, 0 for the latest
   *
   * @return the metric description, never null
   */
  @GetMapping("/detail")
  public Map<String, Object> detail(
      @RequestParam("ns") final String ns,
      @RequestParam(value = "ver", defaultValue = "0") final int ver) {

    final MetricEntry entry = catalog.get(Namespace.parse(ns), ver);

    final Map<String, Object> result = new LinkedHashMap<>();
    result.put("namespace", entry.namespace().toString());
    result.put("version", entry.version());
    result.put("plugin", entry.plugin().toString());
    result.put("lastAdvertisedTime", entry.lastAdvertisedTime().toString());
    result.put("subscriptions", entry.subscriptionCount());
    result.put("tags", entry.tags());

    final List<Map<String, Object>> labels = new ArrayList<>();
    entry.labels().forEach(label -> labels.add(Map.of(
        "index", label.index(), "name", label.name())));
    result.put("labels", labels);

    final List<Map<String, Object>> rules = new ArrayList<>();
    for (final ConfigRule rule : entry.policy().rules()) {
      final Map<String, Object> row = new LinkedHashMap<>();
      row.put("name", rule.name());
      row.put("type", rule.type().displayName());
      row.put("default", rule.defaultValue());
      row.put("required", rule.required());
      row.put("minimum", rule.minimum());
      row.put("maximum", rule.maximum());
      rules.add(row);
    }
    result.put("rules", rules);
    return result;
  }

  /** Maps a missing metric to 404.
   *
   * @param e the error, never null
   *
   * @return the error response, never null
   */
  @ExceptionHandler(MetricNotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleNotFound(
      final MetricNotFoundException e) {
    return error(HttpStatus.NOT_FOUND, e);
  }

  /** Maps every other catalog error to 400.
   *
   * @param e the error, never null
   *
   * @return the error response, never null
   */
  @ExceptionHandler(MetricCatalogException.class)
  public ResponseEntity<Map<String, Object>> handleCatalogError(
      final MetricCatalogException e) {
    return error(HttpStatus.BAD_REQUEST, e);
  }

  /** Builds an error response.
   *
   * @param status the status, never null
   * @param e the error, never null
   *
   * @return the response, never null
   */
  private static ResponseEntity<Map<String, Object>> error(
      final HttpStatus status, final MetricCatalogException e) {
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", e.getMessage());
    body.put("namespace", e.namespace().toString());
    return ResponseEntity.status(status).body(body);
  }

  /** Turns a namespace into a query for everything below it.
   *
   * @param ns the namespace, may be null
   *
   * @return the slash path ending in {@code /*}, never null
   */
  private static String normalize(final String ns) {
    if (ns == null || ns.isBlank()) {
      return ALL;
    }
    String path = ns.trim();
    while (path.endsWith("/")) {
      path = path.substring(0, path.length() - 1);
    }
    return path.endsWith(ALL) ? path : path + ALL;
  }
}
