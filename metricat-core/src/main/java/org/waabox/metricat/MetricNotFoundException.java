package org.waabox.metricat;

import java.util.OptionalInt;

import org.waabox.metricat.namespace.Namespace;

/**
 * Thrown when an exact, versioned, prefix or query lookup finds nothing in
 * the catalog.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MetricNotFoundException extends MetricCatalogException {

  private static final long serialVersionUID = 1L;

  /** The requested version, or -1 when no version was requested. */
  private final int version;

  /**
   * Creates a new exception for a lookup without version.
   *
   * @param namespace the namespace that was looked up, cannot be null.
   */
  public MetricNotFoundException(final Namespace namespace) {
    super("Metric not found: " + namespace, namespace);
    version = -1;
  }

  /**
   * Creates a new exception for a versioned lookup.
   *
   * @param namespace the namespace that was looked up, cannot be null.
   * @param theVersion the requested version.
   */
  public MetricNotFoundException(final Namespace namespace,
      final int theVersion) {
    super("Metric not found: " + namespace + " (version: " + theVersion
        + ")", namespace);
    version = theVersion;
  }

  /** Returns the requested version, if the lookup asked for one.
   *
   * @return the requested version, empty for unversioned lookups.
   */
  public OptionalInt version() {
    return version < 0 ? OptionalInt.empty() : OptionalInt.of(version);
  }
}
