package org.waabox.metricat;

import org.waabox.metricat.namespace.Namespace;

/**
 * Thrown when unsubscribing from a metric whose subscription count is
 * already zero. The count is left unchanged.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NegativeSubscriptionCountException
    extends MetricCatalogException {

  private static final long serialVersionUID = 1L;

  /** The version of the metric. */
  private final int version;

  /**
   * Creates a new exception.
   *
   * @param namespace  the metric namespace, cannot be null.
   * @param theVersion the resolved version of the metric.
   */
  public NegativeSubscriptionCountException(final Namespace namespace,
      final int theVersion) {
    super("Subscription count cannot be < 0 for " + namespace
        + " (version: " + theVersion + ")", namespace);
    version = theVersion;
  }

  /** Returns the resolved version of the metric.
   *
   * @return the version.
   */
  public int version() {
    return version;
  }
}
