package org.waabox.metricat;

import org.waabox.metricat.namespace.Namespace;

/**
 * Thrown when a plugin advertises a namespace that cannot be registered,
 * either because it contains characters that are not allowed or because it
 * ends with a wildcard.
 *
 * <p>Registration input is never retried; the error goes back to the
 * plugin-loading caller.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class InvalidNamespaceException extends MetricCatalogException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception for the given namespace.
   *
   * @param namespace the rejected namespace, cannot be null.
   * @param reason    why it was rejected, cannot be null.
   */
  public InvalidNamespaceException(final Namespace namespace,
      final String reason) {
    super("Metric namespace " + namespace + " " + reason, namespace);
  }
}
