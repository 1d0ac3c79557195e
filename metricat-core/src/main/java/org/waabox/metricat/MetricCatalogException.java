package org.waabox.metricat;

import java.util.Objects;

import org.waabox.metricat.namespace.Namespace;

/**
 * Base exception for every error reported by the {@link MetricCatalog}.
 *
 * <p>Catalog errors are values handed back to the caller: none of them is
 * fatal to the catalog, and the catalog lock is always released before one
 * is thrown. Callers decide whether to retry.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class MetricCatalogException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** The namespace the failed operation was about, never null. */
  private final transient Namespace namespace;

  /** Creates a new exception.
   *
   * @param message the detail message, cannot be null.
   * @param theNamespace the namespace involved, cannot be null.
   */
  protected MetricCatalogException(final String message,
      final Namespace theNamespace) {
    super(message);
    namespace = Objects.requireNonNull(theNamespace, "namespace");
  }

  /** Returns the namespace the failed operation was about.
   *
   * @return the namespace, never null.
   */
  public Namespace namespace() {
    return namespace;
  }
}
