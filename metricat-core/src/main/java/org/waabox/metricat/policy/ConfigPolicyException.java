package org.waabox.metricat.policy;

import java.util.List;
import java.util.Objects;

/**
 * Thrown when configuration values are rejected by a
 * {@link ConfigPolicyNode}.
 *
 * <p>Carries every violation found, not only the first one.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConfigPolicyException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** The violations, never null or empty. */
  private final List<String> errors;

  /**
   * Creates a new exception.
   *
   * @param theErrors the violations, cannot be null or empty.
   */
  public ConfigPolicyException(final List<String> theErrors) {
    super("Config rejected: " + String.join("; ",
        Objects.requireNonNull(theErrors, "errors")));
    errors = List.copyOf(theErrors);
  }

  /** Returns every violation found.
   *
   * @return an unmodifiable list of violations, never null.
   */
  public List<String> errors() {
    return errors;
  }
}
