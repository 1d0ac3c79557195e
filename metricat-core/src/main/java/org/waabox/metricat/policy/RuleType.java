package org.waabox.metricat.policy;

/**
 * The value type a {@link ConfigRule} accepts.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum RuleType {

  /** A text value. */
  STRING,

  /** An integral number. */
  INTEGER,

  /** A floating point number. */
  FLOAT,

  /** A boolean flag. */
  BOOL;

  /**
   * Returns the lower case name used when printing rules, e.g. "string".
   *
   * @return the display name, never null
   */
  public String displayName() {
    return name().toLowerCase();
  }
}
