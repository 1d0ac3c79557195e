package org.waabox.metricat.policy;

import java.util.Objects;
import java.util.Optional;

/**
 * A single processing rule of a {@link ConfigPolicyNode}: the name, type and
 * constraints of one configuration value a plugin needs to collect a
 * metric.
 *
 * <p>Rules are created with {@link #of(String, RuleType)} and refined with
 * the {@code with*} methods, each returning a new rule:
 * <pre>{@code
 * ConfigRule port = ConfigRule.of("portRange", RuleType.INTEGER)
 *     .between(9000, 10000);
 * ConfigRule name = ConfigRule.of("name", RuleType.STRING)
 *     .withDefault("bob");
 * }</pre>
 *
 * @param name         the config key, never null or empty
 * @param type         the accepted value type, never null
 * @param defaultValue the value used when none is given, may be null
 * @param required     whether a value must be present
 * @param minimum      the inclusive lower bound for numeric rules, may be
 *                     null
 * @param maximum      the inclusive upper bound for numeric rules, may be
 *                     null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ConfigRule(String name, RuleType type, Object defaultValue,
    boolean required, Double minimum, Double maximum) {

  /**
   * Creates a new ConfigRule.
   *
   * @throws NullPointerException     if name or type is null
   * @throws IllegalArgumentException if name is empty or bounds are set on
   *                                  a non numeric rule
   */
  public ConfigRule {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(type, "type must not be null");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("name must not be empty");
    }
    if ((minimum != null || maximum != null) && !isNumeric(type)) {
      throw new IllegalArgumentException(
          "Bounds are only supported on numeric rules: " + name);
    }
  }

  /**
   * Creates an optional rule without default or bounds.
   *
   * @param name the config key, never null or empty
   * @param type the accepted value type, never null
   *
   * @return the rule, never null
   */
  public static ConfigRule of(final String name, final RuleType type) {
    return new ConfigRule(name, type, null, false, null, null);
  }

  /**
   * Returns a copy of this rule with the given default value.
   *
   * @param value the default value, never null
   *
   * @return the new rule, never null
   */
  public ConfigRule withDefault(final Object value) {
    Objects.requireNonNull(value, "value must not be null");
    return new ConfigRule(name, type, value, required, minimum, maximum);
  }

  /**
   * Returns a copy of this rule that requires a value.
   *
   * @return the new rule, never null
   */
  public ConfigRule asRequired() {
    return new ConfigRule(name, type, defaultValue, true, minimum, maximum);
  }

  /**
   * Returns a copy of this rule bounded to the inclusive range
   * [{@code min}, {@code max}].
   *
   * @param min the inclusive lower bound
   * @param max the inclusive upper bound
   *
   * @return the new rule, never null
   */
  public ConfigRule between(final double min, final double max) {
    if (min > max) {
      throw new IllegalArgumentException(
          "min must not be greater than max: " + min + " > " + max);
    }
    return new ConfigRule(name, type, defaultValue, required, min, max);
  }

  /**
   * Returns the default value, if any.
   *
   * @return the default value
   */
  public Optional<Object> defaultOption() {
    return Optional.ofNullable(defaultValue);
  }

  /**
   * Checks the given value against this rule.
   *
   * @param value the value to check, never null
   *
   * @return a description of the violation, or empty if the value is
   *         accepted
   */
  Optional<String> check(final Object value) {
    switch (type) {
      case STRING:
        if (!(value instanceof String)) {
          return typeMismatch(value);
        }
        return Optional.empty();
      case BOOL:
        if (!(value instanceof Boolean)) {
          return typeMismatch(value);
        }
        return Optional.empty();
      case INTEGER:
        if (!(value instanceof Integer || value instanceof Long
            || value instanceof Short || value instanceof Byte)) {
          return typeMismatch(value);
        }
        return checkBounds(((Number) value).doubleValue());
      case FLOAT:
        if (!(value instanceof Number)) {
          return typeMismatch(value);
        }
        return checkBounds(((Number) value).doubleValue());
      default:
        throw new IllegalStateException("Unknown rule type: " + type);
    }
  }

  /**
   * Checks the numeric value against the bounds of this rule.
   *
   * @param value the value to check
   *
   * @return the violation, or empty if within bounds
   */
  private Optional<String> checkBounds(final double value) {
    if (minimum != null && value < minimum) {
      return Optional.of("value " + value + " for key (" + name
          + ") is below the minimum " + minimum);
    }
    if (maximum != null && value > maximum) {
      return Optional.of("value " + value + " for key (" + name
          + ") is above the maximum " + maximum);
    }
    return Optional.empty();
  }

  /**
   * Describes a value of the wrong type.
   *
   * @param value the offending value, never null
   *
   * @return the violation, never null
   */
  private Optional<String> typeMismatch(final Object value) {
    return Optional.of("type mismatch for key (" + name + "): expected "
        + type.displayName() + " but got "
        + value.getClass().getSimpleName());
  }

  /**
   * Returns whether bounds make sense for the given type.
   *
   * @param type the rule type, never null
   *
   * @return true for INTEGER and FLOAT
   */
  private static boolean isNumeric(final RuleType type) {
    return type == RuleType.INTEGER || type == RuleType.FLOAT;
  }
}
