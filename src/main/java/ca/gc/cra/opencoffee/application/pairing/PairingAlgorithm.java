package ca.gc.cra.opencoffee.application.pairing;

import java.util.Locale;

/**
 * Pairing algorithms selectable through the {@code generatorAlgorithm} configuration key.
 *
 * @since 0.1.0
 */
public enum PairingAlgorithm {
  /** Random greedy pairing; fastest. */
  SIMPLE("simple"),
  /** Pairing biased toward members sharing the fewest public channels; scans every public channel. */
  MAX_DISTANCE("max-distance");

  private final String configValue;

  PairingAlgorithm(String configValue) {
    this.configValue = configValue;
  }

  /**
   * Returns the value used in configuration files.
   *
   * @return lowercase configuration value
   */
  public String configValue() {
    return configValue;
  }

  /**
   * Parses a configuration value, defaulting to {@link #SIMPLE} when blank.
   *
   * @param value textual value such as {@code "simple"} or {@code "max-distance"}
   * @return parsed algorithm
   * @throws IllegalArgumentException if the value matches no algorithm
   */
  public static PairingAlgorithm fromString(String value) {
    if (value == null || value.isBlank()) {
      return SIMPLE;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    for (PairingAlgorithm algorithm : values()) {
      if (algorithm.configValue.equals(normalized)) {
        return algorithm;
      }
    }
    throw new IllegalArgumentException("Unknown generatorAlgorithm: " + value);
  }
}
