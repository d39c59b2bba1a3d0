/**
 * <strong>Purpose:</strong> Configuration loading (YAML, defaults, CLI overrides) and adapter wiring.
 * <p><strong>Pipeline role:</strong> {@link ca.gc.cra.opencoffee.config.YamlConfigLoader} and
 * {@link ca.gc.cra.opencoffee.config.ConfigMerger} produce the flat map,
 * {@link ca.gc.cra.opencoffee.config.OpenCoffeeConfig} validates it, and
 * {@link ca.gc.cra.opencoffee.config.CompositionRoot} builds the use cases.
 * <p><strong>Security:</strong> The Slack token is held only by the Slack adapter and is redacted in printed plans.
 *
 * @since 0.1.0
 */
package ca.gc.cra.opencoffee.config;
