package org.metric.cli.config;

import com.typesafe.config.Config;

/**
 * Typed view of the {@code metric} configuration block.
 *
 * @param sourceExtension The file extension Metric programs must carry, e.g. {@code .metric}.
 * @param styleEnabled Whether the style validator runs before parsing.
 * @param color Whether errors are printed in colour.
 * @param showTiming Whether {@code run} reports execution time and operation count.
 */
public record MetricSettings(String sourceExtension, boolean styleEnabled, boolean color, boolean showTiming) {

    /** Settings equal to the shipped reference.conf. */
    public static final MetricSettings DEFAULTS = new MetricSettings(".metric", true, true, true);

    /**
     * Reads the settings from a loaded configuration.
     * @param config The configuration; must contain the {@code metric} block.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a key is missing or mistyped.
     */
    public static MetricSettings from(Config config) {
        Config metric = config.getConfig("metric");
        return new MetricSettings(
                metric.getString("source-extension"),
                metric.getBoolean("style.enabled"),
                metric.getBoolean("cli.color"),
                metric.getBoolean("cli.show-timing")
        );
    }

    public MetricSettings withColor(boolean enabled) {
        return new MetricSettings(sourceExtension, styleEnabled, enabled, showTiming);
    }
}
