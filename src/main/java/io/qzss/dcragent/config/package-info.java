/**
 * Configuration loading, validation and wiring.
 * <p><strong>Flow:</strong> {@link io.qzss.dcragent.config.YamlConfigLoader} flattens the YAML file,
 * {@link io.qzss.dcragent.config.ConfigMerger} layers CLI overrides over it and the defaults,
 * {@link io.qzss.dcragent.config.AgentConfig#fromMap} parses the result,
 * {@link io.qzss.dcragent.config.ConfigValidator} checks locality keywords, and
 * {@link io.qzss.dcragent.config.CompositionRoot} builds the runtime.</p>
 */
package io.qzss.dcragent.config;
