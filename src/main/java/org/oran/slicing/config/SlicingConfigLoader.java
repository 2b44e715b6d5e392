package org.oran.slicing.config;

import org.oran.slicing.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Loads engine configuration from YAML.
 *
 * The built-in defaults live in {@code slicing-defaults.yaml} on the classpath. A
 * configuration file only needs the keys it changes:
 * <pre>
 * totalBandwidthMbps: 500
 * maxSlices: 8
 * remediation:
 *   latencyBandwidthBoost: 0.1
 * templates:
 *   - type: Custom
 *     minBandwidthMbps: 5
 *     maxLatencyMs: 20
 *     minReliability: 0.99
 *     priority: 4
 * profiles:
 *   Custom: { compute: 15, memoryMb: 120, storageGb: 8 }
 * </pre>
 * Templates and profiles are merged by slice type; all other keys replace the default.
 */
public class SlicingConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(SlicingConfigLoader.class);

    public static final String DEFAULTS_RESOURCE = "/slicing-defaults.yaml";

    private final Yaml yaml;

    public SlicingConfigLoader() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        this.yaml = new Yaml(options);
    }

    // ========================================================================
    // LOADING
    // ========================================================================

    /**
     * Load the built-in defaults from the classpath.
     */
    public SlicingConfig loadDefaults() throws IOException {
        try (InputStream is = SlicingConfigLoader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (is == null) {
                throw new IOException("Default configuration not found on classpath: " + DEFAULTS_RESOURCE);
            }
            return parse(is, new SlicingConfig());
        }
    }

    /**
     * Load a configuration file layered over the built-in defaults.
     */
    public SlicingConfig load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Configuration file not found: " + file);
        }
        SlicingConfig defaults = loadDefaults();
        try (InputStream is = Files.newInputStream(file)) {
            SlicingConfig config = parse(is, defaults);
            log.info("Loaded slicing configuration from {}: {}", file, config);
            return config;
        }
    }

    /**
     * Parse YAML and layer it over {@code base}. The base is not modified.
     */
    public SlicingConfig parse(InputStream is, SlicingConfig base) {
        Map<String, Object> raw = yaml.load(is);
        return applyOverrides(base, raw == null ? Collections.emptyMap() : raw);
    }

    /**
     * Layer already-parsed YAML over {@code base}. The base is not modified.
     */
    @SuppressWarnings("unchecked")
    public SlicingConfig applyOverrides(SlicingConfig base, Map<String, Object> raw) {
        SlicingConfig config = base.copy();

        config.totalBandwidthMbps = getDouble(raw, "totalBandwidthMbps", config.totalBandwidthMbps);
        config.maxSlices = getInt(raw, "maxSlices", config.maxSlices);
        config.referenceBandwidthMbps = getDouble(raw, "referenceBandwidthMbps", config.referenceBandwidthMbps);
        config.dynamicAllocation = getBoolean(raw, "dynamicAllocation", config.dynamicAllocation);
        config.qosThreshold = getDouble(raw, "qosThreshold", config.qosThreshold);
        config.strictInvariants = getBoolean(raw, "strictInvariants", config.strictInvariants);
        config.eventHistoryLimit = getInt(raw, "eventHistoryLimit", config.eventHistoryLimit);

        Map<String, Object> remediation = (Map<String, Object>) raw.get("remediation");
        if (remediation != null) {
            config.latencyBandwidthBoost = getDouble(remediation, "latencyBandwidthBoost",
                config.latencyBandwidthBoost);
            config.reliabilityComputeBoost = getDouble(remediation, "reliabilityComputeBoost",
                config.reliabilityComputeBoost);
        }

        List<Map<String, Object>> templates = (List<Map<String, Object>>) raw.get("templates");
        if (templates != null) {
            for (Map<String, Object> t : templates) {
                SliceTypeTemplate template = parseTemplate(t);
                config.templates.put(template.type(), template);
            }
        }

        Map<String, Object> profiles = (Map<String, Object>) raw.get("profiles");
        if (profiles != null) {
            for (Map.Entry<String, Object> entry : profiles.entrySet()) {
                SliceType type = SliceType.fromLabel(entry.getKey());
                config.profiles.put(type, parseProfile((Map<String, Object>) entry.getValue()));
            }
        }

        validate(config);
        return config;
    }

    private SliceTypeTemplate parseTemplate(Map<String, Object> map) {
        String label = getString(map, "type");
        if (label == null) {
            throw new IllegalArgumentException("Template without type: " + map);
        }
        return new SliceTypeTemplate(
            SliceType.fromLabel(label),
            getDouble(map, "minBandwidthMbps", 0.0),
            getDouble(map, "maxLatencyMs", 0.0),
            getDouble(map, "minReliability", 0.0),
            SlicePriority.of(getInt(map, "priority", 0)));
    }

    private ResourceProfile parseProfile(Map<String, Object> map) {
        if (map == null) {
            throw new IllegalArgumentException("Empty resource profile");
        }
        return new ResourceProfile(
            getInt(map, "compute", (int) ResourceProfile.FALLBACK.computeBaseUnits()),
            getInt(map, "memoryMb", (int) ResourceProfile.FALLBACK.memoryBaseMb()),
            getInt(map, "storageGb", (int) ResourceProfile.FALLBACK.storageGb()));
    }

    private void validate(SlicingConfig config) {
        if (config.totalBandwidthMbps < 0) {
            throw new IllegalArgumentException("totalBandwidthMbps cannot be negative: " + config.totalBandwidthMbps);
        }
        if (config.maxSlices < 1) {
            throw new IllegalArgumentException("maxSlices must be at least 1: " + config.maxSlices);
        }
        if (config.eventHistoryLimit < 0) {
            throw new IllegalArgumentException("eventHistoryLimit cannot be negative: " + config.eventHistoryLimit);
        }
        if (config.referenceBandwidthMbps <= 0) {
            throw new IllegalArgumentException("referenceBandwidthMbps must be positive: " + config.referenceBandwidthMbps);
        }
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private String getString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value != null ? value.toString() : null;
    }

    private int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }
}
