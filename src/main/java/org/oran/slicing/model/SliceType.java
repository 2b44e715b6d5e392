package org.oran.slicing.model;

import java.util.Locale;

/**
 * Service classes a network slice can be created for.
 * Each type has the label used in configuration files and reports.
 */
public enum SliceType {
    EMBB("eMBB", "Enhanced Mobile Broadband"),
    URLLC("URLLC", "Ultra-Reliable Low Latency Communications"),
    MMTC("mMTC", "Massive Machine Type Communications"),
    XR("XR", "Extended Reality"),
    AUTOMOTIVE("Automotive", "Automotive and V2X"),

    // No default template; must be configured before use
    CUSTOM("Custom", "Custom application slice");

    private final String label;
    private final String description;

    SliceType(String label, String description) {
        this.label = label;
        this.description = description;
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Resolve a slice type from its label or enum name, ignoring case.
     *
     * @throws IllegalArgumentException if nothing matches
     */
    public static SliceType fromLabel(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Slice type label cannot be null");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (SliceType type : values()) {
            if (type.name().equals(normalized)
                    || type.label.toUpperCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown slice type label: " + value);
    }

    @Override
    public String toString() {
        return label;
    }
}
