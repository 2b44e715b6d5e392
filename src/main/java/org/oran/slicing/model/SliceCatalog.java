package org.oran.slicing.model;

import java.util.*;

/**
 * Table of slice-type templates.
 *
 * The catalog is read on every admission decision and only changes through
 * {@link #reload(Collection)}, which swaps the whole table.
 */
public class SliceCatalog {

    private volatile Map<SliceType, SliceTypeTemplate> templates;

    public SliceCatalog(Collection<SliceTypeTemplate> templates) {
        this.templates = index(templates);
    }

    /**
     * Look up the template for a slice type.
     *
     * @throws SlicingException of type UNKNOWN_SLICE_TYPE if none is registered
     */
    public SliceTypeTemplate lookup(SliceType type) {
        SliceTypeTemplate template = type == null ? null : templates.get(type);
        if (template == null) {
            throw new SlicingException(SlicingException.Type.UNKNOWN_SLICE_TYPE,
                "No template registered for slice type " + type);
        }
        return template;
    }

    public boolean contains(SliceType type) {
        return templates.containsKey(type);
    }

    public Set<SliceType> types() {
        return Collections.unmodifiableSet(templates.keySet());
    }

    public Collection<SliceTypeTemplate> templates() {
        return Collections.unmodifiableCollection(templates.values());
    }

    /**
     * Replace all templates. Existing slices keep their resolved requirements;
     * new floors apply to later preemption scans.
     */
    public void reload(Collection<SliceTypeTemplate> newTemplates) {
        this.templates = index(newTemplates);
    }

    private static Map<SliceType, SliceTypeTemplate> index(Collection<SliceTypeTemplate> list) {
        Map<SliceType, SliceTypeTemplate> map = new EnumMap<>(SliceType.class);
        for (SliceTypeTemplate template : list) {
            if (map.put(template.type(), template) != null) {
                throw new IllegalArgumentException("Duplicate template for slice type " + template.type());
            }
        }
        return map;
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for catalogs assembled in code, mostly by tests.
     */
    public static class Builder {
        private final List<SliceTypeTemplate> templates = new ArrayList<>();

        public Builder template(SliceType type, double minBandwidthMbps, double maxLatencyMs,
                                double minReliability, int defaultPriority) {
            templates.add(new SliceTypeTemplate(type, minBandwidthMbps, maxLatencyMs,
                minReliability, SlicePriority.of(defaultPriority)));
            return this;
        }

        public Builder template(SliceTypeTemplate template) {
            templates.add(template);
            return this;
        }

        public SliceCatalog build() {
            return new SliceCatalog(templates);
        }
    }

    @Override
    public String toString() {
        return "SliceCatalog" + templates.keySet();
    }
}
