package org.oran.slicing.model;

import java.util.Objects;

/**
 * Recoverable failure of a slicing operation.
 *
 * Carries the failure type plus, where it applies, the slice concerned and how many
 * Mbps were missing, so the caller can retry with adjusted parameters.
 */
public class SlicingException extends RuntimeException {

    /**
     * Type of slicing failure.
     */
    public enum Type {
        /** No template is registered for the requested slice type. */
        UNKNOWN_SLICE_TYPE,
        /** The configured maximum number of slices is already live. */
        CATALOG_FULL,
        /** Bandwidth could not be secured, even after preemption. */
        INSUFFICIENT_RESOURCES,
        /** No slice with the given id exists. */
        SLICE_NOT_FOUND,
        /** Metrics were reported for a slice that does not exist. */
        METRICS_TARGET_NOT_FOUND,
        /** The slice is not in a state that allows the operation. */
        INVALID_STATE
    }

    private final Type type;
    private final SliceId sliceId;
    private final double shortfallMbps;

    public SlicingException(Type type, String message) {
        this(type, message, null, 0.0);
    }

    public SlicingException(Type type, String message, SliceId sliceId) {
        this(type, message, sliceId, 0.0);
    }

    public SlicingException(Type type, String message, SliceId sliceId, double shortfallMbps) {
        super(message);
        this.type = Objects.requireNonNull(type, "Exception type cannot be null");
        this.sliceId = sliceId;
        this.shortfallMbps = shortfallMbps;
    }

    public static SlicingException notFound(SliceId id) {
        return new SlicingException(Type.SLICE_NOT_FOUND, "Slice " + id + " not found", id);
    }

    public Type getType() {
        return type;
    }

    /**
     * Slice the failure refers to, or null when it concerns no existing slice.
     */
    public SliceId getSliceId() {
        return sliceId;
    }

    /**
     * Bandwidth that was missing, 0 unless the type is INSUFFICIENT_RESOURCES.
     */
    public double getShortfallMbps() {
        return shortfallMbps;
    }

    @Override
    public String toString() {
        return String.format("SlicingException[type=%s, slice=%s, shortfall=%.2f, message=%s]",
            type, sliceId, shortfallMbps, getMessage());
    }
}
