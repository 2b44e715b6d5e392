package org.oran.slicing.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResourceProfileTableTest {

    private final ResourceProfileTable table = new ResourceProfileTable(
        Map.of(SliceType.URLLC, new ResourceProfile(50, 150, 20)), 100);

    @Test
    void shouldScaleComputeAndMemoryWithBandwidth() {
        AllocatedResources resources = table.derive(SliceType.URLLC, 30);

        assertEquals(30, resources.getBandwidthMbps(), 1e-9);
        assertEquals(15, resources.getComputeUnits());
        assertEquals(45, resources.getMemoryMb());
        assertEquals(20, resources.getStorageGb());
    }

    @Test
    void shouldFloorFractionalUnits() {
        AllocatedResources resources = table.derive(SliceType.URLLC, 1);

        assertEquals(0, resources.getComputeUnits());
        assertEquals(1, resources.getMemoryMb());
    }

    @Test
    void shouldUseFallbackForTypesWithoutProfile() {
        AllocatedResources resources = table.derive(SliceType.CUSTOM, 200);

        assertEquals(20, resources.getComputeUnits());
        assertEquals(200, resources.getMemoryMb());
        assertEquals(10, resources.getStorageGb());
    }

    @Test
    void shouldRejectNonPositiveReference() {
        assertThrows(IllegalArgumentException.class, () -> new ResourceProfileTable(Map.of(), 0));
    }
}
