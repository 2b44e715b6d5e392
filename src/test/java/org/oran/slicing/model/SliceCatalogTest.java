package org.oran.slicing.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SliceCatalogTest {

    @Test
    void shouldLookUpRegisteredTemplate() {
        SliceCatalog catalog = SliceCatalog.builder()
            .template(SliceType.URLLC, 10, 1, 0.99999, 1)
            .build();

        SliceTypeTemplate template = catalog.lookup(SliceType.URLLC);

        assertEquals(10, template.minBandwidthMbps());
        assertEquals(SlicePriority.of(1), template.defaultPriority());
    }

    @Test
    void shouldRejectUnknownType() {
        SliceCatalog catalog = SliceCatalog.builder()
            .template(SliceType.URLLC, 10, 1, 0.99999, 1)
            .build();

        SlicingException e = assertThrows(SlicingException.class, () -> catalog.lookup(SliceType.CUSTOM));
        assertEquals(SlicingException.Type.UNKNOWN_SLICE_TYPE, e.getType());
    }

    @Test
    void shouldReplaceAllTemplatesOnReload() {
        SliceCatalog catalog = SliceCatalog.builder()
            .template(SliceType.URLLC, 10, 1, 0.99999, 1)
            .build();

        catalog.reload(List.of(new SliceTypeTemplate(SliceType.CUSTOM, 5, 20, 0.9, SlicePriority.of(4))));

        assertTrue(catalog.contains(SliceType.CUSTOM));
        assertFalse(catalog.contains(SliceType.URLLC));
    }

    @Test
    void shouldRejectDuplicateTemplates() {
        SliceCatalog.Builder builder = SliceCatalog.builder()
            .template(SliceType.EMBB, 50, 10, 0.99, 2)
            .template(SliceType.EMBB, 60, 10, 0.99, 2);

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void shouldResolveLabelsIgnoringCase() {
        assertEquals(SliceType.MMTC, SliceType.fromLabel("mmtc"));
        assertEquals(SliceType.AUTOMOTIVE, SliceType.fromLabel("Automotive"));
        assertEquals(SliceType.EMBB, SliceType.fromLabel("EMBB"));
        assertThrows(IllegalArgumentException.class, () -> SliceType.fromLabel("satellite"));
    }
}
