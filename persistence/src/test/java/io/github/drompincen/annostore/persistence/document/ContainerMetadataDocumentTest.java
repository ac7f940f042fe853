package io.github.drompincen.annostore.persistence.document;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ContainerMetadataDocumentTest {

    @Test
    void fieldCountMapPreservesEntryOrder() {
        ContainerMetadataDocument doc = new ContainerMetadataDocument();
        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("type", 2);
        counts.put("body.value", 1);

        doc.replaceFieldCounts(counts);

        assertThat(doc.getFieldCounts()).hasSize(2);
        assertThat(doc.fieldCountMap()).containsExactly(Map.entry("type", 2), Map.entry("body.value", 1));
    }

    @Test
    void newDocumentHasNoFieldCounts() {
        assertThat(new ContainerMetadataDocument().fieldCountMap()).isEmpty();
    }
}
