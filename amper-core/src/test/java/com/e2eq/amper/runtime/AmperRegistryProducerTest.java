package com.e2eq.amper.runtime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AmperRegistryProducer")
class AmperRegistryProducerTest {

    @Test
    @DisplayName("produces the registry and container of the configured catalog")
    void init_loadsCatalog() {
        AmperRegistryProducer producer = new AmperRegistryProducer("amper/catalog.yaml", "platform", "amper/templates");
        producer.init();

        assertEquals(3, producer.registry().policyTemplateCount());
        assertEquals("platform", producer.catalogContainer().getId());
        assertSame(producer.registry(), producer.catalogContainer().getRegistry());
        assertTrue(producer.registry().container("platform").isPresent());
    }

    @Test
    @DisplayName("a missing catalog fails startup")
    void init_missingCatalog() {
        AmperRegistryProducer producer = new AmperRegistryProducer("amper/absent.yaml", "catalog", "amper/templates");

        IllegalStateException ex = assertThrows(IllegalStateException.class, producer::init);
        assertTrue(ex.getMessage().contains("amper/absent.yaml"));
    }
}
