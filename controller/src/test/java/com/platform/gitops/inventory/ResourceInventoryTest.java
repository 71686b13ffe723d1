package com.platform.gitops.inventory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.gitops.model.ObjectIdentifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResourceInventoryTest {

    private static final ObjectIdentifier NS = ObjectIdentifier.of("v1", "Namespace", null, "apps");
    private static final ObjectIdentifier CM = ObjectIdentifier.of("v1", "ConfigMap", "apps", "settings");
    private static final ObjectIdentifier DEPLOY = ObjectIdentifier.of("apps/v1", "Deployment", "apps", "web");

    @Test
    @DisplayName("Stale entries come back in reverse inventory order")
    void staleInReverseOrder() {
        ResourceInventory inventory = ResourceInventory.of(List.of(NS, CM, DEPLOY));

        assertEquals(List.of(DEPLOY, NS), inventory.staleAgainst(List.of(CM)));
    }

    @Test
    @DisplayName("API version changes do not make an entry stale")
    void identityIgnoresVersion() {
        ResourceInventory inventory = ResourceInventory.of(List.of(DEPLOY));
        ObjectIdentifier upgraded = ObjectIdentifier.of("apps/v2", "Deployment", "apps", "web");

        assertTrue(inventory.staleAgainst(List.of(upgraded)).isEmpty());
        assertTrue(inventory.contains(upgraded));
    }

    @Test
    void validateRejectsDuplicates() {
        ResourceInventory inventory = ResourceInventory.of(List.of(CM, ObjectIdentifier.of("v2", "ConfigMap", "apps", "settings")));

        InvalidInventoryException e = assertThrows(InvalidInventoryException.class, inventory::validate);
        assertTrue(e.getMessage().contains("duplicated"));
    }

    @Test
    void validateRejectsIncompleteEntries() {
        assertThrows(InvalidInventoryException.class,
            () -> ResourceInventory.of(List.of(new ObjectIdentifier("", "", "ConfigMap", "apps", "x"))).validate());
    }

    @Test
    void emptyInventoryIsValid() {
        assertDoesNotThrow(() -> ResourceInventory.empty().validate());
        assertTrue(ResourceInventory.empty().isEmpty());
    }

    @Test
    void serializesAsEntryList() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        ResourceInventory inventory = ResourceInventory.of(List.of(NS, DEPLOY));

        String json = mapper.writeValueAsString(inventory);
        ResourceInventory read = mapper.readValue(json, ResourceInventory.class);

        assertEquals(inventory, read);
        assertTrue(json.startsWith("{\"entries\":["));
    }
}
