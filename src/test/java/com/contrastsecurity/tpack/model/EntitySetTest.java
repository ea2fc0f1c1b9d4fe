package com.contrastsecurity.tpack.model;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class EntitySetTest {

    @Test
    public void testNamesSortedAndUnique() {
        EntitySet set = new EntitySet();
        set.add(EntityKind.ACTION, "user.b_go");
        set.add(EntityKind.ACTION, "user.a_go");
        set.add(EntityKind.ACTION, "user.b_go");
        set.add(EntityKind.ACTION, "");

        assertEquals(Arrays.asList("user.a_go", "user.b_go"), set.names(EntityKind.ACTION));
        assertEquals(2, set.size());
    }

    @Test
    public void testAppsAreNotNamespaced() {
        EntitySet set = new EntitySet();
        set.add(EntityKind.APP, "vscode");

        assertFalse(set.isEmpty());
        assertFalse(set.hasNamespacedEntries());

        set.add(EntityKind.SCOPE, "user.some_scope");
        assertTrue(set.hasNamespacedEntries());
    }

    @Test
    public void testJsonIgnoresUnknownKindsAndValues() {
        JsonObject json = JsonParser.parseString("{\"actions\": [\"user.x_go\", 3, null], \"widgets\": [\"w\"],"
                + " \"tags\": \"user.not_an_array\"}").getAsJsonObject();

        EntitySet set = EntitySet.fromJson(json);

        assertEquals(1, set.size());
        assertTrue(set.contains(Entity.of(EntityKind.ACTION, "user.x_go")));
        assertTrue(EntitySet.fromJson(null).isEmpty());
    }

    @Test
    public void testEntityToStringAndSegment() {
        Entity entity = Entity.of(EntityKind.SETTING, "user.mouse_rig_speed");

        assertEquals("settings:user.mouse_rig_speed", entity.toString());
        assertEquals("user", entity.getNamespaceSegment());
        assertEquals("", Entity.of(EntityKind.APP, "vscode").getNamespaceSegment());
        assertEquals(EntityKind.CAPTURE, EntityKind.fromManifestKey("captures"));
        assertNull(EntityKind.fromManifestKey("widgets"));
    }
}
