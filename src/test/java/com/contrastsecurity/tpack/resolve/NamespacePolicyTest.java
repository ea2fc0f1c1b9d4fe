package com.contrastsecurity.tpack.resolve;

import com.contrastsecurity.tpack.model.EntityKind;
import com.contrastsecurity.tpack.model.EntitySet;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NamespacePolicyTest {

    @Test
    public void testMatches() {
        assertTrue(NamespacePolicy.matches("user.mouse_rig", "user.mouse_rig"));
        assertTrue(NamespacePolicy.matches("user.mouse_rig", "user.mouse_rig_go"));
        assertTrue(NamespacePolicy.matches("user.mouse_rig", "user.mouse_rig.sub"));
        assertFalse(NamespacePolicy.matches("user.mouse_rig", "user.mouse_rigging"));
        assertFalse(NamespacePolicy.matches(null, "user.mouse_rig_go"));
        assertFalse(NamespacePolicy.matches("", "user.mouse_rig_go"));
    }

    @Test
    public void testNormalize() {
        assertEquals("user.mouse_rig", NamespacePolicy.normalize("mouse_rig"));
        assertEquals("user.mouse_rig", NamespacePolicy.normalize(" user.mouse_rig "));
        assertEquals("edit.extra", NamespacePolicy.normalize("edit.extra"));
        assertNull(NamespacePolicy.normalize("  "));
        assertNull(NamespacePolicy.normalize(null));
    }

    @Test
    public void testExpectedVersionAction() {
        assertEquals("user.mouse_rig_version", NamespacePolicy.expectedVersionAction("user.mouse_rig"));
        assertEquals("user.ui_elements_version", NamespacePolicy.expectedVersionAction("ui_elements"));
    }

    @Test
    public void testInferFromMajorityPrefix() {
        EntitySet contributes = new EntitySet();
        contributes.add(EntityKind.ACTION, "user.mouse_rig_go");
        contributes.add(EntityKind.ACTION, "user.mouse_rig_stop");
        contributes.add(EntityKind.SETTING, "user.mouse_rig_speed");
        contributes.add(EntityKind.TAG, "user.other_tag");
        contributes.add(EntityKind.APP, "vscode");

        assertEquals("user.mouse_rig", NamespacePolicy.infer(contributes));
    }

    @Test
    public void testInferFromSingleName() {
        EntitySet contributes = new EntitySet();
        contributes.add(EntityKind.ACTION, "user.ui_elements_show");

        assertEquals("user.ui_elements", NamespacePolicy.infer(contributes));
    }

    @Test
    public void testInferNothingWithoutMajority() {
        EntitySet contributes = new EntitySet();
        contributes.add(EntityKind.ACTION, "user.alpha_go");
        contributes.add(EntityKind.ACTION, "user.beta_go");

        assertNull(NamespacePolicy.infer(contributes));
        assertNull(NamespacePolicy.infer(new EntitySet()));
    }

    @Test
    public void testInconsistentEntities() {
        EntitySet contributes = new EntitySet();
        contributes.add(EntityKind.ACTION, "user.mouse_rig_go");
        contributes.add(EntityKind.MODE, "user.mouse_rig");
        contributes.add(EntityKind.TAG, "user.stray_tag");
        contributes.add(EntityKind.ACTION, "edit.extra");
        contributes.add(EntityKind.APP, "stray_app");

        List<String> offenders = NamespacePolicy.inconsistentEntities("user.mouse_rig", contributes);

        assertEquals(Arrays.asList("tags:user.stray_tag"), offenders);
    }
}
