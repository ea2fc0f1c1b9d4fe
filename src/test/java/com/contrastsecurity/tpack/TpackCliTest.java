package com.contrastsecurity.tpack;

import com.contrastsecurity.tpack.manifest.Manifest;
import com.contrastsecurity.tpack.manifest.ManifestStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the command line entry point
 */
public class TpackCliTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream outputStream;
    private PrintStream originalOut;
    private PrintStream originalErr;

    private Path root;
    private Path rig;

    @BeforeEach
    void setupStreams() throws IOException {
        outputStream = new ByteArrayOutputStream();
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(outputStream, true, "UTF-8"));
        System.setErr(new PrintStream(outputStream, true, "UTF-8"));

        root = tempDir.resolve("user");
        rig = root.resolve("mouse_rig");
        write(rig.resolve("rig.py"), String.join("\n",
                "@mod.action_class",
                "class Actions:",
                "    def mouse_rig_go():",
                "        actions.user.ui_elements_show()",
                "",
                "    def mouse_rig_version() -> str:",
                "        return \"0.1.0\"",
                ""));
        write(root.resolve("talon-ui").resolve("manifest.json"),
                "{\"name\": \"talon-ui\", \"namespace\": \"user.ui_elements\", \"version\": \"1.4.0\","
                        + " \"contributes\": {\"actions\": [\"user.ui_elements_show\", \"user.ui_elements_version\"]},"
                        + " \"_generator\": \"talon-manifest-generator\"}");
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private static void write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    }

    private String output() {
        return new String(outputStream.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    public void testHelp() {
        assertEquals(0, TpackCli.run(new String[]{"help"}));
        assertTrue(output().contains("Usage: tpack"));
    }

    @Test
    public void testVersionFlag() {
        assertEquals(0, TpackCli.run(new String[]{"--version"}));
        assertTrue(output().contains("tpack 1."));
    }

    @Test
    public void testGenerateWritesManifest() throws Exception {
        int exitCode = TpackCli.run(new String[]{"generate", rig.toString()});

        assertEquals(0, exitCode);
        assertTrue(output().contains("Manifest updated"));
        Manifest manifest = new ManifestStore().load(rig);
        assertEquals("user.mouse_rig", manifest.getNamespace());
        assertEquals("1.4.0", manifest.getDependencies(Manifest.DEPENDENCIES).get("talon-ui").getMinVersion());
    }

    @Test
    public void testPackageDirectoryWithoutSubcommand() {
        assertEquals(0, TpackCli.run(new String[]{rig.toString(), "--root=" + root}));
        assertTrue(Files.exists(rig.resolve("manifest.json")));
    }

    @Test
    public void testDryRunPrintsManifest() {
        assertEquals(0, TpackCli.run(new String[]{"generate", rig.toString(), "--dry-run"}));

        assertTrue(output().contains("\"_generator\": \"talon-manifest-generator\""));
        assertFalse(Files.exists(rig.resolve("manifest.json")));
    }

    @Test
    public void testFailedPackageGivesNonZeroExit() throws Exception {
        write(rig.resolve("manifest.json"), "{broken");

        assertEquals(1, TpackCli.run(new String[]{"generate", rig.toString()}));
        assertTrue(output().contains("Failed"));
    }

    @Test
    public void testUnknownOption() {
        assertEquals(1, TpackCli.run(new String[]{"generate", "--frobnicate"}));
        assertTrue(output().contains("Unknown argument: --frobnicate"));
    }

    @Test
    public void testCheckReportsSatisfiedDependencies() {
        TpackCli.run(new String[]{"generate", rig.toString()});
        outputStream.reset();

        assertEquals(0, TpackCli.run(new String[]{"check", rig.toString()}));
        assertTrue(output().contains("mouse_rig: all 1 dependencies satisfied"));
    }

    @Test
    public void testVersionBump() throws Exception {
        TpackCli.run(new String[]{"generate", rig.toString()});

        assertEquals(0, TpackCli.run(new String[]{"version", "minor", rig.toString()}));
        assertEquals("0.1.0", new ManifestStore().load(rig).getVersion());
        assertTrue(output().contains("Version set to 0.1.0"));
    }

    @Test
    public void testVersionBumpNeedsType() {
        assertEquals(1, TpackCli.run(new String[]{"version"}));
        assertEquals(1, TpackCli.run(new String[]{"version", "huge"}));
    }

    @Test
    public void testInfo() {
        TpackCli.run(new String[]{"generate", rig.toString()});
        outputStream.reset();

        assertEquals(0, TpackCli.run(new String[]{"info", rig.toString()}));
        String output = output();
        assertTrue(output.contains("Package: mouse_rig"));
        assertTrue(output.contains("Namespace: user.mouse_rig"));
        assertTrue(output.contains("- talon-ui >= 1.4.0"));
    }

    @Test
    public void testInfoWithoutManifest() {
        assertEquals(1, TpackCli.run(new String[]{"info", rig.toString()}));
    }

    @Test
    public void testDefaultSearchRootIsNearestUserDirectory() {
        assertEquals(root.toAbsolutePath().normalize(), TpackCli.defaultSearchRoot(rig.resolve("sub")));
        Path outside = tempDir.resolve("elsewhere").resolve("pkg");
        assertEquals(outside.getParent().toAbsolutePath().normalize(), TpackCli.defaultSearchRoot(outside));
    }
}
