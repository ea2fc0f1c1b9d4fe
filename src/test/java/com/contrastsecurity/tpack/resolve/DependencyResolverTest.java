package com.contrastsecurity.tpack.resolve;

import com.contrastsecurity.tpack.extract.ExtractionResult;
import com.contrastsecurity.tpack.extract.FileExtraction;
import com.contrastsecurity.tpack.index.IndexedPackage;
import com.contrastsecurity.tpack.index.RepositoryIndex;
import com.contrastsecurity.tpack.model.Entity;
import com.contrastsecurity.tpack.model.EntityKind;
import com.contrastsecurity.tpack.model.ResolvedDependency;
import com.contrastsecurity.tpack.model.WarningType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DependencyResolverTest {

    private static final Path P_DIR = Paths.get("packages", "P");

    private DependencyResolver resolver;
    private FileExtraction file;

    @BeforeEach
    void setUp() {
        resolver = new DependencyResolver();
        file = new FileExtraction(Paths.get("p.py"), "python");
    }

    private ExtractionResult extraction() {
        ExtractionResult result = new ExtractionResult(P_DIR);
        result.add(file);
        return result;
    }

    private static PackageContext context(String namespace) {
        return new PackageContext(P_DIR, "P", namespace, true, true, null);
    }

    private static IndexedPackage pkg(String name, String namespace, String version, boolean lenient) {
        return new IndexedPackage(name, namespace, version, "https://github.com/example/" + name, lenient,
                Paths.get("packages", name));
    }

    private static List<Entity> actions(String... names) {
        Entity[] entities = new Entity[names.length];
        for (int i = 0; i < names.length; i++) {
            entities[i] = Entity.of(EntityKind.ACTION, names[i]);
        }
        return Arrays.asList(entities);
    }

    @Test
    public void testResolvesReferenceToIndexedPackage() {
        file.getDeclared().add(EntityKind.ACTION, "user.p_go");
        file.getReferenced().add(EntityKind.ACTION, "user.q_show");
        RepositoryIndex index = new RepositoryIndex.Builder()
                .add(pkg("Q", "user.q", "2.1.0", false), actions("user.q_show"))
                .build();

        ResolutionResult result = resolver.resolve(context("user.p"), extraction(), index);

        assertEquals(Collections.singletonList("user.p_go"), result.getContributes().names(EntityKind.ACTION));
        assertEquals(Collections.singletonList("user.q_show"), result.getDepends().names(EntityKind.ACTION));
        ResolvedDependency q = result.getDependencies().get("Q");
        assertNotNull(q);
        assertEquals("user.q", q.getNamespace());
        assertEquals("2.1.0", q.getMinVersion());
        assertEquals("https://github.com/example/Q", q.getGithub());
    }

    @Test
    public void testUnresolvedReferenceStaysInDepends() {
        file.getDeclared().add(EntityKind.ACTION, "user.p_version");
        file.getReferenced().add(EntityKind.ACTION, "user.unknown_thing");

        ResolutionResult result = resolver.resolve(context("user.p"), extraction(), RepositoryIndex.empty());

        assertTrue(result.getDepends().contains(EntityKind.ACTION, "user.unknown_thing"));
        assertTrue(result.getUnresolved().contains(EntityKind.ACTION, "user.unknown_thing"));
        assertTrue(result.getDependencies().isEmpty());
        assertEquals(1, result.getWarnings(WarningType.UNRESOLVED_REFERENCE).size());
    }

    @Test
    public void testDeclaredAndBuiltinReferencesAreNotDependencies() {
        file.getDeclared().add(EntityKind.ACTION, "user.p_go");
        file.getReferenced().add(EntityKind.ACTION, "user.p_go");
        file.getReferenced().add(EntityKind.ACTION, "edit.copy");
        file.getReferenced().add(EntityKind.MODE, "command");

        ResolutionResult result = resolver.resolve(context("user.p"), extraction(), RepositoryIndex.empty());

        assertTrue(result.getDepends().isEmpty());
        assertTrue(result.getWarnings(WarningType.UNRESOLVED_REFERENCE).isEmpty());
    }

    @Test
    public void testOwnNamespaceReferenceWithoutDeclaration() {
        file.getDeclared().add(EntityKind.ACTION, "user.p_version");
        file.getReferenced().add(EntityKind.ACTION, "user.p_missing");
        RepositoryIndex index = new RepositoryIndex.Builder()
                .add(pkg("Other", "user.other", "1.0.0", false), actions("user.p_missing"))
                .build();

        ResolutionResult result = resolver.resolve(context("user.p"), extraction(), index);

        assertTrue(result.getDepends().isEmpty());
        assertTrue(result.getDependencies().isEmpty());
        assertEquals(1, result.getWarnings(WarningType.SELF_NAMESPACE_UNDECLARED).size());
    }

    @Test
    public void testSelfEntriesInIndexIgnored() {
        file.getReferenced().add(EntityKind.ACTION, "user.q_show");
        RepositoryIndex index = new RepositoryIndex.Builder()
                .add(pkg("P", "user.p", "1.0.0", false), actions("user.q_show"))
                .build();

        ResolutionResult result = resolver.resolve(context("user.p"), extraction(), index);

        assertFalse(result.getDependencies().containsKey("P"));
        assertTrue(result.getUnresolved().contains(EntityKind.ACTION, "user.q_show"));
    }

    @Test
    public void testAmbiguityPicksLowestNameDeterministically() {
        file.getReferenced().add(EntityKind.ACTION, "user.shared_thing_action");
        for (int run = 0; run < 3; run++) {
            RepositoryIndex index = new RepositoryIndex.Builder()
                    .add(pkg("zeta", "user.zeta", "1.0.0", false), actions("user.shared_thing_action"))
                    .add(pkg("alpha", "user.alpha", "3.0.0", false), actions("user.shared_thing_action"))
                    .build();

            ResolutionResult result = resolver.resolve(context("user.p"), extraction(), index);

            assertEquals(Collections.singleton("alpha"), result.getDependencies().keySet());
            assertEquals(1, result.getWarnings(WarningType.AMBIGUOUS_REFERENCE).size());
            assertEquals(Arrays.asList("alpha", "zeta"),
                    result.getWarnings(WarningType.AMBIGUOUS_REFERENCE).get(0).getSubjects());
        }
    }

    @Test
    public void testLowestNameWinsRegardlessOfLeniency() {
        file.getReferenced().add(EntityKind.ACTION, "user.shared_go");
        RepositoryIndex index = new RepositoryIndex.Builder()
                .add(pkg("bbb-strict", "user.shared", "1.0.0", false), actions("user.shared_go"))
                .add(pkg("aaa-loose", "", "1.0.0", true), actions("user.shared_go"))
                .build();

        ResolutionResult result = resolver.resolve(context("user.p"), extraction(), index);

        assertEquals(Collections.singleton("aaa-loose"), result.getDependencies().keySet());
        assertTrue(result.getWarnings(WarningType.AMBIGUOUS_REFERENCE).get(0).getMessage()
                .contains("aaa-loose (no namespace checks)"));
        assertEquals("aaa-loose", DependencyResolver.choose(index.candidates(
                Entity.of(EntityKind.ACTION, "user.shared_go"), null)).getName());
    }

    @Test
    public void testLongerNamespaceOfAnotherPackageIsNotOwn() {
        file.getDeclared().add(EntityKind.ACTION, "user.ui_version");
        file.getReferenced().add(EntityKind.ACTION, "user.ui_elements_show");
        file.getReferenced().add(EntityKind.ACTION, "user.ui_missing");
        RepositoryIndex index = new RepositoryIndex.Builder()
                .add(pkg("talon-ui-elements", "user.ui_elements", "1.4.0", false), actions("user.ui_elements_show"))
                .build();

        ResolutionResult result = resolver.resolve(context("user.ui"), extraction(), index);

        assertTrue(result.getDepends().contains(EntityKind.ACTION, "user.ui_elements_show"));
        assertEquals("1.4.0", result.getDependencies().get("talon-ui-elements").getMinVersion());
        assertFalse(result.getDepends().contains(EntityKind.ACTION, "user.ui_missing"));
        List<String> selfUndeclared = result.getWarnings(WarningType.SELF_NAMESPACE_UNDECLARED).get(0).getSubjects();
        assertEquals(Collections.singletonList("actions:user.ui_missing"), selfUndeclared);
    }

    @Test
    public void testEntitiesFromSamePackageCollapse() {
        file.getReferenced().add(EntityKind.ACTION, "user.q_show");
        file.getReferenced().add(EntityKind.SETTING, "user.q_size");
        RepositoryIndex index = new RepositoryIndex.Builder()
                .add(pkg("Q", "user.q", "2.1.0", false),
                        Arrays.asList(Entity.of(EntityKind.ACTION, "user.q_show"),
                                Entity.of(EntityKind.SETTING, "user.q_size")))
                .build();

        ResolutionResult result = resolver.resolve(context("user.p"), extraction(), index);

        assertEquals(1, result.getDependencies().size());
        assertEquals(2, result.getDepends().size());
    }

    @Test
    public void testDevDependenciesExcluded() {
        file.getReferenced().add(EntityKind.ACTION, "user.q_show");
        RepositoryIndex index = new RepositoryIndex.Builder()
                .add(pkg("Q", "user.q", "2.1.0", false), actions("user.q_show"))
                .build();
        PackageContext context = new PackageContext(P_DIR, "P", "user.p", true, true,
                new HashSet<>(Collections.singletonList("Q")));

        ResolutionResult result = resolver.resolve(context, extraction(), index);

        assertTrue(result.getDependencies().isEmpty());
        assertTrue(result.getDepends().contains(EntityKind.ACTION, "user.q_show"));
    }

    @Test
    public void testNamespaceInferredWhenNotDeclared() {
        file.getDeclared().add(EntityKind.ACTION, "user.mouse_rig_go");
        file.getDeclared().add(EntityKind.ACTION, "user.mouse_rig_version");

        ResolutionResult result = resolver.resolve(context(null), extraction(), RepositoryIndex.empty());

        assertEquals("user.mouse_rig", result.getNamespace());
        assertTrue(result.isNamespaceInferred());
        assertTrue(result.getWarnings().isEmpty());
    }

    @Test
    public void testBareDeclaredNamespaceIsQualified() {
        file.getDeclared().add(EntityKind.ACTION, "user.p_version");

        ResolutionResult result = resolver.resolve(context("p"), extraction(), RepositoryIndex.empty());

        assertEquals("user.p", result.getNamespace());
        assertFalse(result.isNamespaceInferred());
    }

    @Test
    public void testMissingVersionActionAndStrayEntities() {
        file.getDeclared().add(EntityKind.ACTION, "user.p_go");
        file.getDeclared().add(EntityKind.TAG, "user.elsewhere");

        ResolutionResult result = resolver.resolve(context("user.p"), extraction(), RepositoryIndex.empty());

        assertEquals(1, result.getWarnings(WarningType.MISSING_VERSION_ACTION).size());
        assertEquals(Collections.singletonList("user.p_version"),
                result.getWarnings(WarningType.MISSING_VERSION_ACTION).get(0).getSubjects());
        assertEquals(1, result.getWarnings(WarningType.NAMESPACE_INCONSISTENCY).size());
    }

    @Test
    public void testLenientPackageSkipsNamespaceChecks() {
        file.getDeclared().add(EntityKind.ACTION, "user.p_go");
        file.getDeclared().add(EntityKind.TAG, "user.elsewhere");
        PackageContext context = new PackageContext(P_DIR, "P", "user.p", false, false, null);

        ResolutionResult result = resolver.resolve(context, extraction(), RepositoryIndex.empty());

        assertTrue(result.getWarnings(WarningType.NAMESPACE_INCONSISTENCY).isEmpty());
        assertTrue(result.getWarnings(WarningType.MISSING_VERSION_ACTION).isEmpty());
    }
}
