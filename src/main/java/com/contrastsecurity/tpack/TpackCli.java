package com.contrastsecurity.tpack;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.contrastsecurity.tpack.index.RepositoryIndex;
import com.contrastsecurity.tpack.index.RepositoryIndexer;
import com.contrastsecurity.tpack.manifest.Manifest;
import com.contrastsecurity.tpack.manifest.ManifestStore;
import com.contrastsecurity.tpack.model.EntityKind;
import com.contrastsecurity.tpack.model.EntitySet;
import com.contrastsecurity.tpack.model.ResolvedDependency;
import com.contrastsecurity.tpack.model.TpackException;
import com.contrastsecurity.tpack.model.Warning;
import com.contrastsecurity.tpack.runtime.CapabilityRegistry;
import com.contrastsecurity.tpack.runtime.DependencyValidator;
import com.contrastsecurity.tpack.runtime.ValidationResult;
import com.contrastsecurity.tpack.service.BatchReport;
import com.contrastsecurity.tpack.service.PackageOutcome;
import com.contrastsecurity.tpack.service.PackageProcessor;
import com.contrastsecurity.tpack.service.TpackConfig;
import com.contrastsecurity.tpack.service.VersionBumper;
import com.contrastsecurity.tpack.version.SemanticVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Command line entry point: generates manifests, shows and bumps package versions and
 * checks dependencies against the installed packages.
 */
public class TpackCli {

    private static final Logger logger = LoggerFactory.getLogger(TpackCli.class);
    private static final String FALLBACK_VERSION = "1.0.0";

    public static void main(String[] args) {
        int exitCode = run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Run a command.
     *
     * @return process exit code: 0 on success, 1 if any package failed or the command was invalid
     */
    public static int run(String[] args) {
        String subcommand = args.length > 0 ? args[0].toLowerCase() : "generate";
        try {
            switch (subcommand) {
                case "generate":
                    return handleGenerate(tail(args));
                case "info":
                    return handleInfo(tail(args));
                case "version":
                    return handleVersion(tail(args));
                case "check":
                    return handleCheck(tail(args));
                case "--version":
                    System.out.println("tpack " + getVersion());
                    return 0;
                case "--help":
                case "-h":
                case "help":
                    printUsage();
                    return 0;
                default:
                    // No subcommand: package directories and options only
                    return handleGenerate(args);
            }
        } catch (RuntimeException e) {
            logger.error("Error executing {}: {}", subcommand, e.getMessage(), e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Handle 'generate' subcommand
     */
    private static int handleGenerate(String[] args) {
        List<Path> packageDirs = new ArrayList<>();
        boolean dryRun = false;
        Boolean manifest = null;
        Boolean check = null;
        String root = null;

        for (String arg : args) {
            if (arg.equals("--dry-run")) {
                dryRun = true;
            } else if (arg.equals("--manifest-only")) {
                manifest = true;
                check = false;
            } else if (arg.equals("--no-manifest")) {
                manifest = false;
            } else if (arg.equals("--check-only")) {
                check = true;
                manifest = false;
            } else if (arg.equals("--no-check")) {
                check = false;
            } else if (arg.startsWith("--root=")) {
                root = arg.substring(7);
            } else if (arg.equals("--verbose") || arg.equals("-v")) {
                setLoggingLevel(Level.INFO);
            } else if (arg.startsWith("--loglevel=")) {
                setLogLevel(arg.substring(11).toUpperCase());
            } else if (arg.startsWith("-")) {
                System.err.println("Unknown argument: " + arg);
                System.err.println("Run 'tpack help' for usage information");
                return 1;
            } else {
                packageDirs.add(Paths.get(arg));
            }
        }

        if (packageDirs.isEmpty()) {
            packageDirs.add(Paths.get("."));
        }
        Path searchRoot = root != null ? Paths.get(root) : defaultSearchRoot(packageDirs.get(0));
        TpackConfig config = TpackConfig.load(searchRoot, Paths.get("."));
        boolean runManifest = manifest != null ? manifest : config.isManifestEnabled();
        boolean runCheck = check != null ? check : config.isCheckEnabled();
        logger.info("Search root {}, manifest={}, check={}, dryRun={}", searchRoot, runManifest, runCheck, dryRun);

        int exitCode = 0;
        if (runManifest) {
            PackageProcessor processor = new PackageProcessor(getVersion(), config.getSkipDirectories());
            BatchReport report = processor.processAll(packageDirs, searchRoot, dryRun);
            printReport(report, dryRun);
            exitCode = report.hasFailures() ? 1 : 0;
        }
        if (runCheck) {
            runChecks(packageDirs, searchRoot, config);
        }
        return exitCode;
    }

    /**
     * Handle 'info' subcommand
     */
    private static int handleInfo(String[] args) {
        Path dir = Paths.get(args.length > 0 ? args[0] : ".");
        Manifest manifest;
        try {
            manifest = new ManifestStore().load(dir);
        } catch (TpackException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
        if (manifest == null) {
            System.err.println("No " + Manifest.FILE_NAME + " in " + dir + ". Run 'tpack generate' first.");
            return 1;
        }

        System.out.println("Package: " + valueOrDash(manifest.getName()));
        System.out.println("  Title: " + valueOrDash(manifest.getString(Manifest.TITLE)));
        System.out.println("  Version: " + valueOrDash(manifest.getVersion()));
        System.out.println("  Status: " + valueOrDash(manifest.getString(Manifest.STATUS)));
        System.out.println("  Namespace: " + valueOrDash(manifest.getNamespace()));
        System.out.println("  GitHub: " + valueOrDash(manifest.getGithub()));
        System.out.println("  License: " + valueOrDash(manifest.getString(Manifest.LICENSE)));
        List<String> requires = manifest.getStringList(Manifest.REQUIRES);
        System.out.println("  Requires: " + (requires.isEmpty() ? "-" : String.join(", ", requires)));
        System.out.println("  Contributes: " + describe(manifest.getContributes()));
        System.out.println("  Depends: " + describe(manifest.getEntitySet(Manifest.DEPENDS)));

        Map<String, ResolvedDependency> dependencies = manifest.getDependencies(Manifest.DEPENDENCIES);
        System.out.println("  Dependencies: " + (dependencies.isEmpty() ? "none" : ""));
        for (ResolvedDependency dep : dependencies.values()) {
            System.out.println("    - " + dep.getName() + " >= " + valueOrDash(dep.getMinVersion()));
        }
        return 0;
    }

    /**
     * Handle 'version' subcommand
     */
    private static int handleVersion(String[] args) {
        String bumpType = null;
        Path dir = Paths.get(".");
        boolean dryRun = false;
        for (String arg : args) {
            if (arg.equals("--dry-run")) {
                dryRun = true;
            } else if (bumpType == null) {
                bumpType = arg.toLowerCase();
            } else {
                dir = Paths.get(arg);
            }
        }
        if (bumpType == null || !(bumpType.equals("patch") || bumpType.equals("minor") || bumpType.equals("major"))) {
            System.err.println("Usage: tpack version <patch|minor|major> [dir] [--dry-run]");
            return 1;
        }

        try {
            SemanticVersion next = new VersionBumper(new ManifestStore()).bump(dir, bumpType, dryRun);
            System.out.println((dryRun ? "Would set version to " : "Version set to ") + next);
            return 0;
        } catch (TpackException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Handle 'check' subcommand
     */
    private static int handleCheck(String[] args) {
        Path dir = Paths.get(".");
        String root = null;
        for (String arg : args) {
            if (arg.startsWith("--root=")) {
                root = arg.substring(7);
            } else if (arg.equals("--verbose") || arg.equals("-v")) {
                setLoggingLevel(Level.INFO);
            } else if (arg.startsWith("--loglevel=")) {
                setLogLevel(arg.substring(11).toUpperCase());
            } else {
                dir = Paths.get(arg);
            }
        }
        Path searchRoot = root != null ? Paths.get(root) : defaultSearchRoot(dir);
        List<Path> dirs = new ArrayList<>();
        dirs.add(dir);
        runChecks(dirs, searchRoot, TpackConfig.load(searchRoot, Paths.get(".")));
        return 0;
    }

    /**
     * Validate each package's dependencies against what the index says is installed.
     * Problems are reported, never turned into a failing exit code.
     */
    private static void runChecks(List<Path> packageDirs, Path searchRoot, TpackConfig config) {
        ManifestStore store = new ManifestStore();
        RepositoryIndex index = new RepositoryIndexer(store, config.getSkipDirectories()).build(searchRoot);
        CapabilityRegistry registry = CapabilityRegistry.fromIndex(index, store);
        DependencyValidator validator = new DependencyValidator();

        for (Path dir : packageDirs) {
            Manifest manifest;
            try {
                manifest = store.load(dir);
            } catch (TpackException e) {
                logger.warn("Cannot check {}: {}", dir, e.getMessage());
                continue;
            }
            if (manifest == null) {
                logger.warn("Cannot check {}: no {}", dir, Manifest.FILE_NAME);
                continue;
            }

            ValidationResult result = validator.validate(manifest, registry);
            if (result.isSkipped()) {
                System.out.println(result.getPackageName() + ": dependency validation disabled");
            } else if (result.getError() != null) {
                logger.warn("{}: dependency check failed: {}", result.getPackageName(), result.getError().getMessage());
            } else if (result.isOk()) {
                System.out.println(result.getPackageName() + ": all " + result.getSatisfied().size()
                        + " dependencies satisfied");
            } else {
                System.out.println(result.getPackageName() + ": dependency problems");
                for (String problem : result.getProblems()) {
                    System.out.println("  - " + problem);
                }
            }
        }
    }

    private static void printReport(BatchReport report, boolean dryRun) {
        for (PackageOutcome outcome : report.getOutcomes()) {
            switch (outcome.getStatus()) {
                case DRY_RUN:
                    System.out.println("Dry run, " + outcome.getPackageDir().resolve(Manifest.FILE_NAME) + " would be:");
                    System.out.print(outcome.getManifestJson());
                    break;
                case WRITTEN:
                    System.out.println("Manifest updated: " + outcome.getPackageDir().resolve(Manifest.FILE_NAME));
                    break;
                case UNCHANGED:
                    System.out.println("Manifest unchanged: " + outcome.getPackageDir().resolve(Manifest.FILE_NAME));
                    break;
                case FAILED:
                    System.err.println("Failed: " + outcome.getPackageDir() + ": " + outcome.getError().getMessage());
                    break;
                default:
                    break;
            }
            for (Warning warning : outcome.getWarnings()) {
                System.out.println("  WARNING " + warning.getType() + ": " + warning.getMessage());
            }
        }

        System.out.println();
        System.out.println((dryRun ? "Dry run: " : "") + report.getOutcomes().size() + " package(s), "
                + report.count(PackageOutcome.Status.WRITTEN) + " updated, "
                + report.count(PackageOutcome.Status.UNCHANGED) + " unchanged, "
                + report.getFailures().size() + " failed, "
                + report.getWarningCount() + " warning(s)");
    }

    /**
     * Nearest ancestor named "user", else the parent of the package.
     */
    static Path defaultSearchRoot(Path packageDir) {
        Path absolute = packageDir.toAbsolutePath().normalize();
        for (Path p = absolute; p != null; p = p.getParent()) {
            if (p.getFileName() != null && p.getFileName().toString().equals("user")) {
                return p;
            }
        }
        return absolute.getParent() != null ? absolute.getParent() : absolute;
    }

    private static String describe(EntitySet entities) {
        if (entities.isEmpty()) {
            return "0 items";
        }
        List<String> parts = new ArrayList<>();
        for (EntityKind kind : EntityKind.values()) {
            int count = entities.size(kind);
            if (count > 0) {
                parts.add(count + " " + kind.getManifestKey());
            }
        }
        return entities.size() + " items (" + String.join(", ", parts) + ")";
    }

    private static String valueOrDash(String value) {
        return value == null || value.isEmpty() ? "-" : value;
    }

    private static String[] tail(String[] args) {
        String[] rest = new String[Math.max(0, args.length - 1)];
        System.arraycopy(args, 1, rest, 0, rest.length);
        return rest;
    }

    private static void printUsage() {
        System.out.println("Usage: tpack [subcommand] [args...] [options]");
        System.out.println();
        System.out.println("Subcommands:");
        System.out.println("  generate [dirs...]        Generate or update manifest.json (default)");
        System.out.println("  info [dir]                Show a package summary from its manifest");
        System.out.println("  version <type> [dir]      Bump the package version (patch, minor, major)");
        System.out.println("  check [dir]               Check installed dependency versions");
        System.out.println("  help                      Show this help message");
        System.out.println();
        System.out.println("Generate Options:");
        System.out.println("  --dry-run                 Print manifests instead of writing them");
        System.out.println("  --manifest-only           Only generate manifests");
        System.out.println("  --no-manifest             Do not generate manifests");
        System.out.println("  --check-only              Only check dependencies");
        System.out.println("  --no-check                Do not check dependencies");
        System.out.println("  --root=<dir>              Directory scanned for other packages");
        System.out.println("                            (default: nearest 'user' ancestor)");
        System.out.println("  --verbose, -v             Verbose logging");
        System.out.println("  --loglevel=<level>        Log level (TRACE, DEBUG, INFO, WARN, ERROR)");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  # Update the manifest of the current package");
        System.out.println("  tpack");
        System.out.println();
        System.out.println("  # Preview manifests of two packages");
        System.out.println("  tpack generate mouse_rig talon-ui --dry-run");
        System.out.println();
        System.out.println("  # Release a new minor version");
        System.out.println("  tpack version minor");
        System.out.println();
        System.out.println("Version: " + getVersion());
    }

    /**
     * Set the root log level
     *
     * @param level TRACE, DEBUG, INFO, WARN or ERROR
     */
    private static void setLogLevel(String level) {
        ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
            LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        Level logbackLevel;

        switch (level) {
            case "TRACE":
                logbackLevel = Level.TRACE;
                break;
            case "DEBUG":
                logbackLevel = Level.DEBUG;
                break;
            case "INFO":
                logbackLevel = Level.INFO;
                break;
            case "WARN":
                logbackLevel = Level.WARN;
                break;
            case "ERROR":
                logbackLevel = Level.ERROR;
                break;
            default:
                System.err.println("Unknown log level: " + level + ". Using WARN.");
                logbackLevel = Level.WARN;
        }

        root.setLevel(logbackLevel);
        setLoggingLevel(logbackLevel);
        logger.info("Log level set to: {}", level);
    }

    /**
     * Set the logging level for the application loggers
     */
    private static void setLoggingLevel(Level level) {
        LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        loggerContext.getLogger("com.contrastsecurity.tpack").setLevel(level);
    }

    /**
     * Version of this tool, written to {@code _generatorVersion}
     */
    static String getVersion() {
        try {
            Properties props = new Properties();
            try (InputStream is = TpackCli.class.getResourceAsStream("/META-INF/maven/com.contrastsecurity/tpack/pom.properties")) {
                if (is != null) {
                    props.load(is);
                    return props.getProperty("version", FALLBACK_VERSION);
                }
            }
        } catch (Exception e) {
            logger.debug("Could not read version from pom.properties: {}", e.getMessage());
        }
        return FALLBACK_VERSION;
    }
}
