package com.contrastsecurity.tpack.manifest;

import com.contrastsecurity.tpack.model.ResolvedDependency;
import com.contrastsecurity.tpack.resolve.ResolutionResult;
import com.contrastsecurity.tpack.util.PreviewDetector;
import com.contrastsecurity.tpack.version.VersionParser;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Combines a package's existing manifest with freshly resolved facts.
 *
 * Generated sections are always recomputed, identity fields the owner set are kept,
 * frozen paths are restored from the existing manifest and unknown fields pass through.
 */
public class ManifestMerger {
    private static final Logger logger = LoggerFactory.getLogger(ManifestMerger.class);

    public static final String DEFAULT_VERSION = "0.0.0";
    public static final String DEFAULT_STATUS = "experimental";
    static final String NEW_DESCRIPTION = "Add a description of your Talon package here.";
    static final String FALLBACK_DESCRIPTION = "Auto-generated manifest.";

    /**
     * Produce the manifest to persist. The existing manifest is not modified.
     */
    public Manifest merge(MergeRequest request) {
        Manifest existing = request.isNewManifest() ? new Manifest() : request.getExisting();
        ResolutionResult resolution = request.getResolution();
        JsonObject out = new JsonObject();

        String name = keepOr(existing, Manifest.NAME, request.getDirectoryName());
        out.addProperty(Manifest.NAME, name);
        out.addProperty(Manifest.TITLE, keepOr(existing, Manifest.TITLE, titleFromName(name)));
        out.addProperty(Manifest.DESCRIPTION, keepOr(existing, Manifest.DESCRIPTION,
                request.isNewManifest() ? NEW_DESCRIPTION : FALLBACK_DESCRIPTION));
        out.add(Manifest.VERSION, keepOrString(existing, Manifest.VERSION, DEFAULT_VERSION));
        out.add(Manifest.STATUS, keepOrString(existing, Manifest.STATUS, DEFAULT_STATUS));

        String namespace = resolution.getNamespace();
        out.addProperty(Manifest.NAMESPACE, namespace != null ? namespace : keepOr(existing, Manifest.NAMESPACE, ""));

        String github = keepOr(existing, Manifest.GITHUB, "");
        out.addProperty(Manifest.GITHUB, github);
        out.add(Manifest.PREVIEW, keepOrString(existing, Manifest.PREVIEW,
                PreviewDetector.toRawUrl(github, request.getPreviewFile())));
        out.add(Manifest.AUTHOR, keepOrString(existing, Manifest.AUTHOR, ""));
        out.add(Manifest.TAGS, existing.has(Manifest.TAGS) ? copy(existing, Manifest.TAGS) : new JsonArray());

        if (existing.has(Manifest.PLATFORMS)) {
            out.add(Manifest.PLATFORMS, copy(existing, Manifest.PLATFORMS));
        }
        if (!existing.isBlank(Manifest.LICENSE)) {
            out.add(Manifest.LICENSE, copy(existing, Manifest.LICENSE));
        } else if (request.getDetectedLicense() != null) {
            out.addProperty(Manifest.LICENSE, request.getDetectedLicense());
        }

        JsonArray requires = new JsonArray();
        for (String requirement : request.getRequirements()) {
            requires.add(requirement);
        }
        out.add(Manifest.REQUIRES, requires);

        JsonObject dependencies = dependencies(resolution.getDependencies(),
                existing.getDependencies(Manifest.DEPENDENCIES));
        out.add(Manifest.DEPENDENCIES, dependencies);
        out.add(Manifest.DEV_DEPENDENCIES, existing.has(Manifest.DEV_DEPENDENCIES)
                ? copy(existing, Manifest.DEV_DEPENDENCIES) : new JsonObject());
        out.add(Manifest.CONTRIBUTES, resolution.getContributes().toJson());
        out.add(Manifest.DEPENDS, resolution.getDepends().toJson());

        Boolean validate = existing.getBooleanOrNull(Manifest.VALIDATE_DEPENDENCIES);
        if (validate != null) {
            out.addProperty(Manifest.VALIDATE_DEPENDENCIES, validate);
        } else if (dependencies.size() > 0) {
            out.addProperty(Manifest.VALIDATE_DEPENDENCIES, true);
        }

        out.addProperty(Manifest.GENERATOR, Manifest.GENERATOR_ID);
        out.addProperty(Manifest.GENERATOR_VERSION, request.getGeneratorVersion());
        out.addProperty(Manifest.GENERATOR_REQUIRES_VERSION_ACTION, requiresVersionAction(request, existing));
        out.addProperty(Manifest.GENERATOR_STRICT_NAMESPACE,
                existing.getBoolean(Manifest.GENERATOR_STRICT_NAMESPACE, true));
        out.add(Manifest.GENERATOR_FROZEN_FIELDS, existing.has(Manifest.GENERATOR_FROZEN_FIELDS)
                ? copy(existing, Manifest.GENERATOR_FROZEN_FIELDS) : new JsonArray());

        for (Map.Entry<String, JsonElement> entry : existing.getJson().entrySet()) {
            if (!Manifest.FIELD_ORDER.contains(entry.getKey())) {
                out.add(entry.getKey(), entry.getValue().deepCopy());
            }
        }

        List<String> frozen = existing.getFrozenFields();
        if (!frozen.isEmpty()) {
            FrozenFields.apply(out, existing.getJson(), frozen);
        }

        logger.debug("Merged manifest for {} ({} frozen paths)", name, frozen.size());
        return new Manifest(ordered(out));
    }

    /**
     * Resolved dependencies with the minimum version never lowered below the recorded one.
     */
    private static JsonObject dependencies(Map<String, ResolvedDependency> resolved,
                                           Map<String, ResolvedDependency> recorded) {
        JsonObject result = new JsonObject();
        for (ResolvedDependency dep : resolved.values()) {
            ResolvedDependency previous = recorded.get(dep.getName());
            String minVersion = dep.getMinVersion();
            String github = dep.getGithub();
            if (previous != null) {
                if (VersionParser.compare(previous.getMinVersion(), minVersion) > 0) {
                    logger.debug("Keeping {} min_version {} over indexed {}", dep.getName(),
                            previous.getMinVersion(), minVersion);
                    minVersion = previous.getMinVersion();
                }
                if ((github == null || github.isEmpty()) && previous.getGithub() != null) {
                    github = previous.getGithub();
                }
            }

            JsonObject entry = new JsonObject();
            entry.addProperty(Manifest.NAMESPACE, dep.getNamespace() != null ? dep.getNamespace() : "");
            if (github != null && !github.isEmpty()) {
                entry.addProperty(Manifest.GITHUB, github);
            }
            entry.addProperty(Manifest.MIN_VERSION, minVersion != null ? minVersion : DEFAULT_VERSION);
            result.add(dep.getName(), entry);
        }
        return result;
    }

    private static boolean requiresVersionAction(MergeRequest request, Manifest existing) {
        if (!request.getResolution().getContributes().hasNamespacedEntries()) {
            return false;
        }
        if (request.isNewManifest()) {
            return true;
        }
        return existing.getBoolean(Manifest.GENERATOR_REQUIRES_VERSION_ACTION, true);
    }

    /**
     * Modelled fields in their canonical order, then everything else in existing order.
     */
    private static JsonObject ordered(JsonObject source) {
        JsonObject result = new JsonObject();
        for (String field : Manifest.FIELD_ORDER) {
            if (source.has(field)) {
                result.add(field, source.get(field));
            }
        }
        for (Map.Entry<String, JsonElement> entry : source.entrySet()) {
            if (!result.has(entry.getKey())) {
                result.add(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    /**
     * Title for a new package: {@code talon-mouse_rig} becomes {@code Mouse Rig}.
     */
    public static String titleFromName(String name) {
        String base = name.replace("talon-", "").replace("talon_", "")
                .replace('-', ' ').replace('_', ' ');
        StringBuilder title = new StringBuilder(base.length());
        boolean previousIsLetter = false;
        for (char c : base.toCharArray()) {
            boolean letter = Character.isLetter(c);
            if (letter) {
                title.append(previousIsLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
            } else {
                title.append(c);
            }
            previousIsLetter = letter;
        }
        return title.toString();
    }

    private static String keepOr(Manifest existing, String field, String fallback) {
        return existing.isBlank(field) || existing.getString(field) == null ? fallback : existing.getString(field);
    }

    private static JsonElement keepOrString(Manifest existing, String field, String fallback) {
        if (existing.isBlank(field)) {
            return new JsonPrimitive(fallback != null ? fallback : "");
        }
        return copy(existing, field);
    }

    private static JsonElement copy(Manifest existing, String field) {
        return existing.getJson().get(field).deepCopy();
    }
}
