package com.contrastsecurity.tpack.resolve;

import com.contrastsecurity.tpack.model.Entity;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Entities provided by the voice-command runtime itself. References to them never
 * become dependencies.
 */
public final class BuiltinEntities {

    static final Set<String> ACTION_NAMESPACES = setOf(
            "app", "auto_format", "auto_insert", "browser", "bytes", "clip", "code", "core",
            "deck", "dict", "dictate", "edit", "insert", "key", "list", "math", "menu",
            "migrate", "mimic", "mode", "mouse_click", "mouse_drag", "mouse_move", "mouse_nudge",
            "mouse_release", "mouse_scroll", "mouse_x", "mouse_y", "paste", "path",
            "print", "random", "set", "settings", "skip", "sleep", "sound", "speech", "string",
            "time", "tracking", "tuple", "types", "win");

    static final Set<String> TAGS = setOf("browser", "terminal");

    static final Set<String> MODES = setOf("all", "command", "dictation", "sleep");

    static final Set<String> SETTINGS = setOf(
            "dictate.punctuation", "dictate.word_map", "hotkey_wait", "imgui.dark_mode", "imgui.scale",
            "insert_wait", "key_hold", "key_wait", "paste_wait", "speech._engine_id", "speech._subtitles",
            "speech.debug", "speech.engine", "speech.gain", "speech.language", "speech.latency",
            "speech.microphone", "speech.normalize", "speech.record_all", "speech.record_labels",
            "speech.record_path", "speech.threshold", "speech.timeout", "tracking.zoom_height",
            "tracking.zoom_live", "tracking.zoom_scale", "tracking.zoom_width");

    static final Set<String> CAPTURES = setOf(
            "digit_string", "digits", "key", "letter", "modifiers", "number", "number_signed",
            "number_small", "number_string", "special_key", "symbol");

    static final Set<String> LISTS = setOf(
            "digit", "letter", "modifier", "number_meta", "number_scale", "number_sign",
            "number_small", "special_key", "symbol");

    private BuiltinEntities() {
    }

    /**
     * @return true if the runtime provides the entity
     */
    public static boolean isBuiltin(Entity entity) {
        String name = entity.getName();
        switch (entity.getKind()) {
            case ACTION:
                int dot = name.indexOf('.');
                return ACTION_NAMESPACES.contains(dot >= 0 ? name.substring(0, dot) : name);
            case TAG:
                return TAGS.contains(name);
            case MODE:
                return MODES.contains(name);
            case SETTING:
                return SETTINGS.contains(name);
            case CAPTURE:
                return CAPTURES.contains(name);
            case LIST:
                return LISTS.contains(name);
            default:
                return false;
        }
    }

    private static Set<String> setOf(String... values) {
        return Collections.unmodifiableSet(new HashSet<>(Arrays.asList(values)));
    }
}
