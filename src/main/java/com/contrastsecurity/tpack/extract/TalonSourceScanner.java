package com.contrastsecurity.tpack.extract;

import com.contrastsecurity.tpack.model.EntityKind;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scanner for {@code .talon} command files.
 *
 * A file is a context header and a command body separated by the first line holding a
 * single {@code -}. Files without a separator are all body. Both parts only reference
 * entities; declarations live in the scripting dialect.
 */
public class TalonSourceScanner implements SourceScanner {

    public static final String DIALECT = "talon";

    private static final String USER_NAME = "(user\\.[a-z_][a-z0-9_]*)";

    private static final Pattern HEADER_TAG = header("tag", USER_NAME);
    private static final Pattern HEADER_APP = header("app", "([a-z_][a-z0-9_]*)");
    private static final Pattern HEADER_MODE = header("mode", "([a-z_][a-z0-9_.]*)");
    private static final Pattern HEADER_SCOPE = header("scope", USER_NAME);
    private static final Pattern BLOCK_SETTING = Pattern.compile("^\\s+" + USER_NAME + "\\s*=", Pattern.MULTILINE);

    private static final Pattern BODY_ACTION = Pattern.compile("\\buser\\.([a-z_][a-z0-9_]*)\\s*\\(");
    private static final Pattern BODY_CAPTURE = Pattern.compile("<" + USER_NAME + ">");
    private static final Pattern BODY_LIST = Pattern.compile("\\{" + USER_NAME + "\\}");
    private static final Pattern BODY_SETTING = Pattern.compile("settings\\.get\\s*\\(\\s*[\"']([^\"']+)[\"']\\s*\\)");
    private static final Pattern BODY_TAG = Pattern.compile("\\btag\\(\\)\\s*:\\s*" + USER_NAME);

    private static final Map<Pattern, String> BODY_REQUIREMENTS = new LinkedHashMap<>();
    static {
        BODY_REQUIREMENTS.put(Pattern.compile("\\bgamepad\\s*\\("), "gamepad");
        BODY_REQUIREMENTS.put(Pattern.compile("\\bdeck\\s*\\("), "streamDeck");
        BODY_REQUIREMENTS.put(Pattern.compile("\\bparrot\\s*\\("), "parrot");
        BODY_REQUIREMENTS.put(Pattern.compile("\\bface\\s*\\("), "webcam");
    }

    private static final String[] BETA_MARKERS = {"parrot(", "face(", "deck("};

    private static Pattern header(String key, String value) {
        return Pattern.compile("^\\s*(?:and\\s+|not\\s+)?" + key + ":\\s+" + value, Pattern.MULTILINE);
    }

    @Override
    public String getDialect() {
        return DIALECT;
    }

    @Override
    public boolean supports(Path file) {
        return file.getFileName().toString().endsWith(".talon");
    }

    @Override
    public FileExtraction scan(Path relativePath, String content) {
        FileExtraction result = new FileExtraction(relativePath, DIALECT);
        String text = content.startsWith("\uFEFF") ? content.substring(1) : content;
        text = text.replace("\r\n", "\n");

        String header = "";
        String body = text;
        int separator = findSeparator(text);
        if (separator >= 0) {
            header = text.substring(0, separator);
            int bodyStart = text.indexOf('\n', separator);
            body = bodyStart >= 0 ? text.substring(bodyStart + 1) : "";
        }

        scanHeader(header, result);
        scanBody(body, result);

        String lower = text.toLowerCase(Locale.ROOT);
        for (String marker : BETA_MARKERS) {
            if (lower.contains(marker)) {
                result.addRequirement("talonBeta");
                break;
            }
        }
        return result;
    }

    /**
     * Offset of the first line consisting of a lone {@code -}, or -1.
     */
    static int findSeparator(String text) {
        int offset = 0;
        while (offset <= text.length()) {
            int end = text.indexOf('\n', offset);
            String line = end >= 0 ? text.substring(offset, end) : text.substring(offset);
            if (line.trim().equals("-")) {
                return offset;
            }
            if (end < 0) {
                break;
            }
            offset = end + 1;
        }
        return -1;
    }

    private void scanHeader(String header, FileExtraction result) {
        collect(HEADER_TAG, header, EntityKind.TAG, result);
        collect(HEADER_APP, header, EntityKind.APP, result);
        collect(HEADER_MODE, header, EntityKind.MODE, result);
        collect(HEADER_SCOPE, header, EntityKind.SCOPE, result);
        collect(BLOCK_SETTING, header, EntityKind.SETTING, result);
    }

    private void scanBody(String body, FileExtraction result) {
        Matcher action = BODY_ACTION.matcher(body);
        while (action.find()) {
            result.getReferenced().add(EntityKind.ACTION, "user." + action.group(1));
        }
        collect(BODY_CAPTURE, body, EntityKind.CAPTURE, result);
        collect(BODY_LIST, body, EntityKind.LIST, result);
        collect(BODY_SETTING, body, EntityKind.SETTING, result);
        collect(BODY_TAG, body, EntityKind.TAG, result);
        collect(BLOCK_SETTING, settingsBlocks(body), EntityKind.SETTING, result);

        for (Map.Entry<Pattern, String> requirement : BODY_REQUIREMENTS.entrySet()) {
            if (requirement.getKey().matcher(body).find()) {
                result.addRequirement(requirement.getValue());
            }
        }
    }

    /**
     * The indented lines following each {@code settings():} line of the body.
     */
    private static String settingsBlocks(String body) {
        StringBuilder blocks = new StringBuilder();
        boolean inBlock = false;
        for (String line : body.split("\n", -1)) {
            if (line.trim().equals("settings():")) {
                inBlock = true;
                continue;
            }
            if (inBlock) {
                if (line.trim().isEmpty()) {
                    continue;
                }
                if (Character.isWhitespace(line.charAt(0))) {
                    blocks.append(line).append('\n');
                } else {
                    inBlock = false;
                }
            }
        }
        return blocks.toString();
    }

    private static void collect(Pattern pattern, String text, EntityKind kind, FileExtraction result) {
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            result.getReferenced().add(kind, m.group(1));
        }
    }
}
