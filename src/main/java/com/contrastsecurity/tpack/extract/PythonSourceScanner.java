package com.contrastsecurity.tpack.extract;

import com.contrastsecurity.tpack.model.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scanner for {@code .py} files.
 *
 * The file is parsed with tree-sitter. Declarations are only recognised in their structural
 * position (decorated classes and functions, registration calls, app assignments). If the
 * syntax tree contains errors the scanner falls back to a textual search that only records
 * references.
 */
public class PythonSourceScanner implements SourceScanner {
    private static final Logger logger = LoggerFactory.getLogger(PythonSourceScanner.class);

    public static final String DIALECT = "python";

    /**
     * Action namespaces whose references are tracked as dependencies.
     */
    public static final Set<String> ACTION_NAMESPACES = Collections.unmodifiableSet(
            new HashSet<>(Arrays.asList("user", "edit", "core", "app", "code")));

    private static final Map<String, EntityKind> REGISTRATION_CALLS = new HashMap<>();
    static {
        REGISTRATION_CALLS.put("setting", EntityKind.SETTING);
        REGISTRATION_CALLS.put("tag", EntityKind.TAG);
        REGISTRATION_CALLS.put("mode", EntityKind.MODE);
        REGISTRATION_CALLS.put("list", EntityKind.LIST);
    }

    static final Pattern MATCHES_PATTERN = Pattern.compile("(mode|tag):\\s*([\\w.]+)");

    private static final Pattern FALLBACK_ACTION = Pattern.compile(
            "\\bactions\\.([A-Za-z_]\\w*)\\.([A-Za-z_]\\w*)");
    private static final Pattern FALLBACK_SETTING = Pattern.compile(
            "\\bsettings\\.get\\(\\s*[\"']([^\"']+)[\"']");
    private static final Pattern FALLBACK_TAGS = Pattern.compile(
            "\\.tags\\s*=\\s*\\[([^\\]]*)\\]");
    private static final Pattern QUOTED = Pattern.compile("[\"']([^\"']+)[\"']");

    private final TSLanguage language = new TreeSitterPython();

    @Override
    public String getDialect() {
        return DIALECT;
    }

    @Override
    public boolean supports(Path file) {
        return file.getFileName().toString().endsWith(".py");
    }

    @Override
    public FileExtraction scan(Path relativePath, String content) {
        FileExtraction result = new FileExtraction(relativePath, DIALECT);
        String source = content.startsWith("\uFEFF") ? content.substring(1) : content;
        byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
        TSTree tree;
        try {
            tree = parse(source);
        } catch (ParseDegradedException e) {
            logger.info("Falling back to textual scan of {}: {}", relativePath, e.getMessage());
            result.markDegraded(e.getMessage());
            scanText(source, result);
            return result;
        }
        new TreeWalker(result, tree, bytes).walk();
        return result;
    }

    private TSTree parse(String source) throws ParseDegradedException {
        // TSParser is not threadsafe, so each scan gets its own
        TSParser parser = new TSParser();
        if (!parser.setLanguage(language)) {
            throw new IllegalStateException("Could not load the tree-sitter Python grammar");
        }
        TSTree tree = parser.parseString(null, source);
        TSNode root = tree.getRootNode();
        if (root.isNull()) {
            throw new ParseDegradedException("empty syntax tree", 1);
        }
        if (root.hasError()) {
            TSNode error = firstError(root);
            int line = error != null ? error.getStartPoint().getRow() + 1 : 1;
            throw new ParseDegradedException("syntax error", line);
        }
        return tree;
    }

    private static TSNode firstError(TSNode node) {
        if ("ERROR".equals(node.getType()) || node.isMissing()) {
            return node;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (child.hasError() || child.isMissing()) {
                TSNode found = firstError(child);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    /**
     * Reference-only scan of raw text. Declarations are never recovered this way.
     */
    static void scanText(String content, FileExtraction result) {
        Matcher action = FALLBACK_ACTION.matcher(content);
        while (action.find()) {
            recordActionReference(action.group(1), action.group(2), result);
        }

        Matcher setting = FALLBACK_SETTING.matcher(content);
        while (setting.find()) {
            result.getReferenced().add(EntityKind.SETTING, setting.group(1));
        }

        Matcher tags = FALLBACK_TAGS.matcher(content);
        while (tags.find()) {
            Matcher quoted = QUOTED.matcher(tags.group(1));
            while (quoted.find()) {
                result.getReferenced().add(EntityKind.TAG, quoted.group(1));
            }
        }

        recordMatches(content, result);
    }

    static void recordActionReference(String namespace, String name, FileExtraction result) {
        if ("tracking".equals(namespace)) {
            result.addRequirement("eyeTracker");
        }
        if (ACTION_NAMESPACES.contains(namespace)) {
            result.getReferenced().add(EntityKind.ACTION, namespace + "." + name);
        }
    }

    static void recordMatches(String text, FileExtraction result) {
        Matcher m = MATCHES_PATTERN.matcher(text);
        while (m.find()) {
            EntityKind kind = "mode".equals(m.group(1)) ? EntityKind.MODE : EntityKind.TAG;
            result.getReferenced().add(kind, m.group(2));
        }
    }

    private enum ActionClassMode {
        NONE,
        DECLARE,
        OVERRIDE
    }

    /**
     * Visits every node of the syntax tree once, recording declarations and references.
     */
    private static class TreeWalker {
        private final FileExtraction result;
        private final TSTree tree;
        private final byte[] source;

        TreeWalker(FileExtraction result, TSTree tree, byte[] source) {
            this.result = result;
            this.tree = tree;
            this.source = source;
        }

        void walk() {
            visit(tree.getRootNode());
        }

        void visit(TSNode node) {
            switch (node.getType()) {
                case "decorated_definition":
                    handleDecoratedDefinition(node);
                    break;
                case "call":
                    handleCall(node);
                    break;
                case "attribute":
                    handleAttribute(node);
                    break;
                case "subscript":
                    handleSubscript(node);
                    break;
                case "assignment":
                    handleAssignment(node);
                    break;
                default:
                    break;
            }
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                visit(node.getNamedChild(i));
            }
        }

        private void handleDecoratedDefinition(TSNode node) {
            TSNode definition = field(node, "definition");
            if (definition == null) {
                return;
            }
            List<TSNode> decorators = new ArrayList<>();
            for (int i = 0; i < node.getNamedChildCount(); i++) {
                TSNode child = node.getNamedChild(i);
                if ("decorator".equals(child.getType()) && child.getNamedChildCount() > 0) {
                    decorators.add(child.getNamedChild(0));
                }
            }

            if ("class_definition".equals(definition.getType())) {
                handleActionClass(definition, decorators);
            } else if ("function_definition".equals(definition.getType())) {
                handleDecoratedFunction(definition, decorators);
            }
        }

        private void handleActionClass(TSNode classNode, List<TSNode> decorators) {
            ActionClassMode mode = ActionClassMode.NONE;
            String context = null;
            for (TSNode decorator : decorators) {
                if (isMemberAccess(decorator, "action_class")) {
                    mode = ActionClassMode.DECLARE;
                    break;
                }
                if ("call".equals(decorator.getType()) && isMemberAccess(field(decorator, "function"), "action_class")) {
                    context = firstStringArgument(decorator);
                    if (context != null) {
                        mode = ActionClassMode.OVERRIDE;
                        break;
                    }
                }
            }
            if (mode == ActionClassMode.NONE) {
                return;
            }

            TSNode body = field(classNode, "body");
            if (body == null) {
                return;
            }
            for (int i = 0; i < body.getNamedChildCount(); i++) {
                String name = functionName(body.getNamedChild(i));
                if (name == null) {
                    continue;
                }
                if (mode == ActionClassMode.DECLARE) {
                    result.getDeclared().add(EntityKind.ACTION, "user." + name);
                } else {
                    result.getReferenced().add(EntityKind.ACTION, context + "." + name);
                }
            }
        }

        private void handleDecoratedFunction(TSNode function, List<TSNode> decorators) {
            String name = text(field(function, "name"));
            for (TSNode decorator : decorators) {
                if (!"call".equals(decorator.getType())) {
                    continue;
                }
                TSNode callee = field(decorator, "function");
                if (isMemberAccess(callee, "action")) {
                    String declared = firstStringArgument(decorator);
                    if (declared != null) {
                        result.getDeclared().add(EntityKind.ACTION, declared);
                    }
                } else if (isMemberAccess(callee, "capture") && name != null) {
                    result.getDeclared().add(EntityKind.CAPTURE, "user." + name);
                }
            }
        }

        private void handleCall(TSNode call) {
            TSNode callee = field(call, "function");
            if (callee == null || !"attribute".equals(callee.getType())) {
                return;
            }
            String member = text(field(callee, "attribute"));
            TSNode receiver = field(callee, "object");
            if (receiver != null && "attribute".equals(receiver.getType())
                    && isIdentifier(field(receiver, "object"), "actions")) {
                return;
            }

            // settings.get("name")
            if ("get".equals(member) && isIdentifier(receiver, "settings")) {
                String name = firstStringArgument(call);
                if (name != null) {
                    result.getReferenced().add(EntityKind.SETTING, name);
                }
                return;
            }

            // <x>.setting("name"), <x>.tag(name="name") and friends
            EntityKind kind = REGISTRATION_CALLS.get(member);
            if (kind != null) {
                String name = firstStringArgument(call);
                if (name == null) {
                    name = keywordArgument(call, "name");
                }
                if (name != null) {
                    result.getDeclared().add(kind, "user." + name);
                }
                return;
            }

            if ("dynamic_list".equals(member) && isContext(receiver)) {
                result.addRequirement("talonBeta");
            }
        }

        // actions.<ns>.<name>
        private void handleAttribute(TSNode attribute) {
            TSNode receiver = field(attribute, "object");
            if (receiver == null || !"attribute".equals(receiver.getType())
                    || !isIdentifier(field(receiver, "object"), "actions")) {
                return;
            }
            String namespace = text(field(receiver, "attribute"));
            String name = text(field(attribute, "attribute"));
            if (namespace != null && name != null) {
                recordActionReference(namespace, name, result);
            }
        }

        // <x>.lists["name"] and ctx.selections[...]
        private void handleSubscript(TSNode subscript) {
            TSNode value = field(subscript, "value");
            if (value == null || !"attribute".equals(value.getType())) {
                return;
            }
            String member = text(field(value, "attribute"));
            if ("lists".equals(member)) {
                String name = stringValue(field(subscript, "subscript"));
                if (name != null) {
                    result.getReferenced().add(EntityKind.LIST, name);
                }
            } else if ("selections".equals(member) && isContext(field(value, "object"))) {
                result.addRequirement("talonBeta");
            }
        }

        private void handleAssignment(TSNode assignment) {
            TSNode target = field(assignment, "left");
            TSNode value = field(assignment, "right");
            if (target == null || !"attribute".equals(target.getType())) {
                return;
            }
            String attribute = text(field(target, "attribute"));
            TSNode owner = field(target, "object");

            // <x>.apps.<name> = ...
            if (owner != null && isMemberAccess(owner, "apps")) {
                result.getDeclared().add(EntityKind.APP, attribute);
                return;
            }
            if (value == null) {
                return;
            }
            if ("tags".equals(attribute) && "list".equals(value.getType())) {
                for (int i = 0; i < value.getNamedChildCount(); i++) {
                    String tag = stringValue(value.getNamedChild(i));
                    if (tag != null) {
                        result.getReferenced().add(EntityKind.TAG, tag);
                    }
                }
            } else if ("matches".equals(attribute)) {
                String matches = stringValue(value);
                if (matches != null) {
                    recordMatches(matches, result);
                }
            }
        }

        private String functionName(TSNode member) {
            TSNode function = member;
            if ("decorated_definition".equals(member.getType())) {
                function = field(member, "definition");
            }
            if (function == null || !"function_definition".equals(function.getType())) {
                return null;
            }
            return text(field(function, "name"));
        }

        /**
         * The first call argument if it is a plain string literal.
         */
        private String firstStringArgument(TSNode call) {
            TSNode arguments = field(call, "arguments");
            if (arguments == null || arguments.getNamedChildCount() == 0) {
                return null;
            }
            return usableName(stringValue(arguments.getNamedChild(0)));
        }

        private String keywordArgument(TSNode call, String keyword) {
            TSNode arguments = field(call, "arguments");
            if (arguments == null) {
                return null;
            }
            for (int i = 0; i < arguments.getNamedChildCount(); i++) {
                TSNode argument = arguments.getNamedChild(i);
                if ("keyword_argument".equals(argument.getType())
                        && keyword.equals(text(field(argument, "name")))) {
                    return usableName(stringValue(field(argument, "value")));
                }
            }
            return null;
        }

        /**
         * Literal contents of a string or implicitly concatenated strings, null for anything
         * interpolated or not a string.
         */
        private String stringValue(TSNode node) {
            if (node == null) {
                return null;
            }
            if ("concatenated_string".equals(node.getType())) {
                StringBuilder joined = new StringBuilder();
                for (int i = 0; i < node.getNamedChildCount(); i++) {
                    String part = stringValue(node.getNamedChild(i));
                    if (part == null) {
                        return null;
                    }
                    joined.append(part);
                }
                return joined.toString();
            }
            if (!"string".equals(node.getType())) {
                return null;
            }

            int start = -1;
            int end = -1;
            for (int i = 0; i < node.getChildCount(); i++) {
                TSNode child = node.getChild(i);
                String type = child.getType();
                if ("interpolation".equals(type)) {
                    return null;
                } else if ("string_start".equals(type)) {
                    start = child.getEndByte();
                } else if ("string_end".equals(type)) {
                    end = child.getStartByte();
                }
            }
            if (start < 0 || end < start) {
                return null;
            }
            return slice(start, end);
        }

        private boolean isMemberAccess(TSNode node, String member) {
            return node != null && "attribute".equals(node.getType())
                    && member.equals(text(field(node, "attribute")));
        }

        private boolean isIdentifier(TSNode node, String name) {
            return node != null && "identifier".equals(node.getType()) && name.equals(text(node));
        }

        private boolean isContext(TSNode node) {
            return node != null && "identifier".equals(node.getType())
                    && text(node).toLowerCase().contains("ctx");
        }

        private static TSNode field(TSNode node, String name) {
            if (node == null) {
                return null;
            }
            TSNode child = node.getChildByFieldName(name);
            return child == null || child.isNull() ? null : child;
        }

        private String text(TSNode node) {
            if (node == null) {
                return null;
            }
            return slice(node.getStartByte(), node.getEndByte());
        }

        // Node offsets are UTF-8 byte offsets
        private String slice(int start, int end) {
            int to = Math.min(end, source.length);
            return new String(source, start, Math.max(0, to - start), StandardCharsets.UTF_8);
        }

        // Interpolated names cannot be known statically
        private static String usableName(String text) {
            if (text == null || text.isEmpty() || text.indexOf('{') >= 0) {
                return null;
            }
            return text;
        }
    }
}
