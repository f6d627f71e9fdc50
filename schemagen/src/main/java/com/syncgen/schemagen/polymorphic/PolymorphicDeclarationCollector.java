package com.syncgen.schemagen.polymorphic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Recovers explicit polymorphic target lists from {@code declarePolymorphicRelationships({...})}
 * calls in existing TypeScript sources.
 * <p>
 * The argument object is located with a bracket-balanced scan that ignores braces inside string
 * literals and comments. Commented-out calls are ignored.
 */
public class PolymorphicDeclarationCollector {
    private static final Logger logger = LoggerFactory.getLogger(PolymorphicDeclarationCollector.class);

    private static final Pattern CALL_START = Pattern.compile("declarePolymorphicRelationships\\s*\\(\\s*\\{");
    private static final Pattern TABLE_NAME = Pattern.compile("tableName\\s*:\\s*['\"`]([^'\"`]+)['\"`]");
    private static final Pattern ENTRY_START = Pattern.compile("(\\w+)\\s*:\\s*\\{");
    private static final Pattern TYPE_FIELD = Pattern.compile("typeField\\s*:\\s*['\"`]([^'\"`]+)['\"`]");
    private static final Pattern ID_FIELD = Pattern.compile("idField\\s*:\\s*['\"`]([^'\"`]+)['\"`]");
    private static final Pattern ALLOWED_TYPES = Pattern.compile("allowedTypes\\s*:\\s*\\[([^\\]]*)\\]");
    private static final Pattern QUOTED = Pattern.compile("['\"`]([^'\"`]+)['\"`]");

    private static final List<String> SKIPPED_PATH_PARTS = List.of("reactive-", "/types/", "/base/");

    private final List<String> warnings = new ArrayList<>();

    public PolymorphicDeclarations collect(List<Path> roots) throws IOException {
        PolymorphicDeclarations declarations = new PolymorphicDeclarations();
        for (Path root : roots) {
            if (!Files.isDirectory(root)) {
                logger.debug("Declaration source {} does not exist", root);
                continue;
            }
            List<Path> files;
            try (Stream<Path> walk = Files.walk(root)) {
                files = walk.filter(Files::isRegularFile)
                        .filter(p -> p.getFileName().toString().endsWith(".ts"))
                        .filter(p -> !p.getFileName().toString().endsWith(".d.ts"))
                        .filter(p -> SKIPPED_PATH_PARTS.stream()
                                .noneMatch(part -> p.toString().replace('\\', '/').contains(part)))
                        .sorted()
                        .toList();
            }
            for (Path file : files) {
                collectFromText(Files.readString(file), file.toString()).forEach(declarations::add);
            }
        }
        logger.info("Collected {} polymorphic declarations across {} tables",
                declarations.all().size(), declarations.tableCount());
        return declarations;
    }

    public List<PolymorphicDeclaration> collectFromText(String content, String source) {
        List<PolymorphicDeclaration> result = new ArrayList<>();
        String text = blankComments(content);
        Matcher call = CALL_START.matcher(text);
        int from = 0;
        while (call.find(from)) {
            int open = call.end() - 1;
            int close = matchingBrace(text, open);
            if (close < 0) {
                warn("Unbalanced declarePolymorphicRelationships call in " + source);
                break;
            }
            result.addAll(parseDeclaration(text.substring(open + 1, close), source));
            from = close + 1;
        }
        return result;
    }

    public List<String> warnings() {
        return List.copyOf(warnings);
    }

    private List<PolymorphicDeclaration> parseDeclaration(String body, String source) {
        Matcher tableName = TABLE_NAME.matcher(body);
        if (!tableName.find()) {
            warn("declarePolymorphicRelationships call without tableName in " + source);
            return List.of();
        }
        String table = tableName.group(1);

        List<PolymorphicDeclaration> result = new ArrayList<>();
        for (PolymorphicDeclaration.Side side : PolymorphicDeclaration.Side.values()) {
            Matcher sideStart = Pattern.compile("\\b" + side.key() + "\\s*:\\s*\\{").matcher(body);
            if (!sideStart.find()) continue;
            int open = sideStart.end() - 1;
            int close = matchingBrace(body, open);
            if (close < 0) continue;
            result.addAll(parseEntries(table, side, body.substring(open + 1, close), source));
        }
        return result;
    }

    private List<PolymorphicDeclaration> parseEntries(String table, PolymorphicDeclaration.Side side,
                                                      String body, String source) {
        List<PolymorphicDeclaration> result = new ArrayList<>();
        Matcher entry = ENTRY_START.matcher(body);
        int from = 0;
        while (entry.find(from)) {
            String association = entry.group(1);
            int open = entry.end() - 1;
            int close = matchingBrace(body, open);
            if (close < 0) break;
            String entryBody = body.substring(open + 1, close);

            String typeField = firstGroup(TYPE_FIELD, entryBody, association + "_type");
            String idField = firstGroup(ID_FIELD, entryBody, association + "_id");
            List<String> allowed = new ArrayList<>();
            Matcher allowedTypes = ALLOWED_TYPES.matcher(entryBody);
            if (allowedTypes.find()) {
                Matcher quoted = QUOTED.matcher(allowedTypes.group(1));
                while (quoted.find()) {
                    allowed.add(quoted.group(1));
                }
            }
            result.add(new PolymorphicDeclaration(table, association, side, typeField, idField, allowed, source));
            from = close + 1;
        }
        return result;
    }

    private static String firstGroup(Pattern pattern, String text, String fallback) {
        Matcher m = pattern.matcher(text);
        return m.find() ? m.group(1) : fallback;
    }

    /**
     * Index of the brace closing the one at {@code open}, or -1. Braces inside string and
     * template literals are ignored.
     */
    static int matchingBrace(String text, int open) {
        int depth = 0;
        char quote = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"' || c == '`') {
                quote = c;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    /**
     * Replaces line and block comments with spaces, keeping offsets and newlines intact.
     */
    static String blankComments(String text) {
        StringBuilder out = new StringBuilder(text);
        char quote = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            char next = i + 1 < text.length() ? text.charAt(i + 1) : 0;
            if (quote != 0) {
                if (c == '\\') {
                    i += 2;
                    continue;
                }
                if (c == quote) quote = 0;
                i++;
            } else if (c == '\'' || c == '"' || c == '`') {
                quote = c;
                i++;
            } else if (c == '/' && next == '/') {
                while (i < text.length() && text.charAt(i) != '\n') {
                    out.setCharAt(i, ' ');
                    i++;
                }
            } else if (c == '/' && next == '*') {
                int end = text.indexOf("*/", i + 2);
                int stop = end < 0 ? text.length() : end + 2;
                for (int j = i; j < stop; j++) {
                    if (text.charAt(j) != '\n') out.setCharAt(j, ' ');
                }
                i = stop;
            } else {
                i++;
            }
        }
        return out.toString();
    }

    private void warn(String message) {
        logger.warn(message);
        warnings.add(message);
    }
}
