package com.syncgen.schemagen.naming;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * English inflection and identifier casing used for table, accessor and function names.
 * <p>
 * Rules are tried in order and the first match wins. Only the last underscore-separated
 * word of a compound name is inflected, so {@code front_messages} singularizes to
 * {@code front_message}.
 */
public final class Inflector {
    private Inflector() {}

    private static final Set<String> UNCOUNTABLE = Set.of(
            "equipment", "information", "rice", "money", "species", "series",
            "fish", "sheep", "jeans", "police", "news", "metadata", "feedback");

    private static final Map<String, String> IRREGULAR = new LinkedHashMap<>();

    static {
        IRREGULAR.put("person", "people");
        IRREGULAR.put("man", "men");
        IRREGULAR.put("woman", "women");
        IRREGULAR.put("child", "children");
        IRREGULAR.put("sex", "sexes");
        IRREGULAR.put("move", "moves");
        IRREGULAR.put("zombie", "zombies");
        IRREGULAR.put("mouse", "mice");
        IRREGULAR.put("ox", "oxen");
    }

    private static final List<Rule> PLURAL = List.of(
            new Rule("(quiz)$", "$1zes"),
            new Rule("^(oxen)$", "$1"),
            new Rule("(matr|vert|ind)(?:ix|ex)$", "$1ices"),
            new Rule("(x|ch|ss|sh)$", "$1es"),
            new Rule("([^aeiouy]|qu)y$", "$1ies"),
            new Rule("(hive)$", "$1s"),
            new Rule("(?:([^f])fe|([lr])f)$", "$1$2ves"),
            new Rule("sis$", "ses"),
            new Rule("([ti])a$", "$1a"),
            new Rule("([ti])um$", "$1a"),
            new Rule("(buffal|tomat)o$", "$1oes"),
            new Rule("(bu)s$", "$1ses"),
            new Rule("(alias|status)$", "$1es"),
            new Rule("(octop|vir)(?:us|i)$", "$1i"),
            new Rule("(ax|test)is$", "$1es"),
            new Rule("s$", "s"),
            new Rule("$", "s"));

    private static final List<Rule> SINGULAR = List.of(
            new Rule("(database)s$", "$1"),
            new Rule("(quiz)zes$", "$1"),
            new Rule("(matr)ices$", "$1ix"),
            new Rule("(vert|ind)ices$", "$1ex"),
            new Rule("^(ox)en", "$1"),
            new Rule("(alias|status)(?:es)?$", "$1"),
            new Rule("(octop|vir)(?:us|i)$", "$1us"),
            new Rule("^(a)x[ie]s$", "$1xis"),
            new Rule("(cris|test)(?:is|es)$", "$1is"),
            new Rule("(shoe)s$", "$1"),
            new Rule("(o)es$", "$1"),
            new Rule("(bus)(?:es)?$", "$1"),
            new Rule("(m|l)ice$", "$1ouse"),
            new Rule("(x|ch|ss|sh)es$", "$1"),
            new Rule("(m)ovies$", "$1ovie"),
            new Rule("(s)eries$", "$1eries"),
            new Rule("([^aeiouy]|qu)ies$", "$1y"),
            new Rule("([lr])ves$", "$1f"),
            new Rule("(tive)s$", "$1"),
            new Rule("(hive)s$", "$1"),
            new Rule("([^f])ves$", "$1fe"),
            new Rule("(^analy)(?:sis|ses)$", "$1sis"),
            new Rule("((a)naly|(b)a|(d)iagno|(p)arenthe|(p)rogno|(s)ynop|(t)he)(?:sis|ses)$", "$1sis"),
            new Rule("([ti])a$", "$1um"),
            new Rule("(n)ews$", "$1ews"),
            new Rule("(ss)$", "$1"),
            new Rule("(us)$", "$1"),
            new Rule("s$", ""));

    public static String pluralize(String word) {
        return inflect(word, PLURAL, true);
    }

    public static String singularize(String word) {
        return inflect(word, SINGULAR, false);
    }

    private static String inflect(String word, List<Rule> rules, boolean plural) {
        if (word == null || word.isEmpty()) return word;
        int split = word.lastIndexOf('_');
        String prefix = split >= 0 ? word.substring(0, split + 1) : "";
        String last = split >= 0 ? word.substring(split + 1) : word;
        String lower = last.toLowerCase(Locale.ROOT);

        if (UNCOUNTABLE.contains(lower)) return word;

        for (Map.Entry<String, String> irregular : IRREGULAR.entrySet()) {
            String from = plural ? irregular.getKey() : irregular.getValue();
            String to = plural ? irregular.getValue() : irregular.getKey();
            if (lower.equals(from)) return prefix + matchCase(last, to);
            if (lower.equals(to)) return word;
        }

        for (Rule rule : rules) {
            Matcher m = rule.pattern.matcher(last);
            if (m.find()) {
                return prefix + m.replaceFirst(rule.replacement);
            }
        }
        return word;
    }

    private static String matchCase(String original, String replacement) {
        if (!original.isEmpty() && Character.isUpperCase(original.charAt(0))) {
            return Character.toUpperCase(replacement.charAt(0)) + replacement.substring(1);
        }
        return replacement;
    }

    /** {@code notable_task} to {@code notableTask}. */
    public static String camelCase(String value) {
        String pascal = pascalCase(value);
        if (pascal.isEmpty()) return pascal;
        return Character.toLowerCase(pascal.charAt(0)) + pascal.substring(1);
    }

    /** {@code front_message} to {@code FrontMessage}. */
    public static String pascalCase(String value) {
        if (value == null || value.isEmpty()) return "";
        StringBuilder result = new StringBuilder();
        boolean capitalizeNext = true;
        for (char c : value.toCharArray()) {
            if (c == '_' || c == '-' || c == ' ' || c == '/') {
                capitalizeNext = true;
            } else if (capitalizeNext) {
                result.append(Character.toUpperCase(c));
                capitalizeNext = false;
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }

    /** {@code FrontMessage} to {@code front_message}. */
    public static String underscore(String value) {
        if (value == null || value.isEmpty()) return "";
        StringBuilder result = new StringBuilder();
        char[] chars = value.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            char c = chars[i];
            if (Character.isUpperCase(c)) {
                boolean prevLower = i > 0 && (Character.isLowerCase(chars[i - 1]) || Character.isDigit(chars[i - 1]));
                boolean nextLower = i + 1 < chars.length && Character.isLowerCase(chars[i + 1]);
                boolean prevUpper = i > 0 && Character.isUpperCase(chars[i - 1]);
                if (prevLower || (prevUpper && nextLower)) {
                    result.append('_');
                }
                result.append(Character.toLowerCase(c));
            } else if (c == '-' || c == ' ') {
                result.append('_');
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }

    /** {@code author_id} to {@code Author}, {@code first_name} to {@code First name}. */
    public static String humanize(String value) {
        if (value == null || value.isEmpty()) return "";
        String base = value.endsWith("_id") ? value.substring(0, value.length() - 3) : value;
        String spaced = base.replace('_', ' ').trim();
        if (spaced.isEmpty()) return "";
        return Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1).toLowerCase(Locale.ROOT);
    }

    /** Table name to entity class name: {@code front_messages} to {@code FrontMessage}. */
    public static String classify(String tableName) {
        return pascalCase(singularize(tableName));
    }

    /** Entity class name to table name: {@code FrontMessage} to {@code front_messages}. */
    public static String tableize(String className) {
        return pluralize(underscore(className));
    }

    /** Splits a compound identifier into lower-case words. */
    public static List<String> words(String value) {
        List<String> result = new ArrayList<>();
        for (String part : underscore(value).split("_")) {
            if (!part.isEmpty()) result.add(part);
        }
        return result;
    }

    private static final class Rule {
        private final Pattern pattern;
        private final String replacement;

        private Rule(String regex, String replacement) {
            this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
            this.replacement = replacement;
        }
    }
}
