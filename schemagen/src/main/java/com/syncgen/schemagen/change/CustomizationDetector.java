package com.syncgen.schemagen.change;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flags hand edits in a previously generated file by comparing it with the fresh output.
 * Reports only; nothing is merged or preserved.
 */
public class CustomizationDetector {
    private static final Logger logger = LoggerFactory.getLogger(CustomizationDetector.class);

    public static final String BEGIN_MARKER = "// @generated-begin";
    public static final String END_MARKER = "// @generated-end";

    private static final Pattern EXPORT = Pattern.compile(
            "^export\\s+(?:async\\s+)?(?:const|let|function|type|interface|class|enum)\\s+(\\w+)", Pattern.MULTILINE);

    /**
     * @param existing current file content, or null when the file does not exist
     * @return one message per detected customization
     */
    public List<String> detect(String existing, String fresh) {
        if (existing == null || existing.equals(fresh)) {
            return List.of();
        }

        List<String> findings = new ArrayList<>();
        int begin = existing.indexOf(BEGIN_MARKER);
        int end = existing.lastIndexOf(END_MARKER);

        String region;
        if (begin < 0 || end < 0 || end < begin) {
            findings.add("Generated region markers are missing or out of order");
            region = existing;
        } else {
            if (!existing.substring(0, begin).isBlank()) {
                findings.add("Content before the generated region");
            }
            if (!existing.substring(end + END_MARKER.length()).isBlank()) {
                findings.add("Content after the generated region");
            }
            region = existing.substring(begin, end);
        }

        Set<String> freshLines = new HashSet<>();
        for (String line : fresh.split("\n")) {
            freshLines.add(line.strip());
        }

        for (String raw : region.split("\n")) {
            String line = raw.strip();
            if (freshLines.contains(line)) continue;
            if (line.startsWith("//") || line.startsWith("/*") || line.startsWith("*")) {
                findings.add("Custom comment: " + line);
            } else if (line.startsWith("import ")) {
                findings.add("Custom import: " + line);
            }
        }

        Set<String> freshExports = exports(fresh);
        for (String name : exports(region)) {
            if (!freshExports.contains(name)) {
                findings.add("Custom export: " + name);
            }
        }

        if (!findings.isEmpty()) {
            logger.debug("{} customizations detected", findings.size());
        }
        return findings;
    }

    private static Set<String> exports(String content) {
        Set<String> names = new LinkedHashSet<>();
        Matcher m = EXPORT.matcher(content);
        while (m.find()) {
            names.add(m.group(1));
        }
        return names;
    }
}
