package com.testtree.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses the plain-text config file format:
 *
 * <pre>
 *   # comment lines and trailing comments are ignored
 *   display = false
 *   output-json-file = target/testtree-report.json   # written after the run
 * </pre>
 *
 * One {@code key = value} per line; everything from {@code #} on is dropped; key and
 * value are trimmed; blank lines are skipped. The value is everything after the first
 * {@code =}. When a key repeats, the last line wins.
 */
public final class ConfigFileParser {

    private ConfigFileParser() {}

    public static Map<String, String> parse(String contents) {
        Map<String, String> values = new LinkedHashMap<>();
        if (contents == null || contents.isEmpty()) {
            return values;
        }

        int lineNumber = 0;
        for (String raw : contents.split("\n", -1)) {
            lineNumber++;
            String line = stripComment(raw).strip();
            if (line.isEmpty()) continue;

            int eq = line.indexOf('=');
            if (eq < 0) {
                throw new ConfigurationException(
                    "Config line " + lineNumber + " is not of the form 'key = value': " + raw.strip());
            }
            String key = line.substring(0, eq).strip();
            if (key.isEmpty()) {
                throw new ConfigurationException("Config line " + lineNumber + " has an empty key");
            }
            values.put(key, line.substring(eq + 1).strip());
        }
        return values;
    }

    public static Map<String, String> parse(Path file) {
        try {
            return parse(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigurationException("Could not read config file " + file + ": " + e.getMessage(), e);
        }
    }

    static String stripComment(String line) {
        int hash = line.indexOf('#');
        return hash < 0 ? line : line.substring(0, hash);
    }
}
