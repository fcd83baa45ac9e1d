package com.testtree.core;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of every declared option's value, produced by
 * {@link ConfigRegistry#resolve}. Shared read-only by every test of a run.
 *
 * Looking up a name that was never declared throws {@link ConfigurationException}.
 */
public final class ResolvedConfig {

    /** Which layer supplied a value. */
    public enum Source { CLI, ENVIRONMENT, FILE, DEFAULT }

    public record Value(String value, Source source) {
        @Override
        public String toString() {
            return value + " (" + source + ")";
        }
    }

    private static final ResolvedConfig EMPTY = new ResolvedConfig(Map.of());

    private final Map<String, Value> values;

    ResolvedConfig(Map<String, Value> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /** A snapshot with no options; any lookup fails. */
    public static ResolvedConfig empty() {
        return EMPTY;
    }

    // ── Lookup ────────────────────────────────────────────────────────────────

    public String get(String name) {
        return lookup(name).value();
    }

    public Source source(String name) {
        return lookup(name).source();
    }

    public int getInt(String name) {
        String val = get(name);
        try {
            return Integer.parseInt(val.strip());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                "Option '" + name + "' expects an integer but was '" + val + "'", e);
        }
    }

    /** Accepts true/false, yes/no and 1/0, case-insensitively. */
    public boolean getBoolean(String name) {
        String val = get(name).strip().toLowerCase(Locale.ROOT);
        switch (val) {
            case "true": case "yes": case "1": return true;
            case "false": case "no": case "0": return false;
            default:
                throw new ConfigurationException(
                    "Option '" + name + "' expects a boolean but was '" + get(name) + "'");
        }
    }

    /** Empty when the value is blank. */
    public Optional<Path> getPath(String name) {
        String val = get(name);
        return val.isBlank() ? Optional.empty() : Optional.of(Paths.get(val.strip()));
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public Map<String, Value> asMap() {
        return values;
    }

    private Value lookup(String name) {
        Value v = values.get(name);
        if (v == null) {
            throw new ConfigurationException("Configuration option '" + name + "' was never declared");
        }
        return v;
    }

    @Override
    public String toString() {
        return "ResolvedConfig" + values;
    }
}
