package com.testtree.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declarative registry of configuration options.
 *
 * Lifecycle has two phases:
 *   1. declare -- suites and the framework register every option they read
 *   2. resolve -- one pass over CLI values, environment and config file produces an
 *                 immutable {@link ResolvedConfig} that is handed to every test
 *
 * Precedence, highest first: CLI flag, environment variable, config-file key, default.
 *
 * Declaring the same name twice throws {@link ConfigurationException}: two owners of
 * one option would make the configuration surface ambiguous.
 */
public class ConfigRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConfigRegistry.class);

    private static final ConfigRegistry GLOBAL = new ConfigRegistry();

    private final Map<String, ConfigOption> options = new LinkedHashMap<>();

    /** The process-wide registry used by {@link com.testtree.cli.TestMain}. */
    public static ConfigRegistry global() {
        return GLOBAL;
    }

    // ── Declaration ───────────────────────────────────────────────────────────

    public synchronized ConfigOption declare(ConfigOption option) {
        String name = option.getName();
        if (options.containsKey(name)) {
            throw new ConfigurationException(
                "Configuration option '" + name + "' is declared twice: " +
                options.get(name) + " and " + option);
        }
        checkSpellingUnique(option);
        options.put(name, option);
        log.debug("ConfigRegistry: declared {}", option);
        return option;
    }

    /** Declares an option with the standard CLI, environment and file spellings. */
    public ConfigOption declare(String name, String defaultValue, String help) {
        return declare(ConfigOption.standard(name, defaultValue, help));
    }

    public synchronized boolean isDeclared(String name) {
        return options.containsKey(name);
    }

    /** All declared options in declaration order. */
    public synchronized List<ConfigOption> getOptions() {
        return Collections.unmodifiableList(new ArrayList<>(options.values()));
    }

    public synchronized Optional<ConfigOption> findByCliFlag(String flag) {
        return options.values().stream()
            .filter(o -> o.getCliFlag().map(flag::equals).orElse(false))
            .findFirst();
    }

    // ── Resolution ────────────────────────────────────────────────────────────

    /**
     * Resolves every declared option.
     *
     * @param cliValues    values given on the command line, keyed by CLI flag spelling
     * @param environment  process environment (blank values count as unset)
     * @param fileContents raw config-file text; null or empty when there is no file
     * @return an immutable snapshot
     * @throws ConfigurationException when the config file is malformed
     */
    public ResolvedConfig resolve(Map<String, String> cliValues,
                                  Map<String, String> environment,
                                  String fileContents) {
        return resolve(cliValues, environment, ConfigFileParser.parse(fileContents));
    }

    public synchronized ResolvedConfig resolve(Map<String, String> cliValues,
                                               Map<String, String> environment,
                                               Map<String, String> fileValues) {
        warnUnknownFileKeys(fileValues);

        Map<String, ResolvedConfig.Value> resolved = new LinkedHashMap<>();
        for (ConfigOption option : options.values()) {
            resolved.put(option.getName(), resolveOne(option, cliValues, environment, fileValues));
        }

        log.debug("ConfigRegistry: resolved {} option(s): {}", resolved.size(), resolved);
        return new ResolvedConfig(resolved);
    }

    private ResolvedConfig.Value resolveOne(ConfigOption option,
                                            Map<String, String> cliValues,
                                            Map<String, String> environment,
                                            Map<String, String> fileValues) {
        Optional<String> flag = option.getCliFlag();
        if (flag.isPresent() && cliValues.containsKey(flag.get())) {
            return new ResolvedConfig.Value(cliValues.get(flag.get()), ResolvedConfig.Source.CLI);
        }

        Optional<String> env = option.getEnvVar();
        if (env.isPresent()) {
            String val = environment.get(env.get());
            if (val != null && !val.isBlank()) {
                return new ResolvedConfig.Value(val.strip(), ResolvedConfig.Source.ENVIRONMENT);
            }
        }

        Optional<String> key = option.getFileKey();
        if (key.isPresent() && fileValues.containsKey(key.get())) {
            return new ResolvedConfig.Value(fileValues.get(key.get()), ResolvedConfig.Source.FILE);
        }

        return new ResolvedConfig.Value(option.getDefaultValue(), ResolvedConfig.Source.DEFAULT);
    }

    private void warnUnknownFileKeys(Map<String, String> fileValues) {
        for (String key : fileValues.keySet()) {
            boolean known = options.values().stream()
                .anyMatch(o -> o.getFileKey().map(key::equals).orElse(false));
            if (!known) {
                log.warn("ConfigRegistry: config file key '{}' matches no declared option -- ignored", key);
            }
        }
    }

    private void checkSpellingUnique(ConfigOption option) {
        for (ConfigOption existing : options.values()) {
            if (sameSpelling(existing.getCliFlag(), option.getCliFlag())
                    || sameSpelling(existing.getEnvVar(), option.getEnvVar())
                    || sameSpelling(existing.getFileKey(), option.getFileKey())) {
                throw new ConfigurationException(
                    "Option '" + option.getName() + "' reuses a spelling of option '" +
                    existing.getName() + "'");
            }
        }
    }

    private static boolean sameSpelling(Optional<String> a, Optional<String> b) {
        return a.isPresent() && a.equals(b);
    }
}
