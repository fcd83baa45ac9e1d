package com.testtree.core;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Declaration of one configuration option.
 *
 * A single option is reachable three ways, each optional:
 *   - a command-line flag       e.g. {@code -output-json-file}
 *   - an environment variable   e.g. {@code TESTTREE_OUTPUT_JSON_FILE}
 *   - a config-file key         e.g. {@code output-json-file}
 *
 * {@link #standard} derives all three from the option name; use the builder to
 * choose other spellings or to leave a surface out.
 */
public final class ConfigOption {

    public static final String ENV_PREFIX = "TESTTREE_";

    private final String name;
    private final String defaultValue;
    private final String cliFlag;   // null = not settable from the command line
    private final String envVar;    // null = not settable from the environment
    private final String fileKey;   // null = not settable from the config file
    private final String help;

    private ConfigOption(Builder b) {
        this.name         = b.name;
        this.defaultValue = b.defaultValue;
        this.cliFlag      = b.cliFlag;
        this.envVar       = b.envVar;
        this.fileKey      = b.fileKey;
        this.help         = b.help;
    }

    /**
     * An option with the standard spellings: {@code -name}, {@code TESTTREE_NAME}
     * (dashes become underscores) and {@code name}.
     */
    public static ConfigOption standard(String name, String defaultValue, String help) {
        return builder(name)
            .defaultValue(defaultValue)
            .cliFlag("-" + name)
            .envVar(envVarFor(name))
            .fileKey(name)
            .help(help)
            .build();
    }

    static String envVarFor(String name) {
        return ENV_PREFIX + name.toUpperCase(Locale.ROOT).replace('-', '_');
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public String           getName()         { return name; }
    public String           getDefaultValue() { return defaultValue; }
    public Optional<String> getCliFlag()      { return Optional.ofNullable(cliFlag); }
    public Optional<String> getEnvVar()       { return Optional.ofNullable(envVar); }
    public Optional<String> getFileKey()      { return Optional.ofNullable(fileKey); }
    public String           getHelp()         { return help; }

    @Override
    public String toString() {
        return String.format("ConfigOption{name=%s, default='%s', cli=%s, env=%s, file=%s}",
            name, defaultValue, cliFlag, envVar, fileKey);
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder(String name) { return new Builder(name); }

    public static class Builder {
        private final String name;
        private String defaultValue = "";
        private String cliFlag;
        private String envVar;
        private String fileKey;
        private String help = "";

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "option name");
        }

        public Builder defaultValue(String v) { this.defaultValue = v; return this; }
        public Builder cliFlag(String f)      { this.cliFlag = f; return this; }
        public Builder envVar(String e)       { this.envVar = e; return this; }
        public Builder fileKey(String k)      { this.fileKey = k; return this; }
        public Builder help(String h)         { this.help = h; return this; }

        public ConfigOption build() {
            if (name.isBlank()) {
                throw new ConfigurationException("Option name must not be blank");
            }
            if (defaultValue == null) {
                throw new ConfigurationException("Option '" + name + "' needs a non-null default");
            }
            if (cliFlag != null && !cliFlag.startsWith("-")) {
                throw new ConfigurationException(
                    "CLI flag for option '" + name + "' must start with '-': " + cliFlag);
            }
            return new ConfigOption(this);
        }
    }
}
