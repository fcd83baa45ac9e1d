package com.testtree.cli;

import com.testtree.core.ConfigOption;
import com.testtree.core.ConfigRegistry;
import com.testtree.core.ConfigurationException;
import com.testtree.core.ResolvedConfig;
import com.testtree.core.StandardOptions;
import com.testtree.executor.RunListener;
import com.testtree.executor.TestRunner;
import com.testtree.model.ListedTest;
import com.testtree.model.TestNode;
import com.testtree.model.TestPath;
import com.testtree.report.ConsoleReporter;
import com.testtree.report.JsonReportWriter;
import com.testtree.report.RunReport;
import com.testtree.suite.SuiteRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Model.OptionSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParseResult;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line entry point.
 *
 * <pre>
 *   testtree [-only-test PATH]... [-list-test] [-help] [-conf FILE] [-OPTION VALUE]...
 * </pre>
 *
 *   -only-test PATH   run only the tests at or below the label path PATH (e.g.
 *                     {@code suite:comparator}); repeatable
 *   -list-test        print every test's label path and run nothing
 *   -help             print usage
 *   -conf FILE        read option values from FILE ({@code key = value} lines); also
 *                     {@code TESTTREE_CONF}
 *
 * Every declared {@link ConfigOption} adds its own flag. Exit status: 0 when every
 * test passed (or was skipped or todo), 1 when any failed or errored, 2 when the
 * command line or configuration is invalid. {@code -help} and {@code -list-test}
 * always exit 0.
 */
public final class TestMain {

    private static final Logger log = LoggerFactory.getLogger(TestMain.class);

    public static final String ONLY_TEST     = "-only-test";
    public static final String LIST_TEST     = "-list-test";
    public static final String HELP          = "-help";
    public static final String CONF          = "-conf";
    public static final String SUITE_PACKAGE = "-suite-package";

    /** Flags owned by the command line itself; no declared option may reuse them. */
    static final List<String> BUILT_IN_FLAGS = List.of(ONLY_TEST, LIST_TEST, HELP, CONF, SUITE_PACKAGE);

    public static final String CONF_ENV          = "TESTTREE_CONF";
    public static final String SUITE_PACKAGE_ENV = "TESTTREE_SUITE_PACKAGE";
    public static final String DEFAULT_SUITE_PACKAGE = "com.testtree";

    public static final int EXIT_OK          = 0;
    public static final int EXIT_TEST_FAILED = 1;
    public static final int EXIT_USAGE       = 2;

    private TestMain() {}

    /**
     * Discovers suites under {@code -suite-package} (or {@code TESTTREE_SUITE_PACKAGE}),
     * runs them and exits with the run's status.
     */
    public static void main(String[] args) {
        Map<String, String> env = System.getenv();
        String suitePackage = suitePackage(args, env);
        ConfigRegistry registry = ConfigRegistry.global();

        int code;
        try {
            SuiteRegistry suites = new SuiteRegistry(suitePackage);
            StandardOptions.declareAll(registry);
            suites.declareOptions(registry);
            code = run(args, suites.getRoots(), registry, env, System.out, System.err);
        } catch (ConfigurationException | IllegalStateException e) {
            log.error("TestMain: cannot start the run: {}", e.getMessage());
            System.err.println(e.getMessage());
            code = EXIT_USAGE;
        }
        System.exit(code);
    }

    /**
     * Runs {@code roots} as directed by {@code args}. Never exits the process.
     *
     * @param registry options to expose; the standard options are declared here when
     *                 the caller has not done so
     * @return the process exit status
     */
    public static int run(String[] args,
                          List<TestNode> roots,
                          ConfigRegistry registry,
                          Map<String, String> environment,
                          PrintStream out,
                          PrintStream err) {
        if (!registry.isDeclared(StandardOptions.DISPLAY)) {
            StandardOptions.declareAll(registry);
        }

        CommandLine cmd;
        try {
            cmd = new CommandLine(buildSpec(registry));
        } catch (ConfigurationException e) {
            log.error("TestMain: {}", e.getMessage());
            err.println(e.getMessage());
            return EXIT_USAGE;
        }
        ParseResult parsed;
        try {
            parsed = cmd.parseArgs(args);
        } catch (ParameterException e) {
            err.println(e.getMessage());
            cmd.usage(err);
            return EXIT_USAGE;
        }

        if (parsed.isUsageHelpRequested()) {
            cmd.usage(out);
            return EXIT_OK;
        }

        if (parsed.hasMatchedOption(LIST_TEST)) {
            for (ListedTest test : TestRunner.listTests(roots)) {
                out.println(test.labelPath());
            }
            out.flush();
            return EXIT_OK;
        }

        ResolvedConfig config;
        try {
            config = registry.resolve(cliValues(parsed, registry), environment,
                readConfigFile(parsed.matchedOptionValue(CONF, environment.get(CONF_ENV))));
        } catch (ConfigurationException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        }

        List<String> onlyTests = parsed.matchedOptionValue(ONLY_TEST, Collections.emptyList());
        List<List<String>> selection = onlyTests.stream().map(TestMain::parseLabelPath).toList();

        List<RunListener> listeners = new ArrayList<>();
        TestRunner runner;
        try {
            listeners.add(ConsoleReporter.fromConfig(out, config));
            config.getPath(StandardOptions.OUTPUT_JSON_FILE)
                .ifPresent(path -> listeners.add(new JsonReportWriter(path)));
            runner = new TestRunner(config, listeners);
        } catch (ConfigurationException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        }

        RunReport report = runner.run(roots, selection);
        return report.isOk() ? EXIT_OK : EXIT_TEST_FAILED;
    }

    // ── Command line ──────────────────────────────────────────────────────────

    static CommandSpec buildSpec(ConfigRegistry registry) {
        CommandSpec spec = CommandSpec.create().name("testtree");
        spec.usageMessage().description("Runs a tree of tests and reports every outcome.");

        spec.addOption(OptionSpec.builder(ONLY_TEST)
            .paramLabel("PATH")
            .type(List.class)
            .auxiliaryTypes(String.class)
            .description("Run only the tests at or below this label path, e.g. suite:group:test. Repeatable.")
            .build());
        spec.addOption(OptionSpec.builder(LIST_TEST)
            .type(boolean.class)
            .description("List every test's label path and run nothing.")
            .build());
        spec.addOption(OptionSpec.builder(HELP)
            .type(boolean.class)
            .usageHelp(true)
            .description("Print this help and exit.")
            .build());
        spec.addOption(OptionSpec.builder(CONF)
            .paramLabel("FILE")
            .type(String.class)
            .description("Read 'key = value' option lines from FILE (also " + CONF_ENV + ").")
            .build());
        spec.addOption(OptionSpec.builder(SUITE_PACKAGE)
            .paramLabel("PACKAGE")
            .type(String.class)
            .description("Package scanned for @RegisterSuite classes (also " + SUITE_PACKAGE_ENV + ").")
            .build());

        for (ConfigOption option : registry.getOptions()) {
            option.getCliFlag().filter(BUILT_IN_FLAGS::contains).ifPresent(flag -> {
                throw new ConfigurationException(
                    "Option '" + option.getName() + "' uses the built-in flag '" + flag + "'");
            });
            option.getCliFlag().ifPresent(flag -> spec.addOption(OptionSpec.builder(flag)
                .paramLabel("VALUE")
                .type(String.class)
                .description(describe(option))
                .build()));
        }
        return spec;
    }

    private static String describe(ConfigOption option) {
        StringBuilder sb = new StringBuilder(option.getHelp());
        option.getEnvVar().ifPresent(env -> sb.append(" Env: ").append(env).append('.'));
        option.getFileKey().ifPresent(key -> sb.append(" Config key: ").append(key).append('.'));
        sb.append(" Default: '").append(option.getDefaultValue()).append("'.");
        return sb.toString().strip();
    }

    private static Map<String, String> cliValues(ParseResult parsed, ConfigRegistry registry) {
        Map<String, String> values = new LinkedHashMap<>();
        for (ConfigOption option : registry.getOptions()) {
            option.getCliFlag()
                .filter(flag -> parsed.hasMatchedOption(flag))
                .ifPresent(flag -> values.put(flag, parsed.matchedOptionValue(flag, "")));
        }
        return values;
    }

    /** {@code "suite:group:test"} to {@code [suite, group, test]}. */
    static List<String> parseLabelPath(String text) {
        return List.of(text.split(TestPath.SEPARATOR, -1));
    }

    static String readConfigFile(String location) {
        if (location == null || location.isBlank()) {
            return null;
        }
        Path file = Paths.get(location.strip());
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Could not read config file " + file + ": " + e.getMessage(), e);
        }
    }

    static String suitePackage(String[] args, Map<String, String> environment) {
        List<String> list = Arrays.asList(args);
        int i = list.indexOf(SUITE_PACKAGE);
        if (i >= 0 && i + 1 < list.size()) {
            return list.get(i + 1);
        }
        String fromEnv = environment.get(SUITE_PACKAGE_ENV);
        return fromEnv != null && !fromEnv.isBlank() ? fromEnv.strip() : DEFAULT_SUITE_PACKAGE;
    }
}
