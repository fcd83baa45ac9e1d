package com.testtree.suite;

import com.testtree.core.ConfigRegistry;
import com.testtree.model.TestNode;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Discovers and holds every {@link SuiteProvider} under a base package.
 *
 * At construction time the registry:
 *   1. Uses the Reflections library to scan the base package (and nothing outside it)
 *   2. Finds every class annotated with {@link RegisterSuite}
 *   3. Instantiates each one via its no-arg constructor
 *   4. Orders them by class name so the run order does not depend on the classpath
 *
 * Adding a suite requires only a new annotated class; nothing has to be registered
 * by hand.
 */
public class SuiteRegistry {

    private static final Logger log = LoggerFactory.getLogger(SuiteRegistry.class);

    private final String              basePackage;
    private final List<SuiteProvider> providers;
    private List<TestNode>            roots;

    public SuiteRegistry(String basePackage) {
        this.basePackage = basePackage;
        this.providers   = Collections.unmodifiableList(discoverAndSort());
        log.info("SuiteRegistry: {} suite provider(s) found under {}", providers.size(), basePackage);
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    public List<SuiteProvider> getProviders() {
        return providers;
    }

    /** Lets every provider declare its options. */
    public void declareOptions(ConfigRegistry registry) {
        for (SuiteProvider provider : providers) {
            provider.declareOptions(registry);
        }
    }

    /**
     * Builds every suite, once, in provider order.
     *
     * @throws IllegalStateException when two suites share a root name
     */
    public synchronized List<TestNode> getRoots() {
        if (roots == null) {
            roots = buildRoots();
        }
        return roots;
    }

    public int size() {
        return providers.size();
    }

    // ── Discovery ─────────────────────────────────────────────────────────────

    private List<SuiteProvider> discoverAndSort() {
        Reflections reflections = new Reflections(
            new ConfigurationBuilder()
                .forPackage(basePackage)
                .filterInputsBy(new FilterBuilder().includePackage(basePackage))
                .setScanners(Scanners.TypesAnnotated)
        );

        Set<Class<?>> annotated = reflections.getTypesAnnotatedWith(RegisterSuite.class);

        List<Class<?>> ordered = new ArrayList<>(annotated);
        ordered.sort(Comparator.comparing(Class::getName));

        List<SuiteProvider> discovered = new ArrayList<>();
        for (Class<?> cls : ordered) {
            if (!SuiteProvider.class.isAssignableFrom(cls)) {
                throw new IllegalStateException(
                    "Class " + cls.getName() + " is annotated @RegisterSuite but does not implement SuiteProvider");
            }
            try {
                var constructor = cls.getDeclaredConstructor();
                constructor.setAccessible(true);  // support package-private suites
                discovered.add((SuiteProvider) constructor.newInstance());
                log.debug("SuiteRegistry: registered {}", cls.getName());
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Failed to instantiate suite " + cls.getName() + ".", e);
            }
        }
        return discovered;
    }

    private List<TestNode> buildRoots() {
        List<TestNode> built = new ArrayList<>();
        Map<String, SuiteProvider> byName = new HashMap<>();
        for (SuiteProvider provider : providers) {
            TestNode root = provider.suite();
            SuiteProvider previous = byName.putIfAbsent(root.getName(), provider);
            if (previous != null) {
                throw new IllegalStateException(
                    "Duplicate suite name '" + root.getName() + "': " +
                    previous.getClass().getName() + " and " + provider.getClass().getName());
            }
            built.add(root);
        }
        return Collections.unmodifiableList(built);
    }
}
