package com.testtree.suite;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@link SuiteProvider} for discovery by the {@link SuiteRegistry}.
 *
 * <pre>
 *   {@literal @}RegisterSuite
 *   public class ComparatorSuite implements SuiteProvider {
 *       public TestNode suite() { return TestNode.group("comparator", ...); }
 *   }
 * </pre>
 *
 * Rules:
 *   - The annotated class must implement {@link SuiteProvider}.
 *   - It must have a no-arg constructor.
 *   - Root names of discovered suites must be unique -- duplicates cause startup failure.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface RegisterSuite {
}
