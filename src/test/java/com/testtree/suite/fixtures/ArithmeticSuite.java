package com.testtree.suite.fixtures;

import com.testtree.assertion.Assert;
import com.testtree.core.ConfigRegistry;
import com.testtree.model.TestNode;
import com.testtree.suite.RegisterSuite;
import com.testtree.suite.SuiteProvider;

@RegisterSuite
public class ArithmeticSuite implements SuiteProvider {

    public static final String FACTOR = "arith-factor";

    @Override
    public TestNode suite() {
        return TestNode.group("arithmetic",
            TestNode.leaf("add", ctx -> Assert.assertEquals(4, 2 + 2)),
            TestNode.leaf("scale", ctx -> {
                int factor = ctx.getConfig().getInt(FACTOR);
                Assert.assertEquals(6, 3 * factor, "scaled by " + FACTOR);
            }),
            TestNode.leaf("float", ctx -> Assert.assertFloatEquals(0.3, 0.1 + 0.2)));
    }

    @Override
    public void declareOptions(ConfigRegistry registry) {
        registry.declare(FACTOR, "2", "Multiplier used by the scale test.");
    }
}
