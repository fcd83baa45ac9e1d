package com.testtree.suite.duplicates;

import com.testtree.model.TestNode;
import com.testtree.suite.RegisterSuite;
import com.testtree.suite.SuiteProvider;

@RegisterSuite
public class SecondSuite implements SuiteProvider {
    @Override
    public TestNode suite() {
        return TestNode.group("shared", TestNode.leaf("two", ctx -> {}));
    }
}
