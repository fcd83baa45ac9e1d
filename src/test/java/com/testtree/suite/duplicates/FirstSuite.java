package com.testtree.suite.duplicates;

import com.testtree.model.TestNode;
import com.testtree.suite.RegisterSuite;
import com.testtree.suite.SuiteProvider;

@RegisterSuite
public class FirstSuite implements SuiteProvider {
    @Override
    public TestNode suite() {
        return TestNode.group("shared", TestNode.leaf("one", ctx -> {}));
    }
}
