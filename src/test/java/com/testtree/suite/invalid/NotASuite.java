package com.testtree.suite.invalid;

import com.testtree.suite.RegisterSuite;

@RegisterSuite
public class NotASuite {
}
