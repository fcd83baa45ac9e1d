package com.testtree.executor;

import com.testtree.model.LeafResult;
import com.testtree.model.TestPath;
import com.testtree.report.RunReport;

/**
 * Receives the ordered event stream of a run. All methods are optional.
 *
 * A listener that throws is logged and ignored for that event; it can never change a
 * test's outcome or stop the run.
 */
public interface RunListener {

    /** Called once, after selection, before the first leaf runs. */
    default void onRunStarted(int selectedLeaves) {}

    default void onLeafStarted(TestPath path) {}

    default void onLeafFinished(LeafResult result) {}

    /** Called once with the complete report. */
    default void onRunFinished(RunReport report) {}
}
