package com.eainde.insight.analysis;

import com.eainde.insight.model.Finding;
import com.eainde.insight.model.Platform;
import com.eainde.insight.model.UnifiedStore;

import java.util.List;

/**
 * One platform's analysis unit in the parallel phase.
 */
public interface AnalysisTask {

    Platform platform();

    default String name() {
        return nameFor(platform());
    }

    static String nameFor(Platform platform) {
        return "analysis:" + platform.key();
    }

    /**
     * Reads the sealed store and returns findings for {@link #platform()}. Too little data
     * yields an empty list; any exception marks only this task as failed.
     */
    List<Finding> analyze(UnifiedStore store);
}
