package me.gridrl.algs;

/**
 * Side channel for reporting progress from long-running loops. Listeners can't influence the algorithm.
 */
public interface ProgressListener {
    /**
     * Called after every sweep (dynamic programming) or episode (TD learning).
     *
     * @param xiIteration - 1-based iteration number.
     * @param xiMetric - the sweep's maximum value change, or the episode's total reward.
     */
    public void iterationComplete(int xiIteration, double xiMetric);

    /**
     * A listener that ignores everything.
     */
    public static final ProgressListener NONE = (xiIteration, xiMetric) -> {
        // Nothing to report.
    };
}
