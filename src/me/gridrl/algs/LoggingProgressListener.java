package me.gridrl.algs;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Logs every n-th iteration.
 */
public class LoggingProgressListener implements ProgressListener {
    private static final Logger LOGGER = LogManager.getLogger();

    private final String mName;
    private final int mInterval;

    public LoggingProgressListener(String xiName, int xiInterval) {
        if (xiInterval < 1) {
            throw new IllegalArgumentException("Interval must be positive, got " + xiInterval);
        }
        mName = xiName;
        mInterval = xiInterval;
    }

    @Override
    public void iterationComplete(int xiIteration, double xiMetric) {
        if (xiIteration % mInterval == 0) {
            LOGGER.info("{}: iteration {}, metric {}", mName, xiIteration, xiMetric);
        }
    }
}
