package me.gridrl.algs;

/**
 * Thrown when an iterative solver hits its iteration cap before meeting its convergence criterion.
 */
public class DidNotConvergeException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int mIterations;
    private final double mLastDelta;

    public DidNotConvergeException(String xiPhase, int xiIterations, double xiLastDelta) {
        super(xiPhase + " did not converge after " + xiIterations + " iterations (last delta " + xiLastDelta + ")");
        mIterations = xiIterations;
        mLastDelta = xiLastDelta;
    }

    public int getIterations() {
        return mIterations;
    }

    /**
     * @return the last measured change, or NaN if the phase doesn't measure one.
     */
    public double getLastDelta() {
        return mLastDelta;
    }
}
