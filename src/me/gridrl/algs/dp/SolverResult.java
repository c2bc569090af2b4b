package me.gridrl.algs.dp;

import java.util.Collections;
import java.util.List;

import me.gridrl.algs.Policy;
import me.gridrl.algs.ValueFunction;

/**
 * The output of a dynamic-programming solver.
 */
public final class SolverResult<S, A> {
    private final ValueFunction<S> mValues;
    private final Policy<S, A> mPolicy;
    private final List<ValueFunction<S>> mHistory;
    private final int mIterations;

    public SolverResult(ValueFunction<S> xiValues,
                        Policy<S, A> xiPolicy,
                        List<ValueFunction<S>> xiHistory,
                        int xiIterations) {
        mValues = xiValues;
        mPolicy = xiPolicy;
        mHistory = Collections.unmodifiableList(xiHistory);
        mIterations = xiIterations;
    }

    public ValueFunction<S> getValues() {
        return mValues;
    }

    public Policy<S, A> getPolicy() {
        return mPolicy;
    }

    /**
     * @return value-function snapshots, starting with the initial all-zero table.
     */
    public List<ValueFunction<S>> getHistory() {
        return mHistory;
    }

    /**
     * @return the number of outer iterations (sweeps for value iteration, evaluate/improve rounds otherwise).
     */
    public int getIterations() {
        return mIterations;
    }
}
