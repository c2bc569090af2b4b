package me.gridrl.algs.td;

import java.util.Collections;
import java.util.List;

import me.gridrl.algs.Policy;

/**
 * The output of a TD learner.
 */
public final class LearningResult<S, A> {
    private final QTable<S> mQTable;
    private final Policy<S, A> mPolicy;
    private final List<Double> mRewardHistory;

    public LearningResult(QTable<S> xiQTable, Policy<S, A> xiPolicy, List<Double> xiRewardHistory) {
        mQTable = xiQTable;
        mPolicy = xiPolicy;
        mRewardHistory = Collections.unmodifiableList(xiRewardHistory);
    }

    public QTable<S> getQTable() {
        return mQTable;
    }

    /**
     * @return the greedy policy for every visited non-terminal state.
     */
    public Policy<S, A> getPolicy() {
        return mPolicy;
    }

    /**
     * @return total (undiscounted) reward for each episode, in order.
     */
    public List<Double> getRewardHistory() {
        return mRewardHistory;
    }
}
