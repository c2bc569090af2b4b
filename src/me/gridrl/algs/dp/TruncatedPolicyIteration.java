package me.gridrl.algs.dp;

import java.util.Random;

import me.gridrl.algs.Policy;
import me.gridrl.algs.ValueFunction;
import me.gridrl.mdp.MDP;

/**
 * Policy iteration where each evaluation phase runs a fixed number of synchronous sweeps instead of running to
 * convergence.
 */
public class TruncatedPolicyIteration extends PolicyIteration {
    public static final int DEFAULT_TRUNCATION = 5;

    private final int mTruncation;

    /**
     * @param xiTruncation - number of evaluation sweeps per iteration.
     */
    public TruncatedPolicyIteration(double xiGamma,
                                    double xiTheta,
                                    int xiMaxIterations,
                                    int xiTruncation,
                                    Random xiRandom) {
        super(xiGamma, xiTheta, xiMaxIterations, xiRandom);
        if (xiTruncation < 1) {
            throw new IllegalArgumentException("Truncation must be at least 1, got " + xiTruncation);
        }
        mTruncation = xiTruncation;
    }

    public TruncatedPolicyIteration(double xiGamma, int xiTruncation, Random xiRandom) {
        this(xiGamma, DEFAULT_THETA, DEFAULT_MAX_ITERATIONS, xiTruncation, xiRandom);
    }

    public TruncatedPolicyIteration(Random xiRandom) {
        this(DEFAULT_GAMMA, DEFAULT_TRUNCATION, xiRandom);
    }

    public int getTruncation() {
        return mTruncation;
    }

    @Override
    protected String getName() {
        return "Truncated policy iteration";
    }

    @Override
    protected <S, A> double evaluate(MDP<S, A> xiMDP, Policy<S, A> xiPolicy, ValueFunction<S> xoValues) {
        double lDelta = 0;
        for (int lSweep = 0; lSweep < mTruncation; lSweep++) {
            ValueFunction<S> lPrevious = xoValues.copy();
            lDelta = 0;
            for (S lState : xiMDP.getStates()) {
                if (xiMDP.isTerminal(lState)) {
                    continue;
                }
                double lNewValue = actionValue(xiMDP, lPrevious, lState, xiPolicy.getAction(lState));
                xoValues.set(lState, lNewValue);
                lDelta = Math.max(lDelta, Math.abs(lPrevious.get(lState) - lNewValue));
            }
        }
        return lDelta;
    }
}
