package me.gridrl.algs.dp;

import java.util.List;
import java.util.Random;

import me.gridrl.algs.Policy;
import me.gridrl.algs.ProgressListener;
import me.gridrl.algs.ValueFunction;
import me.gridrl.mdp.MDP;
import me.gridrl.mdp.StepResult;

/**
 * Base class for solvers that need the full model of the MDP.
 */
public abstract class DynamicProgrammingSolver {
    public static final double DEFAULT_GAMMA = 0.9;
    public static final double DEFAULT_THETA = 1e-6;
    public static final int DEFAULT_MAX_ITERATIONS = 100_000;

    protected final double mGamma;
    protected final double mTheta;
    protected final int mMaxIterations;
    protected ProgressListener mListener = ProgressListener.NONE;

    /**
     * @param xiGamma - discount factor in [0, 1].
     * @param xiTheta - convergence threshold on the per-sweep maximum change. Must be positive.
     * @param xiMaxIterations - cap on sweeps (and on outer iterations) before giving up.
     */
    protected DynamicProgrammingSolver(double xiGamma, double xiTheta, int xiMaxIterations) {
        if ((xiGamma < 0) || (xiGamma > 1)) {
            throw new IllegalArgumentException("Gamma must be in [0, 1], got " + xiGamma);
        }
        if (!(xiTheta > 0)) {
            throw new IllegalArgumentException("Theta must be positive, got " + xiTheta);
        }
        if (xiMaxIterations < 1) {
            throw new IllegalArgumentException("Iteration cap must be positive, got " + xiMaxIterations);
        }
        mGamma = xiGamma;
        mTheta = xiTheta;
        mMaxIterations = xiMaxIterations;
    }

    public void setProgressListener(ProgressListener xiListener) {
        mListener = (xiListener == null) ? ProgressListener.NONE : xiListener;
    }

    public double getGamma() {
        return mGamma;
    }

    /**
     * Solve the MDP.
     *
     * @throws me.gridrl.algs.DidNotConvergeException if the iteration cap is reached.
     */
    public abstract <S, A> SolverResult<S, A> solve(MDP<S, A> xiMDP);

    /**
     * @return r(s,a) + gamma * V[s'] for the (deterministic) successor of s under a.
     */
    protected <S, A> double actionValue(MDP<S, A> xiMDP, ValueFunction<S> xiValues, S xiState, A xiAction) {
        StepResult<S> lResult = xiMDP.step(xiState, xiAction);
        return lResult.mReward + mGamma * xiValues.get(lResult.mState);
    }

    /**
     * @return the action with the highest one-step lookahead value. Ties go to the earliest action.
     */
    protected <S, A> A greedyAction(MDP<S, A> xiMDP, ValueFunction<S> xiValues, S xiState) {
        double lBestValue = Double.NEGATIVE_INFINITY;
        A lBestAction = null;
        for (A lAction : xiMDP.getActions()) {
            double lValue = actionValue(xiMDP, xiValues, xiState, lAction);
            if (lValue > lBestValue) {
                lBestValue = lValue;
                lBestAction = lAction;
            }
        }
        return lBestAction;
    }

    /**
     * @return a policy with a uniformly random action for every non-terminal state.
     */
    protected static <S, A> Policy<S, A> randomPolicy(MDP<S, A> xiMDP, Random xiRandom) {
        Policy<S, A> lPolicy = new Policy<>();
        List<A> lActions = xiMDP.getActions();
        for (S lState : xiMDP.getStates()) {
            if (!xiMDP.isTerminal(lState)) {
                lPolicy.setAction(lState, lActions.get(xiRandom.nextInt(lActions.size())));
            }
        }
        return lPolicy;
    }
}
