package me.gridrl.algs.dp;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import me.gridrl.algs.DidNotConvergeException;
import me.gridrl.algs.Policy;
import me.gridrl.algs.ValueFunction;
import me.gridrl.mdp.MDP;

/**
 * Policy iteration: alternate full policy evaluation with greedy policy improvement until the policy is stable.
 *
 * Evaluation updates values in place, so later states in a sweep see values already updated in that sweep.
 */
public class PolicyIteration extends DynamicProgrammingSolver {
    private static final Logger LOGGER = LogManager.getLogger();

    protected final Random mRandom;

    /**
     * @param xiRandom - source for the random initial policy.
     */
    public PolicyIteration(double xiGamma, double xiTheta, int xiMaxIterations, Random xiRandom) {
        super(xiGamma, xiTheta, xiMaxIterations);
        if (xiRandom == null) {
            throw new IllegalArgumentException("A random source is required");
        }
        mRandom = xiRandom;
    }

    public PolicyIteration(double xiGamma, double xiTheta, Random xiRandom) {
        this(xiGamma, xiTheta, DEFAULT_MAX_ITERATIONS, xiRandom);
    }

    public PolicyIteration(Random xiRandom) {
        this(DEFAULT_GAMMA, DEFAULT_THETA, xiRandom);
    }

    @Override
    public <S, A> SolverResult<S, A> solve(MDP<S, A> xiMDP) {
        Policy<S, A> lPolicy = randomPolicy(xiMDP, mRandom);
        ValueFunction<S> lValues = new ValueFunction<>(xiMDP.getStates());
        List<ValueFunction<S>> lHistory = new ArrayList<>();
        lHistory.add(lValues.copy());

        int lIteration = 0;
        boolean lStable;
        do {
            if (lIteration == mMaxIterations) {
                throw new DidNotConvergeException(getName(), lIteration, Double.NaN);
            }
            lIteration++;

            double lDelta = evaluate(xiMDP, lPolicy, lValues);
            lHistory.add(lValues.copy());
            LOGGER.debug("Iteration {}: evaluation delta = {}", lIteration, lDelta);
            mListener.iterationComplete(lIteration, lDelta);

            lStable = improve(xiMDP, lPolicy, lValues);
        } while (!lStable);

        LOGGER.info("{} converged after {} iterations.", getName(), lIteration);
        return new SolverResult<>(lValues, lPolicy, lHistory, lIteration);
    }

    protected String getName() {
        return "Policy iteration";
    }

    /**
     * Evaluate the policy, updating the values in place.
     *
     * @return the maximum change in the final sweep.
     */
    protected <S, A> double evaluate(MDP<S, A> xiMDP, Policy<S, A> xiPolicy, ValueFunction<S> xoValues) {
        int lSweeps = 0;
        double lDelta = Double.NaN;
        do {
            if (lSweeps == mMaxIterations) {
                throw new DidNotConvergeException("Policy evaluation", lSweeps, lDelta);
            }
            lSweeps++;

            lDelta = 0;
            for (S lState : xiMDP.getStates()) {
                if (xiMDP.isTerminal(lState)) {
                    continue;
                }
                double lOldValue = xoValues.get(lState);
                double lNewValue = actionValue(xiMDP, xoValues, lState, xiPolicy.getAction(lState));
                xoValues.set(lState, lNewValue);
                lDelta = Math.max(lDelta, Math.abs(lOldValue - lNewValue));
            }
        } while (lDelta >= mTheta);
        return lDelta;
    }

    /**
     * Make the policy greedy with respect to the values.
     *
     * @return whether the policy was already greedy (i.e. no action changed).
     */
    protected <S, A> boolean improve(MDP<S, A> xiMDP, Policy<S, A> xoPolicy, ValueFunction<S> xiValues) {
        boolean lStable = true;
        for (S lState : xiMDP.getStates()) {
            if (xiMDP.isTerminal(lState)) {
                continue;
            }
            A lBestAction = greedyAction(xiMDP, xiValues, lState);
            A lOldAction = xoPolicy.setAction(lState, lBestAction);
            if (!lBestAction.equals(lOldAction)) {
                lStable = false;
            }
        }
        return lStable;
    }
}
