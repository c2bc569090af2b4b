package me.gridrl.algs.dp;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import me.gridrl.algs.DidNotConvergeException;
import me.gridrl.algs.Policy;
import me.gridrl.algs.ValueFunction;
import me.gridrl.mdp.MDP;

/**
 * Value iteration with synchronous sweeps.
 *
 * Every update in a sweep reads the value function as it stood at the start of that sweep.
 */
public class ValueIteration extends DynamicProgrammingSolver {
    private static final Logger LOGGER = LogManager.getLogger();

    public ValueIteration(double xiGamma, double xiTheta, int xiMaxIterations) {
        super(xiGamma, xiTheta, xiMaxIterations);
    }

    public ValueIteration(double xiGamma, double xiTheta) {
        this(xiGamma, xiTheta, DEFAULT_MAX_ITERATIONS);
    }

    public ValueIteration() {
        this(DEFAULT_GAMMA, DEFAULT_THETA);
    }

    @Override
    public <S, A> SolverResult<S, A> solve(MDP<S, A> xiMDP) {
        ValueFunction<S> lValues = new ValueFunction<>(xiMDP.getStates());
        Policy<S, A> lPolicy = new Policy<>();
        List<ValueFunction<S>> lHistory = new ArrayList<>();
        lHistory.add(lValues.copy());

        int lIteration = 0;
        double lDelta = Double.NaN;
        while (true) {
            if (lIteration == mMaxIterations) {
                throw new DidNotConvergeException("Value iteration", lIteration, lDelta);
            }
            lIteration++;

            ValueFunction<S> lPrevious = lValues.copy();
            lDelta = 0;
            for (S lState : xiMDP.getStates()) {
                if (xiMDP.isTerminal(lState)) {
                    continue;
                }
                A lBestAction = greedyAction(xiMDP, lPrevious, lState);
                double lNewValue = actionValue(xiMDP, lPrevious, lState, lBestAction);
                lPolicy.setAction(lState, lBestAction);
                lValues.set(lState, lNewValue);
                lDelta = Math.max(lDelta, Math.abs(lPrevious.get(lState) - lNewValue));
            }

            lHistory.add(lValues.copy());
            LOGGER.debug("Sweep {}: delta = {}", lIteration, lDelta);
            mListener.iterationComplete(lIteration, lDelta);

            if (lDelta < mTheta) {
                break;
            }
        }

        LOGGER.info("Value iteration converged after {} iterations.", lIteration);
        return new SolverResult<>(lValues, lPolicy, lHistory, lIteration);
    }
}
