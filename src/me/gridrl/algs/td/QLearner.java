package me.gridrl.algs.td;

import java.util.List;
import java.util.Random;

import me.gridrl.mdp.MDP;
import me.gridrl.mdp.StepResult;

/**
 * Off-policy TD control: bootstrap from the best action in the next state, whatever we actually do next.
 */
public class QLearner extends TDLearner {
    public QLearner(double xiAlpha, double xiGamma, double xiEpsilon, Random xiRandom) {
        super(xiAlpha, xiGamma, xiEpsilon, xiRandom);
    }

    public QLearner(Random xiRandom) {
        this(DEFAULT_ALPHA, DEFAULT_GAMMA, DEFAULT_EPSILON, xiRandom);
    }

    @Override
    protected <S, A> double iterate(MDP<S, A> xiMDP, QTable<S> xiQTable) {
        List<A> lActions = xiMDP.getActions();
        double lTotalReward = 0;
        S lState = xiMDP.getStartState();
        boolean lDone = xiMDP.isTerminal(lState);
        while (!lDone) {
            int lAction = chooseAction(xiQTable, lState);
            StepResult<S> lResult = xiMDP.step(lState, lActions.get(lAction));
            lTotalReward += lResult.mReward;
            lDone = lResult.mTerminal;

            double lTarget = lResult.mReward;
            if (!lDone) {
                lTarget += mGamma * bootstrapValue(xiQTable, lResult.mState);
            }
            update(xiQTable, lState, lAction, lTarget);
            lState = lResult.mState;
        }
        return lTotalReward;
    }

    /**
     * @return the estimated value of a non-terminal next state.
     */
    protected <S> double bootstrapValue(QTable<S> xiQTable, S xiNextState) {
        return xiQTable.getBestValue(xiNextState);
    }
}
