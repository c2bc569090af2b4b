package me.gridrl.algs.td;

import java.util.List;
import java.util.Random;

import me.gridrl.mdp.MDP;
import me.gridrl.mdp.StepResult;

/**
 * On-policy TD control: bootstrap from the action that will actually be taken next.
 */
public class SarsaLearner extends TDLearner {
    public SarsaLearner(double xiAlpha, double xiGamma, double xiEpsilon, Random xiRandom) {
        super(xiAlpha, xiGamma, xiEpsilon, xiRandom);
    }

    public SarsaLearner(Random xiRandom) {
        this(DEFAULT_ALPHA, DEFAULT_GAMMA, DEFAULT_EPSILON, xiRandom);
    }

    @Override
    protected <S, A> double iterate(MDP<S, A> xiMDP, QTable<S> xiQTable) {
        List<A> lActions = xiMDP.getActions();
        double lTotalReward = 0;
        S lState = xiMDP.getStartState();
        if (xiMDP.isTerminal(lState)) {
            return 0;
        }

        int lAction = chooseAction(xiQTable, lState);
        boolean lDone = false;
        while (!lDone) {
            StepResult<S> lResult = xiMDP.step(lState, lActions.get(lAction));
            lTotalReward += lResult.mReward;
            lDone = lResult.mTerminal;

            // No decision is made in the terminal state.
            int lNextAction = -1;
            double lTarget = lResult.mReward;
            if (!lDone) {
                lNextAction = chooseAction(xiQTable, lResult.mState);
                lTarget += mGamma * xiQTable.get(lResult.mState, lNextAction);
            }
            update(xiQTable, lState, lAction, lTarget);

            lState = lResult.mState;
            lAction = lNextAction;
        }
        return lTotalReward;
    }
}
