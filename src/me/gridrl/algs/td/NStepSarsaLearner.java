package me.gridrl.algs.td;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Random;

import me.gridrl.mdp.MDP;
import me.gridrl.mdp.StepResult;

/**
 * n-step SARSA.
 *
 * The last n (state, action, reward) steps are held in a sliding buffer. Once it is full, the oldest pair is updated
 * towards the discounted sum of the buffered rewards plus gamma^n * Q(s', a') and then evicted. When the episode ends
 * (or hits the step cap), the remaining pairs are updated oldest-first from the rewards still in the buffer, with no
 * bootstrap, until the buffer is empty.
 */
public class NStepSarsaLearner extends TDLearner {
    public static final int DEFAULT_STEPS = 5;
    public static final int DEFAULT_MAX_STEPS_PER_EPISODE = 1000;

    private final int mSteps;
    private final int mMaxStepsPerEpisode;

    private static final class BufferedStep<S> {
        private final S mState;
        private final int mAction;
        private final double mReward;

        private BufferedStep(S xiState, int xiAction, double xiReward) {
            mState = xiState;
            mAction = xiAction;
            mReward = xiReward;
        }
    }

    /**
     * @param xiSteps - lookahead horizon n (at least 1).
     * @param xiMaxStepsPerEpisode - the most steps taken in any one episode.
     */
    public NStepSarsaLearner(int xiSteps,
                             double xiAlpha,
                             double xiGamma,
                             double xiEpsilon,
                             int xiMaxStepsPerEpisode,
                             Random xiRandom) {
        super(xiAlpha, xiGamma, xiEpsilon, xiRandom);
        if (xiSteps < 1) {
            throw new IllegalArgumentException("Lookahead must be at least 1 step, got " + xiSteps);
        }
        if (xiMaxStepsPerEpisode < 1) {
            throw new IllegalArgumentException("Step cap must be positive, got " + xiMaxStepsPerEpisode);
        }
        mSteps = xiSteps;
        mMaxStepsPerEpisode = xiMaxStepsPerEpisode;
    }

    public NStepSarsaLearner(int xiSteps, double xiAlpha, double xiGamma, double xiEpsilon, Random xiRandom) {
        this(xiSteps, xiAlpha, xiGamma, xiEpsilon, DEFAULT_MAX_STEPS_PER_EPISODE, xiRandom);
    }

    public NStepSarsaLearner(Random xiRandom) {
        this(DEFAULT_STEPS, DEFAULT_ALPHA, DEFAULT_GAMMA, DEFAULT_EPSILON, xiRandom);
    }

    public int getSteps() {
        return mSteps;
    }

    @Override
    protected String getName() {
        return mSteps + "-step SARSA";
    }

    @Override
    protected <S, A> double iterate(MDP<S, A> xiMDP, QTable<S> xiQTable) {
        List<A> lActions = xiMDP.getActions();
        double lTotalReward = 0;
        S lState = xiMDP.getStartState();
        if (xiMDP.isTerminal(lState)) {
            return 0;
        }

        Deque<BufferedStep<S>> lBuffer = new ArrayDeque<>(Math.min(mSteps, mMaxStepsPerEpisode) + 1);
        int lAction = chooseAction(xiQTable, lState);
        boolean lDone = false;
        for (int lStep = 0; !lDone && (lStep < mMaxStepsPerEpisode); lStep++) {
            StepResult<S> lResult = xiMDP.step(lState, lActions.get(lAction));
            lTotalReward += lResult.mReward;
            lDone = lResult.mTerminal;
            lBuffer.addLast(new BufferedStep<>(lState, lAction, lResult.mReward));

            int lNextAction = lDone ? -1 : chooseAction(xiQTable, lResult.mState);

            if (lBuffer.size() >= mSteps) {
                double lReturn = discountedReturn(lBuffer);
                if (!lDone) {
                    lReturn += Math.pow(mGamma, mSteps) * xiQTable.get(lResult.mState, lNextAction);
                }
                BufferedStep<S> lOldest = lBuffer.removeFirst();
                update(xiQTable, lOldest.mState, lOldest.mAction, lReturn);
            }

            lState = lResult.mState;
            lAction = lNextAction;
        }

        // Drain whatever is left. The episode is over, so there's nothing to bootstrap from.
        while (!lBuffer.isEmpty()) {
            double lReturn = discountedReturn(lBuffer);
            BufferedStep<S> lOldest = lBuffer.removeFirst();
            update(xiQTable, lOldest.mState, lOldest.mAction, lReturn);
        }

        return lTotalReward;
    }

    private <S> double discountedReturn(Deque<BufferedStep<S>> xiBuffer) {
        double lReturn = 0;
        int lii = 0;
        for (BufferedStep<S> lBufferedStep : xiBuffer) {
            lReturn += Math.pow(mGamma, lii++) * lBufferedStep.mReward;
        }
        return lReturn;
    }
}
