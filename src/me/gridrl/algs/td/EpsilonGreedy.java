package me.gridrl.algs.td;

import java.util.Random;

/**
 * Epsilon-greedy action selection over a row of action values.
 *
 * With probability epsilon, pick any action uniformly at random. Otherwise pick a highest-valued action, breaking
 * ties uniformly at random.
 */
public class EpsilonGreedy {
    private final double mEpsilon;
    private final Random mRandom;

    /**
     * @param xiEpsilon - exploration probability (0 = pure exploitation, 1 = pure exploration).
     * @param xiRandom - random source.
     */
    public EpsilonGreedy(double xiEpsilon, Random xiRandom) {
        if ((xiEpsilon < 0) || (xiEpsilon > 1)) {
            throw new IllegalArgumentException("Epsilon must be between 0 and 1, got " + xiEpsilon);
        }
        if (xiRandom == null) {
            throw new IllegalArgumentException("A random source is required");
        }
        mEpsilon = xiEpsilon;
        mRandom = xiRandom;
    }

    public double getEpsilon() {
        return mEpsilon;
    }

    /**
     * @return the index of the chosen action.
     */
    public int chooseAction(double[] xiActionValues) {
        if (mRandom.nextDouble() < mEpsilon) {
            return mRandom.nextInt(xiActionValues.length);
        }

        double lBestValue = xiActionValues[0];
        int[] lTies = new int[xiActionValues.length];
        int lNumTies = 1;
        for (int lAction = 1; lAction < xiActionValues.length; lAction++) {
            if (xiActionValues[lAction] > lBestValue) {
                lBestValue = xiActionValues[lAction];
                lNumTies = 0;
            }
            if (xiActionValues[lAction] == lBestValue) {
                lTies[lNumTies++] = lAction;
            }
        }
        return lTies[mRandom.nextInt(lNumTies)];
    }

    /**
     * @return the expected action value when acting epsilon-greedily. The greedy action (the earliest of any ties)
     * has probability 1 - epsilon + epsilon/|A|, every other action epsilon/|A|.
     */
    public double getExpectedValue(double[] xiActionValues) {
        int lGreedy = QTable.bestAction(xiActionValues);
        double lExploreProb = mEpsilon / xiActionValues.length;
        double lExpected = 0;
        for (int lAction = 0; lAction < xiActionValues.length; lAction++) {
            double lProb = (lAction == lGreedy) ? (1 - mEpsilon + lExploreProb) : lExploreProb;
            lExpected += lProb * xiActionValues[lAction];
        }
        return lExpected;
    }
}
