package me.gridrl.algs.td;

import java.util.Random;

/**
 * Expected SARSA: as Q-learning, but bootstrap from the expected value under the epsilon-greedy policy rather than
 * the maximum.
 */
public class ExpectedSarsaLearner extends QLearner {
    public ExpectedSarsaLearner(double xiAlpha, double xiGamma, double xiEpsilon, Random xiRandom) {
        super(xiAlpha, xiGamma, xiEpsilon, xiRandom);
    }

    public ExpectedSarsaLearner(Random xiRandom) {
        this(DEFAULT_ALPHA, DEFAULT_GAMMA, DEFAULT_EPSILON, xiRandom);
    }

    @Override
    protected <S> double bootstrapValue(QTable<S> xiQTable, S xiNextState) {
        return mExplorer.getExpectedValue(xiQTable.getRow(xiNextState));
    }
}
