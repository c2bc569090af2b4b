package me.gridrl.algs.td;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import me.gridrl.algs.Policy;
import me.gridrl.algs.ProgressListener;
import me.gridrl.mdp.MDP;

/**
 * Base class for model-free temporal-difference control. Sub-classes define what happens in a single episode.
 */
public abstract class TDLearner {
    private static final Logger LOGGER = LogManager.getLogger();

    public static final double DEFAULT_ALPHA = 0.1;
    public static final double DEFAULT_GAMMA = 0.9;
    public static final double DEFAULT_EPSILON = 0.1;

    protected final double mAlpha;
    protected final double mGamma;
    protected final EpsilonGreedy mExplorer;
    protected ProgressListener mListener = ProgressListener.NONE;

    /**
     * @param xiAlpha - learning rate in (0, 1].
     * @param xiGamma - discount factor in [0, 1].
     * @param xiEpsilon - exploration rate in [0, 1].
     * @param xiRandom - source for every exploration and tie-breaking draw.
     */
    protected TDLearner(double xiAlpha, double xiGamma, double xiEpsilon, Random xiRandom) {
        if (!(xiAlpha > 0) || (xiAlpha > 1)) {
            throw new IllegalArgumentException("Alpha must be in (0, 1], got " + xiAlpha);
        }
        if ((xiGamma < 0) || (xiGamma > 1)) {
            throw new IllegalArgumentException("Gamma must be in [0, 1], got " + xiGamma);
        }
        mAlpha = xiAlpha;
        mGamma = xiGamma;
        mExplorer = new EpsilonGreedy(xiEpsilon, xiRandom);
    }

    public void setProgressListener(ProgressListener xiListener) {
        mListener = (xiListener == null) ? ProgressListener.NONE : xiListener;
    }

    public double getAlpha() {
        return mAlpha;
    }

    public double getGamma() {
        return mGamma;
    }

    public double getEpsilon() {
        return mExplorer.getEpsilon();
    }

    /**
     * Learn from scratch for the specified number of episodes.
     */
    public <S, A> LearningResult<S, A> train(MDP<S, A> xiMDP, int xiEpisodes) {
        if (xiEpisodes < 0) {
            throw new IllegalArgumentException("Episode count can't be negative, got " + xiEpisodes);
        }
        LOGGER.info("{}: training for {} episodes (alpha={}, gamma={}, epsilon={})",
                getName(), xiEpisodes, mAlpha, mGamma, getEpsilon());

        QTable<S> lQTable = new QTable<>(xiMDP.getActions().size());
        List<Double> lHistory = new ArrayList<>(xiEpisodes);
        for (int lEpisode = 0; lEpisode < xiEpisodes; lEpisode++) {
            double lTotalReward = iterate(xiMDP, lQTable);
            lHistory.add(lTotalReward);
            mListener.iterationComplete(lEpisode + 1, lTotalReward);
        }

        Policy<S, A> lPolicy = derivePolicy(xiMDP, lQTable);
        LOGGER.info("{}: done, {} states visited", getName(), lQTable.getStates().size());
        return new LearningResult<>(lQTable, lPolicy, lHistory);
    }

    /**
     * Run a single episode from the start state, updating the Q-table as we go.
     *
     * @return the total reward for the episode.
     */
    protected abstract <S, A> double iterate(MDP<S, A> xiMDP, QTable<S> xiQTable);

    protected String getName() {
        return getClass().getSimpleName();
    }

    protected <S> int chooseAction(QTable<S> xiQTable, S xiState) {
        return mExplorer.chooseAction(xiQTable.getRow(xiState));
    }

    /**
     * Move Q(s,a) a step of size alpha towards the target.
     */
    protected <S> void update(QTable<S> xiQTable, S xiState, int xiAction, double xiTarget) {
        double lOldQ = xiQTable.get(xiState, xiAction);
        xiQTable.set(xiState, xiAction, lOldQ + mAlpha * (xiTarget - lOldQ));
    }

    /**
     * @return the greedy policy over all visited non-terminal states.
     */
    protected static <S, A> Policy<S, A> derivePolicy(MDP<S, A> xiMDP, QTable<S> xiQTable) {
        Policy<S, A> lPolicy = new Policy<>();
        List<A> lActions = xiMDP.getActions();
        for (S lState : xiQTable.getStates()) {
            if (!xiMDP.isTerminal(lState)) {
                lPolicy.setAction(lState, lActions.get(xiQTable.getBestAction(lState)));
            }
        }
        return lPolicy;
    }
}
