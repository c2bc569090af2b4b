package me.gridrl.algs.td;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.Test;

import me.gridrl.algs.LoggingProgressListener;
import me.gridrl.algs.PolicyRollout;
import me.gridrl.grids.Cell;
import me.gridrl.grids.Direction;
import me.gridrl.grids.GridLayouts;
import me.gridrl.grids.GridWorld;

public class TDLearnerTest {
    private static final int EPISODES = 1000;
    private static final double ALPHA = 0.5;
    private static final double GAMMA = 1.0;
    private static final double EPSILON = 0.1;

    // Shortest route on the classic cliff: up, 11 steps along the edge, down.
    private static final int EDGE_PATH_STEPS = 13;

    @Test
    public void testQLearningTakesTheEdgePath() {
        GridWorld lCliff = GridWorld.cliffWalk(GridLayouts.classicCliff());
        LearningResult<Cell, Direction> lResult =
                new QLearner(ALPHA, GAMMA, EPSILON, new Random(42)).train(lCliff, EPISODES);

        PolicyRollout<Cell> lRollout = PolicyRollout.run(lCliff, lResult.getPolicy(), 100);
        assertTrue(lRollout.reachedGoal());
        assertEquals(EDGE_PATH_STEPS, lRollout.getSteps());
        for (int lCol = 0; lCol < 12; lCol++) {
            assertTrue(lRollout.getPath().contains(new Cell(2, lCol)));
        }
        checkCommonInvariants(lCliff, lResult);
    }

    @Test
    public void testSarsaKeepsAwayFromTheEdge() {
        GridWorld lCliff = GridWorld.cliffWalk(GridLayouts.classicCliff());
        LearningResult<Cell, Direction> lResult =
                new SarsaLearner(ALPHA, GAMMA, EPSILON, new Random(42)).train(lCliff, EPISODES);
        checkSafePath(lCliff, lResult);
        checkCommonInvariants(lCliff, lResult);
    }

    @Test
    public void testExpectedSarsaKeepsAwayFromTheEdge() {
        GridWorld lCliff = GridWorld.cliffWalk(GridLayouts.classicCliff());
        LearningResult<Cell, Direction> lResult =
                new ExpectedSarsaLearner(ALPHA, GAMMA, EPSILON, new Random(42)).train(lCliff, EPISODES);
        checkSafePath(lCliff, lResult);
        checkCommonInvariants(lCliff, lResult);
    }

    @Test
    public void testQLearningSolvesMaze() {
        GridWorld lMaze = GridWorld.maze(GridLayouts.smallMaze());
        QLearner lLearner = new QLearner(ALPHA, 0.9, EPSILON, new Random(7));
        lLearner.setProgressListener(new LoggingProgressListener("Q-learning", 100));
        LearningResult<Cell, Direction> lResult = lLearner.train(lMaze, 500);

        PolicyRollout<Cell> lRollout = PolicyRollout.run(lMaze, lResult.getPolicy(), 200);
        assertTrue(lRollout.reachedGoal());
        assertEquals(24, lRollout.getSteps());
        checkCommonInvariants(lMaze, lResult);
    }

    @Test
    public void testListenerSeesEveryEpisode() {
        GridWorld lCliff = GridWorld.cliffWalk(GridLayouts.smallCliff());
        List<Double> lSeen = new ArrayList<>();
        SarsaLearner lLearner = new SarsaLearner(ALPHA, GAMMA, EPSILON, new Random(3));
        lLearner.setProgressListener((xiEpisode, xiReward) -> {
            assertEquals(lSeen.size() + 1, xiEpisode);
            lSeen.add(xiReward);
        });
        LearningResult<Cell, Direction> lResult = lLearner.train(lCliff, 50);
        assertEquals(lResult.getRewardHistory(), lSeen);
    }

    @Test
    public void testSameSeedSameResult() {
        GridWorld lCliff = GridWorld.cliffWalk(GridLayouts.classicCliff());
        LearningResult<Cell, Direction> lFirst =
                new ExpectedSarsaLearner(ALPHA, GAMMA, EPSILON, new Random(99)).train(lCliff, 100);
        LearningResult<Cell, Direction> lSecond =
                new ExpectedSarsaLearner(ALPHA, GAMMA, EPSILON, new Random(99)).train(lCliff, 100);
        assertEquals(lFirst.getRewardHistory(), lSecond.getRewardHistory());
        assertEquals(lFirst.getPolicy().asMap(), lSecond.getPolicy().asMap());
    }

    @Test
    public void testZeroEpisodes() {
        GridWorld lCliff = GridWorld.cliffWalk(GridLayouts.smallCliff());
        LearningResult<Cell, Direction> lResult = new QLearner(new Random()).train(lCliff, 0);
        assertTrue(lResult.getRewardHistory().isEmpty());
        assertEquals(0, lResult.getPolicy().size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadAlphaRejected() {
        new QLearner(0.0, GAMMA, EPSILON, new Random());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeEpisodesRejected() {
        new SarsaLearner(new Random()).train(GridWorld.cliffWalk(GridLayouts.smallCliff()), -1);
    }

    private static void checkSafePath(GridWorld xiCliff, LearningResult<Cell, Direction> xiResult) {
        PolicyRollout<Cell> lRollout = PolicyRollout.run(xiCliff, xiResult.getPolicy(), 100);
        assertTrue(lRollout.reachedGoal());
        assertTrue(lRollout.getSteps() > EDGE_PATH_STEPS);
        for (int lCol = 1; lCol < 11; lCol++) {
            assertFalse("Walked along the cliff edge at column " + lCol,
                        lRollout.getPath().contains(new Cell(2, lCol)));
        }
    }

    private static void checkCommonInvariants(GridWorld xiWorld, LearningResult<Cell, Direction> xiResult) {
        QTable<Cell> lQTable = xiResult.getQTable();
        for (Cell lState : lQTable.getStates()) {
            assertEquals(xiWorld.getActions().size(), lQTable.getRow(lState).length);
        }
        // The goal row is never updated or used, so it is absent or all zero.
        if (lQTable.contains(xiWorld.getGoalState())) {
            assertEquals(0.0, lQTable.getBestValue(xiWorld.getGoalState()), 0);
        }
        assertNull(xiResult.getPolicy().getAction(xiWorld.getGoalState()));
    }
}
