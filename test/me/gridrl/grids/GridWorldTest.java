package me.gridrl.grids;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Collections;

import org.junit.Test;

import me.gridrl.mdp.InvalidActionException;
import me.gridrl.mdp.StepResult;

public class GridWorldTest {

    @Test
    public void testClassicCliffStates() {
        GridWorld lCliff = GridWorld.cliffWalk(GridLayouts.classicCliff());
        assertEquals(new Cell(3, 0), lCliff.getStartState());
        assertEquals(new Cell(3, 11), lCliff.getGoalState());
        // 36 open cells plus start and goal. The cliff itself is never occupied.
        assertEquals(38, lCliff.getStates().size());
        assertFalse(lCliff.getStates().contains(new Cell(3, 5)));
        assertEquals(4, lCliff.getActions().size());
    }

    @Test
    public void testFallingOffTheCliffResetsToStart() {
        GridWorld lCliff = GridWorld.cliffWalk(GridLayouts.classicCliff());
        StepResult<Cell> lResult = lCliff.step(new Cell(2, 4), Direction.S);
        assertEquals(new Cell(3, 0), lResult.mState);
        assertEquals(-100, lResult.mReward, 0);
        assertFalse(lResult.mTerminal);

        lResult = lCliff.step(new Cell(3, 0), Direction.E);
        assertEquals(new Cell(3, 0), lResult.mState);
        assertEquals(-100, lResult.mReward, 0);
    }

    @Test
    public void testHazardBlocksInMaze() {
        GridWorld lMaze = GridWorld.maze(GridLayouts.classicCliff());
        StepResult<Cell> lResult = lMaze.step(new Cell(2, 4), Direction.S);
        assertEquals(new Cell(2, 4), lResult.mState);
        assertEquals(-1, lResult.mReward, 0);
        assertFalse(lResult.mTerminal);
    }

    @Test
    public void testWallsAndEdgesBlock() {
        GridWorld lMaze = GridWorld.maze(GridLayouts.smallMaze());
        // (0,3) is a wall.
        StepResult<Cell> lResult = lMaze.step(new Cell(0, 2), Direction.E);
        assertEquals(new Cell(0, 2), lResult.mState);
        assertEquals(-1, lResult.mReward, 0);

        lResult = lMaze.step(new Cell(0, 0), Direction.N);
        assertEquals(new Cell(0, 0), lResult.mState);
        assertFalse(lResult.mTerminal);

        assertFalse(lMaze.getStates().contains(new Cell(0, 3)));
    }

    @Test
    public void testReachingGoal() {
        GridWorld lCliff = GridWorld.cliffWalk(GridLayouts.classicCliff(), -1, -100, 10);
        StepResult<Cell> lResult = lCliff.step(new Cell(2, 11), Direction.S);
        assertEquals(lCliff.getGoalState(), lResult.mState);
        assertEquals(10, lResult.mReward, 0);
        assertTrue(lResult.mTerminal);
    }

    @Test
    public void testGoalIsAbsorbing() {
        GridWorld lCliff = GridWorld.cliffWalk(GridLayouts.classicCliff());
        for (Direction lDirection : Direction.values()) {
            StepResult<Cell> lResult = lCliff.step(lCliff.getGoalState(), lDirection);
            assertEquals(lCliff.getGoalState(), lResult.mState);
            assertEquals(0, lResult.mReward, 0);
            assertTrue(lResult.mTerminal);
        }
        assertTrue(lCliff.isTerminal(new Cell(3, 11)));
    }

    @Test(expected = InvalidActionException.class)
    public void testNullActionRejected() {
        GridWorld.maze(GridLayouts.smallMaze()).step(new Cell(0, 0), null);
    }

    @Test
    public void testActionOutsideConfiguredSetRejected() {
        GridWorld lMaze = new GridWorld(new int[][] { { 2, 0, 3 } },
                                        GridWorld.maze(GridLayouts.smallMaze()).getOutcomes(),
                                        -1,
                                        Collections.singletonList(Direction.E));
        assertEquals(new Cell(0, 1), lMaze.step(new Cell(0, 0), Direction.E).mState);
        try {
            lMaze.step(new Cell(0, 0), Direction.W);
            throw new AssertionError("W shouldn't be accepted");
        } catch (InvalidActionException lEx) {
            assertEquals(Direction.W, lEx.getAction());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingGoalRejected() {
        GridWorld.maze(new int[][] { { 2, 0, 0 } });
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTwoStartsRejected() {
        GridWorld.maze(new int[][] { { 2, 2, 3 } });
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRaggedLayoutRejected() {
        GridWorld.maze(new int[][] { { 2, 0, 3 }, { 0 } });
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNaNRewardRejected() {
        GridWorld.cliffWalk(GridLayouts.classicCliff(), -1, Double.NaN, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInfiniteRewardRejected() {
        CellOutcome.enter(Double.NEGATIVE_INFINITY);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownCellCodeRejected() {
        GridWorld.maze(new int[][] { { 2, 7, 3 } });
    }
}
