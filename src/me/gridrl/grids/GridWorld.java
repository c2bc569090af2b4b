package me.gridrl.grids;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import me.gridrl.mdp.InvalidActionException;
import me.gridrl.mdp.MDP;
import me.gridrl.mdp.StepResult;

/**
 * A deterministic grid world.
 *
 * The behaviour of each cell kind is given by a {@link CellOutcome} table, so the same type models both a plain maze
 * (hazards block like walls) and the cliff walk (falling into a hazard sends you back to the start with a large
 * penalty). Moving off the edge of the grid leaves the agent where it was and earns the off-grid reward.
 */
public class GridWorld implements MDP<Cell, Direction> {
    public static final double DEFAULT_STEP_REWARD = -1.0;
    public static final double DEFAULT_CLIFF_REWARD = -100.0;
    public static final double DEFAULT_GOAL_REWARD = 0.0;

    private final CellKind[][] mKinds;
    private final int mHeight;
    private final int mWidth;
    private final Map<CellKind, CellOutcome> mOutcomes;
    private final double mOffGridReward;
    private final List<Direction> mActions;
    private final List<Cell> mStates;
    private final Cell mStart;
    private final Cell mGoal;

    /**
     * Create a grid world.
     *
     * @param xiLayout - rectangular layout of {@link CellKind} codes with exactly one start and one goal.
     * @param xiOutcomes - outcome for moving into each kind of cell. Must cover every kind.
     * @param xiOffGridReward - reward for attempting to move off the grid.
     * @param xiActions - the action set, in tie-breaking order.
     */
    public GridWorld(int[][] xiLayout,
                     Map<CellKind, CellOutcome> xiOutcomes,
                     double xiOffGridReward,
                     List<Direction> xiActions) {
        if ((xiLayout == null) || (xiLayout.length == 0) || (xiLayout[0].length == 0)) {
            throw new IllegalArgumentException("Layout must have at least one cell");
        }
        if ((xiActions == null) || xiActions.isEmpty()) {
            throw new IllegalArgumentException("At least one action is required");
        }
        if (!Double.isFinite(xiOffGridReward)) {
            throw new IllegalArgumentException("Off-grid reward must be finite, got " + xiOffGridReward);
        }
        for (CellKind lKind : CellKind.values()) {
            if (!xiOutcomes.containsKey(lKind)) {
                throw new IllegalArgumentException("No outcome configured for " + lKind);
            }
        }

        mHeight = xiLayout.length;
        mWidth = xiLayout[0].length;
        mKinds = new CellKind[mHeight][mWidth];
        mOutcomes = new EnumMap<>(xiOutcomes);
        mOffGridReward = xiOffGridReward;
        mActions = Collections.unmodifiableList(new ArrayList<>(xiActions));

        List<Cell> lStates = new ArrayList<>();
        Cell lStart = null;
        Cell lGoal = null;
        for (int lRow = 0; lRow < mHeight; lRow++) {
            if (xiLayout[lRow].length != mWidth) {
                throw new IllegalArgumentException("Layout isn't rectangular at row " + lRow);
            }
            for (int lCol = 0; lCol < mWidth; lCol++) {
                CellKind lKind = CellKind.fromCode(xiLayout[lRow][lCol]);
                mKinds[lRow][lCol] = lKind;
                Cell lCell = new Cell(lRow, lCol);
                if (lKind == CellKind.START) {
                    if (lStart != null) {
                        throw new IllegalArgumentException("Layout has more than one start: " + lStart + ", " + lCell);
                    }
                    lStart = lCell;
                } else if (lKind == CellKind.GOAL) {
                    if (lGoal != null) {
                        throw new IllegalArgumentException("Layout has more than one goal: " + lGoal + ", " + lCell);
                    }
                    lGoal = lCell;
                }
                if (lKind.isOccupiable()) {
                    lStates.add(lCell);
                }
            }
        }
        if ((lStart == null) || (lGoal == null)) {
            throw new IllegalArgumentException("Layout needs exactly one start and one goal");
        }

        mStates = Collections.unmodifiableList(lStates);
        mStart = lStart;
        mGoal = lGoal;
    }

    /**
     * Create a maze. Walls and hazards both block movement.
     */
    public static GridWorld maze(int[][] xiLayout, double xiStepReward, double xiGoalReward) {
        Map<CellKind, CellOutcome> lOutcomes = new EnumMap<>(CellKind.class);
        lOutcomes.put(CellKind.OPEN, CellOutcome.enter(xiStepReward));
        lOutcomes.put(CellKind.START, CellOutcome.enter(xiStepReward));
        lOutcomes.put(CellKind.GOAL, CellOutcome.terminate(xiGoalReward));
        lOutcomes.put(CellKind.WALL, CellOutcome.block(xiStepReward));
        lOutcomes.put(CellKind.HAZARD, CellOutcome.block(xiStepReward));
        return new GridWorld(xiLayout, lOutcomes, xiStepReward, Arrays.asList(Direction.values()));
    }

    public static GridWorld maze(int[][] xiLayout) {
        return maze(xiLayout, DEFAULT_STEP_REWARD, DEFAULT_GOAL_REWARD);
    }

    /**
     * Create a cliff walk. Stepping into a hazard sends the agent back to the start with the cliff reward.
     */
    public static GridWorld cliffWalk(int[][] xiLayout, double xiStepReward, double xiCliffReward, double xiGoalReward) {
        Map<CellKind, CellOutcome> lOutcomes = new EnumMap<>(CellKind.class);
        lOutcomes.put(CellKind.OPEN, CellOutcome.enter(xiStepReward));
        lOutcomes.put(CellKind.START, CellOutcome.enter(xiStepReward));
        lOutcomes.put(CellKind.GOAL, CellOutcome.terminate(xiGoalReward));
        lOutcomes.put(CellKind.WALL, CellOutcome.block(xiStepReward));
        lOutcomes.put(CellKind.HAZARD, CellOutcome.resetToStart(xiCliffReward));
        return new GridWorld(xiLayout, lOutcomes, xiStepReward, Arrays.asList(Direction.values()));
    }

    public static GridWorld cliffWalk(int[][] xiLayout) {
        return cliffWalk(xiLayout, DEFAULT_STEP_REWARD, DEFAULT_CLIFF_REWARD, DEFAULT_GOAL_REWARD);
    }

    @Override
    public List<Cell> getStates() {
        return mStates;
    }

    @Override
    public List<Direction> getActions() {
        return mActions;
    }

    @Override
    public Cell getStartState() {
        return mStart;
    }

    @Override
    public Cell getGoalState() {
        return mGoal;
    }

    public int getHeight() {
        return mHeight;
    }

    public int getWidth() {
        return mWidth;
    }

    /**
     * @return the outcome table this world was built with.
     */
    public Map<CellKind, CellOutcome> getOutcomes() {
        return Collections.unmodifiableMap(mOutcomes);
    }

    public CellKind getKind(Cell xiCell) {
        return mKinds[xiCell.getRow()][xiCell.getCol()];
    }

    private boolean inBounds(Cell xiCell) {
        return (xiCell.getRow() >= 0) && (xiCell.getRow() < mHeight) &&
               (xiCell.getCol() >= 0) && (xiCell.getCol() < mWidth);
    }

    @Override
    public StepResult<Cell> step(Cell xiState, Direction xiAction) {
        if ((xiAction == null) || !mActions.contains(xiAction)) {
            throw new InvalidActionException(xiAction);
        }

        // The goal is absorbing.
        if (mGoal.equals(xiState)) {
            return new StepResult<>(mGoal, 0, true);
        }

        Cell lTarget = xiState.move(xiAction);
        if (!inBounds(lTarget)) {
            return new StepResult<>(xiState, mOffGridReward, false);
        }

        CellOutcome lOutcome = mOutcomes.get(getKind(lTarget));
        switch (lOutcome.getEffect()) {
            case ENTER:
                return new StepResult<>(lTarget, lOutcome.getReward(), false);
            case BLOCK:
                return new StepResult<>(xiState, lOutcome.getReward(), false);
            case RESET_TO_START:
                return new StepResult<>(mStart, lOutcome.getReward(), false);
            case TERMINATE:
                return new StepResult<>(lTarget, lOutcome.getReward(), true);
            default:
                throw new IllegalStateException("Unhandled effect: " + lOutcome.getEffect());
        }
    }

    @Override
    public String toString() {
        return "GridWorld " + mHeight + "x" + mWidth + ", start=" + mStart + ", goal=" + mGoal;
    }
}
