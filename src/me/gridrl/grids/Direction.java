package me.gridrl.grids;

/**
 * Compass moves. The declaration order is the action order used for deterministic tie-breaking.
 */
public enum Direction {
    N(-1, 0), S(1, 0), W(0, -1), E(0, 1);

    private final int mRowDelta;
    private final int mColDelta;

    private Direction(int xiRowDelta, int xiColDelta) {
        mRowDelta = xiRowDelta;
        mColDelta = xiColDelta;
    }

    public int getRowDelta() {
        return mRowDelta;
    }

    public int getColDelta() {
        return mColDelta;
    }
}
