package me.gridrl.grids;

/**
 * A grid position. Rows grow downwards, columns grow to the right.
 */
public final class Cell {
    private final int mRow;
    private final int mCol;

    public Cell(int xiRow, int xiCol) {
        mRow = xiRow;
        mCol = xiCol;
    }

    public int getRow() {
        return mRow;
    }

    public int getCol() {
        return mCol;
    }

    /**
     * @return the neighbouring position in the given direction. Not bounds-checked.
     */
    public Cell move(Direction xiDirection) {
        return new Cell(mRow + xiDirection.getRowDelta(), mCol + xiDirection.getColDelta());
    }

    @Override
    public String toString() {
        return "(" + mRow + "," + mCol + ")";
    }

    @Override
    public boolean equals(Object xiOther) {
        if (!(xiOther instanceof Cell)) {
            return false;
        }
        Cell lOther = (Cell) xiOther;
        return ((lOther.mRow == mRow) && (lOther.mCol == mCol));
    }

    @Override
    public int hashCode() {
        return 31 * mRow + mCol;
    }
}
