package me.gridrl.grids;

/**
 * Grid cell categories, with the integer codes used in layouts.
 */
public enum CellKind {
    OPEN(0), WALL(1), START(2), GOAL(3), HAZARD(4);

    private final int mCode;

    private CellKind(int xiCode) {
        mCode = xiCode;
    }

    public int getCode() {
        return mCode;
    }

    /**
     * @return whether an agent can ever be in a cell of this kind.
     */
    public boolean isOccupiable() {
        return (this == OPEN) || (this == START) || (this == GOAL);
    }

    public static CellKind fromCode(int xiCode) {
        for (CellKind lKind : values()) {
            if (lKind.mCode == xiCode) {
                return lKind;
            }
        }
        throw new IllegalArgumentException("Unknown cell code: " + xiCode);
    }
}
