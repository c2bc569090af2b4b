package me.gridrl.grids;

/**
 * Some standard layouts. Codes are those of {@link CellKind}: 0 path, 1 wall, 2 start, 3 goal, 4 hazard.
 */
public final class GridLayouts {
    private GridLayouts() {
    }

    /**
     * The 4x12 cliff walk from Sutton and Barto, example 6.6.
     */
    public static int[][] classicCliff() {
        return new int[][] {
            { 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0 },
            { 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0 },
            { 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0 },
            { 2, 4, 4, 4, 4, 4, 4, 4, 4, 4, 4, 3 }
        };
    }

    /**
     * A tiny cliff where the only safe route to the goal runs through the centre.
     */
    public static int[][] smallCliff() {
        return new int[][] {
            { 2, 0, 4 },
            { 4, 0, 0 },
            { 0, 0, 3 }
        };
    }

    /**
     * A small winding maze with a hazard strip along the bottom. The only route is 24 steps long.
     */
    public static int[][] smallMaze() {
        return new int[][] {
            { 0, 0, 0, 1, 0, 0, 0, 1, 0, 0, 0 },
            { 0, 1, 0, 1, 0, 1, 0, 1, 0, 1, 0 },
            { 0, 1, 0, 0, 0, 1, 0, 0, 0, 1, 0 },
            { 2, 4, 4, 4, 4, 4, 4, 4, 4, 4, 3 }
        };
    }
}
