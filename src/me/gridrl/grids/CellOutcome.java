package me.gridrl.grids;

/**
 * What happens when an agent tries to move into a cell of a particular kind.
 */
public final class CellOutcome {
    public enum Effect {
        /** Move into the cell. */
        ENTER,
        /** Stay where you are. */
        BLOCK,
        /** Teleport back to the start cell. The episode continues. */
        RESET_TO_START,
        /** Move into the cell and end the episode. */
        TERMINATE
    }

    private final Effect mEffect;
    private final double mReward;

    public CellOutcome(Effect xiEffect, double xiReward) {
        if (xiEffect == null) {
            throw new IllegalArgumentException("Effect must be specified");
        }
        if (!Double.isFinite(xiReward)) {
            throw new IllegalArgumentException("Reward must be finite, got " + xiReward);
        }
        mEffect = xiEffect;
        mReward = xiReward;
    }

    public static CellOutcome enter(double xiReward) {
        return new CellOutcome(Effect.ENTER, xiReward);
    }

    public static CellOutcome block(double xiReward) {
        return new CellOutcome(Effect.BLOCK, xiReward);
    }

    public static CellOutcome resetToStart(double xiReward) {
        return new CellOutcome(Effect.RESET_TO_START, xiReward);
    }

    public static CellOutcome terminate(double xiReward) {
        return new CellOutcome(Effect.TERMINATE, xiReward);
    }

    public Effect getEffect() {
        return mEffect;
    }

    public double getReward() {
        return mReward;
    }

    @Override
    public String toString() {
        return mEffect + "(" + mReward + ")";
    }
}
