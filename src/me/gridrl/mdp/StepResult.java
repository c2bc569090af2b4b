package me.gridrl.mdp;

/**
 * The outcome of performing an action: successor state, reward and terminal flag.
 */
public final class StepResult<S> {
    public final S mState;
    public final double mReward;
    public final boolean mTerminal;

    public StepResult(S xiState, double xiReward, boolean xiTerminal) {
        mState = xiState;
        mReward = xiReward;
        mTerminal = xiTerminal;
    }

    @Override
    public String toString() {
        return "-> " + mState + ", r=" + mReward + (mTerminal ? " (terminal)" : "");
    }
}
