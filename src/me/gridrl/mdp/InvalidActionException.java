package me.gridrl.mdp;

/**
 * Thrown when an MDP is asked to perform an action outside its action set. This is a programming error and isn't
 * expected to be caught.
 */
public class InvalidActionException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final transient Object mAction;

    public InvalidActionException(Object xiAction) {
        super("Invalid action: " + xiAction);
        mAction = xiAction;
    }

    /**
     * @return the rejected action (possibly null).
     */
    public Object getAction() {
        return mAction;
    }
}
