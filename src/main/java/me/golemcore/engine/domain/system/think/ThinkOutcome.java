package me.golemcore.engine.domain.system.think;

/**
 * Decision of one think phase.
 *
 * @param shouldAct
 *            whether the act phase runs
 * @param replied
 *            the model answered with content only and no tool calls
 * @param failed
 *            the model call failed and a synthetic error message was recorded
 */
public record ThinkOutcome(boolean shouldAct, boolean replied, boolean failed) {

    public static ThinkOutcome act() {
        return new ThinkOutcome(true, false, false);
    }

    public static ThinkOutcome reply() {
        return new ThinkOutcome(false, true, false);
    }

    public static ThinkOutcome idle() {
        return new ThinkOutcome(false, false, false);
    }

    public static ThinkOutcome failure() {
        return new ThinkOutcome(false, false, true);
    }
}
