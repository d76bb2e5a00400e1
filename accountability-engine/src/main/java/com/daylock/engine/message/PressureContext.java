package com.daylock.engine.message;

import com.daylock.engine.window.Urgency;
import com.daylock.engine.window.WindowStatus;

/**
 * What the user is looking at when a pressure message is chosen.
 *
 * @param countdown      formatted time until the window opens; only used while closed
 * @param allComplete    today's proof is approved, nothing left to push for
 * @param missedRecently a recent miss or rejection still awaits a reflection
 */
public record PressureContext(
    boolean open,
    boolean submitted,
    int     streak,
    int     lastStreak,
    Urgency urgency,
    String  countdown,
    boolean allComplete,
    boolean missedRecently
) {

    /** Context for a single room derived from its window status. */
    public static PressureContext forRoom(WindowStatus window,
                                          boolean submitted,
                                          int streak,
                                          int lastStreak,
                                          boolean allComplete,
                                          boolean missedRecently) {
        return new PressureContext(window.open(), submitted, streak, lastStreak,
            window.urgency(), window.timeRemaining(), allComplete, missedRecently);
    }
}
