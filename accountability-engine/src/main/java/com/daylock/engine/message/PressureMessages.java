package com.daylock.engine.message;

import com.daylock.engine.streak.StreakPhase;

import java.util.ArrayList;
import java.util.List;

/**
 * Chooses the pressure message for a {@link PressureContext}.
 *
 * <h3>Priority (first match wins)</h3>
 * <pre>
 *   all rooms complete                    → AllComplete
 *   missed recently, nothing submitted    → StreakBroken (lastStreak &gt; 3) / JustMissed
 *   open, nothing submitted               → ClosingSoon (critical/high) / OpenNoSubmit,
 *                                           plus StreakActive when streak &gt; 2
 *   closed                                → RoomLocked
 *   submitted with a streak               → Milestone on milestone days / StreakActive
 *   otherwise                             → OpenNoSubmit
 * </pre>
 *
 * <p>The variant within the pool is picked by {@code seed % poolSize}; callers pass the
 * current minute so the wording is stable within a minute instead of flickering.
 */
public final class PressureMessages {

    private static final int BROKEN_STREAK_MIN     = 3;
    private static final int ACTIVE_STREAK_MIN     = 2;

    private PressureMessages() {}

    /** The message categories that apply, in pool order. */
    public static List<PressureMessage> categoriesFor(PressureContext ctx) {
        if (ctx.allComplete()) {
            return List.of(new PressureMessage.AllComplete());
        }
        if (ctx.missedRecently() && !ctx.submitted()) {
            return List.of(ctx.lastStreak() > BROKEN_STREAK_MIN
                ? new PressureMessage.StreakBroken(ctx.lastStreak())
                : new PressureMessage.JustMissed());
        }
        if (ctx.open() && !ctx.submitted()) {
            List<PressureMessage> pool = new ArrayList<>(2);
            pool.add(ctx.urgency() != null && ctx.urgency().isPressing()
                ? new PressureMessage.ClosingSoon()
                : new PressureMessage.OpenNoSubmit());
            if (ctx.streak() > ACTIVE_STREAK_MIN) {
                pool.add(new PressureMessage.StreakActive(ctx.streak()));
            }
            return List.copyOf(pool);
        }
        if (!ctx.open()) {
            return List.of(new PressureMessage.RoomLocked(ctx.countdown() == null ? "" : ctx.countdown()));
        }
        if (ctx.streak() > 0 && ctx.submitted()) {
            return List.of(StreakPhase.isMilestone(ctx.streak())
                ? new PressureMessage.Milestone(ctx.streak(), StreakPhase.of(ctx.streak()))
                : new PressureMessage.StreakActive(ctx.streak()));
        }
        return List.of(new PressureMessage.OpenNoSubmit());
    }

    /**
     * @param seed any non-negative number; the same seed and context give the same message
     */
    public static RenderedMessage select(PressureContext ctx, int seed) {
        List<RenderedMessage> pool = new ArrayList<>();
        for (PressureMessage category : categoriesFor(ctx)) {
            pool.addAll(category.variants());
        }
        return pool.get(Math.floorMod(seed, pool.size()));
    }
}
