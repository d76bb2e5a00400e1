package com.daylock.engine.message;

import com.daylock.engine.streak.StreakPhase;
import com.daylock.engine.window.Urgency;

import java.util.List;

/**
 * Category of motivational/pressure copy shown next to a room.
 *
 * <p>Each category is its own record carrying exactly the values its wording needs, so
 * every substitution is checked at compile time rather than by placeholder replacement.
 */
public interface PressureMessage {

    /** Fixed pool of wordings for this category, in a stable order. */
    List<RenderedMessage> variants();

    record OpenNoSubmit() implements PressureMessage {
        @Override
        public List<RenderedMessage> variants() {
            return List.of(
                new RenderedMessage("The clock is ticking. Your discipline is being measured right now.", Urgency.HIGH),
                new RenderedMessage("Every second you wait, your streak gets more fragile.", Urgency.MEDIUM),
                new RenderedMessage("Winners don't wait. Prove it now.", Urgency.HIGH),
                new RenderedMessage("This window won't open again. Act now or face consequences.", Urgency.CRITICAL),
                new RenderedMessage("Your admin is watching. Don't give them a reason to doubt you.", Urgency.MEDIUM),
                new RenderedMessage("Discipline isn't about motivation. It's about doing it anyway.", Urgency.LOW),
                new RenderedMessage("The gap between who you are and who you want to be closes right here.", Urgency.MEDIUM));
        }
    }

    record ClosingSoon() implements PressureMessage {
        @Override
        public List<RenderedMessage> variants() {
            return List.of(
                new RenderedMessage("⚠️ FINAL WARNING: This room closes soon. Submit NOW.", Urgency.CRITICAL),
                new RenderedMessage("You have minutes, not hours. Don't blow this.", Urgency.CRITICAL),
                new RenderedMessage("Last chance. Miss this and your streak dies.", Urgency.CRITICAL),
                new RenderedMessage("The window is slamming shut. Move.", Urgency.CRITICAL));
        }
    }

    record StreakActive(int streak) implements PressureMessage {
        @Override
        public List<RenderedMessage> variants() {
            return List.of(
                new RenderedMessage("Don't break the chain. " + streak + " days of proof that you're different.", Urgency.MEDIUM),
                new RenderedMessage(streak + " days strong. One miss erases the momentum.", Urgency.MEDIUM),
                new RenderedMessage("Your " + streak + "-day streak is watching. Don't betray it.", Urgency.LOW),
                new RenderedMessage(streak + " days of evidence that you can do this. Keep going.", Urgency.LOW));
        }
    }

    record JustMissed() implements PressureMessage {
        @Override
        public List<RenderedMessage> variants() {
            return List.of(
                new RenderedMessage("You missed. That's not a small thing. Your streak is gone.", Urgency.CRITICAL),
                new RenderedMessage("Yesterday, you chose comfort over commitment. What will today be?", Urgency.HIGH),
                new RenderedMessage("A miss isn't just one day. It's proof that old habits are still stronger.", Urgency.HIGH),
                new RenderedMessage("Your admin was notified. Your record was updated. The evidence is permanent.", Urgency.CRITICAL));
        }
    }

    record StreakBroken(int lastStreak) implements PressureMessage {
        @Override
        public List<RenderedMessage> variants() {
            return List.of(
                new RenderedMessage("You were at " + lastStreak + " days. Now you're at 0. Let that sink in.", Urgency.CRITICAL),
                new RenderedMessage("The fall from " + lastStreak + " to 0 happened because of one choice.", Urgency.HIGH),
                new RenderedMessage("Recovery starts now. But the record remembers everything.", Urgency.MEDIUM));
        }
    }

    record Milestone(int streak, StreakPhase phase) implements PressureMessage {
        @Override
        public List<RenderedMessage> variants() {
            return List.of(
                new RenderedMessage("🔥 " + streak + " DAYS! You've earned the title: " + phase.getLabel() + ".", Urgency.LOW),
                new RenderedMessage("New identity unlocked: " + phase.getLabel() + " " + phase.getEmoji()
                    + ". The journey shaped you.", Urgency.LOW));
        }
    }

    record RoomLocked(String countdown) implements PressureMessage {
        @Override
        public List<RenderedMessage> variants() {
            return List.of(
                new RenderedMessage("Room locked. Your window opens in " + countdown + ". Be ready.", Urgency.LOW),
                new RenderedMessage("Prepare your proof. The room opens in " + countdown + ".", Urgency.LOW),
                new RenderedMessage("Locked for now. Discipline means being ready BEFORE it opens.", Urgency.LOW));
        }
    }

    record AllComplete() implements PressureMessage {
        @Override
        public List<RenderedMessage> variants() {
            return List.of(
                new RenderedMessage("All rooms complete. Today, you won. Tomorrow, prove it again.", Urgency.LOW),
                new RenderedMessage("100% attendance today. That's what discipline looks like.", Urgency.LOW),
                new RenderedMessage("Today's chapter is written. Make tomorrow's just as strong.", Urgency.LOW));
        }
    }
}
