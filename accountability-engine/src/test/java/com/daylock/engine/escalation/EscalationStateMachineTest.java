package com.daylock.engine.escalation;

import com.daylock.engine.model.Consequence;
import com.daylock.engine.model.ConsequenceLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link EscalationStateMachine}.
 */
class EscalationStateMachineTest {

    private static final Instant NOW = Instant.parse("2024-03-15T12:00:00Z");

    private static Consequence active(ConsequenceLevel level) {
        return Consequence.issue(level, "test", NOW.minusSeconds(3600));
    }

    private static Consequence resolved(ConsequenceLevel level) {
        return new Consequence(level, "test", "lifted", false, NOW.minusSeconds(7200), null);
    }

    @Nested
    @DisplayName("next level")
    class NextLevel {

        @Test
        @DisplayName("no consequences → warning")
        void emptyHistory() {
            assertEquals(ConsequenceLevel.WARNING, EscalationStateMachine.nextLevel(List.of()));
            assertEquals(ConsequenceLevel.WARNING, EscalationStateMachine.nextLevel(null));
        }

        @Test
        @DisplayName("active probation → final warning")
        void oneAboveHighest() {
            List<Consequence> history = List.of(
                active(ConsequenceLevel.WARNING),
                active(ConsequenceLevel.PROBATION),
                active(ConsequenceLevel.STRIKE));
            assertEquals(ConsequenceLevel.FINAL_WARNING, EscalationStateMachine.nextLevel(history));
        }

        @Test
        @DisplayName("active removal saturates at removal")
        void saturates() {
            assertEquals(ConsequenceLevel.REMOVAL,
                EscalationStateMachine.nextLevel(List.of(active(ConsequenceLevel.REMOVAL))));
        }

        @Test
        @DisplayName("resolved consequences are ignored")
        void resolvedIgnored() {
            List<Consequence> history = List.of(
                resolved(ConsequenceLevel.FINAL_WARNING),
                active(ConsequenceLevel.WARNING));
            assertEquals(ConsequenceLevel.STRIKE, EscalationStateMachine.nextLevel(history));
            assertEquals(ConsequenceLevel.WARNING,
                EscalationStateMachine.nextLevel(List.of(resolved(ConsequenceLevel.REMOVAL))));
        }

        @Test
        @DisplayName("tiers are never skipped")
        void noSkipping() {
            ConsequenceLevel level = null;
            List<ConsequenceLevel> path = new ArrayList<>();
            for (int i = 0; i < 7; i++) {
                level = EscalationStateMachine.escalate(level);
                path.add(level);
            }
            assertEquals(List.of(
                ConsequenceLevel.WARNING, ConsequenceLevel.STRIKE, ConsequenceLevel.PROBATION,
                ConsequenceLevel.FINAL_WARNING, ConsequenceLevel.REMOVAL,
                ConsequenceLevel.REMOVAL, ConsequenceLevel.REMOVAL), path);
        }

        @Test
        @DisplayName("input list is not mutated")
        void inputUntouched() {
            List<Consequence> history = new ArrayList<>(List.of(active(ConsequenceLevel.STRIKE)));
            EscalationStateMachine.nextLevel(history);
            EscalationStateMachine.summarize(history);
            assertEquals(1, history.size());
            assertTrue(history.get(0).active());
        }
    }

    @Nested
    @DisplayName("expiry")
    class Expiry {

        @Test
        @DisplayName("an expired consequence counts as resolved for the instant overloads")
        void expiredIsResolved() {
            Consequence expired = new Consequence(ConsequenceLevel.PROBATION, "late", null, true,
                NOW.minusSeconds(86_400), NOW.minusSeconds(60));

            assertEquals(ConsequenceLevel.WARNING, EscalationStateMachine.nextLevel(List.of(expired), NOW));
            assertEquals(ConsequenceLevel.FINAL_WARNING, EscalationStateMachine.nextLevel(List.of(expired)));

            ConsequenceSummary summary = EscalationStateMachine.summarize(List.of(expired), NOW);
            assertTrue(summary.active().isEmpty());
            assertEquals(List.of(expired), summary.resolved());
            assertFalse(summary.hasActive());
        }

        @Test
        @DisplayName("an unexpired consequence stays active")
        void notYetExpired() {
            Consequence pending = new Consequence(ConsequenceLevel.STRIKE, "late", null, true,
                NOW.minusSeconds(60), NOW.plusSeconds(3600));
            assertEquals(ConsequenceLevel.PROBATION, EscalationStateMachine.nextLevel(List.of(pending), NOW));
        }
    }

    @Nested
    @DisplayName("summary")
    class Summary {

        @Test
        @DisplayName("partitions active and resolved, picks the highest active")
        void partition() {
            Consequence warning   = active(ConsequenceLevel.WARNING);
            Consequence probation = active(ConsequenceLevel.PROBATION);
            Consequence lifted    = resolved(ConsequenceLevel.REMOVAL);

            ConsequenceSummary summary = EscalationStateMachine.summarize(List.of(warning, lifted, probation));

            assertEquals(List.of(warning, probation), summary.active());
            assertEquals(List.of(lifted), summary.resolved());
            assertEquals(probation, summary.highest());
            assertEquals(3, summary.total());
            assertTrue(summary.hasActive());
        }

        @Test
        @DisplayName("ties keep the first consequence listed")
        void tieKeepsFirst() {
            Consequence first  = new Consequence(ConsequenceLevel.STRIKE, "first", null, true, NOW, null);
            Consequence second = new Consequence(ConsequenceLevel.STRIKE, "second", null, true, NOW, null);
            assertSame(first, EscalationStateMachine.summarize(List.of(first, second)).highest());
        }

        @Test
        @DisplayName("empty history → empty summary")
        void empty() {
            assertEquals(ConsequenceSummary.EMPTY, EscalationStateMachine.summarize(List.of()));
            assertNull(EscalationStateMachine.summarize(null).highest());
        }
    }

    @Test
    @DisplayName("level codes round-trip and unknown codes are rejected")
    void levelCodes() {
        assertEquals(ConsequenceLevel.FINAL_WARNING, ConsequenceLevel.fromCode("final_warning"));
        assertEquals(ConsequenceLevel.FINAL_WARNING, ConsequenceLevel.fromCode("FINAL_WARNING"));
        assertEquals("Final Warning", ConsequenceLevel.FINAL_WARNING.label());
        assertEquals(5, ConsequenceLevel.REMOVAL.severity());
        assertThrows(IllegalArgumentException.class, () -> ConsequenceLevel.fromCode("banished"));
    }
}
