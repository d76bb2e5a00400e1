package com.daylock.engine.escalation;

import com.daylock.engine.model.Consequence;
import com.daylock.engine.model.ConsequenceLevel;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Advisory consequence escalation over the tier scale
 * {@code warning < strike < probation < final_warning < removal}.
 *
 * <h3>Lifecycle</h3>
 * <pre>
 *   Issued(level) ──► Active ──► Resolved      (one-way; a re-offence issues a new consequence)
 * </pre>
 *
 * <p>The engine only <em>suggests</em>: an operator issues or resolves consequences and the
 * persistence collaborator stores them. Nothing here mutates the supplied list.
 *
 * <p>The plain overloads trust the {@code active} flag. The {@link Instant} overloads also
 * treat an active consequence past its {@code expiresAt} as resolved.
 */
public final class EscalationStateMachine {

    private EscalationStateMachine() {}

    /**
     * Suggests the tier for the next consequence: {@code warning} when nothing is active,
     * otherwise one tier above the highest active tier, saturating at {@code removal}.
     * Tiers are never skipped regardless of how severe the latest offence was.
     */
    public static ConsequenceLevel nextLevel(List<Consequence> consequences) {
        return escalate(highestActive(consequences, Consequence::active));
    }

    public static ConsequenceLevel nextLevel(List<Consequence> consequences, Instant now) {
        return escalate(highestActive(consequences, c -> c.isActiveAt(now)));
    }

    public static ConsequenceSummary summarize(List<Consequence> consequences) {
        return partition(consequences, Consequence::active);
    }

    public static ConsequenceSummary summarize(List<Consequence> consequences, Instant now) {
        return partition(consequences, c -> c.isActiveAt(now));
    }

    /** Tier directly above {@code current}; {@code removal} stays {@code removal}. */
    public static ConsequenceLevel escalate(ConsequenceLevel current) {
        if (current == null) return ConsequenceLevel.WARNING;
        ConsequenceLevel[] tiers = ConsequenceLevel.values();
        return tiers[Math.min(current.ordinal() + 1, tiers.length - 1)];
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private static ConsequenceLevel highestActive(List<Consequence> consequences,
                                                  Predicate<Consequence> isActive) {
        ConsequenceLevel highest = null;
        if (consequences != null) {
            for (Consequence c : consequences) {
                if (c == null || c.level() == null || !isActive.test(c)) continue;
                if (c.level().isMoreSevereThan(highest)) highest = c.level();
            }
        }
        return highest;
    }

    private static ConsequenceSummary partition(List<Consequence> consequences,
                                                Predicate<Consequence> isActive) {
        if (consequences == null || consequences.isEmpty()) return ConsequenceSummary.EMPTY;

        List<Consequence> active = new ArrayList<>();
        List<Consequence> resolved = new ArrayList<>();
        Consequence highest = null;

        for (Consequence c : consequences) {
            if (c == null) continue;
            if (!isActive.test(c)) {
                resolved.add(c);
                continue;
            }
            active.add(c);
            if (c.level() != null
                    && (highest == null || c.level().isMoreSevereThan(highest.level()))) {
                highest = c;
            }
        }

        int total = (int) consequences.stream().filter(Objects::nonNull).count();
        return new ConsequenceSummary(List.copyOf(active), List.copyOf(resolved), highest, total);
    }
}
