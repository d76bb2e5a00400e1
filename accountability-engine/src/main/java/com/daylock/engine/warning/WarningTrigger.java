package com.daylock.engine.warning;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Behavioural patterns scanned by {@link WarningDetector}. Each trigger owns its label,
 * severity and message wording; the detector only supplies the observed value.
 */
public enum WarningTrigger {

    CONSECUTIVE_MISSES("Consecutive Misses", WarningSeverity.WARNING) {
        @Override
        public String message(double value) {
            return String.format("%d consecutive days missed. This pattern needs attention.", (long) value);
        }
    },

    LOW_ATTENDANCE_RATE("Low Attendance Rate", WarningSeverity.WARNING) {
        @Override
        public String message(double value) {
            return String.format("Attendance rate dropped to %d%%. Below acceptable threshold.", (long) value);
        }
    },

    REPEATED_REJECTIONS("Repeated Rejections", WarningSeverity.STRIKE) {
        @Override
        public String message(double value) {
            return String.format("%d proofs rejected recently. Quality standards not being met.", (long) value);
        }
    },

    LOW_QUALITY_AVG("Low Quality Average", WarningSeverity.WARNING) {
        @Override
        public String message(double value) {
            return String.format(Locale.ROOT, "Average quality rating is %.1f/5. Effort may be declining.", value);
        }
    },

    WEEK_WITHOUT_SUBMISSION("No Submissions", WarningSeverity.STRIKE) {
        @Override
        public String message(double value) {
            return String.format("No proof submitted in %d days. User may have disengaged.", (long) value);
        }
    };

    private final String label;
    private final WarningSeverity severity;

    WarningTrigger(String label, WarningSeverity severity) {
        this.label    = label;
        this.severity = severity;
    }

    public String label() {
        return label;
    }

    public WarningSeverity severity() {
        return severity;
    }

    public abstract String message(double value);

    @JsonValue
    public String id() {
        return name();
    }
}
