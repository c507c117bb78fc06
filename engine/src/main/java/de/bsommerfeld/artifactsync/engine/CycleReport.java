package de.bsommerfeld.artifactsync.engine;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Summary of one scheduler cycle.
 *
 * @param targets    jobs dispatched plus branches skipped at dispatch
 * @param outcomes   finished or skipped jobs per outcome
 * @param unfinished jobs still running when the cycle timeout expired
 * @param deferred   {@code true} if the catalog could not be read
 * @param elapsed    wall time of the cycle
 */
public record CycleReport(int targets, Map<JobOutcome, Integer> outcomes, int unfinished, boolean deferred,
        Duration elapsed) {

    public CycleReport {
        EnumMap<JobOutcome, Integer> copy = new EnumMap<>(JobOutcome.class);
        copy.putAll(outcomes);
        outcomes = Collections.unmodifiableMap(copy);
    }

    static CycleReport deferred(Duration elapsed) {
        return new CycleReport(0, Map.of(), 0, true, elapsed);
    }

    public int count(JobOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0);
    }

    @Override
    public String toString() {
        if (deferred) return "deferred (catalog unavailable)";
        StringBuilder sb = new StringBuilder().append(targets).append(" target(s)");
        outcomes.forEach((outcome, n) -> sb.append(", ").append(outcome.name().toLowerCase(Locale.ROOT))
                .append('=').append(n));
        if (unfinished > 0) sb.append(", unfinished=").append(unfinished);
        return sb.append(" in ").append(elapsed.toMillis()).append(" ms").toString();
    }
}
