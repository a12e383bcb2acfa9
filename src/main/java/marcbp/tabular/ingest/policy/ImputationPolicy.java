package marcbp.tabular.ingest.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Missing-value policy resolved for one dataset: an effective strategy per feature plus the row-drop flags.
 *
 * @param featureStrategies effective strategy per feature column, in feature order
 * @param targetStrategy explicit strategy governing the target, if any
 * @param dropColumns features whose effective strategy is drop-row
 * @param globalDrop whether the global fallback is drop-row
 * @param targetDrop whether rows with a missing target are dropped
 */
public record ImputationPolicy(
        Map<String, MissingValueStrategy> featureStrategies,
        Optional<MissingValueStrategy> targetStrategy,
        List<String> dropColumns,
        boolean globalDrop,
        boolean targetDrop) {

    public ImputationPolicy {
        featureStrategies = Collections.unmodifiableMap(
                new LinkedHashMap<>(requireNonNull(featureStrategies, "featureStrategies is null")));
        targetStrategy = requireNonNull(targetStrategy, "targetStrategy is null");
        dropColumns = List.copyOf(requireNonNull(dropColumns, "dropColumns is null"));
    }

    public MissingValueStrategy strategyFor(String feature) {
        return featureStrategies.getOrDefault(feature, MissingValueStrategy.LEAVE_AS_IS);
    }

    public boolean dropApplied() {
        return globalDrop || !dropColumns.isEmpty() || targetDrop;
    }
}
