package marcbp.tabular.ingest.policy;

import marcbp.tabular.ingest.config.IngestionConfig;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Merges the global fallback strategy with per-column overrides into one {@link ImputationPolicy}.
 */
public final class PolicyResolver {
    private PolicyResolver() {}

    public static ImputationPolicy resolve(List<String> features, Optional<String> target, IngestionConfig config) {
        return resolve(features, target, config.globalStrategy(), config.columnStrategies(), config.inferTargetDropFromFeatures());
    }

    /**
     * @param inferTargetDropFromFeatures when the target has no explicit strategy, drop rows with a missing
     *                                    target as soon as any feature drops rows
     */
    public static ImputationPolicy resolve(List<String> features,
                                           Optional<String> target,
                                           Optional<MissingValueStrategy> globalStrategy,
                                           Map<String, MissingValueStrategy> columnStrategies,
                                           boolean inferTargetDropFromFeatures) {
        requireNonNull(features, "features is null");
        requireNonNull(target, "target is null");
        requireNonNull(globalStrategy, "globalStrategy is null");
        requireNonNull(columnStrategies, "columnStrategies is null");

        Map<String, MissingValueStrategy> effective = new LinkedHashMap<>();
        List<String> dropColumns = new ArrayList<>();
        for (String feature : features) {
            MissingValueStrategy strategy = effectiveStrategy(feature, globalStrategy, columnStrategies);
            effective.put(feature, strategy);
            if (strategy.isDropRow()) {
                dropColumns.add(feature);
            }
        }

        boolean globalDrop = globalStrategy.map(MissingValueStrategy::isDropRow).orElse(false);
        Optional<MissingValueStrategy> targetStrategy = target.flatMap(name ->
                Optional.ofNullable(columnStrategies.get(name)).or(() -> globalStrategy));

        boolean targetDrop;
        if (target.isEmpty()) {
            targetDrop = false;
        }
        else if (globalDrop) {
            targetDrop = true;
        }
        else if (targetStrategy.isPresent()) {
            targetDrop = targetStrategy.get().isDropRow();
        }
        else {
            targetDrop = inferTargetDropFromFeatures && !dropColumns.isEmpty();
        }
        return new ImputationPolicy(effective, targetStrategy, dropColumns, globalDrop, targetDrop);
    }

    public static MissingValueStrategy effectiveStrategy(String column,
                                                         Optional<MissingValueStrategy> globalStrategy,
                                                         Map<String, MissingValueStrategy> columnStrategies) {
        MissingValueStrategy override = columnStrategies.get(column);
        if (override != null) {
            return override;
        }
        return globalStrategy.orElse(MissingValueStrategy.LEAVE_AS_IS);
    }
}
