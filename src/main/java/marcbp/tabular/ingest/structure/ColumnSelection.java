package marcbp.tabular.ingest.structure;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Target and feature columns chosen for a dataset.
 */
public record ColumnSelection(Column target, List<Column> features) {
    public ColumnSelection {
        target = requireNonNull(target, "target is null");
        features = List.copyOf(requireNonNull(features, "features is null"));
        if (features.contains(target)) {
            throw new IllegalArgumentException("Target column cannot also be a feature: " + target.name());
        }
    }

    public List<String> featureNames() {
        return features.stream()
                .map(Column::name)
                .toList();
    }
}
