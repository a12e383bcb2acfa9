package marcbp.tabular.ingest.dataset;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Numeric training matrix derived from a {@link Dataset}.
 *
 * @param features one row per sample, one column per feature
 * @param targets class index for classification, numeric value for regression
 * @param classLabels labels in class-index order; empty for regression
 * @param means per-feature mean
 * @param stds per-feature population standard deviation
 */
public record EncodedDataset(
        double[][] features,
        double[] targets,
        List<String> featureNames,
        List<Object> classLabels,
        double[] means,
        double[] stds) {

    public EncodedDataset {
        requireNonNull(features, "features is null");
        requireNonNull(targets, "targets is null");
        featureNames = List.copyOf(requireNonNull(featureNames, "featureNames is null"));
        classLabels = List.copyOf(requireNonNull(classLabels, "classLabels is null"));
        requireNonNull(means, "means is null");
        requireNonNull(stds, "stds is null");
        if (features.length != targets.length) {
            throw new IllegalArgumentException("features and targets differ in length");
        }
    }

    public int numClasses() {
        return classLabels.size();
    }
}
