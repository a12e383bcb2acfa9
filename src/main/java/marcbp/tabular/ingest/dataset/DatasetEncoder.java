package marcbp.tabular.ingest.dataset;

import marcbp.tabular.ingest.util.NumericValues;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Converts a finalized {@link Dataset} into numeric arrays for a trainer.
 *
 * <p>Values that cannot be read as numbers encode as 0.
 */
public final class DatasetEncoder {
    private DatasetEncoder() {}

    public static EncodedDataset encode(Dataset dataset) {
        requireNonNull(dataset, "dataset is null");
        List<Map<String, Object>> rows = dataset.rows();
        List<String> featureNames = dataset.features();

        double[][] matrix = new double[rows.size()][featureNames.size()];
        for (int i = 0; i < rows.size(); i++) {
            for (int j = 0; j < featureNames.size(); j++) {
                matrix[i][j] = numeric(rows.get(i).get(featureNames.get(j)));
            }
        }

        double[] targets = new double[rows.size()];
        List<Object> classLabels = new ArrayList<>();
        if (dataset.isClassification()) {
            Map<Object, Integer> labelIndex = new LinkedHashMap<>();
            for (Map<String, Object> row : rows) {
                Object label = row.get(dataset.target());
                if (label != null && !"".equals(label)) {
                    labelIndex.putIfAbsent(label, labelIndex.size());
                }
            }
            for (int i = 0; i < rows.size(); i++) {
                targets[i] = labelIndex.getOrDefault(rows.get(i).get(dataset.target()), 0);
            }
            classLabels.addAll(labelIndex.keySet());
        }
        else {
            for (int i = 0; i < rows.size(); i++) {
                targets[i] = numeric(rows.get(i).get(dataset.target()));
            }
        }

        double[] means = new double[featureNames.size()];
        double[] stds = new double[featureNames.size()];
        for (int j = 0; j < featureNames.size(); j++) {
            means[j] = mean(matrix, j);
            stds[j] = std(matrix, j, means[j]);
        }
        return new EncodedDataset(matrix, targets, featureNames, classLabels, means, stds);
    }

    /**
     * Z-score normalization; a feature with zero deviation maps to 0.
     */
    public static double[][] normalize(double[][] features, double[] means, double[] stds) {
        double[][] normalized = new double[features.length][];
        for (int i = 0; i < features.length; i++) {
            normalized[i] = new double[features[i].length];
            for (int j = 0; j < features[i].length; j++) {
                normalized[i][j] = stds[j] == 0 ? 0 : (features[i][j] - means[j]) / stds[j];
            }
        }
        return normalized;
    }

    public static double[][] normalize(EncodedDataset encoded) {
        return normalize(encoded.features(), encoded.means(), encoded.stds());
    }

    public static double[][] oneHot(double[] targets, int numClasses) {
        if (numClasses <= 0) {
            throw new IllegalArgumentException("numClasses must be positive");
        }
        double[][] encoded = new double[targets.length][numClasses];
        for (int i = 0; i < targets.length; i++) {
            int index = (int) targets[i];
            if (index < 0 || index >= numClasses || index != targets[i]) {
                throw new IllegalArgumentException("Target " + targets[i] + " is not a class index below " + numClasses);
            }
            encoded[i][index] = 1;
        }
        return encoded;
    }

    private static double numeric(Object value) {
        return NumericValues.parseCell(value).orElse(0);
    }

    private static double mean(double[][] matrix, int column) {
        if (matrix.length == 0) {
            return 0;
        }
        double sum = 0;
        for (double[] row : matrix) {
            sum += row[column];
        }
        return sum / matrix.length;
    }

    private static double std(double[][] matrix, int column, double mean) {
        if (matrix.length == 0) {
            return 0;
        }
        double variance = 0;
        for (double[] row : matrix) {
            variance += (row[column] - mean) * (row[column] - mean);
        }
        return Math.sqrt(variance / matrix.length);
    }
}
