package im.arun.promptelide.elision;

import im.arun.promptelide.model.WeightedLine;

/**
 * Which lines go first when text has to shrink. Lines with the lowest priority are removed first.
 */
public enum ElisionStrategy {

    /** Lowest value first. */
    REMOVE_LEAST_DESIRABLE {
        @Override
        public double priorityOf(WeightedLine line) {
            return line.getValue();
        }
    },

    /** Lowest value per token first, so expensive low-value lines go before cheap ones. Free lines stay. */
    REMOVE_LEAST_BANG_FOR_BUCK {
        @Override
        public double priorityOf(WeightedLine line) {
            if (line.getCost() == 0) {
                return Double.POSITIVE_INFINITY;
            }
            return line.getValue() / line.getCost();
        }
    };

    public abstract double priorityOf(WeightedLine line);
}
