package im.arun.promptelide.model;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.ToIntFunction;

/**
 * One line of elidable text together with how much it is worth keeping and how many tokens it costs.
 */
@Getter
@ToString
public class WeightedLine {

    private final String text;
    private double value;
    private int cost;
    private final Map<String, Object> metadata;

    @Setter
    private boolean markedForRemoval;

    public WeightedLine(String text, double value, int cost) {
        this(text, value, cost, ValidationMode.STRICT, null);
    }

    public WeightedLine(String text, double value, int cost, ValidationMode mode, Map<String, Object> metadata) {
        if (mode != ValidationMode.NONE) {
            if (text.contains("\n")) {
                throw new IllegalArgumentException("Line text must not contain a newline: " + text);
            }
            if (value < 0 || Double.isNaN(value)) {
                throw new IllegalArgumentException("Line value must be non-negative, got " + value);
            }
            if (cost < 0) {
                throw new IllegalArgumentException("Line cost must be non-negative, got " + cost);
            }
            if (mode == ValidationMode.STRICT && value > 1) {
                throw new IllegalArgumentException("Line value must be at most 1, got " + value);
            }
        }
        this.text = text;
        this.value = value;
        this.cost = cost;
        this.metadata = metadata != null ? metadata : Collections.emptyMap();
    }

    public WeightedLine adjustValue(double multiplier) {
        this.value *= multiplier;
        return this;
    }

    public WeightedLine setValue(double value) {
        this.value = value;
        return this;
    }

    /**
     * Recomputes the cost with the given token counter. The counter sees the line with its newline.
     */
    public WeightedLine recost(ToIntFunction<String> tokenLength) {
        this.cost = tokenLength.applyAsInt(text + "\n");
        return this;
    }

    public WeightedLine copy() {
        WeightedLine copy = new WeightedLine(text, value, cost, ValidationMode.NONE,
                metadata.isEmpty() ? metadata : new LinkedHashMap<>(metadata));
        copy.markedForRemoval = markedForRemoval;
        return copy;
    }
}
