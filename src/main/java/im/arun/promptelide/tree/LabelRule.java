package im.arun.promptelide.tree;

import lombok.Value;

import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Assigns {@code label} to every line whose text satisfies {@code matches}.
 */
@Value
public class LabelRule<L> {

    Predicate<String> matches;
    L label;

    public static <L> LabelRule<L> of(Pattern pattern, L label) {
        return new LabelRule<>(text -> pattern.matcher(text).find(), label);
    }

    public static <L> LabelRule<L> of(Predicate<String> matches, L label) {
        return new LabelRule<>(matches, label);
    }
}
