package im.arun.promptelide.weighting;

import lombok.Value;

/**
 * How much of a node's weight carries over to its parent, its siblings (per step) and its children.
 */
@Value
public class DecayFactors {

    public static final DecayFactors DEFAULT = new DecayFactors(0.9, 0.88, 0.8);

    double worthUp;
    double worthSibling;
    double worthDown;

    public DecayFactors(double worthUp, double worthSibling, double worthDown) {
        check("worthUp", worthUp);
        check("worthSibling", worthSibling);
        check("worthDown", worthDown);
        this.worthUp = worthUp;
        this.worthSibling = worthSibling;
        this.worthDown = worthDown;
    }

    private static void check(String name, double factor) {
        if (!(factor > 0 && factor <= 1)) {
            throw new IllegalArgumentException(name + " must be in (0, 1], got " + factor);
        }
    }
}
