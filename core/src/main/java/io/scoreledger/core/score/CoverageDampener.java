package io.scoreledger.core.score;

/**
 * Optional multiplier that lowers partial-coverage composites:
 * <pre>
 *   factor = base + (1 - base) * present / total
 * </pre>
 * With base 0.70 a one-of-seven entity keeps 74% of its reweighted score,
 * a full-coverage entity keeps all of it.
 */
public record CoverageDampener(double base) {
    public CoverageDampener {
        if (!(base >= 0.0 && base <= 1.0)) {
            throw new IllegalArgumentException("dampener base must be within [0, 1]: " + base);
        }
    }

    public double factor(int present, int total) {
        if (total <= 0) throw new IllegalArgumentException("total must be > 0");
        if (present < 0 || present > total) throw new IllegalArgumentException("present out of range: " + present);
        return base + (1.0 - base) * present / total;
    }

    public double apply(double composite, int present, int total) {
        return composite * factor(present, total);
    }
}
