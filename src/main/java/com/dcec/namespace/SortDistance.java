package com.dcec.namespace;

/**
 * Result of a sort-compatibility check: whether a sort fits a target and,
 * if so, how many parent edges separate them.
 */
public class SortDistance {
    private static final SortDistance INCOMPATIBLE = new SortDistance(false, -1);

    private final boolean compatible;
    private final int distance;

    private SortDistance(boolean compatible, int distance) {
        this.compatible = compatible;
        this.distance = distance;
    }

    public static SortDistance compatible(int distance) {
        return new SortDistance(true, distance);
    }

    public static SortDistance incompatible() {
        return INCOMPATIBLE;
    }

    public boolean isCompatible() { return compatible; }

    /**
     * Edge count, or -1 when incompatible.
     */
    public int getDistance() { return distance; }

    @Override
    public String toString() {
        return compatible ? "SortDistance{" + distance + "}" : "SortDistance{incompatible}";
    }
}
