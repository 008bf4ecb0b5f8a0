package org.codelibs.taste.similarity;

import com.google.common.base.Preconditions;

/**
 * The ratings one user gave to two distinct items, the lower item ID first.
 */
public final class PairContribution {

    private final int itemA;

    private final int itemB;

    private final int valueA;

    private final int valueB;

    public PairContribution(final int itemA, final int itemB,
            final int valueA, final int valueB) {
        Preconditions.checkArgument(itemA < itemB,
                "itemA must be less than itemB: (%s,%s)", itemA, itemB);
        this.itemA = itemA;
        this.itemB = itemB;
        this.valueA = valueA;
        this.valueB = valueB;
    }

    public int getItemA() {
        return itemA;
    }

    public int getItemB() {
        return itemB;
    }

    public int getValueA() {
        return valueA;
    }

    public int getValueB() {
        return valueB;
    }

    @Override
    public String toString() {
        return "PairContribution[" + itemA + '=' + valueA + ", " + itemB + '='
                + valueB + ']';
    }

}
