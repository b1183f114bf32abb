package ir.label;

/**
 * Label minted while restructuring: joins, fillers, region entries
 */
public final class SyntheticLabel extends Label {
    private final int index;

    SyntheticLabel(int index) {
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public int getValue() {
        return index;
    }

    @Override
    public boolean isSynthetic() {
        return true;
    }

    @Override
    protected int kindRank() {
        return 1;
    }

    @Override
    public String toString() {
        return "c" + index;
    }
}
