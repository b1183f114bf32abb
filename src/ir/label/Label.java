package ir.label;

/**
 * Identity of a node in a block map.
 * Offset labels sort before synthetic labels; within a kind labels sort by value.
 */
public abstract class Label implements Comparable<Label> {

    /**
     * @return rank of the label kind, used to order labels of different kinds
     */
    protected abstract int kindRank();

    /**
     * @return the offset or the synthetic index
     */
    public abstract int getValue();

    public boolean isSynthetic() {
        return false;
    }

    @Override
    public int compareTo(Label other) {
        int byKind = Integer.compare(kindRank(), other.kindRank());
        if (byKind != 0) {
            return byKind;
        }
        return Integer.compare(getValue(), other.getValue());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return getValue() == ((Label) obj).getValue();
    }

    @Override
    public int hashCode() {
        return 31 * kindRank() + getValue();
    }
}
