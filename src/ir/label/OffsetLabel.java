package ir.label;

/**
 * Label of an instruction boundary in the original instruction stream
 */
public final class OffsetLabel extends Label {
    private final int offset;

    public OffsetLabel(int offset) {
        this.offset = offset;
    }

    public static OffsetLabel of(int offset) {
        return new OffsetLabel(offset);
    }

    public int getOffset() {
        return offset;
    }

    @Override
    public int getValue() {
        return offset;
    }

    @Override
    protected int kindRank() {
        return 0;
    }

    @Override
    public String toString() {
        return String.valueOf(offset);
    }
}
