package ir.label;

/**
 * Counter minting synthetic labels.
 * One generator is threaded through a whole restructuring run, so the indices it hands out never repeat.
 */
public class LabelGenerator {
    private int index;

    public LabelGenerator() {
        this(0);
    }

    public LabelGenerator(int start) {
        if (start < 0) {
            throw new IllegalArgumentException("negative label index: " + start);
        }
        this.index = start;
    }

    public SyntheticLabel next() {
        return new SyntheticLabel(index++);
    }

    /**
     * @return the index the next call to {@link #next()} will use
     */
    public int peek() {
        return index;
    }
}
