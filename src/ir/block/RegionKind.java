package ir.block;

/**
 * Kind of a region node
 */
public enum RegionKind {
    LOOP,
    HEAD,
    BRANCH,
    TAIL;

    public String getName() {
        return name().toLowerCase();
    }
}
