package ir.block;

/**
 * Dispatch over the two kinds of nodes
 */
public interface BlockVisitor<T> {
    T visitBasicBlock(BasicBlock block);

    T visitRegionBlock(RegionBlock region);
}
