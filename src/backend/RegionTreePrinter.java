package backend;

import ir.BlockMap;
import ir.block.BasicBlock;
import ir.block.Block;
import ir.block.BlockVisitor;
import ir.block.RegionBlock;

import java.util.Map;

/**
 * Plain text dump of the region hierarchy, one node per line, children indented:
 * <pre>
 * head 0 -> []
 *   [header] leaf 0 -> [c0, 4]
 *   branch c0 -> [c2] exit c0
 *     leaf c0 -> [c2]
 * </pre>
 */
public class RegionTreePrinter implements BlockVisitor<Void> {
    private final StringBuilder sb = new StringBuilder();
    private int depth = 0;
    private String prefix = "";

    public static String print(BlockMap blocks) {
        RegionTreePrinter printer = new RegionTreePrinter();
        for (Block block : blocks.getGraph().values()) {
            block.accept(printer);
        }
        return printer.sb.toString();
    }

    @Override
    public Void visitBasicBlock(BasicBlock block) {
        line().append("leaf ").append(block.getBegin()).append(" -> ").append(block.getJumpTargets());
        if (!block.getBackedges().isEmpty()) {
            sb.append(" backedges ").append(block.getBackedges());
        }
        sb.append('\n');
        return null;
    }

    @Override
    public Void visitRegionBlock(RegionBlock region) {
        line().append(region.getKind().getName()).append(' ').append(region.getBegin())
                .append(" -> ").append(region.getJumpTargets());
        if (region.getExit() != null) {
            sb.append(" exit ").append(region.getExit());
        }
        sb.append('\n');

        depth++;
        for (Map.Entry<?, Block> header : region.getHeaders().entrySet()) {
            prefix = "[header] ";
            header.getValue().accept(this);
        }
        for (Block block : region.getSubregion().getGraph().values()) {
            block.accept(this);
        }
        depth--;
        return null;
    }

    private StringBuilder line() {
        sb.append("  ".repeat(depth)).append(prefix);
        prefix = "";
        return sb;
    }
}
