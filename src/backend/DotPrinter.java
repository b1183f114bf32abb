package backend;

import frontend.Instruction;
import ir.ByteFlow;
import ir.block.BasicBlock;
import ir.block.Block;
import ir.block.BlockVisitor;
import ir.block.RegionBlock;
import ir.label.Label;
import util.LoggingManager;
import util.logging.Logger;

import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Graphviz printer of a flow.
 * Leaves become boxes listing their instructions, regions become clusters coloured by kind, backedges are
 * dashed and do not constrain the layout.
 */
public class DotPrinter {
    private static final Logger logger = LoggingManager.getLogger(DotPrinter.class);
    private static DotPrinter instance;
    // regions of different levels may share a begin label
    private int clusterCount;

    private DotPrinter() {
    }

    public static DotPrinter getInstance() {
        if (instance == null) {
            instance = new DotPrinter();
        }
        return instance;
    }

    public String printToString(ByteFlow flow) {
        StringBuilder sb = new StringBuilder();
        clusterCount = 0;
        sb.append("digraph {\n");
        Map<Label, Block> graph = flow.getBlockMap().getGraph();
        for (Block block : graph.values()) {
            printBlock(sb, flow, block, "  ");
        }
        printEdges(sb, graph, "  ");
        sb.append("}\n");
        return sb.toString();
    }

    public void printToFile(ByteFlow flow, String filename) throws FileNotFoundException {
        PrintStream out = new PrintStream(new FileOutputStream(filename), false, StandardCharsets.UTF_8);
        out.print(printToString(flow));
        out.close();
        logger.info("wrote {}", filename);
    }

    private void printBlock(StringBuilder sb, ByteFlow flow, Block block, String indent) {
        block.accept(new BlockVisitor<Void>() {
            @Override
            public Void visitBasicBlock(BasicBlock basicBlock) {
                printBasicBlock(sb, flow, basicBlock, indent);
                return null;
            }

            @Override
            public Void visitRegionBlock(RegionBlock region) {
                printRegionBlock(sb, flow, region, indent);
                return null;
            }
        });
    }

    private void printBasicBlock(StringBuilder sb, ByteFlow flow, BasicBlock block, String indent) {
        String body;
        if (block.getBegin().isSynthetic()) {
            body = "Control Label: " + block.getBegin().getValue();
        } else {
            StringBuilder lines = new StringBuilder();
            for (Instruction inst : flow.getInstructions(block)) {
                lines.append(String.format("%3d: %s", inst.getOffset(), inst.getOpname())).append("\\l");
            }
            body = lines.toString();
        }
        sb.append(indent).append(id(block.getBegin()))
                .append(" [shape=rect, label=\"").append(body).append("\"];\n");
    }

    private void printRegionBlock(StringBuilder sb, ByteFlow flow, RegionBlock region, String indent) {
        Map<Label, Block> graph = region.getFullGraph();
        String inner = indent + "  ";
        sb.append(indent).append("subgraph \"cluster_").append(clusterCount++).append('_')
                .append(region.getBegin()).append("\" {\n");
        sb.append(inner).append("color=").append(color(region)).append(";\n");
        sb.append(inner).append("label=\"").append(region.getKind().getName()).append("\";\n");
        for (Block block : graph.values()) {
            printBlock(sb, flow, block, inner);
        }
        sb.append(indent).append("}\n");
        printEdges(sb, graph, indent);
    }

    private static String color(RegionBlock region) {
        return switch (region.getKind()) {
            case LOOP -> "blue";
            case BRANCH -> "green";
            case TAIL -> "purple";
            case HEAD -> "red";
        };
    }

    /**
     * Edges between the nodes of one level; a region's edges start at its exit node when it has one
     */
    private void printEdges(StringBuilder sb, Map<Label, Block> graph, String indent) {
        for (Map.Entry<Label, Block> entry : graph.entrySet()) {
            Block block = entry.getValue();
            Label source = entry.getKey();
            if (block instanceof RegionBlock region && region.getExit() != null) {
                source = region.getExit();
            }
            for (Label dst : block.getJumpTargets()) {
                if (graph.containsKey(dst)) {
                    sb.append(indent).append(id(source)).append(" -> ").append(id(dst)).append(";\n");
                }
            }
            for (Label dst : block.getBackedges()) {
                sb.append(indent).append(id(entry.getKey())).append(" -> ").append(id(dst))
                        .append(" [style=dashed, color=grey, constraint=false];\n");
            }
        }
    }

    private static String id(Label label) {
        return "\"" + label + "\"";
    }
}
