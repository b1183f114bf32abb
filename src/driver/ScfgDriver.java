package driver;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import backend.DotPrinter;
import backend.RegionTreePrinter;
import exception.RestructureException;
import frontend.Instruction;
import frontend.listing.ListingLoader;
import frontend.listing.ListingParseException;
import ir.ByteFlow;
import pass.PassManager;
import util.LoggingManager;
import util.logging.Logger;

public class ScfgDriver {
    private static ScfgDriver scfgDriver = new ScfgDriver();
    private String source = null;
    private String target = null;
    private boolean printTree = false;
    private static final Logger logger = LoggingManager.getLogger(ScfgDriver.class);

    private ScfgDriver() {
    }

    public static ScfgDriver getInstance() {
        return scfgDriver;
    }

    /*
     * parse the args based on the input
     */
    public void parseArgs(String[] args) throws RestructureException {
        if (args == null || args.length == 0) {
            throw RestructureException.noArgs();
        }
        source = null;
        target = null;
        printTree = false;

        var cmds = Arrays.asList(args);
        var iter = cmds.iterator();
        while (iter.hasNext()) {
            String cmd = iter.next();
            switch (cmd) {
                case "-o" -> {
                    if (iter.hasNext()) {
                        target = iter.next();
                    } else {
                        throw RestructureException
                                .wrongArgs("Need arg after -o but got: " + cmd);
                    }
                }
                case "--tree" -> {
                    printTree = true;
                }
                default -> {
                    if (cmd.startsWith("-") || source != null) {
                        throw RestructureException.wrongArgs(cmd);
                    }
                    source = cmd;
                }
            }
        }
        if (source == null) {
            throw RestructureException.noArgs();
        }
    }

    /*
     * real driver: listing -> flow -> passes -> dot / tree
     */
    public ByteFlow run() {
        if (source == null) {
            throw RestructureException.noArgs();
        }

        ByteFlow flow = ByteFlow.fromInstructions(loadListing(Path.of(source)));
        logger.info("{} blocks before restructuring", flow.getBlockMap().size());

        ByteFlow result = PassManager.getInstance().run(flow);
        logger.debug(() -> "region tree\n" + RegionTreePrinter.print(result.getBlockMap()));

        if (printTree) {
            System.out.print(RegionTreePrinter.print(result.getBlockMap()));
        }
        if (target != null) {
            try {
                DotPrinter.getInstance().printToFile(result, target);
            } catch (FileNotFoundException e) {
                throw new RuntimeException("failed to write " + target, e);
            }
        } else if (!printTree) {
            System.out.print(DotPrinter.getInstance().printToString(result));
        }
        return result;
    }

    private List<Instruction> loadListing(Path path) {
        try {
            return new ListingLoader().loadFromFile(path);
        } catch (IOException e) {
            throw new RuntimeException("failed to read listing", e);
        } catch (ListingParseException e) {
            throw new RuntimeException("failed to parse listing: " + e.getMessage(), e);
        }
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public boolean isPrintTree() {
        return printTree;
    }
}
