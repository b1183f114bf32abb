package frontend.listing;

import frontend.Instruction;
import frontend.OpcodeTable;
import frontend.grammar.ListingBaseVisitor;
import frontend.grammar.ListingLexer;
import frontend.grammar.ListingParser;
import util.LoggingManager;
import util.logging.Logger;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a textual instruction listing (the format printed by {@code dis}) into an instruction stream.
 * <p>
 * For jumps the destination is taken from a {@code (to N)} annotation when present, so listings of
 * relative jumps load with their absolute destinations.
 */
public class ListingLoader {
    private static final Logger log = LoggingManager.getLogger(ListingLoader.class);
    private static final Pattern JUMP_ANNOTATION = Pattern.compile("\\(\\s*to\\s+(\\d+)\\s*\\)");

    private final OpcodeTable opcodes;

    public ListingLoader(OpcodeTable opcodes) {
        this.opcodes = opcodes;
    }

    public ListingLoader() {
        this(OpcodeTable.cpython());
    }

    public List<Instruction> loadFromFile(Path path) throws IOException, ListingParseException {
        if (!Files.exists(path)) {
            throw new IOException("File not found: " + path);
        }
        return parse(CharStreams.fromPath(path, StandardCharsets.UTF_8));
    }

    /**
     * @param resourcePath class path resource, e.g. "listings/scenario_a.dis"
     */
    public List<Instruction> loadFromResource(String resourcePath) throws IOException, ListingParseException {
        try (InputStream in = ListingLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return parse(CharStreams.fromStream(in, StandardCharsets.UTF_8));
        }
    }

    public List<Instruction> loadFromString(String text) throws ListingParseException {
        return parse(CharStreams.fromString(text));
    }

    private List<Instruction> parse(CharStream input) throws ListingParseException {
        String[] sourceLines = input.toString().split("\r?\n", -1);
        List<ListingParseException.ParseError> errors = new ArrayList<>();
        CollectingErrorListener listener = new CollectingErrorListener(sourceLines, errors);

        ListingLexer lexer = new ListingLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);
        ListingParser parser = new ListingParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(listener);

        ListingParser.ListingContext tree = parser.listing();
        if (!errors.isEmpty()) {
            throw new ListingParseException("Failed to parse listing", errors);
        }

        InstructionBuilder builder = new InstructionBuilder(sourceLines, errors);
        List<Instruction> instructions = new ArrayList<>();
        for (ListingParser.InstructionContext ctx : tree.instruction()) {
            Instruction inst = builder.visitInstruction(ctx);
            if (inst != null) {
                instructions.add(inst);
            }
        }
        if (!errors.isEmpty()) {
            throw new ListingParseException("Invalid listing", errors);
        }
        log.debug("loaded {} instructions", instructions.size());
        return instructions;
    }

    private static String lineAt(String[] sourceLines, int lineNumber) {
        return lineNumber >= 1 && lineNumber <= sourceLines.length ? sourceLines[lineNumber - 1] : "";
    }

    private class InstructionBuilder extends ListingBaseVisitor<Instruction> {
        private final String[] sourceLines;
        private final List<ListingParseException.ParseError> errors;

        InstructionBuilder(String[] sourceLines, List<ListingParseException.ParseError> errors) {
            this.sourceLines = sourceLines;
            this.errors = errors;
        }

        @Override
        public Instruction visitInstruction(ListingParser.InstructionContext ctx) {
            int line = ctx.getStart().getLine();
            String opname = ctx.opname.getText();
            boolean jump = opcodes.classify(opname).isJump();
            int offset;
            Integer argument;
            Integer destination;
            try {
                offset = Integer.parseInt(ctx.offset.getText());
                argument = ctx.arg == null ? null : Integer.valueOf(ctx.arg.getText());
                destination = !jump || ctx.ANNOTATION() == null ? null : jumpDestination(ctx.ANNOTATION().getText());
            } catch (NumberFormatException e) {
                errors.add(new ListingParseException.ParseError(line, lineAt(sourceLines, line),
                        "number out of range: " + e.getMessage()));
                return null;
            }

            if (jump) {
                if (destination != null) {
                    argument = destination;
                }
                if (argument == null) {
                    errors.add(new ListingParseException.ParseError(line, lineAt(sourceLines, line),
                            "jump " + opname + " has no destination"));
                    return null;
                }
            }
            return new Instruction(opname, offset, ctx.JUMP_MARKER() != null, argument);
        }

        private Integer jumpDestination(String annotation) {
            Matcher m = JUMP_ANNOTATION.matcher(annotation);
            return m.matches() ? Integer.valueOf(m.group(1)) : null;
        }
    }

    private static class CollectingErrorListener extends BaseErrorListener {
        private final String[] sourceLines;
        private final List<ListingParseException.ParseError> errors;

        CollectingErrorListener(String[] sourceLines, List<ListingParseException.ParseError> errors) {
            this.sourceLines = sourceLines;
            this.errors = errors;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            errors.add(new ListingParseException.ParseError(line, lineAt(sourceLines, line),
                    "col " + charPositionInLine + ": " + msg));
        }
    }
}
