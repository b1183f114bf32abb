package frontend.listing;

import java.util.ArrayList;
import java.util.List;

/**
 * Errors found while reading an instruction listing
 */
public class ListingParseException extends Exception {

    private final int lineNumber;
    private final String line;
    private final List<ParseError> errors;

    /**
     * One located error
     */
    public static class ParseError {
        private final int lineNumber;
        private final String line;
        private final String errorMessage;

        public ParseError(int lineNumber, String line, String errorMessage) {
            this.lineNumber = lineNumber;
            this.line = line;
            this.errorMessage = errorMessage;
        }

        public int getLineNumber() {
            return lineNumber;
        }

        public String getLine() {
            return line;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append("Line ").append(lineNumber).append(": ").append(errorMessage);
            if (line != null && !line.isEmpty()) {
                sb.append("\n  -> ").append(line.trim());
            }
            return sb.toString();
        }
    }

    public ListingParseException(String message) {
        super(message);
        this.lineNumber = -1;
        this.line = null;
        this.errors = new ArrayList<>();
    }

    public ListingParseException(String message, int lineNumber, String line) {
        super(formatMessage(message, lineNumber, line));
        this.lineNumber = lineNumber;
        this.line = line;
        this.errors = new ArrayList<>();
    }

    public ListingParseException(String message, List<ParseError> errors) {
        super(formatMultipleErrors(message, errors));
        this.lineNumber = errors.isEmpty() ? -1 : errors.get(0).getLineNumber();
        this.line = errors.isEmpty() ? null : errors.get(0).getLine();
        this.errors = new ArrayList<>(errors);
    }

    public ListingParseException(String message, Throwable cause) {
        super(message, cause);
        this.lineNumber = -1;
        this.line = null;
        this.errors = new ArrayList<>();
    }

    /**
     * @return the line of the first error, -1 when unknown
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }

    public List<ParseError> getErrors() {
        return new ArrayList<>(errors);
    }

    public boolean hasMultipleErrors() {
        return errors.size() > 1;
    }

    private static String formatMessage(String message, int lineNumber, String line) {
        StringBuilder sb = new StringBuilder(message);
        if (lineNumber >= 0) {
            sb.append(" (line ").append(lineNumber).append(")");
        }
        if (line != null && !line.isEmpty()) {
            sb.append("\n  -> ").append(line.trim());
        }
        return sb.toString();
    }

    private static String formatMultipleErrors(String message, List<ParseError> errors) {
        StringBuilder sb = new StringBuilder(message);
        sb.append("\nFound ").append(errors.size()).append(" error(s):");

        for (int i = 0; i < errors.size() && i < 5; i++) {
            sb.append("\n").append(i + 1).append(". ").append(errors.get(i).toString());
        }

        if (errors.size() > 5) {
            sb.append("\n... and ").append(errors.size() - 5).append(" more error(s)");
        }

        return sb.toString();
    }

    public static ListingParseException syntaxError(String message, int lineNumber, String line) {
        return new ListingParseException("Syntax error: " + message, lineNumber, line);
    }

    public static ListingParseException missingTarget(String opname, int lineNumber, String line) {
        return new ListingParseException("Jump without destination: " + opname, lineNumber, line);
    }
}
