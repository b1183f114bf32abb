package exception;

/**
 * Hard failure of a restructuring run. There is no partial result once this is thrown.
 */
public class RestructureException extends RuntimeException {

    public enum Kind {
        // a graph handed to an operation does not satisfy its precondition
        PRECONDITION,
        // a construct the restructurer has no strategy for
        UNSUPPORTED,
        // internal assumption broken, programmer error
        INVARIANT,
        // bad driver arguments
        ARGUMENT
    }

    private final Kind kind;

    public RestructureException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RestructureException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public static RestructureException noArgs() {
        return new RestructureException(Kind.ARGUMENT, "need a listing file to process");
    }

    public static RestructureException wrongArgs(String msg) {
        return new RestructureException(Kind.ARGUMENT, "Unexpected args: " + msg);
    }

    public static RestructureException precondition(String msg) {
        return new RestructureException(Kind.PRECONDITION, "Precondition violated: " + msg);
    }

    public static RestructureException unSupported(String msg) {
        return new RestructureException(Kind.UNSUPPORTED, "UnSupported: " + msg);
    }

    public static RestructureException invariant(String msg) {
        return new RestructureException(Kind.INVARIANT, "Invariant violated: " + msg);
    }
}
