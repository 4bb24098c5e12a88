package subexpr.exception;

public class InvalidExpressionException extends Exception {
    private final int offset;

    public InvalidExpressionException(String msg, int offset) {
        super(msg);
        this.offset = offset;
    }

    public InvalidExpressionException(String msg, int offset, Throwable cause) {
        super(msg, cause);
        this.offset = offset;
    }

    /** Character index in the line at which parsing failed. */
    public int getOffset() {
        return offset;
    }
}
