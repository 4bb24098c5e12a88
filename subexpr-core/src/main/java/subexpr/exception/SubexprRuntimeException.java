package subexpr.exception;

public class SubexprRuntimeException extends RuntimeException {
    public SubexprRuntimeException(String msg) {
        super(msg);
    }

    public SubexprRuntimeException(String msg, Throwable t) {
        super(msg, t);
    }
}
