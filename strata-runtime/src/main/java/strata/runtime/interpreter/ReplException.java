package strata.runtime.interpreter;

/**
 * 以编程方式运行片段失败时抛出
 */
public class ReplException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ReplException(String message) {
        super(message);
    }

    public ReplException(String message, Throwable cause) {
        super(message, cause);
    }
}
