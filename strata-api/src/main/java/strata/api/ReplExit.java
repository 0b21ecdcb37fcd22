package strata.api;

/**
 * 抛出即干净地结束会话。
 *
 * <p>不是错误：求值循环在异常链中识别到它就返回 {@link Res#exit()}。</p>
 */
public final class ReplExit extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public static final ReplExit INSTANCE = new ReplExit();

    private ReplExit() {
        super("exit", null, false, false);  // 禁用堆栈跟踪
    }
}
