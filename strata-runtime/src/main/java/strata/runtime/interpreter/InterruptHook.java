package strata.runtime.interpreter;

/**
 * 求值期间的中断信号接入点（例如终端的 Ctrl+C）。
 *
 * <p>安装时保存先前的处理器，关闭返回的句柄时恢复它，因此可以嵌套安装。</p>
 */
public interface InterruptHook {

    Restore install(Runnable onInterrupt);

    interface Restore extends AutoCloseable {
        @Override
        void close();
    }

    /** 不接收任何信号 */
    static InterruptHook none() {
        return onInterrupt -> () -> {
        };
    }
}
