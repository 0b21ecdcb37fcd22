package strata.api;

/**
 * 让片段中的语句可以抛出受检异常：包装类的初始化块不允许声明 throws。
 */
public final class Unchecked {

    @FunctionalInterface
    public interface ThrowingRunnable {
        void run() throws Throwable;
    }

    private Unchecked() {
    }

    public static void run(ThrowingRunnable body) {
        try {
            body.run();
        } catch (Throwable t) {
            throw Unchecked.<RuntimeException>sneaky(t);
        }
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> E sneaky(Throwable t) throws E {
        throw (E) t;
    }
}
