package strata.runtime.interpreter;

import strata.api.Res;
import strata.api.ReplExit;

import java.lang.reflect.InvocationTargetException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * 把求值过程中捕获的异常归类为结果。
 *
 * <ul>
 *   <li>异常链中出现 {@link ReplExit}：会话结束</li>
 *   <li>异常链中出现中断：固定消息 {@value #INTERRUPTED}</li>
 *   <li>用户代码抛出的异常：剥去反射包装，只保留到最后一个包装类栈帧</li>
 *   <li>其他：完整堆栈</li>
 * </ul>
 */
public final class FaultClassifier {

    public static final String INTERRUPTED = "Interrupted!";
    public static final String UNEXPECTED = "Something unexpected went wrong =(";

    /** 打印回显的方法名，回显阶段的异常在此截断 */
    static final String PRINTER_MARKER = "evaluatorRunPrinter";

    private final String wrapperPackage;

    public FaultClassifier(String wrapperPackage) {
        this.wrapperPackage = wrapperPackage;
    }

    /**
     * 入口调用失败时的归类
     */
    public <T> Res<T> classify(Throwable fault) {
        if (isExit(fault)) {
            return Res.exit();
        }
        if (isInterrupt(fault)) {
            return Res.failure(INTERRUPTED, fault);
        }
        if (fault instanceof InvocationTargetException || fault instanceof ExceptionInInitializerError) {
            Throwable user = unwrap(fault);
            return Res.failure(Res.Failure.renderTrace(user, this::userFrames), user);
        }
        return Res.failure(Res.Failure.renderTrace(fault, frames -> frames.length), fault);
    }

    /**
     * 回显阶段的异常
     */
    public <T> Res<T> classifyPrinter(Throwable fault) {
        if (isExit(fault)) {
            return Res.exit();
        }
        return Res.Failure.fromThrowable(fault, frame -> PRINTER_MARKER.equals(frame.getMethodName()));
    }

    /**
     * 管线内部的意外异常：完整堆栈并附加提示
     */
    public <T> Res<T> unexpected(Throwable fault) {
        return Res.failure(Res.Failure.renderTrace(fault, frames -> frames.length) + "\n" + UNEXPECTED, fault);
    }

    static boolean isExit(Throwable fault) {
        for (Throwable t : chain(fault)) {
            if (t instanceof ReplExit) {
                return true;
            }
        }
        return false;
    }

    @SuppressWarnings("deprecation")
    static boolean isInterrupt(Throwable fault) {
        for (Throwable t : chain(fault)) {
            if (t instanceof InterruptedException || t instanceof ThreadDeath) {
                return true;
            }
        }
        return false;
    }

    /**
     * 剥去 InvocationTargetException / ExceptionInInitializerError，得到最内层的用户异常
     */
    static Throwable unwrap(Throwable fault) {
        Throwable current = fault;
        while ((current instanceof InvocationTargetException || current instanceof ExceptionInInitializerError)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private int userFrames(StackTraceElement[] frames) {
        String prefix = wrapperPackage + ".";
        for (int i = frames.length - 1; i >= 0; i--) {
            if (frames[i].getClassName().startsWith(prefix)) {
                return i + 1;
            }
        }
        return frames.length;
    }

    private static Iterable<Throwable> chain(Throwable fault) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = fault;
        while (current != null && seen.add(current)) {
            current = current.getCause();
        }
        return seen;
    }
}
