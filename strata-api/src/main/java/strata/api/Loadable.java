package strata.api;

/**
 * 已加载包装类的入口能力
 */
public interface Loadable {

    /** 入口类的二进制名 */
    String entryClass();

    /**
     * 调用入口点，返回展示计算的结果。
     * 用户代码抛出的异常以 {@link java.lang.reflect.InvocationTargetException} 包装。
     */
    Object invokeEntry() throws ReflectiveOperationException;
}
