package strata.api;

/**
 * 类加载层级。每一层拥有独立的 classpath 根列表与独立构造的加载器。
 */
public enum ClassLoaderTier {
    /** 执行用户代码 */
    RUNTIME,
    /** 编译器自身在编译期执行代码时使用（注解处理器等） */
    COMPILER_INTERNAL,
    /** 编译器插件 */
    PLUGIN
}
