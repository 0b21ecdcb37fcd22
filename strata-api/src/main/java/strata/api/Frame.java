package strata.api;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 编译器看到的会话快照：静态 classpath、内存中已编译的类以及插件加载器。
 *
 * <p>每次编译前重新获取；加载器层级切换后旧快照即失效。</p>
 */
public interface Frame {

    /** 编译 classpath（宿主 classpath 加上当前层级的根） */
    List<Path> classpath();

    /** 内存中的已编译类：二进制类名 → 字节码 */
    Map<String, byte[]> dynamicClasses();

    /** 注解处理器等编译器扩展使用的加载器 */
    ClassLoader pluginClassLoader();

    /** 加载器代数，每次破坏性切换后递增 */
    int generation();
}
