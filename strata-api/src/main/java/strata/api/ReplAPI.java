package strata.api;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 会话桥接对象，在片段中以 {@code repl} 访问。
 *
 * <pre>
 * repl.addJars(java.nio.file.Path.of("lib/foo.jar"));
 * repl.addDependency("com.google.guava:guava:33.0.0-jre");
 * repl.history()
 * </pre>
 */
public interface ReplAPI {

    /** 结束会话，等价于 {@link Predef#exit()} */
    void exit();

    /** 本次会话已求值的片段 */
    List<String> history();

    /** 下一个片段的行号 */
    int currentLine();

    /** 包装类名 → 生成的源码 */
    Map<String, String> sources();

    /** 把 jar 或目录加入运行时 classpath */
    void addJars(Path... paths);

    void addCompilerJars(Path... paths);

    void addPluginJars(Path... paths);

    /**
     * 解析 {@code group:artifact:version} 并加入运行时 classpath
     *
     * @throws IllegalArgumentException 坐标无法解析
     */
    void addDependency(String coordinates);

    /**
     * 运行时与编译器内部加载器合并。切换若真的替换了加载器，之前所有的会话值都会失效。
     */
    void sharedCompileExecuteMode(boolean enabled);

    /** 会话结束时执行 */
    void onStop(Runnable action);
}
