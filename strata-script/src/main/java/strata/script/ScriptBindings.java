package strata.script;

import javax.script.Bindings;

/**
 * 脚本求值期间当前线程的 ENGINE_SCOPE 绑定，供片段中注入的变量读取
 */
public final class ScriptBindings {

    private static final ThreadLocal<Bindings> CURRENT = new ThreadLocal<>();

    private ScriptBindings() {
    }

    /**
     * @throws IllegalStateException 不在脚本求值期间调用
     */
    public static Object get(String name) {
        Bindings bindings = CURRENT.get();
        if (bindings == null) {
            throw new IllegalStateException("no script evaluation in progress");
        }
        return bindings.get(name);
    }

    static void enter(Bindings bindings) {
        CURRENT.set(bindings);
    }

    static void exit() {
        CURRENT.remove();
    }
}
