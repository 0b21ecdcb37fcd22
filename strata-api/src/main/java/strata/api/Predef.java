package strata.api;

/**
 * 以静态通配导入提供给每个片段的内建函数
 */
public final class Predef {

    private Predef() {
    }

    /** 结束当前会话 */
    public static void exit() {
        throw ReplExit.INSTANCE;
    }

    /** 以回显格式渲染任意值 */
    public static String show(Object value) {
        return Display.render(value);
    }
}
