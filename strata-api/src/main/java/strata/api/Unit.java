package strata.api;

import java.io.Serializable;

/**
 * void 表达式的绑定值，回显时省略
 */
public final class Unit implements Serializable {

    public static final Unit INSTANCE = new Unit();

    public static final String TYPE_NAME = "strata.api.Unit";

    private Unit() {
    }

    public static Unit of(Unchecked.ThrowingRunnable body) {
        Unchecked.run(body);
        return INSTANCE;
    }

    private Object readResolve() {
        return INSTANCE;
    }

    @Override
    public String toString() {
        return "()";
    }
}
