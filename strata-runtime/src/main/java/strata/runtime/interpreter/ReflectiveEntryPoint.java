package strata.runtime.interpreter;

import strata.api.Loadable;
import strata.runtime.wrap.CodeWrapper;

import java.lang.reflect.Method;

/**
 * 通过反射调用包装类入口 {@code $main()}
 */
final class ReflectiveEntryPoint implements Loadable {

    private final Class<?> entry;

    ReflectiveEntryPoint(Class<?> entry) {
        this.entry = entry;
    }

    @Override
    public String entryClass() {
        return entry.getName();
    }

    @Override
    public Object invokeEntry() throws ReflectiveOperationException {
        Method main = entry.getMethod(CodeWrapper.ENTRY_METHOD);
        return main.invoke(null);
    }
}
