package strata.runtime.interpreter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import strata.api.ClassLoaderTier;
import strata.api.Evaluated;
import strata.api.ImportEntry;
import strata.api.ReplAPI;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.List;

/**
 * 会话桥接：求值 {@code strata.api.ReplAPI repl;}，再把实现对象注入生成的字段，
 * 最后登记内建导入。
 */
final class BridgeConfig {

    private static final Logger LOG = LoggerFactory.getLogger(BridgeConfig.class);

    static final String BRIDGE_CODE = "strata.api.ReplAPI repl;";
    static final String BRIDGE_FIELD = "repl";

    private final ReplAPI api;

    BridgeConfig(ReplAPI api) {
        this.api = api;
    }

    void install(Interpreter interpreter) {
        Evaluated<List<String>> evaluated = interpreter.run(BRIDGE_CODE);
        String wrapperName = evaluated.wrapperName();
        ClassLoader loader = interpreter.session().registry().currentLoader(ClassLoaderTier.RUNTIME);
        try {
            Class<?> wrapper = Class.forName(wrapperName, true, loader);
            Field field = wrapper.getField(BRIDGE_FIELD);
            Object target = null;
            if (!Modifier.isStatic(field.getModifiers())) {
                target = wrapper.getField("INSTANCE").get(null);
            }
            field.set(target, api);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("cannot inject repl bridge into " + wrapperName, e);
        }
        interpreter.session().ledger().update(bridgeImports());
        LOG.debug("repl bridge installed in {}", wrapperName);
    }

    static List<ImportEntry> bridgeImports() {
        return Arrays.asList(
                ImportEntry.type("strata.api", "Display").asImplicit(),
                ImportEntry.wildcard("strata.api.Predef", ImportEntry.Kind.STATIC));
    }
}
