package strata.script;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import strata.api.ClassLoaderTier;
import strata.api.Evaluated;
import strata.api.ImportEntry;
import strata.api.Res;
import strata.api.Unit;
import strata.runtime.Strata;
import strata.runtime.config.ReplConfig;
import strata.runtime.interpreter.Capturing;
import strata.runtime.interpreter.Interpreter;

import javax.lang.model.SourceVersion;
import javax.script.AbstractScriptEngine;
import javax.script.Bindings;
import javax.script.ScriptContext;
import javax.script.ScriptEngineFactory;
import javax.script.ScriptException;
import javax.script.SimpleBindings;
import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Strata 的 JSR-223 ScriptEngine 实现，每个引擎实例持有一个独立会话。
 *
 * <ul>
 *   <li>ENGINE_SCOPE 中名字合法的绑定在求值前以同名变量注入会话</li>
 *   <li>求值后，本次片段定义的静态字段写回 ENGINE_SCOPE</li>
 *   <li>末尾表达式的值作为 {@code eval} 的返回值</li>
 *   <li>片段执行期间的标准输出与标准错误写到上下文的 Writer 与 ErrorWriter</li>
 * </ul>
 *
 * <p>不是线程安全的。</p>
 */
public class StrataScriptEngine extends AbstractScriptEngine {

    private static final Logger LOG = LoggerFactory.getLogger(StrataScriptEngine.class);

    private final StrataScriptEngineFactory factory;
    private final Map<String, Object> injected = new HashMap<>();
    private Interpreter interpreter;

    public StrataScriptEngine(StrataScriptEngineFactory factory) {
        this.factory = factory;
    }

    @Override
    public Object eval(String script, ScriptContext context) throws ScriptException {
        Interpreter repl = interpreter();
        Bindings bindings = context.getBindings(ScriptContext.ENGINE_SCOPE);
        ScriptBindings.enter(bindings);
        try {
            injectBindings(repl, bindings);
            int line = repl.session().currentLine();
            Res<Evaluated<List<String>>> res = repl.apply(script, false, displayLine -> {
            }, Capturing.to(context.getWriter(), context.getErrorWriter()));
            return res.fold(new Res.Visitor<Evaluated<List<String>>, Object>() {
                @Override
                public Object success(Evaluated<List<String>> value) {
                    String resultName = "res" + String.valueOf(line).replace('-', '_');
                    exportBindings(repl, value, bindings, resultName);
                    return result(repl, value.wrapperName(), resultName);
                }

                @Override
                public Object failure(Res.Failure<?> failure) {
                    throw new ScriptFailure(new ScriptException(failure.message()));
                }

                @Override
                public Object exit() {
                    throw new ScriptFailure(new ScriptException("script requested the session to exit"));
                }

                @Override
                public Object skip() {
                    return null;
                }

                @Override
                public Object buffer(String partial) {
                    repl.resetBuffer();
                    throw new ScriptFailure(new ScriptException("incomplete script: " + partial));
                }
            });
        } catch (ScriptFailure e) {
            throw e.exception;
        } finally {
            ScriptBindings.exit();
        }
    }

    @Override
    public Object eval(Reader reader, ScriptContext context) throws ScriptException {
        return eval(readAll(reader), context);
    }

    @Override
    public Bindings createBindings() {
        return new SimpleBindings();
    }

    @Override
    public ScriptEngineFactory getFactory() {
        return factory;
    }

    /** 会话本身，首次求值时创建 */
    public synchronized Interpreter interpreter() {
        if (interpreter == null) {
            ReplConfig config = ReplConfig.load()
                    .withHistoryFile(null)
                    .withWrapMode(ReplConfig.WrapMode.OBJECT);
            interpreter = Strata.create(config, System.err);
        }
        return interpreter;
    }

    // ---- 内部方法 ----

    private void injectBindings(Interpreter repl, Bindings bindings) throws ScriptException {
        if (bindings == null) return;
        for (Map.Entry<String, Object> entry : bindings.entrySet()) {
            String name = entry.getKey();
            Object value = entry.getValue();
            if (!SourceVersion.isName(name) || name.contains(".")) {
                continue;
            }
            if (injected.containsKey(name) && injected.get(name) == value) {
                continue;
            }
            String type = declaredType(value);
            String code = type + " " + name + " = (" + type + ") strata.script.ScriptBindings.get(\"" + name + "\");";
            Res<Evaluated<List<String>>> res = repl.apply(code, false, line -> {
            });
            if (res instanceof Res.Failure) {
                throw new ScriptException("cannot bind '" + name + "': " + ((Res.Failure<?>) res).message());
            }
            injected.put(name, value);
        }
    }

    /**
     * 可以写在源码里的最具体的公开类型
     */
    static String declaredType(Object value) {
        if (value == null) {
            return "Object";
        }
        Class<?> type = value.getClass();
        // 泛型类以原始类型声明
        while (type != null && (!Modifier.isPublic(type.getModifiers()) || type.getCanonicalName() == null)) {
            type = type.getSuperclass();
        }
        return type == null ? "Object" : type.getCanonicalName();
    }

    private void exportBindings(Interpreter repl, Evaluated<List<String>> evaluated, Bindings bindings,
                                String resultName) {
        if (bindings == null) return;
        Class<?> wrapper = wrapperClass(repl, evaluated.wrapperName());
        if (wrapper == null) return;
        for (ImportEntry entry : evaluated.imports()) {
            if (entry.kind() != ImportEntry.Kind.STATIC || !entry.prefix().equals(evaluated.wrapperName())
                    || entry.localName().equals(resultName)) {
                continue;
            }
            try {
                Field field = wrapper.getField(entry.sourceName());
                Object value = field.get(null);
                bindings.put(entry.localName(), value);
                injected.put(entry.localName(), value);
            } catch (NoSuchFieldException e) {
                // 导出的是方法
            } catch (IllegalAccessException e) {
                LOG.debug("cannot export {}: {}", entry.localName(), e.toString());
            }
        }
    }

    private static Object result(Interpreter repl, String wrapperName, String resultName) {
        Class<?> wrapper = wrapperClass(repl, wrapperName);
        if (wrapper == null) return null;
        try {
            Object value = wrapper.getField(resultName).get(null);
            return value instanceof Unit ? null : value;
        } catch (NoSuchFieldException e) {
            return null;
        } catch (IllegalAccessException e) {
            LOG.debug("cannot read result of {}: {}", wrapperName, e.toString());
            return null;
        }
    }

    private static Class<?> wrapperClass(Interpreter repl, String wrapperName) {
        try {
            return Class.forName(wrapperName, false,
                    repl.session().registry().currentLoader(ClassLoaderTier.RUNTIME));
        } catch (ClassNotFoundException e) {
            LOG.debug("wrapper {} no longer loadable", wrapperName);
            return null;
        }
    }

    private static String readAll(Reader reader) throws ScriptException {
        try {
            StringBuilder sb = new StringBuilder();
            char[] buf = new char[4096];
            int n;
            while ((n = reader.read(buf)) != -1) {
                sb.append(buf, 0, n);
            }
            return sb.toString();
        } catch (IOException e) {
            throw new ScriptException(e);
        }
    }

    /** 把受检的 ScriptException 带出访问者 */
    private static final class ScriptFailure extends RuntimeException {
        private static final long serialVersionUID = 1L;

        final ScriptException exception;

        ScriptFailure(ScriptException exception) {
            super(exception.getMessage(), null, false, false);
            this.exception = exception;
        }
    }
}
