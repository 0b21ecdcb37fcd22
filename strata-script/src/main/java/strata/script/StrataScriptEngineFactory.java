package strata.script;

import javax.script.ScriptEngine;
import javax.script.ScriptEngineFactory;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Strata 的 JSR-223 ScriptEngineFactory 实现。
 *
 * <p>通过 SPI 机制（META-INF/services）被 {@link javax.script.ScriptEngineManager} 自动发现。</p>
 */
public class StrataScriptEngineFactory implements ScriptEngineFactory {

    private static final String ENGINE_NAME = "Strata";
    private static final String ENGINE_VERSION = "0.1.0";
    private static final String LANGUAGE_NAME = "java";

    @Override
    public String getEngineName() {
        return ENGINE_NAME;
    }

    @Override
    public String getEngineVersion() {
        return ENGINE_VERSION;
    }

    @Override
    public List<String> getExtensions() {
        return Collections.singletonList("jsnippet");
    }

    @Override
    public List<String> getMimeTypes() {
        return Collections.singletonList("application/x-strata");
    }

    @Override
    public List<String> getNames() {
        return Arrays.asList("strata", "Strata");
    }

    @Override
    public String getLanguageName() {
        return LANGUAGE_NAME;
    }

    @Override
    public String getLanguageVersion() {
        return System.getProperty("java.specification.version");
    }

    @Override
    public Object getParameter(String key) {
        switch (key) {
            case ScriptEngine.ENGINE:           return getEngineName();
            case ScriptEngine.ENGINE_VERSION:    return getEngineVersion();
            case ScriptEngine.LANGUAGE:          return getLanguageName();
            case ScriptEngine.LANGUAGE_VERSION:  return getLanguageVersion();
            case ScriptEngine.NAME:              return getNames().get(0);
            default:                             return null;
        }
    }

    @Override
    public String getMethodCallSyntax(String obj, String method, String... args) {
        StringBuilder sb = new StringBuilder();
        sb.append(obj).append('.').append(method).append('(');
        for (int i = 0; i < args.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(args[i]);
        }
        sb.append(')');
        return sb.toString();
    }

    @Override
    public String getOutputStatement(String toDisplay) {
        return "System.out.println(" + toDisplay + ");";
    }

    @Override
    public String getProgram(String... statements) {
        StringBuilder sb = new StringBuilder();
        for (String stmt : statements) {
            sb.append(stmt);
            if (!stmt.trim().endsWith(";") && !stmt.trim().endsWith("}")) {
                sb.append(';');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    @Override
    public StrataScriptEngine getScriptEngine() {
        return new StrataScriptEngine(this);
    }
}
