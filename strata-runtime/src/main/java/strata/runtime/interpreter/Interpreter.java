package strata.runtime.interpreter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import strata.api.ClassLoaderTier;
import strata.api.Completer;
import strata.api.Decl;
import strata.api.DisplayItem;
import strata.api.Evaluated;
import strata.api.ImportEntry;
import strata.api.Loadable;
import strata.api.ParseResult;
import strata.api.ReplAPI;
import strata.api.Res;
import strata.api.SnippetCompiler;
import strata.api.SnippetParser;
import strata.runtime.config.ReplConfig;
import strata.runtime.loader.ArtifactRegistry;
import strata.runtime.wrap.CodeWrapper;
import strata.runtime.wrap.DisplayCode;
import strata.runtime.wrap.Wrapped;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 求值循环：解析 → 包装 → 编译 → 加载 → 调用 → 回显 → 累积导入。
 *
 * <p>每个阶段都返回 {@link Res}，在第一个非 Success 处短路。片段到达包装阶段后，
 * 无论之后成功与否行号都前进一次，保证包装类名唯一。</p>
 *
 * <p>不是线程安全的：同一时刻只允许一个片段在一个会话中求值。</p>
 */
public class Interpreter {

    private static final Logger LOG = LoggerFactory.getLogger(Interpreter.class);

    private static final Consumer<String> SILENT = line -> {
    };

    private final ReplConfig config;
    private final Session session;
    private final SnippetParser parser;
    private final SnippetCompiler compiler;
    private final Completer completer;
    private final CodeWrapper wrapper;
    private final FaultClassifier faults;
    private final PrintStream err;

    private final List<Runnable> stopHooks = new ArrayList<>();
    private String buffered = "";
    private boolean evaluating;
    private boolean bridgeStale;
    private boolean stopped;
    private BridgeConfig bridge;

    public Interpreter(ReplConfig config, Session session, SnippetParser parser, SnippetCompiler compiler,
                       Completer completer, CodeWrapper wrapper, PrintStream err) {
        this.config = config;
        this.session = session;
        this.parser = parser;
        this.compiler = compiler;
        this.completer = completer;
        this.wrapper = wrapper;
        this.faults = new FaultClassifier(config.wrapperPackage());
        this.err = err;
    }

    // ============ 会话入口 ============

    /**
     * 求值一次输入。不完整的输入被缓冲，与下一次输入原样拼接后重新解析。
     *
     * @param text        本次输入
     * @param saveHistory 解析成功时是否记入历史
     * @param printer     回显行的去处
     */
    public Res<Evaluated<List<String>>> apply(String text, boolean saveHistory, Consumer<String> printer) {
        return apply(text, saveHistory, printer, null);
    }

    /**
     * 同 {@link #apply(String, boolean, Consumer)}，片段执行期间本线程的标准输出与标准错误写到 {@code capturing}
     *
     * @param capturing 为 null 时不捕获
     */
    public Res<Evaluated<List<String>>> apply(String text, boolean saveHistory, Consumer<String> printer,
                                              Capturing capturing) {
        String source = buffered + text;
        ParseResult parsed = parser.parse(source, String.valueOf(session.currentLine()));
        buffered = "";
        if (parsed instanceof ParseResult.Incomplete) {
            buffered = source;
            return Res.buffer(source);
        }
        if (parsed instanceof ParseResult.Blank) {
            return Res.skip();
        }
        if (parsed instanceof ParseResult.Error) {
            return Res.failure(((ParseResult.Error) parsed).message());
        }
        if (saveHistory) {
            session.history().add(source);
        }
        List<Decl> decls = ((ParseResult.Parsed) parsed).decls();
        if (capturing == null) {
            return process(decls, printer);
        }
        return capturing.around(() -> process(decls, printer));
    }

    /**
     * 求值已解析的声明
     */
    public Res<Evaluated<List<String>>> process(List<Decl> decls, Consumer<String> printer) {
        Thread thread = Thread.currentThread();
        ClassLoader previous = thread.getContextClassLoader();
        evaluating = true;
        try {
            return doProcess(decls, printer);
        } catch (RuntimeException | LinkageError e) {
            LOG.error("unexpected failure while evaluating line {}", session.currentLine() - 1, e);
            return faults.unexpected(e);
        } finally {
            evaluating = false;
            thread.setContextClassLoader(previous);
            if (bridgeStale) {
                rebuildBridge();
            }
        }
    }

    private Res<Evaluated<List<String>>> doProcess(List<Decl> decls, Consumer<String> printer) {
        Set<String> referenced = new LinkedHashSet<>();
        for (Decl decl : decls) {
            referenced.addAll(decl.referencedNames());
        }
        // 本行重新声明的字段不再引入别名，否则实例包装里会出现同名字段
        Set<String> aliased = new LinkedHashSet<>(referenced);
        for (Decl decl : decls) {
            if (decl.shape() == Decl.Shape.FIELD) {
                for (DisplayItem item : decl.display()) {
                    aliased.remove(item.name());
                }
            }
        }
        ImportLedger ledger = session.ledger();
        Wrapped wrapped = wrapper.wrap(decls,
                ledger.previousImportBlock(referenced),
                ledger.previousAliasBlock(aliased),
                wrapperName(session.currentLine()),
                DisplayCode.render(decls, config.flatMarker()));
        session.advance();
        session.registry().recordSource(wrapped.binaryName(), wrapped.source());
        LOG.debug("wrapped {}:\n{}", wrapped.binaryName(), wrapped.source());

        int generation = session.registry().generation();
        return evalClass(wrapped)
                .flatMap(evaluated -> evaluatorRunPrinter(evaluated.value(), printer)
                        .map(lines -> new Evaluated<>(evaluated.wrapperName(), evaluated.imports(), lines)))
                .map(evaluated -> {
                    // 片段执行期间切换了加载器时，它的导出已不可达
                    if (session.registry().generation() == generation) {
                        ledger.update(evaluated.imports());
                    }
                    return evaluated;
                });
    }

    /**
     * 编译、加载并调用一个包装好的编译单元
     */
    public Res<Evaluated<Object>> evalClass(Wrapped wrapped) {
        List<String> diagnostics = new ArrayList<>();
        SnippetCompiler.Output output = compiler.compileOrNull(
                new SnippetCompiler.Request(wrapped.source(), wrapped.binaryName(),
                        wrapped.importsLength(), wrapped.fileName()),
                session.registry(), diagnostics::add);
        if (output == null) {
            return Res.failure(diagnostics.isEmpty() ? "Compilation Failed" : String.join("\n", diagnostics));
        }
        ArtifactRegistry registry = session.registry();
        output.classFiles().forEach(registry::addArtifact);

        List<ImportEntry> imports = new ArrayList<>(output.imports().size());
        for (ImportEntry entry : output.imports()) {
            imports.add(entry.prefix().isEmpty() ? entry.withPrefix(wrapped.binaryName()) : entry);
        }
        return load(wrapped.entryClass())
                .flatMap(this::invoke)
                .map(value -> new Evaluated<>(wrapped.binaryName(), imports, value));
    }

    private Res<Loadable> load(String entryClass) {
        ClassLoader loader = session.registry().currentLoader(ClassLoaderTier.RUNTIME);
        try {
            return Res.success(new ReflectiveEntryPoint(Class.forName(entryClass, false, loader)));
        } catch (ClassNotFoundException | LinkageError e) {
            LOG.error("compiled class {} cannot be loaded", entryClass, e);
            return Res.failure("Failed to load compiled class " + entryClass + ": " + e, e);
        }
    }

    private Res<Object> invoke(Loadable entry) {
        Thread thread = Thread.currentThread();
        if (Thread.interrupted()) {
            return Res.failure(FaultClassifier.INTERRUPTED);
        }
        thread.setContextClassLoader(session.registry().currentLoader(ClassLoaderTier.RUNTIME));
        Object value;
        try {
            value = entry.invokeEntry();
        } catch (ReflectiveOperationException | RuntimeException | LinkageError e) {
            if (Thread.interrupted()) {
                return Res.failure(FaultClassifier.INTERRUPTED, e);
            }
            return faults.classify(e);
        } catch (ThreadDeath e) {
            return Res.failure(FaultClassifier.INTERRUPTED, e);
        }
        if (Thread.interrupted()) {
            return Res.failure(FaultClassifier.INTERRUPTED);
        }
        return Res.success(value);
    }

    /**
     * 把展示计算的结果逐行交给 printer。此方法名是回显异常栈的截断点。
     */
    private Res<List<String>> evaluatorRunPrinter(Object value, Consumer<String> printer) {
        List<String> lines = new ArrayList<>();
        try {
            if (value instanceof Iterable) {
                for (Object line : (Iterable<?>) value) {
                    lines.add(String.valueOf(line));
                }
            } else if (value != null) {
                lines.add(String.valueOf(value));
            }
            for (String line : lines) {
                printer.accept(line);
            }
        } catch (RuntimeException e) {
            return faults.classifyPrinter(e);
        }
        return Res.success(Collections.unmodifiableList(lines));
    }

    // ============ 结果处理 ============

    /**
     * 按结果向用户报告
     *
     * @return 会话是否继续
     */
    public boolean handleOutput(Res<?> res) {
        return res.fold(new Res.Visitor<Object, Boolean>() {
            @Override
            public Boolean success(Object value) {
                return true;
            }

            @Override
            public Boolean failure(Res.Failure<?> failure) {
                err.println(failure.message());
                return true;
            }

            @Override
            public Boolean exit() {
                return false;
            }

            @Override
            public Boolean skip() {
                return true;
            }

            @Override
            public Boolean buffer(String partial) {
                return true;
            }
        });
    }

    /**
     * 以编程方式运行一段完整代码，不记入历史，不回显
     *
     * @throws ReplException 代码不完整、失败或请求退出
     */
    public Evaluated<List<String>> run(String code) {
        String pending = buffered;
        buffered = "";
        try {
            Res<Evaluated<List<String>>> res = apply(code, false, SILENT);
            return res.fold(new Res.Visitor<Evaluated<List<String>>, Evaluated<List<String>>>() {
                @Override
                public Evaluated<List<String>> success(Evaluated<List<String>> value) {
                    return value;
                }

                @Override
                public Evaluated<List<String>> failure(Res.Failure<?> failure) {
                    throw new ReplException(failure.message(), failure.cause());
                }

                @Override
                public Evaluated<List<String>> exit() {
                    throw new ReplException("exit requested while running: " + code);
                }

                @Override
                public Evaluated<List<String>> skip() {
                    return null;
                }

                @Override
                public Evaluated<List<String>> buffer(String partial) {
                    throw new ReplException("incomplete input: " + partial);
                }
            });
        } finally {
            buffered = pending;
        }
    }

    // ============ 补全 ============

    public Completer.Completion complete(int cursor, String text) {
        try {
            return completer.complete(cursor, session.ledger().renderAll(), text);
        } catch (RuntimeException e) {
            LOG.debug("completion failed at {}", cursor, e);
            return new Completer.Completion(cursor, Collections.<String>emptyList());
        }
    }

    // ============ 加载器与生命周期 ============

    /**
     * 切换共享加载模式；若真的替换了加载器，旧的会话绑定被丢弃并重建桥接
     */
    public void sharedCompileExecuteMode(boolean enabled) {
        if (!session.registry().setSharedCompileExecuteMode(enabled)) {
            return;
        }
        int dropped = session.ledger().dropPackage(config.wrapperPackage());
        LOG.debug("dropped {} import(s) bound to discarded wrappers", dropped);
        if (evaluating) {
            bridgeStale = true;
        } else {
            rebuildBridge();
        }
    }

    /**
     * 在用户输入之前运行桥接片段与预置代码，行号为负，第一条用户输入为第 0 行
     *
     * <p>预置代码失败只报告，不终止会话。</p>
     *
     * @throws ReplException 桥接失败
     */
    public void bootstrap(ReplAPI api, String predef) {
        boolean hasPredef = predef != null && !predef.trim().isEmpty();
        session.setCurrentLine(hasPredef ? -2 : -1);
        this.bridge = new BridgeConfig(api);
        bridge.install(this);
        if (hasPredef) {
            try {
                run(predef);
            } catch (ReplException e) {
                LOG.warn("predef failed", e);
                err.println("predef failed:\n" + e.getMessage());
            }
        }
        session.setCurrentLine(0);
    }

    private void rebuildBridge() {
        bridgeStale = false;
        if (bridge == null) {
            return;
        }
        try {
            bridge.install(this);
        } catch (ReplException | IllegalStateException e) {
            LOG.error("cannot reinstall repl bridge after loader swap", e);
            err.println("repl bridge unavailable: " + e.getMessage());
        }
    }

    public void onStop(Runnable action) {
        synchronized (stopHooks) {
            stopHooks.add(action);
        }
    }

    /**
     * 执行关闭钩子，只执行一次
     */
    public void stop() {
        List<Runnable> hooks;
        synchronized (stopHooks) {
            if (stopped) {
                return;
            }
            stopped = true;
            hooks = new ArrayList<>(stopHooks);
        }
        for (Runnable hook : hooks) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                LOG.warn("stop hook failed", e);
            }
        }
    }

    // ============ 状态 ============

    public boolean isBuffering() {
        return !buffered.isEmpty();
    }

    public String buffered() {
        return buffered;
    }

    /** 丢弃尚未完整的输入 */
    public void resetBuffer() {
        buffered = "";
    }

    public Session session() {
        return session;
    }

    public ReplConfig config() {
        return config;
    }

    static String wrapperName(int line) {
        return "cmd" + String.valueOf(line).replace('-', '_');
    }
}
