package strata.runtime;

import com.strata.compiler.completion.JavaCompleter;
import com.strata.compiler.javac.JavacSnippetCompiler;
import com.strata.compiler.parser.JavaSnippetParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import strata.api.ClassLoaderTier;
import strata.runtime.config.ReplConfig;
import strata.runtime.interpreter.History;
import strata.runtime.interpreter.HistoryFile;
import strata.runtime.interpreter.Interpreter;
import strata.runtime.interpreter.ReplApiImpl;
import strata.runtime.interpreter.Session;
import strata.runtime.loader.ArtifactRegistry;
import strata.runtime.resolve.LocalRepositoryResolver;
import strata.runtime.wrap.CodeWrapper;
import strata.runtime.wrap.FlatModuleWrapper;
import strata.runtime.wrap.InstanceWrapper;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 会话装配入口：按配置组装解析器、编译器、补全、注册表与包装器，并运行启动片段。
 *
 * <pre>
 * Interpreter repl = Strata.create(ReplConfig.load(), System.err);
 * repl.run("int x = 1");
 * </pre>
 */
public final class Strata {

    private static final Logger LOG = LoggerFactory.getLogger(Strata.class);

    private Strata() {
    }

    public static Interpreter create(ReplConfig config, PrintStream err) {
        return create(config, err, Collections.<Path>emptyList());
    }

    /**
     * @param classpath 启动时加入运行时层级的额外路径
     */
    public static Interpreter create(ReplConfig config, PrintStream err, List<Path> classpath) {
        ArtifactRegistry registry = new ArtifactRegistry(Strata.class.getClassLoader());
        if (!classpath.isEmpty()) {
            registry.addPaths(ClassLoaderTier.RUNTIME, classpath);
        }
        Path historyPath = config.historyFile();
        History history = historyPath == null
                ? new History()
                : new History(new HistoryFile(historyPath, config.historyDelimiter()));
        Session session = new Session(registry, history);

        JavaCompleter completer = new JavaCompleter(() -> registry,
                () -> registry.currentLoader(ClassLoaderTier.RUNTIME), config.completionCacheSize());
        registry.onPathsAdded((tier, added) -> {
            LOG.info("{} path(s) added to {} classpath", added.size(), tier.name().toLowerCase(Locale.ROOT));
            completer.invalidate();
        });

        Interpreter interpreter = new Interpreter(config, session,
                new JavaSnippetParser(),
                new JavacSnippetCompiler(),
                completer,
                wrapper(config),
                err);
        interpreter.bootstrap(new ReplApiImpl(interpreter, new LocalRepositoryResolver(config.repository())),
                config.predef());
        if (config.sharedLoader()) {
            interpreter.sharedCompileExecuteMode(true);
        }
        LOG.debug("session ready: {}", config);
        return interpreter;
    }

    static CodeWrapper wrapper(ReplConfig config) {
        switch (config.wrapMode()) {
            case CLASS:
                return new InstanceWrapper(config.wrapperPackage(), config.flatMarker());
            case OBJECT:
            default:
                return new FlatModuleWrapper(config.wrapperPackage(), config.flatMarker());
        }
    }
}
