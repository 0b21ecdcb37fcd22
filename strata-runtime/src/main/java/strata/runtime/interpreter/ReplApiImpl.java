package strata.runtime.interpreter;

import strata.api.ClassLoaderTier;
import strata.api.DependencyResolver;
import strata.api.ReplAPI;
import strata.api.ReplExit;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 片段中 {@code repl} 的实现
 */
public class ReplApiImpl implements ReplAPI {

    private final Interpreter interpreter;
    private final DependencyResolver resolver;

    public ReplApiImpl(Interpreter interpreter, DependencyResolver resolver) {
        this.interpreter = interpreter;
        this.resolver = resolver;
    }

    @Override
    public void exit() {
        throw ReplExit.INSTANCE;
    }

    @Override
    public List<String> history() {
        return interpreter.session().history().entries();
    }

    @Override
    public int currentLine() {
        return interpreter.session().currentLine();
    }

    @Override
    public Map<String, String> sources() {
        return interpreter.session().registry().sources();
    }

    @Override
    public void addJars(Path... paths) {
        add(ClassLoaderTier.RUNTIME, paths);
    }

    @Override
    public void addCompilerJars(Path... paths) {
        add(ClassLoaderTier.COMPILER_INTERNAL, paths);
    }

    @Override
    public void addPluginJars(Path... paths) {
        add(ClassLoaderTier.PLUGIN, paths);
    }

    private void add(ClassLoaderTier tier, Path... paths) {
        if (paths == null || paths.length == 0) {
            throw new IllegalArgumentException("no paths given");
        }
        interpreter.session().registry().addPaths(tier, Arrays.asList(paths));
    }

    @Override
    public void addDependency(String coordinates) {
        if (coordinates == null || coordinates.trim().isEmpty()) {
            throw new IllegalArgumentException("empty dependency coordinates");
        }
        List<Path> jars = resolver.resolve(Collections.singletonList(coordinates.trim()));
        if (jars.isEmpty()) {
            throw new IllegalArgumentException("cannot resolve " + coordinates);
        }
        interpreter.session().registry().addPaths(ClassLoaderTier.RUNTIME, jars);
    }

    @Override
    public void sharedCompileExecuteMode(boolean enabled) {
        interpreter.sharedCompileExecuteMode(enabled);
    }

    @Override
    public void onStop(Runnable action) {
        if (action == null) {
            throw new IllegalArgumentException("stop hook must not be null");
        }
        interpreter.onStop(action);
    }

    @Override
    public String toString() {
        return "repl(line " + currentLine() + ")";
    }
}
