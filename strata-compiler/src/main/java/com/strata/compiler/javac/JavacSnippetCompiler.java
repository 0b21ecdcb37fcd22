package com.strata.compiler.javac;

import com.sun.source.tree.CompilationUnitTree;
import com.sun.source.tree.ImportTree;
import com.sun.source.util.JavacTask;
import com.sun.source.util.SourcePositions;
import com.sun.source.util.Trees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import strata.api.Frame;
import strata.api.ImportEntry;
import strata.api.Infer;
import strata.api.SnippetCompiler;

import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.VariableElement;
import javax.lang.model.util.ElementFilter;
import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.StandardLocation;
import javax.tools.ToolProvider;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 基于 JDK {@code javax.tools} 的内存编译器。
 *
 * <p>编译分三步：先反复做语法分析与归因，把 {@link Infer} 占位类型替换为初始化表达式的真实类型，
 * 直到没有占位符；然后由 {@link InstanceMembers} 改写实例成员的引用；最后生成字节码，
 * 并读取包装类的公开成员与片段中的用户 import 作为导出项。</p>
 */
public class JavacSnippetCompiler implements SnippetCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(JavacSnippetCompiler.class);

    /** 推断轮数加上改写实例成员的一轮 */
    private static final int MAX_PASSES = 10;

    private static final List<String> OPTIONS = Collections.unmodifiableList(Arrays.asList(
            "-g", "-parameters", "-Xlint:none"));

    private final JavaCompiler javac;
    private StandardJavaFileManager standardManager;

    public JavacSnippetCompiler() {
        this(ToolProvider.getSystemJavaCompiler());
    }

    JavacSnippetCompiler(JavaCompiler javac) {
        this.javac = javac;
    }

    @Override
    public Output compileOrNull(Request request, Frame frame, Consumer<String> printer) {
        if (javac == null) {
            printer.accept("error: no system Java compiler available, run on a JDK rather than a JRE");
            return null;
        }
        MemoryFileManager fileManager = fileManager(frame);
        String source = request.source();

        JavacTask parsing = task(fileManager, new DiagnosticCollector<>(), request.fileName(), source);
        PlaceholderInference.Pass placeholders;
        try {
            placeholders = PlaceholderInference.substitute(parsing, parsing.parse().iterator().next());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        source = PlaceholderInference.apply(source, placeholders.edits);
        Set<String> pending = new LinkedHashSet<>(placeholders.names);

        for (int pass = 1; pass <= MAX_PASSES; pass++) {
            DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
            JavacTask task = task(fileManager, diagnostics, request.fileName(), source);
            CompilationUnitTree unit;
            try {
                unit = task.parse().iterator().next();
                task.analyze();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }

            if (!pending.isEmpty()) {
                PlaceholderInference.Pass inference = PlaceholderInference.scan(task, unit, source, pending);
                if (inference.edits.isEmpty()) {
                    report(diagnostics, request.fileName(), source, inference.unresolvedSpans, printer);
                    for (String name : inference.unresolved) {
                        printer.accept(request.fileName() + ": error: cannot infer a type for '" + name + "'");
                    }
                    return null;
                }
                source = PlaceholderInference.apply(source, inference.edits);
                pending.removeAll(inference.names);
                LOG.debug("inference pass {} resolved {} placeholder(s) in {}", pass, inference.names.size(), request.moduleClass());
                continue;
            }

            if (hasErrors(diagnostics)) {
                report(diagnostics, request.fileName(), source, null, printer);
                return null;
            }
            List<PlaceholderInference.Edit> rewrites = InstanceMembers.rewrite(task, unit, source, request.moduleClass());
            if (!rewrites.isEmpty()) {
                source = PlaceholderInference.apply(source, rewrites);
                LOG.debug("rewrote instance members of {}:\n{}", request.moduleClass(), source);
                continue;
            }

            // 元素与源码位置只在生成字节码之前可用
            Map<String, String> fieldTypes = instanceFieldTypes(task, request.moduleClass());
            List<ImportEntry> userImports = userImports(task, unit, request.importsLength());
            try {
                task.generate();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            if (hasErrors(diagnostics)) {
                report(diagnostics, request.fileName(), source, null, printer);
                return null;
            }

            Map<String, byte[]> classFiles = fileManager.classFiles();
            List<ImportEntry> imports = new ArrayList<>();
            byte[] module = classFiles.get(request.moduleClass());
            if (module != null) {
                imports.addAll(ExportCollector.collect(request.moduleClass(), module, fieldTypes));
            }
            byte[] holder = classFiles.get(request.moduleClass() + "$" + InstanceMembers.HOLDER);
            if (holder != null) {
                imports.addAll(ExportCollector.forwarders(request.moduleClass() + "." + InstanceMembers.HOLDER, holder));
            }
            imports.addAll(userImports);
            LOG.debug("compiled {} into {} class file(s), {} export(s)", request.moduleClass(), classFiles.size(), imports.size());
            return new Output(classFiles, imports);
        }
        printer.accept(request.fileName() + ": error: type inference did not converge");
        return null;
    }

    private MemoryFileManager fileManager(Frame frame) {
        if (standardManager == null) {
            standardManager = javac.getStandardFileManager(null, Locale.ROOT, StandardCharsets.UTF_8);
        }
        try {
            standardManager.setLocationFromPaths(StandardLocation.CLASS_PATH, frame.classpath());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return new MemoryFileManager(standardManager, frame.dynamicClasses(), frame.pluginClassLoader());
    }

    private JavacTask task(MemoryFileManager fileManager, DiagnosticCollector<JavaFileObject> diagnostics,
                           String fileName, String source) {
        return (JavacTask) javac.getTask(null, fileManager, diagnostics, OPTIONS, null,
                Collections.singletonList(new StringSource(fileName, source)));
    }

    private static boolean hasErrors(DiagnosticCollector<JavaFileObject> diagnostics) {
        for (Diagnostic<? extends JavaFileObject> d : diagnostics.getDiagnostics()) {
            if (d.getKind() == Diagnostic.Kind.ERROR) {
                return true;
            }
        }
        return false;
    }

    /**
     * 输出错误诊断。{@code spans} 非空时只输出落在这些源码范围内的错误，一个也没有时输出全部
     */
    private static void report(DiagnosticCollector<JavaFileObject> diagnostics, String fileName, String source,
                               List<int[]> spans, Consumer<String> printer) {
        List<Diagnostic<? extends JavaFileObject>> errors = new ArrayList<>();
        for (Diagnostic<? extends JavaFileObject> d : diagnostics.getDiagnostics()) {
            if (d.getKind() == Diagnostic.Kind.ERROR) {
                errors.add(d);
            }
        }
        if (spans != null && !spans.isEmpty()) {
            List<Diagnostic<? extends JavaFileObject>> within = new ArrayList<>();
            for (Diagnostic<? extends JavaFileObject> d : errors) {
                for (int[] span : spans) {
                    if (d.getPosition() >= span[0] && d.getPosition() < span[1]) {
                        within.add(d);
                        break;
                    }
                }
            }
            if (!within.isEmpty()) {
                errors = within;
            }
        }
        String[] lines = source.split("\n", -1);
        for (Diagnostic<? extends JavaFileObject> d : errors) {
            String message = d.getMessage(Locale.ROOT);
            StringBuilder sb = new StringBuilder();
            sb.append(fileName);
            if (d.getLineNumber() > 0) {
                sb.append(':').append(d.getLineNumber());
            }
            sb.append(": error: ").append(message);
            long line = d.getLineNumber();
            if (line > 0 && line <= lines.length && d.getColumnNumber() > 0) {
                String text = lines[(int) line - 1];
                sb.append('\n').append(text).append('\n');
                for (int i = 1; i < d.getColumnNumber() && i <= text.length(); i++) {
                    sb.append(text.charAt(i - 1) == '\t' ? '\t' : ' ');
                }
                sb.append('^');
            }
            printer.accept(sb.toString());
        }
    }

    /**
     * 包装类的 public 实例字段 → 归因后的全限定类型
     */
    private static Map<String, String> instanceFieldTypes(JavacTask task, String moduleClass) {
        Map<String, String> types = new HashMap<>();
        TypeElement module = task.getElements().getTypeElement(moduleClass);
        if (module == null) {
            return types;
        }
        for (VariableElement field : ElementFilter.fieldsIn(module.getEnclosedElements())) {
            if (field.getModifiers().contains(Modifier.PUBLIC) && !field.getModifiers().contains(Modifier.STATIC)) {
                types.put(field.getSimpleName().toString(),
                        PlaceholderInference.denotable(field.asType(), task.getTypes()));
            }
        }
        return types;
    }

    /**
     * 前置导入块之后出现的 import，即用户自己写的导入
     */
    private static List<ImportEntry> userImports(JavacTask task, CompilationUnitTree unit, int importsLength) {
        SourcePositions positions = Trees.instance(task).getSourcePositions();
        List<ImportEntry> entries = new ArrayList<>();
        for (ImportTree tree : unit.getImports()) {
            if (positions.getStartPosition(unit, tree) < importsLength) continue;
            String path = tree.getQualifiedIdentifier().toString();
            int dot = path.lastIndexOf('.');
            if (dot < 0) continue;
            String prefix = path.substring(0, dot);
            String name = path.substring(dot + 1);
            ImportEntry.Kind kind = tree.isStatic() ? ImportEntry.Kind.STATIC : ImportEntry.Kind.TYPE;
            if (name.equals("*")) {
                entries.add(ImportEntry.wildcard(prefix, kind));
            } else if (tree.isStatic()) {
                entries.add(ImportEntry.staticMember(prefix, name));
            } else {
                entries.add(ImportEntry.type(prefix, name));
            }
        }
        return entries;
    }
}
