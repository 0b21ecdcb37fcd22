package com.strata.compiler.javac;

import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.StandardLocation;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把 javac 的输出留在内存中，并让会话里已编译的类在 CLASS_PATH 上可见。
 */
final class MemoryFileManager extends ForwardingJavaFileManager<StandardJavaFileManager> {

    private final Map<String, byte[]> dynamicClasses;
    private final ClassLoader pluginLoader;
    private final Map<String, ByteClassFile> outputs = new LinkedHashMap<>();

    MemoryFileManager(StandardJavaFileManager delegate, Map<String, byte[]> dynamicClasses, ClassLoader pluginLoader) {
        super(delegate);
        this.dynamicClasses = dynamicClasses;
        this.pluginLoader = pluginLoader;
    }

    /** 本次编译产生的类：二进制名 → 字节码 */
    Map<String, byte[]> classFiles() {
        Map<String, byte[]> result = new LinkedHashMap<>();
        for (Map.Entry<String, ByteClassFile> e : outputs.entrySet()) {
            result.put(e.getKey(), e.getValue().bytes());
        }
        return result;
    }

    @Override
    public JavaFileObject getJavaFileForOutput(Location location, String className,
                                               JavaFileObject.Kind kind, FileObject sibling) {
        ByteClassFile file = new ByteClassFile(className);
        outputs.put(className, file);
        return file;
    }

    @Override
    public Iterable<JavaFileObject> list(Location location, String packageName,
                                         Set<JavaFileObject.Kind> kinds, boolean recurse) throws IOException {
        Iterable<JavaFileObject> listed = super.list(location, packageName, kinds, recurse);
        if (location != StandardLocation.CLASS_PATH || !kinds.contains(JavaFileObject.Kind.CLASS)) {
            return listed;
        }
        List<JavaFileObject> files = new ArrayList<>();
        for (Map.Entry<String, byte[]> e : dynamicClasses.entrySet()) {
            String pkg = packageOf(e.getKey());
            if (pkg.equals(packageName) || recurse && pkg.startsWith(packageName + ".")) {
                files.add(new ByteClassFile(e.getKey(), e.getValue()));
            }
        }
        if (files.isEmpty()) {
            return listed;
        }
        for (JavaFileObject f : listed) {
            files.add(f);
        }
        return files;
    }

    @Override
    public String inferBinaryName(Location location, JavaFileObject file) {
        if (file instanceof ByteClassFile) {
            return ((ByteClassFile) file).binaryName();
        }
        return super.inferBinaryName(location, file);
    }

    @Override
    public boolean hasLocation(Location location) {
        if (location == StandardLocation.ANNOTATION_PROCESSOR_PATH) {
            return true;
        }
        return super.hasLocation(location);
    }

    @Override
    public ClassLoader getClassLoader(Location location) {
        if (location == StandardLocation.ANNOTATION_PROCESSOR_PATH) {
            return pluginLoader;
        }
        return super.getClassLoader(location);
    }

    private static String packageOf(String binaryName) {
        int dot = binaryName.lastIndexOf('.');
        return dot < 0 ? "" : binaryName.substring(0, dot);
    }
}
