package com.strata.compiler.completion;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.FieldVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * 类的公开成员名索引。
 *
 * <p>会话中编译出的类直接用 ASM 读字节码，其余类通过反射获取；结果按加载器代数缓存，
 * 代数变化后旧条目自然失效。</p>
 */
final class MemberIndex {

    private static final Logger LOG = LoggerFactory.getLogger(MemberIndex.class);

    private final Cache<String, List<String>> cache;

    MemberIndex(long maximumSize) {
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .build();
    }

    /**
     * @return 成员名（已排序）；类不存在时返回 null
     */
    List<String> members(String className, int generation, Map<String, byte[]> artifacts, ClassLoader loader) {
        String key = generation + ":" + className;
        List<String> cached = cache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        List<String> members;
        byte[] bytes = artifacts.get(className);
        if (bytes != null) {
            members = fromBytecode(className, bytes, artifacts);
        } else {
            members = fromReflection(className, loader);
        }
        if (members != null) {
            cache.put(key, members);
        }
        return members;
    }

    void invalidateAll() {
        cache.invalidateAll();
    }

    private static List<String> fromBytecode(String className, byte[] bytes, Map<String, byte[]> artifacts) {
        String internalName = className.replace('.', '/');
        TreeSet<String> names = new TreeSet<>();
        new ClassReader(bytes).accept(new ClassVisitor(Opcodes.ASM9) {
            @Override
            public FieldVisitor visitField(int access, String name, String descriptor, String signature, Object value) {
                if (visible(access, name)) names.add(name);
                return null;
            }

            @Override
            public MethodVisitor visitMethod(int access, String name, String descriptor, String signature, String[] exceptions) {
                if (visible(access, name) && !name.startsWith("<")) names.add(name);
                return null;
            }

            @Override
            public void visitInnerClass(String name, String outerName, String innerName, int access) {
                if (internalName.equals(outerName) && innerName != null && visible(access, innerName)) {
                    names.add(innerName);
                }
            }
        }, ClassReader.SKIP_CODE | ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES);
        return Collections.unmodifiableList(new ArrayList<>(names));
    }

    private static boolean visible(int access, String name) {
        return (access & Opcodes.ACC_PUBLIC) != 0
                && (access & Opcodes.ACC_SYNTHETIC) == 0
                && !name.startsWith("$");
    }

    private static List<String> fromReflection(String className, ClassLoader loader) {
        Class<?> type;
        try {
            type = Class.forName(className, false, loader);
        } catch (ClassNotFoundException | LinkageError e) {
            return null;
        }
        TreeSet<String> names = new TreeSet<>();
        try {
            for (Field f : type.getFields()) {
                names.add(f.getName());
            }
            for (Method m : type.getMethods()) {
                if (!m.isSynthetic()) names.add(m.getName());
            }
            for (Class<?> nested : type.getClasses()) {
                if (Modifier.isPublic(nested.getModifiers())) names.add(nested.getSimpleName());
            }
        } catch (LinkageError e) {
            LOG.debug("incomplete member list for {}: {}", className, e.toString());
        }
        return Collections.unmodifiableList(new ArrayList<>(names));
    }
}
