package com.strata.compiler.javac;

import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.FieldVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import strata.api.ImportEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 从包装类字节码中读取对外可见的成员，生成以空前缀表示的导出项。
 *
 * <ul>
 *   <li>public static 字段 / 方法 → STATIC</li>
 *   <li>public 实例字段 → INSTANCE，类型取自编译期的归因结果</li>
 *   <li>public 嵌套类型 → TYPE</li>
 * </ul>
 *
 * <p>以 {@code $} 开头的合成成员和 {@code INSTANCE} 单例字段不导出。实例方法经由
 * {@link InstanceMembers#HOLDER} 中的静态转发方法导出，见 {@link #forwarders}。</p>
 */
final class ExportCollector extends ClassVisitor {

    private final String internalName;
    private final Map<String, String> fieldTypes;
    private final Map<String, ImportEntry> exports = new LinkedHashMap<>();

    private ExportCollector(String internalName, Map<String, String> fieldTypes) {
        super(Opcodes.ASM9);
        this.internalName = internalName;
        this.fieldTypes = fieldTypes;
    }

    /**
     * @param moduleClass 包装类二进制名
     * @param bytes       包装类字节码
     * @param fieldTypes  实例字段名 → 全限定类型
     */
    static List<ImportEntry> collect(String moduleClass, byte[] bytes, Map<String, String> fieldTypes) {
        ExportCollector collector = new ExportCollector(moduleClass.replace('.', '/'), fieldTypes);
        new ClassReader(bytes).accept(collector, ClassReader.SKIP_CODE | ClassReader.SKIP_DEBUG | ClassReader.SKIP_FRAMES);
        return new ArrayList<>(collector.exports.values());
    }

    /**
     * 转发类的 public static 方法 → STATIC，前缀直接是转发类的全名
     */
    static List<ImportEntry> forwarders(String holderClass, byte[] bytes) {
        List<ImportEntry> entries = new ArrayList<>();
        for (ImportEntry entry : collect(holderClass, bytes, Collections.<String, String>emptyMap())) {
            if (entry.kind() == ImportEntry.Kind.STATIC) {
                entries.add(entry.withPrefix(holderClass));
            }
        }
        return entries;
    }

    private static boolean exported(int access, String name) {
        return (access & Opcodes.ACC_PUBLIC) != 0
                && (access & (Opcodes.ACC_SYNTHETIC | Opcodes.ACC_BRIDGE)) == 0
                && !name.startsWith("$")
                && !name.equals("INSTANCE");
    }

    @Override
    public FieldVisitor visitField(int access, String name, String descriptor, String signature, Object value) {
        if (exported(access, name)) {
            if ((access & Opcodes.ACC_STATIC) != 0) {
                exports.put("S:" + name, ImportEntry.staticMember("", name));
            } else {
                String type = fieldTypes.get(name);
                if (type != null) {
                    exports.put("I:" + name, ImportEntry.instance("", name, type));
                }
            }
        }
        return null;
    }

    @Override
    public MethodVisitor visitMethod(int access, String name, String descriptor, String signature, String[] exceptions) {
        if ((access & Opcodes.ACC_STATIC) != 0 && !name.equals("<clinit>") && exported(access, name)) {
            // 重载只导出一次
            exports.putIfAbsent("S:" + name, ImportEntry.staticMember("", name));
        }
        return null;
    }

    @Override
    public void visitInnerClass(String name, String outerName, String innerName, int access) {
        if (internalName.equals(outerName) && innerName != null && exported(access, innerName)) {
            exports.put("T:" + innerName, ImportEntry.type("", innerName));
        }
    }
}
