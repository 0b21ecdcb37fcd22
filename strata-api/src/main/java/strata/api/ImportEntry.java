package strata.api;

import java.util.Objects;

/**
 * 会话中累积的一条导入绑定。
 *
 * <p>{@code prefix} 标识产生该符号的包装类或外部包/类型；由编译器导出的成员
 * 以空前缀出现，求值循环会把它改写为刚生成的包装类全名。</p>
 */
public final class ImportEntry {

    public enum Kind {
        /** {@code import a.b.C;} */
        TYPE,
        /** {@code import static a.b.C.m;} */
        STATIC,
        /** 实例包装行的字段，以成员别名 {@code T x = prefix.INSTANCE.x;} 引入 */
        INSTANCE
    }

    private final String localName;
    private final String sourceName;
    private final String prefix;
    private final Kind kind;
    private final boolean wildcard;
    private final boolean implicit;
    private final String typeHint;

    public ImportEntry(String localName, String sourceName, String prefix, Kind kind,
                       boolean wildcard, boolean implicit, String typeHint) {
        this.localName = Objects.requireNonNull(localName, "localName");
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.wildcard = wildcard;
        this.implicit = implicit;
        this.typeHint = typeHint;
        if (kind == Kind.INSTANCE && (wildcard || typeHint == null)) {
            throw new IllegalArgumentException("instance alias needs a type and cannot be a wildcard: " + localName);
        }
    }

    public static ImportEntry type(String prefix, String name) {
        return new ImportEntry(name, name, prefix, Kind.TYPE, false, false, null);
    }

    public static ImportEntry staticMember(String prefix, String name) {
        return new ImportEntry(name, name, prefix, Kind.STATIC, false, false, null);
    }

    public static ImportEntry wildcard(String prefix, Kind kind) {
        return new ImportEntry("*", "*", prefix, kind, true, false, null);
    }

    public static ImportEntry instance(String prefix, String name, String type) {
        return new ImportEntry(name, name, prefix, Kind.INSTANCE, false, false, type);
    }

    public String localName() {
        return localName;
    }

    public String sourceName() {
        return sourceName;
    }

    public String prefix() {
        return prefix;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isWildcard() {
        return wildcard;
    }

    public boolean isImplicit() {
        return implicit;
    }

    /** INSTANCE 别名的全限定类型，其余为 null */
    public String typeHint() {
        return typeHint;
    }

    public ImportEntry withPrefix(String newPrefix) {
        return new ImportEntry(localName, sourceName, newPrefix, kind, wildcard, implicit, typeHint);
    }

    public ImportEntry asImplicit() {
        return new ImportEntry(localName, sourceName, prefix, kind, wildcard, true, typeHint);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj instanceof ImportEntry) {
            ImportEntry other = (ImportEntry) obj;
            return localName.equals(other.localName)
                    && sourceName.equals(other.sourceName)
                    && prefix.equals(other.prefix)
                    && kind == other.kind
                    && wildcard == other.wildcard
                    && implicit == other.implicit
                    && Objects.equals(typeHint, other.typeHint);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(localName, sourceName, prefix, kind, wildcard, implicit, typeHint);
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder("ImportEntry(");
        b.append(kind).append(' ');
        b.append(prefix.isEmpty() ? "<wrapper>" : prefix).append('.').append(sourceName);
        if (!localName.equals(sourceName)) {
            b.append(" as ").append(localName);
        }
        if (implicit) {
            b.append(", implicit");
        }
        if (typeHint != null) {
            b.append(", type=").append(typeHint);
        }
        return b.append(')').toString();
    }
}
