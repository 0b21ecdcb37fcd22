package strata.api;

import java.util.Objects;

/**
 * 声明的展示元数据，用于生成 "发生了什么" 的回显。
 */
public abstract class DisplayItem {

    public enum Kind {
        DEFINITION,
        IMPORT,
        IDENTITY,
        LAZY_IDENTITY
    }

    private DisplayItem() {
    }

    public abstract Kind kind();

    /** 涉及的符号名 */
    public abstract String name();

    public static Definition definition(String label, String name) {
        return new Definition(label, name);
    }

    public static Import importOf(String imported) {
        return new Import(imported);
    }

    public static Identity identity(String name) {
        return new Identity(name);
    }

    public static LazyIdentity lazyIdentity(String name) {
        return new LazyIdentity(name);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || obj.getClass() != getClass()) return false;
        DisplayItem other = (DisplayItem) obj;
        return name().equals(other.name()) && Objects.equals(label(), other.label());
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind(), name(), label());
    }

    String label() {
        return null;
    }

    /**
     * class / interface / enum / record / method 的定义
     */
    public static final class Definition extends DisplayItem {
        private final String label;
        private final String name;

        Definition(String label, String name) {
            this.label = label;
            this.name = name;
        }

        @Override
        public Kind kind() {
            return Kind.DEFINITION;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public String label() {
            return label;
        }

        @Override
        public String toString() {
            return "Definition(" + label + ", " + name + ")";
        }
    }

    public static final class Import extends DisplayItem {
        private final String imported;

        Import(String imported) {
            this.imported = imported;
        }

        @Override
        public Kind kind() {
            return Kind.IMPORT;
        }

        @Override
        public String name() {
            return imported;
        }

        @Override
        public String toString() {
            return "Import(" + imported + ")";
        }
    }

    public static final class Identity extends DisplayItem {
        private final String ident;

        Identity(String ident) {
            this.ident = ident;
        }

        @Override
        public Kind kind() {
            return Kind.IDENTITY;
        }

        @Override
        public String name() {
            return ident;
        }

        @Override
        public String toString() {
            return "Identity(" + ident + ")";
        }
    }

    /**
     * 值不在定义时求值（例如 Supplier 绑定），回显时不触发计算
     */
    public static final class LazyIdentity extends DisplayItem {
        private final String ident;

        LazyIdentity(String ident) {
            this.ident = ident;
        }

        @Override
        public Kind kind() {
            return Kind.LAZY_IDENTITY;
        }

        @Override
        public String name() {
            return ident;
        }

        @Override
        public String toString() {
            return "LazyIdentity(" + ident + ")";
        }
    }
}
