package com.strata.compiler.javac;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.ClassReader;
import org.objectweb.asm.util.CheckClassAdapter;
import strata.api.ImportEntry;
import strata.api.SnippetCompiler;
import strata.api.Unit;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 内存编译、占位类型推断与导出项测试
 */
@DisplayName("javac 片段编译测试")
class JavacSnippetCompilerTest {

    private static final String HEADER = "package $sess;\nimport static strata.api.Predef.*;\n";

    private JavacSnippetCompiler compiler;
    private TestFrame frame;
    private List<String> printed;

    @BeforeEach
    void setUp() {
        compiler = new JavacSnippetCompiler();
        frame = new TestFrame();
        printed = new ArrayList<>();
    }

    private SnippetCompiler.Output compile(String wrapper, String userImports, String body) {
        String source = HEADER + userImports + "public final class " + wrapper + " {\n" + body
                + "public static final class $Main { public static Object $main() { return null; } }\n}\n";
        return compiler.compileOrNull(new SnippetCompiler.Request(source, "$sess." + wrapper, HEADER.length(),
                wrapper + ".java"), frame, printed::add);
    }

    private static Class<?> load(Map<String, byte[]> classes, String name) throws ClassNotFoundException {
        return new MapClassLoader(classes).loadClass(name);
    }

    static final class MapClassLoader extends ClassLoader {
        private final Map<String, byte[]> classes;

        MapClassLoader(Map<String, byte[]> classes) {
            super(MapClassLoader.class.getClassLoader());
            this.classes = classes;
        }

        @Override
        protected Class<?> findClass(String name) throws ClassNotFoundException {
            byte[] bytes = classes.get(name);
            if (bytes != null) return defineClass(name, bytes, 0, bytes.length);
            throw new ClassNotFoundException(name);
        }
    }

    @Nested
    @DisplayName("类型推断")
    class Inference {

        @Test
        @DisplayName("占位类型替换为初始化表达式的类型")
        void primitive() throws Exception {
            SnippetCompiler.Output out = compile("cmd0", "", "public static strata.api.Infer x = 1 + 1;\n");
            assertNotNull(out, String.join("\n", printed));
            Class<?> module = load(out.classFiles(), "$sess.cmd0");
            assertEquals(int.class, module.getField("x").getType());
            assertEquals(2, module.getField("x").get(null));
        }

        @Test
        @DisplayName("相互依赖的占位字段")
        void dependent() throws Exception {
            SnippetCompiler.Output out = compile("cmd0", "",
                    "public static strata.api.Infer a = \"ab\";\npublic static strata.api.Infer b = a.length();\n");
            assertNotNull(out, String.join("\n", printed));
            Class<?> module = load(out.classFiles(), "$sess.cmd0");
            assertEquals(String.class, module.getField("a").getType());
            assertEquals(int.class, module.getField("b").getType());
        }

        @Test
        @DisplayName("引用其他占位字段时等它先确定类型")
        void waitsForDependency() throws Exception {
            SnippetCompiler.Output out = compile("cmd0", "",
                    "public static strata.api.Infer s = \"ab\";\npublic static strata.api.Infer t = s;\n");
            assertNotNull(out, String.join("\n", printed));
            assertEquals(String.class, load(out.classFiles(), "$sess.cmd0").getField("t").getType());
        }

        @Test
        @DisplayName("泛型调用按实参推断")
        void genericCall() throws Exception {
            SnippetCompiler.Output out = compile("cmd0", "",
                    "public static strata.api.Infer xs = java.util.Arrays.asList(1, 2);\n");
            assertNotNull(out, String.join("\n", printed));
            assertEquals("java.util.List<java.lang.Integer>",
                    load(out.classFiles(), "$sess.cmd0").getField("xs").getGenericType().getTypeName());
        }

        @Test
        @DisplayName("void 表达式绑定为 Unit")
        void voidExpression() throws Exception {
            SnippetCompiler.Output out = compile("cmd0", "", "public static strata.api.Infer r = Thread.yield();\n");
            assertNotNull(out, String.join("\n", printed));
            Class<?> module = load(out.classFiles(), "$sess.cmd0");
            assertEquals(Unit.class.getName(), module.getField("r").getType().getName());
        }

        @Test
        @DisplayName("null 推断为 Object")
        void nullLiteral() throws Exception {
            SnippetCompiler.Output out = compile("cmd0", "", "public static strata.api.Infer n = null;\n");
            assertNotNull(out, String.join("\n", printed));
            assertEquals(Object.class, load(out.classFiles(), "$sess.cmd0").getField("n").getType());
        }

        @Test
        @DisplayName("匿名类推断为父类型")
        void anonymous() throws Exception {
            SnippetCompiler.Output out = compile("cmd0", "",
                    "public static strata.api.Infer r = new Runnable() { public void run() {} };\n");
            assertNotNull(out, String.join("\n", printed));
            assertEquals(Runnable.class, load(out.classFiles(), "$sess.cmd0").getField("r").getType());
        }

        @Test
        @DisplayName("无法推断时报告字段名")
        void unresolved() {
            SnippetCompiler.Output out = compile("cmd0", "", "public static strata.api.Infer f = () -> 1;\n");
            assertNull(out);
            assertThat(String.join("\n", printed)).contains("'f'");
        }
    }

    @Nested
    @DisplayName("导出项")
    class Exports {

        @Test
        @DisplayName("静态成员、嵌套类型与用户导入")
        void flatExports() {
            SnippetCompiler.Output out = compile("cmd0", "import java.util.List;\nimport static java.lang.Math.*;\n",
                    "public static int x = 1;\n"
                            + "public static int twice(int a) { return a * 2; }\n"
                            + "public static long twice(long a) { return a * 2; }\n"
                            + "public static final class Foo {}\n"
                            + "static int hidden = 0;\n");
            assertNotNull(out, String.join("\n", printed));
            assertThat(out.classFiles()).containsKeys("$sess.cmd0", "$sess.cmd0$Foo", "$sess.cmd0$$Main");
            assertThat(out.imports()).containsExactlyInAnyOrder(
                    ImportEntry.staticMember("", "x"),
                    ImportEntry.staticMember("", "twice"),
                    ImportEntry.type("", "Foo"),
                    ImportEntry.type("java.util", "List"),
                    ImportEntry.wildcard("java.lang.Math", ImportEntry.Kind.STATIC));
        }

        @Test
        @DisplayName("实例字段携带全限定类型")
        void instanceExports() {
            SnippetCompiler.Output out = compile("cmd0", "",
                    "public static final cmd0 INSTANCE = new cmd0();\n"
                            + "public java.util.List<String> names = new java.util.ArrayList<>();\n"
                            + "public int size() { return names.size(); }\n");
            assertNotNull(out, String.join("\n", printed));
            assertThat(out.imports()).containsExactlyInAnyOrder(
                    ImportEntry.instance("", "names", "java.util.List<java.lang.String>"),
                    ImportEntry.staticMember("$sess.cmd0.$Members", "size"));
            assertThat(out.classFiles()).containsKey("$sess.cmd0$$Members");
        }

        @Test
        @DisplayName("实例方法通过静态转发方法调用")
        void forwarders() throws Exception {
            SnippetCompiler.Output out = compile("cmd0", "",
                    "public static final cmd0 INSTANCE = new cmd0();\n"
                            + "public int base = 10;\n"
                            + "public int plus(int a) { return base + a; }\n"
                            + "public <T extends Comparable<T>> T max(T a, T b) { return a.compareTo(b) >= 0 ? a : b; }\n"
                            + "public String join(String... parts) { return String.join(\"-\", parts); }\n"
                            + "public void touch() throws java.io.IOException { base++; }\n");
            assertNotNull(out, String.join("\n", printed));
            Class<?> holder = load(out.classFiles(), "$sess.cmd0$$Members");
            assertEquals(13, holder.getMethod("plus", int.class).invoke(null, 3));
            assertEquals("b", holder.getMethod("max", Comparable.class, Comparable.class).invoke(null, "a", "b"));
            assertEquals("x-y", holder.getMethod("join", String[].class).invoke(null, (Object) new String[]{"x", "y"}));
            assertThat(out.imports()).contains(
                    ImportEntry.staticMember("$sess.cmd0.$Members", "plus"),
                    ImportEntry.staticMember("$sess.cmd0.$Members", "touch"));
        }
    }

    @Nested
    @DisplayName("实例成员别名")
    class InstanceAliases {

        @Test
        @DisplayName("对别名的赋值落在原字段上")
        void assignmentReachesOriginal() throws Exception {
            SnippetCompiler.Output first = compile("cmd0", "",
                    "public static final cmd0 INSTANCE = new cmd0();\n"
                            + "public int x = 1;\n"
                            + "public int twice(int a) { return a * 2; }\n");
            assertNotNull(first, String.join("\n", printed));
            assertThat(first.imports()).contains(ImportEntry.instance("", "x", "int"));
            frame.classes.putAll(first.classFiles());

            SnippetCompiler.Output second = compile("cmd1", "import static $sess.cmd0.$Members.twice;\n",
                    "public static final cmd1 INSTANCE = new cmd1();\n"
                            + "private int x = $sess.cmd0.INSTANCE.x;\n"
                            + "{ x = twice(x) + 3; this.x++; }\n");
            assertNotNull(second, String.join("\n", printed));

            Map<String, byte[]> all = new java.util.HashMap<>(frame.classes);
            all.putAll(second.classFiles());
            MapClassLoader loader = new MapClassLoader(all);
            Class<?> cmd1 = loader.loadClass("$sess.cmd1");
            cmd1.getField("INSTANCE").get(null);
            assertThrows(NoSuchFieldException.class, () -> cmd1.getDeclaredField("x"));

            Object cmd0 = loader.loadClass("$sess.cmd0").getField("INSTANCE").get(null);
            assertEquals(6, cmd0.getClass().getField("x").get(cmd0));
        }

        @Test
        @DisplayName("同名局部变量不被改写")
        void shadowedLocal() throws Exception {
            SnippetCompiler.Output first = compile("cmd0", "",
                    "public static final cmd0 INSTANCE = new cmd0();\npublic int x = 1;\n");
            assertNotNull(first, String.join("\n", printed));
            frame.classes.putAll(first.classFiles());

            SnippetCompiler.Output second = compile("cmd1", "",
                    "public static final cmd1 INSTANCE = new cmd1();\n"
                            + "private int x = $sess.cmd0.INSTANCE.x;\n"
                            + "public int local() { int x = 7; return x; }\n"
                            + "public int shared() { return x; }\n");
            assertNotNull(second, String.join("\n", printed));

            Map<String, byte[]> all = new java.util.HashMap<>(frame.classes);
            all.putAll(second.classFiles());
            MapClassLoader loader = new MapClassLoader(all);
            Object cmd1 = loader.loadClass("$sess.cmd1").getField("INSTANCE").get(null);
            assertEquals(7, cmd1.getClass().getMethod("local").invoke(cmd1));
            assertEquals(1, cmd1.getClass().getMethod("shared").invoke(cmd1));
        }
    }

    @Nested
    @DisplayName("会话中的类")
    class SessionClasses {

        @Test
        @DisplayName("后续编译能引用内存中的包装类")
        void referencesEarlierWrapper() throws Exception {
            SnippetCompiler.Output first = compile("cmd0", "", "public static int x = 41;\n");
            assertNotNull(first, String.join("\n", printed));
            frame.classes.putAll(first.classFiles());

            SnippetCompiler.Output second = compile("cmd1", "import static $sess.cmd0.x;\n",
                    "public static strata.api.Infer res1 = x + 1;\n");
            assertNotNull(second, String.join("\n", printed));
            Map<String, byte[]> all = new java.util.HashMap<>(frame.classes);
            all.putAll(second.classFiles());
            assertEquals(42, load(all, "$sess.cmd1").getField("res1").get(null));
        }

        @Test
        @DisplayName("生成的字节码通过校验")
        void verifies() {
            SnippetCompiler.Output out = compile("cmd0", "",
                    "public static strata.api.Infer xs = new int[]{1, 2, 3};\n"
                            + "static { strata.api.Unchecked.run(() -> { Thread.sleep(0); }); }\n");
            assertNotNull(out, String.join("\n", printed));
            MapClassLoader loader = new MapClassLoader(out.classFiles());
            for (Map.Entry<String, byte[]> e : out.classFiles().entrySet()) {
                StringWriter sw = new StringWriter();
                CheckClassAdapter.verify(new ClassReader(e.getValue()), loader, false, new PrintWriter(sw));
                assertEquals("", sw.toString(), "字节码验证失败 [" + e.getKey() + "]");
            }
        }
    }

    @Nested
    @DisplayName("诊断")
    class Diagnostics {

        @Test
        @DisplayName("类型错误返回 null 并输出诊断")
        void typeError() {
            SnippetCompiler.Output out = compile("cmd0", "", "public static int y = \"s\";\n");
            assertNull(out);
            assertThat(printed).isNotEmpty();
            assertThat(printed.get(0)).startsWith("cmd0.java:").contains("error:").contains("^");
        }

        @Test
        @DisplayName("推断过程中的其他错误照常报告")
        void errorAlongsidePlaceholder() {
            SnippetCompiler.Output out = compile("cmd0", "", "public static strata.api.Infer z = undefinedName;\n");
            assertNull(out);
            assertThat(String.join("\n", printed)).contains("undefinedName");
        }
    }
}
