package strata.runtime.interpreter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import strata.api.ClassLoaderTier;
import strata.api.Evaluated;
import strata.api.Res;
import strata.runtime.Strata;
import strata.runtime.config.ReplConfig;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 端到端：真实的解析器、javac 与分层加载器
 */
@DisplayName("求值循环测试")
class InterpreterTest {

    private ByteArrayOutputStream errBuffer;
    private List<String> printed;

    @BeforeEach
    void setUp() {
        errBuffer = new ByteArrayOutputStream();
        printed = new ArrayList<>();
    }

    private Interpreter create(ReplConfig.WrapMode mode) {
        ReplConfig config = ReplConfig.defaults().withHistoryFile(null).withWrapMode(mode);
        return Strata.create(config, new PrintStream(errBuffer, true));
    }

    private Res<Evaluated<List<String>>> eval(Interpreter repl, String code) {
        return repl.apply(code, true, printed::add);
    }

    private static List<String> lines(Res<Evaluated<List<String>>> res) {
        assertTrue(res.isSuccess(), "expected success but got " + res);
        return ((Res.Success<Evaluated<List<String>>>) res).value().value();
    }

    private static String failure(Res<?> res) {
        assertTrue(res instanceof Res.Failure, "expected failure but got " + res);
        return ((Res.Failure<?>) res).message();
    }

    @Nested
    @DisplayName("扁平包装会话")
    class FlatSession {

        private Interpreter repl;

        @BeforeEach
        void setUp() {
            repl = create(ReplConfig.WrapMode.OBJECT);
        }

        @Test
        @DisplayName("启动后第一条输入是第 0 行")
        void testFirstLineIsZero() {
            assertEquals(0, repl.session().currentLine());
            assertThat(repl.session().registry().sources()).containsKey("$sess.cmd_1");
        }

        @Test
        @DisplayName("Predef 的静态成员无需导入")
        void testPredefMembers() {
            assertEquals(Collections.singletonList("res0 = 4"), lines(eval(repl, "show(\"hi\").length()")));
        }

        @Test
        @DisplayName("定义后引用：int x = 1 然后 x + 1 得到 2")
        void testDefineThenUse() {
            assertEquals(Collections.singletonList("x = 1"), lines(eval(repl, "int x = 1")));
            assertEquals(Collections.singletonList("res1 = 2"), lines(eval(repl, "x + 1")));
            assertEquals(Arrays.asList("x = 1", "res1 = 2"), printed);
        }

        @Test
        @DisplayName("方法与类型跨行可用")
        void testMethodsAndTypes() {
            assertEquals(Collections.singletonList("defined method twice"),
                    lines(eval(repl, "int twice(int a) { return a * 2; }")));
            assertEquals(Collections.singletonList("defined class Point"),
                    lines(eval(repl, "class Point { final int x; Point(int x) { this.x = x; } }")));
            assertEquals(Collections.singletonList("res2 = 42"), lines(eval(repl, "twice(new Point(21).x)")));
        }

        @Test
        @DisplayName("var 推断出具体类型")
        void testVarInference() {
            assertEquals(Collections.singletonList("list = []"),
                    lines(eval(repl, "var list = new java.util.ArrayList<String>();")));
            assertEquals(Collections.singletonList("res1 = true"), lines(eval(repl, "list.add(\"a\")")));
            assertEquals(Collections.singletonList("res2 = 1"), lines(eval(repl, "list.size()")));
        }

        @Test
        @DisplayName("void 表达式不回显")
        void testVoidExpression() {
            assertThat(lines(eval(repl, "\"abc\".length()"))).hasSize(1);
            assertThat(lines(eval(repl, "Thread.yield()"))).isEmpty();
        }

        @Test
        @DisplayName("用户 import 被记住")
        void testUserImport() {
            assertEquals(Collections.singletonList("import java.util.concurrent.atomic.AtomicLong"),
                    lines(eval(repl, "import java.util.concurrent.atomic.AtomicLong;")));
            assertEquals(Collections.singletonList("res1 = 5"), lines(eval(repl, "new AtomicLong(5).get()")));
        }

        @Test
        @DisplayName("后定义的同名变量遮蔽先前的")
        void testShadowing() {
            eval(repl, "int v = 1");
            eval(repl, "String v = \"two\"");
            assertEquals(Collections.singletonList("res2 = 3"), lines(eval(repl, "v.length()")));
        }

        @Test
        @DisplayName("语句修改之前的变量")
        void testStatementMutation() {
            eval(repl, "int counter = 0");
            assertThat(lines(eval(repl, "for (int i = 0; i < 3; i++) counter += i;"))).isEmpty();
            assertEquals(Collections.singletonList("res2 = 3"), lines(eval(repl, "counter")));
        }

        @Test
        @DisplayName("包装类名随行号唯一")
        void testUniqueWrapperNames() {
            Set<String> names = new HashSet<>();
            for (int i = 0; i < 5; i++) {
                Res<Evaluated<List<String>>> res = eval(repl, "int n" + i + " = " + i);
                assertTrue(names.add(((Res.Success<Evaluated<List<String>>>) res).value().wrapperName()));
            }
            assertEquals(new HashSet<>(Arrays.asList("$sess.cmd0", "$sess.cmd1", "$sess.cmd2", "$sess.cmd3",
                    "$sess.cmd4")), names);
        }
    }

    @Nested
    @DisplayName("缓冲")
    class Buffering {

        @Test
        @DisplayName("\"{\" 加 \"}\" 等价于 \"{}\"")
        void testBufferRoundTrip() {
            Interpreter repl = create(ReplConfig.WrapMode.OBJECT);

            Res<Evaluated<List<String>>> first = eval(repl, "{");
            assertEquals(Res.buffer("{"), first);
            assertTrue(repl.isBuffering());
            assertEquals(0, repl.session().currentLine());

            Res<Evaluated<List<String>>> second = eval(repl, "}");
            assertThat(lines(second)).isEmpty();
            assertFalse(repl.isBuffering());
            assertEquals(1, repl.session().currentLine());
            assertEquals(Collections.singletonList("{}"), repl.session().history().entries());
        }

        @Test
        @DisplayName("多行方法定义")
        void testMultiLineMethod() {
            Interpreter repl = create(ReplConfig.WrapMode.OBJECT);
            assertTrue(eval(repl, "int sq(int a) {\n") instanceof Res.Buffer);
            assertTrue(eval(repl, "  return a * a;\n") instanceof Res.Buffer);
            assertEquals(Collections.singletonList("defined method sq"), lines(eval(repl, "}\n")));
            assertEquals(Collections.singletonList("res1 = 49"), lines(eval(repl, "sq(7)")));
        }

        @Test
        @DisplayName("空白输入跳过且不消耗行号")
        void testBlank() {
            Interpreter repl = create(ReplConfig.WrapMode.OBJECT);
            assertSame(Res.skip(), eval(repl, "   // nothing\n"));
            assertEquals(0, repl.session().currentLine());
        }
    }

    @Nested
    @DisplayName("失败与退出")
    class Failures {

        private Interpreter repl;

        @BeforeEach
        void setUp() {
            repl = create(ReplConfig.WrapMode.OBJECT);
        }

        @Test
        @DisplayName("语法错误给出诊断且行号前进一次")
        void testSyntaxError() {
            int before = repl.session().currentLine();
            String message = failure(eval(repl, "int y = ;"));
            assertThat(message).isNotBlank().contains("error");
            assertEquals(before + 1, repl.session().currentLine());

            assertEquals(Collections.singletonList("y = 2"), lines(eval(repl, "int y = 2")));
        }

        @Test
        @DisplayName("类型错误")
        void testTypeError() {
            assertThat(failure(eval(repl, "int s = \"text\""))).contains("incompatible types");
        }

        @Test
        @DisplayName("运行时异常只保留用户栈帧")
        void testRuntimeFault() {
            String message = failure(eval(repl, "Integer.parseInt(\"abc\")"));
            assertThat(message).startsWith("java.lang.NumberFormatException");
            assertThat(message).contains("$sess.cmd0");
            assertThat(message).doesNotContain("strata.runtime.interpreter", "jdk.internal.reflect");
        }

        @Test
        @DisplayName("失败后会话继续")
        void testContinuesAfterFailure() {
            failure(eval(repl, "throw new IllegalStateException(\"boom\");"));
            assertEquals(Collections.singletonList("res1 = 3"), lines(eval(repl, "1 + 2")));
        }

        @Test
        @DisplayName("exit() 结束会话")
        void testExit() {
            assertSame(Res.exit(), eval(repl, "exit()"));
        }

        @Test
        @DisplayName("repl.exit() 与语句中的退出")
        void testExitFromBridge() {
            assertSame(Res.exit(), eval(repl, "repl.exit();"));
            assertSame(Res.exit(), eval(repl, "if (true) throw strata.api.ReplExit.INSTANCE;"));
        }

        @Test
        @DisplayName("回显失败被报告")
        void testPrinterFault() {
            Res<Evaluated<List<String>>> res = repl.apply("int q = 1", true, line -> {
                throw new IllegalStateException("printer broke");
            });
            assertThat(failure(res)).contains("printer broke");
        }

        @Test
        @DisplayName("run 失败时抛出 ReplException")
        void testRunThrows() {
            ReplException e = assertThrows(ReplException.class, () -> repl.run("undefinedName + 1"));
            assertThat(e.getMessage()).contains("undefinedName");
            assertEquals(Collections.singletonList("res1 = 4"), repl.run("2 + 2").value());
        }
    }

    @Nested
    @DisplayName("实例包装会话")
    class InstanceSession {

        private Interpreter repl;

        @BeforeEach
        void setUp() {
            repl = create(ReplConfig.WrapMode.CLASS);
        }

        @Test
        @DisplayName("字段通过别名跨行可用")
        void testAliases() {
            assertEquals(Collections.singletonList("x = 1"), lines(eval(repl, "int x = 1")));
            assertEquals(Collections.singletonList("res1 = 2"), lines(eval(repl, "x + 1")));
            assertThat(repl.session().registry().sources().get("$sess.cmd1"))
                    .contains("int x = $sess.cmd0.INSTANCE.x;");
        }

        @Test
        @DisplayName("扁平标记的行生成 flatCmdN")
        void testFlatEscape() {
            Res<Evaluated<List<String>>> res = eval(repl, "import strata.wrap.flat;\nint twice(int a) { return a * 2; }");
            assertEquals("$sess.flatCmd0", ((Res.Success<Evaluated<List<String>>>) res).value().wrapperName());
            assertEquals(Collections.singletonList("defined method twice"), lines(res));
            assertEquals(Collections.singletonList("res1 = 10"), lines(eval(repl, "twice(5)")));
        }

        @Test
        @DisplayName("方法跨行可调用")
        void testMethodsAcrossLines() {
            assertEquals(Collections.singletonList("defined method twice"),
                    lines(eval(repl, "int twice(int a) { return a * 2; }")));
            assertEquals(Collections.singletonList("res1 = 10"), lines(eval(repl, "twice(5)")));
        }

        @Test
        @DisplayName("语句修改之前的变量")
        void testStatementMutation() {
            assertEquals(Collections.singletonList("x = 1"), lines(eval(repl, "int x = 1")));
            assertThat(lines(eval(repl, "x = 5;"))).isEmpty();
            assertEquals(Collections.singletonList("res2 = 5"), lines(eval(repl, "x")));
        }

        @Test
        @DisplayName("方法修改之前行的字段")
        void testMethodMutatesField() {
            eval(repl, "int count = 0");
            eval(repl, "void bump() { count++; }");
            assertThat(lines(eval(repl, "bump(); bump();"))).isEmpty();
            assertEquals(Collections.singletonList("res3 = 2"), lines(eval(repl, "count")));
        }

        @Test
        @DisplayName("后定义的同名变量遮蔽先前的")
        void testShadowing() {
            eval(repl, "int v = 1");
            assertEquals(Collections.singletonList("v = \"two\""), lines(eval(repl, "String v = \"two\"")));
            assertEquals(Collections.singletonList("res2 = 3"), lines(eval(repl, "v.length()")));
        }

        @Test
        @DisplayName("嵌套类型可以跨行使用")
        void testTypes() {
            eval(repl, "enum Color { RED, GREEN }");
            assertEquals(Collections.singletonList("res1 = GREEN"), lines(eval(repl, "Color.valueOf(\"GREEN\")")));
        }
    }

    @Nested
    @DisplayName("加载器切换")
    class LoaderSwap {

        @Test
        @DisplayName("切换后旧加载器不再解析旧包装类，新片段照常运行")
        void testSwap() throws Exception {
            Interpreter repl = create(ReplConfig.WrapMode.OBJECT);
            lines(eval(repl, "int a = 41"));
            ClassLoader old = repl.session().registry().currentLoader(ClassLoaderTier.RUNTIME);
            assertNotNull(old.loadClass("$sess.cmd0"));

            repl.sharedCompileExecuteMode(true);

            assertThrows(ClassNotFoundException.class, () -> old.loadClass("$sess.cmd0"));
            assertTrue(repl.session().registry().isSharedCompileExecuteMode());
            assertEquals(Collections.singletonList("res2 = 2"), lines(eval(repl, "1 + 1")));
            failure(eval(repl, "a"));
        }

        @Test
        @DisplayName("片段中通过 repl 切换")
        void testSwapFromSnippet() {
            Interpreter repl = create(ReplConfig.WrapMode.OBJECT);
            lines(eval(repl, "repl.sharedCompileExecuteMode(true);"));

            assertEquals(1, repl.session().registry().generation());
            assertEquals(Collections.singletonList("res2 = 6"), lines(eval(repl, "2 * 3")));
            // 求值期间行号已前进
            assertEquals(Collections.singletonList("res3 = 4"), lines(eval(repl, "repl.currentLine()")));
        }
    }

    @Nested
    @DisplayName("桥接与生命周期")
    class Lifecycle {

        @Test
        @DisplayName("预置代码在第 0 行之前运行")
        void testPredef() {
            ReplConfig config = ReplConfig.defaults().withHistoryFile(null).withPredef("int seed = 7;");
            Interpreter repl = Strata.create(config, new PrintStream(errBuffer, true));

            assertEquals(0, repl.session().currentLine());
            assertEquals(Collections.singletonList("res0 = 14"), lines(eval(repl, "seed * 2")));
        }

        @Test
        @DisplayName("预置代码失败只报告")
        void testBrokenPredef() {
            ReplConfig config = ReplConfig.defaults().withHistoryFile(null).withPredef("int broken = ;");
            Interpreter repl = Strata.create(config, new PrintStream(errBuffer, true));

            assertEquals(0, repl.session().currentLine());
            assertThat(new String(errBuffer.toByteArray(), StandardCharsets.UTF_8)).contains("predef failed");
        }

        @Test
        @DisplayName("repl 暴露历史与源码")
        void testBridge() {
            Interpreter repl = create(ReplConfig.WrapMode.OBJECT);
            eval(repl, "int h = 1");
            assertEquals(Collections.singletonList("res1 = 1"), lines(eval(repl, "repl.history().size() - 1")));
            assertEquals(Collections.singletonList("res2 = true"),
                    lines(eval(repl, "repl.sources().containsKey(\"$sess.cmd0\")")));
        }

        @Test
        @DisplayName("关闭钩子只执行一次")
        void testStopHooks() {
            Interpreter repl = create(ReplConfig.WrapMode.OBJECT);
            AtomicInteger calls = new AtomicInteger();
            repl.onStop(calls::incrementAndGet);
            repl.onStop(() -> {
                throw new IllegalStateException("ignored");
            });

            repl.stop();
            repl.stop();
            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("补全成员名")
        void testCompletion() {
            Interpreter repl = create(ReplConfig.WrapMode.OBJECT);
            String text = "Math.ab";
            assertThat(repl.complete(text.length(), text).candidates()).contains("abs");
        }

        @Test
        @DisplayName("求值期间的标准输出写到捕获目标")
        void testCapturing() {
            Interpreter repl = create(ReplConfig.WrapMode.OBJECT);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            Res<Evaluated<List<String>>> res = repl.apply("System.out.print(\"captured\");", true, printed::add,
                    new Capturing(out, null));
            assertThat(lines(res)).isEmpty();
            assertEquals("captured", new String(out.toByteArray(), StandardCharsets.UTF_8));
        }

        @Test
        @DisplayName("多个会话互不影响")
        void testIndependentSessions() {
            Interpreter one = create(ReplConfig.WrapMode.OBJECT);
            Interpreter two = create(ReplConfig.WrapMode.OBJECT);
            eval(one, "int only = 1");
            failure(eval(two, "only"));
        }
    }
}
