package strata.runtime.interpreter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import strata.runtime.Strata;
import strata.runtime.config.ReplConfig;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("交互循环测试")
class ReplDriverTest {

    /** 按顺序给出预设输入，记录每次的提示符 */
    static final class ScriptedFrontEnd implements FrontEnd {
        final Deque<String> inputs;
        final List<String> prompts = new ArrayList<>();

        ScriptedFrontEnd(String... inputs) {
            this.inputs = new ArrayDeque<>(Arrays.asList(inputs));
        }

        @Override
        public String readLine(String prompt) {
            prompts.add(prompt);
            return inputs.poll();
        }
    }

    /** 模拟信号处理器槽位：安装时替换，关闭时恢复 */
    static final class HandlerSlot implements InterruptHook {
        Runnable current;
        int installs;

        @Override
        public Restore install(Runnable onInterrupt) {
            Runnable previous = current;
            current = onInterrupt;
            installs++;
            return () -> current = previous;
        }
    }

    private final ByteArrayOutputStream outBuffer = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuffer = new ByteArrayOutputStream();

    private Interpreter interpreter() {
        return Strata.create(ReplConfig.defaults().withHistoryFile(null), new PrintStream(errBuffer, true));
    }

    private String out() {
        return new String(outBuffer.toByteArray(), StandardCharsets.UTF_8);
    }

    private String err() {
        return new String(errBuffer.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("回显、报错并在 exit 时道别")
    void testSessionTranscript() {
        Interpreter interpreter = interpreter();
        HandlerSlot hook = new HandlerSlot();
        ScriptedFrontEnd frontEnd = new ScriptedFrontEnd("int x = 1", "int sq(int a) {", "return a * a; }",
                "sq(x + 1)", "nope", "exit()", "never read");

        new ReplDriver(interpreter, frontEnd, hook, new PrintStream(outBuffer, true)).loop();

        assertThat(out()).contains("x = 1", "defined method sq", "res2 = 4");
        assertThat(out().trim()).endsWith(ReplDriver.FAREWELL);
        assertThat(err()).contains("nope");
        assertEquals(Arrays.asList("strata> ", "strata> ", "      | ", "strata> ", "strata> ", "strata> "),
                frontEnd.prompts);
        assertEquals(1, frontEnd.inputs.size());
        assertEquals(6, hook.installs);
        assertNull(hook.current);
    }

    @Test
    @DisplayName("输入结束时运行关闭钩子")
    void testEndOfInput() {
        Interpreter interpreter = interpreter();
        int[] stops = new int[1];
        interpreter.onStop(() -> stops[0]++);

        new ReplDriver(interpreter, new ScriptedFrontEnd("int y = 2"), InterruptHook.none(),
                new PrintStream(outBuffer, true)).loop();

        assertEquals(1, stops[0]);
        assertThat(out()).contains("y = 2", ReplDriver.FAREWELL);
    }

    @Test
    @DisplayName("读取失败时结束会话")
    void testReadFailure() {
        FrontEnd broken = prompt -> {
            throw new IOException("terminal closed");
        };
        new ReplDriver(interpreter(), broken, InterruptHook.none(), new PrintStream(outBuffer, true)).loop();
        assertThat(out()).contains(ReplDriver.FAREWELL);
    }

    @Test
    @DisplayName("中断处理器可以嵌套安装并依次恢复")
    void testNestedHooks() {
        HandlerSlot slot = new HandlerSlot();
        Runnable outer = () -> { };
        Runnable inner = () -> { };

        try (InterruptHook.Restore a = slot.install(outer)) {
            try (InterruptHook.Restore b = slot.install(inner)) {
                assertSame(inner, slot.current);
            }
            assertSame(outer, slot.current);
        }
        assertNull(slot.current);
    }
}
