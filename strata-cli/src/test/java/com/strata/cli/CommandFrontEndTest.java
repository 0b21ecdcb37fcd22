package com.strata.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import strata.runtime.Strata;
import strata.runtime.config.ReplConfig;
import strata.runtime.interpreter.Interpreter;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("REPL 命令测试")
class CommandFrontEndTest {

    static final class Scripted extends CommandFrontEnd {
        final Deque<String> inputs;

        Scripted(Interpreter interpreter, PrintStream out, String... inputs) {
            super(interpreter, out);
            this.inputs = new ArrayDeque<>(Arrays.asList(inputs));
        }

        @Override
        protected String read(String prompt) {
            return inputs.poll();
        }
    }

    private final ByteArrayOutputStream outBuffer = new ByteArrayOutputStream();
    private Interpreter interpreter;

    @BeforeEach
    void setUp() {
        interpreter = Strata.create(ReplConfig.defaults().withHistoryFile(null),
                new PrintStream(new ByteArrayOutputStream(), true));
    }

    private Scripted frontEnd(String... inputs) {
        return new Scripted(interpreter, new PrintStream(outBuffer, true), inputs);
    }

    private String output() {
        return new String(outBuffer.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("命令被消费，代码原样返回")
    void commandsAreConsumed() throws Exception {
        Scripted fe = frontEnd(":help", ":version", "1 + 1");
        assertEquals("1 + 1", fe.readLine("> "));
        assertThat(output()).contains("REPL 命令:").contains("Strata v0.1.0");
        assertTrue(fe.inputs.isEmpty());
    }

    @Test
    void quitEndsInput() throws Exception {
        assertNull(frontEnd(":quit", "never").readLine("> "));
        assertNull(frontEnd(":q").readLine("> "));
    }

    @Test
    void endOfInput() throws Exception {
        assertNull(frontEnd().readLine("> "));
    }

    @Test
    void unknownCommand() throws Exception {
        assertEquals("x", frontEnd(":bogus", "x").readLine("> "));
        assertThat(output()).contains("未知命令: :bogus");
    }

    @Test
    @DisplayName("续行中的冒号开头的行属于代码")
    void colonWhileBuffering() throws Exception {
        interpreter.apply("String s = switch (1) {\n", true, line -> {
        });
        assertTrue(interpreter.isBuffering());
        assertEquals(":weird", frontEnd(":weird").readLine("> "));
    }

    @Test
    @DisplayName(":history 与 :line")
    void historyAndLine() throws Exception {
        interpreter.apply("int a = 1", true, line -> {
        });
        frontEnd(":history", ":line", "").readLine("> ");
        assertThat(output()).contains("   1  int a = 1").contains("1\n");
    }
}
