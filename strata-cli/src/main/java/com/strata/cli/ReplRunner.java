package com.strata.cli;

import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import strata.runtime.Strata;
import strata.runtime.config.ReplConfig;
import strata.runtime.interpreter.InterruptHook;
import strata.runtime.interpreter.Interpreter;
import strata.runtime.interpreter.ReplDriver;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * jline REPL 交互模式
 */
public class ReplRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ReplRunner.class);

    private final ReplConfig config;
    private final List<Path> classpath;

    public ReplRunner(ReplConfig config, List<Path> classpath) {
        this.config = config;
        this.classpath = classpath;
    }

    /**
     * 启动 REPL 交互模式
     */
    public void run() {
        printBanner();
        Interpreter interpreter = Strata.create(config, System.err, classpath);
        System.out.println("输入 :help 获取帮助，:quit 或 exit() 退出");
        System.out.println();

        Terminal terminal;
        try {
            terminal = TerminalBuilder.builder().system(true).build();
        } catch (IOException e) {
            System.err.println("终端初始化失败: " + e.getMessage());
            LOG.debug("terminal unavailable", e);
            runFallback(interpreter);
            return;
        }
        try (Terminal t = terminal) {
            // 多行输入由解释器缓冲
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(t)
                    .parser(new DefaultParser())
                    .completer(new ReplCompleter(interpreter))
                    .option(LineReader.Option.DISABLE_EVENT_EXPANSION, true)
                    .build();
            new ReplDriver(interpreter, new JLineFrontEnd(reader, interpreter, System.out),
                    new JLineInterruptHook(t), System.out).loop();
        } catch (IOException e) {
            LOG.warn("cannot close terminal: {}", e.getMessage());
        }
    }

    private void runFallback(Interpreter interpreter) {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        new ReplDriver(interpreter, new ConsoleFrontEnd(in, interpreter, System.out),
                InterruptHook.none(), System.out).loop();
    }

    private void printBanner() {
        System.out.println("  ____  _             _        ");
        System.out.println(" / ___|| |_ _ __ __ _| |_ __ _ ");
        System.out.println(" \\___ \\| __| '__/ _` | __/ _` |");
        System.out.println("  ___) | |_| | | (_| | || (_| |");
        System.out.println(" |____/ \\__|_|  \\__,_|\\__\\__,_|");
        System.out.println();
        System.out.println("Strata v" + CommandFrontEnd.VERSION + " - 增量式 Java REPL（Java "
                + System.getProperty("java.version") + "，包装方式 "
                + config.wrapMode().name().toLowerCase(Locale.ROOT) + "）");
        System.out.println();
    }
}
