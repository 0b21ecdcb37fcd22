package strata.runtime.interpreter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import strata.api.Evaluated;
import strata.api.Res;

import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

/**
 * 交互循环：读取 → 求值 → 报告，直到退出或输入结束
 */
public class ReplDriver {

    private static final Logger LOG = LoggerFactory.getLogger(ReplDriver.class);

    public static final String FAREWELL = "Bye!";

    private final Interpreter interpreter;
    private final FrontEnd frontEnd;
    private final InterruptHook interruptHook;
    private final PrintStream out;

    public ReplDriver(Interpreter interpreter, FrontEnd frontEnd, InterruptHook interruptHook, PrintStream out) {
        this.interpreter = interpreter;
        this.frontEnd = frontEnd;
        this.interruptHook = interruptHook;
        this.out = out;
    }

    public void loop() {
        LOG.info("session started (wrap={}, line {})",
                interpreter.config().wrapMode(), interpreter.session().currentLine());
        try {
            while (true) {
                String prompt = interpreter.isBuffering()
                        ? interpreter.config().continuationPrompt()
                        : interpreter.config().prompt();
                String line;
                try {
                    line = frontEnd.readLine(prompt);
                } catch (IOException e) {
                    LOG.error("cannot read input", e);
                    break;
                }
                if (line == null) {
                    break;
                }
                if (!interpreter.handleOutput(evaluate(line + "\n"))) {
                    break;
                }
            }
        } finally {
            out.println(FAREWELL);
            interpreter.stop();
        }
    }

    private Res<Evaluated<List<String>>> evaluate(String text) {
        Thread thread = Thread.currentThread();
        try (InterruptHook.Restore ignored = interruptHook.install(thread::interrupt)) {
            return interpreter.apply(text, true, out::println);
        } finally {
            // 丢弃回显之后才到达的中断
            Thread.interrupted();
        }
    }
}
