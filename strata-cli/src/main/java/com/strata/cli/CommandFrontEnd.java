package com.strata.cli;

import strata.runtime.interpreter.FrontEnd;
import strata.runtime.interpreter.Interpreter;

import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

/**
 * 在读取的行中拦截以 {@code :} 开头的 REPL 命令，其余交给解释器
 */
abstract class CommandFrontEnd implements FrontEnd {

    static final String VERSION = "0.1.0";

    protected final Interpreter interpreter;
    protected final PrintStream out;

    CommandFrontEnd(Interpreter interpreter, PrintStream out) {
        this.interpreter = interpreter;
        this.out = out;
    }

    /**
     * 读取原始一行，输入结束返回 null
     */
    protected abstract String read(String prompt) throws IOException;

    @Override
    public String readLine(String prompt) throws IOException {
        while (true) {
            String line = read(prompt);
            if (line == null) {
                return null;
            }
            // 续行中的冒号属于代码
            if (interpreter.isBuffering() || !line.trim().startsWith(":")) {
                return line;
            }
            if (!handleCommand(line.trim())) {
                return null;
            }
        }
    }

    /**
     * @return true 继续读取，false 结束会话
     */
    boolean handleCommand(String command) {
        switch (command) {
            case ":quit":
            case ":q":
            case ":exit":
                return false;
            case ":help":
            case ":h":
                printHelp();
                return true;
            case ":clear":
            case ":c":
                out.print("\033[H\033[2J");
                out.flush();
                return true;
            case ":version":
                out.println("Strata v" + VERSION);
                out.println("Java: " + System.getProperty("java.version"));
                out.println("JVM: " + System.getProperty("java.vm.name"));
                return true;
            case ":history":
                List<String> entries = interpreter.session().history().entries();
                for (int i = 0; i < entries.size(); i++) {
                    out.println(String.format("%4d  %s", i + 1, entries.get(i).stripTrailing()));
                }
                return true;
            case ":line":
                out.println(interpreter.session().currentLine());
                return true;
            default:
                out.println("未知命令: " + command);
                out.println("输入 :help 获取帮助");
                return true;
        }
    }

    void printHelp() {
        out.println("REPL 命令:");
        out.println("  :help, :h        显示此帮助");
        out.println("  :quit, :q, :exit 退出 REPL");
        out.println("  :clear, :c       清屏");
        out.println("  :version         显示版本");
        out.println("  :history         显示输入历史");
        out.println("  :line            显示当前行号");
        out.println();
        out.println("示例:");
        out.println("  int x = 42                    定义变量");
        out.println("  var list = new ArrayList<String>()   推断类型");
        out.println("  int sq(int a) { return a * a; }      定义方法");
        out.println("  sq(x)                         求值并显示 resN");
        out.println("  repl.addJars(Paths.get(\"a.jar\"))   追加依赖");
        out.println();
        out.println("提示:");
        out.println("  - 未闭合的括号会自动进入多行模式");
        out.println("  - Ctrl+C 中断正在执行的代码或丢弃未完成的输入");
        out.println("  - exit() 或 :quit 退出");
    }
}
