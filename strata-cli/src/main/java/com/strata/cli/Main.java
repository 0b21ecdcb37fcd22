package com.strata.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import strata.runtime.config.ReplConfig;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UnsupportedEncodingException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Strata CLI 入口点（picocli）
 */
@Command(name = "strata", version = "Strata v0.1.0",
         mixinStandardHelpOptions = true,
         description = "增量式 Java REPL")
public class Main implements Callable<Integer> {

    @Option(names = "--wrap", description = "包装方式（object, class）")
    String wrap;

    @Option(names = "--predef", description = "会话开始前执行的代码")
    String predef;

    @Option(names = "--no-history", description = "不读写历史文件")
    boolean noHistory;

    @Option(names = "--history-file", description = "历史文件路径")
    Path historyFile;

    @Option(names = "--shared-loader", description = "编译与执行共享同一个类加载器")
    boolean sharedLoader;

    @Option(names = "-e", description = "执行一段代码后退出")
    String expression;

    @Option(names = {"-cp", "--classpath"}, split = "${sys:path.separator}", description = "追加到会话的类路径")
    List<Path> classpath = new ArrayList<>();

    @Override
    public Integer call() {
        ReplConfig config;
        try {
            config = config();
        } catch (IllegalArgumentException e) {
            System.err.println("错误: " + e.getMessage());
            return 1;
        }
        if (expression != null) {
            return new ExpressionRunner(config, classpath, System.out, System.err).run(expression);
        }
        new ReplRunner(config, classpath).run();
        return 0;
    }

    /**
     * 配置文件之上叠加命令行选项
     */
    ReplConfig config() {
        ReplConfig config = ReplConfig.load();
        if (wrap != null) {
            config = config.withWrapMode(ReplConfig.WrapMode.parse(wrap));
        }
        if (predef != null) {
            config = config.withPredef(predef);
        }
        if (sharedLoader) {
            config = config.withSharedLoader(true);
        }
        if (historyFile != null) {
            config = config.withHistoryFile(historyFile);
        }
        if (noHistory || expression != null) {
            config = config.withHistoryFile(null);
        }
        return config;
    }

    public static void main(String[] args) {
        // Windows 控制台可能仍用 GBK，按操作系统原生编码输出
        String charsetName = getConsoleCharsetName();

        try {
            PrintStream out = new PrintStream(System.out, true, charsetName);
            PrintStream err = new PrintStream(System.err, true, charsetName);
            System.setOut(out);
            System.setErr(err);

            Charset consoleCharset = Charset.forName(charsetName);
            CommandLine cmd = new CommandLine(new Main());
            cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
            cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
            System.exit(cmd.execute(args));
        } catch (UnsupportedEncodingException e) {
            System.exit(new CommandLine(new Main()).execute(args));
        }
    }

    /**
     * 控制台实际使用的字符编码名；native.encoding 反映操作系统原生编码
     */
    private static String getConsoleCharsetName() {
        String nativeEnc = System.getProperty("native.encoding");
        if (nativeEnc != null && Charset.isSupported(nativeEnc)) {
            return nativeEnc;
        }
        return Charset.defaultCharset().name();
    }
}
