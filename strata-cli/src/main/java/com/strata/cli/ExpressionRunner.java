package com.strata.cli;

import strata.api.Evaluated;
import strata.api.Res;
import strata.runtime.Strata;
import strata.runtime.config.ReplConfig;
import strata.runtime.interpreter.Interpreter;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

/**
 * -e 模式：在新会话中执行一段代码，输出展示行
 */
class ExpressionRunner {

    private final ReplConfig config;
    private final List<Path> classpath;
    private final PrintStream out;
    private final PrintStream err;

    ExpressionRunner(ReplConfig config, List<Path> classpath, PrintStream out, PrintStream err) {
        this.config = config;
        this.classpath = classpath;
        this.out = out;
        this.err = err;
    }

    /**
     * @return 进程退出码
     */
    int run(String code) {
        Interpreter interpreter = Strata.create(config, err, classpath);
        try {
            Res<Evaluated<List<String>>> res = interpreter.apply(code, false, out::println);
            return res.fold(new Res.Visitor<Evaluated<List<String>>, Integer>() {
                @Override
                public Integer success(Evaluated<List<String>> value) {
                    return 0;
                }

                @Override
                public Integer failure(Res.Failure<?> failure) {
                    err.println(failure.message());
                    return 1;
                }

                @Override
                public Integer exit() {
                    return 0;
                }

                @Override
                public Integer skip() {
                    return 0;
                }

                @Override
                public Integer buffer(String partial) {
                    err.println("错误: 代码不完整");
                    return 1;
                }
            });
        } finally {
            interpreter.stop();
        }
    }
}
