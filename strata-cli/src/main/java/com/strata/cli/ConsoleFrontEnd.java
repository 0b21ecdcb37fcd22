package com.strata.cli;

import strata.runtime.interpreter.Interpreter;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

/**
 * 回退输入（jline 初始化失败时使用 BufferedReader）
 */
class ConsoleFrontEnd extends CommandFrontEnd {

    private final BufferedReader reader;

    ConsoleFrontEnd(BufferedReader reader, Interpreter interpreter, PrintStream out) {
        super(interpreter, out);
        this.reader = reader;
    }

    @Override
    protected String read(String prompt) throws IOException {
        out.print(prompt);
        out.flush();
        return reader.readLine();
    }
}
