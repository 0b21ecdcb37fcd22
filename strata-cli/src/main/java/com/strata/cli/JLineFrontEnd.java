package com.strata.cli;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;
import strata.runtime.interpreter.Interpreter;

import java.io.PrintStream;

/**
 * jline 行编辑输入
 */
class JLineFrontEnd extends CommandFrontEnd {

    private final LineReader reader;

    JLineFrontEnd(LineReader reader, Interpreter interpreter, PrintStream out) {
        super(interpreter, out);
        this.reader = reader;
    }

    @Override
    protected String read(String prompt) {
        try {
            return reader.readLine(prompt);
        } catch (UserInterruptException e) {
            // Ctrl+C: 丢弃未完成的输入
            interpreter.resetBuffer();
            return "";
        } catch (EndOfFileException e) {
            return null;
        }
    }
}
