package com.strata.cli;

import org.jline.terminal.Terminal;
import strata.runtime.interpreter.InterruptHook;

/**
 * 求值期间把 Ctrl+C 转给正在执行的线程
 */
class JLineInterruptHook implements InterruptHook {

    private final Terminal terminal;

    JLineInterruptHook(Terminal terminal) {
        this.terminal = terminal;
    }

    @Override
    public Restore install(Runnable onInterrupt) {
        Terminal.SignalHandler previous = terminal.handle(Terminal.Signal.INT, signal -> onInterrupt.run());
        return () -> terminal.handle(Terminal.Signal.INT, previous);
    }
}
