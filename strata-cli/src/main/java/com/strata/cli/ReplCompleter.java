package com.strata.cli;

import org.jline.reader.Candidate;
import org.jline.reader.Completer;
import org.jline.reader.LineReader;
import org.jline.reader.ParsedLine;
import strata.runtime.interpreter.Interpreter;

import java.util.List;

/**
 * 把会话补全接到 jline 上
 */
class ReplCompleter implements Completer {

    private final Interpreter interpreter;

    ReplCompleter(Interpreter interpreter) {
        this.interpreter = interpreter;
    }

    @Override
    public void complete(LineReader reader, ParsedLine line, List<Candidate> candidates) {
        String pending = interpreter.buffered();
        String text = pending + line.line();
        int cursor = pending.length() + line.cursor();
        strata.api.Completer.Completion completion = interpreter.complete(cursor, text);

        int anchor = completion.anchor() - pending.length();
        int wordStart = line.cursor() - line.wordCursor();
        for (String name : completion.candidates()) {
            candidates.add(new Candidate(candidateValue(line.line(), wordStart, anchor, name),
                    name, null, null, null, null, true));
        }
    }

    /**
     * jline 用候选值替换整个当前词，而补全结果只替换 anchor 之后的部分
     */
    static String candidateValue(String line, int wordStart, int anchor, String name) {
        if (anchor <= wordStart || anchor > line.length()) {
            return name;
        }
        return line.substring(wordStart, anchor) + name;
    }
}
