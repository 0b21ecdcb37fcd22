package strata.runtime.interpreter;

import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.Charset;
import java.util.function.Supplier;

/**
 * 一次求值的标准输出与标准错误去处。
 *
 * <p>首次捕获时把 {@code System.out}/{@code System.err} 换成按线程转发的流：正在捕获的线程写到本对象的目标，
 * 其他线程照旧写到原来的流。目标为 null 的那一路保持原来的去处。</p>
 */
public final class Capturing {

    private static Redirect out;
    private static Redirect err;

    private final OutputStream stdout;
    private final OutputStream stderr;

    public Capturing(OutputStream stdout, OutputStream stderr) {
        this.stdout = stdout;
        this.stderr = stderr;
    }

    /**
     * 以字符流为目标，字节按默认字符集解码
     */
    public static Capturing to(Writer stdout, Writer stderr) {
        return new Capturing(stdout == null ? null : new WriterStream(stdout),
                stderr == null ? null : new WriterStream(stderr));
    }

    /**
     * 在捕获下执行 {@code body}，结束后恢复本线程之前的去处（捕获可以嵌套）
     */
    public <T> T around(Supplier<T> body) {
        Redirect[] redirects = install();
        OutputStream previousOut = redirects[0].swap(stdout);
        OutputStream previousErr = redirects[1].swap(stderr);
        try {
            return body.get();
        } finally {
            redirects[0].flush();
            redirects[1].flush();
            redirects[0].restore(previousOut);
            redirects[1].restore(previousErr);
        }
    }

    /**
     * 系统流被别处换掉时重新包一层
     */
    private static synchronized Redirect[] install() {
        if (out == null || System.out != out) {
            out = new Redirect(System.out);
            System.setOut(out);
        }
        if (err == null || System.err != err) {
            err = new Redirect(System.err);
            System.setErr(err);
        }
        return new Redirect[]{out, err};
    }

    private static final class Redirect extends PrintStream {
        private final PrintStream original;
        private final ThreadLocal<OutputStream> target = new ThreadLocal<>();
        private final ThreadLocal<Boolean> writing = new ThreadLocal<>();

        Redirect(PrintStream original) {
            super(original, true);
            this.original = original;
        }

        /**
         * @return 本线程之前的目标
         */
        OutputStream swap(OutputStream next) {
            OutputStream previous = target.get();
            if (next != null) {
                target.set(next);
            }
            return previous;
        }

        void restore(OutputStream previous) {
            if (previous == null) {
                target.remove();
            } else {
                target.set(previous);
            }
        }

        /**
         * 目标自己又写回系统流时（例如默认 ScriptContext 的 Writer 包着 System.out），交给原来的流
         */
        private OutputStream enter() {
            OutputStream t = target.get();
            if (t == null || writing.get() != null) {
                return original;
            }
            writing.set(Boolean.TRUE);
            return t;
        }

        private void exit(OutputStream used) {
            if (used != original) {
                writing.remove();
            }
        }

        @Override
        public void write(int b) {
            OutputStream used = enter();
            try {
                used.write(b);
            } catch (IOException e) {
                setError();
            } finally {
                exit(used);
            }
        }

        @Override
        public void write(byte[] buf, int off, int len) {
            OutputStream used = enter();
            try {
                used.write(buf, off, len);
            } catch (IOException e) {
                setError();
            } finally {
                exit(used);
            }
        }

        @Override
        public void flush() {
            OutputStream used = enter();
            try {
                used.flush();
            } catch (IOException e) {
                setError();
            } finally {
                exit(used);
            }
        }
    }

    /** 把字节解码后写入 Writer */
    private static final class WriterStream extends OutputStream {
        private final Writer writer;
        private final Charset charset = Charset.defaultCharset();

        WriterStream(Writer writer) {
            this.writer = writer;
        }

        @Override
        public void write(int b) throws IOException {
            write(new byte[]{(byte) b}, 0, 1);
        }

        @Override
        public void write(byte[] buf, int off, int len) throws IOException {
            writer.write(new String(buf, off, len, charset));
        }

        @Override
        public void flush() throws IOException {
            writer.flush();
        }
    }
}
