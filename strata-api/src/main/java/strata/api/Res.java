package strata.api;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

/**
 * 贯穿整条求值管线的统一结果类型。
 *
 * <p>五种结果：</p>
 * <ul>
 *   <li>{@link Success}：本阶段成功，携带值</li>
 *   <li>{@link Failure}：本阶段失败，携带面向用户的诊断信息</li>
 *   <li>{@link Exit}：请求结束会话（不是错误）</li>
 *   <li>{@link Skip}：片段什么也没产生（例如空输入）</li>
 *   <li>{@link Buffer}：片段语法上不完整，需要与下一次输入拼接后重试</li>
 * </ul>
 *
 * <p>{@link #flatMap} 在第一个非 Success 处短路，后续阶段不再执行。
 * 除求值循环外，任何组件都不会把 Failure 重新抛成异常。</p>
 */
public abstract class Res<T> {

    Res() {
    }

    public abstract <U> Res<U> flatMap(Function<? super T, Res<U>> f);

    public final <U> Res<U> map(Function<? super T, ? extends U> f) {
        return flatMap(value -> success(f.apply(value)));
    }

    public abstract <R> R fold(Visitor<? super T, R> visitor);

    public boolean isSuccess() {
        return false;
    }

    /**
     * 对五种结果做穷尽分派
     */
    public interface Visitor<T, R> {
        R success(T value);

        R failure(Failure<?> failure);

        R exit();

        R skip();

        R buffer(String partial);
    }

    // ============ 工厂方法 ============

    public static <T> Res<T> success(T value) {
        return new Success<>(value);
    }

    public static <T> Res<T> failure(String message) {
        return new Failure<>(message, null);
    }

    public static <T> Res<T> failure(String message, Throwable cause) {
        return new Failure<>(message, cause);
    }

    @SuppressWarnings("unchecked")
    public static <T> Res<T> exit() {
        return (Res<T>) Exit.INSTANCE;
    }

    @SuppressWarnings("unchecked")
    public static <T> Res<T> skip() {
        return (Res<T>) Skip.INSTANCE;
    }

    public static <T> Res<T> buffer(String partial) {
        return new Buffer<>(partial);
    }

    /**
     * 值为 null 时转为 Failure
     */
    public static <T> Res<T> of(T valueOrNull, String messageIfNull) {
        return valueOrNull != null ? success(valueOrNull) : failure(messageIfNull);
    }

    // ============ 变体 ============

    public static final class Success<T> extends Res<T> {
        private final T value;

        Success(T value) {
            this.value = value;
        }

        public T value() {
            return value;
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <U> Res<U> flatMap(Function<? super T, Res<U>> f) {
            return f.apply(value);
        }

        @Override
        public <R> R fold(Visitor<? super T, R> visitor) {
            return visitor.success(value);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Success && Objects.equals(value, ((Success<?>) obj).value);
        }

        @Override
        public int hashCode() {
            return 31 + Objects.hashCode(value);
        }

        @Override
        public String toString() {
            return "Success(" + value + ")";
        }
    }

    public static final class Failure<T> extends Res<T> {
        private final String message;
        private final Throwable cause;

        Failure(String message, Throwable cause) {
            this.message = Objects.requireNonNull(message, "message");
            this.cause = cause;
        }

        /**
         * 以异常渲染失败信息：每一层异常的栈帧在第一个满足 {@code stop} 的帧处截断
         */
        public static <T> Failure<T> fromThrowable(Throwable t, Predicate<StackTraceElement> stop) {
            return new Failure<>(renderTrace(t, frames -> {
                for (int i = 0; i < frames.length; i++) {
                    if (stop.test(frames[i])) {
                        return i;
                    }
                }
                return frames.length;
            }), t);
        }

        /**
         * 渲染异常及其 cause 链。{@code visibleFrames} 返回每层异常要保留的前缀帧数。
         */
        public static String renderTrace(Throwable t, ToIntFunction<StackTraceElement[]> visibleFrames) {
            StringBuilder sb = new StringBuilder();
            Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
            Throwable current = t;
            while (current != null && seen.add(current)) {
                if (current != t) {
                    sb.append("\nCaused by: ");
                }
                sb.append(current);
                StackTraceElement[] frames = current.getStackTrace();
                int keep = Math.max(0, Math.min(frames.length, visibleFrames.applyAsInt(frames)));
                for (int i = 0; i < keep; i++) {
                    sb.append("\n  at ").append(frames[i]);
                }
                current = current.getCause();
            }
            return sb.toString();
        }

        /** 已裁剪过内部栈帧、可直接展示的诊断文本 */
        public String message() {
            return message;
        }

        /** 原始异常，没有则为 null */
        public Throwable cause() {
            return cause;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <U> Res<U> flatMap(Function<? super T, Res<U>> f) {
            return (Res<U>) this;
        }

        @Override
        public <R> R fold(Visitor<? super T, R> visitor) {
            return visitor.failure(this);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Failure && message.equals(((Failure<?>) obj).message);
        }

        @Override
        public int hashCode() {
            return message.hashCode();
        }

        @Override
        public String toString() {
            return "Failure(" + message + ")";
        }
    }

    public static final class Exit<T> extends Res<T> {
        static final Exit<Object> INSTANCE = new Exit<>();

        private Exit() {
        }

        @Override
        @SuppressWarnings("unchecked")
        public <U> Res<U> flatMap(Function<? super T, Res<U>> f) {
            return (Res<U>) this;
        }

        @Override
        public <R> R fold(Visitor<? super T, R> visitor) {
            return visitor.exit();
        }

        @Override
        public String toString() {
            return "Exit";
        }
    }

    public static final class Skip<T> extends Res<T> {
        static final Skip<Object> INSTANCE = new Skip<>();

        private Skip() {
        }

        @Override
        @SuppressWarnings("unchecked")
        public <U> Res<U> flatMap(Function<? super T, Res<U>> f) {
            return (Res<U>) this;
        }

        @Override
        public <R> R fold(Visitor<? super T, R> visitor) {
            return visitor.skip();
        }

        @Override
        public String toString() {
            return "Skip";
        }
    }

    public static final class Buffer<T> extends Res<T> {
        private final String partial;

        Buffer(String partial) {
            this.partial = Objects.requireNonNull(partial, "partial");
        }

        /** 目前已累积的不完整文本 */
        public String partial() {
            return partial;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <U> Res<U> flatMap(Function<? super T, Res<U>> f) {
            return (Res<U>) this;
        }

        @Override
        public <R> R fold(Visitor<? super T, R> visitor) {
            return visitor.buffer(partial);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Buffer && partial.equals(((Buffer<?>) obj).partial);
        }

        @Override
        public int hashCode() {
            return partial.hashCode();
        }

        @Override
        public String toString() {
            return "Buffer(" + partial + ")";
        }
    }
}
