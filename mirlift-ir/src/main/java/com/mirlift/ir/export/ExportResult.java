package com.mirlift.ir.export;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 导出结果。I/O 失败以 {@link Failure} 返回，不抛出异常。
 */
public abstract class ExportResult {

    /** 失败发生的步骤 */
    public enum Step {
        CREATE_DIRECTORY,
        OPEN_FILE,
        WRITE
    }

    private ExportResult() {
    }

    public static ExportResult success(Path path, boolean partial) {
        return new Success(path, partial);
    }

    public static ExportResult failure(Step step, Path path, String message) {
        return new Failure(step, path, message);
    }

    public abstract boolean isSuccess();

    public static final class Success extends ExportResult {
        private final Path path;
        private final boolean partial;

        private Success(Path path, boolean partial) {
            this.path = Objects.requireNonNull(path);
            this.partial = partial;
        }

        /** 写出文件的绝对路径 */
        public Path getPath() { return path; }

        /** 翻译中登记过错误，导出的只是部分内容 */
        public boolean isPartial() { return partial; }

        @Override
        public boolean isSuccess() { return true; }

        @Override
        public String toString() {
            return (partial ? "partial " : "") + path;
        }
    }

    public static final class Failure extends ExportResult {
        private final Step step;
        private final Path path;
        private final String message;

        private Failure(Step step, Path path, String message) {
            this.step = Objects.requireNonNull(step);
            this.path = path;
            this.message = message;
        }

        public Step getStep() { return step; }
        public Path getPath() { return path; }
        public String getMessage() { return message; }

        @Override
        public boolean isSuccess() { return false; }

        @Override
        public String toString() {
            return step + " failed for " + path + ": " + message;
        }
    }
}
