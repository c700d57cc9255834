package com.mirlift.ir.translate;

/**
 * 翻译选项。
 */
public class TranslateOptions {

    /** 遇到可恢复错误时是否继续（false 为严格模式） */
    private boolean continueOnFailure = true;
    /** 每个 pass 结束后打印结构化函数体（MIRLIFT_DUMP_LLBC=1 启用） */
    private boolean dumpLlbc = "1".equals(System.getenv("MIRLIFT_DUMP_LLBC"));

    public boolean isContinueOnFailure() {
        return continueOnFailure;
    }

    public TranslateOptions setContinueOnFailure(boolean continueOnFailure) {
        this.continueOnFailure = continueOnFailure;
        return this;
    }

    public boolean isDumpLlbc() {
        return dumpLlbc;
    }

    public TranslateOptions setDumpLlbc(boolean dumpLlbc) {
        this.dumpLlbc = dumpLlbc;
        return this;
    }

    public static TranslateOptions strict() {
        return new TranslateOptions().setContinueOnFailure(false);
    }
}
