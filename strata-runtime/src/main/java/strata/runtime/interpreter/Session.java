package strata.runtime.interpreter;

import strata.runtime.loader.ArtifactRegistry;

/**
 * 一个会话的全部可变状态：行号、历史、导入账本与注册表。
 *
 * <p>不共享：每个会话拥有独立的注册表与账本，多个会话可以并存。</p>
 */
public final class Session {

    private final ArtifactRegistry registry;
    private final ImportLedger ledger;
    private final History history;
    private int currentLine;

    public Session(ArtifactRegistry registry, History history) {
        this.registry = registry;
        this.history = history;
        this.ledger = new ImportLedger();
    }

    public ArtifactRegistry registry() {
        return registry;
    }

    public ImportLedger ledger() {
        return ledger;
    }

    public History history() {
        return history;
    }

    public int currentLine() {
        return currentLine;
    }

    void setCurrentLine(int line) {
        this.currentLine = line;
    }

    /** 进入包装阶段的片段调用一次 */
    void advance() {
        currentLine++;
    }
}
