package com.mirlift.ir.ullbc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 基本块：若干语句 + 一个终止指令。
 */
public final class BlockData {

    private final List<Statement> statements;
    private final Terminator terminator;

    public BlockData(List<Statement> statements, Terminator terminator) {
        this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
        this.terminator = Objects.requireNonNull(terminator);
    }

    public List<Statement> getStatements() { return statements; }
    public Terminator getTerminator() { return terminator; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Statement st : statements) {
            sb.append(st).append(";\n");
        }
        return sb.append(terminator).toString();
    }
}
