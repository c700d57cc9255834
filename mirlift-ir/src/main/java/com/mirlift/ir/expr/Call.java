package com.mirlift.ir.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 函数调用：{@code dest := func(args)}。
 */
public final class Call {

    private final FnPtr func;
    private final List<Operand> args;
    private final Place dest;

    public Call(FnPtr func, List<Operand> args, Place dest) {
        this.func = Objects.requireNonNull(func);
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
        this.dest = Objects.requireNonNull(dest);
    }

    public FnPtr getFunc() { return func; }
    public List<Operand> getArgs() { return args; }
    public Place getDest() { return dest; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Call)) return false;
        Call that = (Call) o;
        return func.equals(that.func) && args.equals(that.args) && dest.equals(that.dest);
    }

    @Override
    public int hashCode() {
        return Objects.hash(func, args, dest);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder().append(dest).append(" := ").append(func).append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(args.get(i));
        }
        return sb.append(')').toString();
    }
}
