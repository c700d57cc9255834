package com.mirlift.ir.llbc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 多路分支的一个分支：一组匹配值 + 分支体。
 *
 * @param <V> 匹配值类型（整数值或枚举变体 id）
 */
public final class SwitchCase<V> {

    private final List<V> values;
    private final Statement body;

    public SwitchCase(List<V> values, Statement body) {
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
        this.body = Objects.requireNonNull(body);
    }

    public List<V> getValues() { return values; }
    public Statement getBody() { return body; }
}
