package com.mirlift.types;

import com.mirlift.types.id.FunDeclId;
import com.mirlift.types.id.TraitClauseId;
import com.mirlift.types.id.TraitDeclId;
import com.mirlift.types.id.TraitImplId;

import java.util.Objects;

/**
 * trait 实例见证：描述一条 trait 义务是<em>如何</em>被满足的。
 * <p>
 * 读作当前定义的 trait 子句层次中的一条路径。下游需要重放推导过程（例如构造运行时字典），
 * 所以保存完整路径而不只是最终的 impl id。
 * <p>
 * 变体的声明顺序即比较顺序：具体/局部推导排在 {@link SelfId} 之前，
 * 使得按序求解时优先使用局部子句。子句列表的确定性序列化依赖这一顺序。
 */
public abstract class TraitInstanceId implements Tagged, Comparable<TraitInstanceId> {

    public static final TraitInstanceId SELF = new SelfId();

    private TraitInstanceId() {
    }

    /** 变体在比较顺序中的位置 */
    protected abstract int order();

    /** 同一变体内部的比较 */
    protected abstract int compareSameVariant(TraitInstanceId other);

    public abstract <T> T accept(TraitInstanceIdVisitor<T> visitor);

    @Override
    public final int compareTo(TraitInstanceId other) {
        int c = Integer.compare(order(), other.order());
        return c != 0 ? c : compareSameVariant(other);
    }

    // ===== 工厂方法 =====

    public static TraitInstanceId traitImpl(TraitImplId id) { return new TraitImpl(id); }
    public static TraitInstanceId builtinOrAuto(TraitDeclId id) { return new BuiltinOrAuto(id); }
    public static TraitInstanceId clause(TraitClauseId id) { return new Clause(id); }

    public static TraitInstanceId parentClause(TraitInstanceId base, TraitDeclId traitId, TraitClauseId clauseId) {
        return new ParentClause(base, traitId, clauseId);
    }

    public static TraitInstanceId itemClause(TraitInstanceId base, TraitDeclId traitId, String itemName,
                                             TraitClauseId clauseId) {
        return new ItemClause(base, traitId, itemName, clauseId);
    }

    public static TraitInstanceId fnPointer(Ty<ErasedRegion> ty) { return new FnPointer(ty); }

    public static TraitInstanceId closure(FunDeclId funId, GenericArgs<ErasedRegion> generics) {
        return new Closure(funId, generics);
    }

    public static TraitInstanceId unsolved(TraitDeclId traitId, GenericArgs<Region> generics) {
        return new Unsolved(traitId, generics);
    }

    public static TraitInstanceId unknown(String message) { return new Unknown(message); }

    // ===== 变体 =====

    /** 具体的 trait 实现 */
    public static final class TraitImpl extends TraitInstanceId {
        private final TraitImplId implId;

        private TraitImpl(TraitImplId implId) { this.implId = Objects.requireNonNull(implId); }

        public TraitImplId getImplId() { return implId; }

        @Override
        protected int order() { return 0; }

        @Override
        protected int compareSameVariant(TraitInstanceId other) {
            return implId.compareTo(((TraitImpl) other).implId);
        }

        @Override
        public <T> T accept(TraitInstanceIdVisitor<T> visitor) { return visitor.visitTraitImpl(this); }

        @Override
        public String tag() { return "TraitImpl"; }

        @Override
        public Object[] fields() { return new Object[]{implId}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof TraitImpl && ((TraitImpl) o).implId.equals(implId);
        }

        @Override
        public int hashCode() { return implId.hashCode(); }

        @Override
        public String toString() { return implId.toString(); }
    }

    /** 内建 trait（如 Sized）或 auto trait（如 Sync）的实现 */
    public static final class BuiltinOrAuto extends TraitInstanceId {
        private final TraitDeclId traitId;

        private BuiltinOrAuto(TraitDeclId traitId) { this.traitId = Objects.requireNonNull(traitId); }

        public TraitDeclId getTraitId() { return traitId; }

        @Override
        protected int order() { return 1; }

        @Override
        protected int compareSameVariant(TraitInstanceId other) {
            return traitId.compareTo(((BuiltinOrAuto) other).traitId);
        }

        @Override
        public <T> T accept(TraitInstanceIdVisitor<T> visitor) { return visitor.visitBuiltinOrAuto(this); }

        @Override
        public String tag() { return "BuiltinOrAuto"; }

        @Override
        public Object[] fields() { return new Object[]{traitId}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof BuiltinOrAuto && ((BuiltinOrAuto) o).traitId.equals(traitId);
        }

        @Override
        public int hashCode() { return traitId.hashCode(); }

        @Override
        public String toString() { return "builtin(" + traitId + ")"; }
    }

    /**
     * 局部子句之一：{@code fn f<T>(...) where T: Foo} 中的 {@code T: Foo} 为 Clause(0)。
     */
    public static final class Clause extends TraitInstanceId {
        private final TraitClauseId clauseId;

        private Clause(TraitClauseId clauseId) { this.clauseId = Objects.requireNonNull(clauseId); }

        public TraitClauseId getClauseId() { return clauseId; }

        @Override
        protected int order() { return 2; }

        @Override
        protected int compareSameVariant(TraitInstanceId other) {
            return clauseId.compareTo(((Clause) other).clauseId);
        }

        @Override
        public <T> T accept(TraitInstanceIdVisitor<T> visitor) { return visitor.visitClause(this); }

        @Override
        public String tag() { return "Clause"; }

        @Override
        public Object[] fields() { return new Object[]{clauseId}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Clause && ((Clause) o).clauseId.equals(clauseId);
        }

        @Override
        public int hashCode() { return clauseId.hashCode(); }

        @Override
        public String toString() { return clauseId.toString(); }
    }

    /**
     * 父子句：base 所实现的 trait（traitId）的第 clauseId 个父 trait 子句。
     * <pre>
     * trait Bar : Foo1 + Foo2 {}
     * fn g&lt;T : Bar&gt;(x : T) { x.f() }   // Parent(Clause(0), Bar, 1)::f(x)
     * </pre>
     */
    public static final class ParentClause extends TraitInstanceId {
        private final TraitInstanceId base;
        private final TraitDeclId traitId;
        private final TraitClauseId clauseId;

        private ParentClause(TraitInstanceId base, TraitDeclId traitId, TraitClauseId clauseId) {
            this.base = Objects.requireNonNull(base);
            this.traitId = Objects.requireNonNull(traitId);
            this.clauseId = Objects.requireNonNull(clauseId);
        }

        public TraitInstanceId getBase() { return base; }
        public TraitDeclId getTraitId() { return traitId; }
        public TraitClauseId getClauseId() { return clauseId; }

        @Override
        protected int order() { return 3; }

        @Override
        protected int compareSameVariant(TraitInstanceId other) {
            ParentClause that = (ParentClause) other;
            int c = base.compareTo(that.base);
            if (c != 0) return c;
            c = traitId.compareTo(that.traitId);
            return c != 0 ? c : clauseId.compareTo(that.clauseId);
        }

        @Override
        public <T> T accept(TraitInstanceIdVisitor<T> visitor) { return visitor.visitParentClause(this); }

        @Override
        public String tag() { return "ParentClause"; }

        @Override
        public Object[] fields() { return new Object[]{base, traitId, clauseId}; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ParentClause)) return false;
            ParentClause that = (ParentClause) o;
            return base.equals(that.base) && traitId.equals(that.traitId) && clauseId.equals(that.clauseId);
        }

        @Override
        public int hashCode() { return Objects.hash(base, traitId, clauseId); }

        @Override
        public String toString() { return "parent(" + base + ", " + traitId + ", " + clauseId + ")"; }
    }

    /**
     * trait 项（通常是关联类型）上绑定的子句：
     * {@code trait Foo { type W: Bar0 + Bar1 }} 中 W 的第 1 条子句为 ItemClause(base, Foo, W, 1)。
     */
    public static final class ItemClause extends TraitInstanceId {
        private final TraitInstanceId base;
        private final TraitDeclId traitId;
        private final String itemName;
        private final TraitClauseId clauseId;

        private ItemClause(TraitInstanceId base, TraitDeclId traitId, String itemName, TraitClauseId clauseId) {
            this.base = Objects.requireNonNull(base);
            this.traitId = Objects.requireNonNull(traitId);
            this.itemName = Objects.requireNonNull(itemName);
            this.clauseId = Objects.requireNonNull(clauseId);
        }

        public TraitInstanceId getBase() { return base; }
        public TraitDeclId getTraitId() { return traitId; }
        public String getItemName() { return itemName; }
        public TraitClauseId getClauseId() { return clauseId; }

        @Override
        protected int order() { return 4; }

        @Override
        protected int compareSameVariant(TraitInstanceId other) {
            ItemClause that = (ItemClause) other;
            int c = base.compareTo(that.base);
            if (c != 0) return c;
            c = traitId.compareTo(that.traitId);
            if (c != 0) return c;
            c = itemName.compareTo(that.itemName);
            return c != 0 ? c : clauseId.compareTo(that.clauseId);
        }

        @Override
        public <T> T accept(TraitInstanceIdVisitor<T> visitor) { return visitor.visitItemClause(this); }

        @Override
        public String tag() { return "ItemClause"; }

        @Override
        public Object[] fields() { return new Object[]{base, traitId, itemName, clauseId}; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ItemClause)) return false;
            ItemClause that = (ItemClause) o;
            return base.equals(that.base) && traitId.equals(that.traitId)
                    && itemName.equals(that.itemName) && clauseId.equals(that.clauseId);
        }

        @Override
        public int hashCode() { return Objects.hash(base, traitId, itemName, clauseId); }

        @Override
        public String toString() {
            return "item(" + base + ", " + traitId + ", " + itemName + ", " + clauseId + ")";
        }
    }

    /** 函数指针作为 Fn/FnMut 等 trait 的实现者 */
    public static final class FnPointer extends TraitInstanceId {
        private final Ty<ErasedRegion> ty;

        private FnPointer(Ty<ErasedRegion> ty) { this.ty = Objects.requireNonNull(ty); }

        public Ty<ErasedRegion> getTy() { return ty; }

        @Override
        protected int order() { return 5; }

        @Override
        protected int compareSameVariant(TraitInstanceId other) {
            return StructuralOrder.compare(ty, ((FnPointer) other).ty);
        }

        @Override
        public <T> T accept(TraitInstanceIdVisitor<T> visitor) { return visitor.visitFnPointer(this); }

        @Override
        public String tag() { return "FnPointer"; }

        @Override
        public Object[] fields() { return new Object[]{ty}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof FnPointer && ((FnPointer) o).ty.equals(ty);
        }

        @Override
        public int hashCode() { return ty.hashCode(); }

        @Override
        public String toString() { return "fn_ptr(" + ty + ")"; }
    }

    /** 闭包作为 Fn 系列 trait 的实现者 */
    public static final class Closure extends TraitInstanceId {
        private final FunDeclId funId;
        private final GenericArgs<ErasedRegion> generics;

        private Closure(FunDeclId funId, GenericArgs<ErasedRegion> generics) {
            this.funId = Objects.requireNonNull(funId);
            this.generics = Objects.requireNonNull(generics);
        }

        public FunDeclId getFunId() { return funId; }
        public GenericArgs<ErasedRegion> getGenerics() { return generics; }

        @Override
        protected int order() { return 6; }

        @Override
        protected int compareSameVariant(TraitInstanceId other) {
            Closure that = (Closure) other;
            int c = funId.compareTo(that.funId);
            return c != 0 ? c : StructuralOrder.compare(generics, that.generics);
        }

        @Override
        public <T> T accept(TraitInstanceIdVisitor<T> visitor) { return visitor.visitClosure(this); }

        @Override
        public String tag() { return "Closure"; }

        @Override
        public Object[] fields() { return new Object[]{funId, generics}; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Closure)) return false;
            Closure that = (Closure) o;
            return funId.equals(that.funId) && generics.equals(that.generics);
        }

        @Override
        public int hashCode() { return Objects.hash(funId, generics); }

        @Override
        public String toString() { return "closure(" + funId + generics + ")"; }
    }

    /**
     * trait 声明/实现内部的 Self。故意排在局部子句之后。
     */
    public static final class SelfId extends TraitInstanceId {
        private SelfId() {}

        @Override
        protected int order() { return 7; }

        @Override
        protected int compareSameVariant(TraitInstanceId other) { return 0; }

        @Override
        public <T> T accept(TraitInstanceIdVisitor<T> visitor) { return visitor.visitSelf(this); }

        @Override
        public String tag() { return "SelfId"; }

        @Override
        public Object[] fields() { return new Object[0]; }

        @Override
        public String toString() { return "Self"; }
    }

    /**
     * 尚未求解的子句（注册子句时可能引用尚未注册的子句）。
     * 纯内部状态：翻译结束后不应残留，容错模式下改写为 {@link Unknown}。
     */
    public static final class Unsolved extends TraitInstanceId {
        private final TraitDeclId traitId;
        private final GenericArgs<Region> generics;

        private Unsolved(TraitDeclId traitId, GenericArgs<Region> generics) {
            this.traitId = Objects.requireNonNull(traitId);
            this.generics = Objects.requireNonNull(generics);
        }

        public TraitDeclId getTraitId() { return traitId; }
        public GenericArgs<Region> getGenerics() { return generics; }

        @Override
        protected int order() { return 8; }

        @Override
        protected int compareSameVariant(TraitInstanceId other) {
            Unsolved that = (Unsolved) other;
            int c = traitId.compareTo(that.traitId);
            return c != 0 ? c : StructuralOrder.compare(generics, that.generics);
        }

        @Override
        public <T> T accept(TraitInstanceIdVisitor<T> visitor) { return visitor.visitUnsolved(this); }

        @Override
        public String tag() { return "Unsolved"; }

        @Override
        public Object[] fields() { return new Object[]{traitId, generics}; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Unsolved)) return false;
            Unsolved that = (Unsolved) o;
            return traitId.equals(that.traitId) && generics.equals(that.generics);
        }

        @Override
        public int hashCode() { return Objects.hash(traitId, generics); }

        @Override
        public String toString() { return "unsolved(" + traitId + generics + ")"; }
    }

    /** 无法恢复的错误，携带诊断信息 */
    public static final class Unknown extends TraitInstanceId {
        private final String message;

        private Unknown(String message) { this.message = Objects.requireNonNull(message); }

        public String getMessage() { return message; }

        @Override
        protected int order() { return 9; }

        @Override
        protected int compareSameVariant(TraitInstanceId other) {
            return message.compareTo(((Unknown) other).message);
        }

        @Override
        public <T> T accept(TraitInstanceIdVisitor<T> visitor) { return visitor.visitUnknown(this); }

        @Override
        public String tag() { return "Unknown"; }

        @Override
        public Object[] fields() { return new Object[]{message}; }

        @Override
        public boolean equals(Object o) {
            return o instanceof Unknown && ((Unknown) o).message.equals(message);
        }

        @Override
        public int hashCode() { return message.hashCode(); }

        @Override
        public String toString() { return "unknown(\"" + message + "\")"; }
    }
}
