package com.mirlift.types;

import com.mirlift.types.id.DeBruijnId;
import com.mirlift.types.id.RegionId;

import java.util.Objects;

/**
 * 签名中的区域（生命周期）：'static、De Bruijn 绑定变量，或出错时的占位。
 * 绑定变量用 (binder 深度, binder 内编号) 表示，不使用指针回链。
 */
public abstract class Region implements Tagged {

    public static final Region STATIC = new Static();
    public static final Region UNKNOWN = new Unknown();

    private Region() {
    }

    public static Region bvar(int depth, int varIndex) {
        return new BVar(DeBruijnId.of(depth), RegionId.of(varIndex));
    }

    public static Region bvar(DeBruijnId depth, RegionId var) {
        return new BVar(depth, var);
    }

    public boolean isStatic() {
        return this instanceof Static;
    }

    public static final class Static extends Region {
        private Static() {}

        @Override
        public String tag() { return "Static"; }

        @Override
        public Object[] fields() { return new Object[0]; }

        @Override
        public String toString() { return "'static"; }
    }

    public static final class BVar extends Region {
        private final DeBruijnId depth;
        private final RegionId var;

        private BVar(DeBruijnId depth, RegionId var) {
            this.depth = Objects.requireNonNull(depth);
            this.var = Objects.requireNonNull(var);
        }

        public DeBruijnId getDepth() { return depth; }
        public RegionId getVar() { return var; }

        /** 把深度整体平移 delta（穿过 binder 时使用） */
        public BVar shift(int delta) {
            return new BVar(DeBruijnId.of(depth.getIndex() + delta), var);
        }

        @Override
        public String tag() { return "BVar"; }

        @Override
        public Object[] fields() { return new Object[]{depth, var}; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BVar)) return false;
            BVar that = (BVar) o;
            return depth.equals(that.depth) && var.equals(that.var);
        }

        @Override
        public int hashCode() {
            return Objects.hash(depth, var);
        }

        @Override
        public String toString() {
            return "'_" + depth.getIndex() + "_" + var.getIndex();
        }
    }

    public static final class Unknown extends Region {
        private Unknown() {}

        @Override
        public String tag() { return "Unknown"; }

        @Override
        public Object[] fields() { return new Object[0]; }

        @Override
        public String toString() { return "'?"; }
    }
}
