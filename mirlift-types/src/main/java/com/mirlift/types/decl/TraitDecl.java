package com.mirlift.types.decl;

import com.mirlift.types.GenericParams;
import com.mirlift.types.Predicates;
import com.mirlift.types.Region;
import com.mirlift.types.TraitClause;
import com.mirlift.types.Ty;
import com.mirlift.types.id.GlobalDeclId;
import com.mirlift.types.id.TraitDeclId;
import com.mirlift.types.meta.Meta;
import com.mirlift.types.names.Name;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * trait 声明。
 * <pre>
 * trait Foo : Bar {          // parentClauses = [Bar]
 *     const C: usize = 0;    // consts
 *     type W: Clone;         // types
 *     fn f(&amp;self);          // requiredMethods
 *     fn g(&amp;self) {}        // providedMethods
 * }
 * </pre>
 */
public final class TraitDecl {

    private final TraitDeclId defId;
    private final boolean isLocal;
    private final Name name;
    private final Meta meta;
    private GenericParams generics;
    private Predicates preds;
    private List<TraitClause> parentClauses;
    private List<Const> consts;
    private List<AssocType> types;
    private final List<TraitMethod> requiredMethods;
    private final List<TraitMethod> providedMethods;

    public TraitDecl(TraitDeclId defId, boolean isLocal, Name name, Meta meta, GenericParams generics,
                     Predicates preds, List<TraitClause> parentClauses, List<Const> consts,
                     List<AssocType> types, List<TraitMethod> requiredMethods,
                     List<TraitMethod> providedMethods) {
        this.defId = Objects.requireNonNull(defId);
        this.isLocal = isLocal;
        this.name = Objects.requireNonNull(name);
        this.meta = Objects.requireNonNull(meta);
        this.generics = Objects.requireNonNull(generics);
        this.preds = Objects.requireNonNull(preds);
        this.parentClauses = Collections.unmodifiableList(new ArrayList<>(parentClauses));
        this.consts = Collections.unmodifiableList(new ArrayList<>(consts));
        this.types = Collections.unmodifiableList(new ArrayList<>(types));
        this.requiredMethods = Collections.unmodifiableList(new ArrayList<>(requiredMethods));
        this.providedMethods = Collections.unmodifiableList(new ArrayList<>(providedMethods));
    }

    public TraitDeclId getDefId() { return defId; }
    public boolean isLocal() { return isLocal; }
    public Name getName() { return name; }
    public Meta getMeta() { return meta; }
    public GenericParams getGenerics() { return generics; }
    public Predicates getPreds() { return preds; }
    public List<TraitClause> getParentClauses() { return parentClauses; }
    public List<Const> getConsts() { return consts; }
    public List<AssocType> getTypes() { return types; }
    public List<TraitMethod> getRequiredMethods() { return requiredMethods; }
    public List<TraitMethod> getProvidedMethods() { return providedMethods; }

    public void setGenerics(GenericParams generics) { this.generics = Objects.requireNonNull(generics); }
    public void setPreds(Predicates preds) { this.preds = Objects.requireNonNull(preds); }

    public void setParentClauses(List<TraitClause> parentClauses) {
        this.parentClauses = Collections.unmodifiableList(new ArrayList<>(parentClauses));
    }

    public void setConsts(List<Const> consts) {
        this.consts = Collections.unmodifiableList(new ArrayList<>(consts));
    }

    public void setTypes(List<AssocType> types) {
        this.types = Collections.unmodifiableList(new ArrayList<>(types));
    }

    @Override
    public String toString() {
        return "trait " + name + " (" + defId + ")";
    }

    /** 关联常量，可带默认值（指向一个全局声明） */
    public static final class Const {
        private final String name;
        private final Ty<Region> ty;
        private final GlobalDeclId defaultValue;  // nullable

        public Const(String name, Ty<Region> ty, GlobalDeclId defaultValue) {
            this.name = Objects.requireNonNull(name);
            this.ty = Objects.requireNonNull(ty);
            this.defaultValue = defaultValue;
        }

        public String getName() { return name; }
        public Ty<Region> getTy() { return ty; }
        public GlobalDeclId getDefaultValue() { return defaultValue; }

        public Const withTy(Ty<Region> newTy) {
            return new Const(name, newTy, defaultValue);
        }
    }

    /** 关联类型：其上的 trait 子句，以及可选的默认类型 */
    public static final class AssocType {
        private final String name;
        private final List<TraitClause> clauses;
        private final Ty<Region> defaultTy;  // nullable

        public AssocType(String name, List<TraitClause> clauses, Ty<Region> defaultTy) {
            this.name = Objects.requireNonNull(name);
            this.clauses = Collections.unmodifiableList(new ArrayList<>(clauses));
            this.defaultTy = defaultTy;
        }

        public String getName() { return name; }
        public List<TraitClause> getClauses() { return clauses; }
        public Ty<Region> getDefaultTy() { return defaultTy; }

        public AssocType with(List<TraitClause> newClauses, Ty<Region> newDefaultTy) {
            return new AssocType(name, newClauses, newDefaultTy);
        }
    }
}
