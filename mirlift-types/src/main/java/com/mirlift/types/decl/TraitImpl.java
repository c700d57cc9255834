package com.mirlift.types.decl;

import com.mirlift.types.GenericParams;
import com.mirlift.types.Predicates;
import com.mirlift.types.Region;
import com.mirlift.types.TraitDeclRef;
import com.mirlift.types.TraitRef;
import com.mirlift.types.Ty;
import com.mirlift.types.id.GlobalDeclId;
import com.mirlift.types.id.TraitImplId;
import com.mirlift.types.meta.Meta;
import com.mirlift.types.names.Name;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * trait 实现。parentTraitRefs 为被实现 trait 的每个父子句提供见证，顺序与父子句一致。
 */
public final class TraitImpl {

    private final TraitImplId defId;
    private final boolean isLocal;
    private final Name name;
    private final Meta meta;
    private TraitDeclRef<Region> implTrait;
    private GenericParams generics;
    private Predicates preds;
    private List<TraitRef<Region>> parentTraitRefs;
    private List<Const> consts;
    private List<AssocType> types;
    private final List<TraitMethod> requiredMethods;
    private final List<TraitMethod> providedMethods;

    public TraitImpl(TraitImplId defId, boolean isLocal, Name name, Meta meta, TraitDeclRef<Region> implTrait,
                     GenericParams generics, Predicates preds, List<TraitRef<Region>> parentTraitRefs,
                     List<Const> consts, List<AssocType> types, List<TraitMethod> requiredMethods,
                     List<TraitMethod> providedMethods) {
        this.defId = Objects.requireNonNull(defId);
        this.isLocal = isLocal;
        this.name = Objects.requireNonNull(name);
        this.meta = Objects.requireNonNull(meta);
        this.implTrait = Objects.requireNonNull(implTrait);
        this.generics = Objects.requireNonNull(generics);
        this.preds = Objects.requireNonNull(preds);
        this.parentTraitRefs = Collections.unmodifiableList(new ArrayList<>(parentTraitRefs));
        this.consts = Collections.unmodifiableList(new ArrayList<>(consts));
        this.types = Collections.unmodifiableList(new ArrayList<>(types));
        this.requiredMethods = Collections.unmodifiableList(new ArrayList<>(requiredMethods));
        this.providedMethods = Collections.unmodifiableList(new ArrayList<>(providedMethods));
    }

    public TraitImplId getDefId() { return defId; }
    public boolean isLocal() { return isLocal; }
    public Name getName() { return name; }
    public Meta getMeta() { return meta; }
    public TraitDeclRef<Region> getImplTrait() { return implTrait; }
    public GenericParams getGenerics() { return generics; }
    public Predicates getPreds() { return preds; }
    public List<TraitRef<Region>> getParentTraitRefs() { return parentTraitRefs; }
    public List<Const> getConsts() { return consts; }
    public List<AssocType> getTypes() { return types; }
    public List<TraitMethod> getRequiredMethods() { return requiredMethods; }
    public List<TraitMethod> getProvidedMethods() { return providedMethods; }

    public void setImplTrait(TraitDeclRef<Region> implTrait) { this.implTrait = Objects.requireNonNull(implTrait); }
    public void setGenerics(GenericParams generics) { this.generics = Objects.requireNonNull(generics); }
    public void setPreds(Predicates preds) { this.preds = Objects.requireNonNull(preds); }

    public void setParentTraitRefs(List<TraitRef<Region>> parentTraitRefs) {
        this.parentTraitRefs = Collections.unmodifiableList(new ArrayList<>(parentTraitRefs));
    }

    public void setConsts(List<Const> consts) {
        this.consts = Collections.unmodifiableList(new ArrayList<>(consts));
    }

    public void setTypes(List<AssocType> types) {
        this.types = Collections.unmodifiableList(new ArrayList<>(types));
    }

    @Override
    public String toString() {
        return "impl " + name + " (" + defId + ")";
    }

    public static final class Const {
        private final String name;
        private final Ty<Region> ty;
        private final GlobalDeclId value;

        public Const(String name, Ty<Region> ty, GlobalDeclId value) {
            this.name = Objects.requireNonNull(name);
            this.ty = Objects.requireNonNull(ty);
            this.value = Objects.requireNonNull(value);
        }

        public String getName() { return name; }
        public Ty<Region> getTy() { return ty; }
        public GlobalDeclId getValue() { return value; }

        public Const withTy(Ty<Region> newTy) {
            return new Const(name, newTy, value);
        }
    }

    /** 关联类型的取值，连同为其上子句提供的见证 */
    public static final class AssocType {
        private final String name;
        private final List<TraitRef<Region>> traitRefs;
        private final Ty<Region> ty;

        public AssocType(String name, List<TraitRef<Region>> traitRefs, Ty<Region> ty) {
            this.name = Objects.requireNonNull(name);
            this.traitRefs = Collections.unmodifiableList(new ArrayList<>(traitRefs));
            this.ty = Objects.requireNonNull(ty);
        }

        public String getName() { return name; }
        public List<TraitRef<Region>> getTraitRefs() { return traitRefs; }
        public Ty<Region> getTy() { return ty; }

        public AssocType with(List<TraitRef<Region>> newRefs, Ty<Region> newTy) {
            return new AssocType(name, newRefs, newTy);
        }
    }
}
