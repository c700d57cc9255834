package com.mirlift.types;

/**
 * TraitInstanceId 访问者接口。
 */
public interface TraitInstanceIdVisitor<T> {
    T visitTraitImpl(TraitInstanceId.TraitImpl id);
    T visitBuiltinOrAuto(TraitInstanceId.BuiltinOrAuto id);
    T visitClause(TraitInstanceId.Clause id);
    T visitParentClause(TraitInstanceId.ParentClause id);
    T visitItemClause(TraitInstanceId.ItemClause id);
    T visitFnPointer(TraitInstanceId.FnPointer id);
    T visitClosure(TraitInstanceId.Closure id);
    T visitSelf(TraitInstanceId.SelfId id);
    T visitUnsolved(TraitInstanceId.Unsolved id);
    T visitUnknown(TraitInstanceId.Unknown id);
}
