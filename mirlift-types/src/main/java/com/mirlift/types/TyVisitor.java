package com.mirlift.types;

/**
 * Ty 访问者接口，每个变体一个方法。新增变体时编译器会强制所有实现补齐。
 *
 * @param <R> 区域表示
 * @param <T> 返回类型
 */
public interface TyVisitor<R, T> {
    T visitAdt(Ty.Adt<R> ty);
    T visitTypeVar(Ty.TypeVarRef<R> ty);
    T visitLiteral(Ty.Lit<R> ty);
    T visitNever(Ty.Never<R> ty);
    T visitRef(Ty.Ref<R> ty);
    T visitRawPtr(Ty.RawPtr<R> ty);
    T visitTraitType(Ty.TraitType<R> ty);
    T visitArrow(Ty.Arrow<R> ty);
}
