package com.mirlift.ir.llbc;

import com.mirlift.ir.expr.AggregateKind;
import com.mirlift.ir.expr.Assert;
import com.mirlift.ir.expr.Call;
import com.mirlift.ir.expr.FnPtr;
import com.mirlift.ir.expr.FunIdOrTraitMethodRef;
import com.mirlift.ir.expr.Operand;
import com.mirlift.ir.expr.Place;
import com.mirlift.ir.expr.Rvalue;
import com.mirlift.ir.expr.Var;
import com.mirlift.types.ConstGeneric;
import com.mirlift.types.ErasedRegion;
import com.mirlift.types.GenericArgs;
import com.mirlift.types.TraitRef;
import com.mirlift.types.Ty;
import com.mirlift.types.TypeTransformer;

import java.util.List;

/**
 * 函数体内表达式的类型改写（copy-on-change）。
 * 覆盖 {@link TypeTransformer} 的方法即可作用到操作数、右值、调用与断言中的类型和 trait 引用。
 */
public class MutTypeVisitor extends TypeTransformer<ErasedRegion> {

    public Var transformVar(Var var) {
        Ty<ErasedRegion> ty = transformTy(var.getTy());
        return ty == var.getTy() ? var : var.withTy(ty);
    }

    /** 投影中不含类型，默认原样返回 */
    public Place transformPlace(Place place) {
        return place;
    }

    public Operand transformOperand(Operand op) {
        if (op instanceof Operand.Copy) {
            Operand.Copy copy = (Operand.Copy) op;
            Place place = transformPlace(copy.getPlace());
            return place == copy.getPlace() ? op : Operand.copy(place);
        }
        if (op instanceof Operand.Move) {
            Operand.Move move = (Operand.Move) op;
            Place place = transformPlace(move.getPlace());
            return place == move.getPlace() ? op : Operand.move(place);
        }
        Operand.Const c = (Operand.Const) op;
        Ty<ErasedRegion> ty = transformTy(c.getTy());
        return ty == c.getTy() ? op : Operand.constant(ty, c.getValue());
    }

    public List<Operand> transformOperands(List<Operand> ops) {
        return transformList(ops, new Fn<Operand>() {
            @Override
            public Operand apply(Operand o) { return transformOperand(o); }
        });
    }

    public Rvalue transformRvalue(Rvalue rv) {
        if (rv instanceof Rvalue.Use) {
            Rvalue.Use use = (Rvalue.Use) rv;
            Operand op = transformOperand(use.getOperand());
            return op == use.getOperand() ? rv : Rvalue.use(op);
        }
        if (rv instanceof Rvalue.Ref) {
            Rvalue.Ref ref = (Rvalue.Ref) rv;
            Place place = transformPlace(ref.getPlace());
            return place == ref.getPlace() ? rv : Rvalue.ref(place, ref.getKind());
        }
        if (rv instanceof Rvalue.UnaryOp) {
            Rvalue.UnaryOp un = (Rvalue.UnaryOp) rv;
            Operand op = transformOperand(un.getOperand());
            return op == un.getOperand() ? rv : Rvalue.unaryOp(un.getOp(), op);
        }
        if (rv instanceof Rvalue.BinaryOp) {
            Rvalue.BinaryOp bin = (Rvalue.BinaryOp) rv;
            Operand left = transformOperand(bin.getLeft());
            Operand right = transformOperand(bin.getRight());
            if (left == bin.getLeft() && right == bin.getRight()) return rv;
            return Rvalue.binaryOp(bin.getOp(), left, right);
        }
        if (rv instanceof Rvalue.Discriminant) {
            Rvalue.Discriminant d = (Rvalue.Discriminant) rv;
            Place place = transformPlace(d.getPlace());
            return place == d.getPlace() ? rv : Rvalue.discriminant(place, d.getAdtId());
        }
        if (rv instanceof Rvalue.Aggregate) {
            Rvalue.Aggregate agg = (Rvalue.Aggregate) rv;
            AggregateKind kind = transformAggregateKind(agg.getKind());
            List<Operand> ops = transformOperands(agg.getOperands());
            if (kind == agg.getKind() && ops == agg.getOperands()) return rv;
            return Rvalue.aggregate(kind, ops);
        }
        if (rv instanceof Rvalue.Len) {
            Rvalue.Len len = (Rvalue.Len) rv;
            Place place = transformPlace(len.getPlace());
            Ty<ErasedRegion> ty = transformTy(len.getTy());
            ConstGeneric length = len.getLength() == null ? null : transformConstGeneric(len.getLength());
            if (place == len.getPlace() && ty == len.getTy() && length == len.getLength()) return rv;
            return Rvalue.len(place, ty, length);
        }
        // Global
        return rv;
    }

    public AggregateKind transformAggregateKind(AggregateKind kind) {
        if (kind instanceof AggregateKind.Adt) {
            AggregateKind.Adt adt = (AggregateKind.Adt) kind;
            GenericArgs<ErasedRegion> generics = transformGenericArgs(adt.getGenerics());
            return generics == adt.getGenerics() ? kind : adt.withGenerics(generics);
        }
        AggregateKind.Array array = (AggregateKind.Array) kind;
        Ty<ErasedRegion> elemTy = transformTy(array.getElemTy());
        return elemTy == array.getElemTy() ? kind : AggregateKind.array(elemTy, array.getLength());
    }

    public FnPtr transformFnPtr(FnPtr ptr) {
        FunIdOrTraitMethodRef func = ptr.getFunc();
        if (func instanceof FunIdOrTraitMethodRef.Trait) {
            FunIdOrTraitMethodRef.Trait trait = (FunIdOrTraitMethodRef.Trait) func;
            TraitRef<ErasedRegion> ref = transformTraitRef(trait.getTraitRef());
            if (ref != trait.getTraitRef()) func = trait.withTraitRef(ref);
        }
        GenericArgs<ErasedRegion> generics = transformGenericArgs(ptr.getGenerics());
        if (func == ptr.getFunc() && generics == ptr.getGenerics()) return ptr;
        return new FnPtr(func, generics);
    }

    public Call transformCall(Call call) {
        FnPtr func = transformFnPtr(call.getFunc());
        List<Operand> args = transformOperands(call.getArgs());
        Place dest = transformPlace(call.getDest());
        if (func == call.getFunc() && args == call.getArgs() && dest == call.getDest()) return call;
        return new Call(func, args, dest);
    }

    public Assert transformAssert(Assert a) {
        Operand cond = transformOperand(a.getCond());
        return cond == a.getCond() ? a : new Assert(cond, a.isExpected());
    }
}
