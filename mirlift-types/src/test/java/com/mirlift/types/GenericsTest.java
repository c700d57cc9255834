package com.mirlift.types;

import com.mirlift.types.id.ConstGenericVarId;
import com.mirlift.types.id.IdVector;
import com.mirlift.types.id.RegionId;
import com.mirlift.types.id.TraitClauseId;
import com.mirlift.types.id.TypeVarId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

@DisplayName("泛型参数与实参测试")
class GenericsTest {

    /** <'a, T, U> */
    private static GenericParams twoTypesOneRegion() {
        return new GenericParams(
                IdVector.of(RegionId.FACTORY, new RegionVar(RegionId.of(0), "'a")),
                IdVector.of(TypeVarId.FACTORY, new TypeVar(TypeVarId.of(0), "T"), new TypeVar(TypeVarId.of(1), "U")),
                IdVector.<ConstGenericVarId, ConstGenericVar>empty(ConstGenericVarId.FACTORY),
                IdVector.<TraitClauseId, TraitClause>empty(TraitClauseId.FACTORY));
    }

    @Test
    @DisplayName("恒等实参与参数数量一致")
    void testIdentityArgsMatch() {
        GenericParams params = twoTypesOneRegion();

        GenericArgs<Region> args = params.identityArgs();

        assertThat(args.matchesArity(params)).isTrue();
        assertThat(args.getTypes()).containsExactly(
                Ty.<Region>typeVar(TypeVarId.of(0)), Ty.<Region>typeVar(TypeVarId.of(1)));
        assertThat(args.getRegions()).containsExactly(Region.bvar(0, 0));
    }

    @Test
    @DisplayName("缺少类型实参时数量不一致")
    void testArityMismatch() {
        GenericArgs<Region> args = GenericArgs.ofTypes(
                Collections.singletonList(Ty.<Region>integer(IntegerTy.U8)));

        assertThat(args.matchesArity(twoTypesOneRegion())).isFalse();
        assertThat(GenericArgs.<Region>empty().matchesArity(GenericParams.empty())).isTrue();
    }

    @Test
    @DisplayName("外层参数计数")
    void testParamsInfo() {
        Predicates preds = new Predicates(
                Collections.singletonList(new OutlivesPred<>(Region.bvar(0, 0), Region.STATIC)),
                Arrays.asList(
                        new OutlivesPred<>(Ty.<Region>typeVar(TypeVarId.of(0)), Region.bvar(0, 0)),
                        new OutlivesPred<>(Ty.<Region>typeVar(TypeVarId.of(1)), Region.STATIC)),
                Collections.<TraitTypeConstraint<Region>>emptyList());

        ParamsInfo info = ParamsInfo.of(twoTypesOneRegion(), preds);

        assertThat(info.getNumRegionParams()).isEqualTo(1);
        assertThat(info.getNumTypeParams()).isEqualTo(2);
        assertThat(info.getNumConstGenericParams()).isZero();
        assertThat(info.getNumTraitClauses()).isZero();
        assertThat(info.getNumRegionsOutlive()).isEqualTo(1);
        assertThat(info.getNumTypesOutlive()).isEqualTo(2);
        assertThat(info).isEqualTo(new ParamsInfo(1, 2, 0, 0, 1, 2, 0));
        assertThat(ParamsInfo.of(GenericParams.empty(), Predicates.empty()))
                .isEqualTo(new ParamsInfo(0, 0, 0, 0, 0, 0, 0));
    }
}
