package com.mirlift.types;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 收集签名类型中在最外层 binder 处自由出现的区域。
 * <p>
 * 进入 {@link Ty.Arrow} 时 binder 深度加一，退出时减一；深度小于当前 binder 深度的绑定变量
 * 属于内层函数指针，被忽略。结果中的绑定变量深度已平移回最外层坐标。
 */
public final class FreeRegionCollector extends TypeTransformer<Region> {

    private final Set<Region> regions = new LinkedHashSet<>();
    private int binderDepth = 0;

    public static Set<Region> collect(Ty<Region> ty) {
        FreeRegionCollector collector = new FreeRegionCollector();
        collector.transformTy(ty);
        return collector.getRegions();
    }

    public static Set<Region> collect(FunSig sig) {
        FreeRegionCollector collector = new FreeRegionCollector();
        collector.transformTys(sig.getInputs());
        collector.transformTy(sig.getOutput());
        return collector.getRegions();
    }

    public Set<Region> getRegions() {
        return Collections.unmodifiableSet(regions);
    }

    public int getBinderDepth() {
        return binderDepth;
    }

    @Override
    public Region transformRegion(Region region) {
        if (region instanceof Region.BVar) {
            Region.BVar bvar = (Region.BVar) region;
            if (bvar.getDepth().getIndex() >= binderDepth) {
                regions.add(bvar.shift(-binderDepth));
            }
        } else if (region.isStatic()) {
            regions.add(region);
        }
        return region;
    }

    @Override
    public Ty<Region> visitArrow(Ty.Arrow<Region> ty) {
        binderDepth++;
        try {
            return super.visitArrow(ty);
        } finally {
            binderDepth--;
        }
    }
}
