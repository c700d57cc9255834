package com.mirlift.ir.translate;

import com.mirlift.ir.export.DeclarationGroup;
import com.mirlift.ir.export.DeclarationReorderer;
import com.mirlift.ir.gast.GExprBody;
import com.mirlift.ir.gast.GFunDecl;
import com.mirlift.ir.gast.GGlobalDecl;
import com.mirlift.types.decl.TraitDecl;
import com.mirlift.types.decl.TraitImpl;
import com.mirlift.types.decl.TypeDecl;
import com.mirlift.types.id.FileId;
import com.mirlift.types.id.FunDeclId;
import com.mirlift.types.id.GlobalDeclId;
import com.mirlift.types.id.IdMap;
import com.mirlift.types.id.TraitDeclId;
import com.mirlift.types.id.TraitImplId;
import com.mirlift.types.id.TypeDeclId;
import com.mirlift.types.meta.FileName;
import com.mirlift.types.meta.Meta;
import com.mirlift.types.names.Name;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import java.util.logging.Logger;

/**
 * 一个 crate 的翻译上下文：声明表、文件表、声明分组与错误计数。
 * <p>
 * 由抽取阶段填充；各 pass 只读取声明表并通过 {@link #registerError(Meta, String)} 报告问题。
 */
public class TransCtx {

    private static final Logger LOG = Logger.getLogger(TransCtx.class.getName());

    private final String crateName;
    private final TranslateOptions options;
    private final IdMap<TypeDeclId, TypeDecl> typeDecls = new IdMap<>();
    private final IdMap<TraitDeclId, TraitDecl> traitDecls = new IdMap<>();
    private final IdMap<TraitImplId, TraitImpl> traitImpls = new IdMap<>();
    private final Map<FileId, FileName> idToFile = new TreeMap<>();
    private List<DeclarationGroup> orderedDecls;
    private final AtomicInteger errorCount = new AtomicInteger();

    public TransCtx(String crateName, TranslateOptions options) {
        this.crateName = Objects.requireNonNull(crateName);
        this.options = Objects.requireNonNull(options);
    }

    public TransCtx(String crateName) {
        this(crateName, new TranslateOptions());
    }

    public String getCrateName() { return crateName; }
    public TranslateOptions getOptions() { return options; }
    public IdMap<TypeDeclId, TypeDecl> getTypeDecls() { return typeDecls; }
    public IdMap<TraitDeclId, TraitDecl> getTraitDecls() { return traitDecls; }
    public IdMap<TraitImplId, TraitImpl> getTraitImpls() { return traitImpls; }
    public Map<FileId, FileName> getIdToFile() { return idToFile; }

    public void registerFile(FileId id, FileName name) {
        idToFile.put(id, name);
    }

    /** 声明分组；尚未排序时为 null */
    public List<DeclarationGroup> getOrderedDecls() {
        return orderedDecls;
    }

    public void setOrderedDecls(List<DeclarationGroup> orderedDecls) {
        this.orderedDecls = Collections.unmodifiableList(new ArrayList<>(orderedDecls));
    }

    /**
     * 调用外部排序器计算声明顺序，结果原样保存。
     */
    public void computeDeclarationOrder(DeclarationReorderer reorderer, List<FunDeclId> funs,
                                        List<GlobalDeclId> globals) {
        setOrderedDecls(reorderer.reorder(this, funs, globals));
    }

    public int getErrorCount() {
        return errorCount.get();
    }

    public boolean hasErrors() {
        return errorCount.get() > 0;
    }

    /**
     * 登记一个可恢复错误。严格模式下抛出 {@link TranslationException}。
     */
    public void registerError(Meta meta, String message) {
        LOG.severe(meta != null ? message + " at " + meta : message);
        errorCount.incrementAndGet();
        if (!options.isContinueOnFailure()) {
            throw new TranslationException(message, meta);
        }
    }

    /**
     * 依次访问所有存在函数体的函数与全局量：先函数，后全局量，各自按 id 顺序。
     */
    public <B> void iterBodies(IdMap<FunDeclId, GFunDecl<B>> funs, IdMap<GlobalDeclId, GGlobalDecl<B>> globals,
                               BiConsumer<Name, GExprBody<B>> consumer) {
        for (GFunDecl<B> fun : funs.values()) {
            if (fun.getBody() != null) {
                consumer.accept(fun.getName(), fun.getBody());
            }
        }
        for (GGlobalDecl<B> global : globals.values()) {
            if (global.getBody() != null) {
                consumer.accept(global.getName(), global.getBody());
            }
        }
    }
}
