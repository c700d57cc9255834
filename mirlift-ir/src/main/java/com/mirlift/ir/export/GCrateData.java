package com.mirlift.ir.export;

import com.google.gson.JsonElement;
import com.mirlift.ir.translate.TransCtx;
import com.mirlift.types.decl.TraitDecl;
import com.mirlift.types.decl.TraitImpl;
import com.mirlift.types.decl.TypeDecl;
import com.mirlift.types.id.FileId;
import com.mirlift.types.id.FunDeclId;
import com.mirlift.types.id.GlobalDeclId;
import com.mirlift.types.id.IdMap;
import com.mirlift.types.meta.FileName;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 导出用的 crate 快照。声明表被展开为按 id 排序的列表（声明自带 id，可据此重建映射）。
 * <p>
 * 导出内容在组装时编码定型：之后再修改上下文、声明或函数体，都不会改变 {@link #toJson()} 与写出的文件。
 *
 * @param <FD> 函数声明类型
 * @param <GD> 全局量声明类型
 */
public final class GCrateData<FD, GD> {

    private static final Logger LOG = Logger.getLogger(GCrateData.class.getName());

    private final String name;
    private final List<FileEntry> idToFile;
    private final List<DeclarationGroup> declarations;
    private final List<TypeDecl> types;
    private final List<FD> functions;
    private final List<GD> globals;
    private final List<TraitDecl> traitDecls;
    private final List<TraitImpl> traitImpls;
    /** 翻译中登记过错误时只包含部分内容；不导出 */
    private final transient boolean hasErrors;
    /** 组装时的编码结果；编码失败时为 null */
    private transient JsonElement encoded;
    private transient RuntimeException encodeFailure;

    private GCrateData(String name, List<FileEntry> idToFile, List<DeclarationGroup> declarations,
                       List<TypeDecl> types, List<FD> functions, List<GD> globals,
                       List<TraitDecl> traitDecls, List<TraitImpl> traitImpls, boolean hasErrors) {
        this.name = name;
        this.idToFile = idToFile;
        this.declarations = declarations;
        this.types = types;
        this.functions = functions;
        this.globals = globals;
        this.traitDecls = traitDecls;
        this.traitImpls = traitImpls;
        this.hasErrors = hasErrors;
    }

    /**
     * 从翻译上下文组装快照。要求声明顺序已经计算好。
     */
    public static <FD, GD> GCrateData<FD, GD> assemble(TransCtx ctx, IdMap<FunDeclId, FD> funs,
                                                       IdMap<GlobalDeclId, GD> globals) {
        List<DeclarationGroup> declarations = ctx.getOrderedDecls();
        if (declarations == null) {
            throw new IllegalStateException("declaration order has not been computed for crate " + ctx.getCrateName());
        }
        // 按 file id 排序，让输出尽可能稳定
        List<FileEntry> files = new ArrayList<>();
        for (Map.Entry<FileId, FileName> entry : ctx.getIdToFile().entrySet()) {
            files.add(new FileEntry(entry.getKey(), entry.getValue()));
        }
        GCrateData<FD, GD> data = new GCrateData<>(
                ctx.getCrateName(),
                Collections.unmodifiableList(files),
                Collections.unmodifiableList(new ArrayList<>(declarations)),
                Collections.unmodifiableList(ctx.getTypeDecls().values()),
                Collections.unmodifiableList(funs.values()),
                Collections.unmodifiableList(globals.values()),
                Collections.unmodifiableList(ctx.getTraitDecls().values()),
                Collections.unmodifiableList(ctx.getTraitImpls().values()),
                ctx.hasErrors());
        data.freeze();
        return data;
    }

    private void freeze() {
        try {
            encoded = CrateJson.gson().toJsonTree(this);
        } catch (RuntimeException e) {
            // 推迟到写文件时按 WRITE 失败上报
            LOG.log(Level.WARNING, "Could not encode crate " + name, e);
            encodeFailure = e;
        }
    }

    public String getName() { return name; }
    public List<FileEntry> getIdToFile() { return idToFile; }
    public List<DeclarationGroup> getDeclarations() { return declarations; }
    public List<TypeDecl> getTypes() { return types; }
    public List<FD> getFunctions() { return functions; }
    public List<GD> getGlobals() { return globals; }
    public List<TraitDecl> getTraitDecls() { return traitDecls; }
    public List<TraitImpl> getTraitImpls() { return traitImpls; }
    public boolean hasErrors() { return hasErrors; }

    /**
     * @throws IllegalStateException 组装时编码失败
     */
    public String toJson() {
        if (encodeFailure != null) {
            throw new IllegalStateException("crate " + name + " could not be encoded", encodeFailure);
        }
        return CrateJson.gson().toJson(encoded);
    }

    /**
     * 写出 JSON 文件，必要时创建父目录。
     */
    public ExportResult serializeToFile(Path target) {
        Path dir = target.toAbsolutePath().getParent();
        if (dir != null) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                LOG.log(Level.SEVERE, "Could not create the directory: " + dir, e);
                return ExportResult.failure(ExportResult.Step.CREATE_DIRECTORY, target, e.toString());
            }
        }

        Writer writer;
        try {
            writer = new OutputStreamWriter(Files.newOutputStream(target), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.log(Level.SEVERE, "Could not open: " + target, e);
            return ExportResult.failure(ExportResult.Step.OPEN_FILE, target, e.toString());
        }
        try (Writer out = writer) {
            if (encodeFailure != null) {
                throw encodeFailure;
            }
            CrateJson.gson().toJson(encoded, out);
        } catch (IOException | RuntimeException e) {
            LOG.log(Level.SEVERE, "Could not write to: " + target, e);
            discardPartial(target);
            return ExportResult.failure(ExportResult.Step.WRITE, target, e.toString());
        }

        Path absolute = resolve(target);
        if (hasErrors) {
            LOG.info("Generated the partial (because we encountered errors) file: " + absolute);
        } else {
            LOG.info("Generated the file: " + absolute);
        }
        return ExportResult.success(absolute, hasErrors);
    }

    /** 写失败后删除残缺文件 */
    private static void discardPartial(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Could not delete the partial file: " + target, e);
        }
    }

    /** 解析符号链接后的真实路径；解析失败时退回规范化的绝对路径 */
    private static Path resolve(Path target) {
        try {
            return target.toRealPath();
        } catch (IOException e) {
            LOG.log(Level.FINE, "Could not resolve the real path of: " + target, e);
            return target.toAbsolutePath().normalize();
        }
    }
}
