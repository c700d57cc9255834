package com.mirlift.ir.export;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import com.mirlift.ir.llbc.SwitchCase;
import com.mirlift.types.Tagged;
import com.mirlift.types.id.IdVector;
import com.mirlift.types.id.IndexId;
import com.mirlift.types.names.Name;
import com.mirlift.types.names.PathElem;

import java.lang.reflect.Type;

/**
 * 导出格式的 Gson 配置。
 * <ul>
 *   <li>字段名 snake_case，保留 null</li>
 *   <li>id 为整数，{@link IdVector} 为数组，{@link Name} 为路径段数组</li>
 *   <li>和类型：无字段 {@code "Tag"}，单字段 {@code {"Tag": v}}，多字段 {@code {"Tag": [v...]}}</li>
 * </ul>
 * 同一输入总是得到逐字节相同的输出。
 */
public final class CrateJson {

    private static final Gson GSON = builder().create();

    private CrateJson() {
    }

    public static Gson gson() {
        return GSON;
    }

    public static GsonBuilder builder() {
        return new GsonBuilder()
                .serializeNulls()
                .disableHtmlEscaping()
                .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
                .registerTypeHierarchyAdapter(Tagged.class, new TaggedSerializer())
                .registerTypeHierarchyAdapter(IndexId.class, new IdSerializer())
                .registerTypeHierarchyAdapter(IdVector.class, new IdVectorSerializer())
                .registerTypeHierarchyAdapter(Name.class, new NameSerializer())
                .registerTypeHierarchyAdapter(SwitchCase.class, new SwitchCaseSerializer())
                .registerTypeHierarchyAdapter(FileEntry.class, new FileEntrySerializer());
    }

    private static final class TaggedSerializer implements JsonSerializer<Tagged> {
        @Override
        public JsonElement serialize(Tagged src, Type typeOfSrc, JsonSerializationContext context) {
            Object[] fields = src.fields();
            if (fields.length == 0) {
                return new JsonPrimitive(src.tag());
            }
            JsonObject obj = new JsonObject();
            if (fields.length == 1) {
                obj.add(src.tag(), context.serialize(fields[0]));
            } else {
                JsonArray arr = new JsonArray();
                for (Object field : fields) {
                    arr.add(context.serialize(field));
                }
                obj.add(src.tag(), arr);
            }
            return obj;
        }
    }

    private static final class IdSerializer implements JsonSerializer<IndexId<?>> {
        @Override
        public JsonElement serialize(IndexId<?> src, Type typeOfSrc, JsonSerializationContext context) {
            return new JsonPrimitive(src.getIndex());
        }
    }

    private static final class IdVectorSerializer implements JsonSerializer<IdVector<?, ?>> {
        @Override
        public JsonElement serialize(IdVector<?, ?> src, Type typeOfSrc, JsonSerializationContext context) {
            JsonArray arr = new JsonArray();
            for (Object value : src.values()) {
                arr.add(context.serialize(value));
            }
            return arr;
        }
    }

    private static final class NameSerializer implements JsonSerializer<Name> {
        @Override
        public JsonElement serialize(Name src, Type typeOfSrc, JsonSerializationContext context) {
            JsonArray arr = new JsonArray();
            for (PathElem elem : src.getElems()) {
                arr.add(context.serialize(elem));
            }
            return arr;
        }
    }

    /** 分支导出为 {@code [values, body]} */
    private static final class SwitchCaseSerializer implements JsonSerializer<SwitchCase<?>> {
        @Override
        public JsonElement serialize(SwitchCase<?> src, Type typeOfSrc, JsonSerializationContext context) {
            JsonArray values = new JsonArray();
            for (Object value : src.getValues()) {
                values.add(context.serialize(value));
            }
            JsonArray arr = new JsonArray();
            arr.add(values);
            arr.add(context.serialize(src.getBody()));
            return arr;
        }
    }

    private static final class FileEntrySerializer implements JsonSerializer<FileEntry> {
        @Override
        public JsonElement serialize(FileEntry src, Type typeOfSrc, JsonSerializationContext context) {
            JsonArray arr = new JsonArray();
            arr.add(src.getId().getIndex());
            arr.add(context.serialize(src.getName()));
            return arr;
        }
    }
}
