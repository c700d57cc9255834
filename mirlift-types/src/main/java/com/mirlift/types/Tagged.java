package com.mirlift.types;

/**
 * 封闭和类型（sum type）的变体。
 * 导出时按变体名编码：无字段 → "Tag"，单字段 → {"Tag": v}，多字段 → {"Tag": [v...]}。
 */
public interface Tagged {

    /** 变体名 */
    String tag();

    /** 变体字段，按声明顺序 */
    Object[] fields();
}
