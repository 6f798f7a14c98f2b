package com.termindex.config;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * 全局常量定义
 * 
 * 包含查询参数、语料读取参数与位置查找的哨兵值
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 索引参数 ====================
    /** 词项不存在时 positionOf 的返回值 */
    public static final int NOT_FOUND = -1;

    // ==================== 查询参数 ====================
    /** 单个查询词的最大长度 */
    public static final int MAX_QUERY_LENGTH = 256;
    /** 单次命令允许的最大查询词数量 */
    public static final int MAX_QUERY_TERMS = 100;

    // ==================== 语料参数 ====================
    /** 文档文件默认编码 */
    public static final Charset DEFAULT_DOCUMENT_CHARSET = StandardCharsets.UTF_8;
    /** 单次命令允许读取的最大文档数 */
    public static final int MAX_DOCUMENTS = 100_000;
}
