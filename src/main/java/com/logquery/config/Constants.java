package com.logquery.config;

/**
 * 全局常量定义
 *
 * 包含列名、查询长度上限、SQL 片段与命名参数前缀
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 列与索引字段 ====================
    /** 原始日志文本列，全文叶子在结构化存储中匹配此列 */
    public static final String RAW_TEXT_COLUMN = "raw_text";
    /** 全文索引中无字段全文查询的默认字段 */
    public static final String FULL_TEXT_FIELD = "raw_text";
    /** 租户列 */
    public static final String TENANT_COLUMN = "tenant_id";
    /** 作业列 */
    public static final String JOB_COLUMN = "job_id";

    // ==================== 查询参数 ====================
    /** 单条查询最大字符数 */
    public static final int MAX_QUERY_LENGTH = 4096;
    /** 括号分组与 NOT 的最大嵌套层数 */
    public static final int MAX_NESTING_DEPTH = 256;
    /** 单独出现时等价于空查询的通配查询 */
    public static final String MATCH_ALL_QUERY = "*";

    // ==================== SQL 参数 ====================
    /** 空查询对应的恒真谓词 */
    public static final String SQL_TRUE_FRAGMENT = "1=1";
    /** 位置占位符 */
    public static final char SQL_PLACEHOLDER = '?';
    /** KQL 命名参数前缀 */
    public static final String NAMED_PARAM_PREFIX = "kql_";
    /** LIKE/ILIKE 转义字符 */
    public static final char LIKE_ESCAPE = '\\';
}
