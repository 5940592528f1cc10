package com.logquery.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 字段别名表：小写别名 -> 规范列名。
 *
 * 构造后只读，可在任意并发调用间共享；未登记的字段按原样作为列名透传
 */
public final class FieldAliasTable {
    private final Map<String, String> aliases;

    private FieldAliasTable(Map<String, String> aliases) {
        this.aliases = Map.copyOf(aliases);
    }

    /**
     * 由别名映射构造，别名统一转为小写。
     */
    public static FieldAliasTable of(Map<String, String> aliases) {
        Map<String, String> normalized = new LinkedHashMap<>();
        aliases.forEach((alias, column) -> normalized.put(alias.toLowerCase(Locale.ROOT), column));
        return new FieldAliasTable(normalized);
    }

    /**
     * 内置别名表
     */
    public static FieldAliasTable defaults() {
        Map<String, String> aliases = new LinkedHashMap<>();
        aliases.put("type", "log_type");
        aliases.put("log_type", "log_type");
        aliases.put("user", "user");
        aliases.put("form", "form");
        aliases.put("queue", "queue");
        aliases.put("thread", "thread_id");
        aliases.put("trace", "trace_id");
        aliases.put("rpc", "rpc_id");
        aliases.put("duration", "duration_ms");
        aliases.put("status", "success");
        aliases.put("api_code", "api_code");
        aliases.put("sql_table", "sql_table");
        aliases.put("filter", "filter_name");
        aliases.put("escalation", "esc_name");
        aliases.put("timestamp", "timestamp");
        aliases.put("error", "error_message");
        aliases.put("identifier", "api_code");
        return new FieldAliasTable(aliases);
    }

    /**
     * 不区分大小写地解析别名；未命中时原样返回字段名。
     */
    public String resolve(String field) {
        String column = aliases.get(field.toLowerCase(Locale.ROOT));
        return column != null ? column : field;
    }

    public boolean contains(String field) {
        return aliases.containsKey(field.toLowerCase(Locale.ROOT));
    }

    public Map<String, String> asMap() {
        return aliases;
    }
}
