package com.logquery.suggest;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 按名称前缀（不区分大小写）提示可查询字段。
 */
public class FieldSuggester {
    private static final List<FieldSuggestion> KNOWN_FIELDS = List.of(
            new FieldSuggestion("log_type", "Type of log entry (API, SQL, FLTR, ESCL)"),
            new FieldSuggestion("user", "User who initiated the operation"),
            new FieldSuggestion("queue", "AR System queue name"),
            new FieldSuggestion("thread_id", "Thread identifier"),
            new FieldSuggestion("trace_id", "Distributed tracing ID"),
            new FieldSuggestion("rpc_id", "RPC call identifier"),
            new FieldSuggestion("api_code", "AR API code"),
            new FieldSuggestion("form", "AR form name"),
            new FieldSuggestion("operation", "Operation type (GET, SET, CREATE, DELETE)"),
            new FieldSuggestion("request_id", "Request identifier"),
            new FieldSuggestion("sql_table", "SQL table name"),
            new FieldSuggestion("filter_name", "Filter name"),
            new FieldSuggestion("esc_name", "Escalation name"),
            new FieldSuggestion("esc_pool", "Escalation pool"),
            new FieldSuggestion("duration_ms", "Duration in milliseconds (numeric)"),
            new FieldSuggestion("success", "Operation success (true/false)"),
            new FieldSuggestion("error_encountered", "Error encountered (true/false)"));

    private final List<FieldSuggestion> fields;

    public FieldSuggester() {
        this(KNOWN_FIELDS);
    }

    public FieldSuggester(List<FieldSuggestion> fields) {
        this.fields = List.copyOf(fields);
    }

    /**
     * 返回名称以 prefix 开头的字段，保持登记顺序；空前缀返回全部。
     */
    public List<FieldSuggestion> suggest(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            return fields;
        }
        String lowerPrefix = prefix.toLowerCase(Locale.ROOT);
        List<FieldSuggestion> matches = new ArrayList<>();
        for (FieldSuggestion field : fields) {
            if (field.name().toLowerCase(Locale.ROOT).startsWith(lowerPrefix)) {
                matches.add(field);
            }
        }
        return matches;
    }

    public record FieldSuggestion(String name, String description) {
    }
}
