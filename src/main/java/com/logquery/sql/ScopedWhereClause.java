package com.logquery.sql;

import com.logquery.config.Constants;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 租户/作业范围限定的 WHERE 子句：tenant_id = @tenantID AND job_id = @jobID [AND (kql)]。
 * 所有取值都以命名参数传递，KQL 参数命名为 @kql_0..@kql_N。
 */
public record ScopedWhereClause(String where, Map<String, String> params) {

    public ScopedWhereClause {
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    /**
     * 组合范围条件与 KQL 谓词；kqlPredicate 为 null 时只保留范围条件。
     */
    public static ScopedWhereClause of(String tenantId, String jobId, SqlPredicate kqlPredicate) {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(jobId, "jobId");

        StringBuilder where = new StringBuilder()
                .append(Constants.TENANT_COLUMN).append(" = @tenantID AND ")
                .append(Constants.JOB_COLUMN).append(" = @jobID");
        Map<String, String> params = new LinkedHashMap<>();
        params.put("tenantID", tenantId);
        params.put("jobID", jobId);

        if (kqlPredicate != null) {
            SqlPredicate.NamedPredicate named = kqlPredicate.toNamed(Constants.NAMED_PARAM_PREFIX);
            where.append(" AND (").append(named.fragment()).append(')');
            params.putAll(named.params());
        }
        return new ScopedWhereClause(where.toString(), params);
    }
}
