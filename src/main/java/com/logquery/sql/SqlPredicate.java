package com.logquery.sql;

import com.logquery.config.Constants;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 带位置占位符的谓词片段与按占位符顺序排列的绑定值。
 */
public record SqlPredicate(String fragment, List<String> params) {

    public SqlPredicate {
        params = List.copyOf(params);
    }

    public static SqlPredicate matchAll() {
        return new SqlPredicate(Constants.SQL_TRUE_FRAGMENT, List.of());
    }

    /**
     * 将 ? 占位符按顺序改写为 @prefixN 命名参数；反引号标识符内的字符不参与改写。
     */
    public NamedPredicate toNamed(String prefix) {
        StringBuilder converted = new StringBuilder(fragment.length() + params.size() * 6);
        Map<String, String> named = new LinkedHashMap<>();
        int paramIndex = 0;
        boolean inIdentifier = false;
        for (int i = 0; i < fragment.length(); i++) {
            char ch = fragment.charAt(i);
            if (inIdentifier) {
                converted.append(ch);
                if (ch == '\\' && i + 1 < fragment.length()) {
                    converted.append(fragment.charAt(++i));
                } else if (ch == '`') {
                    inIdentifier = false;
                }
                continue;
            }
            if (ch == '`') {
                inIdentifier = true;
                converted.append(ch);
                continue;
            }
            if (ch == Constants.SQL_PLACEHOLDER && paramIndex < params.size()) {
                String name = prefix + paramIndex;
                converted.append('@').append(name);
                named.put(name, params.get(paramIndex));
                paramIndex++;
                continue;
            }
            converted.append(ch);
        }
        return new NamedPredicate(converted.toString(), named);
    }

    /**
     * 使用命名参数的谓词片段，参数按出现顺序排列。
     */
    public record NamedPredicate(String fragment, Map<String, String> params) {
        public NamedPredicate {
            params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        }
    }
}
