package com.logquery.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logquery.config.Constants;
import com.logquery.config.EngineConfig;
import com.logquery.query.QueryEngine;
import com.logquery.query.QueryNode;
import com.logquery.query.QueryParseException;
import com.logquery.sql.ScopedWhereClause;
import com.logquery.sql.SqlPredicate;
import com.logquery.suggest.FieldSuggester;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "lqe",
    description = "🔍 日志 KQL 过滤查询编译器",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.ParseSubcommand.class,
        MainCommand.SqlSubcommand.class,
        MainCommand.LuceneSubcommand.class,
        MainCommand.FieldsSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--max-length"}, description = "查询最大字符数", defaultValue = "4096")
    private int maxLength;

    @Option(names = {"--raw-text-column"}, description = "全文匹配使用的原始文本列", defaultValue = Constants.RAW_TEXT_COLUMN)
    private String rawTextColumn;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔍 日志 KQL 过滤查询编译器");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    QueryEngine createEngine() {
        EngineConfig config = EngineConfig.defaults();
        if (maxLength > 0) {
            config.setMaxQueryLength(maxLength);
        } else {
            System.err.printf("⚠️ 非法查询长度上限 %d，已回退为默认值 %d%n", maxLength, Constants.MAX_QUERY_LENGTH);
        }
        if (rawTextColumn != null && !rawTextColumn.isBlank()) {
            config.setRawTextColumn(rawTextColumn);
        }
        return new QueryEngine(config);
    }

    static int reportInvalidQuery(QueryParseException exception) {
        System.err.println("❌ 查询语法错误: " + exception.getMessage());
        System.err.println("💡 " + exception.getSuggestion());
        return 1;
    }

    @Command(name = "parse", description = "🌳 输出查询树（JSON）")
    static class ParseSubcommand implements Callable<Integer> {

        @Parameters(description = "KQL 查询语句", arity = "1")
        private String query;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() throws JsonProcessingException {
            try {
                QueryNode ast = main.createEngine().parse(query);
                System.out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(ast));
                return 0;
            } catch (QueryParseException exception) {
                return reportInvalidQuery(exception);
            }
        }
    }

    @Command(name = "sql", description = "🗄️ 编译为 ClickHouse WHERE 片段")
    static class SqlSubcommand implements Callable<Integer> {

        @Parameters(description = "KQL 查询语句", arity = "1")
        private String query;

        @Option(names = {"--tenant"}, description = "租户 ID，与 --job 一起使用时输出带范围的子句")
        private String tenantId;

        @Option(names = {"--job"}, description = "作业 ID")
        private String jobId;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() throws JsonProcessingException {
            if ((tenantId == null) != (jobId == null)) {
                System.err.println("❌ --tenant 与 --job 需要同时指定");
                return 1;
            }
            try {
                QueryEngine engine = main.createEngine();
                if (tenantId != null) {
                    ScopedWhereClause clause = engine.toScopedWhere(tenantId, jobId, query);
                    print(clause.where(), clause.params());
                } else {
                    SqlPredicate predicate = engine.toPredicate(query);
                    print(predicate.fragment(), predicate.params());
                }
                return 0;
            } catch (QueryParseException exception) {
                return reportInvalidQuery(exception);
            }
        }

        private void print(String fragment, Object params) throws JsonProcessingException {
            if ("json".equalsIgnoreCase(format)) {
                Map<String, Object> output = new LinkedHashMap<>();
                output.put("where", fragment);
                output.put("params", params);
                System.out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(output));
                return;
            }
            System.out.println(fragment);
            System.out.println("📎 参数: " + params);
        }
    }

    @Command(name = "lucene", description = "🔎 编译为 Lucene 查询")
    static class LuceneSubcommand implements Callable<Integer> {

        @Parameters(description = "KQL 查询语句", arity = "1")
        private String query;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                System.out.println(main.createEngine().toIndexQuery(query));
                return 0;
            } catch (QueryParseException exception) {
                return reportInvalidQuery(exception);
            }
        }
    }

    @Command(name = "fields", description = "📋 列出可查询字段")
    static class FieldsSubcommand implements Callable<Integer> {

        @Parameters(description = "字段名前缀", arity = "0..1")
        private String prefix;

        @Override
        public Integer call() {
            List<FieldSuggester.FieldSuggestion> suggestions = new FieldSuggester().suggest(prefix);
            if (suggestions.isEmpty()) {
                System.out.println("⚠️ 没有匹配的字段");
                return 0;
            }
            for (FieldSuggester.FieldSuggestion suggestion : suggestions) {
                System.out.printf("%-18s %s%n", suggestion.name(), suggestion.description());
            }
            return 0;
        }
    }
}
