package com.logquery;

import com.logquery.query.QueryEngine;
import com.logquery.query.QueryNode;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.TimeUnit;

/**
 * 查询管线基准测试：解析、ClickHouse 谓词编译、Lucene 查询编译
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms512m", "-Xmx512m"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class QueryPipelineBenchmark {

    @Param({
        "user:alice",
        "type:sql AND duration:>500 NOT status:false",
        "(form:HPD* OR queue:Admin) timestamp:2026-02-10T10:00:00+05:00 \"connection reset\""
    })
    public String query;

    private QueryEngine engine;
    private QueryNode parsed;

    @Setup
    public void setup() {
        engine = new QueryEngine();
        parsed = engine.parse(query);
    }

    @Benchmark
    public QueryNode parse() {
        return engine.parse(query);
    }

    @Benchmark
    public void compileBoth(Blackhole blackhole) {
        blackhole.consume(engine.toPredicate(parsed));
        blackhole.consume(engine.toIndexQuery(parsed));
    }

    @Benchmark
    public void fullPipeline(Blackhole blackhole) {
        QueryNode ast = engine.parse(query);
        blackhole.consume(engine.toPredicate(ast));
        blackhole.consume(engine.toIndexQuery(ast));
    }

    public static void main(String[] args) throws RunnerException {
        Options options = new OptionsBuilder()
            .include(QueryPipelineBenchmark.class.getSimpleName())
            .build();
        new Runner(options).run();
    }
}
