package com.logquery.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;
import picocli.CommandLine.ParseResult;

class MainCommandTest {

    private final ByteArrayOutputStream outBuffer = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuffer = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void redirectStreams() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(outBuffer, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(errBuffer, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void testCallWithoutSubcommand() {
        assertEquals(0, new MainCommand().call());
    }

    @Test
    void testHelpOptionReturnsZero() {
        assertEquals(0, execute("--help"));
    }

    @Test
    void testParseGlobalOptionsAndSubcommand() {
        CommandLine commandLine = new CommandLine(new MainCommand());
        ParseResult parseResult = commandLine.parseArgs("--max-length", "64", "sql", "user:alice");

        assertNotNull(parseResult.subcommand());
        assertEquals("sql", parseResult.subcommand().commandSpec().name());
    }

    @Test
    void testParsePrintsTreeAsJson() {
        assertEquals(0, execute("parse", "type:API AND duration:>500"));

        String output = out();
        assertTrue(output.contains("\"bool_op\" : \"AND\""));
        assertTrue(output.contains("\"field\" : \"duration\""));
        assertTrue(output.contains("\"op\" : \"gt\""));
    }

    @Test
    void testParseEmptyQueryPrintsNull() {
        assertEquals(0, execute("parse", "  "));

        assertEquals("null", out().trim());
    }

    @Test
    void testSqlText() {
        assertEquals(0, execute("sql", "user:alice"));

        String output = out();
        assertTrue(output.contains("user = ?"));
        assertTrue(output.contains("[alice]"));
    }

    @Test
    void testSqlScopedJson() {
        assertEquals(0, execute("sql", "--tenant", "t1", "--job", "j1", "-f", "json", "duration:>=10"));

        String output = out();
        assertTrue(output.contains("tenant_id = @tenantID AND job_id = @jobID AND (duration_ms >= @kql_0)"));
        assertTrue(output.contains("\"kql_0\" : \"10\""));
    }

    @Test
    void testSqlScopeNeedsBothIds() {
        assertEquals(1, execute("sql", "--tenant", "t1", "user:alice"));

        assertTrue(err().contains("--job"));
    }

    @Test
    void testLucene() {
        assertEquals(0, execute("lucene", "NOT status:fail"));

        String output = out();
        assertTrue(output.contains("-success:fail"));
        assertTrue(output.contains("+*:*"));
    }

    @Test
    void testInvalidQueryReturnsOne() {
        assertEquals(1, execute("sql", "user:"));

        assertTrue(err().contains("查询语法错误"));
    }

    @Test
    void testQueryTooLongReturnsOne() {
        assertEquals(1, execute("--max-length", "5", "parse", "user:alice"));
    }

    @Test
    void testDeeplyNestedQueryReturnsOne() {
        String query = "(".repeat(2000) + "a" + ")".repeat(2000);

        assertEquals(1, execute("lucene", query));
        assertTrue(err().contains("嵌套"));
    }

    @Test
    void testFields() {
        assertEquals(0, execute("fields", "dur"));

        assertTrue(out().contains("duration_ms"));
    }

    @Test
    void testFieldsWithoutMatch() {
        assertEquals(0, execute("fields", "zzz"));

        assertTrue(out().contains("没有匹配的字段"));
    }

    @Test
    void testUnknownSubcommandIsUsageError() {
        assertEquals(2, execute("explode"));
    }

    private int execute(String... args) {
        return new CommandLine(new MainCommand()).execute(args);
    }

    private String out() {
        return outBuffer.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBuffer.toString(StandardCharsets.UTF_8);
    }
}
