package com.logquery.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.logquery.config.EngineConfig;
import com.logquery.query.FilterOp;
import com.logquery.query.QueryNode;
import com.logquery.query.QueryParser;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.lucene.document.DoublePoint;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.MatchNoDocsQuery;
import org.apache.lucene.search.PointRangeQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.WildcardQuery;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("LuceneQueryCompiler Tests")
class LuceneQueryCompilerTest {

    private final LuceneQueryCompiler compiler = new LuceneQueryCompiler(EngineConfig.defaults());

    @Test
    void testNullTreeMatchesEverything() {
        assertInstanceOf(MatchAllDocsQuery.class, compiler.toIndexQuery(null));
    }

    @Test
    void testFullTextIsAnalyzedMatchOnRawText() {
        TermQuery query = assertInstanceOf(TermQuery.class, compile("Timeout"));

        assertEquals("raw_text", query.getTerm().field());
        assertEquals("timeout", query.getTerm().text());
    }

    @Test
    void testMultiWordFullTextIsDisjunctionOfTerms() {
        BooleanQuery query = assertInstanceOf(BooleanQuery.class, compile("\"connection reset\""));

        assertEquals(2, clauses(query, BooleanClause.Occur.SHOULD).size());
    }

    @Test
    void testFullTextWithoutTermsMatchesNothing() {
        assertInstanceOf(MatchNoDocsQuery.class, compile("\"--\""));
    }

    @Test
    void testEqualityIsExactTerm() {
        TermQuery query = assertInstanceOf(TermQuery.class, compile("type:API"));

        assertEquals("log_type", query.getTerm().field());
        assertEquals("API", query.getTerm().text());
    }

    @Test
    void testEqualityOnNumericColumnIsExactPoint() {
        PointRangeQuery query = assertInstanceOf(PointRangeQuery.class, compile("duration:1000"));

        assertEquals("duration_ms", query.getField());
        assertEquals(1000.0, lower(query));
        assertEquals(1000.0, upper(query));
    }

    @Test
    void testNonNumericEqualityOnNumericColumnStaysTerm() {
        assertInstanceOf(TermQuery.class, compile("duration:slow"));
    }

    @Test
    void testNotEqualsIsEverythingExceptTerm() {
        Query query = compiler.toIndexQuery(new QueryNode.FieldFilter("user", FilterOp.NOT_EQUALS, "bob"));

        Query excluded = assertEverythingExcept(query);
        TermQuery term = assertInstanceOf(TermQuery.class, excluded);
        assertEquals("user", term.getTerm().field());
        assertEquals("bob", term.getTerm().text());
    }

    @Test
    void testWildcardValueIsUsedAsIs() {
        WildcardQuery query = assertInstanceOf(WildcardQuery.class, compile("form:HPD*Desk"));

        assertEquals("form", query.getTerm().field());
        assertEquals("HPD*Desk", query.getTerm().text());
    }

    @Test
    void testGreaterThanIsExclusiveLowerBound() {
        PointRangeQuery query = assertInstanceOf(PointRangeQuery.class, compile("duration:>500"));

        assertEquals("duration_ms", query.getField());
        assertEquals(DoublePoint.nextUp(500.0), lower(query));
        assertTrue(lower(query) > 500.0);
        assertEquals(Double.POSITIVE_INFINITY, upper(query));
    }

    @Test
    void testGreaterOrEqualIsInclusiveLowerBound() {
        PointRangeQuery query = assertInstanceOf(PointRangeQuery.class, compile("duration:>=500"));

        assertEquals(500.0, lower(query));
        assertEquals(Double.POSITIVE_INFINITY, upper(query));
    }

    @Test
    void testLessThanIsExclusiveUpperBound() {
        PointRangeQuery query = assertInstanceOf(PointRangeQuery.class, compile("duration:<2.5"));

        assertEquals(Double.NEGATIVE_INFINITY, lower(query));
        assertEquals(DoublePoint.nextDown(2.5), upper(query));
    }

    @Test
    void testLessOrEqualIsInclusiveUpperBound() {
        PointRangeQuery query = assertInstanceOf(PointRangeQuery.class, compile("duration:<=-1e3"));

        assertEquals(Double.NEGATIVE_INFINITY, lower(query));
        assertEquals(-1000.0, upper(query));
    }

    @Test
    void testRangeOnNonNumericColumnWithNumericValueIsStillNumeric() {
        PointRangeQuery query = assertInstanceOf(PointRangeQuery.class, compile("line_number:>10"));

        assertEquals("line_number", query.getField());
    }

    @ParameterizedTest
    @ValueSource(strings = {"duration:>abc", "duration:>1d", "duration:>NaN", "duration:>0x10"})
    void testNonNumericRangeFallsBackToFieldMatch(String query) {
        Query compiled = compile(query);

        assertFalse(compiled instanceof PointRangeQuery);
        TermQuery term = assertInstanceOf(TermQuery.class, compiled);
        assertEquals("duration_ms", term.getTerm().field());
    }

    @Test
    void testOutOfRangeNumberFallsBackToFieldMatch() {
        Query compiled = compile("duration:>1e400");

        assertFalse(compiled instanceof PointRangeQuery);
        TermQuery term = assertInstanceOf(TermQuery.class, compiled);
        assertEquals("duration_ms", term.getTerm().field());
    }

    @Test
    void testOverlyComplexWildcardFallsBackToFieldMatch() {
        Query compiled = compile("name:\"*a????????????????????*\"");

        assertFalse(compiled instanceof WildcardQuery);
        TermQuery term = assertInstanceOf(TermQuery.class, compiled);
        assertEquals("name", term.getTerm().field());
        assertEquals("a", term.getTerm().text());
    }

    @Test
    void testTimestampRangeFallsBackToMatchOnField() {
        Query compiled = compile("timestamp:>2026-02-10T10:00:00");

        assertFalse(compiled instanceof PointRangeQuery);
        assertTrue(compiled.toString().contains("timestamp:"));
    }

    @Test
    void testAndIsConjunction() {
        BooleanQuery query = assertInstanceOf(BooleanQuery.class, compile("type:sql AND error"));

        List<Query> must = clauses(query, BooleanClause.Occur.MUST);
        assertEquals(2, must.size());
        assertEquals(2, query.clauses().size());
    }

    @Test
    void testOrIsDisjunction() {
        BooleanQuery query = assertInstanceOf(BooleanQuery.class, compile("type:API OR type:SQL"));

        assertEquals(2, clauses(query, BooleanClause.Occur.SHOULD).size());
        assertEquals(2, query.clauses().size());
    }

    @Test
    void testNotIsEverythingExcept() {
        Query excluded = assertEverythingExcept(compile("NOT status:fail"));

        TermQuery term = assertInstanceOf(TermQuery.class, excluded);
        assertEquals("success", term.getTerm().field());
    }

    @Test
    void testNestedStructure() {
        BooleanQuery root = assertInstanceOf(BooleanQuery.class, compile("(a OR b) AND NOT c"));

        List<BooleanClause> rootClauses = root.clauses();
        assertEquals(BooleanClause.Occur.MUST, rootClauses.get(0).getOccur());
        BooleanQuery or = assertInstanceOf(BooleanQuery.class, rootClauses.get(0).getQuery());
        assertEquals(2, clauses(or, BooleanClause.Occur.SHOULD).size());
        assertEverythingExcept(rootClauses.get(1).getQuery());
    }

    @Test
    void testParseNumber() {
        assertEquals(500.0, LuceneQueryCompiler.parseNumber("500").getAsDouble());
        assertEquals(0.5, LuceneQueryCompiler.parseNumber(".5").getAsDouble());
        assertEquals(-3.0, LuceneQueryCompiler.parseNumber("-3.").getAsDouble());
        assertEquals(1200.0, LuceneQueryCompiler.parseNumber("+1.2E3").getAsDouble());
        assertTrue(LuceneQueryCompiler.parseNumber("Infinity").isEmpty());
        assertTrue(LuceneQueryCompiler.parseNumber("").isEmpty());
        assertTrue(LuceneQueryCompiler.parseNumber("1_000").isEmpty());
        assertTrue(LuceneQueryCompiler.parseNumber("-1e400").isEmpty());
    }

    private Query compile(String query) {
        return compiler.toIndexQuery(new QueryParser().parse(query).ast());
    }

    private static Query assertEverythingExcept(Query query) {
        BooleanQuery booleanQuery = assertInstanceOf(BooleanQuery.class, query);
        assertEquals(2, booleanQuery.clauses().size());
        List<Query> must = clauses(booleanQuery, BooleanClause.Occur.MUST);
        assertEquals(1, must.size());
        assertInstanceOf(MatchAllDocsQuery.class, must.get(0));
        List<Query> mustNot = clauses(booleanQuery, BooleanClause.Occur.MUST_NOT);
        assertEquals(1, mustNot.size());
        return mustNot.get(0);
    }

    private static List<Query> clauses(BooleanQuery query, BooleanClause.Occur occur) {
        return query.clauses().stream()
                .filter(clause -> clause.getOccur() == occur)
                .map(BooleanClause::getQuery)
                .collect(Collectors.toList());
    }

    private static double lower(PointRangeQuery query) {
        return DoublePoint.decodeDimension(query.getLowerPoint(), 0);
    }

    private static double upper(PointRangeQuery query) {
        return DoublePoint.decodeDimension(query.getUpperPoint(), 0);
    }
}
