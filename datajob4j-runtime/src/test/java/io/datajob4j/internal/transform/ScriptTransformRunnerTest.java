package io.datajob4j.internal.transform;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.datajob4j.config.DataJobProperties;
import io.datajob4j.core.Dataset;
import io.datajob4j.core.TransformException;
import io.datajob4j.core.TransformOutputException;
import io.datajob4j.core.TransformTimeoutException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScriptTransformRunnerTest {

    private static final Dataset SALES = Dataset.of(
            List.of("region", "amount"),
            List.of(
                    List.of("north", 10L),
                    List.of("south", 5L),
                    List.of("north", 2.5)
            ));

    private static ScriptTransformRunner runner;

    @BeforeAll
    static void setUp() {
        runner = new ScriptTransformRunner(new DataJobProperties(), new ObjectMapper());
    }

    @AfterAll
    static void tearDown() {
        runner.close();
    }

    @Test
    void identityScriptShouldReturnInput() throws Exception {
        assertEquals(SALES, runner.run("output = input;", SALES));
    }

    @Test
    void unsetOutputShouldFallBackToMutatedInput() throws Exception {
        Dataset out = runner.run("input.forEach(function (r) { r.amount = r.amount * 2; });", SALES);

        assertEquals(List.of(20L, 10L, 5L), List.of(out.get(0, "amount"), out.get(1, "amount"), out.get(2, "amount")));
        assertEquals(10L, SALES.get(0, "amount"));
    }

    @Test
    void helpersShouldAggregateRows() throws Exception {
        String code = String.join("\n",
                "var g = groupBy(input, 'region');",
                "output = Object.keys(g).map(function (k) {",
                "  return {region: k, total: round(sum(g[k], 'amount'), 1), n: g[k].length};",
                "});");

        Dataset out = runner.run(code, SALES);

        assertEquals(List.of("region", "total", "n"), out.columns());
        assertEquals(2, out.rowCount());
        assertEquals("north", out.get(0, "region"));
        assertEquals(12.5, out.get(0, "total"));
        assertEquals(2L, out.get(0, "n"));
        assertEquals(5L, out.get(1, "total"));
    }

    @Test
    void tableHelperShouldKeepColumnsWithoutRows() throws Exception {
        Dataset out = runner.run("output = table(['region', 'amount'], input.filter(function (r) { return r.amount > 100; }));", SALES);

        assertEquals(List.of("region", "amount"), out.columns());
        assertEquals(0, out.rowCount());
    }

    @Test
    void emptyRowArrayShouldKeepInputColumns() throws Exception {
        Dataset out = runner.run("output = [];", SALES);

        assertTrue(out.isEmpty());
        assertEquals(List.of("region", "amount"), out.columns());
    }

    @Test
    void headerOnlyInputShouldKeepColumns() throws Exception {
        Dataset headerOnly = Dataset.of(List.of("a", "b"), List.of());

        assertEquals(headerOnly, runner.run("output = input;", headerOnly));
        assertEquals(headerOnly, runner.run("var seen = input.length;", headerOnly));
        assertEquals(List.of("a", "b"),
                runner.run("output = input.filter(function (r) { return r.a > 1; });", headerOnly).columns());
    }

    @Test
    void filteringEveryRowOutShouldKeepColumns() throws Exception {
        Dataset out = runner.run("output = input.filter(function (r) { return r.amount > 100; });", SALES);

        assertEquals(List.of("region", "amount"), out.columns());
        assertEquals(0, out.rowCount());
    }

    @Test
    void identityShouldKeepWholeDoublesAndLargeIntegers() throws Exception {
        Dataset in = Dataset.of(List.of("price", "id"), List.of(
                List.of(2.0, 9007199254740993L),
                List.of(3.5, -9223372036854775807L)));

        Dataset out = runner.run("output = input;", in);

        assertEquals(in, out);
        assertEquals(Double.class, out.get(0, "price").getClass());
        assertEquals(9007199254740993L, out.get(0, "id"));
    }

    @Test
    void wholeDoubleColumnShouldStayDoubleAfterArithmetic() throws Exception {
        Dataset in = Dataset.of(List.of("price"), List.of(List.of(2.0), List.of(1.5)));

        Dataset out = runner.run("input.forEach(function (r) { r.price = r.price * 2; });", in);

        assertEquals(4.0, out.get(0, "price"));
        assertEquals(3.0, out.get(1, "price"));
    }

    @Test
    void largeIntegersShouldReachScriptsAsText() throws Exception {
        Dataset in = Dataset.of(List.of("id", "small"), List.of(List.of(9007199254740993L, 7L)));

        Dataset out = runner.run("output = [{id: typeof input[0].id, small: typeof input[0].small, text: input[0].id}];", in);

        assertEquals("string", out.get(0, "id"));
        assertEquals("number", out.get(0, "small"));
        assertEquals("9007199254740993", out.get(0, "text"));
    }

    @Test
    void nestedValuesShouldBeCarriedAsJsonText() throws Exception {
        Dataset out = runner.run("output = [{id: 1, tags: ['a', 'b'], meta: {k: 1}}];", SALES);

        assertEquals("[\"a\",\"b\"]", out.get(0, "tags"));
        assertEquals("{\"k\":1}", out.get(0, "meta"));
    }

    @Test
    void nonTabularOutputShouldBeRejectedWithItsType() {
        assertEquals("string", outputTypeOf("output = 'hello';"));
        assertEquals("number", outputTypeOf("output = 42;"));
        assertEquals("function", outputTypeOf("output = function () {};"));
        assertEquals("object", outputTypeOf("output = {a: 1};"));
        assertEquals("array of number", outputTypeOf("output = [1, 2];"));
    }

    private String outputTypeOf(String code) {
        TransformOutputException e = assertThrows(TransformOutputException.class, () -> runner.run(code, SALES));
        assertTrue(e.getMessage().startsWith("Script output must be a table"), e.getMessage());
        return e.producedType();
    }

    @Test
    void scriptErrorShouldBeWrapped() {
        TransformException e = assertThrows(TransformException.class,
                () -> runner.run("throw new TypeError('bad row');", SALES));

        assertTrue(e.getMessage().startsWith("Script execution failed: "), e.getMessage());
        assertTrue(e.getMessage().contains("bad row"), e.getMessage());
    }

    @Test
    void blankScriptShouldBeRejected() {
        TransformException e = assertThrows(TransformException.class, () -> runner.run("  \n", SALES));
        assertEquals("Script content cannot be empty", e.getMessage());
    }

    @Test
    void missingInputShouldBeRejected() {
        TransformException e = assertThrows(TransformException.class, () -> runner.run("output = input;", null));
        assertEquals("Input dataset is missing", e.getMessage());
    }

    @Test
    void hostAccessShouldBeUnavailable() throws Exception {
        Dataset out = runner.run(
                "output = [{java: typeof Java, load: typeof load, packages: typeof Packages}];", SALES);

        assertEquals("undefined", out.get(0, "java"));
        assertEquals("undefined", out.get(0, "load"));
        assertEquals("undefined", out.get(0, "packages"));
    }

    @Test
    void scriptsShouldNotShareState() throws Exception {
        runner.run("var leaked = 1; output = input;", SALES);

        Dataset out = runner.run("output = [{seen: typeof leaked}];", SALES);
        assertEquals("undefined", out.get(0, "seen"));
    }

    @Test
    void runawayScriptShouldTimeOut() {
        String busy = "var end = Date.now() + 5000; while (Date.now() < end) {} output = input;";

        long startedAt = System.nanoTime();
        TransformTimeoutException e = assertThrows(TransformTimeoutException.class,
                () -> runner.run(busy, SALES, Duration.ofSeconds(1)));
        long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

        assertEquals("Script execution timed out after 1000 ms", e.getMessage());
        assertTrue(tookMs < 3000, "timeout took " + tookMs + " ms");
    }

    @Test
    void nonPositiveTimeoutShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> runner.run("output = input;", SALES, Duration.ZERO));
    }
}
