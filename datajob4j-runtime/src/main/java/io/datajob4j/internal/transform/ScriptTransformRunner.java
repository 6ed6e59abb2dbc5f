package io.datajob4j.internal.transform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.datajob4j.config.DataJobProperties;
import io.datajob4j.core.Dataset;
import io.datajob4j.core.TransformException;
import io.datajob4j.core.TransformOutputException;
import io.datajob4j.core.TransformTimeoutException;
import io.datajob4j.internal.DatasetJson;
import io.datajob4j.pipeline.TransformRunner;
import org.openjdk.nashorn.api.scripting.NashornScriptEngineFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.script.ScriptEngine;
import javax.script.ScriptException;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs JavaScript transformations on an embedded Nashorn engine.
 *
 * <p>Each run gets a fresh engine started with {@code --no-java} and a class filter that exposes no host class,
 * so scripts see only ECMAScript built-ins and the helpers from {@code prelude.js}. The dataset crosses the
 * boundary as JSON: the script reads a private copy as {@code input} (array of row objects) and leaves its result
 * in {@code output}, falling back to {@code input} when {@code output} is unset. An empty row array keeps the
 * input's columns. Integers beyond 2^53 reach the script as decimal strings, and columns that kept their name come
 * back with the numeric kind they had on input (see {@code ColumnKinds}).
 *
 * <p>Timeouts abandon the script rather than stop it. The engine thread is a daemon that keeps running until the
 * script returns on its own, so a script that never ends holds one thread and its heap for the life of the
 * process. Nashorn offers no safe way to halt a running script.
 */
public class ScriptTransformRunner implements TransformRunner, Closeable {
    private static final Logger log = LoggerFactory.getLogger(ScriptTransformRunner.class);

    private static final String[] ENGINE_ARGS = {"--no-java", "--no-syntax-extensions", "--language=es6"};
    private static final String BIND_INPUT = "var input = JSON.parse(__input); var output; __input = undefined;";
    private static final String DESCRIBE_RESULT =
            "__describe((typeof output === 'undefined' || output === null) ? input : output, JSON.parse(__columns))";

    private final DataJobProperties props;
    private final ObjectMapper objectMapper;
    private final NashornScriptEngineFactory engineFactory = new NashornScriptEngineFactory();
    private final String prelude;

    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r);
        t.setName("datajob.transform");
        t.setDaemon(true);
        return t;
    });

    public ScriptTransformRunner(DataJobProperties props, ObjectMapper objectMapper) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.prelude = loadPrelude();
    }

    @Override
    public Dataset run(String code, Dataset input) throws TransformException {
        return run(code, input, props.getTransformTimeout());
    }

    @Override
    public Dataset run(String code, Dataset input, Duration timeout) throws TransformException {
        if (input == null) {
            throw new TransformException("Input dataset is missing");
        }
        if (code == null || code.isBlank()) {
            throw new TransformException("Script content cannot be empty");
        }
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be a positive duration");
        }

        String inputJson;
        String columnsJson;
        try {
            inputJson = objectMapper.writeValueAsString(ColumnKinds.toScriptJson(input, objectMapper));
            columnsJson = objectMapper.writeValueAsString(input.columns());
        } catch (JsonProcessingException e) {
            throw new TransformException("Input dataset could not be serialized: " + e.getOriginalMessage(), e);
        }

        log.debug("datajob transform starting rows={} timeout={}", input.rowCount(), timeout);
        Future<String> future = executor.submit(() -> evaluate(code, inputJson, columnsJson));

        String described;
        try {
            described = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(false);
            log.warn("datajob transform timed out after {}, script abandoned on its thread", timeout);
            throw new TransformTimeoutException(timeout);
        } catch (InterruptedException e) {
            future.cancel(false);
            Thread.currentThread().interrupt();
            throw new TransformException("Interrupted while waiting for script execution", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new TransformException("Script execution failed: " + cause.getClass().getSimpleName()
                    + ": " + cause.getMessage(), cause);
        }

        Dataset output = ColumnKinds.of(input).restore(toDataset(described));
        if (output.isEmpty()) {
            log.warn("datajob transform produced an empty result");
        }
        log.debug("datajob transform finished rows={} columns={}", output.rowCount(), output.columns());
        return output;
    }

    private String evaluate(String code, String inputJson, String columnsJson) throws ScriptException {
        ScriptEngine engine = engineFactory.getScriptEngine(
                ENGINE_ARGS,
                ScriptTransformRunner.class.getClassLoader(),
                className -> false
        );
        engine.put("__input", inputJson);
        engine.eval(prelude);
        engine.eval(BIND_INPUT);
        engine.eval(code);
        engine.put("__columns", columnsJson);
        return String.valueOf(engine.eval(DESCRIBE_RESULT));
    }

    private Dataset toDataset(String described) throws TransformException {
        JsonNode node;
        try {
            node = objectMapper.readTree(described);
        } catch (JsonProcessingException e) {
            throw new TransformException("Script output could not be read: " + e.getOriginalMessage(), e);
        }

        String kind = node.path("kind").asText();
        try {
            return switch (kind) {
                case "rows" -> DatasetJson.fromJson(node.get("rows"));
                case "table" -> DatasetJson.fromTable(node.get("columns"), node.get("rows"));
                default -> throw new TransformOutputException(node.path("type").asText("unknown"));
            };
        } catch (IllegalArgumentException e) {
            throw new TransformException("Script output is not a valid table: " + e.getMessage(), e);
        }
    }

    private static String loadPrelude() {
        try (InputStream in = ScriptTransformRunner.class.getResourceAsStream("prelude.js")) {
            if (in == null) {
                throw new IllegalStateException("prelude.js not found on the classpath");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("prelude.js could not be read", e);
        }
    }

    /**
     * Stops accepting work. Abandoned scripts keep their threads.
     */
    @Override
    public void close() {
        executor.shutdown();
    }
}
