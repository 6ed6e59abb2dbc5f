package io.datajob4j.internal.fetch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.exceptions.CsvException;
import io.datajob4j.config.DataJobProperties;
import io.datajob4j.core.ApiSource;
import io.datajob4j.core.DataSource;
import io.datajob4j.core.Dataset;
import io.datajob4j.core.FetchException;
import io.datajob4j.core.FileSource;
import io.datajob4j.internal.DatasetJson;
import io.datajob4j.internal.format.CsvTables;
import io.datajob4j.pipeline.DataFetcher;
import io.datajob4j.utils.CellValues;
import org.apache.http.HttpEntity;
import org.apache.http.HttpHeaders;
import org.apache.http.StatusLine;
import org.apache.http.client.HttpResponseException;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Reads datasets from local CSV/JSON files and from JSON HTTP APIs.
 *
 * <p>API fetches are retried on timeouts, transport errors, error statuses and unparsable bodies: attempt
 * {@code n} (from 0) waits {@code fetchBackoffUnit * 2^n} first, so 2s then 4s with the defaults. A body that
 * parses but has an unsupported shape fails at once. File fetches are never retried.
 */
public class DefaultDataFetcher implements DataFetcher, Closeable {
    private static final Logger log = LoggerFactory.getLogger(DefaultDataFetcher.class);

    private final DataJobProperties props;
    private final ObjectMapper objectMapper;
    private final CloseableHttpClient httpClient;

    public DefaultDataFetcher(DataJobProperties props, ObjectMapper objectMapper) {
        this(props, objectMapper, createClient(props.getFetchTimeout()));
    }

    public DefaultDataFetcher(DataJobProperties props, ObjectMapper objectMapper, CloseableHttpClient httpClient) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
    }

    static CloseableHttpClient createClient(Duration timeout) {
        int ms = Math.toIntExact(Objects.requireNonNull(timeout, "timeout must not be null").toMillis());
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(ms)
                .setConnectionRequestTimeout(ms)
                .setSocketTimeout(ms)
                .build();
        return HttpClientBuilder.create()
                .disableCookieManagement()
                .disableAutomaticRetries()
                .useSystemProperties()
                .setDefaultRequestConfig(requestConfig)
                .build();
    }

    @Override
    public Dataset fetch(DataSource source) throws FetchException {
        Objects.requireNonNull(source, "source must not be null");
        if (source instanceof FileSource file) {
            return fetchFile(file);
        }
        if (source instanceof ApiSource api) {
            return fetchApi(api);
        }
        throw new FetchException("Unsupported source type: " + source.getClass().getSimpleName());
    }

    private Dataset fetchFile(FileSource source) throws FetchException {
        log.info("datajob reading file path={} format={}", source.path(), source.format().value());
        Path path = Path.of(source.path());

        if (!Files.exists(path)) {
            throw new FetchException("File not found: " + source.path());
        }
        if (!Files.isRegularFile(path)) {
            throw new FetchException("Path is not a file: " + source.path());
        }

        Dataset dataset;
        try {
            if (Files.size(path) == 0) {
                throw new FetchException("File is empty: " + source.path());
            }
            dataset = switch (source.format()) {
                case CSV -> readCsv(path);
                case JSON -> readJson(path);
            };
        } catch (IOException | CsvException | IllegalArgumentException e) {
            throw new FetchException("Error parsing " + source.format().value() + " file " + source.path()
                    + ": " + e.getMessage(), e);
        }

        if (dataset == null) {
            throw new FetchException("File is empty: " + source.path());
        }
        log.info("datajob read {} row(s) from file path={}", dataset.rowCount(), source.path());
        return dataset;
    }

    private Dataset readCsv(Path path) throws IOException, CsvException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Dataset ds = CsvTables.read(reader, CellValues::parse, true);
            return ds.columnCount() == 0 ? null : ds;
        }
    }

    private Dataset readJson(Path path) throws IOException {
        JsonNode node = objectMapper.readTree(path.toFile());
        if (node == null || node.isMissingNode()) {
            return null;
        }
        return DatasetJson.fromJson(node);
    }

    private Dataset fetchApi(ApiSource source) throws FetchException {
        String url = source.url();
        int maxAttempts = props.getFetchMaxAttempts();
        Exception lastError = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (attempt > 0) {
                Duration wait = backoff(attempt);
                log.info("datajob retrying fetch in {} url={}", wait, url);
                try {
                    Thread.sleep(wait.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new FetchException("Interrupted while fetching data from API " + url, e);
                }
            }

            log.info("datajob fetching url={} attempt={}/{}", url, attempt + 1, maxAttempts);
            JsonNode body;
            try {
                body = get(url);
            } catch (IOException e) {
                lastError = e;
                log.warn("datajob fetch attempt failed url={} attempt={}/{} msg={}", url, attempt + 1, maxAttempts, describe(e));
                continue;
            }

            try {
                Dataset dataset = DatasetJson.fromJson(body);
                log.info("datajob fetched {} row(s) from url={}", dataset.rowCount(), url);
                return dataset;
            } catch (IllegalArgumentException e) {
                throw new FetchException("Unexpected data format from API " + url + ": " + e.getMessage(), e);
            }
        }

        String msg = "Failed to fetch data from API " + url + " after " + maxAttempts
                + " attempts. Last error: " + describe(lastError);
        log.error("datajob {}", msg);
        throw new FetchException(msg, lastError);
    }

    private JsonNode get(String url) throws IOException {
        HttpGet request = new HttpGet(url);
        request.setHeader(HttpHeaders.ACCEPT, "application/json");
        try (CloseableHttpResponse response = httpClient.execute(request)) {
            StatusLine status = response.getStatusLine();
            HttpEntity entity = response.getEntity();
            if (status.getStatusCode() >= 400) {
                EntityUtils.consumeQuietly(entity);
                throw new HttpResponseException(status.getStatusCode(),
                        "HTTP " + status.getStatusCode() + " " + status.getReasonPhrase());
            }
            if (entity == null) {
                throw new IOException("empty response body");
            }
            String text = EntityUtils.toString(entity, StandardCharsets.UTF_8);
            if (text.isBlank()) {
                throw new IOException("empty response body");
            }
            return objectMapper.readTree(text);
        }
    }

    private Duration backoff(int attempt) {
        int exp = Math.min(attempt, 10);
        return props.getFetchBackoffUnit().multipliedBy(1L << exp);
    }

    private static String describe(Exception e) {
        if (e == null) {
            return "none";
        }
        String msg = e.getMessage();
        return e.getClass().getSimpleName() + (msg == null ? "" : ": " + msg);
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
