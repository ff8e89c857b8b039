package io.jobflow4j.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobflow4j.core.Command;
import io.jobflow4j.core.Job;
import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.client.methods.RequestBuilder;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Runs {@code http:} commands with Apache HttpClient.
 *
 * <p>Job parameters shape the request: {@code method} (default GET), {@code headers},
 * {@code params} (query string) and {@code data} (a string is sent as is, anything else as JSON).
 * A status outside 2xx fails the job.
 */
public class HttpCommandRunner implements CommandRunner<Command.Http>, Closeable {
    private static final Logger log = LoggerFactory.getLogger(HttpCommandRunner.class);

    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpCommandRunner(ObjectMapper objectMapper, int maxConnections) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        PoolingHttpClientConnectionManager cm = new PoolingHttpClientConnectionManager();
        cm.setMaxTotal(Math.max(1, maxConnections));
        cm.setDefaultMaxPerRoute(Math.max(1, maxConnections));
        this.httpClient = HttpClients.custom()
                .setConnectionManager(cm)
                .disableCookieManagement()
                .build();
    }

    @Override
    public Map<String, Object> run(Command.Http command, Job job, RunContext context) throws JobExecutionException {
        HttpUriRequest request = buildRequest(command.url(), job.getParameters(), context);
        log.debug("jobflow http request id={} method={} uri={}", job.getId(), request.getMethod(), request.getURI());

        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int status = response.getStatusLine().getStatusCode();
            HttpEntity entity = response.getEntity();
            String content = entity == null ? "" : EntityUtils.toString(entity, StandardCharsets.UTF_8);
            if (status < 200 || status >= 300) {
                throw new JobExecutionException("HTTP request failed with status " + status
                        + ": " + response.getStatusLine().getReasonPhrase());
            }

            Map<String, String> headers = new LinkedHashMap<>();
            for (Header h : response.getAllHeaders()) {
                headers.merge(h.getName(), h.getValue(), (a, b) -> a + ", " + b);
            }

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("status_code", status);
            result.put("headers", headers);
            result.put("content", content);
            result.put("url", request.getURI().toString());
            return result;
        } catch (IOException e) {
            throw new JobExecutionException("HTTP request failed: " + e.getMessage(), e);
        }
    }

    HttpUriRequest buildRequest(String url, Map<String, Object> parameters, RunContext context)
            throws JobExecutionException {
        String method = String.valueOf(parameters.getOrDefault("method", "GET")).toUpperCase(Locale.ROOT);

        URIBuilder uri;
        try {
            uri = new URIBuilder(url);
        } catch (URISyntaxException e) {
            throw new JobExecutionException("Invalid URL: " + url, e);
        }
        if (parameters.get("params") instanceof Map<?, ?> params) {
            params.forEach((k, v) -> uri.addParameter(String.valueOf(k), String.valueOf(v)));
        }

        int timeoutMillis = (int) Math.min(Integer.MAX_VALUE, context.timeout().toMillis());
        RequestConfig config = RequestConfig.custom()
                .setConnectTimeout(timeoutMillis)
                .setConnectionRequestTimeout(timeoutMillis)
                .setSocketTimeout(timeoutMillis)
                .build();

        RequestBuilder builder;
        try {
            builder = RequestBuilder.create(method).setUri(uri.build()).setConfig(config);
        } catch (URISyntaxException e) {
            throw new JobExecutionException("Invalid URL: " + url, e);
        }

        if (parameters.get("headers") instanceof Map<?, ?> headers) {
            headers.forEach((k, v) -> builder.addHeader(String.valueOf(k), String.valueOf(v)));
        }

        Object data = parameters.get("data");
        if (data instanceof String s) {
            builder.setEntity(new StringEntity(s, StandardCharsets.UTF_8));
        } else if (data != null) {
            try {
                builder.setEntity(new StringEntity(objectMapper.writeValueAsString(data), ContentType.APPLICATION_JSON));
            } catch (JsonProcessingException e) {
                throw new JobExecutionException("Failed to encode request body: " + e.getOriginalMessage(), e);
            }
        }
        return builder.build();
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
