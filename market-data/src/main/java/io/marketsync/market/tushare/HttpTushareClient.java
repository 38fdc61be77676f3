package io.marketsync.market.tushare;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.marketsync.core.Row;
import io.marketsync.error.UpstreamException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON-over-HTTP client: POSTs {@code {api_name, token, params, fields}} and unpacks
 * {@code {code, msg, data: {fields, items}}} into rows.
 */
public final class HttpTushareClient implements TushareClient {
    public static final String DEFAULT_URL = "http://api.tushare.pro";

    private final HttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();
    private final URI uri;
    private final String token;
    private final Duration timeout;

    public HttpTushareClient(String url, String token, Duration timeout) {
        if (token == null || token.isBlank()) throw new IllegalArgumentException("upstream token is required");
        this.uri = URI.create(url == null || url.isBlank() ? DEFAULT_URL : url);
        this.token = token;
        this.timeout = timeout;
        this.http = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    @Override
    public List<Row> query(String api, Map<String, Object> params, String fields) throws IOException, InterruptedException {
        ObjectNode body = mapper.createObjectNode();
        body.put("api_name", api);
        body.put("token", token);
        body.set("params", mapper.valueToTree(params == null ? Map.of() : params));
        body.put("fields", fields == null ? "" : fields);

        HttpRequest req = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                .build();
        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new UpstreamException(api, resp.statusCode(), "HTTP " + resp.statusCode());
        }
        return parse(api, mapper.readTree(resp.body()));
    }

    static List<Row> parse(String api, JsonNode root) {
        int code = root.path("code").asInt(-1);
        if (code != 0) throw new UpstreamException(api, code, root.path("msg").asText(""));
        JsonNode data = root.path("data");
        JsonNode fields = data.path("fields");
        JsonNode items = data.path("items");
        List<Row> rows = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            Row r = new Row();
            for (int i = 0; i < fields.size(); i++) {
                r.put(fields.get(i).asText(), value(item.get(i)));
            }
            rows.add(r);
        }
        return rows;
    }

    private static Object value(JsonNode n) {
        if (n == null || n.isNull()) return null;
        if (n.isIntegralNumber()) return n.longValue();
        if (n.isNumber()) return n.doubleValue();
        if (n.isBoolean()) return n.booleanValue();
        return n.asText();
    }
}
