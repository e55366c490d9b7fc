package com.imperium.searchinsight.provider.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.searchinsight.exception.ProviderException;
import com.imperium.searchinsight.exception.ProviderParseException;
import com.imperium.searchinsight.model.RawItem;
import com.imperium.searchinsight.model.RawSearchResult;
import com.imperium.searchinsight.model.SearchDepth;
import com.imperium.searchinsight.model.SearchParams;
import com.imperium.searchinsight.model.SearchType;
import com.imperium.searchinsight.policy.SearchTypePolicy;
import com.imperium.searchinsight.provider.PrimarySearchProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Primary provider：Tavily 搜索 API（POST /search）。
 * 未配置 TAVILY_API_KEY 时直接失败，不发请求，由网关切到 fallback。
 */
@Service
public class TavilySearchProvider implements PrimarySearchProvider {

    public static final String ID = "tavily";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;

    public TavilySearchProvider(@Qualifier("searchRestTemplate") RestTemplate restTemplate,
                                ObjectMapper objectMapper,
                                @Value("${app.search.primary.base-url:https://api.tavily.com}") String baseUrl,
                                @Value("${app.search.primary.api-key:}") String apiKey) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.apiKey = apiKey;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RawSearchResult query(String text, SearchType type, SearchParams params) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ProviderException(ID, "TAVILY_API_KEY is not configured");
        }

        String body;
        try {
            body = objectMapper.writeValueAsString(buildPayload(text, type, params));
        } catch (JsonProcessingException e) {
            throw new ProviderException(ID, "cannot encode request", e);
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(apiKey);

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(
                    URI.create(baseUrl + "/search"),
                    HttpMethod.POST,
                    new HttpEntity<>(body, headers),
                    String.class);
        } catch (HttpStatusCodeException e) {
            throw new ProviderException(ID, describeStatus(e.getStatusCode()), e);
        } catch (RestClientException e) {
            throw new ProviderException(ID, "transport error: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new ProviderException(ID, describeStatus(response.getStatusCode()));
        }
        if (response.getBody() == null || response.getBody().isBlank()) {
            throw new ProviderException(ID, "empty response body");
        }
        return parseSearchResponse(response.getBody(), params != null && params.isIncludeImages());
    }

    Map<String, Object> buildPayload(String text, SearchType type, SearchParams params) {
        SearchParams p = params != null ? params : SearchParams.defaults();
        String q = text.length() > SearchTypePolicy.MAX_QUERY_CHARS
                ? text.substring(0, SearchTypePolicy.MAX_QUERY_CHARS) : text;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", q);
        payload.put("search_depth", (p.getDepth() != null ? p.getDepth() : SearchDepth.BASIC).value());
        payload.put("max_results", p.getMaxResults());
        payload.put("include_answer", true);
        if (p.getIncludeDomains() != null && !p.getIncludeDomains().isEmpty()) {
            payload.put("include_domains", List.copyOf(p.getIncludeDomains()));
        }
        if (p.getExcludeDomains() != null && !p.getExcludeDomains().isEmpty()) {
            payload.put("exclude_domains", List.copyOf(p.getExcludeDomains()));
        }
        if (type == SearchType.NEWS) {
            payload.put("topic", "news");
            if (p.getDays() != null) {
                payload.put("days", p.getDays());
            }
        }
        if (p.isIncludeImages()) {
            payload.put("include_images", true);
            payload.put("include_image_descriptions", true);
        }
        return payload;
    }

    RawSearchResult parseSearchResponse(String json, boolean includeImages) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ProviderParseException(ID, "malformed JSON response", e);
        }
        if (root == null || !root.isObject()) {
            throw new ProviderParseException(ID, "response is not a JSON object", null);
        }
        JsonNode results = root.get("results");
        if (results != null && !results.isNull() && !results.isArray()) {
            throw new ProviderParseException(ID, "'results' is not an array", null);
        }

        List<RawItem> items = new ArrayList<>();
        if (results != null && results.isArray()) {
            for (JsonNode r : results) {
                String url = text(r, "url");
                String title = text(r, "title");
                String content = text(r, "content");
                if ((url == null || url.isBlank()) && (content == null || content.isBlank())) continue;
                items.add(new RawItem(title != null && !title.isBlank() ? title : url, url, content));
            }
        }

        JsonNode images = root.get("images");
        if (includeImages && images != null && images.isArray()) {
            for (JsonNode img : images) {
                // 旧版返回字符串数组，带描述时返回对象
                String url = img.isTextual() ? img.asText() : text(img, "url");
                String description = img.isObject() ? text(img, "description") : null;
                if (url == null || url.isBlank()) continue;
                items.add(new RawItem("Image", url, description));
            }
        }

        return new RawSearchResult(items, text(root, "answer"));
    }

    private static String describeStatus(HttpStatusCode status) {
        int code = status.value();
        if (code == 401 || code == 403) {
            return "authentication failed (HTTP " + code + ")";
        }
        if (code == 429 || code == 432 || code == 433) {
            return "quota exceeded (HTTP " + code + ")";
        }
        return "unexpected HTTP status " + code;
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }

    private static String stripTrailingSlash(String url) {
        String v = url == null ? "" : url.trim();
        while (v.endsWith("/")) {
            v = v.substring(0, v.length() - 1);
        }
        return v;
    }
}
