package com.imperium.searchinsight.provider.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.imperium.searchinsight.exception.ProviderException;
import com.imperium.searchinsight.exception.ProviderParseException;
import com.imperium.searchinsight.model.RawItem;
import com.imperium.searchinsight.model.RawSearchResult;
import com.imperium.searchinsight.provider.FallbackSearchProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Fallback provider：DuckDuckGo Instant Answer API，无需 key。
 * 摘要（AbstractText）与前几条 RelatedTopics 作为结果条目。
 */
@Service
public class DuckDuckGoSearchProvider implements FallbackSearchProvider {

    public static final String ID = "duckduckgo";

    private static final String USER_AGENT = "SearchInsight/1.0";
    private static final int MAX_TITLE_CHARS = 80;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final int relatedTopics;

    public DuckDuckGoSearchProvider(@Qualifier("searchRestTemplate") RestTemplate restTemplate,
                                    ObjectMapper objectMapper,
                                    @Value("${app.search.fallback.base-url:https://api.duckduckgo.com}") String baseUrl,
                                    @Value("${app.search.fallback.related-topics:3}") int relatedTopics) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.relatedTopics = Math.max(0, relatedTopics);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RawSearchResult query(String text) {
        URI uri = UriComponentsBuilder.fromUriString(baseUrl)
                .path("/")
                .queryParam("q", text)
                .queryParam("format", "json")
                .queryParam("no_html", 1)
                .queryParam("skip_disambig", 1)
                .encode()
                .build()
                .toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, USER_AGENT);

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<Void>(headers), String.class);
        } catch (HttpStatusCodeException e) {
            throw new ProviderException(ID, "unexpected HTTP status " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new ProviderException(ID, "transport error: " + e.getMessage(), e);
        }
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new ProviderException(ID, "unexpected HTTP status " + response.getStatusCode().value());
        }
        if (response.getBody() == null || response.getBody().isBlank()) {
            throw new ProviderException(ID, "empty response body");
        }
        return parseInstantAnswer(response.getBody(), text);
    }

    RawSearchResult parseInstantAnswer(String json, String query) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ProviderParseException(ID, "malformed JSON response", e);
        }
        if (root == null || !root.isObject()) {
            throw new ProviderParseException(ID, "response is not a JSON object", null);
        }

        String heading = text(root, "Heading");
        String abstractText = text(root, "AbstractText");
        String abstractUrl = text(root, "AbstractURL");
        String answer = text(root, "Answer");

        List<RawItem> items = new ArrayList<>();
        if (!abstractText.isBlank()) {
            items.add(new RawItem(!heading.isBlank() ? heading : query, abstractUrl, abstractText));
        }

        List<JsonNode> topics = new ArrayList<>();
        flattenTopics(root.get("RelatedTopics"), topics);
        for (JsonNode topic : topics) {
            if (items.size() >= relatedTopics + (abstractText.isBlank() ? 0 : 1)) break;
            String topicText = text(topic, "Text");
            if (topicText.isBlank()) continue;
            items.add(new RawItem(titleOf(topicText), text(topic, "FirstURL"), topicText));
        }

        String directAnswer = !answer.isBlank() ? answer : abstractText;
        return new RawSearchResult(items, directAnswer);
    }

    /** RelatedTopics 里可能夹着带 Topics 的分组，展开成单层 */
    private static void flattenTopics(JsonNode node, List<JsonNode> out) {
        if (node == null || !node.isArray()) {
            return;
        }
        for (JsonNode n : node) {
            if (n.has("Topics")) {
                flattenTopics(n.get("Topics"), out);
            } else {
                out.add(n);
            }
        }
    }

    private static String titleOf(String topicText) {
        int dash = topicText.indexOf(" - ");
        String title = dash > 0 ? topicText.substring(0, dash) : topicText;
        return title.length() > MAX_TITLE_CHARS ? title.substring(0, MAX_TITLE_CHARS) + "..." : title;
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return v == null || v.isNull() ? "" : v.asText();
    }
}
