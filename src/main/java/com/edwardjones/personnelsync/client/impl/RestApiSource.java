package com.edwardjones.personnelsync.client.impl;

import com.edwardjones.personnelsync.client.PersonSource;
import com.edwardjones.personnelsync.client.SyncClientException;
import com.edwardjones.personnelsync.config.SyncProperties;
import com.edwardjones.personnelsync.model.domain.Person;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads people from a JSON REST endpoint.
 *
 * Each element of the response array is decoded into flat string attributes: nested objects become
 * dotted keys, scalars their text, arrays and nulls are dropped.
 */
@Slf4j
public class RestApiSource implements PersonSource {

    public static final String PATH_OPTION = "path";

    private final RestTemplate restTemplate;
    private final SyncProperties.RestApi settings;
    private String listPath;

    public RestApiSource(RestTemplateBuilder builder, SyncProperties.RestApi settings) {
        this(buildRestTemplate(builder, settings), settings);
    }

    RestApiSource(RestTemplate restTemplate, SyncProperties.RestApi settings) {
        this.restTemplate = restTemplate;
        this.settings = settings;
        this.listPath = settings.getListPath();
    }

    private static RestTemplate buildRestTemplate(RestTemplateBuilder builder, SyncProperties.RestApi settings) {
        if (settings.getBaseUrl() == null || settings.getBaseUrl().isBlank()) {
            throw new IllegalArgumentException("RestApi source requires a base-url");
        }
        RestTemplateBuilder configured = builder.rootUri(settings.getBaseUrl());
        String authType = settings.getAuthType() == null ? "none" : settings.getAuthType().toLowerCase(Locale.ROOT);
        switch (authType) {
            case "basic" -> configured = configured.basicAuthentication(settings.getUsername(), settings.getPassword());
            case "bearer" -> configured = configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + settings.getToken());
            case "none" -> log.debug("RestApi source {} uses no authentication", settings.getBaseUrl());
            default -> throw new IllegalArgumentException("Unsupported RestApi auth type: " + settings.getAuthType());
        }
        return configured.build();
    }

    @Override
    public void forSet(Map<String, String> options) {
        String path = options.get(PATH_OPTION);
        if (path != null && !path.isBlank()) {
            listPath = path;
        }
    }

    @Override
    public List<Person> listUsers(List<String> desiredAttributes) {
        log.info("Fetching people from REST source path {}", listPath);

        JsonNode root;
        try {
            root = restTemplate.getForObject(listPath, JsonNode.class);
        } catch (RestClientException e) {
            throw new SyncClientException("Failed to retrieve people from " + listPath + ": " + e.getMessage(), e);
        }
        if (root == null) {
            throw new SyncClientException("Empty response from " + listPath);
        }

        String container = settings.getResultsContainer();
        JsonNode results = container == null || container.isBlank() ? root : root.path(container);
        if (!results.isArray()) {
            throw new SyncClientException("Response from " + listPath + " does not contain a people array");
        }

        List<Person> people = new ArrayList<>(results.size());
        for (JsonNode element : results) {
            if (!element.isObject()) {
                log.warn("Skipping non-object entry in REST source response: {}", element.getNodeType());
                continue;
            }

            Map<String, String> attrs = new LinkedHashMap<>();
            flatten("", element, attrs);

            String compareKey = attrs.get(settings.getCompareAttribute());
            if (compareKey == null || compareKey.isBlank()) {
                log.warn("Skipping REST source entry without compare attribute '{}'", settings.getCompareAttribute());
                continue;
            }
            String externalId = settings.getIdAttribute() == null ? null : attrs.get(settings.getIdAttribute());

            people.add(new Person(compareKey, externalId, retain(attrs, desiredAttributes), false));
        }

        log.info("Retrieved {} people from REST source", people.size());
        return people;
    }

    static void flatten(String prefix, JsonNode node, Map<String, String> into) {
        node.fields().forEachRemaining(field -> {
            String key = prefix.isEmpty() ? field.getKey() : prefix + "." + field.getKey();
            JsonNode value = field.getValue();
            switch (value.getNodeType()) {
                case OBJECT -> flatten(key, value, into);
                case STRING, NUMBER, BOOLEAN -> into.put(key, value.asText());
                default -> log.trace("Dropping attribute {} of type {}", key, value.getNodeType());
            }
        });
    }

    static Map<String, String> retain(Map<String, String> attrs, List<String> desiredAttributes) {
        if (desiredAttributes == null || desiredAttributes.isEmpty()) {
            return attrs;
        }
        Map<String, String> retained = new LinkedHashMap<>();
        for (String name : desiredAttributes) {
            String value = attrs.get(name);
            if (value != null) {
                retained.put(name, value);
            }
        }
        return retained;
    }
}
