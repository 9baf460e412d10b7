package com.edwardjones.personnelsync.client.impl;

import com.edwardjones.personnelsync.client.PersonDestination;
import com.edwardjones.personnelsync.client.SyncClientException;
import com.edwardjones.personnelsync.config.SyncProperties;
import com.edwardjones.personnelsync.model.domain.Person;
import com.edwardjones.personnelsync.model.dto.ChangeResults;
import com.edwardjones.personnelsync.model.dto.ChangeSet;
import com.edwardjones.personnelsync.service.dispatch.BatchTimer;
import com.edwardjones.personnelsync.service.dispatch.ChangeOperations;
import com.edwardjones.personnelsync.service.dispatch.ChangeSetDispatcher;
import com.edwardjones.personnelsync.service.event.EventLogSink;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Web Help Desk ticketing system as a destination. Its people are called "clients".
 *
 * The API offers no way to delete or deactivate a client, so deletes are never applied.
 */
@Slf4j
public class WebHelpDeskDestination implements PersonDestination, ChangeOperations {

    public static final String CLIENTS_API_PATH = "/ra/Clients";
    public static final int DEFAULT_LIST_CLIENTS_PAGE_LIMIT = 100;
    private static final int BATCH_WINDOW_SECONDS = 60;

    private final RestTemplate restTemplate;
    private final SyncProperties.WebHelpDesk settings;
    private final ChangeSetDispatcher dispatcher;
    private final int pageLimit;

    public WebHelpDeskDestination(RestTemplate restTemplate,
                                  SyncProperties.WebHelpDesk settings,
                                  ChangeSetDispatcher dispatcher) {
        if (settings.getUrl() == null || settings.getUrl().isBlank()) {
            throw new IllegalArgumentException("WebHelpDesk destination requires a url");
        }
        this.restTemplate = restTemplate;
        this.settings = settings;
        this.dispatcher = dispatcher;
        this.pageLimit = settings.getListClientsPageLimit() > 0
                ? settings.getListClientsPageLimit()
                : DEFAULT_LIST_CLIENTS_PAGE_LIMIT;
    }

    /**
     * JSON shape of a Web Help Desk client.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WebHelpDeskClient(Integer id, String firstName, String lastName, String email, String username) {

        Map<String, String> toAttributes() {
            Map<String, String> attrs = new LinkedHashMap<>();
            if (id != null) {
                attrs.put("id", String.valueOf(id));
            }
            putIfPresent(attrs, "email", email);
            putIfPresent(attrs, "firstName", firstName);
            putIfPresent(attrs, "lastName", lastName);
            putIfPresent(attrs, "username", username);
            return attrs;
        }

        static WebHelpDeskClient fromPerson(Person person, Integer id) {
            return new WebHelpDeskClient(id,
                    person.attribute("firstName"),
                    person.attribute("lastName"),
                    person.attribute("email"),
                    person.attribute("username"));
        }

        private static void putIfPresent(Map<String, String> attrs, String key, String value) {
            // The API sends "" for fields that were never set
            if (value != null && !value.isBlank()) {
                attrs.put(key, value);
            }
        }
    }

    @Override
    public List<Person> listUsers(List<String> desiredAttributes) {
        List<WebHelpDeskClient> allClients = new ArrayList<>();
        int page = 1;

        while (true) {
            WebHelpDeskClient[] clients;
            try {
                clients = restTemplate.getForObject(clientsUri("", page), WebHelpDeskClient[].class);
            } catch (RestClientException e) {
                throw new SyncClientException("Failed to list Web Help Desk clients (page " + page + "): " + e.getMessage(), e);
            }

            List<WebHelpDeskClient> batch = clients == null ? List.of() : Arrays.asList(clients);
            allClients.addAll(batch);

            // A short page is the last one
            if (batch.size() < pageLimit) {
                break;
            }
            page++;
        }

        List<Person> people = new ArrayList<>(allClients.size());
        for (WebHelpDeskClient client : allClients) {
            if (client.email() == null || client.email().isBlank()) {
                log.warn("Skipping Web Help Desk client {} without an email", client.id());
                continue;
            }
            String externalId = client.id() == null ? null : String.valueOf(client.id());
            people.add(new Person(client.email(), externalId,
                    RestApiSource.retain(client.toAttributes(), desiredAttributes), false));
        }

        log.info("Retrieved {} clients from Web Help Desk in {} pages", people.size(), page);
        return people;
    }

    @Override
    public ChangeResults applyChangeSet(ChangeSet changes, EventLogSink eventLog) {
        int perMinute = settings.getBatchSizePerMinute() > 0
                ? settings.getBatchSizePerMinute()
                : BatchTimer.DEFAULT_MAX_PER_WINDOW;
        BatchTimer batchTimer = new BatchTimer("webHelpDesk", perMinute, BATCH_WINDOW_SECONDS);
        return dispatcher.dispatch(changes, this, batchTimer, eventLog);
    }

    @Override
    public void create(Person person) {
        WebHelpDeskClient client = WebHelpDeskClient.fromPerson(person, null);
        restTemplate.postForEntity(clientsUri("", null), client, Void.class);
        log.debug("Created Web Help Desk client {}", person.compareKey());
    }

    @Override
    public void update(Person person) {
        Integer id = clientId(person);
        WebHelpDeskClient client = WebHelpDeskClient.fromPerson(person, id);
        restTemplate.put(clientsUri("/" + id, null), client);
        log.debug("Updated Web Help Desk client {} ({})", person.compareKey(), id);
    }

    @Override
    public boolean supportsDelete() {
        return false;
    }

    private Integer clientId(Person person) {
        String id = person.externalId() != null ? person.externalId() : person.attribute("id");
        if (id == null) {
            throw new IllegalStateException("no Web Help Desk id known for " + person.compareKey());
        }
        return Integer.valueOf(id);
    }

    private URI clientsUri(String suffix, Integer page) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(settings.getUrl())
                .path(CLIENTS_API_PATH + suffix)
                .queryParam("username", settings.getUsername())
                .queryParam("apiKey", settings.getApiKey());
        if (page != null) {
            builder.queryParam("limit", pageLimit).queryParam("page", page);
        }
        return builder.encode().build().toUri();
    }
}
