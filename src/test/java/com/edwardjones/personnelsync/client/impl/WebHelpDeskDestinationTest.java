package com.edwardjones.personnelsync.client.impl;

import com.edwardjones.personnelsync.client.SyncClientException;
import com.edwardjones.personnelsync.config.SyncProperties;
import com.edwardjones.personnelsync.model.domain.Person;
import com.edwardjones.personnelsync.model.dto.ChangeResults;
import com.edwardjones.personnelsync.model.dto.ChangeSet;
import com.edwardjones.personnelsync.model.dto.EventLogEntry.Severity;
import com.edwardjones.personnelsync.service.dispatch.ChangeSetDispatcher;
import com.edwardjones.personnelsync.service.event.BufferedEventLog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("WebHelpDeskDestination Tests")
class WebHelpDeskDestinationTest {

    private static final String WHD_URL = "https://whd.example.com/helpdesk/WebObjects/Helpdesk.woa";
    private static final String AUTH = "username=api&apiKey=secret";

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private ExecutorService executor;
    private WebHelpDeskDestination destination;
    private BufferedEventLog eventLog;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        executor = Executors.newSingleThreadExecutor();

        SyncProperties.WebHelpDesk settings = new SyncProperties.WebHelpDesk();
        settings.setUrl(WHD_URL);
        settings.setUsername("api");
        settings.setApiKey("secret");
        settings.setListClientsPageLimit(2);
        settings.setBatchSizePerMinute(50);

        destination = new WebHelpDeskDestination(restTemplate, settings, new ChangeSetDispatcher(executor));
        eventLog = new BufferedEventLog("whd");
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Nested
    @DisplayName("Listing clients")
    class ListUsersTests {

        @Test
        @DisplayName("Should page until a short page is returned")
        void shouldDrainAllPages() {
            // Given
            server.expect(requestTo(WHD_URL + "/ra/Clients?" + AUTH + "&limit=2&page=1"))
                    .andExpect(method(HttpMethod.GET))
                    .andRespond(withSuccess("""
                            [{"id": 1, "email": "one@example.com", "firstName": "One", "lastName": "User", "username": "one"},
                             {"id": 2, "email": "two@example.com", "firstName": "Two", "lastName": "User", "username": "two"}]
                            """, MediaType.APPLICATION_JSON));
            server.expect(requestTo(WHD_URL + "/ra/Clients?" + AUTH + "&limit=2&page=2"))
                    .andRespond(withSuccess("""
                            [{"id": 3, "email": "three@example.com", "firstName": "Three", "type": "Client"}]
                            """, MediaType.APPLICATION_JSON));

            // When
            List<Person> people = destination.listUsers(List.of("email", "firstName", "lastName"));

            // Then
            server.verify();
            assertThat(people).extracting(Person::compareKey)
                    .containsExactly("one@example.com", "two@example.com", "three@example.com");
            assertThat(people).extracting(Person::externalId).containsExactly("1", "2", "3");
            assertThat(people.get(0).attributes()).containsExactlyInAnyOrderEntriesOf(Map.of(
                    "email", "one@example.com", "firstName", "One", "lastName", "User"));
            assertThat(people.get(2).attributes()).doesNotContainKey("lastName");
        }

        @Test
        @DisplayName("Should raise a client exception when listing fails")
        void shouldFailOnServerError() {
            server.expect(requestTo(WHD_URL + "/ra/Clients?" + AUTH + "&limit=2&page=1"))
                    .andRespond(withServerError());

            assertThatThrownBy(() -> destination.listUsers(List.of()))
                    .isInstanceOf(SyncClientException.class)
                    .hasMessageContaining("page 1");
        }

        @Test
        @DisplayName("Should treat blank client fields as unset")
        void shouldTreatBlankFieldsAsAbsent() {
            // Given
            server.expect(requestTo(WHD_URL + "/ra/Clients?" + AUTH + "&limit=2&page=1"))
                    .andRespond(withSuccess("""
                            [{"id": 5, "email": "five@example.com", "firstName": "Five", "lastName": " ", "username": ""}]
                            """, MediaType.APPLICATION_JSON));

            // When
            List<Person> people = destination.listUsers(List.of("email", "firstName", "lastName", "username"));

            // Then
            assertThat(people).singleElement()
                    .extracting(Person::attributes)
                    .isEqualTo(Map.of("email", "five@example.com", "firstName", "Five"));
        }
    }

    @Nested
    @DisplayName("Applying changes")
    class ApplyChangeSetTests {

        @Test
        @DisplayName("Should create a client with a POST")
        void shouldCreateClient() {
            // Given
            server.expect(requestTo(WHD_URL + "/ra/Clients?" + AUTH))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                    .andExpect(jsonPath("$.email").value("new@example.com"))
                    .andExpect(jsonPath("$.id").doesNotExist())
                    .andRespond(withSuccess());
            Person person = Person.of("new@example.com", Map.of("email", "new@example.com", "firstName", "New"));

            // When
            ChangeResults results = destination.applyChangeSet(
                    new ChangeSet(List.of(person), List.of(), List.of()), eventLog);

            // Then
            server.verify();
            assertThat(results.getCreated()).isEqualTo(1);
            assertThat(eventLog.getErrorCount()).isZero();
        }

        @Test
        @DisplayName("Should update a client by id with a PUT")
        void shouldUpdateClient() {
            server.expect(requestTo(WHD_URL + "/ra/Clients/42?" + AUTH))
                    .andExpect(method(HttpMethod.PUT))
                    .andExpect(jsonPath("$.id").value(42))
                    .andExpect(jsonPath("$.lastName").value("Renamed"))
                    .andRespond(withSuccess());
            Person person = new Person("old@example.com", "42",
                    Map.of("email", "old@example.com", "lastName", "Renamed"), false);

            ChangeResults results = destination.applyChangeSet(
                    new ChangeSet(List.of(), List.of(person), List.of()), eventLog);

            server.verify();
            assertThat(results.getUpdated()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should report a failed update without counting it")
        void shouldReportFailedUpdate() {
            server.expect(requestTo(WHD_URL + "/ra/Clients/42?" + AUTH)).andRespond(withServerError());
            Person person = new Person("old@example.com", "42", Map.of("email", "old@example.com"), false);

            ChangeResults results = destination.applyChangeSet(
                    new ChangeSet(List.of(), List.of(person), List.of()), eventLog);

            assertThat(results.getUpdated()).isZero();
            assertThat(results.hasErrors()).isFalse();
            assertThat(eventLog.getErrorCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should never delete clients")
        void shouldSkipDeletes() {
            Person person = new Person("gone@example.com", "7", Map.of("email", "gone@example.com"), false);

            ChangeResults results = destination.applyChangeSet(
                    new ChangeSet(List.of(), List.of(), List.of(person)), eventLog);

            server.verify();
            assertThat(results.getDeleted()).isZero();
            assertThat(eventLog.snapshot()).singleElement()
                    .satisfies(entry -> assertThat(entry.severity()).isEqualTo(Severity.WARNING));
        }
    }
}
