package com.edwardjones.personnelsync.config;

import com.edwardjones.personnelsync.model.domain.AttributeMapping;
import com.edwardjones.personnelsync.model.domain.ChangePolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Run-level controls bound from the {@code app.sync.*} properties.
 *
 * <pre>
 * app:
 *   sync:
 *     dry-run: true
 *     source:
 *       type: RestApi
 *       rest-api:
 *         base-url: https://hr.example.com
 *         list-path: /people
 *     destination:
 *       type: WebHelpDesk
 *       disable-delete: true
 *     attribute-map:
 *       - source-key: email
 *         destination-key: email
 *         required: true
 * </pre>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "app.sync")
public class SyncProperties {

    private boolean dryRun = false;

    // Spring's "-" disables the scheduled trigger
    private String cron = "-";

    private int applyThreads = 10;

    private Http http = new Http();
    private SourceSettings source = new SourceSettings();
    private DestinationSettings destination = new DestinationSettings();
    private List<AttributeMapping> attributeMap = new ArrayList<>();
    private List<SyncSet> syncSets = new ArrayList<>();

    @Getter
    @Setter
    public static class Http {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class SourceSettings {
        private String type;
        private RestApi restApi = new RestApi();
        private Ldap ldap = new Ldap();
    }

    @Getter
    @Setter
    public static class RestApi {
        private String baseUrl;
        private String listPath = "/";
        /** none, basic or bearer */
        private String authType = "none";
        private String username;
        private String password;
        private String token;
        /** Field of the response object that holds the people array, blank if the response is the array. */
        private String resultsContainer;
        private String compareAttribute = "email";
        private String idAttribute;
    }

    @Getter
    @Setter
    public static class Ldap {
        private String url;
        private String base = "";
        private String username;
        private String password;
        private List<String> searchBases = new ArrayList<>();
        private String filter = "(objectclass=person)";
        private String compareAttribute = "mail";
        private int pageSize = 500;
    }

    @Getter
    @Setter
    public static class DestinationSettings {
        private String type;
        private boolean disableAdd;
        private boolean disableUpdate;
        private boolean disableDelete;
        private WebHelpDesk webHelpDesk = new WebHelpDesk();

        public ChangePolicy toChangePolicy() {
            return new ChangePolicy(disableAdd, disableUpdate, disableDelete);
        }
    }

    @Getter
    @Setter
    public static class WebHelpDesk {
        private String url;
        private String username;
        private String apiKey;
        private int listClientsPageLimit = 100;
        private int batchSizePerMinute = 50;
    }

    @Getter
    @Setter
    public static class SyncSet {
        private String name;
        private Map<String, String> source = new LinkedHashMap<>();
        private Map<String, String> destination = new LinkedHashMap<>();
    }
}
