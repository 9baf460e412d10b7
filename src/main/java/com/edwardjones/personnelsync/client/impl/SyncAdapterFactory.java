package com.edwardjones.personnelsync.client.impl;

import com.edwardjones.personnelsync.client.PersonDestination;
import com.edwardjones.personnelsync.client.PersonSource;
import com.edwardjones.personnelsync.config.SyncProperties;
import com.edwardjones.personnelsync.service.dispatch.ChangeSetDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;

/**
 * Builds the configured source and destination adapters.
 *
 * Adapters are created per run so each sync set starts from clean per-set options.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncAdapterFactory {

    public static final String SOURCE_TYPE_REST_API = "RestApi";
    public static final String SOURCE_TYPE_LDAP = "Ldap";
    public static final String DESTINATION_TYPE_WEB_HELP_DESK = "WebHelpDesk";

    private final RestTemplateBuilder restTemplateBuilder;
    private final ChangeSetDispatcher dispatcher;

    public PersonSource createSource(SyncProperties.SourceSettings settings) {
        String type = settings.getType();
        log.debug("Creating source adapter of type {}", type);
        if (SOURCE_TYPE_REST_API.equalsIgnoreCase(type)) {
            return new RestApiSource(restTemplateBuilder, settings.getRestApi());
        }
        if (SOURCE_TYPE_LDAP.equalsIgnoreCase(type)) {
            return LdapSource.create(settings.getLdap());
        }
        throw new IllegalArgumentException("Unknown source type: " + type);
    }

    public PersonDestination createDestination(SyncProperties.DestinationSettings settings) {
        String type = settings.getType();
        log.debug("Creating destination adapter of type {}", type);
        if (DESTINATION_TYPE_WEB_HELP_DESK.equalsIgnoreCase(type)) {
            return new WebHelpDeskDestination(restTemplateBuilder.build(), settings.getWebHelpDesk(), dispatcher);
        }
        throw new IllegalArgumentException("Unknown destination type: " + type);
    }
}
