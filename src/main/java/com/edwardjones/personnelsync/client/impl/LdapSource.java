package com.edwardjones.personnelsync.client.impl;

import com.edwardjones.personnelsync.client.PersonSource;
import com.edwardjones.personnelsync.client.SyncClientException;
import com.edwardjones.personnelsync.config.SyncProperties;
import com.edwardjones.personnelsync.model.domain.Person;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ldap.control.PagedResultsDirContextProcessor;
import org.springframework.ldap.core.AttributesMapper;
import org.springframework.ldap.core.LdapOperations;
import org.springframework.ldap.core.support.LdapOperationsCallback;
import org.springframework.ldap.core.support.LdapContextSource;
import org.springframework.ldap.core.support.SingleContextSource;

import javax.naming.NamingEnumeration;
import javax.naming.NamingException;
import javax.naming.directory.Attribute;
import javax.naming.directory.Attributes;
import javax.naming.directory.SearchControls;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads people from an LDAP / Active Directory server with paged searches.
 *
 * The server ties a paged-results cookie to the connection that issued it, so all pages of one
 * search base are read over a single connection.
 */
@Slf4j
public class LdapSource implements PersonSource {

    // Server-side limits to prevent LDAP server overload
    private static final int SERVER_TIME_LIMIT_SECONDS = 30;

    // Client-side safety cap
    private static final int MAX_PAGES_PER_BASE = 1000;

    private final ConnectionScope connectionScope;
    private final SyncProperties.Ldap settings;

    LdapSource(ConnectionScope connectionScope, SyncProperties.Ldap settings) {
        this.connectionScope = connectionScope;
        this.settings = settings;
    }

    public static LdapSource create(SyncProperties.Ldap settings) {
        if (settings.getUrl() == null || settings.getUrl().isBlank()) {
            throw new IllegalArgumentException("Ldap source requires a url");
        }
        LdapContextSource contextSource = new LdapContextSource();
        contextSource.setUrl(settings.getUrl());
        contextSource.setBase(settings.getBase());
        contextSource.setUserDn(settings.getUsername());
        contextSource.setPassword(settings.getPassword());
        contextSource.afterPropertiesSet();

        // Active Directory answers subtree searches with referrals we do not follow
        return new LdapSource(
                callback -> SingleContextSource.doWithSingleContext(contextSource, callback, true, true, false),
                settings);
    }

    @Override
    public List<Person> listUsers(List<String> desiredAttributes) {
        List<String> bases = settings.getSearchBases().isEmpty() ? List.of("") : settings.getSearchBases();
        log.info("Fetching people from LDAP across {} search bases with filter {}", bases.size(), settings.getFilter());

        List<Person> allPeople = new ArrayList<>();
        for (String base : bases) {
            try {
                List<Person> inBase = fetchFromBase(base, desiredAttributes);
                allPeople.addAll(inBase);
                log.info("Found {} people in base '{}' (running total: {})", inBase.size(), base, allPeople.size());
            } catch (RuntimeException e) {
                throw new SyncClientException("Failed to query LDAP base '" + base + "': " + e.getMessage(), e);
            }
        }

        // The same entry can be reachable from overlapping bases
        List<Person> unique = allPeople.stream().distinct().toList();
        log.info("Total unique people fetched from LDAP: {}", unique.size());
        return unique;
    }

    private List<Person> fetchFromBase(String base, List<String> desiredAttributes) {
        return connectionScope.run(ldapOperations -> readAllPages(ldapOperations, base, desiredAttributes));
    }

    private List<Person> readAllPages(LdapOperations ldapOperations, String base, List<String> desiredAttributes) {
        List<Person> people = new ArrayList<>();
        PagedResultsDirContextProcessor processor = new PagedResultsDirContextProcessor(settings.getPageSize());
        AttributesMapper<Person> mapper = new PersonAttributesMapper(settings.getCompareAttribute(), desiredAttributes);
        SearchControls controls = searchControls(desiredAttributes);
        int pageCount = 0;

        do {
            pageCount++;
            List<Person> page = ldapOperations.search(base, settings.getFilter(), controls, mapper, processor);
            page.stream().filter(Objects::nonNull).forEach(people::add);
            log.debug("Page {} of base '{}' returned {} entries", pageCount, base, page.size());

            if (pageCount >= MAX_PAGES_PER_BASE) {
                throw new SyncClientException("LDAP base '" + base + "' exceeded " + MAX_PAGES_PER_BASE + " pages");
            }
        } while (processor.hasMore());

        return people;
    }

    private SearchControls searchControls(List<String> desiredAttributes) {
        SearchControls searchControls = new SearchControls();
        searchControls.setSearchScope(SearchControls.SUBTREE_SCOPE);
        if (desiredAttributes != null && !desiredAttributes.isEmpty()) {
            Set<String> requested = new LinkedHashSet<>(desiredAttributes);
            requested.add(settings.getCompareAttribute());
            searchControls.setReturningAttributes(requested.toArray(new String[0]));
        }
        searchControls.setTimeLimit(SERVER_TIME_LIMIT_SECONDS * 1000);
        return searchControls;
    }

    /**
     * Runs a callback against operations bound to one directory connection.
     */
    @FunctionalInterface
    interface ConnectionScope {
        List<Person> run(LdapOperationsCallback<List<Person>> callback);
    }

    static class PersonAttributesMapper implements AttributesMapper<Person> {

        private final String compareAttribute;
        private final List<String> desiredAttributes;

        PersonAttributesMapper(String compareAttribute, List<String> desiredAttributes) {
            this.compareAttribute = compareAttribute;
            this.desiredAttributes = desiredAttributes == null ? List.of() : desiredAttributes;
        }

        @Override
        public Person mapFromAttributes(Attributes attrs) throws NamingException {
            String compareKey = getAttribute(attrs, compareAttribute);
            if (compareKey == null || compareKey.isBlank()) {
                log.debug("Skipping LDAP entry without '{}'", compareAttribute);
                return null;
            }

            Map<String, String> values = new LinkedHashMap<>();
            if (desiredAttributes.isEmpty()) {
                NamingEnumeration<? extends Attribute> all = attrs.getAll();
                while (all.hasMore()) {
                    Attribute attribute = all.next();
                    Object value = attribute.get();
                    if (value != null) {
                        values.put(attribute.getID(), value.toString());
                    }
                }
            } else {
                for (String name : desiredAttributes) {
                    String value = getAttribute(attrs, name);
                    if (value != null) {
                        values.put(name, value);
                    }
                }
            }
            return new Person(compareKey, null, values, false);
        }

        private String getAttribute(Attributes attrs, String attrId) throws NamingException {
            Attribute attribute = attrs.get(attrId);
            if (attribute == null || attribute.get() == null) {
                return null;
            }
            return attribute.get().toString();
        }
    }
}
