package io.b2mash.orgguard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Names under which a request may carry an organization hint.
 *
 * @param queryParameter query parameter consulted after the session's active organization
 * @param pathVariable URI template variable consulted last
 */
@ConfigurationProperties(prefix = "orgguard.hints")
public record GuardProperties(
    @DefaultValue("organizationId") String queryParameter,
    @DefaultValue("organizationId") String pathVariable) {}
