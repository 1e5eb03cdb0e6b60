package io.b2mash.orgguard.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/** @param ttl how long a member invitation stays valid */
@ConfigurationProperties(prefix = "orgguard.invitations")
public record InvitationProperties(@DefaultValue("7d") Duration ttl) {}
