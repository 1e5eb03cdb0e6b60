package io.b2mash.orgguard.member;

import io.b2mash.orgguard.api.Role;

/** Binds a subject to exactly one role within one organization. */
public record Membership(String subjectId, String organizationId, Role role) {}
