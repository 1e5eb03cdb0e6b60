package io.b2mash.orgguard.rbac;

/** Actions one member can take on another member's record. */
public enum MemberAction {
  VIEW,
  EDIT,
  DELETE,
  MANAGE
}
