package io.b2mash.orgguard.member;

import io.b2mash.orgguard.api.Role;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Membership row. The role is kept as its raw stored string; {@link #parsedRole()} is the typed
 * view and is empty for values outside {@link Role}, which callers treat as no membership.
 */
@Entity
@Table(
    name = "members",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uq_members_subject_org",
            columnNames = {"subject_id", "organization_id"}))
public class Member {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "subject_id", nullable = false, length = 255)
  private String subjectId;

  @Column(name = "organization_id", nullable = false, length = 255)
  private String organizationId;

  @Column(name = "role", nullable = false, length = 50)
  private String role;

  @Column(name = "name", length = 255)
  private String name;

  @Column(name = "email", length = 255)
  private String email;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Member() {}

  public Member(String subjectId, String organizationId, String role, String name, String email) {
    this.subjectId = subjectId;
    this.organizationId = organizationId;
    this.role = role;
    this.name = name;
    this.email = email;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getSubjectId() {
    return subjectId;
  }

  public String getOrganizationId() {
    return organizationId;
  }

  public String getRole() {
    return role;
  }

  public Optional<Role> parsedRole() {
    return Role.tryParse(role);
  }

  public String getName() {
    return name;
  }

  public String getEmail() {
    return email;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void changeRole(String role) {
    this.role = role;
    this.updatedAt = Instant.now();
  }
}
