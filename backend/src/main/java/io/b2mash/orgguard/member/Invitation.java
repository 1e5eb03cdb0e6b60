package io.b2mash.orgguard.member;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "invitations")
public class Invitation {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false, length = 255)
  private String organizationId;

  @Column(name = "email", nullable = false, length = 255)
  private String email;

  @Column(name = "role", nullable = false, length = 50)
  private String role;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private Status status;

  @Column(name = "inviter_subject_id", nullable = false, length = 255)
  private String inviterSubjectId;

  @Column(name = "expires_at", nullable = false)
  private Instant expiresAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Invitation() {}

  public Invitation(
      String organizationId,
      String email,
      String role,
      String inviterSubjectId,
      Instant expiresAt) {
    this.organizationId = organizationId;
    this.email = email;
    this.role = role;
    this.inviterSubjectId = inviterSubjectId;
    this.expiresAt = expiresAt;
    this.status = Status.PENDING;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getOrganizationId() {
    return organizationId;
  }

  public String getEmail() {
    return email;
  }

  public String getRole() {
    return role;
  }

  public Status getStatus() {
    return status;
  }

  public String getInviterSubjectId() {
    return inviterSubjectId;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public enum Status {
    PENDING,
    ACCEPTED,
    REVOKED
  }
}
