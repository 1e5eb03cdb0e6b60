package io.b2mash.orgguard.organization;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "organizations")
public class Organization {

  @Id
  @Column(name = "id", nullable = false, length = 255)
  private String id;

  @Column(name = "name", nullable = false)
  private String name;

  @Column(name = "slug", unique = true)
  private String slug;

  @Column(name = "logo", length = 1000)
  private String logo;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Organization() {}

  public Organization(String id, String name, String slug) {
    this.id = id;
    this.name = name;
    this.slug = slug;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getSlug() {
    return slug;
  }

  public String getLogo() {
    return logo;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  /** Applies the non-null fields. */
  public void updateSettings(String name, String slug, String logo) {
    if (name != null) {
      this.name = name;
    }
    if (slug != null) {
      this.slug = slug;
    }
    if (logo != null) {
      this.logo = logo;
    }
    this.updatedAt = Instant.now();
  }
}
