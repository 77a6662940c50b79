package io.b2mash.b2b.projecthub.user;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** An account. Email is the login identifier; organization is optional until the user joins one. */
@Entity
@Table(name = "users")
public class User {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "email", nullable = false, unique = true, length = 254)
  private String email;

  @Column(name = "first_name", length = 150)
  private String firstName;

  @Column(name = "last_name", length = 150)
  private String lastName;

  @Column(name = "password_hash", nullable = false)
  private String passwordHash;

  @Column(name = "organization_id")
  private UUID organizationId;

  @Column(name = "organization_admin", nullable = false)
  private boolean organizationAdmin;

  @Column(name = "superuser", nullable = false)
  private boolean superuser;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "token_version", nullable = false)
  private long tokenVersion;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected User() {}

  public User(String email, String firstName, String lastName, String passwordHash) {
    this.email = email;
    this.firstName = firstName;
    this.lastName = lastName;
    this.passwordHash = passwordHash;
    this.active = true;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getEmail() {
    return email;
  }

  public String getFirstName() {
    return firstName;
  }

  public String getLastName() {
    return lastName;
  }

  public String getFullName() {
    String full = ((firstName != null ? firstName : "") + " " + (lastName != null ? lastName : ""));
    return full.isBlank() ? email : full.trim();
  }

  public String getPasswordHash() {
    return passwordHash;
  }

  public UUID getOrganizationId() {
    return organizationId;
  }

  public boolean isOrganizationAdmin() {
    return organizationAdmin;
  }

  public boolean isSuperuser() {
    return superuser;
  }

  public boolean isActive() {
    return active;
  }

  public long getTokenVersion() {
    return tokenVersion;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void joinOrganization(UUID organizationId, boolean admin) {
    this.organizationId = organizationId;
    this.organizationAdmin = admin;
    this.updatedAt = Instant.now();
  }

  /** Invalidates every access and refresh token issued so far. */
  public void revokeTokens() {
    this.tokenVersion++;
    this.updatedAt = Instant.now();
  }

  public void deactivate() {
    this.active = false;
    this.updatedAt = Instant.now();
  }
}
