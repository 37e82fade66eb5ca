package com.library.bookshelf.entity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * JPA entity representing an account linked to the external identity provider.
 *
 * <p>Created on the first successful sign-in and looked up by
 * {@link #externalSubjectId} (the OIDC {@code sub} claim) on every later one. The name
 * and email columns mirror the most recent profile claims. {@link #roles} are assigned
 * administratively; sign-in never changes them.
 *
 * <p>Roles are loaded eagerly because every authenticated request needs them for the
 * access checks.
 */
@Entity
@Table(name = "users")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class User extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "external_subject_id", nullable = false, unique = true)
    private String externalSubjectId;

    @Column(name = "email", length = 320)
    private String email;

    @Column(name = "display_name")
    private String displayName;

    @Column(name = "given_name")
    private String givenName;

    @Column(name = "family_name")
    private String familyName;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "user_roles", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "role", nullable = false, length = 50)
    private Set<String> roles = new HashSet<>();

    @Column(name = "last_login_at")
    private Instant lastLoginAt;
}
