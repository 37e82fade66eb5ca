package com.library.bookshelf.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity representing a reservation of a book by a user.
 *
 * <p>{@link #bookId} is a plain column rather than an association: the referenced book
 * was active when the reservation was made, but may be soft-deleted afterwards without
 * touching its reservations.
 *
 * <p>{@link #forenames} and {@link #surname} are derived from the owner's profile once,
 * at creation time, and never recomputed.
 *
 * <p><strong>Lifecycle</strong>: {@link ReservationState#RESERVED} to
 * {@link ReservationState#CANCELLED}, performed by a conditional bulk update in
 * {@code ReservationRepository} that also stamps {@link #cancelledAt}.
 */
@Entity
@Table(name = "reservations")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Reservation extends BaseEntity {

    @Id
    private UUID id;

    @Column(name = "book_id", nullable = false)
    private UUID bookId;

    /** Internal id of the owning {@link User}. */
    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "forenames", nullable = false, length = 320)
    private String forenames;

    @Column(name = "surname", nullable = false)
    private String surname;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private ReservationState state;

    @Column(name = "reserved_at", nullable = false, updatable = false)
    private Instant reservedAt;

    /** {@code null} until the reservation is cancelled. */
    @Column(name = "cancelled_at")
    private Instant cancelledAt;
}
