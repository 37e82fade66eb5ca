package com.library.bookshelf.entity;

/**
 * Visibility state of a {@link Book}.
 *
 * <p>The only transition is {@link #ACTIVE} to {@link #DELETED}. A deleted book stays in
 * the table but is excluded from every read, update and reservation lookup.
 */
public enum BookState {
    ACTIVE,
    DELETED
}
