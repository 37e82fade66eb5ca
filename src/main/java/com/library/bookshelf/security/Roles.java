package com.library.bookshelf.security;

/** Role names stored in {@code user_roles}. */
public final class Roles {

    public static final String ADMIN = "admin";
    public static final String EDITOR = "editor";
    public static final String VIEWER = "viewer";

    private Roles() {}
}
