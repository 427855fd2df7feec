package io.fluenthttp.example;

/** A user as returned by the user API. */
public record User(UserId id, String name) {}
