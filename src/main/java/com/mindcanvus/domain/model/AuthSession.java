package com.mindcanvus.domain.model;

/**
 * A freshly issued bearer token together with the account it belongs to.
 */
public record AuthSession(String token, User user) {}
