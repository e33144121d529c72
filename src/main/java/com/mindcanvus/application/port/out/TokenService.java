package com.mindcanvus.application.port.out;

import com.mindcanvus.domain.model.Actor;
import com.mindcanvus.domain.model.User;

import java.util.Optional;

/**
 * Issues and verifies bearer tokens.
 */
public interface TokenService {

    String issue(User user);

    /**
     * Returns the actor a token was issued to, or empty when the token is malformed,
     * badly signed or expired.
     */
    Optional<Actor> verify(String token);
}
