package com.mindcanvus.application.port.out;

import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;

import java.util.List;
import java.util.Optional;

public interface UserRepository {
    void save(User user, String passwordHash);
    Optional<User> findById(UserId id);
    Optional<User> findByUsername(String username);

    /**
     * Looks up the account and its password hash by normalized email, for login.
     */
    Optional<StoredCredentials> findCredentialsByEmail(String email);

    boolean exists(UserId id);
    boolean existsByUsername(String username);
    boolean existsByEmail(String email);

    /**
     * Case-insensitive regex match over username, first and last name,
     * most followed first.
     *
     * @throws SearchPatternRejectedException if the database cannot compile the pattern
     */
    List<User> search(String pattern, int offset, int limit);
    long countSearch(String pattern);

    record StoredCredentials(User user, String passwordHash) {}

    long count();
    void deleteAll();
}
