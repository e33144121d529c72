package com.mindcanvus.application.service;

import com.mindcanvus.application.port.in.GetCurrentUserUseCase;
import com.mindcanvus.application.port.in.LoginUseCase;
import com.mindcanvus.application.port.in.RegisterUseCase;
import com.mindcanvus.application.port.out.IdGenerator;
import com.mindcanvus.application.port.out.MetricsPort;
import com.mindcanvus.application.port.out.PasswordHasher;
import com.mindcanvus.application.port.out.TokenService;
import com.mindcanvus.application.port.out.UserRepository;
import com.mindcanvus.domain.error.AuthError;
import com.mindcanvus.domain.error.ValidationError.AccountError;
import com.mindcanvus.domain.model.AuthSession;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;
import com.mindcanvus.infrastructure.exception.UserNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
public class AuthService implements RegisterUseCase, LoginUseCase, GetCurrentUserUseCase {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final int MIN_PASSWORD_LENGTH = 6;

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final TokenService tokenService;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;
    private final Clock clock;

    public AuthService(
            UserRepository userRepository,
            PasswordHasher passwordHasher,
            TokenService tokenService,
            IdGenerator idGenerator,
            MetricsPort metrics,
            Clock clock) {
        this.userRepository = userRepository;
        this.passwordHasher = passwordHasher;
        this.tokenService = tokenService;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public Result<AuthSession, AuthError> register(RegisterCommand command) {
        log.debug("Processing registration for username={}", command.username());

        if (command.password() == null || command.password().length() < MIN_PASSWORD_LENGTH) {
            return Result.failure(new AuthError.ValidationFailed(new AccountError.PasswordTooShort(MIN_PASSWORD_LENGTH)));
        }

        var userResult = User.create(
            UserId.of(idGenerator.generate()),
            command.username(),
            command.email(),
            command.firstName(),
            command.lastName(),
            clock.instant()
        );
        if (userResult.isFailure()) {
            log.warn("Registration validation failed: {}", userResult.errorOrNull().message());
            return Result.failure(new AuthError.ValidationFailed(userResult.errorOrNull()));
        }
        User user = userResult.getOrThrow();

        if (userRepository.existsByUsername(user.username())) {
            return Result.failure(new AuthError.UsernameTaken(user.username()));
        }
        if (userRepository.existsByEmail(user.email())) {
            return Result.failure(new AuthError.EmailTaken(user.email()));
        }

        try {
            userRepository.save(user, passwordHasher.hash(command.password()));
        } catch (DuplicateKeyException e) {
            // lost a race with a concurrent registration
            log.warn("Concurrent registration collided for username={}", user.username());
            return Result.failure(new AuthError.UsernameTaken(user.username()));
        }

        metrics.incrementUsersRegistered();
        log.info("User registered: id={}, username={}", user.id(), user.username());

        return Result.success(new AuthSession(tokenService.issue(user), user));
    }

    @Override
    public Result<AuthSession, AuthError> login(String email, String password) {
        var credentials = userRepository.findCredentialsByEmail(User.normalizeEmail(email));
        if (credentials.isEmpty() || !passwordHasher.matches(password, credentials.get().passwordHash())) {
            log.warn("Failed login attempt");
            return Result.failure(AuthError.InvalidCredentials.INSTANCE);
        }
        User user = credentials.get().user();
        log.info("User logged in: id={}", user.id());
        return Result.success(new AuthSession(tokenService.issue(user), user));
    }

    @Override
    public User getCurrentUser(UserId userId) {
        return userRepository.findById(userId)
            .orElseThrow(() -> new UserNotFoundException(userId.toString()));
    }
}
