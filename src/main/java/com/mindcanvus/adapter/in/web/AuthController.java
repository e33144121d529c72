package com.mindcanvus.adapter.in.web;

import com.mindcanvus.application.port.in.GetCurrentUserUseCase;
import com.mindcanvus.application.port.in.LoginUseCase;
import com.mindcanvus.application.port.in.RegisterUseCase;
import com.mindcanvus.application.port.in.RegisterUseCase.RegisterCommand;
import com.mindcanvus.domain.error.AuthError;
import com.mindcanvus.domain.model.AuthSession;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.infrastructure.context.RequestContext;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

@RestController
@RequestMapping("/api/auth")
@Tag(name = "Auth", description = "Registration, login and current account")
public class AuthController {

    private final RegisterUseCase registerUseCase;
    private final LoginUseCase loginUseCase;
    private final GetCurrentUserUseCase getCurrentUserUseCase;

    public AuthController(
            RegisterUseCase registerUseCase,
            LoginUseCase loginUseCase,
            GetCurrentUserUseCase getCurrentUserUseCase) {
        this.registerUseCase = registerUseCase;
        this.loginUseCase = loginUseCase;
        this.getCurrentUserUseCase = getCurrentUserUseCase;
    }

    @PostMapping("/register")
    @Operation(summary = "Register", description = "Creates an account and returns a bearer token for it")
    public ResponseEntity<?> register(@Valid @RequestBody RegisterRequest request) {
        Result<AuthSession, AuthError> result = registerUseCase.register(new RegisterCommand(
            request.username(), request.email(), request.password(), request.firstName(), request.lastName()));

        return result.isSuccess()
            ? ResponseEntity.status(HttpStatus.CREATED).body(AuthResponse.from(result.getOrThrow()))
            : ErrorResponses.of(result.errorOrNull());
    }

    @PostMapping("/login")
    @Operation(summary = "Log in", description = "Exchanges email and password for a bearer token")
    public ResponseEntity<?> login(@Valid @RequestBody LoginRequest request) {
        Result<AuthSession, AuthError> result = loginUseCase.login(request.email(), request.password());

        return result.isSuccess()
            ? ResponseEntity.ok(AuthResponse.from(result.getOrThrow()))
            : ErrorResponses.of(result.errorOrNull());
    }

    @GetMapping("/me")
    @Operation(summary = "Current account", description = "Returns the account behind the bearer token")
    public AccountResponse me() {
        return AccountResponse.from(getCurrentUserUseCase.getCurrentUser(RequestContext.getUserId()));
    }

    public record RegisterRequest(
        @NotBlank @Size(min = 3, max = 30) String username,
        @NotBlank @Email String email,
        @NotBlank @Size(min = 6) String password,
        String firstName,
        String lastName
    ) {}

    public record LoginRequest(
        @NotBlank String email,
        @NotBlank String password
    ) {}

    public record AuthResponse(String token, AccountResponse user) {
        static AuthResponse from(AuthSession session) {
            return new AuthResponse(session.token(), AccountResponse.from(session.user()));
        }
    }

    public record AccountResponse(
        String id,
        String username,
        String email,
        String firstName,
        String lastName,
        String bio,
        String avatar,
        String role,
        Instant createdAt
    ) {
        static AccountResponse from(User user) {
            return new AccountResponse(
                user.id().toString(),
                user.username(),
                user.email(),
                user.firstName(),
                user.lastName(),
                user.bio(),
                user.avatar(),
                user.role().value(),
                user.createdAt()
            );
        }
    }
}
