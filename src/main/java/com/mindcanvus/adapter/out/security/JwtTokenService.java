package com.mindcanvus.adapter.out.security;

import com.mindcanvus.application.port.out.TokenService;
import com.mindcanvus.domain.model.Actor;
import com.mindcanvus.domain.model.Role;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;
import com.mindcanvus.infrastructure.config.AppProperties;
import com.nimbusds.jose.jwk.source.ImmutableSecret;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * HS256-signed tokens. The subject is the user id; the role travels as a claim.
 */
@Component
public class JwtTokenService implements TokenService {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenService.class);

    private static final String ROLE_CLAIM = "role";
    private static final String USERNAME_CLAIM = "username";
    private static final int MIN_SECRET_BYTES = 32;

    private final JwtEncoder encoder;
    private final JwtDecoder decoder;
    private final Duration tokenTtl;
    private final String issuer;
    private final Clock clock;

    public JwtTokenService(AppProperties appProperties, Clock clock) {
        AppProperties.Security security = appProperties.getSecurity();
        String secret = security.getJwtSecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("app.security.jwt-secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        SecretKey key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        this.encoder = new NimbusJwtEncoder(new ImmutableSecret<>(key));
        this.decoder = NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
        this.tokenTtl = security.getTokenTtl();
        this.issuer = security.getIssuer();
        this.clock = clock;
    }

    @Override
    public String issue(User user) {
        Instant now = clock.instant();
        JwtClaimsSet claims = JwtClaimsSet.builder()
            .issuer(issuer)
            .subject(user.id().toString())
            .issuedAt(now)
            .expiresAt(now.plus(tokenTtl))
            .claim(USERNAME_CLAIM, user.username())
            .claim(ROLE_CLAIM, user.role().value())
            .build();
        JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
        return encoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
    }

    @Override
    public Optional<Actor> verify(String token) {
        Jwt jwt;
        try {
            jwt = decoder.decode(token);
        } catch (JwtException e) {
            log.debug("Token rejected: {}", e.getMessage());
            return Optional.empty();
        }
        var userIdResult = UserId.parse(jwt.getSubject());
        if (userIdResult.isFailure()) {
            log.warn("Token carries an invalid subject: {}", userIdResult.errorOrNull().message());
            return Optional.empty();
        }
        Role role = Role.fromValue(jwt.getClaimAsString(ROLE_CLAIM));
        return Optional.of(new Actor(userIdResult.getOrThrow(), role));
    }
}
