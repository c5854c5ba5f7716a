package com.myfinancehub.ledger.auth;

import com.myfinancehub.ledger.controller.dto.ErrorResponseDto;
import com.myfinancehub.ledger.model.UserProfile;
import com.myfinancehub.ledger.security.AuthenticatedUserProvider;
import com.myfinancehub.ledger.security.JwtIssuerService;
import com.myfinancehub.ledger.security.RequestContextHolder;
import com.myfinancehub.ledger.session.LedgerSession;
import com.myfinancehub.ledger.session.SessionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final CredentialService credentialService;
    private final SessionService sessionService;
    private final JwtIssuerService jwtIssuerService;
    private final AuthenticatedUserProvider authenticatedUserProvider;

    public AuthController(CredentialService credentialService,
                          SessionService sessionService,
                          JwtIssuerService jwtIssuerService,
                          AuthenticatedUserProvider authenticatedUserProvider) {
        this.credentialService = credentialService;
        this.sessionService = sessionService;
        this.jwtIssuerService = jwtIssuerService;
        this.authenticatedUserProvider = authenticatedUserProvider;
    }

    public record RegisterRequest(String username, String password, String email) {}

    public record RegisterResponse(String username, String email) {}

    public record LoginRequest(@NotBlank String username, @NotBlank String password) {}

    public record LoginResponse(String accessToken, String tokenType, long expiresIn, String username, String period) {}

    public record ChangePasswordRequest(@NotNull String currentPassword, @NotNull String newPassword) {}

    @PostMapping(path = "/register", consumes = "application/json", produces = "application/json")
    public ResponseEntity<RegisterResponse> register(@RequestBody RegisterRequest request) {
        UserProfile profile = credentialService.register(request.username(), request.password(), request.email());
        return ResponseEntity.status(HttpStatus.CREATED).body(new RegisterResponse(profile.username(), profile.email()));
    }

    @PostMapping(path = "/login", consumes = "application/json", produces = "application/json")
    public ResponseEntity<?> login(@RequestBody @Valid LoginRequest request) {
        Optional<LedgerSession> session = sessionService.login(request.username(), request.password());
        if (session.isEmpty()) {
            String traceId = RequestContextHolder.traceId().orElse(null);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(new ErrorResponseDto("INVALID_CREDENTIALS", "Invalid username or password", Map.of(), traceId));
        }
        String token = jwtIssuerService.issue(session.get().username());
        return ResponseEntity.ok(new LoginResponse(
                token,
                "Bearer",
                jwtIssuerService.ttlSeconds(),
                session.get().username(),
                session.get().period().toString()
        ));
    }

    @PostMapping(path = "/password", consumes = "application/json")
    public ResponseEntity<Void> changePassword(@RequestBody @Valid ChangePasswordRequest request) {
        String username = authenticatedUserProvider.requireCurrentUsername();
        credentialService.changePassword(username, request.currentPassword(), request.newPassword());
        return ResponseEntity.noContent().build();
    }
}
