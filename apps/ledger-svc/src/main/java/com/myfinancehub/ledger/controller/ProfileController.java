package com.myfinancehub.ledger.controller;

import com.myfinancehub.ledger.auth.CredentialService;
import com.myfinancehub.ledger.controller.dto.EmailUpdateRequestDto;
import com.myfinancehub.ledger.controller.dto.ProfileResponseDto;
import com.myfinancehub.ledger.error.NotFoundException;
import com.myfinancehub.ledger.journal.LoginJournal;
import com.myfinancehub.ledger.model.UserProfile;
import com.myfinancehub.ledger.security.AuthenticatedUserProvider;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/profile")
public class ProfileController {

    private final CredentialService credentialService;
    private final LoginJournal loginJournal;
    private final AuthenticatedUserProvider authenticatedUserProvider;

    public ProfileController(CredentialService credentialService,
                             LoginJournal loginJournal,
                             AuthenticatedUserProvider authenticatedUserProvider) {
        this.credentialService = credentialService;
        this.loginJournal = loginJournal;
        this.authenticatedUserProvider = authenticatedUserProvider;
    }

    @GetMapping
    public ResponseEntity<ProfileResponseDto> profile() {
        String username = authenticatedUserProvider.requireCurrentUsername();
        UserProfile profile = credentialService.findProfile(username)
                .orElseThrow(() -> new NotFoundException("user " + username + " not found"));
        return ResponseEntity.ok(map(profile));
    }

    @PutMapping("/email")
    public ResponseEntity<ProfileResponseDto> updateEmail(@RequestBody @Valid EmailUpdateRequestDto request) {
        String username = authenticatedUserProvider.requireCurrentUsername();
        UserProfile profile = credentialService.updateEmail(username, request.email());
        return ResponseEntity.ok(map(profile));
    }

    private ProfileResponseDto map(UserProfile profile) {
        return new ProfileResponseDto(
                profile.username(),
                profile.email(),
                profile.createdAt(),
                loginJournal.recentLogins(profile.username())
        );
    }
}
