package com.genads.api.service;

import com.genads.api.dto.AuthDto;
import com.genads.api.entity.User;
import com.genads.api.store.UserAccountStore;
import com.genads.common.exception.ApiException;
import com.genads.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private static final String SIGNED_IN = "signed_in";

    private final UserAccountStore userAccountStore;
    private final PasswordEncoder passwordEncoder;

    public AuthDto.SignupResponse signup(AuthDto.SignupRequest request) {
        User user = User.builder()
                .name(request.getName())
                .email(request.getEmail())
                .passwordHash(passwordEncoder.encode(request.getPassword()))
                .build();

        User stored = userAccountStore.insertIfEmailAbsent(user)
                .orElseThrow(() -> new ApiException(ErrorCode.DUPLICATE_EMAIL));
        log.info("New user registered: {}", stored.getId());

        return AuthDto.SignupResponse.builder()
                .id(stored.getId())
                .name(stored.getName())
                .email(stored.getEmail())
                .build();
    }

    /**
     * Unknown email and wrong password fail identically.
     */
    public AuthDto.SigninResponse signin(AuthDto.SigninRequest request) {
        User user = userAccountStore.findByEmail(request.getEmail())
                .filter(found -> passwordEncoder.matches(request.getPassword(), found.getPasswordHash()))
                .orElseThrow(() -> new ApiException(ErrorCode.INVALID_CREDENTIALS));

        log.info("User signed in: {}", user.getId());

        return AuthDto.SigninResponse.builder()
                .message(SIGNED_IN)
                .email(request.getEmail())
                .name(user.getName())
                .avatarUrl(user.getAvatarUrl())
                .build();
    }
}
