package com.egg.service;

import com.egg.dto.response.AuthResponse;
import com.egg.entity.User;
import com.egg.repository.UserRepository;
import com.egg.security.JwtTokenProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Anonymous authentication.
 *
 * Every call creates a fresh user and returns a JWT whose subject is the user id.
 * There are no credentials: the token itself is the identity.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AuthService {

    private final UserRepository userRepository;
    private final JwtTokenProvider jwtTokenProvider;

    @Transactional
    public AuthResponse createAnonymousUser() {
        User user = userRepository.save(new User());
        String token = jwtTokenProvider.generateToken(user.getId());

        log.info("Anonymous user created: userId={}", user.getId());

        return AuthResponse.builder()
                .userId(user.getId())
                .token(token)
                .build();
    }
}
