package com.nhoyhub.order.controller;

import com.nhoyhub.order.resource.TokenResource;
import com.nhoyhub.order.service.AuthService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    @PostMapping("/login")
    public ResponseEntity<TokenResource> login(@RequestParam String username, @RequestParam String password) {
        log.info("Received login request for user: {}", username);
        String token = authService.login(username, password);
        return ResponseEntity.ok(TokenResource.builder()
                .accessToken(token)
                .tokenType(AuthService.TOKEN_TYPE)
                .build());
    }
}
