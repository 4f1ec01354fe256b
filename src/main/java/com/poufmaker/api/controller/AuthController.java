package com.poufmaker.api.controller;

import com.poufmaker.api.dto.ClientInfo;
import com.poufmaker.api.dto.InfoResponse;
import com.poufmaker.api.dto.LoginRequest;
import com.poufmaker.api.dto.LoginResponse;
import com.poufmaker.api.dto.PasswordResetRequest;
import com.poufmaker.api.dto.RegisterRequest;
import com.poufmaker.api.dto.RegisterResponse;
import com.poufmaker.api.dto.ResetPasswordRequest;
import com.poufmaker.api.service.AuthService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {
    private final AuthService authService;

    @PostMapping("/register")
    public ResponseEntity<RegisterResponse> register(@Valid @RequestBody RegisterRequest request,
                                                     HttpServletRequest httpRequest) {
        UUID userId = authService.register(request, ClientInfo.from(httpRequest));
        return new ResponseEntity<>(new RegisterResponse(
                "Registration successful. Please check your email to confirm your account.", userId),
                HttpStatus.CREATED);
    }

    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request,
                                               HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.login(request, ClientInfo.from(httpRequest)));
    }

    @GetMapping("/verify-email")
    public ResponseEntity<InfoResponse> verifyEmail(@RequestParam(required = false) String token) {
        authService.verifyEmail(token);
        return ResponseEntity.ok(new InfoResponse("Email confirmed successfully. You can now log in."));
    }

    @PostMapping("/request-reset")
    public ResponseEntity<InfoResponse> requestReset(@Valid @RequestBody PasswordResetRequest request) {
        authService.requestPasswordReset(request.getEmail());
        return ResponseEntity.ok(new InfoResponse("Password reset instructions have been sent to your email."));
    }

    @PostMapping("/reset-password")
    public ResponseEntity<InfoResponse> resetPassword(@Valid @RequestBody ResetPasswordRequest request,
                                                      HttpServletRequest httpRequest) {
        authService.resetPassword(request, ClientInfo.from(httpRequest));
        return ResponseEntity.ok(new InfoResponse("Password has been reset successfully."));
    }
}
