package org.example.campusschedule.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.example.campusschedule.dto.request.LoginRequest;
import org.example.campusschedule.dto.request.RegisterRequest;
import org.example.campusschedule.dto.response.LoginResponse;
import org.example.campusschedule.dto.response.RegisterResponse;
import org.example.campusschedule.service.UserService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AuthController {

    private final UserService userService;

    @PostMapping("/register")
    public ResponseEntity<RegisterResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.ok(userService.register(request));
    }

    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(userService.login(request));
    }
}
