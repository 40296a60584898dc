package org.example.campusschedule.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.campusschedule.dto.request.LoginRequest;
import org.example.campusschedule.dto.request.RegisterRequest;
import org.example.campusschedule.dto.request.UpdateProfileRequest;
import org.example.campusschedule.dto.response.LoginResponse;
import org.example.campusschedule.dto.response.RegisterResponse;
import org.example.campusschedule.dto.response.UserProfileResponse;
import org.example.campusschedule.exception.DuplicateDocumentException;
import org.example.campusschedule.exception.DuplicateEmailException;
import org.example.campusschedule.exception.InvalidCredentialsException;
import org.example.campusschedule.exception.NotFoundException;
import org.example.campusschedule.model.DocumentKind;
import org.example.campusschedule.model.User;
import org.example.campusschedule.repository.DocumentStore;
import org.example.campusschedule.security.DemoTokenService;
import org.example.campusschedule.service.UserService;
import org.example.campusschedule.validation.DocumentValidator;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserServiceImpl implements UserService {

    private final DocumentStore store;
    private final DocumentValidator validator;
    private final PasswordEncoder passwordEncoder;
    private final DemoTokenService tokenService;

    @Override
    public RegisterResponse register(RegisterRequest request) {
        User user = new User(
                request.getName(),
                request.getEmail(),
                passwordEncoder.encode(request.getPassword()),
                request.getMajor(),
                request.getYear()
        );
        validator.validate(DocumentKind.USER, user);

        // the unique index on email arbitrates concurrent registrations
        try {
            String id = store.createDocument(DocumentKind.USER, user);
            log.info("Registered user {} with id {}", user.getEmail(), id);
            return new RegisterResponse("Registered", id);
        } catch (DuplicateDocumentException e) {
            log.info("Registration rejected, email already registered: {}", user.getEmail());
            throw new DuplicateEmailException(e);
        }
    }

    @Override
    public LoginResponse login(LoginRequest request) {
        User user = store.findOne(DocumentKind.USER, Map.of("email", request.getEmail())).orElse(null);
        if (user == null || !passwordEncoder.matches(request.getPassword(), user.getPasswordHash())) {
            throw new InvalidCredentialsException();
        }

        String token = tokenService.issueToken(request.getEmail());
        return new LoginResponse("Logged in", token, UserProfileResponse.loginProfile(user));
    }

    @Override
    public UserProfileResponse updateProfile(String email, UpdateProfileRequest request) {
        Map<String, Object> changes = new LinkedHashMap<>();
        if (request.getName() != null) {
            changes.put("name", request.getName());
        }
        if (request.getMajor() != null) {
            changes.put("major", request.getMajor());
        }
        if (request.getYear() != null) {
            changes.put("year", request.getYear());
        }
        if (request.getAvatar() != null) {
            changes.put("avatar", request.getAvatar());
        }
        validator.validateValues(DocumentKind.USER, changes);

        // Update first, then read back: an unknown email is a no-op update and surfaces as not found below.
        Map<String, Object> byEmail = Map.of("email", email);
        if (!changes.isEmpty()) {
            store.updateFields(DocumentKind.USER, byEmail, changes);
        }
        User user = store.findOne(DocumentKind.USER, byEmail)
                .orElseThrow(() -> new NotFoundException("User not found"));

        if (!changes.isEmpty()) {
            log.info("Updated profile fields {} for {}", changes.keySet(), email);
        }
        return UserProfileResponse.from(user);
    }
}
