package org.example.campusschedule.service.impl;

import jakarta.validation.Validation;
import org.example.campusschedule.dto.request.LoginRequest;
import org.example.campusschedule.dto.request.RegisterRequest;
import org.example.campusschedule.dto.request.UpdateProfileRequest;
import org.example.campusschedule.dto.response.LoginResponse;
import org.example.campusschedule.dto.response.RegisterResponse;
import org.example.campusschedule.dto.response.UserProfileResponse;
import org.example.campusschedule.exception.ClientValidationException;
import org.example.campusschedule.exception.DuplicateEmailException;
import org.example.campusschedule.exception.InvalidCredentialsException;
import org.example.campusschedule.exception.NotFoundException;
import org.example.campusschedule.exception.StoreUnavailableException;
import org.example.campusschedule.model.DocumentKind;
import org.example.campusschedule.model.User;
import org.example.campusschedule.security.DemoTokenService;
import org.example.campusschedule.security.Sha256PasswordEncoder;
import org.example.campusschedule.support.InMemoryDocumentStore;
import org.example.campusschedule.validation.DocumentValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class UserServiceImplTest {

    private InMemoryDocumentStore store;
    private UserServiceImpl service;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        service = new UserServiceImpl(
                store,
                new DocumentValidator(Validation.buildDefaultValidatorFactory().getValidator()),
                new Sha256PasswordEncoder(),
                new DemoTokenService());
    }

    @Test
    void registersDistinctEmailsWithUniqueIds() {
        RegisterResponse a = service.register(new RegisterRequest("Alice", "alice@uni.edu", "pw-1", "Math", "Freshman"));
        RegisterResponse b = service.register(new RegisterRequest("Bob", "bob@uni.edu", "pw-2", null, null));

        assertEquals("Registered", a.getMessage());
        assertNotNull(a.getId());
        assertNotEquals(a.getId(), b.getId());
        assertEquals(2, store.size(DocumentKind.USER));
    }

    @Test
    void storesDigestInsteadOfRawPassword() {
        service.register(new RegisterRequest("Alice", "alice@uni.edu", "password", null, null));

        User stored = store.findOne(DocumentKind.USER, Map.of("email", "alice@uni.edu")).orElseThrow();
        assertEquals("5e884898da28047151d0e56f8dc6292773603d0d6aabbdd62a11ef721d1542d8", stored.getPasswordHash());
    }

    @Test
    void secondRegistrationWithSameEmailIsRejected() {
        service.register(new RegisterRequest("Alice", "alice@uni.edu", "pw", null, null));

        assertThrows(DuplicateEmailException.class,
                () -> service.register(new RegisterRequest("Alice Again", "alice@uni.edu", "other", null, null)));
        assertEquals(1, store.size(DocumentKind.USER));
    }

    @Test
    void invalidUserNeverReachesTheStore() {
        store.setAvailable(false);

        // one-char name fails validation before the unavailable store is touched
        ClientValidationException ex = assertThrows(ClientValidationException.class,
                () -> service.register(new RegisterRequest("A", "alice@uni.edu", "pw", null, null)));
        assertThat(ex.getErrors()).anyMatch(m -> m.startsWith("name:"));
    }

    @Test
    void registerFailsWhenStoreIsUnavailable() {
        store.setAvailable(false);

        assertThrows(StoreUnavailableException.class,
                () -> service.register(new RegisterRequest("Alice", "alice@uni.edu", "pw", null, null)));
    }

    @Test
    void loginReturnsTokenAndProfileWithoutHash() {
        service.register(new RegisterRequest("Alice", "alice@uni.edu", "secret", "CS", "Sophomore"));

        LoginResponse response = service.login(new LoginRequest("alice@uni.edu", "secret"));

        assertEquals("Logged in", response.getMessage());
        assertEquals(Sha256PasswordEncoder.sha256Hex("alice@uni.edu").substring(0, 32), response.getToken());
        UserProfileResponse profile = response.getProfile();
        assertEquals("Alice", profile.getName());
        assertEquals("alice@uni.edu", profile.getEmail());
        assertEquals("CS", profile.getMajor());
        assertEquals("Sophomore", profile.getYear());
        assertNull(profile.getAvatar());
        assertNull(profile.getId());
    }

    @Test
    void unknownEmailAndWrongPasswordAreIndistinguishable() {
        service.register(new RegisterRequest("Alice", "alice@uni.edu", "secret", null, null));

        InvalidCredentialsException unknown = assertThrows(InvalidCredentialsException.class,
                () -> service.login(new LoginRequest("nobody@uni.edu", "secret")));
        InvalidCredentialsException wrong = assertThrows(InvalidCredentialsException.class,
                () -> service.login(new LoginRequest("alice@uni.edu", "Secret")));

        assertEquals(unknown.getMessage(), wrong.getMessage());
    }

    @Test
    void updateMergesOnlyProvidedFields() {
        service.register(new RegisterRequest("Alice", "alice@uni.edu", "secret", "Math", "Junior"));
        UpdateProfileRequest request = new UpdateProfileRequest();
        request.setMajor("CS");

        UserProfileResponse updated = service.updateProfile("alice@uni.edu", request);

        assertEquals("Alice", updated.getName());
        assertEquals("CS", updated.getMajor());
        assertEquals("Junior", updated.getYear());
        assertNotNull(updated.getId());
    }

    @Test
    void emptyUpdateReturnsCurrentProfile() {
        service.register(new RegisterRequest("Alice", "alice@uni.edu", "secret", "Math", null));

        UserProfileResponse profile = service.updateProfile("alice@uni.edu", new UpdateProfileRequest());

        assertEquals("Math", profile.getMajor());
    }

    @Test
    void updateOfUnknownEmailIsNotFound() {
        UpdateProfileRequest request = new UpdateProfileRequest();
        request.setName("Ghost");

        assertThrows(NotFoundException.class, () -> service.updateProfile("ghost@uni.edu", request));
        assertEquals(0, store.size(DocumentKind.USER));
    }

    @Test
    void updateRejectsOverlongMajor() {
        service.register(new RegisterRequest("Alice", "alice@uni.edu", "secret", null, null));
        UpdateProfileRequest request = new UpdateProfileRequest();
        request.setMajor("x".repeat(81));

        assertThrows(ClientValidationException.class, () -> service.updateProfile("alice@uni.edu", request));
        assertNull(store.findOne(DocumentKind.USER, Map.of("email", "alice@uni.edu")).orElseThrow().getMajor());
    }
}
