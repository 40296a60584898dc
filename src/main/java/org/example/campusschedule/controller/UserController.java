package org.example.campusschedule.controller;

import lombok.RequiredArgsConstructor;
import org.example.campusschedule.dto.request.UpdateProfileRequest;
import org.example.campusschedule.dto.response.UserProfileResponse;
import org.example.campusschedule.service.UserService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/profile")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    @PutMapping("/{email}")
    public ResponseEntity<UserProfileResponse> updateProfile(@PathVariable String email,
                                                             @RequestBody UpdateProfileRequest request) {
        return ResponseEntity.ok(userService.updateProfile(email, request));
    }
}
