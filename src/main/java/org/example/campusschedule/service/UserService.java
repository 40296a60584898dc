package org.example.campusschedule.service;

import org.example.campusschedule.dto.request.LoginRequest;
import org.example.campusschedule.dto.request.RegisterRequest;
import org.example.campusschedule.dto.request.UpdateProfileRequest;
import org.example.campusschedule.dto.response.LoginResponse;
import org.example.campusschedule.dto.response.RegisterResponse;
import org.example.campusschedule.dto.response.UserProfileResponse;

public interface UserService {
    RegisterResponse register(RegisterRequest request);
    LoginResponse login(LoginRequest request);
    UserProfileResponse updateProfile(String email, UpdateProfileRequest request);
}
