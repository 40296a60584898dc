package org.example.campusschedule.security;

import org.springframework.stereotype.Service;

/**
 * Issues the display token returned on login: the first 32 hex chars of the email's SHA-256.
 * It is deterministic per email and never expires, so nothing may treat it as proof of identity.
 */
@Service
public class DemoTokenService {

    static final int TOKEN_LENGTH = 32;

    public String issueToken(String email) {
        return Sha256PasswordEncoder.sha256Hex(email).substring(0, TOKEN_LENGTH);
    }
}
