package org.example.campusschedule.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.example.campusschedule.model.User;

/**
 * Public view of a user. Never carries the password hash.
 * The login profile leaves the id out; the profile update returns it as {@code _id}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class UserProfileResponse {

    @JsonProperty("_id")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String id;
    private String name;
    private String email;
    private String major;
    private String year;
    private String avatar;

    public static UserProfileResponse from(User user) {
        return new UserProfileResponse(
                user.getId(),
                user.getName(),
                user.getEmail(),
                user.getMajor(),
                user.getYear(),
                user.getAvatar()
        );
    }

    public static UserProfileResponse loginProfile(User user) {
        UserProfileResponse profile = from(user);
        profile.setId(null);
        return profile;
    }
}
