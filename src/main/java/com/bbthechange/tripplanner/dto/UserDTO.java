package com.bbthechange.tripplanner.dto;

import com.bbthechange.tripplanner.model.User;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Public view of a user account. Never carries the password hash.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserDTO {

    private String id;
    private String email;
    private String name;
    private Instant createdAt;

    public static UserDTO from(User user) {
        return new UserDTO(user.getId(), user.getEmail(), user.getName(), user.getCreatedAt());
    }
}
