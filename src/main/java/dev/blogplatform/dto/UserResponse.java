package dev.blogplatform.dto;

import dev.blogplatform.entity.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {

    private String id;
    private String email;
    private String username;
    private String fullName;
    private String bio;
    private String profileImageUrl;
    private Boolean isActive;
    private Boolean isVerified;
    private LocalDateTime dateAdded;
    private LocalDateTime dateUpdated;

    public static UserResponse fromEntity(User user) {
        return UserResponse.builder()
                .id(String.valueOf(user.getId()))
                .email(user.getEmail())
                .username(user.getUsername())
                .fullName(user.getFullName())
                .bio(user.getBio())
                .profileImageUrl(user.getProfileImageUrl())
                .isActive(user.getActive())
                .isVerified(user.getVerified())
                .dateAdded(user.getDateAdded())
                .dateUpdated(user.getDateUpdated())
                .build();
    }
}
