package com.kinshipkeeper.config;

import com.kinshipkeeper.model.AppUser;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Accounts that own records. Define under 'kinship.users' in application.yml.
 */
@Configuration
@ConfigurationProperties(prefix = "kinship")
public class UsersConfig {

    private List<UserDefinition> users = new ArrayList<>();

    public List<UserDefinition> getUsers() {
        return users;
    }

    public void setUsers(List<UserDefinition> users) {
        this.users = users;
    }

    public List<AppUser> getAppUsers() {
        return users.stream()
            .map(UserDefinition::toAppUser)
            .toList();
    }

    public Optional<AppUser> findUser(String username) {
        return getAppUsers().stream()
            .filter(user -> user.username().equals(username))
            .findFirst();
    }

    /**
     * Mutable class for Spring Boot configuration binding
     */
    public static class UserDefinition {
        private String username;
        private String password;
        private String displayName;
        private String role = "USER";
        private Long profilePersonId;

        public AppUser toAppUser() {
            return new AppUser(username, password, displayName, role, profilePersonId);
        }

        // Getters and setters for Spring Boot binding
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public String getDisplayName() { return displayName; }
        public void setDisplayName(String displayName) { this.displayName = displayName; }

        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }

        public Long getProfilePersonId() { return profilePersonId; }
        public void setProfilePersonId(Long profilePersonId) { this.profilePersonId = profilePersonId; }
    }
}
