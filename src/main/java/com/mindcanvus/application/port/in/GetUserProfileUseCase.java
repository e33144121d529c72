package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.model.UserProfile;

import java.util.Optional;

public interface GetUserProfileUseCase {
    Optional<UserProfile> getProfile(String username);
}
