package com.mindcanvus.application.service;

import com.mindcanvus.application.port.in.GetFollowSuggestionsUseCase;
import com.mindcanvus.application.port.in.GetUserProfileUseCase;
import com.mindcanvus.application.port.in.SearchUsersUseCase;
import com.mindcanvus.application.port.out.FollowRepository;
import com.mindcanvus.application.port.out.FriendshipRepository;
import com.mindcanvus.application.port.out.PostRepository;
import com.mindcanvus.application.port.out.SearchPatternRejectedException;
import com.mindcanvus.application.port.out.UserRepository;
import com.mindcanvus.domain.error.ValidationError;
import com.mindcanvus.domain.model.Page;
import com.mindcanvus.domain.model.PageRequest;
import com.mindcanvus.domain.model.Result;
import com.mindcanvus.domain.model.User;
import com.mindcanvus.domain.model.UserId;
import com.mindcanvus.domain.model.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

@Service
public class UserService implements GetUserProfileUseCase, SearchUsersUseCase, GetFollowSuggestionsUseCase {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final FollowRepository followRepository;
    private final FriendshipRepository friendshipRepository;
    private final PostRepository postRepository;

    public UserService(
            UserRepository userRepository,
            FollowRepository followRepository,
            FriendshipRepository friendshipRepository,
            PostRepository postRepository) {
        this.userRepository = userRepository;
        this.followRepository = followRepository;
        this.friendshipRepository = friendshipRepository;
        this.postRepository = postRepository;
    }

    @Override
    public Optional<UserProfile> getProfile(String username) {
        return userRepository.findByUsername(username).map(user -> new UserProfile(
            user,
            followRepository.countFollowers(user.id()),
            followRepository.countFollowing(user.id()),
            friendshipRepository.countFriends(user.id()),
            postRepository.countPublishedByAuthor(user.id())
        ));
    }

    @Override
    public Result<Page<User>, ValidationError> searchUsers(String query, PageRequest pageRequest) {
        String pattern = query == null ? "" : query.trim();
        if (pattern.isEmpty()) {
            return Result.failure(new ValidationError.InvalidSearchPattern(pattern));
        }
        try {
            Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            return Result.failure(new ValidationError.InvalidSearchPattern(pattern));
        }
        try {
            List<User> users = userRepository.search(pattern, pageRequest.offset(), pageRequest.limit());
            long total = userRepository.countSearch(pattern);
            return Result.success(Page.of(users, pageRequest, total));
        } catch (SearchPatternRejectedException e) {
            log.warn("User search rejected by database: {}", pattern);
            return Result.failure(new ValidationError.InvalidSearchPattern(pattern));
        }
    }

    @Override
    public List<User> getFollowSuggestions(UserId userId, int limit) {
        return followRepository.findSuggestions(userId, limit);
    }
}
