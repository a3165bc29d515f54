package com.example.authservice.service;

import com.example.authservice.repository.UserRepository;
import com.example.authservice.security.UserDirectory;
import com.example.authservice.security.UserRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * {@link UserDirectory} backed by the users table.
 */
@Component
@RequiredArgsConstructor
public class JpaUserDirectory implements UserDirectory {

    private final UserRepository userRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<UserRecord> findById(String subjectId) {
        return userRepository.findForAuthentication(subjectId)
                .map(user -> new UserRecord(
                        user.getId(),
                        user.getRole(),
                        user.isDisabled(),
                        user.isActive(),
                        user.getOrganizationId()));
    }
}
