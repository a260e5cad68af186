package com.contactsbook.backend.modules.auth.application;

import java.util.Optional;

import com.contactsbook.backend.modules.auth.domain.AppUser;
import com.contactsbook.backend.modules.auth.domain.UserRole;
import com.contactsbook.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Source of truth for user accounts. Username and email uniqueness is enforced by the database;
 * a violation on insert is reported as a conflict.
 */
@Component
@Transactional
public class UserDirectory {

    private final AppUserRepository appUserRepository;

    public UserDirectory(AppUserRepository appUserRepository) {
        this.appUserRepository = appUserRepository;
    }

    @Transactional(readOnly = true)
    public Optional<AppUser> findByUsername(String username) {
        return appUserRepository.findByUsername(username);
    }

    @Transactional(readOnly = true)
    public Optional<AppUser> findByEmail(String email) {
        return appUserRepository.findByEmail(email);
    }

    @Transactional(readOnly = true)
    public Optional<AppUser> findById(Long id) {
        return appUserRepository.findById(id);
    }

    @Transactional(readOnly = true)
    public boolean existsByUsername(String username) {
        return appUserRepository.existsByUsername(username);
    }

    @Transactional(readOnly = true)
    public boolean existsByEmail(String email) {
        return appUserRepository.existsByEmail(email);
    }

    public AppUser create(UserRegistration registration, String passwordHash, String avatar) {
        AppUser user = new AppUser();
        user.setUsername(registration.username());
        user.setEmail(registration.email());
        user.setPasswordHash(passwordHash);
        user.setAvatar(avatar);
        user.setConfirmed(false);
        user.setRole(UserRole.STANDARD);
        try {
            return appUserRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            throw new AuthException(AuthErrorKind.CONFLICT, "USER_ALREADY_EXISTS", "User already exists", ex);
        }
    }

    public AppUser setConfirmed(String email) {
        AppUser user = requireByEmail(email);
        user.setConfirmed(true);
        return appUserRepository.save(user);
    }

    public AppUser setAvatar(String email, String avatarUrl) {
        AppUser user = requireByEmail(email);
        user.setAvatar(avatarUrl);
        return appUserRepository.save(user);
    }

    public AppUser setPasswordHash(AppUser user, String passwordHash) {
        user.setPasswordHash(passwordHash);
        return appUserRepository.save(user);
    }

    private AppUser requireByEmail(String email) {
        return appUserRepository.findByEmail(email)
                .orElseThrow(() -> AuthException.notFound("USER_NOT_FOUND"));
    }
}
