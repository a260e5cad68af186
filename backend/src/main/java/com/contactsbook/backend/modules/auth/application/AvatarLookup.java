package com.contactsbook.backend.modules.auth.application;

import java.util.Optional;

/**
 * Resolves a default avatar image for an email address. Registration proceeds without an avatar
 * when the lookup fails.
 */
public interface AvatarLookup {

    Optional<String> lookup(String email);
}
