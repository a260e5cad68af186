package com.contactsbook.backend.modules.auth.infrastructure.avatar;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class GravatarAvatarLookupTest {

    private final GravatarAvatarLookup lookup = new GravatarAvatarLookup("https://www.gravatar.com/avatar");

    @Test
    void hashesNormalizedEmail() {
        assertThat(lookup.lookup("  MyEmailAddress@example.com "))
                .contains("https://www.gravatar.com/avatar/0bc83cb571cd1c50ba6f3e8a78ef1346");
    }

    @Test
    void blankEmailHasNoAvatar() {
        assertThat(lookup.lookup(" ")).isEmpty();
        assertThat(lookup.lookup(null)).isEmpty();
    }
}
