package com.flagship.flight_cover.auth;

import com.flagship.flight_cover.exception.ErrorCode;
import com.flagship.flight_cover.exception.UnauthorizedCallerException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AuthorityPolicyTest {

    private final AuthorityPolicy authorityPolicy = new AuthorityPolicy("oracle-authority");

    @Test
    @DisplayName("Only the configured identity is the authority")
    void testIsAuthority() {
        assertTrue(authorityPolicy.isAuthority("oracle-authority"));
        assertFalse(authorityPolicy.isAuthority("alice"));
        assertFalse(authorityPolicy.isAuthority(null));
    }

    @Test
    @DisplayName("Authority-only operations reject everyone else")
    void testRequireAuthority() {
        assertDoesNotThrow(() -> authorityPolicy.requireAuthority("oracle-authority", "deposit"));

        UnauthorizedCallerException e = assertThrows(UnauthorizedCallerException.class,
            () -> authorityPolicy.requireAuthority("alice", "deposit"));
        assertEquals(ErrorCode.UNAUTHORIZED, e.getCode());
    }

    @Test
    @DisplayName("Holder-or-authority operations accept both and reject strangers")
    void testRequireHolderOrAuthority() {
        assertDoesNotThrow(() -> authorityPolicy.requireHolderOrAuthority("alice", "alice", "cancel"));
        assertDoesNotThrow(() -> authorityPolicy.requireHolderOrAuthority("oracle-authority", "alice", "cancel"));

        assertThrows(UnauthorizedCallerException.class,
            () -> authorityPolicy.requireHolderOrAuthority("mallory", "alice", "cancel"));
        assertThrows(UnauthorizedCallerException.class,
            () -> authorityPolicy.requireHolderOrAuthority(null, "alice", "cancel"));
    }

    @Test
    @DisplayName("A blank identity is a configuration error")
    void testBlankIdentity() {
        assertThrows(IllegalStateException.class, () -> new AuthorityPolicy(" "));
    }
}
