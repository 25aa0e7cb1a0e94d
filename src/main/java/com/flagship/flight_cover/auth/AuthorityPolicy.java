package com.flagship.flight_cover.auth;

import com.flagship.flight_cover.exception.UnauthorizedCallerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Holds the single trusted identity (oracle / administrator) and answers
 * authorization questions for the cover operations.
 *
 * The identity itself is authenticated upstream; this component only compares
 * the caller identity it is handed against the configured one.
 */
@Component
@Slf4j
public class AuthorityPolicy {

    private final String authorityIdentity;

    public AuthorityPolicy(@Value("${cover.authority.identity}") String authorityIdentity) {
        if (authorityIdentity == null || authorityIdentity.isBlank()) {
            throw new IllegalStateException("cover.authority.identity must be configured");
        }
        this.authorityIdentity = authorityIdentity;
    }

    public String getIdentity() {
        return authorityIdentity;
    }

    public boolean isAuthority(String caller) {
        return authorityIdentity.equals(caller);
    }

    /**
     * @throws UnauthorizedCallerException unless the caller is the authority
     */
    public void requireAuthority(String caller, String operation) {
        if (!isAuthority(caller)) {
            log.warn("Rejected {} from non-authority caller {}", operation, caller);
            throw new UnauthorizedCallerException(caller, operation);
        }
    }

    /**
     * @throws UnauthorizedCallerException unless the caller is the holder or the authority
     */
    public void requireHolderOrAuthority(String caller, String holder, String operation) {
        if (!isAuthority(caller) && (caller == null || !caller.equals(holder))) {
            log.warn("Rejected {} from caller {} who is neither holder nor authority", operation, caller);
            throw new UnauthorizedCallerException(caller, operation);
        }
    }
}
