package com.keer.seating.auth;

/**
 * Proof that the caller presented the admin credential. Only {@link AdminTokenVerifier} can
 * create one, so engine operations that take a grant cannot be reached unauthenticated.
 */
public final class AdminGrant {

    private final String principal;

    AdminGrant(String principal) {
        this.principal = principal;
    }

    public String principal() {
        return principal;
    }

    @Override
    public String toString() {
        return "AdminGrant[" + principal + "]";
    }
}
