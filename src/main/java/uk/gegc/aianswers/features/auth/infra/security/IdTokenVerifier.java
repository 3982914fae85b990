package uk.gegc.aianswers.features.auth.infra.security;

/**
 * Resolves a bearer ID token to the stable id of the user it was issued to.
 */
public interface IdTokenVerifier {

    /**
     * @return the user id, never blank
     * @throws InvalidIdTokenException when the token is malformed, expired, revoked or cannot be checked
     */
    String verify(String idToken);
}
