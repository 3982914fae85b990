package uk.gegc.aianswers.features.auth.infra.security;

import com.google.firebase.auth.AuthErrorCode;
import com.google.firebase.auth.FirebaseAuth;
import com.google.firebase.auth.FirebaseAuthException;
import com.google.firebase.auth.FirebaseToken;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class FirebaseIdTokenVerifier implements IdTokenVerifier {

    private final FirebaseAuth firebaseAuth;
    private final boolean checkRevoked;

    @Override
    public String verify(String idToken) {
        if (idToken == null || idToken.isBlank()) {
            throw new InvalidIdTokenException(InvalidIdTokenException.Reason.INVALID, "Empty ID token");
        }
        try {
            FirebaseToken token = firebaseAuth.verifyIdToken(idToken, checkRevoked);
            String uid = token.getUid();
            if (uid == null || uid.isBlank()) {
                throw new InvalidIdTokenException(InvalidIdTokenException.Reason.INVALID, "ID token carries no uid");
            }
            return uid;
        } catch (FirebaseAuthException ex) {
            throw new InvalidIdTokenException(reasonFor(ex.getAuthErrorCode()), ex.getMessage(), ex);
        } catch (IllegalArgumentException ex) {
            throw new InvalidIdTokenException(InvalidIdTokenException.Reason.INVALID, ex.getMessage(), ex);
        }
    }

    private static InvalidIdTokenException.Reason reasonFor(AuthErrorCode code) {
        if (code == null) {
            return InvalidIdTokenException.Reason.UNVERIFIABLE;
        }
        return switch (code) {
            case EXPIRED_ID_TOKEN -> InvalidIdTokenException.Reason.EXPIRED;
            case REVOKED_ID_TOKEN -> InvalidIdTokenException.Reason.REVOKED;
            case INVALID_ID_TOKEN -> InvalidIdTokenException.Reason.INVALID;
            default -> InvalidIdTokenException.Reason.UNVERIFIABLE;
        };
    }
}
