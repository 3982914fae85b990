package uk.gegc.aianswers.features.auth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.firebase")
public class FirebaseProperties {

    /**
     * Turns Firebase initialisation off, e.g. for tests that supply their own token verifier.
     */
    private boolean enabled = true;

    /**
     * Firebase project id. Taken from the service account when blank.
     */
    private String projectId;

    /**
     * Service account key as inline JSON. Preferred over {@link #serviceAccountPath} when both are set.
     */
    private String serviceAccountJson;

    /**
     * Filesystem path of the service account key, used when no inline JSON is given.
     */
    private String serviceAccountPath;

    /**
     * Also reject tokens whose sessions were revoked. Costs one extra call to Firebase per request.
     */
    private boolean checkRevoked = false;
}
