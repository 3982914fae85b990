package uk.gegc.aianswers.features.auth.config;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.auth.FirebaseAuth;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import uk.gegc.aianswers.features.auth.infra.security.FirebaseIdTokenVerifier;
import uk.gegc.aianswers.features.auth.infra.security.IdTokenVerifier;

import java.io.ByteArrayInputStream;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

@Slf4j
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.firebase", name = "enabled", havingValue = "true", matchIfMissing = true)
public class FirebaseConfig {

    private final FirebaseProperties properties;

    @Bean
    public FirebaseApp firebaseApp() throws IOException {
        if (!FirebaseApp.getApps().isEmpty()) {
            return FirebaseApp.getInstance();
        }

        FirebaseOptions.Builder options = FirebaseOptions.builder()
                .setCredentials(loadCredentials());
        if (StringUtils.hasText(properties.getProjectId())) {
            options.setProjectId(properties.getProjectId());
        }
        return FirebaseApp.initializeApp(options.build());
    }

    @Bean
    public FirebaseAuth firebaseAuth(FirebaseApp firebaseApp) {
        return FirebaseAuth.getInstance(firebaseApp);
    }

    @Bean
    public IdTokenVerifier idTokenVerifier(FirebaseAuth firebaseAuth) {
        return new FirebaseIdTokenVerifier(firebaseAuth, properties.isCheckRevoked());
    }

    private GoogleCredentials loadCredentials() throws IOException {
        if (StringUtils.hasText(properties.getServiceAccountJson())) {
            try (InputStream in = new ByteArrayInputStream(
                    properties.getServiceAccountJson().getBytes(StandardCharsets.UTF_8))) {
                log.info("Loading Firebase credentials from inline service account JSON");
                return GoogleCredentials.fromStream(in);
            }
        }
        if (StringUtils.hasText(properties.getServiceAccountPath())) {
            try (InputStream in = new FileInputStream(properties.getServiceAccountPath())) {
                log.info("Loading Firebase credentials from {}", properties.getServiceAccountPath());
                return GoogleCredentials.fromStream(in);
            }
        }
        log.info("No service account configured, using application default credentials");
        return GoogleCredentials.getApplicationDefault();
    }
}
