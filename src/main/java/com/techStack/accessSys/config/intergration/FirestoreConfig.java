package com.techStack.accessSys.config.intergration;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.NoCredentials;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Firestore Configuration
 *
 * Client for the access graph collections. Only active when access.store=firestore.
 * Credentials come from a classpath service account, or the emulator when
 * firestore.emulator-host is set.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "access.store", havingValue = "firestore")
public class FirestoreConfig {

    @Value("${firestore.project-id}")
    private String projectId;

    @Value("${firestore.service-account.path:}")
    private String serviceAccountPath;

    @Value("${firestore.emulator-host:}")
    private String emulatorHost;

    @Bean(destroyMethod = "close")
    public Firestore firestore(Clock clock) throws IOException {
        Instant startTime = clock.instant();
        FirestoreOptions.Builder options = FirestoreOptions.newBuilder().setProjectId(projectId);

        if (!emulatorHost.isBlank()) {
            options.setEmulatorHost(emulatorHost).setCredentials(NoCredentials.getInstance());
            log.info("🧪 Using Firestore emulator at {}", emulatorHost);
        } else if (!serviceAccountPath.isBlank()) {
            try (InputStream serviceAccount = loadServiceAccount()) {
                options.setCredentials(GoogleCredentials.fromStream(serviceAccount));
            }
        } else {
            options.setCredentials(GoogleCredentials.getApplicationDefault());
            log.info("Using application default credentials for Firestore");
        }

        Firestore firestore = options.build().getService();
        log.info("✅ Firestore initialized for project {} (duration: {})",
                projectId, Duration.between(startTime, clock.instant()));
        return firestore;
    }

    private InputStream loadServiceAccount() {
        InputStream serviceAccount = getClass().getClassLoader().getResourceAsStream(serviceAccountPath);
        if (serviceAccount == null) {
            log.error("Firestore service account file not found: {}", serviceAccountPath);
            throw new IllegalStateException(
                    "Firestore service account file not found in classpath: " + serviceAccountPath);
        }
        return serviceAccount;
    }
}
