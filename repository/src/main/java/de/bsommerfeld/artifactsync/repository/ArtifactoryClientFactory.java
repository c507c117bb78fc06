package de.bsommerfeld.artifactsync.repository;

import com.google.inject.Singleton;
import de.bsommerfeld.artifactsync.core.config.SyncSettings;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Hands out {@link ArtifactoryClient}s that share one {@link HttpClient}. The
 * HTTP client is only rebuilt when the configured connect timeout changes.
 */
@Singleton
public class ArtifactoryClientFactory implements RepositoryClientFactory {

    private HttpClient http;
    private Duration connectTimeout;

    @Override
    public synchronized RepositoryClient create(SyncSettings settings) {
        if (http == null || !settings.connectTimeout().equals(connectTimeout)) {
            http = HttpClient.newBuilder()
                    .version(HttpClient.Version.HTTP_1_1)
                    .followRedirects(HttpClient.Redirect.NORMAL)
                    .connectTimeout(settings.connectTimeout())
                    .build();
            connectTimeout = settings.connectTimeout();
        }
        return new ArtifactoryClient(settings, http);
    }
}
