package de.bsommerfeld.artifactsync.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Splitter;
import com.google.common.net.UrlEscapers;
import de.bsommerfeld.artifactsync.core.config.SyncSettings;
import de.bsommerfeld.artifactsync.core.domain.BuildReference;
import de.bsommerfeld.artifactsync.core.error.DownloadIncompleteException;
import de.bsommerfeld.artifactsync.core.error.DownloadTimeoutException;
import de.bsommerfeld.artifactsync.core.error.RepositoryUnreachableException;
import de.bsommerfeld.artifactsync.core.error.StagingFilesystemException;
import de.bsommerfeld.artifactsync.core.util.ByteFormatter;
import de.bsommerfeld.artifactsync.repository.download.DownloadProgressListener;
import de.bsommerfeld.artifactsync.repository.download.Downloader;
import de.bsommerfeld.artifactsync.repository.pattern.ResolvedPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * {@link RepositoryClient} for JFrog Artifactory, bound to one configuration
 * snapshot.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>Listing: {@code GET {base}/api/storage/{repo}/{prefix}} returns
 * {@code children[{uri, folder}]}</li>
 * <li>File info: {@code GET {base}/api/storage/{repo}/{path}} returns
 * {@code size} and {@code checksums.sha256}</li>
 * <li>Download: {@code GET {base}/{repo}/{path}}</li>
 * </ul>
 *
 * <h3>Authentication</h3>
 * With a configured username every request carries a preemptive HTTP Basic
 * {@code Authorization} header. 401 and 403 are reported as an unreachable
 * repository, the same as a network failure.
 */
public class ArtifactoryClient implements RepositoryClient {

    private static final Logger LOG = LoggerFactory.getLogger(ArtifactoryClient.class);

    private static final String STORAGE_API = "api/storage";

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final String repositoryKey;
    private final String authorization;
    private final Duration requestTimeout;

    public ArtifactoryClient(SyncSettings settings, HttpClient http) {
        this.http = http;
        this.mapper = new ObjectMapper();
        this.baseUrl = settings.repositoryBaseUrl().toString();
        this.repositoryKey = settings.repositoryKey();
        this.authorization = settings.hasCredentials()
                ? basicAuth(settings.username(), settings.password())
                : null;
        this.requestTimeout = settings.downloadTimeout();
    }

    // =====================================================================
    // Listing
    // =====================================================================

    @Override
    public List<BuildCandidate> listCandidates(ResolvedPattern pattern) throws RepositoryUnreachableException {
        String url = storageUrl(pattern.listingPrefix());
        HttpResponse<String> response;
        try {
            response = http.send(request(url), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RepositoryUnreachableException("Listing failed for " + url + ": " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RepositoryUnreachableException("Listing interrupted: " + url, e);
        }

        int status = response.statusCode();
        if (status == 404) {
            LOG.debug("No folder at {}", url);
            return List.of();
        }
        checkStatus(status, url);

        JsonNode children = parse(response.body(), url).path("children");
        List<BuildCandidate> candidates = new ArrayList<>();
        for (JsonNode child : children) {
            String name = stripLeadingSlash(child.path("uri").asText(""));
            boolean folder = child.path("folder").asBoolean(false);
            // build folders when the artifact sits below the build segment, files otherwise
            if (folder == pattern.artifactIsChild()) continue;
            pattern.match(name)
                    .ifPresent(ref -> candidates.add(new BuildCandidate(ref, pattern.artifactPath(ref))));
        }
        LOG.debug("Listed {}: {} children, {} build candidates", url, children.size(), candidates.size());
        return candidates;
    }

    // =====================================================================
    // Download
    // =====================================================================

    @Override
    public long download(BuildCandidate candidate, Path destination)
            throws RepositoryUnreachableException, DownloadTimeoutException, DownloadIncompleteException,
            StagingFilesystemException {
        FileInfo info = fileInfo(candidate.artifactPath());
        String url = baseUrl + "/" + escapePath(repositoryKey + "/" + candidate.artifactPath());

        long bytes = Downloader.toFile(http, request(url), destination, info.size(), info.sha256(),
                requestTimeout, progressLogger(candidate.build(), info.size()));
        LOG.info("Downloaded {} ({})", candidate.artifactPath(), ByteFormatter.format(bytes));
        return bytes;
    }

    /** Size and checksum as reported by the storage API. */
    record FileInfo(long size, String sha256) {
    }

    FileInfo fileInfo(String artifactPath)
            throws RepositoryUnreachableException, DownloadTimeoutException, DownloadIncompleteException {
        String url = storageUrl(artifactPath);
        HttpResponse<String> response;
        try {
            response = http.send(request(url), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new DownloadTimeoutException("Timed out reading file info " + url, e);
        } catch (IOException e) {
            throw new RepositoryUnreachableException("File info failed for " + url + ": " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RepositoryUnreachableException("File info interrupted: " + url, e);
        }

        if (response.statusCode() == 404) {
            // build folder exists but the upload has not finished yet
            throw new DownloadIncompleteException("Artifact not present yet: " + artifactPath);
        }
        checkStatus(response.statusCode(), url);

        JsonNode root = parse(response.body(), url);
        long size = root.path("size").asLong(-1);
        String sha256 = root.path("checksums").path("sha256").asText(null);
        return new FileInfo(size, sha256);
    }

    // -- Helpers --

    private HttpRequest request(String url) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
                .timeout(requestTimeout)
                .header("Accept", "application/json, */*")
                .GET();
        if (authorization != null) {
            builder.header("Authorization", authorization);
        }
        return builder.build();
    }

    private String storageUrl(String path) {
        String url = baseUrl + "/" + STORAGE_API + "/" + escapePath(repositoryKey);
        return path.isEmpty() ? url : url + "/" + escapePath(path);
    }

    private JsonNode parse(String body, String url) throws RepositoryUnreachableException {
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RepositoryUnreachableException("Malformed response from " + url, e);
        }
    }

    private static void checkStatus(int status, String url) throws RepositoryUnreachableException {
        if (status == 401 || status == 403) {
            throw new RepositoryUnreachableException("Authentication rejected (HTTP " + status + ") for " + url);
        }
        if (status < 200 || status >= 300) {
            throw new RepositoryUnreachableException("HTTP " + status + " for " + url);
        }
    }

    private static DownloadProgressListener progressLogger(BuildReference build, long expected) {
        if (!LOG.isDebugEnabled() || expected <= 0) return DownloadProgressListener.NONE;
        int[] lastQuarter = {0};
        return (bytesRead, totalBytes) -> {
            int quarter = (int) (bytesRead * 4 / expected);
            if (quarter > lastQuarter[0]) {
                lastQuarter[0] = quarter;
                LOG.debug("{}: {} of {}", build, ByteFormatter.format(bytesRead), ByteFormatter.format(expected));
            }
        };
    }

    static String escapePath(String path) {
        return StreamSupport.stream(Splitter.on('/').omitEmptyStrings().split(path).spliterator(), false)
                .map(UrlEscapers.urlPathSegmentEscaper()::escape)
                .collect(Collectors.joining("/"));
    }

    private static String stripLeadingSlash(String uri) {
        return uri.startsWith("/") ? uri.substring(1) : uri;
    }

    private static String basicAuth(String username, String password) {
        String token = username + ":" + Optional.ofNullable(password).orElse("");
        return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
