package com.mocha.supporters.sync.assets;

import com.mocha.supporters.config.SupportersProperties;
import com.mocha.supporters.sync.http.SyncHttpClient;
import com.mocha.supporters.sync.model.Bucket;
import com.mocha.supporters.sync.model.ClassifiedSupporters;
import com.mocha.supporters.sync.model.HttpFetchResult;
import com.mocha.supporters.sync.model.ImageDimensions;
import com.mocha.supporters.sync.model.Supporter;
import com.mocha.supporters.sync.model.SupporterDataset;
import com.mocha.supporters.sync.util.UriEncoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Downloads every supporter's avatar into {@code <output-dir>/<id>.png}.
 * <p>
 * All supporters of a bucket are fetched at once and the bucket completes when every download
 * has settled. Payloads that are not PNG are replaced with the bucket's placeholder. A transport
 * failure does not cancel the other downloads of the bucket, but it is rethrown once they have
 * finished and aborts the sync; files already written are left in place.
 */
@Service
public class AvatarAssetSync {
    private static final Logger log = LoggerFactory.getLogger(AvatarAssetSync.class);
    private static final String IMAGE_ACCEPT = "image/png,image/*;q=0.8,*/*;q=0.5";
    private static final String ASSET_EXTENSION = ".png";

    private final SyncHttpClient httpClient;
    private final SupportersProperties properties;
    private final ExecutorService assetExecutor;

    public AvatarAssetSync(
        SyncHttpClient httpClient,
        SupportersProperties properties,
        @Qualifier("assetExecutor") ExecutorService assetExecutor
    ) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.assetExecutor = assetExecutor;
    }

    public SupporterDataset sync(ClassifiedSupporters classified) {
        Path outputDir = prepareOutputDir();
        List<Supporter> sponsors = syncBucket(Bucket.SPONSOR, classified.sponsors(), outputDir);
        List<Supporter> backers = syncBucket(Bucket.BACKER, classified.backers(), outputDir);
        return new SupporterDataset(sponsors, backers, Instant.now());
    }

    Path prepareOutputDir() {
        Path outputDir = resolvePath(properties.getAssets().getOutputDir());
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new AssetStorageException("Unable to create avatar directory " + outputDir, e);
        }
        return outputDir;
    }

    List<Supporter> syncBucket(Bucket bucket, List<Supporter> supporters, Path outputDir) {
        if (supporters.isEmpty()) {
            return List.of();
        }
        List<CompletableFuture<Supporter>> futures = new ArrayList<>(supporters.size());
        for (Supporter supporter : supporters) {
            futures.add(CompletableFuture.supplyAsync(() -> syncOne(bucket, supporter, outputDir), assetExecutor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw e;
        }
        List<Supporter> synced = new ArrayList<>(futures.size());
        for (CompletableFuture<Supporter> future : futures) {
            synced.add(future.join());
        }
        log.debug("Stored {} {} avatars in {}", synced.size(), bucket.name().toLowerCase(Locale.ROOT), outputDir);
        return synced;
    }

    Supporter syncOne(Bucket bucket, Supporter supporter, Path outputDir) {
        Path target = assetPath(outputDir, supporter.id());
        byte[] payload = fetchAvatar(supporter);

        byte[] imageBytes;
        ImageDimensions dimensions = null;
        if (ImageFormatSniffer.isPng(payload)) {
            imageBytes = payload;
            if (bucket.readsDimensions()) {
                dimensions = ImageFormatSniffer.pngDimensions(payload).orElse(null);
            }
        } else {
            log.debug(
                "Avatar for {} is {} instead of PNG; using placeholder",
                supporter.slug(),
                ImageFormatSniffer.detect(payload)
            );
            imageBytes = PlaceholderImages.forBucket(bucket);
            if (bucket.readsDimensions()) {
                dimensions = PlaceholderImages.dimensionsFor(bucket);
            }
        }

        try {
            Files.write(target, imageBytes);
        } catch (IOException e) {
            throw new AssetStorageException("Unable to write avatar " + target, e);
        }
        return supporter.withAsset(target.getFileName().toString(), dimensions);
    }

    private byte[] fetchAvatar(Supporter supporter) {
        String avatarUrl = supporter.avatar();
        if (avatarUrl == null || avatarUrl.isBlank()) {
            return null;
        }
        HttpFetchResult fetch = httpClient.get(UriEncoding.encodeUri(avatarUrl.trim()), IMAGE_ACCEPT);
        if (fetch.isTransportFailure()) {
            throw new AvatarFetchException(
                "Avatar download failed for " + supporter.slug() + " (" + avatarUrl + "): "
                    + fetch.errorCode() + " " + fetch.errorMessage()
            );
        }
        if (!fetch.isSuccessful()) {
            log.debug("Avatar for {} answered HTTP {}", supporter.slug(), fetch.statusCode());
        }
        return fetch.bodyBytes();
    }

    static Path assetPath(Path outputDir, String supporterId) {
        if (supporterId == null || supporterId.isBlank()) {
            throw new AssetStorageException("Supporter without id cannot be stored");
        }
        Path dir = outputDir.normalize();
        Path target = dir.resolve(supporterId + ASSET_EXTENSION).normalize();
        if (!dir.equals(target.getParent())) {
            throw new AssetStorageException("Supporter id " + supporterId + " does not map to a file in " + outputDir);
        }
        return target;
    }

    private Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }
}
