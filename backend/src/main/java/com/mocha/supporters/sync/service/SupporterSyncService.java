package com.mocha.supporters.sync.service;

import com.mocha.supporters.config.SupportersProperties;
import com.mocha.supporters.sync.aggregate.SupporterAggregator;
import com.mocha.supporters.sync.assets.AvatarAssetSync;
import com.mocha.supporters.sync.classify.SupporterClassifier;
import com.mocha.supporters.sync.ledger.LedgerPageFetcher;
import com.mocha.supporters.sync.model.ClassifiedSupporters;
import com.mocha.supporters.sync.model.DonationRecord;
import com.mocha.supporters.sync.model.Supporter;
import com.mocha.supporters.sync.model.SupporterDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the whole pipeline: ledger pages, aggregation by slug, classification, avatar sync.
 * A run either returns a complete dataset or throws; nothing partial is kept.
 */
@Service
public class SupporterSyncService {
    private static final Logger log = LoggerFactory.getLogger(SupporterSyncService.class);

    private final LedgerPageFetcher pageFetcher;
    private final SupporterAggregator aggregator;
    private final SupporterClassifier classifier;
    private final AvatarAssetSync assetSync;
    private final SupporterDatasetExporter exporter;
    private final SupportersProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<SupporterDataset> latest = new AtomicReference<>();

    public SupporterSyncService(
        LedgerPageFetcher pageFetcher,
        SupporterAggregator aggregator,
        SupporterClassifier classifier,
        AvatarAssetSync assetSync,
        SupporterDatasetExporter exporter,
        SupportersProperties properties
    ) {
        this.pageFetcher = pageFetcher;
        this.aggregator = aggregator;
        this.classifier = classifier;
        this.assetSync = assetSync;
        this.exporter = exporter;
        this.properties = properties;
    }

    public SupporterDataset sync() {
        return sync(properties.getLedger().getDefaultSlug());
    }

    public SupporterDataset sync(String slug) {
        String accountSlug = SupportersProperties.normalizeSlug(slug);
        if (!running.compareAndSet(false, true)) {
            throw new SyncAlreadyRunningException("A supporter sync is already running");
        }
        Instant startedAt = Instant.now();
        try {
            List<DonationRecord> orders = pageFetcher.fetchAll(accountSlug);
            List<Supporter> supporters = aggregator.aggregate(orders);
            ClassifiedSupporters classified = classifier.classify(supporters);
            SupporterDataset dataset = assetSync.sync(classified);
            exporter.export(dataset);
            latest.set(dataset);
            log.info(
                "Found {} valid backers and {} valid sponsors ({} total) for {} from {} orders in {} ms",
                dataset.backers().size(),
                dataset.sponsors().size(),
                dataset.totalCount(),
                accountSlug,
                orders.size(),
                Duration.between(startedAt, Instant.now()).toMillis()
            );
            return dataset;
        } catch (RuntimeException e) {
            log.warn("Supporter sync for {} failed", accountSlug, e);
            throw e;
        } finally {
            running.set(false);
        }
    }

    public Optional<SupporterDataset> latest() {
        return Optional.ofNullable(latest.get());
    }

    public boolean isRunning() {
        return running.get();
    }
}
