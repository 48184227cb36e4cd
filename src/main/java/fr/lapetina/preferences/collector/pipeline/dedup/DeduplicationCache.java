package fr.lapetina.preferences.collector.pipeline.dedup;

import fr.lapetina.preferences.collector.domain.model.ComparisonSubmission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded set of content hashes used to suppress resubmission of the same comparison.
 *
 * The hash covers the full prompt and the first {@value #RESPONSE_PREFIX_LENGTH}
 * characters of each response, so two comparisons whose responses only diverge
 * after that prefix are treated as the same comparison.
 *
 * Check-then-insert runs under a single lock: two producers racing the same
 * comparison cannot both see it as new.
 */
public final class DeduplicationCache {

    private static final Logger log = LoggerFactory.getLogger(DeduplicationCache.class);

    public static final int DEFAULT_MAX_SIZE = 10_000;
    public static final int RESPONSE_PREFIX_LENGTH = 100;
    static final int HASH_HEX_LENGTH = 16;

    private final int maxSize;
    private final EvictionPolicy policy;
    private final LinkedHashMap<String, Boolean> entries;
    private final ReentrantLock lock = new ReentrantLock();

    public DeduplicationCache(int maxSize, EvictionPolicy policy) {
        if (maxSize < 2) {
            throw new IllegalArgumentException("Cache size must be at least 2");
        }
        this.maxSize = maxSize;
        this.policy = policy;
        // Access order gives LRU iteration; insertion order is what HALF sweeps.
        this.entries = new LinkedHashMap<>(16, 0.75f, policy == EvictionPolicy.LRU);
    }

    public DeduplicationCache() {
        this(DEFAULT_MAX_SIZE, EvictionPolicy.LRU);
    }

    /**
     * Returns true if an equivalent comparison was seen before.
     * On a miss the comparison is remembered before returning false.
     */
    public boolean isDuplicate(ComparisonSubmission submission) {
        String hash = hash(submission);

        lock.lock();
        try {
            if (entries.get(hash) != null) {
                return true;
            }
            if (entries.size() >= maxSize) {
                evict();
            }
            entries.put(hash, Boolean.TRUE);
            return false;
        } finally {
            lock.unlock();
        }
    }

    private void evict() {
        int toRemove = policy == EvictionPolicy.HALF ? entries.size() - maxSize / 2 : 1;
        Iterator<Map.Entry<String, Boolean>> it = entries.entrySet().iterator();
        for (int i = 0; i < toRemove && it.hasNext(); i++) {
            it.next();
            it.remove();
        }
        if (policy == EvictionPolicy.HALF) {
            log.info("Deduplication cache full, evicted {} entries: maxSize={}", toRemove, maxSize);
        }
    }

    /**
     * Computes the content hash for a comparison.
     */
    public static String hash(ComparisonSubmission submission) {
        String content = nullToEmpty(submission.prompt())
                + "|" + prefix(submission.responseA())
                + "|" + prefix(submission.responseB());
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, HASH_HEX_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String prefix(String value) {
        if (value == null) {
            return "";
        }
        if (value.codePointCount(0, value.length()) <= RESPONSE_PREFIX_LENGTH) {
            return value;
        }
        return value.substring(0, value.offsetByCodePoints(0, RESPONSE_PREFIX_LENGTH));
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    public EvictionPolicy getPolicy() {
        return policy;
    }
}
