package com.shardindex.core.cache;

import com.shardindex.core.model.ShardIndex;
import com.shardindex.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Persists the last index of each shard as {@code <cacheDir>/shard-<id>.json}.
 * <p>
 * Writes go to a temporary file in the same directory that is then moved over the old one, so a
 * reader sees either the previous or the new index.
 * </p>
 */
public class ShardCache {
    private static final Logger log = LoggerFactory.getLogger(ShardCache.class);

    private final Path cacheDir;

    public ShardCache(Path cacheDir) {
        this.cacheDir = cacheDir;
    }

    public Path file(int shardId) {
        return cacheDir.resolve("shard-" + shardId + ".json");
    }

    /**
     * Loads the cached index of a shard.
     *
     * @return Cached index, or empty when there is none or it cannot be read
     */
    public Optional<ShardIndex> load(int shardId) {
        Path file = file(shardId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            ShardIndex index = JsonUtils.mapper().readValue(Files.readAllBytes(file), ShardIndex.class);
            if (index.getShardId() != shardId) {
                log.warn("Ignoring cache file {}: it holds shard {}", file, index.getShardId());
                return Optional.empty();
            }
            return Optional.of(index);
        } catch (IOException e) {
            log.warn("Ignoring unreadable cache file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    public void save(ShardIndex index) throws IOException {
        Files.createDirectories(cacheDir);
        Path target = file(index.getShardId());
        Path tmp = Files.createTempFile(cacheDir, "shard-" + index.getShardId() + "-", ".tmp");
        try {
            Files.write(tmp, JsonUtils.mapper().writeValueAsBytes(index));
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.debug("Saved {} to {}", index, target);
    }
}
