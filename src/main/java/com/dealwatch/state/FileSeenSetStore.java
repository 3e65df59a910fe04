package com.dealwatch.state;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Seen set kept in a local JSON file. Writes go to a sibling temp file that is then moved over the
 * target, so readers never see a half-written file.
 */
public final class FileSeenSetStore implements SeenSetStore {
    private static final Logger LOG = LogManager.getLogger(FileSeenSetStore.class);

    private final Path path;

    public FileSeenSetStore(Path path) {
        this.path = path;
    }

    @Override
    public LoadResult load() {
        if (!Files.exists(path)) {
            LOG.info("No seen set at {}, starting empty", path);
            return LoadResult.absent();
        }
        try {
            String txt = Files.readString(path, StandardCharsets.UTF_8);
            SeenSet seenSet = SeenSet.fromJson(txt);
            LOG.info("Loaded {} seen deal id(s) from {}", seenSet.size(), path);
            return LoadResult.loaded(seenSet);
        } catch (Exception e) {
            LOG.error("Error loading seen deals from {}: {}", path, e.getMessage());
            return LoadResult.failed("seen_load_failed: " + e.getMessage());
        }
    }

    @Override
    public void save(SeenSet seenSet) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            Files.writeString(tmp, seenSet.toJson(), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            LOG.info("Saved {} seen deals to {}", seenSet.size(), path);
        } catch (IOException e) {
            throw new SeenSetStoreException("failed to write seen set to " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "file:" + path;
    }
}
