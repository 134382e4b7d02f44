package io.github.themoah.busping.store;

import io.github.themoah.busping.model.Chunk;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.file.CopyOptions;
import io.vertx.core.file.FileSystem;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ChunkStore} backed by one file per chunk in a directory, using the Vert.x
 * asynchronous file system.
 *
 * <p>Chunks are written to a hidden temporary name and then moved into place, so a
 * listed chunk is always complete. Undecodable chunks can be moved to a
 * {@code quarantine} sub-directory.
 */
public class FileChunkStore implements ChunkStore {

  private static final Logger log = LoggerFactory.getLogger(FileChunkStore.class);

  static final String QUARANTINE_DIR = "quarantine";
  private static final String TEMP_SUFFIX = ".tmp";

  private final FileSystem fs;
  private final Path directory;

  public FileChunkStore(Vertx vertx, Path directory) {
    Objects.requireNonNull(vertx, "vertx cannot be null");
    this.fs = vertx.fileSystem();
    this.directory = Objects.requireNonNull(directory, "directory cannot be null").toAbsolutePath();
  }

  @Override
  public Future<Void> open() {
    return fs.mkdirs(directory.resolve(QUARANTINE_DIR).toString())
      .onSuccess(v -> log.info("Chunk store ready at {}", directory))
      .onFailure(err -> log.error("Failed to create chunk directory {}", directory, err));
  }

  @Override
  public Future<ChunkKey> put(Chunk chunk) {
    ChunkKey key = new ChunkKey(chunk.timestamp());
    String target = pathOf(key);
    String temp = directory.resolve("." + key.fileName() + TEMP_SUFFIX).toString();

    return fs.exists(target)
      .compose(exists -> {
        if (exists) {
          return Future.failedFuture(new FileAlreadyExistsException(target));
        }
        return fs.writeFile(temp, ChunkCodec.encode(chunk));
      })
      .compose(v -> fs.move(temp, target, new CopyOptions().setAtomicMove(true)))
      .map(key)
      .onSuccess(k -> log.debug("Wrote chunk {}", k.fileName()));
  }

  @Override
  public Future<List<ChunkKey>> listSince(long watermark) {
    return listKeys().map(keys -> {
      List<ChunkKey> newer = new ArrayList<>();
      for (ChunkKey key : keys) {
        if (key.timestamp() > watermark) {
          newer.add(key);
        }
      }
      return newer;
    });
  }

  @Override
  public Future<Chunk> get(ChunkKey key) {
    return fs.readFile(pathOf(key))
      .map(buffer -> {
        Chunk chunk;
        try {
          chunk = ChunkCodec.decode(buffer);
        } catch (ChunkDecodeException e) {
          throw new ChunkDecodeException(key, e.getMessage(), e);
        }
        if (chunk.timestamp() != key.timestamp()) {
          throw new ChunkDecodeException(key, "content timestamp " + chunk.timestamp() + " does not match key", null);
        }
        return chunk;
      });
  }

  @Override
  public Future<Integer> purgeOlderThan(long cutoff) {
    return listKeys().compose(keys -> {
      List<Future<Boolean>> deletions = new ArrayList<>();
      for (ChunkKey key : keys) {
        if (key.timestamp() >= cutoff) {
          break;
        }
        deletions.add(fs.delete(pathOf(key))
          .map(true)
          .otherwise(err -> {
            log.warn("Failed to delete expired chunk {}: {}", key.fileName(), err.getMessage());
            return false;
          }));
      }
      return Future.join(deletions).map(composite -> {
        int deleted = 0;
        for (int i = 0; i < composite.size(); i++) {
          if (Boolean.TRUE.equals(composite.resultAt(i))) {
            deleted++;
          }
        }
        if (deleted > 0) {
          log.info("Purged {} chunks older than {}", deleted, cutoff);
        }
        return deleted;
      });
    });
  }

  @Override
  public Future<Void> quarantine(ChunkKey key) {
    String target = directory.resolve(QUARANTINE_DIR).resolve(key.fileName()).toString();
    return fs.move(pathOf(key), target, new CopyOptions().setReplaceExisting(true))
      .onSuccess(v -> log.warn("Quarantined chunk {} to {}", key.fileName(), target));
  }

  /**
   * Lists every chunk key in the directory, oldest first.
   */
  private Future<List<ChunkKey>> listKeys() {
    return fs.readDir(directory.toString())
      .map(paths -> {
        List<ChunkKey> keys = new ArrayList<>();
        for (String path : paths) {
          Optional<ChunkKey> key = ChunkKey.parse(Path.of(path).getFileName().toString());
          key.ifPresent(keys::add);
        }
        Collections.sort(keys);
        return keys;
      });
  }

  private String pathOf(ChunkKey key) {
    return directory.resolve(key.fileName()).toString();
  }

  public Path directory() {
    return directory;
  }
}
