package io.github.behaviorcache.cache;

import io.github.behaviorcache.exception.BehaviorCacheException;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mutual exclusion per cache entry, within this JVM and across processes sharing the cache
 * directory. A file lock cannot be taken twice by one JVM, so threads first serialize on an
 * in-process lock keyed by the lock file path and only the holder takes the file lock.
 *
 * <p>In-process locks are counted per path and dropped once no thread holds or waits for them.
 */
public final class EntryLocks {

  private static final Logger log = LoggerFactory.getLogger(EntryLocks.class);

  private static final ConcurrentMap<Path, Slot> LOCAL = new ConcurrentHashMap<>();

  private EntryLocks() {
  }

  /**
   * Acquire the lock for an entry, blocking until it is free.
   *
   * @param lockFile the entry's lock file
   * @return a handle to close
   */
  public static Handle acquire(final Path lockFile) {
    final Path key = lockFile.toAbsolutePath().normalize();
    final Slot slot = LOCAL.compute(key, (path, existing) -> {
      final Slot s = existing == null ? new Slot() : existing;
      s.users++;
      return s;
    });
    slot.lock.lock();
    FileChannel channel = null;
    try {
      Files.createDirectories(lockFile.getParent());
      channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
      final FileLock fileLock = channel.lock();
      return new Handle(key, slot, channel, fileLock);
    } catch (IOException | RuntimeException e) {
      closeQuietly(channel);
      release(key, slot);
      throw new BehaviorCacheException("Cannot lock cache entry " + lockFile, e);
    }
  }

  /**
   * Number of paths with a live in-process lock.
   */
  static int trackedPaths() {
    return LOCAL.size();
  }

  private static void release(final Path key, final Slot slot) {
    slot.lock.unlock();
    LOCAL.computeIfPresent(key, (path, s) -> --s.users == 0 ? null : s);
  }

  private static void closeQuietly(final FileChannel channel) {
    if (channel == null) {
      return;
    }
    try {
      channel.close();
    } catch (IOException e) {
      log.debug("Closing lock channel failed: {}", e.getMessage());
    }
  }

  /**
   * Held lock.
   */
  public static final class Handle implements AutoCloseable {

    private final Path key;
    private final Slot slot;
    private final FileChannel channel;
    private final FileLock fileLock;

    private Handle(final Path key, final Slot slot, final FileChannel channel,
                   final FileLock fileLock) {
      this.key = key;
      this.slot = slot;
      this.channel = channel;
      this.fileLock = fileLock;
    }

    @Override
    public void close() {
      try {
        fileLock.release();
        channel.close();
      } catch (IOException e) {
        throw new BehaviorCacheException("Cannot release cache entry lock", e);
      } finally {
        release(key, slot);
      }
    }
  }

  /**
   * In-process lock of one path and the number of threads holding or waiting for it. The count
   * only changes inside map compute calls.
   */
  private static final class Slot {

    private final ReentrantLock lock = new ReentrantLock();
    private int users;
  }
}
