/*
 * どこで: Registrar 成果物保存
 * 何を: ローカルファイルシステムに成果物を保存する
 * なぜ: 単一ノード/開発環境で外部ストレージなしにジョブ結果を扱うため
 */
package org.openreg.registrar.store;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import org.openreg.registrar.model.ResultRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FileSystemResultStore implements ResultStore {

  private static final Logger logger = LoggerFactory.getLogger(FileSystemResultStore.class);
  private static final String CONTENT_TYPE_SUFFIX = ".content-type";

  private final Path root;

  public FileSystemResultStore(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  @Override
  public ResultRef put(UUID jobId, InputStream payload, long length, String contentType) {
    final String key = ResultStore.objectKey(jobId, contentType);
    final Path target = resolve(key);
    Path temp = null;
    try {
      Files.createDirectories(target.getParent());
      temp = Files.createTempFile(target.getParent(), jobId.toString(), ".tmp");
      Files.copy(payload, temp, StandardCopyOption.REPLACE_EXISTING);
      Files.writeString(
          sidecar(target), contentType == null ? "" : contentType, StandardCharsets.UTF_8);
      move(temp, target);
      logger.debug("result stored jobId={} path={}", jobId, target);
      return new ResultRef(key);
    } catch (IOException ex) {
      throw new ResultStoreException("failed to store result for job " + jobId, ex);
    } finally {
      deleteQuietly(temp);
    }
  }

  @Override
  public StoredResult get(ResultRef ref) {
    final Path path = resolve(ref.value());
    try {
      final byte[] payload = Files.readAllBytes(path);
      final Path sidecar = sidecar(path);
      final String contentType =
          Files.exists(sidecar)
              ? Files.readString(sidecar, StandardCharsets.UTF_8)
              : "application/octet-stream";
      return new StoredResult(payload, contentType);
    } catch (NoSuchFileException ex) {
      throw new ResultStoreException("result not found: " + ref.value(), ex);
    } catch (IOException ex) {
      throw new ResultStoreException("failed to read result: " + ref.value(), ex);
    }
  }

  @Override
  public void delete(ResultRef ref) {
    final Path path = resolve(ref.value());
    try {
      Files.deleteIfExists(path);
      Files.deleteIfExists(sidecar(path));
    } catch (IOException ex) {
      throw new ResultStoreException("failed to delete result: " + ref.value(), ex);
    }
  }

  @Override
  public Optional<URI> downloadUrl(ResultRef ref, Duration ttl) {
    return Optional.empty();
  }

  private Path resolve(String key) {
    final Path path = root.resolve(key).normalize();
    if (!path.startsWith(root)) {
      throw new ResultStoreException("result reference escapes store root: " + key);
    }
    return path;
  }

  private Path sidecar(Path payloadPath) {
    return payloadPath.resolveSibling(payloadPath.getFileName() + CONTENT_TYPE_SUFFIX);
  }

  private void move(Path source, Path target) throws IOException {
    try {
      Files.move(
          source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      logger.warn("atomic move is not supported; falling back to replace path={}", target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private void deleteQuietly(Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException ex) {
      logger.warn("failed to delete temp file path={}", path, ex);
    }
  }
}
