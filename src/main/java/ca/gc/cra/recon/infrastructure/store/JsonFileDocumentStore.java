package ca.gc.cra.recon.infrastructure.store;

import ca.gc.cra.recon.domain.schema.FieldSchema;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Write-through document store persisting one collection as a JSON array file.
 * <p><strong>Role:</strong> Infrastructure adapter used by the CLI; the file lives at
 * {@code <directory>/<collection>.json}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load the file, if present, when the store is opened.</li>
 *   <li>Rewrite the file after every mutation through a temporary sibling and an atomic move.</li>
 *   <li>Roll the in-memory collection back when the rewrite fails.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Inherits the store lock; separate processes must not share a file.</p>
 * <p><strong>Observability:</strong> Logs loads at DEBUG; IO failures surface as {@link UncheckedIOException}.</p>
 *
 * @since 0.1.0
 */
public final class JsonFileDocumentStore extends InMemoryDocumentStore {
  private static final Logger log = LoggerFactory.getLogger(JsonFileDocumentStore.class);

  private final JsonDocuments json = new JsonDocuments();
  private final Path file;

  /**
   * Opens (or prepares) the collection file named after the schema.
   *
   * @param directory database directory; created when missing
   * @param schema array registry; its name is the file name
   * @throws UncheckedIOException when the directory or file cannot be read
   */
  public JsonFileDocumentStore(Path directory, FieldSchema schema) {
    this(directory, schema.name(), schema);
  }

  /**
   * Opens (or prepares) a named collection file.
   *
   * @param directory database directory; created when missing
   * @param collection file name without extension
   * @param schema array registry of the collection
   * @throws UncheckedIOException when the directory or file cannot be read
   */
  public JsonFileDocumentStore(Path directory, String collection, FieldSchema schema) {
    super(schema);
    Objects.requireNonNull(directory, "directory");
    Objects.requireNonNull(collection, "collection");
    this.file = directory.resolve(collection + ".json");
    try {
      Files.createDirectories(directory);
      if (Files.isRegularFile(file)) {
        List<Map<String, Object>> loaded = readFile();
        restore(loaded);
        log.debug("Loaded {} documents from {}", loaded.size(), file);
      }
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to open collection file " + file, ex);
    }
  }

  /**
   * Returns the backing file.
   *
   * @return collection file path
   */
  public Path file() {
    return file;
  }

  @Override
  protected boolean writesThrough() {
    return true;
  }

  @Override
  protected void changed() {
    Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
    try {
      try (BufferedWriter writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
        json.write(snapshot(), writer);
      }
      Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException ex) {
      try {
        Files.deleteIfExists(tmp);
      } catch (IOException cleanup) {
        ex.addSuppressed(cleanup);
      }
      throw new UncheckedIOException("Unable to write collection file " + file, ex);
    }
  }

  @SuppressWarnings("unchecked")
  private List<Map<String, Object>> readFile() throws IOException {
    Object content;
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      content = json.read(reader);
    }
    if (content instanceof Map<?, ?> map && map.isEmpty()) {
      return List.of();
    }
    if (!(content instanceof List<?> list)) {
      throw new IOException("Collection file " + file + " must hold a JSON array");
    }
    List<Map<String, Object>> documents = new ArrayList<>(list.size());
    for (Object element : list) {
      if (element instanceof Map<?, ?>) {
        documents.add((Map<String, Object>) element);
      } else {
        log.warn("Skipping non-object entry in {}", file);
      }
    }
    return documents;
  }
}
