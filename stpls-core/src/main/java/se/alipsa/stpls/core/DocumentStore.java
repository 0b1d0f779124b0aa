package se.alipsa.stpls.core;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/** In-memory text store for open documents, each with the editor's version number. */
public final class DocumentStore {

  private static final class Document {
    final String text;
    final int version;

    Document(String text, int version) {
      this.text = text;
      this.version = version;
    }
  }

  private final Map<String, Document> byUri = new ConcurrentHashMap<>();

  /** Store {@code text} as the next version of the document and return that version. */
  public int put(String uri, String text) {
    Objects.requireNonNull(text);
    return byUri.compute(Objects.requireNonNull(uri),
        (k, old) -> new Document(text, old == null ? 1 : old.version + 1)).version;
  }

  /**
   * Store {@code text} with an explicit version. An older version than the one held is ignored.
   *
   * @return true if the text was stored
   */
  public boolean put(String uri, int version, String text) {
    Objects.requireNonNull(text);
    boolean[] stored = {false};
    byUri.compute(Objects.requireNonNull(uri), (k, old) -> {
      if (old != null && old.version > version) return old;
      stored[0] = true;
      return new Document(text, version);
    });
    return stored[0];
  }

  public String get(String uri) {
    Document d = byUri.get(uri);
    return d == null ? null : d.text;
  }

  /** Current version, or -1 when the document is not open. */
  public int version(String uri) {
    Document d = byUri.get(uri);
    return d == null ? -1 : d.version;
  }

  public boolean contains(String uri) {
    return byUri.containsKey(uri);
  }

  public List<String> uris() {
    return List.copyOf(byUri.keySet());
  }

  public void remove(String uri) {
    byUri.remove(uri);
  }
}
