package se.alipsa.stpls.core;

import se.alipsa.stpls.core.model.IndexStats;
import se.alipsa.stpls.core.model.Scope;
import se.alipsa.stpls.core.model.Symbol;
import se.alipsa.stpls.core.model.SymbolKind;

import java.util.*;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Workspace-wide symbol table. Each file contributes a list of symbols that is replaced
 * wholesale on every re-parse, so readers either see the old list or the new one.
 * <p>
 * Names are looked up case-insensitively. Results follow file-insertion order and then
 * declaration order within a file.
 */
public final class SymbolIndex implements CoreQuery {

  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  // guarded by lock
  private final Map<String, List<Symbol>> byFile = new HashMap<>();
  private final Map<String, Integer> fileOrdinal = new HashMap<>();
  private final Map<String, Integer> fileVersion = new HashMap<>();
  private final Map<String, TreeMap<Integer, List<Symbol>>> byName = new HashMap<>();
  private int nextOrdinal;

  /** Replace everything {@code fileUri} contributed with {@code symbols}. */
  public void upsertFile(String fileUri, List<Symbol> symbols) {
    lock.writeLock().lock();
    try {
      replace(fileUri, symbols);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Versioned replace. If a newer version of the file has already been applied the call is a
   * no-op and returns false, so the last write by version wins regardless of thread timing.
   */
  public boolean upsertFile(String fileUri, int version, List<Symbol> symbols) {
    lock.writeLock().lock();
    try {
      Integer current = fileVersion.get(fileUri);
      if (current != null && current > version) {
        return false;
      }
      replace(fileUri, symbols);
      fileVersion.put(fileUri, version);
      return true;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public void removeFile(String fileUri) {
    lock.writeLock().lock();
    try {
      dropFile(fileUri);
      fileOrdinal.remove(fileUri);
      fileVersion.remove(fileUri);
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public List<Symbol> findByName(String name) {
    if (name == null || name.isEmpty()) return List.of();
    lock.readLock().lock();
    try {
      TreeMap<Integer, List<Symbol>> perFile = byName.get(Symbol.normalize(name));
      if (perFile == null) return List.of();
      List<Symbol> out = new ArrayList<>();
      perFile.values().forEach(out::addAll);
      return List.copyOf(out);
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public List<Symbol> allSymbols() {
    lock.readLock().lock();
    try {
      List<Symbol> out = new ArrayList<>();
      for (String uri : orderedUris()) out.addAll(byFile.get(uri));
      return List.copyOf(out);
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public List<Symbol> symbolsInFile(String fileUri) {
    lock.readLock().lock();
    try {
      List<Symbol> syms = byFile.get(fileUri);
      return syms == null ? List.of() : syms;
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public List<String> fileUris() {
    lock.readLock().lock();
    try {
      return List.copyOf(orderedUris());
    } finally {
      lock.readLock().unlock();
    }
  }

  public boolean containsFile(String fileUri) {
    lock.readLock().lock();
    try {
      return byFile.containsKey(fileUri);
    } finally {
      lock.readLock().unlock();
    }
  }

  public IndexStats stats() {
    lock.readLock().lock();
    try {
      int symbols = 0, programs = 0, functions = 0, fbs = 0, globals = 0;
      for (List<Symbol> syms : byFile.values()) {
        for (Symbol s : syms) {
          symbols++;
          switch (s.getKind()) {
            case PROGRAM -> programs++;
            case FUNCTION -> functions++;
            case FUNCTION_BLOCK -> fbs++;
            default -> {
              if (s.getScope() == Scope.GLOBAL && s.getKind() != SymbolKind.TYPE) globals++;
            }
          }
        }
      }
      return new IndexStats(byFile.size(), symbols, programs, functions, fbs, globals);
    } finally {
      lock.readLock().unlock();
    }
  }

  // --- internals (caller holds the write lock) ------------------------------------------------

  private void replace(String fileUri, List<Symbol> symbols) {
    Objects.requireNonNull(fileUri, "fileUri");
    List<Symbol> accepted = dedupe(fileUri, symbols);
    dropFile(fileUri);
    int ordinal = fileOrdinal.computeIfAbsent(fileUri, k -> nextOrdinal++);
    byFile.put(fileUri, accepted);
    for (Symbol s : accepted) {
      byName.computeIfAbsent(s.getNormalizedName(), k -> new TreeMap<>())
          .computeIfAbsent(ordinal, k -> new ArrayList<>())
          .add(s);
    }
  }

  private static List<Symbol> dedupe(String fileUri, List<Symbol> symbols) {
    Set<String> seen = new HashSet<>();
    List<Symbol> out = new ArrayList<>(symbols.size());
    for (Symbol s : symbols) {
      Objects.requireNonNull(s, "symbol");
      if (!fileUri.equals(s.getLocation().getUri())) {
        throw new IllegalArgumentException("Symbol " + s.getName() + " is located in "
            + s.getLocation().getUri() + " but was reported for " + fileUri);
      }
      String key = s.getNormalizedName() + "@" + s.getLocation().getRange();
      if (seen.add(key)) out.add(s);
    }
    return List.copyOf(out);
  }

  private void dropFile(String fileUri) {
    List<Symbol> old = byFile.remove(fileUri);
    Integer ordinal = fileOrdinal.get(fileUri);
    if (old == null || ordinal == null) return;
    for (Symbol s : old) {
      TreeMap<Integer, List<Symbol>> perFile = byName.get(s.getNormalizedName());
      if (perFile == null) continue;
      perFile.remove(ordinal);
      if (perFile.isEmpty()) byName.remove(s.getNormalizedName());
    }
  }

  private List<String> orderedUris() {
    List<String> uris = new ArrayList<>(byFile.keySet());
    uris.sort(Comparator.comparingInt(fileOrdinal::get));
    return uris;
  }
}
