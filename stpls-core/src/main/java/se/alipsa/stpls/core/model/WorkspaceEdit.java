package se.alipsa.stpls.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** A set of text edits across one or more documents, applied as a unit by the editor. */
public final class WorkspaceEdit {

  private final Map<String, List<TextEdit>> changes = new LinkedHashMap<>();

  public static WorkspaceEdit empty() {
    return new WorkspaceEdit();
  }

  public WorkspaceEdit add(String uri, TextEdit edit) {
    changes.computeIfAbsent(Objects.requireNonNull(uri), k -> new ArrayList<>()).add(edit);
    return this;
  }

  /** Edits per document uri, in the order documents were first touched. */
  public Map<String, List<TextEdit>> getChanges() {
    Map<String, List<TextEdit>> copy = new LinkedHashMap<>();
    changes.forEach((k, v) -> copy.put(k, List.copyOf(v)));
    return Collections.unmodifiableMap(copy);
  }

  public List<TextEdit> editsFor(String uri) {
    List<TextEdit> edits = changes.get(uri);
    return edits == null ? List.of() : List.copyOf(edits);
  }

  public boolean isEmpty() {
    return changes.isEmpty();
  }

  public int editCount() {
    return changes.values().stream().mapToInt(List::size).sum();
  }

  @Override
  public String toString() {
    return "WorkspaceEdit" + changes;
  }
}
