package se.alipsa.stpls.st.parse;

import se.alipsa.stpls.st.lex.CodeView;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Block structure of one document: POUs, VAR sections, TYPE blocks and block mismatches. */
public final class StructuralModel {

  private final CodeView view;
  private final List<StructureIssue> issues;
  private final List<PouRange> pous;
  private final List<VarSectionRange> varSections;
  private final List<TypeBlockRange> typeBlocks;

  public StructuralModel(CodeView view, List<StructureIssue> issues, List<PouRange> pous,
                         List<VarSectionRange> varSections, List<TypeBlockRange> typeBlocks) {
    this.view = view;
    this.issues = List.copyOf(issues);
    this.pous = List.copyOf(pous);
    this.varSections = List.copyOf(varSections);
    this.typeBlocks = List.copyOf(typeBlocks);
  }

  public CodeView getView() { return view; }
  public List<StructureIssue> getIssues() { return issues; }
  public List<PouRange> getPous() { return pous; }
  public List<VarSectionRange> getVarSections() { return varSections; }
  public List<TypeBlockRange> getTypeBlocks() { return typeBlocks; }

  /** Innermost POU whose span contains the line. */
  public Optional<PouRange> pouAt(int line) {
    PouRange best = null;
    for (PouRange p : pous) {
      if (p.containsLine(line) && (best == null || p.getStartLine() >= best.getStartLine())) best = p;
    }
    return Optional.ofNullable(best);
  }

  public boolean isInVarSection(int line) {
    for (VarSectionRange v : varSections) {
      if (v.containsLine(line)) return true;
    }
    return false;
  }

  public boolean isDeclarationLine(int line) {
    if (isInVarSection(line)) return true;
    for (TypeBlockRange t : typeBlocks) {
      if (t.containsLine(line)) return true;
    }
    return false;
  }

  /** Statement lines of a POU: between opener and closer, outside declarations and nested POUs. */
  public List<Integer> bodyLines(PouRange pou) {
    List<Integer> out = new ArrayList<>();
    for (int line = pou.getStartLine() + 1; line <= pou.getEndLine(); line++) {
      if (!pou.isInterior(line) || isDeclarationLine(line)) continue;
      if (pouAt(line).orElse(null) != pou) continue;
      out.add(line);
    }
    return out;
  }

  public List<VarSectionRange> varSectionsOf(PouRange pou) {
    List<VarSectionRange> out = new ArrayList<>();
    for (VarSectionRange v : varSections) {
      if (pouAt(v.getStartLine()).orElse(null) == pou) out.add(v);
    }
    return out;
  }
}
