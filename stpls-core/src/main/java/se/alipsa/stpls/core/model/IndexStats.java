package se.alipsa.stpls.core.model;

/** Snapshot counts over the workspace index. */
public final class IndexStats {
  private final int files;
  private final int symbols;
  private final int programs;
  private final int functions;
  private final int functionBlocks;
  private final int globalVariables;

  public IndexStats(int files, int symbols, int programs, int functions, int functionBlocks, int globalVariables) {
    this.files = files;
    this.symbols = symbols;
    this.programs = programs;
    this.functions = functions;
    this.functionBlocks = functionBlocks;
    this.globalVariables = globalVariables;
  }

  public int getFiles() { return files; }
  public int getSymbols() { return symbols; }
  public int getPrograms() { return programs; }
  public int getFunctions() { return functions; }
  public int getFunctionBlocks() { return functionBlocks; }
  public int getGlobalVariables() { return globalVariables; }

  @Override
  public String toString() {
    return "IndexStats{files=" + files + ", symbols=" + symbols + ", programs=" + programs
        + ", functions=" + functions + ", functionBlocks=" + functionBlocks
        + ", globalVariables=" + globalVariables + '}';
  }
}
