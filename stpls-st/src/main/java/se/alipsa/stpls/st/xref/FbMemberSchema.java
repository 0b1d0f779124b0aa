package se.alipsa.stpls.st.xref;

import se.alipsa.stpls.st.lex.Keywords;

import java.util.*;

import static se.alipsa.stpls.st.xref.FbMember.Direction.INPUT;
import static se.alipsa.stpls.st.xref.FbMember.Direction.OUTPUT;

/** Interfaces of the ten IEC 61131-3 standard function blocks. Immutable. */
public final class FbMemberSchema {

  private static final Map<String, List<FbMember>> MEMBERS;
  private static final Map<String, String> TITLES = Map.of(
      "TON", "On-Delay Timer",
      "TOF", "Off-Delay Timer",
      "TP", "Pulse Timer",
      "CTU", "Up Counter",
      "CTD", "Down Counter",
      "CTUD", "Up-Down Counter",
      "R_TRIG", "Rising Edge Detector",
      "F_TRIG", "Falling Edge Detector",
      "RS", "Reset-Dominant Bistable",
      "SR", "Set-Dominant Bistable");

  static {
    Map<String, List<FbMember>> m = new LinkedHashMap<>();
    for (String timer : List.of("TON", "TOF", "TP")) {
      m.put(timer, List.of(
          new FbMember("IN", "BOOL", INPUT, "Timer input signal", timer),
          new FbMember("PT", "TIME", INPUT, "Preset time", timer),
          new FbMember("Q", "BOOL", OUTPUT, "Timer output", timer),
          new FbMember("ET", "TIME", OUTPUT, "Elapsed time", timer)));
    }
    m.put("CTU", List.of(
        new FbMember("CU", "BOOL", INPUT, "Count up input", "CTU"),
        new FbMember("R", "BOOL", INPUT, "Reset input", "CTU"),
        new FbMember("PV", "INT", INPUT, "Preset value", "CTU"),
        new FbMember("Q", "BOOL", OUTPUT, "Counter output", "CTU"),
        new FbMember("CV", "INT", OUTPUT, "Current value", "CTU")));
    m.put("CTD", List.of(
        new FbMember("CD", "BOOL", INPUT, "Count down input", "CTD"),
        new FbMember("LD", "BOOL", INPUT, "Load input", "CTD"),
        new FbMember("PV", "INT", INPUT, "Preset value", "CTD"),
        new FbMember("Q", "BOOL", OUTPUT, "Counter output", "CTD"),
        new FbMember("CV", "INT", OUTPUT, "Current value", "CTD")));
    m.put("CTUD", List.of(
        new FbMember("CU", "BOOL", INPUT, "Count up input", "CTUD"),
        new FbMember("CD", "BOOL", INPUT, "Count down input", "CTUD"),
        new FbMember("R", "BOOL", INPUT, "Reset input", "CTUD"),
        new FbMember("LD", "BOOL", INPUT, "Load input", "CTUD"),
        new FbMember("PV", "INT", INPUT, "Preset value", "CTUD"),
        new FbMember("QU", "BOOL", OUTPUT, "Count up output", "CTUD"),
        new FbMember("QD", "BOOL", OUTPUT, "Count down output", "CTUD"),
        new FbMember("CV", "INT", OUTPUT, "Current value", "CTUD")));
    m.put("R_TRIG", List.of(
        new FbMember("CLK", "BOOL", INPUT, "Clock input", "R_TRIG"),
        new FbMember("Q", "BOOL", OUTPUT, "Rising edge output", "R_TRIG")));
    m.put("F_TRIG", List.of(
        new FbMember("CLK", "BOOL", INPUT, "Clock input", "F_TRIG"),
        new FbMember("Q", "BOOL", OUTPUT, "Falling edge output", "F_TRIG")));
    m.put("RS", List.of(
        new FbMember("S", "BOOL", INPUT, "Set input", "RS"),
        new FbMember("R1", "BOOL", INPUT, "Reset input", "RS"),
        new FbMember("Q1", "BOOL", OUTPUT, "Output", "RS")));
    m.put("SR", List.of(
        new FbMember("S1", "BOOL", INPUT, "Set input", "SR"),
        new FbMember("R", "BOOL", INPUT, "Reset input", "SR"),
        new FbMember("Q1", "BOOL", OUTPUT, "Output", "SR")));
    MEMBERS = Collections.unmodifiableMap(m);
  }

  private FbMemberSchema() {}

  public static boolean isStandard(String fbType) {
    return fbType != null && MEMBERS.containsKey(Keywords.upper(fbType.trim()));
  }

  /** Members in declaration order; empty for unknown types. */
  public static List<FbMember> members(String fbType) {
    if (fbType == null) return List.of();
    return MEMBERS.getOrDefault(Keywords.upper(fbType.trim()), List.of());
  }

  public static Optional<FbMember> member(String fbType, String memberName) {
    return members(fbType).stream().filter(m -> m.isNamed(memberName)).findFirst();
  }

  /** Short title such as "On-Delay Timer". */
  public static Optional<String> title(String fbType) {
    if (fbType == null) return Optional.empty();
    return Optional.ofNullable(TITLES.get(Keywords.upper(fbType.trim())));
  }

  public static Set<String> types() {
    return MEMBERS.keySet();
  }
}
