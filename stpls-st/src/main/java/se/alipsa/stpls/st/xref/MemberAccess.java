package se.alipsa.stpls.st.xref;

import se.alipsa.stpls.core.model.Position;
import se.alipsa.stpls.core.model.Range;

/** One {@code instance.member} occurrence on a line. */
public final class MemberAccess {
  private final String instance;
  private final String member;
  private final Range instanceRange;
  private final Range memberRange;

  MemberAccess(String instance, String member, int line, int instanceStart, int memberStart) {
    this.instance = instance;
    this.member = member;
    this.instanceRange = Range.of(line, instanceStart, instance.length());
    this.memberRange = Range.of(line, memberStart, member.length());
  }

  public String getInstance() { return instance; }
  public String getMember() { return member; }
  public Range getInstanceRange() { return instanceRange; }
  public Range getMemberRange() { return memberRange; }

  public Range getRange() {
    return new Range(instanceRange.start, memberRange.end);
  }

  /** Touching counts: a cursor right after the last character is still on the token. */
  public boolean onInstance(Position p) {
    return touches(instanceRange, p);
  }

  public boolean onMember(Position p) {
    return touches(memberRange, p);
  }

  private static boolean touches(Range r, Position p) {
    return p.line == r.start.line && p.column >= r.start.column && p.column <= r.end.column;
  }

  @Override
  public String toString() {
    return instance + "." + member + "@" + instanceRange.start;
  }
}
