package se.alipsa.stpls.st.xref;

import se.alipsa.stpls.core.model.Position;
import se.alipsa.stpls.st.lex.CodeView;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds {@code instance.member} pairs in code. {@code a.b.c} yields {@code a.b} and {@code b.c};
 * the type of {@code a.b} is not followed.
 */
public final class MemberAccessScanner {

  private static final Pattern ACCESS = Pattern.compile("\\b([A-Za-z_]\\w*)\\.([A-Za-z_]\\w*)\\b");

  private MemberAccessScanner() {}

  public static List<MemberAccess> scan(CodeView view) {
    List<MemberAccess> out = new ArrayList<>();
    for (int line = 0; line < view.lineCount(); line++) {
      out.addAll(scanLine(view.code(line), line));
    }
    return out;
  }

  /** Accesses on one code-only line. */
  public static List<MemberAccess> scanLine(String code, int line) {
    List<MemberAccess> out = new ArrayList<>();
    Matcher m = ACCESS.matcher(code);
    int from = 0;
    while (from < code.length() && m.find(from)) {
      char before = m.start(1) > 0 ? code.charAt(m.start(1) - 1) : '\0';
      if (before != '#' && before != '%') {
        out.add(new MemberAccess(m.group(1), m.group(2), line, m.start(1), m.start(2)));
      }
      from = m.start(2);
    }
    return out;
  }

  /** The access whose instance or member part touches the position. */
  public static Optional<MemberAccess> at(CodeView view, Position position) {
    if (position.line < 0 || position.line >= view.lineCount()) return Optional.empty();
    List<MemberAccess> onLine = scanLine(view.code(position.line), position.line);
    for (MemberAccess a : onLine) {
      if (a.onMember(position)) return Optional.of(a);
    }
    for (MemberAccess a : onLine) {
      if (a.onInstance(position)) return Optional.of(a);
    }
    return Optional.empty();
  }
}
