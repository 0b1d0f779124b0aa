package se.alipsa.stpls.st.symbols;

import se.alipsa.stpls.core.model.Range;
import se.alipsa.stpls.st.parse.Statement;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** A parsed {@code a, b AT %IX0.0 : TYPE := init} statement. */
final class Declaration {

  private static final Pattern DECL = Pattern.compile(
      "^\\s*([A-Za-z_]\\w*(?:\\s*,\\s*[A-Za-z_]\\w*)*)\\s*(?:AT\\s+%\\S+\\s*)?:(?!=)\\s*(.+?)\\s*(?::=\\s*(.*?))?\\s*$",
      Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
  private static final Pattern NAME = Pattern.compile("[A-Za-z_]\\w*");

  static final class Name {
    final String text;
    final Range range;

    Name(String text, Range range) {
      this.text = text;
      this.range = range;
    }
  }

  final List<Name> names;
  final String dataType;
  final String initialValue;

  private Declaration(List<Name> names, String dataType, String initialValue) {
    this.names = names;
    this.dataType = dataType;
    this.initialValue = initialValue;
  }

  /** Null when the statement is not a declaration. */
  static Declaration parse(Statement st) {
    if (st.isMarker()) return null;
    Matcher m = DECL.matcher(st.getText());
    if (!m.matches()) return null;
    List<Name> names = new ArrayList<>();
    Matcher n = NAME.matcher(st.getText());
    n.region(m.start(1), m.end(1));
    while (n.find()) {
      names.add(new Name(n.group(), st.rangeOf(n.start(), n.group().length())));
    }
    String type = m.group(2).replaceAll("\\s+", " ").trim();
    String init = m.group(3) == null ? null : m.group(3).replaceAll("\\s+", " ").trim();
    return new Declaration(names, type, init == null || init.isEmpty() ? null : init);
  }

  /** Leading identifier of the type, e.g. {@code STRING} for {@code STRING(20)}. */
  String baseType() {
    return baseType(dataType);
  }

  static String baseType(String dataType) {
    if (dataType == null) return null;
    Matcher m = NAME.matcher(dataType);
    return m.lookingAt() ? m.group() : null;
  }
}
