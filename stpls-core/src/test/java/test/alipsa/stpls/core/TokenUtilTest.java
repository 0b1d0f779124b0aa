package test.alipsa.stpls.core;

import org.junit.jupiter.api.Test;
import se.alipsa.stpls.core.TokenUtil;
import se.alipsa.stpls.core.model.Position;
import se.alipsa.stpls.core.model.Range;

import static org.junit.jupiter.api.Assertions.*;

class TokenUtilTest {

  private static final String TEXT = "PROGRAM Main\n  x := timer.Q;\nEND_PROGRAM";

  @Test
  void offsets_and_positions_agree() {
    int offset = TokenUtil.positionToOffset(TEXT, 1, 2);
    assertEquals('x', TEXT.charAt(offset));
    assertEquals(new Position(1, 2), TokenUtil.offsetToPosition(TEXT, offset));
  }

  @Test
  void tokenAt_stops_at_member_access() {
    int offset = TokenUtil.positionToOffset(TEXT, 1, 9);
    assertEquals("timer", TokenUtil.tokenAt(TEXT, offset));
  }

  @Test
  void wordRange_accepts_cursor_right_after_word() {
    Range r = TokenUtil.wordRange("  x := timer.Q;", 1, 12);
    assertNotNull(r);
    assertEquals(new Range(new Position(1, 7), new Position(1, 12)), r);
    assertNull(TokenUtil.wordRange("  x := 1;", 1, 4));
  }
}
