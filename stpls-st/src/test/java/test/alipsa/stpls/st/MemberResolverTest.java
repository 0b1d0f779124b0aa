package test.alipsa.stpls.st;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import se.alipsa.stpls.core.SymbolIndex;
import se.alipsa.stpls.core.model.Position;
import se.alipsa.stpls.st.symbols.StDocument;
import se.alipsa.stpls.st.xref.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MemberResolverTest {

  private static final String LIB_URI = "file:///work/lib.st";
  private static final String MAIN_URI = "file:///work/main.st";

  private static final String LIB = """
      TYPE
          Point :
          STRUCT
              x : REAL;
              y : REAL;
          END_STRUCT
      END_TYPE

      FUNCTION_BLOCK Motor
      VAR_INPUT
          setpoint : INT;
      END_VAR
      VAR_OUTPUT
          running : BOOL;
      END_VAR
      VAR
          internal : INT;
      END_VAR
      internal := setpoint;
      END_FUNCTION_BLOCK
      """;

  private static final String MAIN = """
      PROGRAM Main
      VAR
          myTimer : TON;
          m : Motor;
          p : Point;
          x : BOOL;
          n : INT;
      END_VAR
      x := myTimer.Q;
      m.setpoint := n;
      n := REAL_TO_INT(p.y);
      END_PROGRAM
      """;

  private MemberResolver resolver;

  @BeforeEach
  void setUp() {
    SymbolIndex index = new SymbolIndex();
    StDocument lib = StDocument.parse(LIB_URI, LIB);
    StDocument main = StDocument.parse(MAIN_URI, MAIN);
    index.upsertFile(LIB_URI, lib.getSymbols());
    index.upsertFile(MAIN_URI, main.getSymbols());
    resolver = new MemberResolver(index, main);
  }

  @Test
  void member_of_standard_block_at_cursor() {
    MemberHit hit = resolver.resolveAt(new Position(8, 13)).orElseThrow();

    assertTrue(hit.isOnMember());
    FbMember q = hit.getMember().orElseThrow();
    assertEquals("Q", q.getName());
    assertEquals("BOOL", q.getDataType());
    assertEquals(FbMember.Direction.OUTPUT, q.getDirection());
    assertEquals("TON", q.getFbType());
    assertTrue(q.getDeclaration().isEmpty());
  }

  @Test
  void instance_part_at_cursor_is_the_declaration() {
    MemberHit hit = resolver.resolveAt(new Position(8, 7)).orElseThrow();

    assertFalse(hit.isOnMember());
    InstanceBinding binding = hit.getBinding().orElseThrow();
    assertEquals(InstanceBinding.Strength.STRICT, binding.getStrength());
    assertEquals("myTimer", binding.getSymbol().getName());
    assertEquals(2, binding.getSymbol().getLocation().getRange().start.line);
  }

  @Test
  void variable_typed_by_block_of_another_file_is_inferred() {
    InstanceBinding binding = resolver.bindInstance("M", "Main").orElseThrow();

    assertEquals(InstanceBinding.Strength.INFERRED, binding.getStrength());
    assertEquals("Motor", binding.getFbType());
    assertFalse(binding.isStandard());
  }

  @Test
  void custom_block_members_resolve_to_declarations() {
    FbMember setpoint = resolver.resolve("m", "SETPOINT", "Main").orElseThrow();

    assertEquals(FbMember.Direction.INPUT, setpoint.getDirection());
    assertEquals("INT", setpoint.getDataType());
    assertEquals(LIB_URI, setpoint.getDeclaration().orElseThrow().getLocation().getUri());

    List<FbMember> members = resolver.availableMembers("Motor");
    assertEquals(List.of("setpoint", "running", "internal"), members.stream().map(FbMember::getName).toList());
    assertEquals(FbMember.Direction.VAR, members.get(2).getDirection());
  }

  @Test
  void struct_fields_resolve() {
    FbMember y = resolver.resolve("p", "y", "Main").orElseThrow();

    assertEquals(FbMember.Direction.FIELD, y.getDirection());
    assertEquals("REAL", y.getDataType());
    assertEquals("Point", y.getFbType());

    MemberHit hit = resolver.resolveAt(new Position(10, 19)).orElseThrow();
    assertEquals("y", hit.getMember().orElseThrow().getName());
  }

  @Test
  void unknown_names_resolve_to_nothing() {
    assertTrue(resolver.resolve("myTimer", "nonexistent").isEmpty());
    assertTrue(resolver.resolve("unknown", "Q").isEmpty());
    assertTrue(resolver.bindInstance("x").isEmpty());
    assertTrue(resolver.resolveAt(new Position(8, 1)).isEmpty());
  }

  @Test
  void standard_schema() {
    assertEquals(8, resolver.availableMembers("CTUD").size());
    assertEquals(List.of("IN", "PT", "Q", "ET"),
        FbMemberSchema.members("ton").stream().map(FbMember::getName).toList());
    assertEquals("On-Delay Timer", FbMemberSchema.title("ton").orElseThrow());
    assertEquals(10, FbMemberSchema.types().size());
    assertTrue(FbMemberSchema.member("R_TRIG", "clk").isPresent());
  }

  @Test
  void chained_access_is_scanned_pairwise() {
    List<MemberAccess> accesses = MemberAccessScanner.scanLine("a.b.c := %IX0.1 AND T#1.5s > x;", 0);

    assertEquals(2, accesses.size(), accesses.toString());
    assertEquals("a", accesses.get(0).getInstance());
    assertEquals("b", accesses.get(0).getMember());
    assertEquals("b", accesses.get(1).getInstance());
    assertEquals("c", accesses.get(1).getMember());
    assertEquals(4, accesses.get(1).getMemberRange().start.column);
  }
}
