package com.gentoro.metabasemcp.mcp;

import static com.gentoro.metabasemcp.utility.JsonFixtures.json;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.metabasemcp.exception.ValidationException;
import java.util.List;
import org.junit.jupiter.api.Test;

class ToolArgumentsTest {

  private final ToolArguments args =
      new ToolArguments(
          json(
              """
              {"id": 12, "text_id": "34", "name": "Revenue", "blank": "  ", "nothing": null,
               "flag": true, "list": [1, 2], "obj": {"a": 1, "b": 2}, "huge": 99999999999}
              """));

  @Test
  void numbers() {
    assertEquals(12L, args.requireLong("id"));
    assertEquals(34L, args.optionalLong("text_id"));
    assertNull(args.optionalLong("missing"));
    assertNull(args.optionalLong("nothing"));
    assertEquals(7, args.optionalInt("missing", 7));
    assertThrows(ValidationException.class, () -> args.requireLong("missing"));
    assertThrows(ValidationException.class, () -> args.requireLong("name"));
    assertThrows(ValidationException.class, () -> args.optionalInt("huge"));
  }

  @Test
  void text() {
    assertEquals("Revenue", args.requireText("name"));
    assertNull(args.optionalText("missing"));
    assertThrows(ValidationException.class, () -> args.requireText("blank"));
    assertThrows(ValidationException.class, () -> args.optionalText("obj"));
  }

  @Test
  void structures() {
    assertEquals(2, args.list("list").size());
    assertTrue(args.list("missing").isEmpty());
    assertEquals(List.of("a", "b"), List.copyOf(args.map("obj").keySet()));
    assertThrows(ValidationException.class, () -> args.optionalArray("obj"));
    assertThrows(ValidationException.class, () -> args.optionalObject("list"));
    assertThrows(ValidationException.class, () -> args.requireNode("nothing"));
  }

  @Test
  void booleans() {
    assertTrue(args.optionalBoolean("flag", false));
    assertTrue(args.optionalBoolean("missing", true));
    assertThrows(ValidationException.class, () -> args.optionalBoolean("list", false));
  }

  @Test
  void absentArgumentsAreAnEmptyObject() {
    ToolArguments none = new ToolArguments(null);
    assertFalse(none.has("anything"));
    assertTrue(none.raw().isEmpty());
    assertThrows(ValidationException.class, () -> new ToolArguments(json("[1]")));
  }
}
