package com.gentoro.metabasemcp.tools;

import static com.gentoro.metabasemcp.utility.JsonFixtures.json;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.metabasemcp.exception.ValidationException;
import com.gentoro.metabasemcp.gateway.Gateway;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;

class DatabaseToolsTest {

  private final Gateway gateway = mock(Gateway.class);
  private final ToolHarness tools = new ToolHarness(new DatabaseTools(gateway));

  @Test
  void listTablesRendersSortedMarkdown() throws Exception {
    when(gateway.get("/database/3/metadata"))
        .thenReturn(
            json(
                """
                {"id": 3, "tables": [
                  {"id": 8, "display_name": "Orders", "description": "All orders",
                   "entity_type": "entity/TransactionTable"},
                  {"id": 2, "display_name": "Accounts", "description": null, "entity_type": null},
                  {"id": 5, "display_name": "Notes", "description": "a | b"}]}
                """));

    String markdown = tools.call("list_tables", "{\"database_id\": 3}").asText();

    assertTrue(markdown.startsWith("# Tables in Database 3"));
    assertTrue(markdown.contains("**Total Tables:** 3"));
    assertTrue(markdown.indexOf("Accounts") < markdown.indexOf("Notes"));
    assertTrue(markdown.indexOf("Notes") < markdown.indexOf("Orders"));
    assertTrue(markdown.contains("| 2 | Accounts | No description | N/A |"));
    assertTrue(markdown.contains("| 5 | Notes | a \\| b | N/A |"));
    assertTrue(markdown.contains("| 8 | Orders | All orders | entity/TransactionTable |"));
  }

  @Test
  void listTablesOfEmptyDatabase() throws Exception {
    when(gateway.get("/database/4/metadata")).thenReturn(json("{\"id\": 4, \"tables\": []}"));
    String markdown = tools.call("list_tables", "{\"database_id\": 4}").asText();
    assertTrue(markdown.contains("*No tables found in this database.*"));
  }

  @Test
  void tableFieldsAreTruncated() throws Exception {
    StringBuilder fields = new StringBuilder();
    for (int i = 1; i <= 25; i++) {
      if (i > 1) fields.append(',');
      fields.append("{\"id\":").append(i).append(",\"name\":\"f").append(i).append("\"}");
    }
    when(gateway.get("/table/7/query_metadata"))
        .thenReturn(json("{\"id\":7,\"name\":\"orders\",\"fields\":[" + fields + "]}"));

    JsonNode defaultLimit = tools.call("get_table_fields", "{\"table_id\": 7}");
    assertEquals(20, defaultLimit.get("fields").size());
    assertTrue(defaultLimit.get("_truncated").asBoolean());
    assertEquals(25, defaultLimit.get("_total_fields").asInt());
    assertEquals(20, defaultLimit.get("_limit_applied").asInt());
    assertEquals("orders", defaultLimit.get("name").asText());

    JsonNode unlimited = tools.call("get_table_fields", "{\"table_id\": 7, \"limit\": 0}");
    assertEquals(25, unlimited.get("fields").size());
    assertFalse(unlimited.has("_truncated"));

    JsonNode roomy = tools.call("get_table_fields", "{\"table_id\": 7, \"limit\": 50}");
    assertFalse(roomy.has("_truncated"));
  }

  @Test
  void invalidArgumentsNeverReachMetabase() {
    assertThrows(ValidationException.class, () -> tools.call("list_tables", "{}"));
    assertThrows(
        ValidationException.class, () -> tools.call("get_table_fields", "{\"table_id\": \"x\"}"));
    verify(gateway, never()).get(ArgumentMatchers.anyString());
  }
}
