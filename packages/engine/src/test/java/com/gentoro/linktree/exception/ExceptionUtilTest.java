package com.gentoro.linktree.exception;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.linktree.utility.JacksonUtility;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void keepsCodeAndContextOfLinkTreeExceptions() {
    ErrorDetails details =
        ExceptionUtil.toErrorDetails(
            new NotFoundException("Version not found: v9", Map.of("version", "v9")));

    assertEquals("NotFoundException", details.type);
    assertEquals(LinkTreeErrorCode.NOT_FOUND, details.code);
    assertEquals(Map.of("version", "v9"), details.context);
    assertNotNull(details.timestamp);
  }

  @Test
  void mapsPlainExceptions() {
    assertEquals(
        LinkTreeErrorCode.INVALID_ARGUMENT,
        ExceptionUtil.toErrorDetails(new IllegalArgumentException("bad")).code);

    ErrorDetails unknown = ExceptionUtil.toErrorDetails(new IllegalStateException());
    assertEquals(LinkTreeErrorCode.UNKNOWN, unknown.code);
    assertEquals("", unknown.message);
    assertNull(unknown.context);
  }

  @Test
  void serializesWithoutNullFields() {
    String json = JacksonUtility.toJson(ExceptionUtil.toErrorDetails(new RuntimeException("boom")));
    assertTrue(json.contains("\"code\" : \"UNKNOWN\""));
    assertFalse(json.contains("context"));
  }
}
