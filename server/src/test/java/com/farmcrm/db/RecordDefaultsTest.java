package com.farmcrm.db;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.base.Strings;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for the normalization rules applied when rows are turned into records. */
class RecordDefaultsTest {

  @Test
  void testDisplayName() {
    assertEquals("Jane Doe", Farmers.displayName("Jane", "Doe"));
    assertEquals("Jane Doe", Farmers.displayName(" Jane", "Doe "));
    assertEquals("Unknown", Farmers.displayName("Jane", null));
    assertEquals("Unknown", Farmers.displayName(null, "Doe"));
    assertEquals("Unknown", Farmers.displayName("", "Doe"));
  }

  @Test
  void testPreviewKeepsShortMessages() {
    String exactly100 = Strings.repeat("a", 100);
    assertEquals(exactly100, Messages.preview(exactly100));
    assertEquals("", Messages.preview(null));
  }

  @Test
  void testPreviewCutsLongMessages() {
    String text = Strings.repeat("b", 100) + "tail";
    String preview = Messages.preview(text);
    assertEquals(103, preview.length());
    assertEquals(Strings.repeat("b", 100) + "...", preview);
  }

  @Test
  void testPreviewCountsCodePoints() {
    String seedling = "\uD83C\uDF31";
    String exactly100 = Strings.repeat("a", 99) + seedling;
    assertEquals(exactly100, Messages.preview(exactly100));

    String preview = Messages.preview(Strings.repeat(seedling, 101));
    assertEquals(Strings.repeat(seedling, 100) + "...", preview);
    assertEquals(103, preview.codePointCount(0, preview.length()));
    assertFalse(Character.isHighSurrogate(preview.charAt(preview.length() - 4)));
  }

  @Test
  void testRoleSlots() {
    ConversationTurn user = ConversationTurn.of(1, "When to spray?", "user", null);
    assertEquals("When to spray?", user.userInput());
    assertEquals("", user.avaResponse());

    ConversationTurn assistant = ConversationTurn.of(2, "After rain.", "assistant", null);
    assertEquals("", assistant.userInput());
    assertEquals("After rain.", assistant.avaResponse());

    ConversationTurn system = ConversationTurn.of(3, "note", "system", null);
    assertEquals("", system.userInput());
    assertEquals("", system.avaResponse());
  }

  @Test
  void testTurnPlaceholders() {
    ConversationTurn turn = ConversationTurn.of(1, "hi", "user", null);
    assertEquals("chat", turn.messageType());
    assertEquals(0.8, turn.confidenceScore());
    assertFalse(turn.approvedStatus());
  }

  @Test
  void testCropInfoPlaceholders() {
    CropInfo crop = CropInfo.of("Maize");
    assertEquals(1, crop.id());
    assertEquals("Maize", crop.cropName());
    assertEquals("Maize", crop.localizedName());
    assertEquals("Crop", crop.category());
    assertEquals("Spring", crop.plantingSeason());
    assertEquals("Fall", crop.harvestSeason());
    assertEquals("Information about Maize", crop.description());
  }

  @Test
  void testConversationRequestPhoneFallback() {
    assertEquals("unknown", new ConversationRequest("q", "a").phoneOrUnknown());
    assertEquals("555-0100", new ConversationRequest("q", "a", "555-0100").phoneOrUnknown());
  }

  @Test
  void testApprovalQueueApprovedIsAlwaysEmpty() {
    ApprovalEntry entry =
        new ApprovalEntry(1, 2, "Jane Doe", "", "", "Farm", "0.0", "hello", null);
    ApprovalQueue queue = ApprovalQueue.ofUnapproved(List.of(entry));
    assertEquals(1, queue.unapproved().size());
    assertTrue(queue.approved().isEmpty());
  }
}
