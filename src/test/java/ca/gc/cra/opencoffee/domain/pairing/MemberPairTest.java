package ca.gc.cra.opencoffee.domain.pairing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class MemberPairTest {

  @Test
  void canonicalPutsSmallerMemberFirst() {
    MemberPair pair = new MemberPair("U2", "U1");

    assertEquals(new MemberPair("U1", "U2"), pair.canonical());
    assertEquals(pair.canonical(), pair.canonical().canonical());
  }

  @Test
  void canonicalReturnsSameInstanceWhenOrdered() {
    MemberPair pair = new MemberPair("A", "B");
    assertSame(pair, pair.canonical());
  }

  @Test
  void rejectsSelfPairing() {
    assertThrows(IllegalArgumentException.class, () -> new MemberPair("U1", "U1"));
  }

  @Test
  void rejectsNullMembers() {
    assertThrows(NullPointerException.class, () -> new MemberPair(null, "U1"));
    assertThrows(NullPointerException.class, () -> new MemberPair("U1", null));
  }

  @Test
  void containsAndMembersFollowPairOrder() {
    MemberPair pair = new MemberPair("U9", "U3");

    assertTrue(pair.contains("U3"));
    assertTrue(pair.contains("U9"));
    assertFalse(pair.contains("U1"));
    assertEquals(List.of("U9", "U3"), pair.members());
    assertEquals("(U9, U3)", pair.toString());
  }
}
