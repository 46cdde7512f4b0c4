package br.teambuilder.engine;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NameResolverTest {

  private final NameResolver resolver = new NameResolver();

  @Test
  void concatenatedNickname_shouldResolveWithHighConfidence() {
    NameMatch m = resolver.matchSingle("mikesmith", "Michael Smith");

    assertEquals(Confidence.HIGH, m.confidence());
    assertEquals(0.82, m.score(), 1e-9);
    assertTrue(m.reason().startsWith("Name concatenation match"), m.reason());
  }

  @Test
  void concatenatedNickname_shouldRankFirstAmongCandidates() {
    List<NameMatch> matches = resolver.match("mikesmith", List.of("Mary Jones", "Michael Smith"));

    assertFalse(matches.isEmpty());
    assertEquals("Michael Smith", matches.get(0).match());
    assertEquals("high", matches.get(0).confidence().code());
  }

  @Test
  void exactAndNormalizedMatches() {
    assertEquals(1.0, resolver.matchSingle("Ana Souza", "Ana Souza").score(), 1e-9);

    NameMatch lower = resolver.matchSingle("ana   souza", "Ana Souza");
    assertEquals(0.95, lower.score(), 1e-9);
    assertEquals(Confidence.EXACT, lower.confidence());

    NameMatch accents = resolver.matchSingle("jose silva", "José Silva");
    assertEquals(0.95, accents.score(), 1e-9);
  }

  @Test
  void nicknameTable_shouldLinkBothDirections() {
    NameMatch a = resolver.matchSingle("Bob", "Robert");
    NameMatch b = resolver.matchSingle("Robert", "Bob");

    assertEquals(0.9, a.score(), 1e-9);
    assertEquals(Confidence.HIGH, a.confidence());
    assertEquals(a.score(), b.score(), 1e-9);
    assertTrue(resolver.isLikelyMatch("Bob", "Robert"));
  }

  @Test
  void phoneticMatch_isMediumConfidence() {
    NameMatch m = resolver.matchSingle("Jonathon", "Jonathan");

    assertEquals(Confidence.MEDIUM, m.confidence());
    assertEquals(0.8, m.score(), 1e-9);
  }

  @Test
  void unrelatedNames_shouldNotMatch() {
    assertEquals(0.0, resolver.matchSingle("Xavier", "Bob").score(), 1e-9);
    assertTrue(resolver.match("Xavier", List.of("Bob", "Carla")).isEmpty());
    assertFalse(resolver.isLikelyMatch("Xavier", "Bob"));
  }

  @Test
  void customMapping_shouldBeUsedAfterCacheIsCleared() {
    List<String> roster = List.of("Roberto");
    assertTrue(resolver.match("Beto", roster).isEmpty());

    resolver.addCustomMapping("Roberto", List.of("Beto"));

    List<NameMatch> after = resolver.match("Beto", roster);
    assertEquals(1, after.size());
    assertEquals(0.9, after.get(0).score(), 1e-9);
  }

  @Test
  void customMapping_doesNotLeakIntoOtherResolvers() {
    resolver.addCustomMapping("Roberto", List.of("Beto"));

    assertEquals(0.0, new NameResolver().matchSingle("Beto", "Roberto").score(), 1e-9);
  }

  @Test
  void cache_returnsSameResultUntilCleared() {
    List<NameMatch> first = resolver.match("Bob", List.of("Robert"));
    assertSame(first, resolver.match("Bob", List.of("Robert")));

    resolver.clearCache();
    List<NameMatch> again = resolver.match("Bob", List.of("Robert"));
    assertNotSame(first, again);
    assertEquals(first, again);
  }

  @Test
  void suggestions_shouldRespectLimitAndOrder() {
    List<String> names = List.of("Bruno Lima", "Bruna Lima", "Breno Lima", "Carla Dias");

    List<NameMatch> s = resolver.getSuggestions("Bruno Lima", names, 2);

    assertEquals(2, s.size());
    assertEquals("Bruno Lima", s.get(0).match());
    assertTrue(s.get(0).score() >= s.get(1).score());
  }

  // -------------------------
  // Política de resolução
  // -------------------------

  @Test
  void resolveRequest_statuses() {
    Player alice = Player.of("p1", "Alice Wong", Gender.F, 5);
    Player bruno = Player.of("p2", "Bruno Lima", Gender.M, 5);
    Player jon = Player.of("p3", "Jonathan", Gender.M, 5);
    List<Player> roster = List.of(alice, bruno, jon);

    RequestResolution exact = resolver.resolveRequest(alice, "Bruno Lima", 0, roster);
    assertEquals(RequestResolution.Status.ACCEPTED, exact.status());
    assertEquals("p2", exact.resolvedId());
    assertEquals(RequestPriority.MUST_HAVE, exact.priority());

    RequestResolution review = resolver.resolveRequest(alice, "Jonathon", 1, roster);
    assertEquals(RequestResolution.Status.NEEDS_REVIEW, review.status());
    assertEquals("p3", review.resolvedId());
    assertTrue(review.accepted());
    assertEquals(RequestPriority.NICE_TO_HAVE, review.priority());

    RequestResolution suggested = resolver.resolveRequest(alice, "Bruno", 0, roster);
    assertEquals(RequestResolution.Status.SUGGESTED, suggested.status());
    assertNull(suggested.resolved());
    assertFalse(suggested.accepted());
    assertEquals("Bruno Lima", suggested.best().match());

    RequestResolution missing = resolver.resolveRequest(alice, "Zzyzx Qwop", 0, roster);
    assertEquals(RequestResolution.Status.NOT_FOUND, missing.status());
    assertNull(missing.best());
  }

  @Test
  void resolveRequest_neverResolvesToRequester() {
    Player alice = Player.of("p1", "Alice Wong", Gender.F, 5);
    Player other = Player.of("p2", "Bruno Lima", Gender.M, 5);

    RequestResolution r = resolver.resolveRequest(alice, "Alice Wong", 0, List.of(alice, other));

    assertNotEquals("p1", r.resolvedId());
    assertFalse(r.accepted());
  }
}
