package br.teambuilder.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Restrições "evitar" já resolvidas para ids do elenco.
 * conflict(a, b) é simétrico: basta um dos lados citar o outro.
 *
 * Só vira restrição o nome resolvido com confiança exact/high. Um match medium
 * (ex.: só fonético) não é aplicado; fica em unverified() para o usuário confirmar.
 */
public final class AvoidIndex {

  private static final Logger log = LoggerFactory.getLogger(AvoidIndex.class);

  private static final AvoidIndex EMPTY = new AvoidIndex(Map.of(), List.of());

  /** Avoid com match de confiança média: candidato provável, mas não aplicado. */
  public record Unverified(String requesterId, String request, String candidateId, NameMatch match) {}

  // from -> ids que "from" evita
  private final Map<String, Set<String>> directed;
  private final List<Unverified> unverified;

  private AvoidIndex(Map<String, Set<String>> directed, List<Unverified> unverified) {
    this.directed = directed;
    this.unverified = List.copyOf(unverified);
  }

  public static AvoidIndex empty() {
    return EMPTY;
  }

  /** Resolve cada nome de avoidRequests contra o elenco (limiar avoidThreshold do resolver). */
  public static AvoidIndex build(List<Player> roster, NameResolver resolver) {
    double threshold = resolver.settings().avoidThreshold();
    Map<String, Set<String>> m = new HashMap<>();
    List<Unverified> pending = new ArrayList<>();
    for (Player p : roster) {
      for (String name : p.avoidRequests()) {
        NameResolver.PlayerMatch target = resolver.bestPlayerMatch(name, roster, threshold, p.id());
        if (target == null) {
          log.debug("Avoid de {} não resolvido: '{}'", p.name(), name);
          continue;
        }
        Confidence c = target.match().confidence();
        if (c != Confidence.EXACT && c != Confidence.HIGH) {
          log.warn("Avoid de {} não aplicado, confiança {}: '{}' -> '{}' ({})",
              p.name(), c.code(), name, target.player().name(), target.match().reason());
          pending.add(new Unverified(p.id(), name, target.player().id(), target.match()));
          continue;
        }
        m.computeIfAbsent(p.id(), k -> new HashSet<>()).add(target.player().id());
      }
    }
    return new AvoidIndex(m, pending);
  }

  public List<Unverified> unverified() {
    return unverified;
  }

  public boolean avoids(String fromId, String toId) {
    Set<String> s = directed.get(fromId);
    return s != null && s.contains(toId);
  }

  public boolean conflict(String a, String b) {
    return avoids(a, b) || avoids(b, a);
  }

  public boolean conflictsWithAny(Player p, Collection<Player> others) {
    for (Player o : others) {
      if (!o.id().equals(p.id()) && conflict(p.id(), o.id())) return true;
    }
    return false;
  }

  /** Algum par de members se evita? */
  public boolean internalConflict(Collection<Player> members) {
    for (Player p : members) {
      if (conflictsWithAny(p, members)) return true;
    }
    return false;
  }
}
