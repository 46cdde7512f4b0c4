package br.teambuilder.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Transforma os pedidos de parceiro (texto livre, ordenados por prioridade) em grupos de afinidade
 * simétricos de 2..4 jogadores.
 *
 * Regras:
 *  - aresta A-B só existe se A pediu B E B pediu A (ambos resolvidos no limiar de aceite)
 *  - pares que se evitam nunca viram aresta, e ninguém entra num grupo onde evita/é evitado
 *  - BFS com teto de 4: o excedente vira near-miss ("group-too-large"), não some em silêncio
 *  - membros de grupos customizados não participam (já estão agrupados)
 */
public final class GroupFormation {

  private static final Logger log = LoggerFactory.getLogger(GroupFormation.class);

  public static final int MAX_GROUP_SIZE = 4;

  private final NameResolver resolver;

  public GroupFormation(NameResolver resolver) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
  }

  // -------------------------
  // Resolução e diagnóstico
  // -------------------------

  /** requesterId -> resolução de cada pedido, na ordem original (índice 0 = must-have). */
  public Map<String, List<RequestResolution>> resolveRequests(List<Player> roster) {
    Map<String, List<RequestResolution>> out = new LinkedHashMap<>();
    for (Player p : roster) {
      List<RequestResolution> list = new ArrayList<>(p.teammateRequests().size());
      for (int i = 0; i < p.teammateRequests().size(); i++) {
        list.add(resolver.resolveRequest(p, p.teammateRequests().get(i), i, roster));
      }
      out.put(p.id(), list);
    }
    return out;
  }

  public List<RequestConflict> detectRequestConflicts(
      List<Player> roster,
      Map<String, List<RequestResolution>> resolved,
      AvoidIndex avoids) {

    Map<String, Player> byId = indexById(roster);
    Map<String, Set<String>> accepted = acceptedTargets(resolved);
    List<RequestConflict> out = new ArrayList<>();

    for (Player a : roster) {
      for (String bId : accepted.getOrDefault(a.id(), Set.of())) {
        Player b = byId.get(bId);
        if (b == null) continue;

        if (avoids.avoids(bId, a.id())) {
          out.add(new RequestConflict(RequestConflict.Type.AVOID_VS_REQUEST, a.id(), a.name(), bId, b.name()));
        }
        if (!accepted.getOrDefault(bId, Set.of()).contains(a.id())) {
          out.add(new RequestConflict(RequestConflict.Type.ONE_WAY_REQUEST, a.id(), a.name(), bId, b.name()));
        }
      }
    }
    return out;
  }

  // -------------------------
  // Formação
  // -------------------------

  public GroupFormationResult processMutualRequests(List<Player> roster) {
    return processMutualRequests(roster, List.of());
  }

  public GroupFormationResult processMutualRequests(List<Player> roster, List<PlayerGroup> customGroups) {
    Objects.requireNonNull(roster, "roster");
    List<PlayerGroup> custom = customGroups == null ? List.of() : customGroups;

    AvoidIndex avoids = AvoidIndex.build(roster, resolver);
    Map<String, List<RequestResolution>> resolved = resolveRequests(roster);
    List<RequestConflict> conflicts = detectRequestConflicts(roster, resolved, avoids);
    Map<String, Set<String>> accepted = acceptedTargets(resolved);

    int n = roster.size();
    String[] ids = new String[n];
    Map<String, Integer> indexOf = new HashMap<>();
    for (int i = 0; i < n; i++) {
      ids[i] = roster.get(i).id();
      indexOf.put(ids[i], i);
    }

    // 1) Grafo só com reciprocidade real
    MutualGraph graph = new MutualGraph(n);
    for (int i = 0; i < n; i++) {
      for (String target : accepted.getOrDefault(ids[i], Set.of())) {
        Integer j = indexOf.get(target);
        if (j == null || j == i) continue;
        if (!accepted.getOrDefault(target, Set.of()).contains(ids[i])) continue;
        if (avoids.conflict(ids[i], target)) continue;
        graph.addEdge(i, j);
      }
    }

    // 2) Membros de grupos customizados ficam fora da BFS
    Map<String, String> groupIdOf = new HashMap<>();
    boolean[] excluded = new boolean[n];
    for (PlayerGroup g : custom) {
      for (String pid : g.playerIds()) {
        groupIdOf.put(pid, g.id());
        Integer i = indexOf.get(pid);
        if (i != null) excluded[i] = true;
      }
    }

    // 3) Componentes com teto
    List<MutualGraph.Component> components =
        graph.cappedComponents(MAX_GROUP_SIZE, excluded, (a, b) -> avoids.conflict(ids[a], ids[b]));

    // Índices de rótulo/cor continuam depois dos grupos customizados, pulando ids já usados por eles
    Set<String> usedIds = new HashSet<>();
    for (PlayerGroup g : custom) usedIds.add(g.id());
    int next = custom.size();
    List<NearMiss> nearMisses = new ArrayList<>();
    List<String[]> memberIdsByGroup = new ArrayList<>();
    List<Integer> paletteIndex = new ArrayList<>();

    for (MutualGraph.Component c : components) {
      while (usedIds.contains(GroupPalette.groupId(next))) next++;
      int idx = next++;
      paletteIndex.add(idx);
      String gid = GroupPalette.groupId(idx);
      String[] members = idsOf(c.members(), ids);
      memberIdsByGroup.add(members);
      for (String m : members) groupIdOf.put(m, gid);

      if (c.truncated()) {
        List<String> overflow = List.of(idsOf(c.overflow(), ids));
        nearMisses.add(new NearMiss(gid, List.of(members), overflow, NearMiss.GROUP_TOO_LARGE));
        log.warn("Grupo {} atingiu o limite de {} jogadores; ficaram de fora: {}", gid, MAX_GROUP_SIZE, overflow);
      }
    }

    // 4) Carimba groupId e diagnóstico dos pedidos
    List<Player> stamped = new ArrayList<>(n);
    for (Player p : roster) {
      List<UnfulfilledRequest> unfulfilled = classify(p, resolved.getOrDefault(p.id(), List.of()),
          groupIdOf, accepted, avoids);
      stamped.add(p.withGroupId(groupIdOf.get(p.id())).withUnfulfilled(unfulfilled));
    }

    Map<String, Player> stampedById = indexById(stamped);
    List<PlayerGroup> groups = new ArrayList<>(components.size());
    for (int k = 0; k < memberIdsByGroup.size(); k++) {
      int idx = paletteIndex.get(k);
      List<String> memberIds = List.of(memberIdsByGroup.get(k));
      List<Player> members = memberIds.stream().map(stampedById::get).toList();
      groups.add(new PlayerGroup(GroupPalette.groupId(idx), GroupPalette.label(idx), GroupPalette.color(idx),
          memberIds, members));
    }

    List<RequestResolution> allResolutions = new ArrayList<>();
    resolved.values().forEach(allResolutions::addAll);

    log.debug("Formação: {} arestas mútuas, {} grupos, {} near-misses, {} conflitos",
        graph.edgeCount(), groups.size(), nearMisses.size(), conflicts.size());

    return new GroupFormationResult(stamped, groups, allResolutions, conflicts, nearMisses, avoids);
  }

  /**
   * Motivo de cada pedido não atendido (somente explicação, não afeta a formação):
   * conflict (inclusive com alguém do grupo de um dos dois) > group-full (era mútuo mas não coube)
   * > non-reciprocal; não resolvido = not-found.
   */
  private static List<UnfulfilledRequest> classify(
      Player p,
      List<RequestResolution> resolutions,
      Map<String, String> groupIdOf,
      Map<String, Set<String>> accepted,
      AvoidIndex avoids) {

    List<UnfulfilledRequest> out = new ArrayList<>();
    String myGroup = groupIdOf.get(p.id());

    for (RequestResolution r : resolutions) {
      if (!r.accepted()) {
        out.add(new UnfulfilledRequest(r.request(), UnfulfilledRequest.Reason.NOT_FOUND, r.priority()));
        continue;
      }
      String target = r.resolvedId();
      String name = r.resolved().name();

      if (myGroup != null && myGroup.equals(groupIdOf.get(target))) continue;

      if (avoids.conflict(p.id(), target) || blockedByGroupmate(p.id(), target, groupIdOf, avoids)) {
        out.add(new UnfulfilledRequest(name, UnfulfilledRequest.Reason.CONFLICT, r.priority()));
      } else if (accepted.getOrDefault(target, Set.of()).contains(p.id())) {
        out.add(new UnfulfilledRequest(name, UnfulfilledRequest.Reason.GROUP_FULL, r.priority()));
      } else {
        out.add(new UnfulfilledRequest(name, UnfulfilledRequest.Reason.NON_RECIPROCAL, r.priority()));
      }
    }
    return out;
  }

  /** Algum membro do grupo de target evita (ou é evitado por) requester, ou vice-versa? */
  private static boolean blockedByGroupmate(
      String requester, String target, Map<String, String> groupIdOf, AvoidIndex avoids) {

    String targetGroup = groupIdOf.get(target);
    String myGroup = groupIdOf.get(requester);
    for (Map.Entry<String, String> e : groupIdOf.entrySet()) {
      String member = e.getKey();
      if (targetGroup != null && targetGroup.equals(e.getValue()) && avoids.conflict(requester, member)) return true;
      if (myGroup != null && myGroup.equals(e.getValue()) && avoids.conflict(target, member)) return true;
    }
    return false;
  }

  // -------------------------
  // Pré-checagem para geração
  // -------------------------

  public static GroupValidation validateGroupsForGeneration(List<PlayerGroup> groups, int maxTeamSize) {
    List<String> errors = new ArrayList<>();
    List<String> warnings = new ArrayList<>();
    if (groups == null) return new GroupValidation(errors, warnings);

    for (PlayerGroup g : groups) {
      String label = TextUtil.firstNonBlank(g.label(), g.id());
      if (g.size() > maxTeamSize) {
        errors.add("Grupo " + label + " tem " + g.size() + " jogadores, acima do tamanho máximo de time ("
            + maxTeamSize + "); ele nunca poderá ser alocado.");
      } else if (g.size() == maxTeamSize) {
        warnings.add("Grupo " + label + " tem exatamente " + maxTeamSize
            + " jogadores e vai ocupar um time inteiro.");
      }
    }
    return new GroupValidation(errors, warnings);
  }

  // -------------------------
  // Helpers
  // -------------------------

  private static Map<String, Set<String>> acceptedTargets(Map<String, List<RequestResolution>> resolved) {
    Map<String, Set<String>> out = new HashMap<>();
    for (Map.Entry<String, List<RequestResolution>> e : resolved.entrySet()) {
      Set<String> s = new LinkedHashSet<>();
      for (RequestResolution r : e.getValue()) {
        if (r.accepted()) s.add(r.resolvedId());
      }
      out.put(e.getKey(), s);
    }
    return out;
  }

  private static Map<String, Player> indexById(List<Player> roster) {
    Map<String, Player> m = new LinkedHashMap<>();
    for (Player p : roster) m.putIfAbsent(p.id(), p);
    return m;
  }

  private static String[] idsOf(int[] idx, String[] ids) {
    String[] out = new String[idx.length];
    for (int i = 0; i < idx.length; i++) out[i] = ids[idx[i]];
    return out;
  }
}
