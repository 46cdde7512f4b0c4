package br.teambuilder.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BiPredicate;

/**
 * Grafo de conexões mútuas: nós são índices do elenco (0..n-1), arestas não direcionadas.
 * Uma aresta só existe se os dois lados se pediram (a reciprocidade é verificada por quem adiciona).
 */
public final class MutualGraph {

  /**
   * Componente extraído pela BFS: membros (na ordem de visita), vizinhos que ficaram de fora
   * pelo limite (overflow) e vizinhos recusados por conflito com algum membro (blocked).
   */
  public record Component(int[] members, int[] overflow, int[] blocked) {

    public boolean truncated() {
      return overflow.length > 0;
    }
  }

  private final List<List<Integer>> adjacency;

  public MutualGraph(int size) {
    adjacency = new ArrayList<>(size);
    for (int i = 0; i < size; i++) adjacency.add(new ArrayList<>());
  }

  public int size() {
    return adjacency.size();
  }

  public void addEdge(int a, int b) {
    if (a == b || hasEdge(a, b)) return;
    adjacency.get(a).add(b);
    adjacency.get(b).add(a);
  }

  public boolean hasEdge(int a, int b) {
    return adjacency.get(a).contains(b);
  }

  public List<Integer> neighbors(int node) {
    return adjacency.get(node);
  }

  public int degree(int node) {
    return adjacency.get(node).size();
  }

  public int edgeCount() {
    int sum = 0;
    for (List<Integer> l : adjacency) sum += l.size();
    return sum / 2;
  }

  /**
   * BFS a partir de cada nó ainda não visitado, acumulando no máximo cap membros por componente.
   * Vizinhos alcançados depois que o componente encheu vão para overflow e NÃO são marcados
   * como visitados: podem abrir um componente próprio mais adiante.
   * Nós em excluded nunca entram em componente algum; um vizinho em conflito (blocked) com
   * qualquer membro já aceito também fica de fora.
   */
  public List<Component> cappedComponents(int cap, boolean[] excluded, BiPredicate<Integer, Integer> blocked) {
    int n = size();
    boolean[] skip = excluded == null ? new boolean[n] : Arrays.copyOf(excluded, n);
    boolean[] visited = new boolean[n];
    List<Component> out = new ArrayList<>();

    for (int start = 0; start < n; start++) {
      if (visited[start] || skip[start] || degree(start) == 0) continue;

      Set<Integer> group = new LinkedHashSet<>();
      Set<Integer> overflow = new LinkedHashSet<>();
      Set<Integer> refused = new LinkedHashSet<>();
      Deque<Integer> queue = new ArrayDeque<>();
      group.add(start);
      queue.add(start);

      while (!queue.isEmpty()) {
        int cur = queue.poll();
        for (int nb : neighbors(cur)) {
          if (skip[nb] || visited[nb] || group.contains(nb)) continue;
          if (blocked != null && conflictsWithGroup(nb, group, blocked)) {
            refused.add(nb);
          } else if (group.size() < cap) {
            group.add(nb);
            queue.add(nb);
          } else {
            overflow.add(nb);
          }
        }
      }

      if (group.size() < 2) continue;
      for (int m : group) visited[m] = true;
      out.add(new Component(toArray(group), toArray(overflow), toArray(refused)));
    }
    return out;
  }

  public List<Component> cappedComponents(int cap) {
    return cappedComponents(cap, null, null);
  }

  private static boolean conflictsWithGroup(int node, Set<Integer> group, BiPredicate<Integer, Integer> blocked) {
    for (int m : group) {
      if (blocked.test(node, m)) return true;
    }
    return false;
  }

  private static int[] toArray(Set<Integer> s) {
    int[] a = new int[s.size()];
    int i = 0;
    for (int v : s) a[i++] = v;
    return a;
  }
}
