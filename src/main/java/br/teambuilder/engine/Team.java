package br.teambuilder.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Time imutável. Os campos derivados (média, gêneros, handlers) são calculados
 * no construtor a partir de players; qualquer mudança de elenco gera um Team novo.
 */
public final class Team {

  private final String id;
  private final String name;
  private final List<Player> players;
  private final double averageSkill;
  private final Map<Gender, Integer> genderBreakdown;
  private final int handlerCount;

  public Team(String id, String name, List<Player> players) {
    this.id = Objects.requireNonNull(id, "id");
    this.name = name == null ? id : name;
    this.players = players == null ? List.of() : List.copyOf(players);

    double total = 0;
    int handlers = 0;
    EnumMap<Gender, Integer> genders = new EnumMap<>(Gender.class);
    for (Gender g : Gender.values()) genders.put(g, 0);
    for (Player p : this.players) {
      total += p.effectiveSkill();
      genders.merge(p.gender(), 1, Integer::sum);
      if (p.handler()) handlers++;
    }
    this.averageSkill = this.players.isEmpty() ? 0 : total / this.players.size();
    this.genderBreakdown = Collections.unmodifiableMap(genders);
    this.handlerCount = handlers;
  }

  public static Team empty(int index) {
    return new Team("team-" + (index + 1), "Team " + (index + 1), List.of());
  }

  public String id() {
    return id;
  }

  public String name() {
    return name;
  }

  public List<Player> players() {
    return players;
  }

  public int size() {
    return players.size();
  }

  public double averageSkill() {
    return averageSkill;
  }

  public double totalSkill() {
    return averageSkill * players.size();
  }

  public Map<Gender, Integer> genderBreakdown() {
    return genderBreakdown;
  }

  public int count(Gender g) {
    return genderBreakdown.getOrDefault(g, 0);
  }

  public int handlerCount() {
    return handlerCount;
  }

  public boolean contains(String playerId) {
    for (Player p : players) {
      if (p.id().equals(playerId)) return true;
    }
    return false;
  }

  public Team withPlayers(List<Player> newPlayers) {
    return new Team(id, name, newPlayers);
  }

  public Team plus(List<Player> added) {
    List<Player> out = new ArrayList<>(players);
    out.addAll(added);
    return new Team(id, name, out);
  }

  @Override
  public String toString() {
    return "Team{" + id + ", players=" + players.size() + ", avg=" + String.format("%.2f", averageSkill) + "}";
  }
}
