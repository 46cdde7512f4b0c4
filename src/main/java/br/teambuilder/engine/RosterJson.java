package br.teambuilder.engine;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Leitura/escrita do documento de geração (REST e CLI).
 *
 * Entrada:
 * <pre>
 * {
 *   "players": [{"id","name","gender","skillRating","execSkillRating","teammateRequests","avoidRequests","isHandler"}],
 *   "config":  {"maxTeamSize","minFemales","minMales","targetTeams","allowMixedGender"},
 *   "groups":  [{"id","label","color","playerIds"}],
 *   "mode":    "balanced" | "random" | "manual"
 * }
 * </pre>
 * teammateRequests/avoidRequests aceitam array ou string "a, b; c".
 */
public final class RosterJson {

  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

  private RosterJson() {}

  /** Documento já interpretado. */
  public record Request(List<Player> players, LeagueConfig config, List<PlayerGroup> groups, GenerationMode mode) {}

  // -------------------------
  // Leitura
  // -------------------------

  public static JsonObject parseObject(String json) {
    if (json == null || json.isBlank()) throw new IllegalArgumentException("JSON vazio");
    JsonElement el = JsonParser.parseString(json);
    if (!el.isJsonObject()) throw new JsonParseException("Esperado um objeto JSON na raiz");
    return el.getAsJsonObject();
  }

  public static Request parseRequest(String json) {
    return parseRequest(parseObject(json));
  }

  public static Request parseRequest(JsonObject root) {
    List<Player> players = parsePlayers(JsonUtil.getArray(root, "players"));
    JsonElement cfg = JsonUtil.dig(root, "config");
    LeagueConfig config = cfg != null && cfg.isJsonObject()
        ? parseConfig(cfg.getAsJsonObject())
        : LeagueConfig.defaults();
    List<PlayerGroup> groups = parseGroups(JsonUtil.getArray(root, "groups"), players);
    GenerationMode mode = GenerationMode.parse(JsonUtil.getString(root, "mode"));
    return new Request(players, config, groups, mode);
  }

  public static List<Player> parsePlayers(JsonArray arr) {
    List<Player> out = new ArrayList<>();
    if (arr == null) return out;

    Set<String> seen = new HashSet<>();
    int i = 0;
    for (JsonElement el : arr) {
      i++;
      if (el == null || !el.isJsonObject()) {
        throw new IllegalArgumentException("players[" + (i - 1) + "] não é um objeto");
      }
      JsonObject o = el.getAsJsonObject();

      String name = JsonUtil.getString(o, "name");
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("players[" + (i - 1) + "] sem nome");
      }
      String id = TextUtil.firstNonBlank(JsonUtil.getString(o, "id"), "player-" + i);
      if (!seen.add(id)) throw new IllegalArgumentException("id de jogador repetido: " + id);

      Double skill = JsonUtil.getDouble(o, "skillRating");
      if (skill == null) skill = JsonUtil.getDouble(o, "skill");
      Boolean handler = JsonUtil.getBoolean(o, "isHandler");
      if (handler == null) handler = JsonUtil.getBoolean(o, "handler");

      out.add(new Player(
          id,
          name,
          Gender.parse(JsonUtil.getString(o, "gender")),
          skill == null ? 0 : skill,
          JsonUtil.getDouble(o, "execSkillRating"),
          JsonUtil.getStringList(o, "teammateRequests"),
          JsonUtil.getStringList(o, "avoidRequests"),
          null,
          null,
          Boolean.TRUE.equals(handler),
          List.of()));
    }
    return out;
  }

  /** Lê e já normaliza (LeagueConfig.validate). */
  public static LeagueConfig parseConfig(JsonObject o) {
    LeagueConfig d = LeagueConfig.defaults();
    Integer max = JsonUtil.getInt(o, "maxTeamSize");
    Integer minF = JsonUtil.getInt(o, "minFemales");
    Integer minM = JsonUtil.getInt(o, "minMales");
    Boolean mixed = JsonUtil.getBoolean(o, "allowMixedGender");

    return new LeagueConfig(
        JsonUtil.getString(o, "id"),
        JsonUtil.getString(o, "name"),
        max == null ? d.maxTeamSize() : max,
        minF == null ? 0 : minF,
        minM == null ? 0 : minM,
        JsonUtil.getInt(o, "targetTeams"),
        mixed == null || mixed).validate();
  }

  public static List<PlayerGroup> parseGroups(JsonArray arr, List<Player> players) {
    List<PlayerGroup> out = new ArrayList<>();
    if (arr == null) return out;

    Set<String> taken = new HashSet<>();
    int index = 0;
    for (JsonElement el : arr) {
      if (el == null || !el.isJsonObject()) continue;
      JsonObject o = el.getAsJsonObject();

      List<String> ids = JsonUtil.getStringList(o, "playerIds");
      List<Player> members = new ArrayList<>();
      for (String pid : ids) {
        Player p = players.stream().filter(x -> x.id().equals(pid)).findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Grupo referencia jogador inexistente: " + pid));
        if (!taken.add(pid)) throw new IllegalArgumentException("Jogador em mais de um grupo: " + pid);
        members.add(p);
      }

      out.add(new PlayerGroup(
          TextUtil.firstNonBlank(JsonUtil.getString(o, "id"), GroupPalette.groupId(index)),
          TextUtil.firstNonBlank(JsonUtil.getString(o, "label"), GroupPalette.label(index)),
          TextUtil.firstNonBlank(JsonUtil.getString(o, "color"), GroupPalette.color(index)),
          ids,
          members));
      index++;
    }
    return out;
  }

  // -------------------------
  // Escrita
  // -------------------------

  public static String toJson(JsonElement el) {
    return GSON.toJson(el);
  }

  public static JsonObject render(GenerationResult r) {
    return render(r, null);
  }

  /** groupCheck: validação de todos os grupos (customizados e formados), vai em warnings.groups. */
  public static JsonObject render(GenerationResult r, GroupValidation groupCheck) {
    JsonObject root = new JsonObject();
    root.addProperty("mode", r.mode().name().toLowerCase(Locale.ROOT));

    JsonArray teams = new JsonArray();
    for (Team t : r.teams()) teams.add(team(t));
    root.add("teams", teams);

    JsonArray unassigned = new JsonArray();
    for (Player p : r.unassigned()) unassigned.add(player(p));
    root.add("unassignedPlayers", unassigned);

    JsonArray groups = new JsonArray();
    for (PlayerGroup g : r.groups()) groups.add(group(g));
    root.add("groups", groups);

    root.add("stats", stats(r.stats()));
    JsonObject warnings = warnings(r.formation());
    if (groupCheck != null) warnings.add("groups", validation(groupCheck));
    root.add("warnings", warnings);
    return root;
  }

  /** Prévia da formação de grupos (sem alocar). */
  public static JsonObject render(GroupFormationResult f, GroupValidation validation) {
    JsonObject root = new JsonObject();
    JsonArray groups = new JsonArray();
    for (PlayerGroup g : f.groups()) groups.add(group(g));
    root.add("groups", groups);

    JsonArray players = new JsonArray();
    for (Player p : f.players()) players.add(player(p));
    root.add("players", players);

    root.add("warnings", warnings(f));
    if (validation != null) root.add("validation", validation(validation));
    return root;
  }

  public static JsonObject validation(GroupValidation v) {
    JsonObject o = new JsonObject();
    o.addProperty("isValid", v.ok());
    o.add("errors", JsonUtil.toArray(v.errors()));
    o.add("warnings", JsonUtil.toArray(v.warnings()));
    return o;
  }

  public static JsonArray matches(List<NameMatch> matches) {
    JsonArray arr = new JsonArray();
    for (NameMatch m : matches) {
      JsonObject o = new JsonObject();
      o.addProperty("match", m.match());
      o.addProperty("score", round(m.score()));
      o.addProperty("confidence", m.confidence().code());
      o.addProperty("reason", m.reason());
      arr.add(o);
    }
    return arr;
  }

  public static JsonObject team(Team t) {
    JsonObject o = new JsonObject();
    o.addProperty("id", t.id());
    o.addProperty("name", t.name());
    o.addProperty("averageSkill", round(t.averageSkill()));
    o.addProperty("handlerCount", t.handlerCount());

    JsonObject genders = new JsonObject();
    for (Map.Entry<Gender, Integer> e : t.genderBreakdown().entrySet()) {
      genders.addProperty(e.getKey().name(), e.getValue());
    }
    o.add("genderBreakdown", genders);

    JsonArray players = new JsonArray();
    for (Player p : t.players()) players.add(player(p));
    o.add("players", players);
    return o;
  }

  public static JsonObject player(Player p) {
    JsonObject o = new JsonObject();
    o.addProperty("id", p.id());
    o.addProperty("name", p.name());
    o.addProperty("gender", p.gender().name());
    o.addProperty("skillRating", p.skillRating());
    if (p.execSkillRating() != null) o.addProperty("execSkillRating", p.execSkillRating());
    o.addProperty("isHandler", p.handler());
    o.add("teammateRequests", JsonUtil.toArray(p.teammateRequests()));
    o.add("avoidRequests", JsonUtil.toArray(p.avoidRequests()));
    o.addProperty("teamId", p.teamId());
    o.addProperty("groupId", p.groupId());

    if (!p.unfulfilledRequests().isEmpty()) {
      JsonArray un = new JsonArray();
      for (UnfulfilledRequest u : p.unfulfilledRequests()) {
        JsonObject x = new JsonObject();
        x.addProperty("playerName", u.name());
        x.addProperty("reason", u.reason().code());
        x.addProperty("priority", u.priority().code());
        un.add(x);
      }
      o.add("unfulfilledRequests", un);
    }
    return o;
  }

  public static JsonObject group(PlayerGroup g) {
    JsonObject o = new JsonObject();
    o.addProperty("id", g.id());
    o.addProperty("label", g.label());
    o.addProperty("color", g.color());
    o.add("playerIds", JsonUtil.toArray(g.playerIds()));
    return o;
  }

  public static JsonObject stats(GenerationStats s) {
    JsonObject o = new JsonObject();
    o.addProperty("totalPlayers", s.totalPlayers());
    o.addProperty("assignedPlayers", s.assignedPlayers());
    o.addProperty("unassignedPlayers", s.unassignedPlayers());

    JsonObject must = new JsonObject();
    must.addProperty("honored", s.mustHaveHonored());
    must.addProperty("broken", s.mustHaveBroken());
    o.add("mustHaveRequests", must);

    JsonObject nice = new JsonObject();
    nice.addProperty("honored", s.niceToHaveHonored());
    nice.addProperty("broken", s.niceToHaveBroken());
    o.add("niceToHaveRequests", nice);

    o.addProperty("conflictsDetected", s.conflictsDetected());
    o.addProperty("avoidViolations", s.avoidViolations());
    o.addProperty("groupsKeptTogether", s.groupsKeptTogether());
    o.addProperty("groupsSplit", s.groupsSplit());
    o.addProperty("swapsApplied", s.swapsApplied());
    o.addProperty("generationTimeMs", s.durationMs());
    return o;
  }

  private static JsonObject warnings(GroupFormationResult f) {
    JsonObject o = new JsonObject();
    if (f == null) return o;

    JsonArray review = new JsonArray();
    for (RequestResolution r : f.needsReview()) review.add(resolution(r));
    o.add("needsReview", review);

    JsonArray suggested = new JsonArray();
    for (RequestResolution r : f.suggestions()) suggested.add(resolution(r));
    o.add("suggestions", suggested);

    JsonArray notFound = new JsonArray();
    for (RequestResolution r : f.notFound()) notFound.add(resolution(r));
    o.add("notFound", notFound);

    JsonArray conflicts = new JsonArray();
    for (RequestConflict c : f.conflicts()) {
      JsonObject x = new JsonObject();
      x.addProperty("type", c.type().code());
      x.addProperty("requesterId", c.requesterId());
      x.addProperty("requesterName", c.requesterName());
      x.addProperty("targetId", c.targetId());
      x.addProperty("targetName", c.targetName());
      conflicts.add(x);
    }
    o.add("conflicts", conflicts);

    JsonArray near = new JsonArray();
    for (NearMiss n : f.nearMisses()) {
      JsonObject x = new JsonObject();
      x.addProperty("groupId", n.groupId());
      x.add("memberIds", JsonUtil.toArray(n.memberIds()));
      x.add("overflowIds", JsonUtil.toArray(n.overflowIds()));
      x.addProperty("reason", n.reason());
      near.add(x);
    }
    o.add("nearMisses", near);

    JsonArray avoidReview = new JsonArray();
    if (f.avoids() != null) {
      for (AvoidIndex.Unverified u : f.avoids().unverified()) {
        JsonObject x = new JsonObject();
        x.addProperty("requesterId", u.requesterId());
        x.addProperty("request", u.request());
        x.addProperty("candidateId", u.candidateId());
        x.addProperty("bestMatch", u.match().match());
        x.addProperty("score", round(u.match().score()));
        x.addProperty("confidence", u.match().confidence().code());
        avoidReview.add(x);
      }
    }
    o.add("avoidNeedsReview", avoidReview);
    return o;
  }

  private static JsonObject resolution(RequestResolution r) {
    JsonObject o = new JsonObject();
    o.addProperty("requesterId", r.requesterId());
    o.addProperty("request", r.request());
    o.addProperty("priority", r.priority().code());
    o.addProperty("status", r.status().name());
    if (r.resolved() != null) o.addProperty("resolvedId", r.resolved().id());
    if (r.best() != null) {
      o.addProperty("bestMatch", r.best().match());
      o.addProperty("score", round(r.best().score()));
      o.addProperty("confidence", r.best().confidence().code());
    }
    return o;
  }

  private static double round(double v) {
    return Math.round(v * 1000.0) / 1000.0;
  }
}
