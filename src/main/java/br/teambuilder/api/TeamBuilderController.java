package br.teambuilder.api;

import br.teambuilder.engine.EngineSettings;
import br.teambuilder.engine.GenerationResult;
import br.teambuilder.engine.GroupFormation;
import br.teambuilder.engine.GroupFormationResult;
import br.teambuilder.engine.GroupValidation;
import br.teambuilder.engine.JsonUtil;
import br.teambuilder.engine.LeagueConfig;
import br.teambuilder.engine.NameMatch;
import br.teambuilder.engine.NameResolver;
import br.teambuilder.engine.PlayerGroup;
import br.teambuilder.engine.RosterJson;
import br.teambuilder.engine.TeamGenerator;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Endpoints JSON do engine. Cada requisição usa instâncias próprias (o engine não é thread-safe).
 *
 *   POST /generate          documento completo -> times, sem time, grupos, stats
 *   POST /groups            prévia da formação de grupos + validação
 *   POST /groups/validate   só a validação de tamanho dos grupos
 *   POST /names/match       {"input", "candidates", "threshold"?, "suggest"?}
 */
@RestController
public class TeamBuilderController {

  private static final Logger log = LoggerFactory.getLogger(TeamBuilderController.class);

  private final EngineSettings settings;

  public TeamBuilderController(EngineSettings settings) {
    this.settings = settings;
  }

  @PostMapping(value = "/generate", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<String> generate(@RequestBody String body) {
    try {
      RosterJson.Request req = RosterJson.parseRequest(body);
      requireFeasible(req.config());

      GroupValidation v = GroupFormation.validateGroupsForGeneration(req.groups(), req.config().maxTeamSize());
      if (!v.ok()) return badRequest("Grupos inválidos: " + String.join(" ", v.errors()));

      TeamGenerator generator = new TeamGenerator(settings, new Random());
      GenerationResult result = generator.generate(req.players(), req.config(), req.groups(), req.mode());
      // grupos formados grandes demais não barram a geração, só aparecem em warnings.groups
      GroupValidation all = GroupFormation.validateGroupsForGeneration(result.groups(), req.config().maxTeamSize());
      return json(RosterJson.render(result, all));

    } catch (IllegalArgumentException | JsonParseException e) {
      return badRequest("Requisição inválida: " + e.getMessage());
    } catch (Exception e) {
      return serverError("Erro ao gerar times", e);
    }
  }

  @PostMapping(value = "/groups", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<String> groups(@RequestBody String body) {
    try {
      RosterJson.Request req = RosterJson.parseRequest(body);
      GroupFormationResult f = new GroupFormation(new NameResolver(settings))
          .processMutualRequests(req.players(), req.groups());

      List<PlayerGroup> all = new ArrayList<>(req.groups());
      all.addAll(f.groups());
      GroupValidation v = GroupFormation.validateGroupsForGeneration(all, req.config().maxTeamSize());
      return json(RosterJson.render(f, v));

    } catch (IllegalArgumentException | JsonParseException e) {
      return badRequest("Requisição inválida: " + e.getMessage());
    } catch (Exception e) {
      return serverError("Erro ao formar grupos", e);
    }
  }

  @PostMapping(value = "/groups/validate", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<String> validateGroups(@RequestBody String body) {
    try {
      RosterJson.Request req = RosterJson.parseRequest(body);
      GroupValidation v = GroupFormation.validateGroupsForGeneration(req.groups(), req.config().maxTeamSize());
      return json(RosterJson.validation(v));

    } catch (IllegalArgumentException | JsonParseException e) {
      return badRequest("Requisição inválida: " + e.getMessage());
    } catch (Exception e) {
      return serverError("Erro ao validar grupos", e);
    }
  }

  @PostMapping(value = "/names/match", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<String> matchName(@RequestBody String body) {
    try {
      JsonObject root = RosterJson.parseObject(body);
      String input = JsonUtil.getString(root, "input");
      if (input == null || input.isBlank()) return badRequest("input ausente");
      List<String> candidates = JsonUtil.getStringList(root, "candidates");

      NameResolver resolver = new NameResolver(settings);
      List<NameMatch> matches;
      if (Boolean.TRUE.equals(JsonUtil.getBoolean(root, "suggest"))) {
        Integer limit = JsonUtil.getInt(root, "limit");
        matches = resolver.getSuggestions(input, candidates, limit == null ? 5 : limit);
      } else {
        Double threshold = JsonUtil.getDouble(root, "threshold");
        matches = resolver.match(input, candidates, threshold == null ? settings.resolutionThreshold() : threshold);
      }

      JsonObject out = new JsonObject();
      out.addProperty("input", input);
      out.add("matches", RosterJson.matches(matches));
      return json(out);

    } catch (IllegalArgumentException | JsonParseException e) {
      return badRequest("Requisição inválida: " + e.getMessage());
    } catch (Exception e) {
      return serverError("Erro ao comparar nomes", e);
    }
  }

  // -------------------------
  // Helpers
  // -------------------------

  private static void requireFeasible(LeagueConfig config) {
    if (!config.quotasFeasible()) {
      throw new IllegalArgumentException("minFemales + minMales (" + (config.minFemales() + config.minMales())
          + ") excede maxTeamSize (" + config.maxTeamSize() + ")");
    }
  }

  private static ResponseEntity<String> json(JsonObject body) {
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_JSON)
        .body(RosterJson.toJson(body));
  }

  private static ResponseEntity<String> badRequest(String msg) {
    log.debug("400: {}", msg);
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .contentType(MediaType.TEXT_PLAIN)
        .body(msg);
  }

  private static ResponseEntity<String> serverError(String what, Exception e) {
    log.error("{}", what, e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .contentType(MediaType.TEXT_PLAIN)
        .body(what + ": " + e.getClass().getSimpleName() + " - " + e.getMessage());
  }
}
