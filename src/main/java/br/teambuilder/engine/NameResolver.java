package br.teambuilder.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolve um nome em texto livre para um membro do elenco, tolerando apelidos,
 * erros de digitação e nomes colados ("mikesmith" -> "Michael Smith").
 *
 * Ordem das checagens em matchSingle (primeira que acerta vence, a não ser que uma
 * checagem posterior dê score claramente maior):
 *  1) exato / case-insensitive          -> exact
 *  2) nome colado (com apelidos)         -> high
 *  3) base de apelidos (bidirecional)    -> high
 *  4) fonética (soundex simplificado)    -> medium
 *  5) Levenshtein: >=0.8 high, >=0.6 medium
 *  6) substring com razão de tamanho >=0.5 (score x0.7) -> medium
 *
 * Não é thread-safe (cache interno); use uma instância por invocação concorrente.
 */
public final class NameResolver {

  private static final Logger log = LoggerFactory.getLogger(NameResolver.class);

  public static final double DEFAULT_THRESHOLD = 0.6;
  public static final double LIKELY_MATCH_THRESHOLD = 0.8;

  // Quanto uma checagem posterior precisa superar a primeira para substituí-la
  private static final double MATERIAL_GAIN = 0.1;

  private static final int CACHE_LIMIT = 4096;

  private final EngineSettings settings;
  private final NicknameDatabase nicknames;
  private final Map<CacheKey, List<NameMatch>> cache = new LinkedHashMap<>(256, 0.75f, true) {
    @Override
    protected boolean removeEldestEntry(Map.Entry<CacheKey, List<NameMatch>> eldest) {
      return size() > CACHE_LIMIT;
    }
  };

  private record CacheKey(String input, List<String> candidates, double threshold) {}

  public NameResolver() {
    this(EngineSettings.defaults());
  }

  public NameResolver(EngineSettings settings) {
    this(settings, NicknameDatabase.get().copy());
  }

  public NameResolver(EngineSettings settings, NicknameDatabase nicknames) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.nicknames = Objects.requireNonNull(nicknames, "nicknames");
  }

  public EngineSettings settings() {
    return settings;
  }

  // -------------------------
  // API
  // -------------------------

  public NameMatch matchSingle(String input, String candidate) {
    String in = TextUtil.normalizeName(input);
    String cand = TextUtil.normalizeName(candidate);
    if (in.isEmpty() || cand.isEmpty()) return NameMatch.none(candidate);

    if (input.trim().equals(candidate.trim())) {
      return new NameMatch(candidate, 1.0, Confidence.EXACT, "Exact match");
    }
    if (in.equals(cand)) {
      return new NameMatch(candidate, 0.95, Confidence.EXACT, "Case-insensitive exact match");
    }

    NameMatch chosen = null;
    for (NameMatch m : new NameMatch[] {
        concatenated(input, candidate, in, cand),
        nickname(input, candidate, in, cand),
        phonetic(candidate, in, cand),
        edit(candidate, in, cand),
        partial(candidate, in, cand)}) {
      if (m == null) continue;
      if (chosen == null || m.score() > chosen.score() + MATERIAL_GAIN) chosen = m;
    }
    return chosen != null ? chosen : NameMatch.none(candidate);
  }

  /** Candidatos com score >= threshold, do maior para o menor (empates mantêm a ordem de entrada). */
  public List<NameMatch> match(String input, List<String> candidates, double threshold) {
    if (input == null || candidates == null || candidates.isEmpty()) return List.of();

    CacheKey key = new CacheKey(input, List.copyOf(candidates), threshold);
    List<NameMatch> hit = cache.get(key);
    if (hit != null) return hit;

    List<NameMatch> out = new ArrayList<>();
    for (String c : candidates) {
      NameMatch m = matchSingle(input, c);
      if (m.score() > 0 && m.score() >= threshold) out.add(m);
    }
    out.sort(Comparator.comparingDouble(NameMatch::score).reversed());

    List<NameMatch> result = List.copyOf(out);
    cache.put(key, result);
    return result;
  }

  public List<NameMatch> match(String input, List<String> candidates) {
    return match(input, candidates, DEFAULT_THRESHOLD);
  }

  public boolean isLikelyMatch(String name1, String name2) {
    return isLikelyMatch(name1, name2, LIKELY_MATCH_THRESHOLD);
  }

  public boolean isLikelyMatch(String name1, String name2, double threshold) {
    return matchSingle(name1, name2).score() >= threshold;
  }

  /** Autocomplete: até limit candidatos com score >= suggestionThreshold. */
  public List<NameMatch> getSuggestions(String partial, List<String> candidates, int limit) {
    List<NameMatch> all = match(partial, candidates, settings.suggestionThreshold());
    return all.size() <= limit ? all : all.subList(0, Math.max(0, limit));
  }

  public void clearCache() {
    cache.clear();
  }

  public void addCustomMapping(String baseName, List<String> variants) {
    nicknames.addMapping(baseName, variants);
    cache.clear();
  }

  // -------------------------
  // Resolução contra o elenco
  // -------------------------

  /**
   * Resolve o pedido "request" (posição index na lista do requester) contra o elenco.
   * exact/high -> ACCEPTED, medium -> NEEDS_REVIEW (aceito com aviso),
   * abaixo do limiar -> SUGGESTED (se houver algo) ou NOT_FOUND.
   */
  public RequestResolution resolveRequest(Player requester, String request, int index, List<Player> roster) {
    RequestPriority priority = RequestPriority.ofIndex(index);
    List<NameMatch> matches = match(request, namesOf(roster), settings.suggestionThreshold());

    for (NameMatch m : matches) {
      Player p = playerNamed(m.match(), roster, requester.id());
      if (p == null) continue;

      if (m.score() >= settings.resolutionThreshold() && m.confidence().autoAccept()) {
        if (m.confidence().needsReview()) {
          log.warn("Pedido de {} resolvido com confiança média, verificar: '{}' -> '{}' ({})",
              requester.name(), request, p.name(), m.reason());
          return new RequestResolution(requester.id(), request, index, priority,
              RequestResolution.Status.NEEDS_REVIEW, p, m);
        }
        if (!request.trim().equals(p.name())) {
          log.debug("Pedido de {} normalizado: '{}' -> '{}' ({})", requester.name(), request, p.name(), m.reason());
        }
        return new RequestResolution(requester.id(), request, index, priority,
            RequestResolution.Status.ACCEPTED, p, m);
      }

      log.debug("Pedido de {} sem match aceitável: '{}' (sugestão: '{}', {})",
          requester.name(), request, p.name(), m.reason());
      return new RequestResolution(requester.id(), request, index, priority,
          RequestResolution.Status.SUGGESTED, null, m);
    }

    log.debug("Pedido de {} não encontrado no elenco: '{}'", requester.name(), request);
    return new RequestResolution(requester.id(), request, index, priority,
        RequestResolution.Status.NOT_FOUND, null, null);
  }

  /** Jogador do elenco junto com o match que o encontrou. */
  public record PlayerMatch(Player player, NameMatch match) {}

  /** Melhor jogador do elenco (exceto excludeId) com score >= threshold, ou null. */
  public Player bestPlayer(String name, List<Player> roster, double threshold, String excludeId) {
    PlayerMatch pm = bestPlayerMatch(name, roster, threshold, excludeId);
    return pm == null ? null : pm.player();
  }

  public PlayerMatch bestPlayerMatch(String name, List<Player> roster, double threshold, String excludeId) {
    for (NameMatch m : match(name, namesOf(roster), threshold)) {
      Player p = playerNamed(m.match(), roster, excludeId);
      if (p != null) return new PlayerMatch(p, m);
    }
    return null;
  }

  private static List<String> namesOf(List<Player> roster) {
    List<String> names = new ArrayList<>(roster.size());
    for (Player p : roster) names.add(p.name());
    return names;
  }

  private static Player playerNamed(String name, List<Player> roster, String excludeId) {
    for (Player p : roster) {
      if (p.name().equals(name) && !p.id().equals(excludeId)) return p;
    }
    return null;
  }

  // -------------------------
  // Checagens
  // -------------------------

  private NameMatch concatenated(String input, String candidate, String in, String cand) {
    String inCompact = in.replace(" ", "");
    String candCompact = cand.replace(" ", "");

    if (inCompact.equals(candCompact)) {
      return new NameMatch(candidate, 0.85, Confidence.HIGH,
          "Concatenated name match: \"" + input + "\" -> \"" + candidate + "\"");
    }

    String[] words = cand.split(" ");
    if (words.length < 2) return null;

    String first = words[0];
    String last = words[words.length - 1];
    String lastInitial = last.substring(0, 1);

    List<String> patterns = new ArrayList<>();
    patterns.add(first + last);
    patterns.add(first + lastInitial);
    patterns.add(first.charAt(0) + last);
    for (String v : nicknames.variantsOf(first)) {
      String vc = v.replace(" ", "");
      patterns.add(vc + last);
      patterns.add(vc + lastInitial);
    }

    if (patterns.contains(inCompact)) {
      return new NameMatch(candidate, 0.82, Confidence.HIGH,
          "Name concatenation match: \"" + input + "\" -> \"" + candidate + "\"");
    }

    double sim = StringSimilarity.similarity(inCompact, candCompact);
    if (sim >= 0.8) {
      return new NameMatch(candidate, sim * 0.85, Confidence.HIGH,
          "Fuzzy concatenation match: \"" + input + "\" -> \"" + candidate + "\" (" + pct(sim) + "%)");
    }
    return null;
  }

  private NameMatch nickname(String input, String candidate, String in, String cand) {
    if (nicknames.related(in, cand)) {
      return new NameMatch(candidate, 0.9, Confidence.HIGH, "Nickname match: " + input + " <-> " + candidate);
    }

    // "Mike Smith" x "Michael Smith": mesmo sobrenome, primeiro nome relacionado
    String[] wi = in.split(" ");
    String[] wc = cand.split(" ");
    if (wi.length >= 2 && wc.length >= 2
        && wi[wi.length - 1].equals(wc[wc.length - 1])
        && nicknames.related(wi[0], wc[0])) {
      return new NameMatch(candidate, 0.9, Confidence.HIGH, "Nickname variant: " + input + " -> " + candidate);
    }
    return null;
  }

  private static NameMatch phonetic(String candidate, String in, String cand) {
    String a = StringSimilarity.soundex(in);
    if (a.isEmpty() || !a.equals(StringSimilarity.soundex(cand))) return null;
    return new NameMatch(candidate, 0.8, Confidence.MEDIUM, "Phonetic similarity");
  }

  private static NameMatch edit(String candidate, String in, String cand) {
    double sim = StringSimilarity.similarity(in, cand);
    if (sim >= 0.8) {
      return new NameMatch(candidate, sim, Confidence.HIGH, "High similarity (" + pct(sim) + "%)");
    }
    if (sim >= 0.6) {
      return new NameMatch(candidate, sim, Confidence.MEDIUM, "Moderate similarity (" + pct(sim) + "%)");
    }
    return null;
  }

  private static NameMatch partial(String candidate, String in, String cand) {
    if (!cand.contains(in) && !in.contains(cand)) return null;
    double ratio = (double) Math.min(in.length(), cand.length()) / Math.max(in.length(), cand.length());
    if (ratio < 0.5) return null;
    return new NameMatch(candidate, ratio * 0.7, Confidence.MEDIUM, "Partial name match");
  }

  private static long pct(double v) {
    return Math.round(v * 100);
  }
}
