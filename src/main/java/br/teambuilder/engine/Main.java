package br.teambuilder.engine;

import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;

public final class Main {

    private Main() {}

    public static void main(String[] args) throws Exception {
        Map<String, String> a = parseArgs(args);

        Path input = requirePath(a, "--input");
        Path out = requirePath(a, "--out");

        if (!Files.isRegularFile(input)) {
            usageAndFail("--input is not a file: " + input);
        }

        RosterJson.Request req = RosterJson.parseRequest(Files.readString(input, StandardCharsets.UTF_8));

        // --mode sobrescreve o "mode" do documento
        GenerationMode mode = a.containsKey("--mode") ? GenerationMode.parse(a.get("--mode")) : req.mode();
        Long seed = optionalLong(a, "--seed");

        if (!req.config().quotasFeasible()) {
            usageAndFail("minFemales + minMales exceeds maxTeamSize");
        }
        GroupValidation v = GroupFormation.validateGroupsForGeneration(req.groups(), req.config().maxTeamSize());
        if (!v.ok()) {
            usageAndFail(String.join("\n", v.errors()));
        }

        Random random = seed == null ? new Random() : new Random(seed);
        TeamGenerator generator = new TeamGenerator(EngineSettings.fromSystemProperties(), random);
        GenerationResult result = generator.generate(req.players(), req.config(), req.groups(), mode);

        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        GroupValidation all = GroupFormation.validateGroupsForGeneration(result.groups(), req.config().maxTeamSize());
        Files.writeString(out, RosterJson.toJson(RosterJson.render(result, all)), StandardCharsets.UTF_8);

        GenerationStats s = result.stats();
        System.out.println("OK: " + out + " (" + result.teams().size() + " teams, "
            + s.assignedPlayers() + " assigned, " + s.unassignedPlayers() + " unassigned)");
    }

    // =========================
    // CLI helpers
    // =========================
    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            String k = args[i];
            if (!k.startsWith("--")) continue;
            String v = null;
            if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                v = args[++i];
            }
            m.put(k, v);
        }
        return m;
    }

    private static Path requirePath(Map<String, String> a, String key) {
        String v = a.get(key);
        if (v == null || v.isBlank()) {
            usageAndFail("Missing " + key);
        }
        return Paths.get(v);
    }

    private static Long optionalLong(Map<String, String> a, String key) {
        String v = a.get(key);
        if (v == null || v.isBlank()) return null;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            usageAndFail("Invalid number for " + key + ": " + v);
            return null;
        }
    }

    private static void usageAndFail(String msg) {
        System.err.println("Usage:");
        System.err.println("  --input <request.json> --out <result.json> [--mode balanced|random|manual] [--seed N]");
        System.err.println("  engine tunables: -Dteambuilder.balancer.max-passes=N, -Dteambuilder.resolution.threshold=X, ...");
        if (msg != null && !msg.isBlank()) System.err.println("\n" + msg);
        throw new IllegalArgumentException(msg);
    }
}
