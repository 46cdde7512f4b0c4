package br.teambuilder.engine;

import java.util.List;

/** Rótulo e cor de um grupo como função pura do índice (sem contador global). */
public final class GroupPalette {

  private static final List<String> COLORS = List.of(
      "#3B82F6", // azul
      "#EF4444", // vermelho
      "#10B981", // verde
      "#F59E0B", // amarelo
      "#8B5CF6", // roxo
      "#F97316", // laranja
      "#06B6D4", // ciano
      "#84CC16", // lima
      "#EC4899", // rosa
      "#6B7280", // cinza
      "#14B8A6", // teal
      "#F43F5E"  // rose
  );

  private GroupPalette() {}

  /** 0 -> A, 25 -> Z, 26 -> AA, 27 -> AB ... */
  public static String label(int index) {
    if (index < 0) throw new IllegalArgumentException("index negativo: " + index);
    StringBuilder sb = new StringBuilder();
    int i = index;
    do {
      sb.append((char) ('A' + (i % 26)));
      i = i / 26 - 1;
    } while (i >= 0);
    return sb.reverse().toString();
  }

  public static String color(int index) {
    if (index < 0) throw new IllegalArgumentException("index negativo: " + index);
    return COLORS.get(index % COLORS.size());
  }

  public static String groupId(int index) {
    return "group-" + index;
  }

  public static int paletteSize() {
    return COLORS.size();
  }
}
