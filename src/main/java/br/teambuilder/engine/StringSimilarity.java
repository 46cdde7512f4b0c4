package br.teambuilder.engine;

final class StringSimilarity {

  private StringSimilarity() {}

  static int levenshtein(String a, String b) {
    int n = a.length();
    int m = b.length();
    if (n == 0) return m;
    if (m == 0) return n;

    int[] prev = new int[m + 1];
    int[] cur = new int[m + 1];
    for (int j = 0; j <= m; j++) prev[j] = j;

    for (int i = 1; i <= n; i++) {
      cur[0] = i;
      char ca = a.charAt(i - 1);
      for (int j = 1; j <= m; j++) {
        int cost = ca == b.charAt(j - 1) ? 0 : 1;
        cur[j] = Math.min(Math.min(cur[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
      }
      int[] t = prev;
      prev = cur;
      cur = t;
    }
    return prev[m];
  }

  /** 1 - distância / maior comprimento (0..1). Duas strings vazias = 1. */
  static double similarity(String a, String b) {
    int max = Math.max(a.length(), b.length());
    if (max == 0) return 1.0;
    return 1.0 - (double) levenshtein(a, b) / max;
  }

  /**
   * Soundex simplificado: primeira letra + 3 dígitos.
   * Vogais/h/w/y contam como separador (código 0) antes de serem removidas,
   * então consoantes iguais separadas por vogal geram dígitos repetidos.
   */
  static String soundex(String s) {
    StringBuilder letters = new StringBuilder();
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c >= 'a' && c <= 'z') letters.append(c);
    }
    if (letters.length() == 0) return "";

    StringBuilder out = new StringBuilder().append(letters.charAt(0));
    char last = 0;
    for (int i = 1; i < letters.length() && out.length() < 4; i++) {
      char code = code(letters.charAt(i));
      if (code != last && code != '0') out.append(code);
      last = code;
    }
    while (out.length() < 4) out.append('0');
    return out.toString();
  }

  private static char code(char c) {
    if ("bfpv".indexOf(c) >= 0) return '1';
    if ("cgjkqsxz".indexOf(c) >= 0) return '2';
    if ("dt".indexOf(c) >= 0) return '3';
    if (c == 'l') return '4';
    if (c == 'm' || c == 'n') return '5';
    if (c == 'r') return '6';
    return '0';
  }
}
