package br.teambuilder.engine;

import java.util.List;

/**
 * Pré-checagem antes de gerar times.
 * errors: grupo maior que maxTeamSize (nunca cabe em time nenhum).
 * warnings: grupo do tamanho exato de um time (ocupa o time inteiro).
 */
public record GroupValidation(List<String> errors, List<String> warnings) {

  public GroupValidation {
    errors = List.copyOf(errors);
    warnings = List.copyOf(warnings);
  }

  public boolean ok() {
    return errors.isEmpty();
  }
}
