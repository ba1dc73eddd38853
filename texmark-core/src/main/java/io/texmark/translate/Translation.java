package io.texmark.translate;

import java.util.List;

/**
 * Output of one translation run.
 *
 * @param latex the generated LaTeX source
 * @param warnings warnings raised during the run, in order
 */
public record Translation(String latex, List<Warning> warnings) {

  public Translation {
    warnings = List.copyOf(warnings);
  }
}
