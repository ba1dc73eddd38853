package io.texmark.fn;

import io.texmark.config.DocumentConfig;
import io.texmark.token.CallNode;
import io.texmark.token.Value;
import io.texmark.translate.TranslationState;
import java.util.HashMap;
import java.util.Map;

/**
 * {@code Header()}: the LaTeX preamble filled in from the document configuration, followed by
 * {@code \begin{document}}. Keyword arguments named after {@link DocumentConfig#KEYS} override the
 * configured fields.
 */
public final class HeaderFn extends FnMapping {

  private static final String PREAMBLE =
      """
      \\documentclass{article}
      \\usepackage{amsmath,amssymb,amsthm,tikz,tkz-graph,color,chngpage,soul,hyperref,csquotes,graphicx,floatrow, yfonts}
      \\newcommand*{\\QEDB}{\\hfill\\ensuremath{\\square}}\\newtheorem*{prop}{Proposition}
      \\renewcommand{\\theenumi}{\\alph{enumi}}\\usepackage[shortlabels]{enumitem}
      \\usepackage[nobreak=true]{mdframed}\\usetikzlibrary{matrix,calc, automata, positioning}
      \\MakeOuterQuote{"}\\usepackage[margin=1in]{geometry} \\newtheorem{theorem}{Theorem}
      \\usepackage{tabto}
      \\NumTabs{20}
      \\usepackage{fancyhdr}
      \\usepackage{pdfpages}
      \\pagestyle{fancy}
      \\hypersetup{colorlinks=true, urlcolor=blue}
      \\headheight=40pt
      \\renewcommand{\\headrulewidth}{6pt}
      \\newcommand{\\lt}{<}
      \\newcommand{\\gt}{>}
      \\rfoot{%s | %s}
      \\lhead{\\Large\\fontfamily{lmdh}\\selectfont %s \\\\%s \\tab\\tab %s}
      \\rhead{\\LARGE \\fontfamily{lmdh}\\selectfont %s}
      \\begin{document}""";

  HeaderFn(CallNode call) {
    super(call, false);
  }

  @Override
  public String begin(TranslationState state) {
    if (!state.openDocument()) {
      state.warn(call.line(), "Header used more than once; the preamble is repeated");
    }
    Map<String, String> overrides = new HashMap<>();
    for (String key : DocumentConfig.KEYS) {
      Value v = call.kwarg(key);
      if (v != null) {
        overrides.put(key, state.render(v));
      }
    }
    DocumentConfig c = state.config().withOverrides(overrides);
    return PREAMBLE.formatted(
        c.name(), c.id(), c.course(), c.semester(), c.instructor(), c.title());
  }

  @Override
  public String end() {
    return "";
  }

  @Override
  public boolean endsLine() {
    return true;
  }
}
