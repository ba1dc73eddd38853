package io.texmark.cli;

import io.texmark.TexmarkCompiler;
import io.texmark.TexmarkException;
import io.texmark.config.DocumentConfig;
import io.texmark.token.Token;
import io.texmark.translate.Translation;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "texmark",
    description = "Translate a texmark document into LaTeX",
    version = "0.1.0",
    mixinStandardHelpOptions = true)
public class Main implements Callable<Integer> {

  @CommandLine.Parameters(
      index = "0",
      paramLabel = "INPUT",
      description = "Markup file to translate")
  private Path input;

  @CommandLine.Option(
      names = {"-o", "--output"},
      description = "Write LaTeX to this file instead of stdout")
  private Path output;

  @CommandLine.Option(
      names = {"-c", "--config"},
      description = "Header fields: a .properties file or six lines (title, name, id, course, "
              + "semester, instructor)")
  private Path config;

  @CommandLine.Option(
      names = "--strict-keys",
      description = "Fail on duplicate keyword arguments or object keys")
  private boolean strictKeys;

  @CommandLine.Option(
      names = "--dump-tokens",
      description = "Print the refined token sequence to stderr")
  private boolean dumpTokens;

  @CommandLine.Option(names = "--verbose", description = "Debug logging")
  private boolean verbose;

  public static void main(String[] args) {
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() {
    if (verbose) {
      System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
    }
    PrintStream err = System.err;
    if (!Files.exists(input)) {
      err.println("Error: input file not found: " + input);
      return 1;
    }
    try {
      DocumentConfig header = config != null ? DocumentConfig.load(config) : DocumentConfig.empty();
      TexmarkCompiler compiler =
          TexmarkCompiler.builder()
              .config(header)
              .strictKeys(strictKeys)
              .warnings(w -> err.println("Warning: " + w))
              .build();
      if (dumpTokens) {
        try (Reader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
          for (Token t : compiler.tokens(reader)) {
            err.println(t.repr());
          }
        }
      }
      Translation result;
      try (Reader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
        result = compiler.compile(reader);
      }
      if (output != null) {
        Files.writeString(output, result.latex(), StandardCharsets.UTF_8);
      } else {
        System.out.print(result.latex());
        System.out.flush();
      }
      return 0;
    } catch (TexmarkException e) {
      err.println("Error: " + e.getMessage());
      return 1;
    } catch (IOException e) {
      err.println("Error: " + e.getMessage());
      return 1;
    }
  }
}
