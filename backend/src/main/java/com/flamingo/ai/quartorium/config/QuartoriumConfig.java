package com.flamingo.ai.quartorium.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the conversion pipeline. */
@Configuration
@ConfigurationProperties(prefix = "quartorium")
@Getter
@Setter
public class QuartoriumConfig {

  private Render render = new Render();
  private Assets assets = new Assets();
  private Projects projects = new Projects();
  private Serializer serializer = new Serializer();

  @Getter
  @Setter
  public static class Render {
    /** Renderer executable, resolved through PATH when not absolute. */
    private String executable = "quarto";

    /**
     * Arguments passed after the executable. {@code {source}} and {@code {outputDir}} are replaced
     * with the snapshot source file and the output directory.
     */
    private List<String> arguments =
        new ArrayList<>(
            List.of("render", "{source}", "--to", "jats", "--output-dir", "{outputDir}"));

    private int timeoutSeconds = 300;

    /** Directory holding per-render project snapshots. Defaults to the system temp dir. */
    private String workDir;

    private int cacheMaxEntries = 64;
  }

  @Getter
  @Setter
  public static class Assets {
    private String urlPrefix = "/api/assets";
  }

  @Getter
  @Setter
  public static class Projects {
    private String baseDir = "./repos";
  }

  @Getter
  @Setter
  public static class Serializer {
    /** Mark types in the order they wrap each other, outermost first. */
    private List<String> markPrecedence =
        new ArrayList<>(List.of("comment", "strikethrough", "strong", "em", "code"));

    private boolean sentenceBreaksEnabled = true;

    /** Drops comment threads whose mark no longer exists in the saved tree. */
    private boolean pruneOrphanComments = true;

    private List<String> abbreviations =
        new ArrayList<>(
            List.of(
                "Dr.", "Mr.", "Mrs.", "Ms.", "Prof.", "Sr.", "Jr.", "St.", "vs.", "etc.", "e.g.",
                "i.e.", "al.", "cf.", "approx.", "Fig.", "Figs.", "Eq.", "Eqs.", "Tab.", "No.",
                "Vol.", "pp.", "p.", "ca.", "Ref.", "Sec.", "Ch."));
  }
}
