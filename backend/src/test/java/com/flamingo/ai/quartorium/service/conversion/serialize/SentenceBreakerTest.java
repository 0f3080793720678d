package com.flamingo.ai.quartorium.service.conversion.serialize;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.quartorium.config.QuartoriumConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SentenceBreakerTest {

  private SentenceBreaker breaker;

  @BeforeEach
  void setUp() {
    breaker = new SentenceBreaker(new QuartoriumConfig().getSerializer().getAbbreviations());
  }

  @Test
  @DisplayName("should put each sentence on its own line")
  void shouldBreakAfterTerminators() {
    assertThat(breaker.breakLines("First sentence. Second one! Third? Yes."))
        .isEqualTo("First sentence.\nSecond one!\nThird?\nYes.");
  }

  @Test
  @DisplayName("should not break after known abbreviations or initials")
  void shouldNotBreak_whenAbbreviationOrInitial() {
    assertThat(breaker.breakLines("Dr. Smith arrived. He left."))
        .isEqualTo("Dr. Smith arrived.\nHe left.");
    assertThat(breaker.breakLines("J. R. Tolkien wrote it. It sold."))
        .isEqualTo("J. R. Tolkien wrote it.\nIt sold.");
    assertThat(breaker.breakLines("See Fig. Two for details."))
        .isEqualTo("See Fig. Two for details.");
  }

  @Test
  @DisplayName("should not break before a lowercase word or after an ellipsis")
  void shouldNotBreak_whenLowercaseOrEllipsis() {
    assertThat(breaker.breakLines("Values were high, e.g. above ten. fine"))
        .isEqualTo("Values were high, e.g. above ten. fine");
    assertThat(breaker.breakLines("Wait... Then go.")).isEqualTo("Wait... Then go.");
  }

  @Test
  @DisplayName("should leave code spans, URLs and bracketed spans intact")
  void shouldNotBreak_insideProtectedSpans() {
    assertThat(breaker.breakLines("Use `x. Y` here. Done."))
        .isEqualTo("Use `x. Y` here.\nDone.");
    assertThat(breaker.breakLines("Visit https://example.org/a. Then go."))
        .isEqualTo("Visit https://example.org/a. Then go.");
    assertThat(breaker.breakLines("[Odd. Claim]{.comment ref=\"c1\"} stays."))
        .isEqualTo("[Odd. Claim]{.comment ref=\"c1\"} stays.");
  }

  @Test
  @DisplayName("should break before a reference and after closing quotes")
  void shouldBreak_beforeReferenceAndAfterQuote() {
    assertThat(breaker.breakLines("Shown before. @fig-plot is nice."))
        .isEqualTo("Shown before.\n@fig-plot is nice.");
    assertThat(breaker.breakLines("He said \"Stop.\" Then left."))
        .isEqualTo("He said \"Stop.\"\nThen left.");
  }

  @Test
  @DisplayName("should not break inside titles, decimals or e-mail addresses")
  void shouldNotBreak_whenTitleDecimalOrEmail() {
    assertThat(
            breaker.breakLines(
                "Dr. Smith measured 3.14 mm and wrote to ann.lee@example.org about it. "
                    + "The value held at 2.5 units. Contact bob@lab.example.com for data."))
        .isEqualTo(
            "Dr. Smith measured 3.14 mm and wrote to ann.lee@example.org about it.\n"
                + "The value held at 2.5 units.\n"
                + "Contact bob@lab.example.com for data.");
    assertThat(breaker.breakLines("Write to ann@example.org. Then wait."))
        .isEqualTo("Write to ann@example.org.\nThen wait.");
  }

  @Test
  @DisplayName("should keep a list marker on the line of its item text")
  void shouldNotBreak_afterListMarker() {
    assertThat(breaker.breakLines("1. First item")).isEqualTo("1. First item");
    assertThat(breaker.breakLines("12. Twelfth item")).isEqualTo("12. Twelfth item");
    assertThat(breaker.breakLines("2) Second. Third part."))
        .isEqualTo("2) Second.\nThird part.");
    assertThat(breaker.breakLines("- Bullet one. Two.")).isEqualTo("- Bullet one.\nTwo.");
  }
}
