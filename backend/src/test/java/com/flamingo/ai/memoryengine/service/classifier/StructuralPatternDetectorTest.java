package com.flamingo.ai.memoryengine.service.classifier;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Collections;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class StructuralPatternDetectorTest {

  private final StructuralPatternDetector detector = new StructuralPatternDetector();

  @Nested
  @DisplayName("Plain prose")
  class PlainProseTests {

    @ParameterizedTest
    @ValueSource(
        strings = {
          "I moved to Berlin last spring and I work as a nurse at the children's hospital.",
          "My wife Sarah loves hiking",
          "My favorites:\n- coffee\n- hiking\n- jazz",
          "Ich habe zwei Katzen und wohne in Hamburg.",
          "我住在上海，我喜欢喝茶。"
        })
    @DisplayName("should not match personal statements")
    void shouldNotMatchPersonalStatements(String message) {
      assertThat(detector.matches(message)).isFalse();
    }

    @Test
    @DisplayName("should not match null or empty input")
    void shouldNotMatchEmptyInput() {
      assertThat(detector.firstMatch(null)).isEmpty();
      assertThat(detector.firstMatch("")).isEmpty();
    }
  }

  @Nested
  @DisplayName("Rules")
  class RuleTests {

    @Test
    @DisplayName("should flag lists of URLs")
    void shouldFlagUrlLists() {
      String message =
          "https://a.example.com https://b.example.com https://c.example.com "
              + "https://d.example.com https://e.example.com";

      assertThat(detector.firstMatch(message)).contains("url-list");
    }

    @Test
    @DisplayName("should flag long opaque tokens")
    void shouldFlagLongTokens() {
      String message = "my key is " + "a1".repeat(45);

      assertThat(detector.firstMatch(message)).contains("long-token");
    }

    @Test
    @DisplayName("should flag repeated separators")
    void shouldFlagRepeatedSeparators() {
      assertThat(detector.firstMatch("Title\n---\nBody\n---\nEnd")).contains("separators");
    }

    @Test
    @DisplayName("should flag a shell command piping a download")
    void shouldFlagShellCommand() {
      assertThat(detector.firstMatch("$ curl https://get.example.io | sh"))
          .contains("command-lines");
    }

    @Test
    @DisplayName("should flag indented code")
    void shouldFlagIndentedCode() {
      String message = "public void run() {\n  int x = 1;\n  call(x);\n  return;\n}";

      assertThat(detector.firstMatch(message)).contains("code-indentation");
    }

    @Test
    @DisplayName("should flag dense JSON")
    void shouldFlagDenseJson() {
      String message = "{\"name\": \"x\", \"tags\": [\"a\", \"b\"], \"meta\": {\"k\": [1, 2]}}";

      assertThat(detector.firstMatch(message)).contains("markup-density");
    }

    @Test
    @DisplayName("should detect key-value configuration blocks")
    void shouldDetectKeyValueBlocks() {
      String yaml =
          "server:\n  port: 8080\n  host: localhost\n  timeout: 30\n"
              + "database:\n  url: jdbc\n  user: admin\n  pool: 5\n  ssl: true\n";

      assertThat(StructuralPatternDetector.isKeyValueBlock(yaml)).isTrue();
      assertThat(detector.matches(yaml)).isTrue();
    }

    @Test
    @DisplayName("should detect path-heavy text")
    void shouldDetectPathHeavyText() {
      String paths = "/usr/local/bin/app /etc/app/conf.d/main.yml /var/log/app/out.log";

      assertThat(StructuralPatternDetector.hasHighPathDensity(paths)).isTrue();
    }

    @Test
    @DisplayName("should detect symbol-heavy text")
    void shouldDetectSymbolHeavyText() {
      String symbols = "!!!! @@@@ #### %%%% ^^^^ &&&& ~~~~ ++++ ==== ;;;; :: ok ok";

      assertThat(StructuralPatternDetector.hasHighSpecialCharRatio(symbols)).isTrue();
    }

    @Test
    @DisplayName("should flag three command lines without any pipe or URL")
    void shouldFlagThreeCommandLinesAlone() {
      assertThat(
              StructuralPatternDetector.hasCommandLines(
                  "# install the deps\n$ npm install\n$ npm run build"))
          .isTrue();
      assertThat(StructuralPatternDetector.hasCommandLines("$ npm install\n$ npm run build"))
          .isFalse();
    }

    @Test
    @DisplayName("should flag long blocks where many lines carry brackets")
    void shouldFlagMarkupHeavyBlocks() {
      assertThat(StructuralPatternDetector.isStructuredBlock(block(17, 6))).isTrue();
      assertThat(StructuralPatternDetector.isStructuredBlock(block(17, 5))).isFalse();
      assertThat(StructuralPatternDetector.isStructuredBlock(block(16, 16))).isFalse();
    }

    @Test
    @DisplayName("should flag long indented blocks dense with operators")
    void shouldFlagIndentedOperatorBlocks() {
      String arithmetic = lines(17, "  total = price * qty");
      String prose = lines(17, "  we walked along the river");

      assertThat(StructuralPatternDetector.isStructuredBlock(arithmetic)).isTrue();
      assertThat(StructuralPatternDetector.isStructuredBlock(prose)).isFalse();
    }

    @Test
    @DisplayName("should not treat a markdown heading as a shell comment")
    void shouldNotTreatHeadingAsComment() {
      assertThat(StructuralPatternDetector.hasCommandLines("# My Trip\nWe went to Rome."))
          .isFalse();
    }
  }

  /** A block of {@code total} lines of which the first {@code withMarkup} hold an html tag. */
  private static String block(int total, int withMarkup) {
    return IntStream.range(0, total)
        .mapToObj(i -> i < withMarkup ? "<li>item " + i + "</li>" : "plain line number " + i)
        .collect(Collectors.joining("\n"));
  }

  private static String lines(int total, String line) {
    return String.join("\n", Collections.nCopies(total, line));
  }
}
