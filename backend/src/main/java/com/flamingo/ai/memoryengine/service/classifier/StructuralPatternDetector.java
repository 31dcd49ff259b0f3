package com.flamingo.ai.memoryengine.service.classifier;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import org.springframework.stereotype.Component;

/**
 * Language-agnostic structural checks that flag technical or machine-shaped content without any
 * model call.
 *
 * <p>Every rule is tuned for precision over recall: a hit is a strong signal, a miss says nothing.
 * Plain prose and simple bullet lists never match.
 */
@Component
public class StructuralPatternDetector {

  private static final String PUNCTUATION_TO_STRIP = ".,;:!?()[]{}\"'";
  private static final String MARKUP_CHARS = "{}[]<>";
  private static final String CODE_LINE_ENDINGS = "{}();";
  private static final List<String> SEPARATORS = List.of("---", "===", "___", "***");
  private static final List<String> OPERATORS =
      List.of("=", "+", "-", "*", "/", "<", ">", "&", "|", "!", ":", "?");
  private static final Set<String> KNOWN_COMMANDS =
      Set.of("curl", "wget", "git", "npm", "pip", "docker");

  private final List<Rule> rules =
      List.of(
          new Rule("url-list", StructuralPatternDetector::hasManyUrls),
          new Rule("long-token", StructuralPatternDetector::hasLongToken),
          new Rule("separators", StructuralPatternDetector::hasRepeatedSeparators),
          new Rule("command-lines", StructuralPatternDetector::hasCommandLines),
          new Rule("path-density", StructuralPatternDetector::hasHighPathDensity),
          new Rule("markup-density", StructuralPatternDetector::hasHighMarkupDensity),
          new Rule("key-value-block", StructuralPatternDetector::isKeyValueBlock),
          new Rule("structured-block", StructuralPatternDetector::isStructuredBlock),
          new Rule("code-indentation", StructuralPatternDetector::hasCodeIndentation),
          new Rule("special-chars", StructuralPatternDetector::hasHighSpecialCharRatio));

  /** Whether any rule matches the raw message. */
  public boolean matches(String message) {
    return firstMatch(message).isPresent();
  }

  /** Name of the first matching rule, for diagnostics. */
  public Optional<String> firstMatch(String message) {
    if (message == null || message.isEmpty()) {
      return Optional.empty();
    }
    return rules.stream().filter(rule -> rule.test().test(message)).map(Rule::name).findFirst();
  }

  private record Rule(String name, Predicate<String> test) {}

  static boolean hasManyUrls(String message) {
    return count(message, "http://") + count(message, "https://") >= 5;
  }

  // Tokens, hashes, base64 blobs.
  static boolean hasLongToken(String message) {
    for (String word : words(message)) {
      String cleaned = stripChars(word, PUNCTUATION_TO_STRIP);
      if (cleaned.length() > 80 && isAlphanumeric(cleaned.replace("-", "").replace("_", ""))) {
        return true;
      }
    }
    return false;
  }

  static boolean hasRepeatedSeparators(String message) {
    return SEPARATORS.stream().anyMatch(separator -> count(message, separator) >= 2);
  }

  static boolean hasCommandLines(String message) {
    int commandLines = 0;
    for (String line : message.split("\n")) {
      String stripped = line.strip();
      if (stripped.isEmpty()) {
        continue;
      }
      if (isCommandLine(stripped)) {
        commandLines++;
      }
    }
    if (commandLines >= 1
        && (message.contains("http://")
            || message.contains("https://")
            || message.contains(" | "))) {
      return true;
    }
    return commandLines >= 3;
  }

  private static boolean isCommandLine(String line) {
    if (line.startsWith("$ ") && line.length() > 2) {
      String[] parts = words(line.substring(2));
      return parts.length > 0 && isAlphanumeric(parts[0]);
    }
    int dollar = line.indexOf("$ ");
    if (dollar >= 0) {
      if (dollar == 0) {
        return false;
      }
      char before = line.charAt(dollar - 1);
      if (before != ' ' && before != ':' && before != '\t') {
        return false;
      }
      String[] parts = words(line.substring(dollar + 2));
      return parts.length > 0 && (isAlphanumeric(parts[0]) || KNOWN_COMMANDS.contains(parts[0]));
    }
    if (line.startsWith("# ") && line.length() > 2) {
      // Shell comment style: "# install the deps", not a markdown heading.
      String rest = line.substring(2).strip();
      return !rest.isEmpty() && !Character.isUpperCase(rest.charAt(0)) && rest.contains(" ");
    }
    return false;
  }

  static boolean hasHighPathDensity(String message) {
    int length = message.length();
    if (length <= 30) {
      return false;
    }
    int pathChars = count(message, "/") + count(message, "\\") + count(message, ".");
    return pathChars > 10 && (double) pathChars / length > 0.15;
  }

  static boolean hasHighMarkupDensity(String message) {
    int markup = countChars(message, MARKUP_CHARS);
    if (markup < 6) {
      return false;
    }
    if ((double) markup / message.length() > 0.10) {
      return true;
    }
    return countChars(message, "{}") >= 10;
  }

  static boolean isKeyValueBlock(String message) {
    if (count(message, "\n") < 8) {
      return false;
    }
    List<String> lines = nonBlankLines(message);
    if (lines.isEmpty()) {
      return false;
    }
    long colonLines =
        lines.stream().filter(l -> l.contains(":") && !l.strip().startsWith("#")).count();
    long indented = lines.stream().filter(StructuralPatternDetector::isIndented).count();
    if ((double) colonLines / lines.size() <= 0.4 || (double) indented / lines.size() <= 0.5) {
      return false;
    }
    int wordsOutsideKeyValue =
        lines.stream().filter(l -> !l.contains(":")).mapToInt(l -> words(l).length).sum();
    return wordsOutsideKeyValue < 5;
  }

  static boolean isStructuredBlock(String message) {
    if (count(message, "\n") <= 15) {
      return false;
    }
    List<String> lines = nonBlankLines(message);
    if (lines.isEmpty()) {
      return false;
    }
    long markupLines = lines.stream().filter(l -> countChars(l, MARKUP_CHARS) > 0).count();
    if ((double) markupLines / lines.size() > 0.3) {
      return true;
    }
    long indented = lines.stream().filter(StructuralPatternDetector::isIndented).count();
    if ((double) indented / lines.size() > 0.6) {
      int operators = OPERATORS.stream().mapToInt(op -> count(message, op)).sum();
      return (double) operators / message.length() > 0.05;
    }
    return false;
  }

  static boolean hasCodeIndentation(String message) {
    if (count(message, "\n") < 3) {
      return false;
    }
    List<String> lines = nonBlankLines(message);
    if (lines.isEmpty()) {
      return false;
    }
    long indented = lines.stream().filter(StructuralPatternDetector::isIndented).count();
    if ((double) indented / lines.size() <= 0.5) {
      return false;
    }
    long codeEndings =
        lines.stream()
            .map(String::strip)
            .filter(l -> !l.isEmpty() && CODE_LINE_ENDINGS.indexOf(l.charAt(l.length() - 1)) >= 0)
            .count();
    return (double) codeEndings / lines.size() > 0.2;
  }

  static boolean hasHighSpecialCharRatio(String message) {
    int length = message.length();
    if (length <= 50) {
      return false;
    }
    int special = 0;
    int alphanumeric = 0;
    for (int i = 0; i < length; i++) {
      char c = message.charAt(i);
      if (Character.isLetterOrDigit(c)) {
        alphanumeric++;
      } else if (!Character.isWhitespace(c)) {
        special++;
      }
    }
    return (double) special / length > 0.35 && (double) alphanumeric / length < 0.50;
  }

  private static boolean isIndented(String line) {
    return line.startsWith(" ") || line.startsWith("\t");
  }

  private static List<String> nonBlankLines(String message) {
    return Arrays.stream(message.split("\n")).filter(l -> !l.isBlank()).toList();
  }

  private static String[] words(String text) {
    String stripped = text.strip();
    return stripped.isEmpty() ? new String[0] : stripped.split("\\s+");
  }

  private static boolean isAlphanumeric(String text) {
    if (text.isEmpty()) {
      return false;
    }
    for (int i = 0; i < text.length(); i++) {
      if (!Character.isLetterOrDigit(text.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private static String stripChars(String text, String chars) {
    int start = 0;
    int end = text.length();
    while (start < end && chars.indexOf(text.charAt(start)) >= 0) {
      start++;
    }
    while (end > start && chars.indexOf(text.charAt(end - 1)) >= 0) {
      end--;
    }
    return text.substring(start, end);
  }

  private static int count(String text, String needle) {
    int count = 0;
    int from = 0;
    while ((from = text.indexOf(needle, from)) >= 0) {
      count++;
      from += needle.length();
    }
    return count;
  }

  private static int countChars(String text, String chars) {
    int count = 0;
    for (int i = 0; i < text.length(); i++) {
      if (chars.indexOf(text.charAt(i)) >= 0) {
        count++;
      }
    }
    return count;
  }
}
