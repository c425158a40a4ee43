package com.flamingo.ai.studymate.service.dispatch;

import com.flamingo.ai.studymate.service.routing.ActionArguments;
import com.flamingo.ai.studymate.service.routing.LocaleDigits;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Extracts note text and an optional page number for {@code add_note}. Router arguments win;
 * the utterance fills whatever they leave out.
 */
@Component
public class NoteTextExtractor {

  private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

  private static final Pattern PAGE =
      Pattern.compile(
          "(?:(?<!\\p{L})(?:on|at|in|في|فى)\\s+)?"
              + "(?<!\\p{L})(?:page|pg\\.?|p\\.?|صفحة|صفحه|ص)\\s*(\\d+)",
          FLAGS);

  private static final Pattern PARENTHESIZED = Pattern.compile("\\(([^)]+)\\)");
  private static final Pattern QUOTED = Pattern.compile("[\"“”«]([^\"“”«»]+)[\"“”»]");

  private static final List<Pattern> COMMAND_PHRASES =
      List.of(
          Pattern.compile("\\badd_note\\b", FLAGS),
          Pattern.compile("\\b(?:add|make|take|write)\\s+(?:a\\s+)?note\\b", FLAGS),
          Pattern.compile("\\bnote\\s*:", FLAGS),
          Pattern.compile(
              "(?:زود|زوّد|ضيف|اضف|أضف|إضافة|اكتب)\\s+(?:نوته|نوتة|نوت|ملاحظة|ملاحظه)", FLAGS));

  private static final Pattern EDGE_PUNCTUATION =
      Pattern.compile("^[\\s:،,.\\-–]+|[\\s:،,.\\-–]+$");

  /** Extracted note; {@code text} is null when the user gave no content. */
  public record NoteDraft(String text, Integer pageNumber) {}

  public NoteDraft extract(ActionArguments arguments, String utterance) {
    String normalized = LocaleDigits.normalize(utterance == null ? "" : utterance).strip();

    Integer page = arguments.pageNum();
    Matcher pageMatcher = PAGE.matcher(normalized);
    String remainder = normalized;
    if (pageMatcher.find()) {
      if (page == null) {
        // Out-of-range page numbers leave the note on the current page.
        page = LocaleDigits.parseInteger(pageMatcher.group(1));
      }
      remainder = pageMatcher.replaceFirst(" ");
    }

    String text = arguments.noteText();
    if (text == null || text.isBlank()) {
      text = textFromUtterance(remainder);
    } else {
      text = text.strip();
    }
    return new NoteDraft(text, page);
  }

  private static String textFromUtterance(String utterance) {
    Matcher parenthesized = PARENTHESIZED.matcher(utterance);
    if (parenthesized.find()) {
      return blankToNull(parenthesized.group(1));
    }
    Matcher quoted = QUOTED.matcher(utterance);
    if (quoted.find()) {
      return blankToNull(quoted.group(1));
    }

    String text = utterance;
    for (Pattern phrase : COMMAND_PHRASES) {
      text = phrase.matcher(text).replaceAll(" ");
    }
    return blankToNull(text.replaceAll("\\s+", " "));
  }

  private static String blankToNull(String text) {
    String cleaned = EDGE_PUNCTUATION.matcher(text).replaceAll("").strip();
    return cleaned.isEmpty() ? null : cleaned;
  }
}
