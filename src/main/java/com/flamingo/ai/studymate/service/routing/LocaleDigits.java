package com.flamingo.ai.studymate.service.routing;

/** Normalizes Arabic-Indic and Persian digits to ASCII. */
public final class LocaleDigits {

  private LocaleDigits() {}

  public static String normalize(String text) {
    if (text == null) {
      return null;
    }
    StringBuilder sb = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c >= '٠' && c <= '٩') {
        sb.append((char) ('0' + (c - '٠')));
      } else if (c >= '۰' && c <= '۹') {
        sb.append((char) ('0' + (c - '۰')));
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  /** Parses an integer from a number or a digit string in any supported script. */
  public static Integer parseInteger(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number number) {
      return number.intValue();
    }
    String text = normalize(value.toString()).trim();
    if (text.isEmpty()) {
      return null;
    }
    try {
      return Integer.parseInt(text);
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
