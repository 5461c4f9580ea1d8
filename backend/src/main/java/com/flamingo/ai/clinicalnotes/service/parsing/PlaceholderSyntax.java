package com.flamingo.ai.clinicalnotes.service.parsing;

import java.util.regex.Pattern;

/**
 * Recognizes vendor template placeholders left in note text: SmartPhrases ({@code @HPI@}),
 * SmartLists ({@code {Mood:1234}}), wildcard blanks ({@code ***}) and dot phrases ({@code
 * .hpi}).
 */
public final class PlaceholderSyntax {

  public static final String SMART_PHRASE = "@[A-Z][A-Z0-9_]*@";
  public static final String SMART_LIST = "\\{[A-Za-z][^{}\\n]*:\\d+\\}";
  public static final String WILDCARD_BLANK = "\\*\\*\\*";
  public static final String DOT_PHRASE = "(?<![\\w.])\\.[a-z][a-z0-9]{2,}\\b";

  private static final Pattern ANY =
      Pattern.compile(String.join("|", SMART_PHRASE, SMART_LIST, WILDCARD_BLANK, DOT_PHRASE));

  private PlaceholderSyntax() {}

  public static boolean containsPlaceholder(String text) {
    return text != null && ANY.matcher(text).find();
  }
}
