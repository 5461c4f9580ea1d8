package com.flamingo.ai.clinicalnotes.service.merge;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Removes model chatter around a generated note: code fences, an introductory line such as "Here
 * is the updated note:", and BEGIN/END markers. Runs of blank lines are collapsed to one.
 */
@Component
public class CandidateTextCleaner {

  private static final Pattern CODE_FENCE = Pattern.compile("^\\s*```[\\w-]*\\s*$");
  private static final Pattern INTRO_LINE =
      Pattern.compile(
          "(?i)^\\s*(?:(?:here'?s|here is|below is)\\s+(?:the|an?|your)\\b.*"
              + "|the\\s+updated\\b.*):\\s*$");
  private static final Pattern NOTE_MARKER =
      Pattern.compile("(?i)^\\s*(?:BEGIN|END)\\s+(?:OF\\s+)?(?:UPDATED\\s+)?NOTE\\s*:?\\s*$");
  private static final Pattern BLANK_RUNS = Pattern.compile("\\n[ \\t]*\\n(?:[ \\t]*\\n)+");

  public String clean(String text) {
    if (text == null) {
      return "";
    }
    String normalized = text.replace("\r\n", "\n").replace('\r', '\n');

    List<String> kept = new ArrayList<>();
    boolean contentSeen = false;
    for (String line : normalized.split("\n", -1)) {
      if (CODE_FENCE.matcher(line).matches() || NOTE_MARKER.matcher(line).matches()) {
        continue;
      }
      if (!contentSeen && INTRO_LINE.matcher(line).matches()) {
        continue;
      }
      if (!line.isBlank()) {
        contentSeen = true;
      }
      kept.add(line);
    }

    String joined = String.join("\n", kept);
    return BLANK_RUNS.matcher(joined).replaceAll("\n\n").strip();
  }
}
