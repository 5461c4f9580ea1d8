package com.flamingo.ai.clinicalnotes.service.parsing;

import com.flamingo.ai.clinicalnotes.service.parsing.model.ParsedNote;
import com.flamingo.ai.clinicalnotes.service.parsing.model.Section;
import java.util.List;

/**
 * Writes sections back to note text: the original heading line, the body, and a blank line
 * between sections. Parsing the output yields the same section types and confidence tiers.
 */
public final class NoteRenderer {

  private NoteRenderer() {}

  public static String render(ParsedNote note) {
    return render(note.sections());
  }

  public static String render(List<Section> sections) {
    StringBuilder text = new StringBuilder();
    for (Section section : sections) {
      String block = renderSection(section);
      if (block.isEmpty()) {
        continue;
      }
      if (text.length() > 0) {
        text.append("\n\n");
      }
      text.append(block);
    }
    return text.toString();
  }

  private static String renderSection(Section section) {
    String heading = section.heading();
    String content = section.content() == null ? "" : section.content();
    if (heading.isBlank()) {
      return content;
    }
    if (content.isBlank()) {
      return heading;
    }
    return heading + "\n" + content;
  }
}
