package com.gentoro.knowledge.connector.jira;

import com.gentoro.knowledge.utility.StringUtility;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Renders a {@link JiraIssue} as a markdown document. */
final class JiraMarkdown {
  private static final Pattern NOFORMAT =
      Pattern.compile("\\{noformat}(.*?)\\{noformat}", Pattern.DOTALL);
  private static final Pattern BLANK_RUNS = Pattern.compile("\n{3,}");

  private JiraMarkdown() {}

  static String render(String domain, JiraIssue issue) {
    StringBuilder md = new StringBuilder();
    md.append("# ").append(issue.key()).append(": ").append(issue.summary());

    List<List<String>> metadata = new ArrayList<>();
    metadata.add(List.of("Type", issue.issueType()));
    metadata.add(List.of("Status", issue.status()));
    metadata.add(List.of("Priority", issue.priority()));
    metadata.add(List.of("Assignee", issue.assignee()));
    metadata.add(List.of("Reporter", issue.reporter()));
    metadata.add(List.of("Created", issue.created()));
    metadata.add(List.of("Updated", issue.updated()));
    if (issue.parent() != null) {
      metadata.add(
          List.of("Parent", link(domain, issue.parent().key(), issue.parent().summary())));
    }
    md.append("\n\n## Metadata\n\n");
    md.append(StringUtility.markdownTable(List.of("Field", "Value"), metadata));

    md.append("\n\n## Description\n\n").append(markupToMarkdown(issue.description()));

    if (!issue.relatedIssues().isEmpty()) {
      md.append("\n\n## Related");
      Map<String, List<List<String>>> groups = new LinkedHashMap<>();
      issue.relatedIssues().stream()
          .sorted(
              Comparator.comparing(JiraIssue.RelatedIssue::linkType)
                  .thenComparing(JiraIssue.RelatedIssue::key))
          .forEach(
              r ->
                  groups
                      .computeIfAbsent(r.linkType(), k -> new ArrayList<>())
                      .add(
                          List.of(
                              link(domain, r.key(), r.summary()),
                              r.issueType(),
                              r.assignee(),
                              r.priority(),
                              r.status())));
      for (Map.Entry<String, List<List<String>>> group : groups.entrySet()) {
        md.append("\n\n### ").append(capitalize(group.getKey())).append("\n\n");
        md.append(
            StringUtility.markdownTable(
                List.of("Issue", "Issue Type", "Assignee", "Priority", "Status"),
                group.getValue()));
      }
    }

    if (!issue.attachments().isEmpty()) {
      md.append("\n\n## Attachments");
      List<String> images = new ArrayList<>();
      List<String> files = new ArrayList<>();
      for (JiraIssue.Attachment a : issue.attachments()) {
        if (a.isImage()) {
          images.add("![" + a.label() + "](" + a.url() + ")");
        } else {
          files.add("- [" + a.label() + "](" + a.url() + ")");
        }
      }
      if (!images.isEmpty()) md.append("\n\n").append(String.join("\n\n", images));
      if (!files.isEmpty()) md.append("\n\n").append(String.join("\n", files));
    }

    md.append("\n\n## Comments");
    if (issue.comments().isEmpty()) {
      md.append("\n\nNo comments.");
    } else {
      for (JiraIssue.Comment c : issue.comments()) {
        md.append("\n\n### ").append(c.author()).append(" @ ").append(c.created());
        md.append("\n\n").append(markupToMarkdown(c.body()));
      }
    }
    return md.toString();
  }

  /** Converts the few Jira wiki constructs that matter ({@code {noformat}} blocks). */
  static String markupToMarkdown(String markup) {
    if (markup == null || markup.isBlank()) return "None";
    String text = StringUtility.normalizeNewlines(markup);
    text =
        NOFORMAT
            .matcher(text)
            .replaceAll(m -> Matcher.quoteReplacement("```\n" + m.group(1).strip() + "\n```"));
    return BLANK_RUNS.matcher(text).replaceAll("\n\n").strip();
  }

  private static String link(String domain, String key, String summary) {
    return "[" + key + ": " + summary + "](https://" + domain + "/browse/" + key + ")";
  }

  private static String capitalize(String value) {
    if (value.isEmpty()) return value;
    return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
  }
}
