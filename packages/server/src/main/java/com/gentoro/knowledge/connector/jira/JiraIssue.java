package com.gentoro.knowledge.connector.jira;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/** The parts of a Jira REST issue document that are rendered and linked. */
record JiraIssue(
    String key,
    String summary,
    String description,
    Parent parent,
    String issueType,
    String status,
    String priority,
    String assignee,
    String reporter,
    String created,
    String updated,
    List<RelatedIssue> relatedIssues,
    List<Attachment> attachments,
    List<Comment> comments) {

  record Parent(String key, String summary) {}

  record RelatedIssue(
      String key,
      String summary,
      String linkType,
      String issueType,
      String assignee,
      String priority,
      String status) {}

  record Attachment(String label, String mimeType, String url) {
    boolean isImage() {
      return mimeType.startsWith("image/");
    }
  }

  record Comment(String author, String created, String body) {}

  static JiraIssue parse(String key, JsonNode data) {
    JsonNode fields = data.path("fields");

    Parent parent = null;
    JsonNode p = fields.hasNonNull("epic") ? fields.get("epic") : fields.get("parent");
    if (p != null && !p.isNull()) {
      parent = new Parent(text(p, "", "key"), text(p, "", "fields", "summary"));
    }

    List<RelatedIssue> related = new ArrayList<>();
    for (JsonNode link : fields.path("issuelinks")) {
      JsonNode other;
      String linkType;
      if (link.has("outwardIssue")) {
        other = link.get("outwardIssue");
        linkType = text(link, "related to", "type", "outward");
      } else if (link.has("inwardIssue")) {
        other = link.get("inwardIssue");
        linkType = text(link, "related to", "type", "inward");
      } else {
        continue;
      }
      related.add(
          new RelatedIssue(
              text(other, "", "key"),
              text(other, "", "fields", "summary"),
              linkType,
              text(other, "", "fields", "issuetype", "name"),
              text(other, "Unassigned", "fields", "assignee", "displayName"),
              text(other, "Undefined", "fields", "priority", "name"),
              text(other, "", "fields", "status", "name")));
    }

    List<Attachment> attachments = new ArrayList<>();
    for (JsonNode a : fields.path("attachment")) {
      attachments.add(
          new Attachment(
              text(a, "", "filename"),
              text(a, "application/octet-stream", "mimeType"),
              text(a, "", "content")));
    }

    List<Comment> comments = new ArrayList<>();
    for (JsonNode c : fields.path("comment").path("comments")) {
      comments.add(
          new Comment(
              text(c, "Unknown", "author", "displayName"),
              text(c, "", "created"),
              text(c, "", "body")));
    }

    return new JiraIssue(
        text(data, key, "key"),
        text(fields, "", "summary"),
        text(fields, "", "description"),
        parent,
        text(fields, "Unknown", "issuetype", "name"),
        text(fields, "Unknown", "status", "name"),
        text(fields, "Undefined", "priority", "name"),
        text(fields, "Unassigned", "assignee", "displayName"),
        text(fields, "None", "reporter", "displayName"),
        text(fields, "", "created"),
        text(fields, "", "updated"),
        related,
        attachments,
        comments);
  }

  /** Text at {@code path}, or {@code fallback} when missing, null or empty. */
  static String text(JsonNode node, String fallback, String... path) {
    JsonNode cursor = node;
    for (String segment : path) {
      if (cursor == null || !cursor.isObject() || !cursor.has(segment)) return fallback;
      cursor = cursor.get(segment);
    }
    if (cursor == null || cursor.isNull()) return fallback;
    String value = cursor.isValueNode() ? cursor.asText() : cursor.toString();
    return value.isEmpty() ? fallback : value;
  }
}
