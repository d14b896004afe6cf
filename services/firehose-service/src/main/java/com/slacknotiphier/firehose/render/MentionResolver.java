package com.slacknotiphier.firehose.render;

import com.slacknotiphier.firehose.config.NotifierProperties;
import com.slacknotiphier.firehose.domain.UserDirectory;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Rewrites {@code @username} mentions in tracker comments into chat mentions. */
@Component
public class MentionResolver {

  private static final Pattern MENTION = Pattern.compile("@([\\w-]+)");

  private final UserDirectory users;
  private final MentionMode mode;

  @Autowired
  public MentionResolver(UserDirectory users, NotifierProperties properties) {
    this(users, properties.mentions().mode());
  }

  public MentionResolver(UserDirectory users, MentionMode mode) {
    this.users = users;
    this.mode = mode == null ? MentionMode.EXACT : mode;
  }

  public String resolve(String text) {
    if (text == null || text.isEmpty()) {
      return text == null ? "" : text;
    }
    return mode == MentionMode.SUBSTRING ? replaceSubstrings(text) : replaceSpans(text);
  }

  private String replaceSpans(String text) {
    Map<String, Optional<String>> resolved = new LinkedHashMap<>();
    Matcher m = MENTION.matcher(text);
    StringBuilder out = new StringBuilder(text.length());
    while (m.find()) {
      String username = m.group(1);
      Optional<String> mention = resolved.computeIfAbsent(username, users::findMention);
      m.appendReplacement(out, Matcher.quoteReplacement(mention.orElse(m.group())));
    }
    m.appendTail(out);
    return out.toString();
  }

  private String replaceSubstrings(String text) {
    Map<String, String> replacements = new LinkedHashMap<>();
    Matcher m = MENTION.matcher(text);
    while (m.find()) {
      String username = m.group(1);
      if (!replacements.containsKey(username)) {
        users.findMention(username).ifPresent(mention -> replacements.put(username, mention));
      }
    }
    String out = text;
    for (Map.Entry<String, String> e : replacements.entrySet()) {
      out = out.replace("@" + e.getKey(), e.getValue()).replace(e.getKey(), e.getValue());
    }
    return out;
  }
}
