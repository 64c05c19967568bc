package com.companyintel.research.robots;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public class RobotsRules {
  private final List<Rule> rules;
  private final List<String> sitemapUrls;
  private final boolean fetched;

  public RobotsRules(List<Rule> rules, List<String> sitemapUrls, boolean fetched) {
    this.rules = List.copyOf(rules);
    this.sitemapUrls = List.copyOf(sitemapUrls);
    this.fetched = fetched;
  }

  public static RobotsRules allowAll() {
    return new RobotsRules(List.of(), List.of(), false);
  }

  public static RobotsRules disallowAll() {
    return new RobotsRules(List.of(new Rule("/", false)), List.of(), false);
  }

  public List<String> getSitemapUrls() {
    return sitemapUrls;
  }

  public List<Rule> getRules() {
    return rules;
  }

  /** Whether these rules came from an actual robots.txt response. */
  public boolean isFetched() {
    return fetched;
  }

  /**
   * Literal paths named by Allow/Disallow directives, in file order. Wildcard patterns and the
   * site root are skipped since they do not name a concrete page.
   */
  public List<String> candidatePaths() {
    LinkedHashSet<String> paths = new LinkedHashSet<>();
    for (Rule rule : rules) {
      String path = rule.path().trim();
      if (path.contains("*") || path.equals("/")) {
        continue;
      }
      if (path.endsWith("$")) {
        path = path.substring(0, path.length() - 1);
      }
      if (!path.startsWith("/")) {
        path = "/" + path;
      }
      if (path.length() > 1) {
        paths.add(path);
      }
    }
    return List.copyOf(paths);
  }

  /** Longest matching rule wins; on a tie Allow beats Disallow. No match means allowed. */
  public boolean isAllowed(String pathAndQuery) {
    String subject = pathAndQuery == null || pathAndQuery.isBlank() ? "/" : pathAndQuery;
    Rule winner = null;
    for (Rule rule : rules) {
      if (!rule.matches(subject)) {
        continue;
      }
      if (winner == null
          || rule.path().length() > winner.path().length()
          || (rule.path().length() == winner.path().length() && rule.allow() && !winner.allow())) {
        winner = rule;
      }
    }
    return winner == null || winner.allow();
  }

  public static RobotsRules parse(String robotsText) {
    return parse(robotsText, null);
  }

  /**
   * Parses a robots.txt body. Groups naming {@code agentToken} take precedence over the {@code *}
   * groups; when no group names it, the {@code *} groups apply.
   */
  public static RobotsRules parse(String robotsText, String agentToken) {
    if (robotsText == null || robotsText.isBlank()) {
      return new RobotsRules(List.of(), List.of(), true);
    }
    String token = agentToken == null ? null : agentToken.trim().toLowerCase(Locale.ROOT);

    List<String> sitemaps = new ArrayList<>();
    List<Group> groups = new ArrayList<>();
    Group current = null;
    for (String rawLine : robotsText.split("\\R")) {
      int hash = rawLine.indexOf('#');
      String line = (hash >= 0 ? rawLine.substring(0, hash) : rawLine).trim();
      int colon = line.indexOf(':');
      if (colon <= 0) {
        continue;
      }
      String field = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
      String value = line.substring(colon + 1).trim();
      switch (field) {
        case "user-agent" -> {
          if (current == null || !current.rules.isEmpty()) {
            current = new Group();
            groups.add(current);
          }
          current.agents.add(value.toLowerCase(Locale.ROOT));
        }
        case "allow", "disallow" -> {
          if (current != null && !value.isEmpty()) {
            current.rules.add(new Rule(value, field.equals("allow")));
          }
        }
        case "sitemap" -> {
          if (!value.isEmpty()) {
            sitemaps.add(value);
          }
        }
        default -> {
          // crawl-delay, host and unknown fields carry no access rules
        }
      }
    }

    List<Rule> named = new ArrayList<>();
    List<Rule> wildcard = new ArrayList<>();
    for (Group group : groups) {
      if (token != null && !token.isEmpty() && group.names(token)) {
        named.addAll(group.rules);
      } else if (group.agents.contains("*")) {
        wildcard.addAll(group.rules);
      }
    }
    boolean tokenHasGroup = token != null && !token.isEmpty() && groups.stream().anyMatch(g -> g.names(token));
    return new RobotsRules(tokenHasGroup ? named : wildcard, sitemaps, true);
  }

  private static final class Group {
    private final List<String> agents = new ArrayList<>();
    private final List<Rule> rules = new ArrayList<>();

    private boolean names(String token) {
      return agents.stream().anyMatch(agent -> !agent.equals("*") && token.startsWith(agent));
    }
  }

  public record Rule(String path, boolean allow) {
    public boolean matches(String testPath) {
      String pattern = path.startsWith("/") ? path : "/" + path;
      if (pattern.indexOf('*') < 0 && pattern.indexOf('$') < 0) {
        return testPath.startsWith(pattern);
      }
      StringBuilder regex = new StringBuilder("^");
      StringBuilder literal = new StringBuilder();
      for (char c : pattern.toCharArray()) {
        if (c == '*' || c == '$') {
          if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
            literal.setLength(0);
          }
          regex.append(c == '*' ? ".*" : "$");
        } else {
          literal.append(c);
        }
      }
      if (literal.length() > 0) {
        regex.append(Pattern.quote(literal.toString()));
      }
      return Pattern.compile(regex.toString()).matcher(testPath).find();
    }
  }
}
