package com.companyintel.research.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;

public final class UrlNormalizer {
  private static final Set<String> NON_PAGE_EXTENSIONS =
      Set.of(
          ".pdf", ".jpg", ".jpeg", ".png", ".gif", ".svg", ".webp", ".ico", ".css", ".js", ".zip",
          ".gz", ".mp4", ".mp3", ".mov", ".avi", ".doc", ".docx", ".xls", ".xlsx", ".ppt", ".pptx",
          ".xml", ".json", ".woff", ".woff2", ".ttf");

  private UrlNormalizer() {}

  /**
   * Dedup key: lowercase scheme and host, non-default port, path without trailing slash. Query
   * and fragment are dropped. Returns null when the input is not an absolute http(s) URL.
   */
  public static String dedupKey(String url) {
    URI uri = parse(url);
    if (uri == null) {
      return null;
    }
    String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
    StringBuilder key = new StringBuilder();
    key.append(scheme).append("://").append(uri.getHost().toLowerCase(Locale.ROOT));
    if (uri.getPort() != -1 && !isDefaultPort(scheme, uri.getPort())) {
      key.append(':').append(uri.getPort());
    }
    String path = uri.getRawPath() == null ? "" : uri.getRawPath();
    while (path.endsWith("/")) {
      path = path.substring(0, path.length() - 1);
    }
    key.append(path);
    return key.toString();
  }

  /**
   * Resolves {@code href} against {@code baseUrl} and drops the fragment. Returns null for
   * non-http targets such as mailto: or javascript: links.
   */
  public static String toAbsolute(String baseUrl, String href) {
    if (href == null || href.isBlank()) {
      return null;
    }
    String trimmed = href.trim();
    String lower = trimmed.toLowerCase(Locale.ROOT);
    if (lower.startsWith("mailto:")
        || lower.startsWith("tel:")
        || lower.startsWith("javascript:")
        || lower.startsWith("data:")
        || lower.startsWith("#")) {
      return null;
    }
    try {
      URI resolved = baseUrl == null ? new URI(trimmed) : withRootPath(new URI(baseUrl)).resolve(trimmed);
      String result = resolved.toString();
      int hash = result.indexOf('#');
      if (hash >= 0) {
        result = result.substring(0, hash);
      }
      URI parsed = parse(result);
      if (parsed == null) {
        return null;
      }
      if (parsed.getRawPath() == null || parsed.getRawPath().isEmpty()) {
        result = parsed.getScheme() + "://" + parsed.getRawAuthority() + "/"
            + (parsed.getRawQuery() == null ? "" : "?" + parsed.getRawQuery());
      }
      return result;
    } catch (URISyntaxException | IllegalArgumentException e) {
      return null;
    }
  }

  /** Same registrable host, ignoring a leading {@code www.}. */
  public static boolean isSameSite(String rootUrl, String candidateUrl) {
    String rootHost = hostWithoutWww(rootUrl);
    String candidateHost = hostWithoutWww(candidateUrl);
    return rootHost != null && rootHost.equals(candidateHost);
  }

  public static String hostWithoutWww(String url) {
    URI uri = parse(url);
    if (uri == null) {
      return null;
    }
    String host = uri.getHost().toLowerCase(Locale.ROOT);
    return host.startsWith("www.") ? host.substring(4) : host;
  }

  public static String pathOf(String url) {
    URI uri = parse(url);
    if (uri == null || uri.getRawPath() == null || uri.getRawPath().isEmpty()) {
      return "/";
    }
    return uri.getRawPath();
  }

  public static boolean isLikelyPage(String url) {
    String path = pathOf(url).toLowerCase(Locale.ROOT);
    for (String extension : NON_PAGE_EXTENSIONS) {
      if (path.endsWith(extension)) {
        return false;
      }
    }
    return true;
  }

  public static String ensureScheme(String url) {
    if (url == null || url.isBlank()) {
      return null;
    }
    String trimmed = url.trim();
    if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
      return trimmed;
    }
    return "https://" + trimmed;
  }

  private static URI parse(String url) {
    if (url == null || url.isBlank()) {
      return null;
    }
    try {
      URI uri = new URI(url.trim());
      String scheme = uri.getScheme();
      if (scheme == null || uri.getHost() == null) {
        return null;
      }
      String lower = scheme.toLowerCase(Locale.ROOT);
      return lower.equals("http") || lower.equals("https") ? uri : null;
    } catch (URISyntaxException e) {
      return null;
    }
  }

  private static URI withRootPath(URI base) throws URISyntaxException {
    if (base.getRawPath() != null && !base.getRawPath().isEmpty()) {
      return base;
    }
    return new URI(base.getScheme() + "://" + base.getRawAuthority() + "/");
  }

  private static boolean isDefaultPort(String scheme, int port) {
    return ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
  }
}
