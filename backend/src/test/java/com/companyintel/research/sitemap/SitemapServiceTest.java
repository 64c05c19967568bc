package com.companyintel.research.sitemap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.companyintel.research.http.PoliteHttpClient;
import com.companyintel.research.model.HttpFetchResult;
import com.companyintel.research.model.SitemapDiscoveryResult;
import com.companyintel.research.model.SitemapUrlEntry;
import com.companyintel.research.robots.RobotsRules;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.zip.GZIPOutputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SitemapServiceTest {
  private static final String URLSET =
      """
      <?xml version="1.0" encoding="UTF-8"?>
      <urlset xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
        <url><loc>https://example.com/about</loc><lastmod>2024-01-01</lastmod></url>
        <url><loc>https://example.com/team</loc></url>
      </urlset>
      """;

  @Mock private PoliteHttpClient httpClient;

  @Test
  void extractsUrlsFromGzippedSitemapWhenMagicBytesPresent() throws Exception {
    stub("https://example.com/sitemap.xml", fetch("https://example.com/sitemap.xml", gzip(URLSET), null));

    SitemapDiscoveryResult result =
        new SitemapService(httpClient)
            .discover(List.of("https://example.com/sitemap.xml"), RobotsRules.allowAll(), 1, 10, 10);

    assertThat(result.discoveredUrls())
        .extracting(SitemapUrlEntry::url)
        .containsExactly("https://example.com/about", "https://example.com/team");
    assertEquals("2024-01-01", result.discoveredUrls().get(0).lastmod());
  }

  @Test
  void followsSitemapIndexOneLevelOnly() {
    String index =
        """
        <sitemapindex xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
          <sitemap><loc>https://example.com/pages.xml</loc></sitemap>
        </sitemapindex>
        """;
    String nestedIndex =
        """
        <sitemapindex xmlns="http://www.sitemaps.org/schemas/sitemap/0.9">
          <sitemap><loc>https://example.com/too-deep.xml</loc></sitemap>
        </sitemapindex>
        """;
    stub("https://example.com/sitemap.xml", fetch("https://example.com/sitemap.xml", utf8(index), null));
    stub(
        "https://example.com/pages.xml",
        fetch("https://example.com/pages.xml", utf8(URLSET.replace("</urlset>", "") + nestedIndex + "</urlset>"), null));

    SitemapDiscoveryResult result =
        new SitemapService(httpClient)
            .discover(List.of("https://example.com/sitemap.xml"), RobotsRules.allowAll(), 1, 10, 10);

    assertThat(result.fetchedSitemaps())
        .containsExactly("https://example.com/sitemap.xml", "https://example.com/pages.xml");
    assertThat(result.discoveredUrls()).hasSize(2);
    assertThat(result.discoveredUrls()).allMatch(entry -> entry.depth() == 1);
    verify(httpClient, never()).get(eq("https://example.com/too-deep.xml"), anyString(), anyInt());
  }

  @Test
  void skipsSitemapsBlockedByRobots() {
    RobotsRules rules = RobotsRules.parse("User-agent: *\nDisallow: /sitemap.xml\n");

    SitemapDiscoveryResult result =
        new SitemapService(httpClient)
            .discover(List.of("https://example.com/sitemap.xml"), rules, 1, 10, 10);

    assertThat(result.discoveredUrls()).isEmpty();
    assertEquals(1, result.errors().get("blocked_by_robots"));
    verify(httpClient, never()).get(anyString(), anyString(), anyInt());
  }

  @Test
  void stopsAtUrlCap() {
    stub("https://example.com/sitemap.xml", fetch("https://example.com/sitemap.xml", utf8(URLSET), null));

    SitemapDiscoveryResult result =
        new SitemapService(httpClient)
            .discover(List.of("https://example.com/sitemap.xml"), RobotsRules.allowAll(), 1, 10, 1);

    assertThat(result.discoveredUrls())
        .extracting(SitemapUrlEntry::url)
        .containsExactly("https://example.com/about");
  }

  private void stub(String url, HttpFetchResult result) {
    when(httpClient.get(eq(url), eq(SitemapService.SITEMAP_ACCEPT), anyInt())).thenReturn(result);
  }

  private HttpFetchResult fetch(String url, byte[] bytes, String contentEncoding) {
    return new HttpFetchResult(
        url,
        URI.create(url),
        200,
        null,
        bytes,
        "application/xml",
        contentEncoding,
        Instant.now(),
        Duration.ofMillis(20),
        null,
        null);
  }

  private byte[] utf8(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  private byte[] gzip(String text) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
      gzip.write(text.getBytes(StandardCharsets.UTF_8));
    }
    return out.toByteArray();
  }
}
