package com.companyintel.research.sitemap;

import com.companyintel.research.http.PoliteHttpClient;
import com.companyintel.research.model.HttpFetchResult;
import com.companyintel.research.model.SitemapDiscoveryResult;
import com.companyintel.research.model.SitemapUrlEntry;
import com.companyintel.research.robots.RobotsRules;
import com.companyintel.research.robots.RobotsTxtService;
import com.companyintel.research.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.zip.GZIPInputStream;

@Service
public class SitemapService {
    private static final Logger log = LoggerFactory.getLogger(SitemapService.class);
    private static final int MAX_SITEMAP_BYTES = 2_000_000;
    static final String SITEMAP_ACCEPT = "application/xml,text/xml;q=0.9,*/*;q=0.1";

    private final PoliteHttpClient httpClient;

    public SitemapService(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * Breadth-first over the seeds. Index entries are queued while their depth stays within
     * {@code maxDepth}; page URLs keep first-seen order and each carries the depth of the sitemap
     * that listed it.
     */
    public SitemapDiscoveryResult discover(
        List<String> seedSitemaps,
        RobotsRules robotsRules,
        int maxDepth,
        int maxSitemaps,
        int maxUrls
    ) {
        Walk walk = new Walk(maxUrls);
        for (String seed : seedSitemaps) {
            walk.enqueue(seed, 0);
        }

        while (walk.hasPending() && walk.visited.size() < maxSitemaps && !walk.isFull()) {
            SitemapTask task = walk.pending.removeFirst();
            if (task.depth() > maxDepth || !walk.visited.add(task.url())) {
                continue;
            }
            if (robotsRules != null && !RobotsTxtService.isAllowed(robotsRules, task.url())) {
                log.debug("sitemap blocked by robots url={}", task.url());
                walk.fail("blocked_by_robots");
                continue;
            }

            Document xml = load(task.url(), walk);
            if (xml == null) {
                continue;
            }
            if (task.depth() < maxDepth) {
                for (Element loc : xml.select("sitemap > loc")) {
                    walk.enqueue(loc.text(), task.depth() + 1);
                }
            }
            int added = 0;
            for (Element entry : xml.select("url")) {
                if (walk.isFull()) {
                    break;
                }
                if (walk.accept(entry, task.depth())) {
                    added++;
                }
            }
            walk.fetched.add(task.url());
            log.debug("sitemap read url={} depth={} pageUrls={}", task.url(), task.depth(), added);
        }

        return new SitemapDiscoveryResult(List.copyOf(walk.fetched), List.copyOf(walk.urls.values()), walk.errors);
    }

    private Document load(String sitemapUrl, Walk walk) {
        HttpFetchResult fetch = httpClient.get(sitemapUrl, SITEMAP_ACCEPT, MAX_SITEMAP_BYTES);
        if (!fetch.isSuccessful()) {
            walk.fail(failureKey(fetch));
            return null;
        }
        String payload;
        try {
            payload = decode(sitemapUrl, fetch);
        } catch (IOException e) {
            log.debug("sitemap gzip decode failed url={} error={}", sitemapUrl, e.getMessage());
            walk.fail("gzip_decode_error");
            return null;
        }
        if (payload == null || payload.isBlank()) {
            walk.fail("empty_sitemap_payload");
            return null;
        }
        return Jsoup.parse(payload, "", Parser.xmlParser());
    }

    private static String failureKey(HttpFetchResult fetch) {
        if (fetch.errorCode() != null) {
            return fetch.errorCode();
        }
        return fetch.statusCode() > 0 ? "http_" + fetch.statusCode() : "unknown_error";
    }

    static String decode(String sitemapUrl, HttpFetchResult fetch) throws IOException {
        byte[] raw = fetch.bodyBytes();
        if (raw == null) {
            return fetch.body();
        }
        if (!isGzipped(sitemapUrl, fetch.contentEncoding(), raw)) {
            return new String(raw, StandardCharsets.UTF_8);
        }
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(raw))) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    static boolean isGzipped(String sitemapUrl, String contentEncoding, byte[] raw) {
        if (raw.length >= 2 && (raw[0] & 0xFF) == 0x1f && (raw[1] & 0xFF) == 0x8b) {
            return true;
        }
        if (raw.length > 0 && raw[0] == '<') {
            return false;
        }
        // servers often inflate transparently but keep the .gz name
        String name = sitemapUrl == null ? "" : sitemapUrl.toLowerCase(Locale.ROOT);
        String encoding = contentEncoding == null ? "" : contentEncoding.toLowerCase(Locale.ROOT);
        return name.endsWith(".gz") || encoding.contains("gzip");
    }

    private static final class Walk {
        private final int maxUrls;
        private final ArrayDeque<SitemapTask> pending = new ArrayDeque<>();
        private final Set<String> queued = new HashSet<>();
        private final Set<String> visited = new HashSet<>();
        private final List<String> fetched = new ArrayList<>();
        private final Map<String, SitemapUrlEntry> urls = new LinkedHashMap<>();
        private final Map<String, Integer> errors = new LinkedHashMap<>();

        private Walk(int maxUrls) {
            this.maxUrls = maxUrls;
        }

        private void enqueue(String location, int depth) {
            String url = UrlNormalizer.ensureScheme(location);
            if (url == null || UrlNormalizer.toAbsolute(null, url) == null) {
                return;
            }
            if (queued.add(url)) {
                pending.addLast(new SitemapTask(url, depth));
            }
        }

        private boolean accept(Element entry, int depth) {
            Element loc = entry.selectFirst("loc");
            String url = loc == null ? null : UrlNormalizer.ensureScheme(loc.text());
            if (url == null || UrlNormalizer.toAbsolute(null, url) == null || urls.containsKey(url)) {
                return false;
            }
            Element lastmod = entry.selectFirst("lastmod");
            urls.put(url, new SitemapUrlEntry(url, lastmod == null ? null : lastmod.text().trim(), depth));
            return true;
        }

        private boolean hasPending() {
            return !pending.isEmpty();
        }

        private boolean isFull() {
            return urls.size() >= maxUrls;
        }

        private void fail(String reason) {
            errors.merge(reason, 1, Integer::sum);
        }
    }

    private record SitemapTask(String url, int depth) {
    }
}
