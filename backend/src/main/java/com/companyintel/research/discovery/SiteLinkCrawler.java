package com.companyintel.research.discovery;

import com.companyintel.research.CancellationToken;
import com.companyintel.research.http.PoliteHttpClient;
import com.companyintel.research.model.DiscoverySource;
import com.companyintel.research.model.HttpFetchResult;
import com.companyintel.research.robots.RobotsRules;
import com.companyintel.research.robots.RobotsTxtService;
import com.companyintel.research.util.ReasonCodeClassifier;
import com.companyintel.research.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Set;

@Component
public class SiteLinkCrawler {
    private static final Logger log = LoggerFactory.getLogger(SiteLinkCrawler.class);
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.1";
    private static final int MAX_PAGE_BYTES = 2_000_000;

    private final PoliteHttpClient httpClient;

    public SiteLinkCrawler(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public int crawl(
        String baseUrl,
        int maxDepth,
        int maxPages,
        RobotsRules robotsRules,
        DiscoveredLinkSet links,
        CancellationToken token
    ) {
        String root = UrlNormalizer.toAbsolute(null, baseUrl);
        if (root == null) {
            log.warn("crawl skipped, invalid base url={}", baseUrl);
            return 0;
        }
        links.add(root, DiscoverySource.CRAWL, 0);

        ArrayDeque<CrawlTask> queue = new ArrayDeque<>();
        Set<String> enqueued = new HashSet<>();
        queue.addLast(new CrawlTask(root, 0));
        enqueued.add(UrlNormalizer.dedupKey(root));
        int fetchedPages = 0;

        while (!queue.isEmpty() && fetchedPages < maxPages && !links.isFull()) {
            if (token != null && token.isCancelled()) {
                log.debug("crawl stopped by cancellation base={}", baseUrl);
                break;
            }
            CrawlTask task = queue.removeFirst();
            if (robotsRules != null && !RobotsTxtService.isAllowed(robotsRules, task.url())) {
                log.debug("crawl blocked by robots url={}", task.url());
                continue;
            }

            HttpFetchResult fetch = httpClient.get(task.url(), HTML_ACCEPT, MAX_PAGE_BYTES);
            fetchedPages++;
            if (!fetch.isSuccessful() || fetch.body() == null || !fetch.isHtmlLike()) {
                String reason = ReasonCodeClassifier.fromFetch(fetch);
                if (task.depth() == 0) {
                    log.warn(
                        "crawl root fetch failed url={} status={} reason={} retryable={}",
                        task.url(),
                        fetch.statusCode(),
                        reason,
                        ReasonCodeClassifier.isRetryable(reason)
                    );
                } else {
                    log.debug("crawl fetch failed url={} status={} reason={}", task.url(), fetch.statusCode(), reason);
                }
                continue;
            }

            String pageUrl = fetch.finalUrlOrRequested();
            Document document = Jsoup.parse(fetch.body(), pageUrl);
            int childDepth = task.depth() + 1;
            for (Element anchor : document.select("a[href]")) {
                String href = UrlNormalizer.toAbsolute(pageUrl, anchor.attr("href"));
                if (href == null || !UrlNormalizer.isSameSite(root, href) || !UrlNormalizer.isLikelyPage(href)) {
                    continue;
                }
                links.add(href, DiscoverySource.CRAWL, childDepth);
                if (childDepth < maxDepth && enqueued.add(UrlNormalizer.dedupKey(href))) {
                    queue.addLast(new CrawlTask(href, childDepth));
                }
                if (links.isFull()) {
                    break;
                }
            }
        }
        return fetchedPages;
    }

    private record CrawlTask(String url, int depth) {
    }
}
