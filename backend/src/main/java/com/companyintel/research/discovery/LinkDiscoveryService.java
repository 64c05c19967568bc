package com.companyintel.research.discovery;

import com.companyintel.config.ResearchProperties;
import com.companyintel.research.CancellationToken;
import com.companyintel.research.model.DiscoveredLink;
import com.companyintel.research.model.DiscoveryResult;
import com.companyintel.research.model.DiscoverySource;
import com.companyintel.research.model.PipelineConfig;
import com.companyintel.research.model.SitemapDiscoveryResult;
import com.companyintel.research.model.SitemapUrlEntry;
import com.companyintel.research.progress.ProgressSink;
import com.companyintel.research.progress.ProgressStatus;
import com.companyintel.research.robots.RobotsRules;
import com.companyintel.research.robots.RobotsTxtService;
import com.companyintel.research.sitemap.SitemapService;
import com.companyintel.research.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
public class LinkDiscoveryService {
    private static final Logger log = LoggerFactory.getLogger(LinkDiscoveryService.class);
    private static final int SITEMAP_INDEX_DEPTH = 1;
    private static final Pattern LOCALE_SEGMENT = Pattern.compile("/([a-z]{2})([-_][a-z]{2})?(?=/|$)");

    private final ResearchProperties properties;
    private final RobotsTxtService robotsTxtService;
    private final SitemapService sitemapService;
    private final SiteLinkCrawler siteLinkCrawler;

    public LinkDiscoveryService(
        ResearchProperties properties,
        RobotsTxtService robotsTxtService,
        SitemapService sitemapService,
        SiteLinkCrawler siteLinkCrawler
    ) {
        this.properties = properties;
        this.robotsTxtService = robotsTxtService;
        this.sitemapService = sitemapService;
        this.siteLinkCrawler = siteLinkCrawler;
    }

    public DiscoveryResult discover(String baseUrl, PipelineConfig config, ProgressSink sink, CancellationToken token) {
        String root = UrlNormalizer.toAbsolute(null, UrlNormalizer.ensureScheme(baseUrl));
        DiscoveredLinkSet links = new DiscoveredLinkSet(config.maxLinks());
        List<String> failedSources = new ArrayList<>();
        if (root == null) {
            log.warn("discovery skipped, invalid base url={}", baseUrl);
            failedSources.add("invalid_base_url");
            return new DiscoveryResult(List.of(), links.countsBySource(), failedSources);
        }

        RobotsRules robotsRules = RobotsRules.allowAll();
        try {
            robotsRules = robotsTxtService.loadRules(root);
            int added = addRobotsLinks(root, robotsRules, links);
            sink.emit(ProgressSink.DISCOVERY, ProgressStatus.PROGRESS, "robots links=" + added);
        } catch (RuntimeException e) {
            sourceFailed(DiscoverySource.ROBOTS, root, e, failedSources, sink);
        }

        if (!links.isFull() && !isCancelled(token)) {
            try {
                List<String> seeds = selectSitemapSeeds(root, robotsRules.getSitemapUrls());
                SitemapDiscoveryResult sitemaps = sitemapService.discover(
                    seeds,
                    robotsRules,
                    SITEMAP_INDEX_DEPTH,
                    properties.getDiscovery().getMaxSitemaps(),
                    links.remaining()
                );
                int added = 0;
                for (SitemapUrlEntry entry : sitemaps.discoveredUrls()) {
                    if (UrlNormalizer.isSameSite(root, entry.url())
                        && links.add(entry.url(), DiscoverySource.SITEMAP, entry.depth())) {
                        added++;
                    }
                }
                if (!sitemaps.errors().isEmpty()) {
                    log.debug("sitemap errors base={} errors={}", root, sitemaps.errors());
                }
                sink.emit(
                    ProgressSink.DISCOVERY,
                    ProgressStatus.PROGRESS,
                    "sitemap links=" + added + " sitemaps=" + sitemaps.fetchedSitemaps().size()
                );
            } catch (RuntimeException e) {
                sourceFailed(DiscoverySource.SITEMAP, root, e, failedSources, sink);
            }
        }

        if (!links.isFull() && !isCancelled(token)) {
            int before = links.size();
            try {
                int pages = siteLinkCrawler.crawl(
                    root,
                    config.maxCrawlDepth(),
                    properties.getDiscovery().getMaxCrawlPages(),
                    robotsRules,
                    links,
                    token
                );
                sink.emit(
                    ProgressSink.DISCOVERY,
                    ProgressStatus.PROGRESS,
                    "crawl links=" + (links.size() - before) + " pagesFetched=" + pages
                );
            } catch (RuntimeException e) {
                sourceFailed(DiscoverySource.CRAWL, root, e, failedSources, sink);
            }
        }

        List<DiscoveredLink> result = links.toList();
        log.info(
            "discovery complete base={} links={} bySource={} failedSources={}",
            root,
            result.size(),
            links.countsBySource(),
            failedSources
        );
        return new DiscoveryResult(result, links.countsBySource(), failedSources);
    }

    private int addRobotsLinks(String root, RobotsRules rules, DiscoveredLinkSet links) {
        int added = 0;
        for (String path : rules.candidatePaths()) {
            String url = UrlNormalizer.toAbsolute(root, path);
            if (url != null && UrlNormalizer.isLikelyPage(url) && links.add(url, DiscoverySource.ROBOTS, 0)) {
                added++;
            }
        }
        return added;
    }

    // locale sitemaps other than en-us are skipped; falls back to the first declared one, then /sitemap.xml
    List<String> selectSitemapSeeds(String root, List<String> declared) {
        String conventional = UrlNormalizer.toAbsolute(root, "/sitemap.xml");
        if (declared == null || declared.isEmpty()) {
            return conventional == null ? List.of() : List.of(conventional);
        }
        int limit = properties.getDiscovery().getMaxRobotsSitemaps();
        List<String> main = new ArrayList<>();
        for (String sitemap : declared) {
            if (main.size() >= limit) {
                break;
            }
            if (!isInternational(sitemap)) {
                main.add(sitemap);
            }
        }
        if (main.isEmpty()) {
            log.debug("all declared sitemaps are localized base={} using first={}", root, declared.get(0));
            main.add(declared.get(0));
        }
        return main;
    }

    static boolean isInternational(String sitemapUrl) {
        String path = UrlNormalizer.pathOf(sitemapUrl).toLowerCase(Locale.ROOT);
        Matcher matcher = LOCALE_SEGMENT.matcher(path);
        while (matcher.find()) {
            String language = matcher.group(1);
            String region = matcher.group(2) == null ? "" : matcher.group(2).substring(1);
            boolean usEnglish = language.equals("us")
                || (language.equals("en") && (region.isEmpty() || region.equals("us")));
            if (!usEnglish) {
                return true;
            }
        }
        return false;
    }

    private void sourceFailed(
        DiscoverySource source,
        String root,
        RuntimeException e,
        List<String> failedSources,
        ProgressSink sink
    ) {
        String name = source.name().toLowerCase(Locale.ROOT);
        failedSources.add(name);
        log.warn("discovery source failed source={} base={} error={}", name, root, e.toString());
        sink.emit(ProgressSink.DISCOVERY, ProgressStatus.PROGRESS, "source_failed=" + name + " error=" + e.getMessage());
    }

    private boolean isCancelled(CancellationToken token) {
        return token != null && token.isCancelled();
    }
}
