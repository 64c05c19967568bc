package com.companyintel.research.robots;

import com.companyintel.config.ResearchProperties;
import com.companyintel.research.http.PoliteHttpClient;
import com.companyintel.research.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;

@Service
public class RobotsTxtService {
    private static final Logger log = LoggerFactory.getLogger(RobotsTxtService.class);
    private static final int MAX_ROBOTS_BYTES = 512_000;

    private final ResearchProperties properties;
    private final PoliteHttpClient httpClient;

    public RobotsTxtService(ResearchProperties properties, PoliteHttpClient httpClient) {
        this.properties = properties;
        this.httpClient = httpClient;
    }

    public RobotsRules loadRules(String baseUrl) {
        String origin = originOf(baseUrl);
        if (origin == null) {
            return RobotsRules.allowAll();
        }
        String robotsUrl = origin + "/robots.txt";
        HttpFetchResult fetch = httpClient.get(robotsUrl, "text/plain,text/*;q=0.9,*/*;q=0.1", MAX_ROBOTS_BYTES);
        if (fetch.statusCode() == 404 || fetch.statusCode() == 410) {
            log.debug("no robots.txt origin={} status={}", origin, fetch.statusCode());
            return RobotsRules.allowAll();
        }
        if (!fetch.isSuccessful()) {
            boolean failOpen = properties.getDiscovery().isRobotsFailOpen();
            log.warn(
                "robots fetch failed origin={} status={} errorCode={} errorMessage={} decision={}",
                origin,
                fetch.statusCode(),
                fetch.errorCode(),
                fetch.errorMessage(),
                failOpen ? "allow_all" : "disallow_all"
            );
            return failOpen ? RobotsRules.allowAll() : RobotsRules.disallowAll();
        }
        RobotsRules rules = RobotsRules.parse(fetch.body(), productToken(properties.getUserAgent()));
        log.debug(
            "loaded robots origin={} rules={} sitemapHints={}",
            origin,
            rules.getRules().size(),
            rules.getSitemapUrls().size()
        );
        return rules;
    }

    public static boolean isAllowed(RobotsRules rules, String url) {
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return true;
        }
        String path = uri.getRawPath() == null || uri.getRawPath().isBlank() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null && !uri.getRawQuery().isBlank()) {
            path = path + "?" + uri.getRawQuery();
        }
        return rules.isAllowed(path);
    }

    static String productToken(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return null;
        }
        String token = userAgent.trim().split("[/\\s]", 2)[0];
        return token.isEmpty() ? null : token;
    }

    static String originOf(String url) {
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        String scheme = uri.getScheme() == null ? "https" : uri.getScheme();
        String port = uri.getPort() > 0 ? ":" + uri.getPort() : "";
        return scheme + "://" + uri.getHost() + port;
    }

    private static URI toUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
