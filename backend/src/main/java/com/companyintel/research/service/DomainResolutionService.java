package com.companyintel.research.service;

import com.companyintel.research.DiscoveryExhaustedException;
import com.companyintel.research.http.PoliteHttpClient;
import com.companyintel.research.model.HttpFetchResult;
import com.companyintel.research.model.ResearchTarget;
import com.companyintel.research.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Service
public class DomainResolutionService {
    private static final Logger log = LoggerFactory.getLogger(DomainResolutionService.class);
    private static final String PROBE_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.1";
    private static final int PROBE_MAX_BYTES = 512_000;
    private static final List<String> GUESS_TLDS = List.of(".com", ".io", ".co");
    private static final Set<String> LEGAL_SUFFIXES = Set.of(
        "inc", "incorporated", "llc", "ltd", "limited", "corp", "corporation", "co", "company", "gmbh", "plc", "sa"
    );

    private final PoliteHttpClient httpClient;

    public DomainResolutionService(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public String resolve(ResearchTarget target) {
        List<String> candidates = target.hasPrimaryUrl()
            ? hostVariants(UrlNormalizer.ensureScheme(target.primaryUrl()))
            : guessedUrls(target.companyName());
        for (String candidate : candidates) {
            HttpFetchResult probe = httpClient.get(candidate, PROBE_ACCEPT, PROBE_MAX_BYTES);
            if (probe.isSuccessful()) {
                String resolved = rootOf(probe.finalUrlOrRequested());
                log.info("resolved website company={} url={}", target.companyName(), resolved);
                return resolved;
            }
            log.debug(
                "website probe failed company={} url={} status={} error={}",
                target.companyName(),
                candidate,
                probe.statusCode(),
                probe.errorCode()
            );
        }
        if (target.hasPrimaryUrl()) {
            String supplied = UrlNormalizer.toAbsolute(null, UrlNormalizer.ensureScheme(target.primaryUrl()));
            if (supplied == null) {
                throw new IllegalArgumentException("Invalid website url: " + target.primaryUrl());
            }
            log.warn("website did not answer probes, continuing with supplied url company={} url={}", target.companyName(), supplied);
            return supplied;
        }
        throw new DiscoveryExhaustedException("No reachable website found for " + target.companyName() + " (tried " + candidates + ")");
    }

    List<String> hostVariants(String url) {
        String normalized = UrlNormalizer.toAbsolute(null, url);
        if (normalized == null) {
            return List.of();
        }
        LinkedHashSet<String> variants = new LinkedHashSet<>();
        variants.add(normalized);
        try {
            URI uri = new URI(normalized);
            String host = uri.getHost();
            String alternate = host.startsWith("www.") ? host.substring(4) : "www." + host;
            variants.add(new URI(uri.getScheme(), null, alternate, uri.getPort(), uri.getPath(), null, null).toString());
        } catch (URISyntaxException e) {
            log.debug("no host variant for url={} error={}", normalized, e.getMessage());
        }
        return new ArrayList<>(variants);
    }

    List<String> guessedUrls(String companyName) {
        List<String> slugs = slugs(companyName);
        List<String> urls = new ArrayList<>();
        for (String slug : slugs) {
            for (String tld : GUESS_TLDS) {
                urls.add("https://" + slug + tld + "/");
            }
        }
        return urls;
    }

    static List<String> slugs(String companyName) {
        String lower = companyName.toLowerCase(Locale.ROOT).replace("&", " and ");
        List<String> words = new ArrayList<>();
        for (String word : lower.split("[^a-z0-9]+")) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        while (words.size() > 1 && LEGAL_SUFFIXES.contains(words.get(words.size() - 1))) {
            words.remove(words.size() - 1);
        }
        LinkedHashSet<String> slugs = new LinkedHashSet<>();
        if (!words.isEmpty()) {
            slugs.add(String.join("", words));
            if (words.size() > 1) {
                slugs.add(String.join("-", words));
            }
        }
        return new ArrayList<>(slugs);
    }

    private String rootOf(String url) {
        String root = UrlNormalizer.toAbsolute(url, "/");
        return root == null ? url : root;
    }
}
