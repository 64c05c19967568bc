package com.companyintel.research.discovery;

import com.companyintel.research.model.DiscoveredLink;
import com.companyintel.research.model.DiscoverySource;
import com.companyintel.research.util.UrlNormalizer;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class DiscoveredLinkSet {
    private final int maxLinks;
    private final Map<String, DiscoveredLink> linksByKey = new LinkedHashMap<>();
    private final Map<DiscoverySource, Integer> countsBySource = new EnumMap<>(DiscoverySource.class);

    public DiscoveredLinkSet(int maxLinks) {
        this.maxLinks = Math.max(1, maxLinks);
    }

    public boolean add(String url, DiscoverySource source, int depth) {
        if (isFull()) {
            return false;
        }
        String key = UrlNormalizer.dedupKey(url);
        if (key == null || linksByKey.containsKey(key)) {
            return false;
        }
        linksByKey.put(key, new DiscoveredLink(url, source, depth));
        countsBySource.merge(source, 1, Integer::sum);
        return true;
    }

    public boolean contains(String url) {
        String key = UrlNormalizer.dedupKey(url);
        return key != null && linksByKey.containsKey(key);
    }

    public boolean isFull() {
        return linksByKey.size() >= maxLinks;
    }

    public int size() {
        return linksByKey.size();
    }

    public int remaining() {
        return Math.max(0, maxLinks - linksByKey.size());
    }

    public Map<DiscoverySource, Integer> countsBySource() {
        return Map.copyOf(countsBySource);
    }

    public List<DiscoveredLink> toList() {
        return List.copyOf(new ArrayList<>(linksByKey.values()));
    }
}
