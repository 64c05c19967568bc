package com.companyintel.research.fetch;

import com.companyintel.research.http.PoliteHttpClient;
import com.companyintel.research.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
public class PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);
    static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.1";
    private static final int MAX_PAGE_BYTES = 3_000_000;

    private final PoliteHttpClient httpClient;
    private final ScriptRenderingClient renderingClient;

    public PageFetcher(PoliteHttpClient httpClient, ScriptRenderingClient renderingClient) {
        this.httpClient = httpClient;
        this.renderingClient = renderingClient;
    }

    public HttpFetchResult fetch(String url, Duration timeout) {
        if (renderingClient.isEnabled()) {
            HttpFetchResult rendered = renderingClient.render(url, timeout);
            if (rendered.isSuccessful()) {
                return rendered;
            }
            if ("interrupted".equals(rendered.errorCode()) || Thread.currentThread().isInterrupted()) {
                return rendered;
            }
            log.debug("render failed, plain fetch url={} errorMessage={}", url, rendered.errorMessage());
        }
        return httpClient.get(url, HTML_ACCEPT, MAX_PAGE_BYTES, timeout);
    }
}
