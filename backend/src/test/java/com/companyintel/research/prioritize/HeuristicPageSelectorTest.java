package com.companyintel.research.prioritize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.companyintel.research.model.DiscoveredLink;
import com.companyintel.research.model.DiscoverySource;
import com.companyintel.research.model.PrioritizedPage;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class HeuristicPageSelectorTest {
  private final HeuristicPageSelector selector = new HeuristicPageSelector();

  @Test
  void ranksInformativePathsByWeightThenDiscoveryOrder() {
    List<PrioritizedPage> pages =
        selector.select(
            links("/", "/blog/post-1", "/services", "/about-us", "/contact", "/products/widgets", "/team"),
            4);

    assertThat(pages)
        .extracting(PrioritizedPage::url)
        .containsExactly(
            "https://acme.example/contact",
            "https://acme.example/about-us",
            "https://acme.example/team",
            "https://acme.example/services");
    assertThat(pages).extracting(PrioritizedPage::rank).containsExactly(1, 2, 3, 4);
    assertEquals("heuristic: path mentions contact", pages.get(0).rationale());
  }

  @Test
  void takesDiscoveryOrderWhenNothingMatches() {
    List<PrioritizedPage> pages = selector.select(links("/", "/blog/a", "/blog/b"), 2);

    assertThat(pages)
        .extracting(PrioritizedPage::url)
        .containsExactly("https://acme.example/", "https://acme.example/blog/a");
  }

  @Test
  void weightsUseTheStrongestKeyword() {
    assertEquals(10, HeuristicPageSelector.weightOf("https://acme.example/about/contact"));
    assertEquals(0, HeuristicPageSelector.weightOf("https://acme.example/blog"));
  }

  private List<DiscoveredLink> links(String... paths) {
    return Arrays.stream(paths)
        .map(path -> new DiscoveredLink("https://acme.example" + path, DiscoverySource.CRAWL, 1))
        .toList();
  }
}
