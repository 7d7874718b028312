package com.catalog.scraper.crawl.extract;

import com.catalog.scraper.config.ScraperProperties;
import com.catalog.scraper.crawl.model.ListingPage;
import com.catalog.scraper.crawl.model.ScrapedRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SelectorSiteExtractorTest {
    private static final String PAGE = "https://shop.example/catalog/index.html";
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void listingUsesConfiguredLinkAndNextSelectors() throws Exception {
        SelectorSiteExtractor extractor = new SelectorSiteExtractor(
            "div.item a.title", "a.more", Map.of("name", "h1"), List.of()
        );
        String html = """
            <div class="item"><a class="title" href="/p/1">One</a></div>
            <div class="item"><a class="title" href="p/2">Two</a></div>
            <a class="more" href="index.html?page=2">More</a>
            """;

        ListingPage page = extractor.parseListing(html, PAGE);

        assertThat(page.detailUrls()).containsExactly("https://shop.example/p/1", "https://shop.example/catalog/p/2");
        assertThat(page.nextPageUrl()).isEqualTo("https://shop.example/catalog/index.html?page=2");
    }

    @Test
    void detailReadsTextAndAttributesWithSeedCategoryFallback() throws Exception {
        ScraperProperties.Selectors selectors = new ScraperProperties.Selectors();
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("name", "h1.name");
        fields.put("price", "span.price");
        fields.put("image", "img.main@src");
        fields.put("sku", "div.product@data-sku");
        fields.put("category", "nav .crumb");
        selectors.setFields(fields);
        selectors.setRequiredFields(List.of("name", "price"));
        SelectorSiteExtractor extractor = new SelectorSiteExtractor(selectors);
        String html = """
            <div class="product" data-sku="SKU-7">
              <h1 class="name"> Lamp </h1>
              <span class="price">19.99</span>
              <img class="main" src="../img/lamp.png">
            </div>
            """;

        ScrapedRecord record = extractor.parseDetail(html, PAGE, "Lighting", NOW);

        assertThat(record.fields()).containsExactly(
            Map.entry("name", "Lamp"),
            Map.entry("price", "19.99"),
            Map.entry("image", "https://shop.example/img/lamp.png"),
            Map.entry("sku", "SKU-7"),
            Map.entry("category", "Lighting")
        );
    }

    @Test
    void missingRequiredFieldIsAParseFailure() {
        SelectorSiteExtractor extractor = new SelectorSiteExtractor(
            "a", "", Map.of("name", "h1"), List.of("name")
        );

        assertThatThrownBy(() -> extractor.parseDetail("<p>nothing</p>", PAGE, null, NOW))
            .isInstanceOf(ParseFailureException.class)
            .hasMessage("missing name");
    }

    @Test
    void requiredFieldWithoutSelectorIsRejectedUpFront() {
        assertThatThrownBy(() -> new SelectorSiteExtractor("a", "", Map.of("name", "h1"), List.of("price")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("price");
    }

    @Test
    void invalidSelectorIsAParseFailure() {
        SelectorSiteExtractor extractor = new SelectorSiteExtractor("a[", "", Map.of(), List.of());

        assertThatThrownBy(() -> extractor.parseListing("<a href=\"/x\">x</a>", PAGE))
            .isInstanceOf(ParseFailureException.class)
            .hasMessageContaining("invalid selector");
    }
}
