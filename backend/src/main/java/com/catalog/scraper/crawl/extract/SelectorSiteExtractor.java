package com.catalog.scraper.crawl.extract;

import com.catalog.scraper.config.ScraperProperties;
import com.catalog.scraper.crawl.model.ListingPage;
import com.catalog.scraper.crawl.model.ScrapedRecord;
import com.catalog.scraper.crawl.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Extraction driven entirely by configured CSS selectors. A field selector may end in
 * {@code @attr} to read an attribute instead of the element text. The field named {@code category}
 * falls back to the seed's category when its selector matches nothing.
 */
public class SelectorSiteExtractor implements SiteExtractor {
    private final String listingLinkSelector;
    private final String nextLinkSelector;
    private final Map<String, String> fieldSelectors;
    private final Set<String> requiredFields;

    public SelectorSiteExtractor(ScraperProperties.Selectors selectors) {
        this(
            selectors.getListingLink(),
            selectors.getNextLink(),
            selectors.getFields(),
            selectors.getRequiredFields()
        );
    }

    public SelectorSiteExtractor(
        String listingLinkSelector,
        String nextLinkSelector,
        Map<String, String> fieldSelectors,
        List<String> requiredFields
    ) {
        if (listingLinkSelector == null || listingLinkSelector.isBlank()) {
            throw new IllegalArgumentException("listing link selector is required");
        }
        this.listingLinkSelector = listingLinkSelector;
        this.nextLinkSelector = nextLinkSelector == null ? "" : nextLinkSelector.trim();
        this.fieldSelectors = new LinkedHashMap<>(fieldSelectors);
        this.requiredFields = new LinkedHashSet<>(requiredFields);
        for (String required : this.requiredFields) {
            if (!this.fieldSelectors.containsKey(required)) {
                throw new IllegalArgumentException("no selector for required field " + required);
            }
        }
    }

    @Override
    public ListingPage parseListing(String body, String pageUrl) throws ParseFailureException {
        Document document = Jsoup.parse(body, pageUrl);
        List<String> detailUrls = new ArrayList<>();
        for (Element link : select(document, listingLinkSelector)) {
            String resolved = UrlUtils.resolve(pageUrl, link.attr("href"));
            if (resolved != null) {
                detailUrls.add(resolved);
            }
        }
        String nextUrl = null;
        if (!nextLinkSelector.isEmpty()) {
            List<Element> next = select(document, nextLinkSelector);
            if (!next.isEmpty()) {
                nextUrl = UrlUtils.resolve(pageUrl, next.get(0).attr("href"));
            }
        }
        return new ListingPage(detailUrls, nextUrl);
    }

    @Override
    public ScrapedRecord parseDetail(String body, String pageUrl, String category, Instant scrapedAt)
        throws ParseFailureException {
        Document document = Jsoup.parse(body, pageUrl);
        Map<String, Object> fields = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : fieldSelectors.entrySet()) {
            String value = read(document, entry.getValue());
            if (value == null && "category".equals(entry.getKey())) {
                value = category;
            }
            if (value == null && requiredFields.contains(entry.getKey())) {
                throw new ParseFailureException("missing " + entry.getKey());
            }
            fields.put(entry.getKey(), value);
        }
        return new ScrapedRecord(fields, pageUrl, scrapedAt);
    }

    private String read(Document document, String fieldSelector) throws ParseFailureException {
        String css = fieldSelector;
        String attribute = null;
        int at = fieldSelector.lastIndexOf('@');
        if (at > 0) {
            css = fieldSelector.substring(0, at).trim();
            attribute = fieldSelector.substring(at + 1).trim();
        }
        List<Element> matches = select(document, css);
        if (matches.isEmpty()) {
            return null;
        }
        Element element = matches.get(0);
        String value;
        if (attribute == null || attribute.isEmpty()) {
            value = element.text();
        } else if ("href".equals(attribute) || "src".equals(attribute)) {
            value = element.absUrl(attribute);
            if (value.isEmpty()) {
                value = element.attr(attribute);
            }
        } else {
            value = element.attr(attribute);
        }
        value = value == null ? null : value.trim();
        return value == null || value.isEmpty() ? null : value;
    }

    private List<Element> select(Document document, String css) throws ParseFailureException {
        try {
            return document.select(css);
        } catch (Selector.SelectorParseException e) {
            throw new ParseFailureException("invalid selector '" + css + "': " + e.getMessage());
        }
    }
}
