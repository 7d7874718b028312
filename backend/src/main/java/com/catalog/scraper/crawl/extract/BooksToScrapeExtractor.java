package com.catalog.scraper.crawl.extract;

import com.catalog.scraper.crawl.model.ListingPage;
import com.catalog.scraper.crawl.model.ScrapedRecord;
import com.catalog.scraper.crawl.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Markup of the books.toscrape.com catalogue: listing pages of {@code article.product_pod} cards with
 * an {@code li.next} pager, and one product per detail page.
 */
public class BooksToScrapeExtractor implements SiteExtractor {

    @Override
    public ListingPage parseListing(String body, String pageUrl) {
        Document document = Jsoup.parse(body, pageUrl);
        List<String> detailUrls = new ArrayList<>();
        for (Element link : document.select("article.product_pod h3 a[href]")) {
            String resolved = UrlUtils.resolve(pageUrl, link.attr("href"));
            if (resolved != null) {
                detailUrls.add(resolved);
            }
        }
        Element next = document.selectFirst("li.next a[href]");
        String nextUrl = next == null ? null : UrlUtils.resolve(pageUrl, next.attr("href"));
        return new ListingPage(detailUrls, nextUrl);
    }

    @Override
    public ScrapedRecord parseDetail(String body, String pageUrl, String category, Instant scrapedAt)
        throws ParseFailureException {
        Document document = Jsoup.parse(body, pageUrl);
        String title = text(document.selectFirst("div.product_main h1"));
        if (title == null) {
            throw new ParseFailureException("missing title");
        }
        String price = text(document.selectFirst("div.product_main p.price_color"));
        if (price == null) {
            price = text(document.selectFirst("p.price_color"));
        }
        if (price == null) {
            throw new ParseFailureException("missing price");
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("title", title);
        fields.put("category", firstNonNull(
            text(document.selectFirst("ul.breadcrumb li:nth-child(3) a")),
            category,
            "No category"
        ));
        fields.put("price", price);
        fields.put("rating", rating(document.selectFirst("p.star-rating")));
        fields.put("stock", firstNonNull(text(document.selectFirst("p.instock.availability")), "No stock info"));
        fields.put("image_url", imageUrl(document, pageUrl));
        fields.put("description", firstNonNull(
            text(document.selectFirst("#product_description ~ p")),
            "No description available"
        ));
        fields.put("product_information", productInformation(document));
        return new ScrapedRecord(fields, pageUrl, scrapedAt);
    }

    private String rating(Element element) {
        if (element == null) {
            return "No rating";
        }
        String value = element.className().replace("star-rating", "").trim();
        return value.isEmpty() ? "No rating" : value;
    }

    private String imageUrl(Document document, String pageUrl) {
        Element image = document.selectFirst("div.item.active img[src]");
        if (image == null) {
            return "No image";
        }
        String resolved = UrlUtils.resolve(pageUrl, image.attr("src"));
        return resolved == null ? image.attr("src") : resolved;
    }

    private Map<String, String> productInformation(Document document) {
        Map<String, String> info = new LinkedHashMap<>();
        for (Element row : document.select("table.table.table-striped tr")) {
            String key = firstNonNull(text(row.selectFirst("th")), "Unknown");
            String value = firstNonNull(text(row.selectFirst("td")), "Unknown");
            info.put(key, value);
        }
        return info;
    }

    private static String text(Element element) {
        if (element == null) {
            return null;
        }
        String value = element.text().trim();
        return value.isEmpty() ? null : value;
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
