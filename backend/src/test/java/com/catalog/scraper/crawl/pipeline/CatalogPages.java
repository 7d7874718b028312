package com.catalog.scraper.crawl.pipeline;

/**
 * Minimal books.toscrape.com style markup for pipeline tests.
 */
final class CatalogPages {
    static final String BASE = "https://books.example/catalogue/";

    private CatalogPages() {
    }

    static String listingUrl(int page) {
        return BASE + "page-" + page + ".html";
    }

    static String detailUrl(String slug) {
        return BASE + slug + "/index.html";
    }

    static String listing(String nextUrl, String... detailUrls) {
        StringBuilder html = new StringBuilder("<html><body><section><ol class=\"row\">");
        for (String url : detailUrls) {
            html.append("<li><article class=\"product_pod\"><h3><a href=\"")
                .append(url)
                .append("\">book</a></h3></article></li>");
        }
        html.append("</ol>");
        if (nextUrl != null) {
            html.append("<ul class=\"pager\"><li class=\"next\"><a href=\"")
                .append(nextUrl)
                .append("\">next</a></li></ul>");
        }
        return html.append("</section></body></html>").toString();
    }

    static String detail(String title, String price) {
        return """
            <html><body>
              <div class="product_main">
                <h1>%s</h1>
                <p class="price_color">%s</p>
                <p class="star-rating Three"></p>
                <p class="instock availability">In stock</p>
              </div>
            </body></html>
            """.formatted(title, price);
    }
}
