package io.github.jbellis.mobilize.filter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.util.Objects;

/**
 * Parses a page, hands the tree to a filter once and serializes the result.
 * Output is not pretty-printed so that untouched markup keeps its whitespace.
 */
public final class RewritePipeline {
    private static final Logger logger = LogManager.getLogger(RewritePipeline.class);

    private final HtmlFilter filter;

    public RewritePipeline(HtmlFilter filter) {
        this.filter = Objects.requireNonNull(filter, "filter");
    }

    /**
     * @param html    the page source
     * @param pageUrl the URL the page was requested from; becomes the document
     *                location, and may be empty if unknown
     * @return the rewritten page
     */
    public String rewrite(String html, String pageUrl) {
        Document document = Jsoup.parse(html, pageUrl);
        rewrite(document);
        return document.outerHtml();
    }

    public void rewrite(Document document) {
        document.outputSettings().prettyPrint(false);
        logger.debug("Rewriting {} with filter {}", document.location(), filter.getClass().getSimpleName());
        filter.rewrite(document);
    }
}
