package io.github.jbellis.mobilize.filter;

import org.jsoup.nodes.Document;

/**
 * Functional interface for rewriters that transform a parsed HTML document in
 * place before it is serialized. Implementations may freely mutate the
 * supplied tree but MUST NOT replace the document itself.
 */
@FunctionalInterface
public interface HtmlFilter {

    /**
     * No-op filter that leaves the document unchanged.
     */
    HtmlFilter DEFAULT = document -> {
        // No-op
    };

    /**
     * Convenience accessor for the {@link #DEFAULT} instance.
     *
     * @return an identity/no-op HtmlFilter
     */
    static HtmlFilter noOp() {
        return DEFAULT;
    }

    /**
     * Mutate the supplied document in place.
     *
     * @param document the parsed page; its location is the page URL, if known
     */
    void rewrite(Document document);
}
