package io.github.jbellis.mobilize.filter;

import io.github.jbellis.mobilize.config.MobilizeOptions;
import io.github.jbellis.mobilize.stats.MobilizeStats;
import io.github.jbellis.mobilize.stats.StatisticsRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.Objects;

/**
 * Rewrites a page for mobile rendering.
 *
 * A single depth-first walk over the document classifies every element by its
 * {@link MobileRole} and restructures the page at three anchors:
 * <ul>
 *   <li>the first {@code <head>} gains the telephone meta tag, the viewport and
 *       XHR script in layout mode, and the mobile stylesheets;</li>
 *   <li>the first {@code <body>} opens with the header bar and spacer, preceded
 *       by a noscript redirect when the page URL is known and followed by the
 *       progress scrim in layout mode;</li>
 *   <li>the last {@code <body>} ends with the scripts that start mobilization.</li>
 * </ul>
 * Repeated heads and bodies are otherwise left alone, and injected nodes are
 * never visited or counted. In layout mode, pre-existing viewport meta tags are
 * removed in favor of the injected one.
 *
 * The filter is immutable and may be shared; all per-document state lives in
 * a pass object created for each call.
 */
public final class MobilizeRewriteFilter implements HtmlFilter {
    private static final Logger logger = LogManager.getLogger(MobilizeRewriteFilter.class);

    private final MobilizeOptions options;
    private final RoleClassifier classifier;
    private final StatisticsRegistry registry;

    public MobilizeRewriteFilter(MobilizeOptions options, StatisticsRegistry registry) {
        this(options, new RoleClassifier(), registry);
    }

    public MobilizeRewriteFilter(MobilizeOptions options, RoleClassifier classifier, StatisticsRegistry registry) {
        this.options = Objects.requireNonNull(options, "options");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.registry = Objects.requireNonNull(registry, "registry");
        MobilizeStats.registerAll(registry);
    }

    public MobilizeOptions options() {
        return options;
    }

    /**
     * Whether a page requested by a client should be mobilized at all. Device
     * detection belongs to the caller; this only applies the
     * {@code alwaysMobilize} override.
     */
    public boolean isEligible(boolean mobileClient) {
        return mobileClient || options.alwaysMobilize();
    }

    @Override
    public void rewrite(Document document) {
        mobilize(document, PageState.forDocument(document));
    }

    /**
     * Mobilizes {@code document} in place and merges the pass statistics into
     * the registry.
     *
     * @param document the parsed page
     * @param page state shared by all passes over the same logical page
     * @return the statistics recorded by this pass
     */
    public MobilizeStats mobilize(Document document, PageState page) {
        var pass = new Pass(document, page);
        pass.run();
        pass.stats.recordPageMobilized();
        pass.stats.mergeInto(registry);
        logger.debug("Mobilized {}: {}", page.url() == null ? "page" : page.url(), pass.stats);
        return pass.stats;
    }

    private final class Pass {
        private final PageState page;
        private final MobilizeMarkup markup;
        private final MobilizeStats stats = new MobilizeStats();
        private final Element root;
        private final @Nullable Element lastBody;

        private @Nullable Element firstHead;
        private boolean bodySeen;
        private int keeperDepth;

        Pass(Document document, PageState page) {
            this.root = document;
            this.page = page;
            this.markup = new MobilizeMarkup(document, options);
            this.lastBody = document.getElementsByTag("body").last();
        }

        void run() {
            for (Element child : new ArrayList<>(root.children())) {
                visit(child);
            }
            if (firstHead == null) {
                logger.debug("No <head> found; skipping head injection");
            }
            if (lastBody == null) {
                logger.debug("No <body> found; skipping body injection");
            }
        }

        private void visit(Element element) {
            if (options.layoutMode() && MobilizeMarkup.isViewportMeta(element)) {
                logger.trace("Removing existing viewport {}", element.attr("content"));
                element.remove();
                stats.recordDeletedElement();
                return;
            }

            var role = classifier.classify(element);
            // an implicit keeper inside a keeper block belongs to that block
            if (role != null && !(keeperDepth > 0 && RoleClassifier.isKeeperTag(element))) {
                stats.recordRole(role);
            }
            boolean keeperBlock = role == MobileRole.KEEPER;

            // Snapshot first so injected nodes are never visited
            var children = new ArrayList<>(element.children());
            startElement(element);
            if (keeperBlock) {
                keeperDepth++;
            }
            for (Element child : children) {
                visit(child);
            }
            if (keeperBlock) {
                keeperDepth--;
            }
            endElement(element);
        }

        private void startElement(Element element) {
            var name = element.normalName();
            if ("head".equals(name) && firstHead == null) {
                firstHead = element;
                element.prependChildren(markup.headPrefix());
            } else if ("body".equals(name) && !bodySeen) {
                bodySeen = true;
                element.prependChildren(bodyPrefix());
            }
        }

        private void endElement(Element element) {
            if (element == firstHead) {
                element.appendChildren(markup.headStyles());
            }
            if (element == lastBody) {
                element.appendChildren(markup.bodySuffix());
            }
        }

        private ArrayList<Element> bodyPrefix() {
            var nodes = new ArrayList<Element>();
            var url = page.url();
            if (url != null) {
                nodes.add(markup.noscriptRedirect(url));
            }
            nodes.add(markup.headerBar());
            nodes.add(markup.spacer());
            if (options.layoutMode() && !page.isProgressAdded()) {
                nodes.add(markup.progressScrim());
                page.markProgressAdded();
            }
            return nodes;
        }
    }
}
