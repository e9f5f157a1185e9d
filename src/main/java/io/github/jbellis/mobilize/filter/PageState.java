package io.github.jbellis.mobilize.filter;

import org.jetbrains.annotations.Nullable;
import org.jsoup.nodes.Document;

/**
 * What the caller knows about the logical page being mobilized. A caller that
 * rewrites one page in several passes hands the same instance to each pass so
 * the progress scrim is only ever added once.
 */
public final class PageState {

    private final @Nullable String url;
    private boolean progressAdded;

    public PageState(@Nullable String url) {
        this.url = url == null || url.isBlank() ? null : url;
    }

    /**
     * State for a page whose URL is the document's location.
     */
    public static PageState forDocument(Document document) {
        return new PageState(document.location());
    }

    /**
     * The page URL, or {@code null} when it is unknown.
     */
    public @Nullable String url() {
        return url;
    }

    public boolean isProgressAdded() {
        return progressAdded;
    }

    public void markProgressAdded() {
        this.progressAdded = true;
    }
}
