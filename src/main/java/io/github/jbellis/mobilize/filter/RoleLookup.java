package io.github.jbellis.mobilize.filter;

import org.jetbrains.annotations.Nullable;
import org.jsoup.nodes.Element;

/**
 * Source of the role label assigned to an element by the labeling pass that
 * runs before mobilization. The mobilizer never infers roles from content; it
 * only reads what the labeler left behind.
 */
@FunctionalInterface
public interface RoleLookup {

    String ROLE_ATTRIBUTE = "data-mobile-role";

    /**
     * Reads the {@value #ROLE_ATTRIBUTE} attribute.
     */
    RoleLookup ATTRIBUTE = element -> element.hasAttr(ROLE_ATTRIBUTE) ? element.attr(ROLE_ATTRIBUTE) : null;

    /**
     * Returns the raw role label of {@code element}, or {@code null} if it was
     * not labeled.
     */
    @Nullable
    String roleLabel(Element element);
}
