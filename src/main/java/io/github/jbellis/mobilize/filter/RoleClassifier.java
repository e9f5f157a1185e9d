package io.github.jbellis.mobilize.filter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jsoup.nodes.Element;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves the {@link MobileRole} of an element.
 *
 * Keeper tags are always {@link MobileRole#KEEPER}, whatever their label says.
 * Other elements are classified from their label; a {@code null} result means
 * the element is unlabeled, which is distinct from {@link MobileRole#INVALID}.
 */
public final class RoleClassifier {
    private static final Logger logger = LogManager.getLogger(RoleClassifier.class);

    /**
     * Tags whose content must survive restructuring untouched.
     */
    static final Set<String> KEEPER_TAGS = Set.of("script", "style", "link", "map");

    private final RoleLookup lookup;

    public RoleClassifier() {
        this(RoleLookup.ATTRIBUTE);
    }

    public RoleClassifier(RoleLookup lookup) {
        this.lookup = Objects.requireNonNull(lookup, "lookup");
    }

    public static boolean isKeeperTag(Element element) {
        return KEEPER_TAGS.contains(element.normalName());
    }

    public @Nullable MobileRole classify(Element element) {
        if (isKeeperTag(element)) {
            return MobileRole.KEEPER;
        }
        String label = lookup.roleLabel(element);
        if (label == null || label.isEmpty()) {
            return null;
        }
        var role = MobileRole.fromAttributeValue(label);
        if (role == MobileRole.INVALID) {
            logger.trace("Ignoring unknown mobile role '{}' on <{}>", label, element.tagName().toLowerCase(Locale.ROOT));
        }
        return role;
    }
}
