package io.github.jbellis.mobilize.filter;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RoleClassifierTest {

    private final RoleClassifier classifier = new RoleClassifier();

    private static Element first(String html, String selector) {
        return Jsoup.parse(html).selectFirst(selector);
    }

    @Test
    void testMobileRoleAttribute() {
        var div = first("<div data-mobile-role=\"navigational\"></div>", "div");
        assertEquals(MobileRole.NAVIGATIONAL, classifier.classify(div));
    }

    @Test
    void testEveryRecognizedValue() {
        for (var role : MobileRole.values()) {
            if (role == MobileRole.INVALID) {
                continue;
            }
            var div = first("<div data-mobile-role=\"" + role.attributeValue() + "\"></div>", "div");
            assertEquals(role, classifier.classify(div), role.attributeValue());
        }
    }

    @Test
    void testInvalidMobileRoleAttribute() {
        var div = first("<div data-mobile-role=\"garbage\"></div>", "div");
        assertEquals(MobileRole.INVALID, classifier.classify(div));
    }

    @Test
    void testMatchingIsCaseSensitive() {
        var div = first("<div data-mobile-role=\"Header\"></div>", "div");
        assertEquals(MobileRole.INVALID, classifier.classify(div));
    }

    @Test
    void testUnlabeledIsNotInvalid() {
        assertNull(classifier.classify(first("<div></div>", "div")));
        assertNull(classifier.classify(first("<div data-mobile-role=\"\"></div>", "div")),
                   "An empty label counts as unlabeled");
    }

    @Test
    void testKeeperMobileRoleAttribute() {
        assertEquals(MobileRole.KEEPER, classifier.classify(first("<script></script>", "script")));
        assertEquals(MobileRole.KEEPER, classifier.classify(first("<style></style>", "style")));
        assertEquals(MobileRole.KEEPER, classifier.classify(first("<link rel=\"icon\">", "link")));
        assertEquals(MobileRole.KEEPER, classifier.classify(first("<map name=\"m\"></map>", "map")));
    }

    @Test
    void testKeeperOverridesAttribute() {
        var script = first("<script data-mobile-role=\"content\">x()</script>", "script");
        assertEquals(MobileRole.KEEPER, classifier.classify(script));
    }

    @Test
    void testFromAttributeValue() {
        assertEquals(MobileRole.MARGINAL, MobileRole.fromAttributeValue("marginal"));
        assertEquals(MobileRole.INVALID, MobileRole.fromAttributeValue(" marginal"));
        assertNull(MobileRole.INVALID.attributeValue());
    }
}
