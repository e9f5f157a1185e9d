package io.github.jbellis.mobilize.filter;

import io.github.jbellis.mobilize.config.MobilizeOptions;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MobilizeMarkupTest {

    private static MobilizeOptions.Builder options() {
        return MobilizeOptions.builder()
                .debugMode(false)
                .phoneNumber("555")
                .conversionId(9_000_000_000L)
                .phoneConversionLabel("label")
                .beaconUrl("/b");
    }

    @Test
    void testBootstrapScriptFieldOrder() {
        var script = MobilizeMarkup.bootstrapScript(options()
                .layoutMode(true)
                .navEnabled(false)
                .staticJs(true)
                .debugMode(true)
                .deviceType("tablet")
                .themeSpec("#010203 #ffffff")
                .beaconCategory("exp")
                .build());
        assertEquals("window.psDebugMode=true;window.psNavMode=false;window.psLabeledMode=false;"
                     + "window.psConfigMode=false;window.psLayoutMode=true;window.psStaticJs=true;"
                     + "window.psDeviceType='tablet';window.psConversionId='9000000000';"
                     + "window.psPhoneNumber='555';window.psPhoneConversionLabel='label';"
                     + "window.psMobBackgroundColor=[1,2,3];window.psMobForegroundColor=[255,255,255];"
                     + "window.psMobBeaconUrl='/b';window.psMobBeaconCategory='exp';"
                     + "psStartMobilization();",
                     script);
    }

    @Test
    void testBeaconCategoryOmittedWhenUnset() {
        var script = MobilizeMarkup.bootstrapScript(options().beaconCategory("").build());
        assertFalse(script.contains("psMobBeaconCategory"), script);
        assertTrue(script.endsWith("window.psMobBeaconUrl='/b';psStartMobilization();"), script);
    }

    @Test
    void testScriptTerminatorCannotEscapeLiteral() {
        var script = MobilizeMarkup.bootstrapScript(options().beaconCategory("</script><b>").build());
        assertFalse(script.contains("</script>"), script);
    }

    @Test
    void testAssetUrls() {
        var custom = options().assetPrefix("https://cdn.example.com/mob/").assetVersion("abc123").build();
        assertEquals("https://cdn.example.com/mob/mobilize_layout_css.abc123.css",
                     MobilizeMarkup.StaticAsset.MOBILIZE_LAYOUT_CSS.url(custom));
        assertEquals("/psajs/mobilize.0.js", MobilizeMarkup.StaticAsset.MOBILIZE_JS.url(options().build()));
    }

    @Test
    void testNoscriptUrl() {
        assertEquals("http://a.com/p?PageSpeed=noscript", MobilizeMarkup.noscriptUrl("http://a.com/p"));
        assertEquals("http://a.com/p?x=1&PageSpeed=noscript", MobilizeMarkup.noscriptUrl("http://a.com/p?x=1"));
        assertEquals("http://a.com/p?PageSpeed=noscript#top", MobilizeMarkup.noscriptUrl("http://a.com/p#top"));
        assertEquals("http://a.com/p?PageSpeed=noscript", MobilizeMarkup.noscriptUrl("http://a.com/p?"));
    }

    @Test
    void testNoscriptRefreshKeepsQuotedUrlIntact() {
        var doc = Jsoup.parse("");
        var noscript = new MobilizeMarkup(doc, options().build()).noscriptRedirect("http://a.com/it's.html");
        assertEquals("0;url='http://a.com/it%27s.html?PageSpeed=noscript'",
                     noscript.selectFirst("meta").attr("content"));
        assertEquals("http://a.com/it%27s.html?PageSpeed=noscript", noscript.selectFirst("a").attr("href"));
    }

    @Test
    void testViewportDetection() {
        var doc = Jsoup.parse("<meta name=\"Viewport\" content=\"a\"><meta name=\"keywords\" content=\"b\">");
        var metas = doc.select("meta");
        assertTrue(MobilizeMarkup.isViewportMeta(metas.get(0)));
        assertFalse(MobilizeMarkup.isViewportMeta(metas.get(1)));
    }

    @Test
    void testHeadPrefixWithoutLayout() {
        var doc = Jsoup.parse("");
        var prefix = new MobilizeMarkup(doc, options().build()).headPrefix();
        assertEquals(1, prefix.size());
        assertEquals("555", prefix.get(0).attr("content"));
    }
}
