package io.github.jbellis.mobilize.filter;

import io.github.jbellis.mobilize.config.MobileTheme;
import io.github.jbellis.mobilize.config.MobilizeOptions;
import io.github.jbellis.mobilize.config.RgbColor;
import io.github.jbellis.mobilize.util.JsStrings;
import org.jetbrains.annotations.Nullable;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Builds the nodes the mobilizer injects into a page. Every factory creates
 * fresh elements owned by the target document.
 */
public final class MobilizeMarkup {

    // Element ids and classes the client-side mobilization script relies on
    public static final String ID_HEADER_BAR = "psmob-header-bar";
    public static final String CLASS_HIDE = "psmob-hide";
    public static final String ID_SPACER = "psmob-spacer";
    public static final String ID_PROGRESS_SCRIM = "ps-progress-scrim";
    public static final String CLASS_PROGRESS_SCRIM = "psProgressScrim";
    public static final String ID_PROGRESS_REMOVE = "ps-progress-remove";
    public static final String CLASS_PROGRESS_BAR = "psProgressBar";
    public static final String ID_PROGRESS_SPAN = "ps-progress-span";
    public static final String CLASS_PROGRESS_SPAN = "psProgressSpan";
    public static final String ID_PROGRESS_LOG = "ps-progress-log";
    public static final String CLASS_PROGRESS_LOG = "psProgressLog";

    public static final String VIEWPORT_CONTENT = "width=device-width";
    public static final String NOSCRIPT_QUERY_PARAM = "PageSpeed=noscript";

    static final String START_MOBILIZATION_CALL = "psStartMobilization();";

    /**
     * Static assets served next to the rewritten page.
     */
    public enum StaticAsset {
        MOBILIZE_CSS("mobilize_css", "css"),
        MOBILIZE_LAYOUT_CSS("mobilize_layout_css", "css"),
        MOBILIZE_XHR_JS("mobilize_xhr", "js"),
        MOBILIZE_JS("mobilize", "js");

        private final String baseName;
        private final String extension;

        StaticAsset(String baseName, String extension) {
            this.baseName = baseName;
            this.extension = extension;
        }

        public String url(MobilizeOptions options) {
            return options.assetPrefix() + baseName + "." + options.assetVersion() + "." + extension;
        }
    }

    private final Document document;
    private final MobilizeOptions options;

    public MobilizeMarkup(Document document, MobilizeOptions options) {
        this.document = document;
        this.options = options;
    }

    public static boolean isViewportMeta(Element element) {
        return "meta".equals(element.normalName())
                && "viewport".equals(element.attr("name").trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Nodes that open the first head: the telephone meta tag and, in layout
     * mode, the viewport and the XHR bootstrap script.
     */
    public List<Element> headPrefix() {
        var nodes = new ArrayList<Element>();
        nodes.add(document.createElement("meta")
                          .attr("itemprop", "telephone")
                          .attr("content", options.phoneNumber()));
        if (options.layoutMode()) {
            nodes.add(document.createElement("meta")
                              .attr("name", "viewport")
                              .attr("content", VIEWPORT_CONTENT));
            nodes.add(scriptSrc(StaticAsset.MOBILIZE_XHR_JS));
        }
        return nodes;
    }

    /**
     * Stylesheets appended to the end of the first head.
     */
    public List<Element> headStyles() {
        var nodes = new ArrayList<Element>();
        nodes.add(stylesheet(StaticAsset.MOBILIZE_CSS));
        if (options.layoutMode()) {
            nodes.add(stylesheet(StaticAsset.MOBILIZE_LAYOUT_CSS));
        }
        return nodes;
    }

    public Element headerBar() {
        return document.createElement("header").attr("id", ID_HEADER_BAR).addClass(CLASS_HIDE);
    }

    public Element spacer() {
        return document.createElement("div").attr("id", ID_SPACER);
    }

    /**
     * Overlay shown while the page is mobilized on the client.
     */
    public Element progressScrim() {
        var scrim = document.createElement("div").attr("id", ID_PROGRESS_SCRIM).addClass(CLASS_PROGRESS_SCRIM);
        scrim.appendChild(document.createElement("a")
                                  .attr("href", "javascript:psRemoveProgressBar();")
                                  .attr("id", ID_PROGRESS_REMOVE)
                                  .text("Remove Progress Bar (doesn't stop mobilization)"));
        scrim.appendChild(document.createElement("br"));
        scrim.appendChild(document.createElement("a")
                                  .attr("href", "javascript:psSetDebugMode();")
                                  .text("Show Debug Log In Progress Bar"));
        var bar = document.createElement("div").addClass(CLASS_PROGRESS_BAR);
        bar.appendChild(document.createElement("span").attr("id", ID_PROGRESS_SPAN).addClass(CLASS_PROGRESS_SPAN));
        scrim.appendChild(bar);
        scrim.appendChild(document.createElement("pre").attr("id", ID_PROGRESS_LOG).addClass(CLASS_PROGRESS_LOG));
        return scrim;
    }

    /**
     * Redirects clients without script support to the unmobilized page.
     *
     * @param pageUrl the URL of the page being rewritten
     */
    public Element noscriptRedirect(String pageUrl) {
        var target = noscriptUrl(pageUrl);
        var noscript = document.createElement("noscript");
        noscript.appendChild(document.createElement("meta")
                                     .attr("http-equiv", "refresh")
                                     .attr("content", "0;url='" + target + "'"));
        noscript.appendChild(document.createElement("style")
                                     .appendChild(new DataNode("<!--table,div,span,font,p{display:none} -->")));
        var notice = document.createElement("div").attr("style", "display:block");
        notice.appendText("Please click ");
        notice.appendChild(document.createElement("a").attr("href", target).text("here"));
        notice.appendText(" if you are not redirected within a few seconds.");
        noscript.appendChild(notice);
        return noscript;
    }

    /**
     * Scripts appended to the end of the last body: the mobilization library
     * followed by the inline configuration block that starts it.
     */
    public List<Element> bodySuffix() {
        var inline = document.createElement("script").appendChild(new DataNode(bootstrapScript(options)));
        return List.of(scriptSrc(StaticAsset.MOBILIZE_JS), inline);
    }

    /**
     * Renders the inline configuration consumed by the mobilization library.
     * Field order is fixed; string values are encoded as JavaScript literals.
     */
    public static String bootstrapScript(MobilizeOptions options) {
        var theme = options.theme();
        var js = new StringBuilder();
        js.append("window.psDebugMode=").append(options.debugMode()).append(';');
        js.append("window.psNavMode=").append(options.navEnabled()).append(';');
        js.append("window.psLabeledMode=false;");
        js.append("window.psConfigMode=false;");
        js.append("window.psLayoutMode=").append(options.layoutMode()).append(';');
        js.append("window.psStaticJs=").append(options.staticJs()).append(';');
        js.append("window.psDeviceType=").append(JsStrings.singleQuoted(options.deviceType())).append(';');
        js.append("window.psConversionId=").append(JsStrings.singleQuoted(Long.toString(options.conversionId()))).append(';');
        js.append("window.psPhoneNumber=").append(JsStrings.singleQuoted(options.phoneNumber())).append(';');
        js.append("window.psPhoneConversionLabel=")
          .append(JsStrings.singleQuoted(options.phoneConversionLabel())).append(';');
        js.append("window.psMobBackgroundColor=").append(colorArray(theme, MobileTheme::background)).append(';');
        js.append("window.psMobForegroundColor=").append(colorArray(theme, MobileTheme::foreground)).append(';');
        js.append("window.psMobBeaconUrl=").append(JsStrings.singleQuoted(options.beaconUrl())).append(';');
        var beaconCategory = options.beaconCategory();
        if (beaconCategory != null) {
            js.append("window.psMobBeaconCategory=").append(JsStrings.singleQuoted(beaconCategory)).append(';');
        }
        js.append(START_MOBILIZATION_CALL);
        return js.toString();
    }

    static String noscriptUrl(String pageUrl) {
        int hash = pageUrl.indexOf('#');
        var base = hash < 0 ? pageUrl : pageUrl.substring(0, hash);
        var fragment = hash < 0 ? "" : pageUrl.substring(hash);
        String separator;
        if (base.indexOf('?') < 0) {
            separator = "?";
        } else if (base.endsWith("?") || base.endsWith("&")) {
            separator = "";
        } else {
            separator = "&";
        }
        // the refresh header single-quotes the url
        return (base + separator + NOSCRIPT_QUERY_PARAM + fragment).replace("'", "%27");
    }

    private static String colorArray(@Nullable MobileTheme theme, Function<MobileTheme, RgbColor> channel) {
        return theme == null ? "null" : channel.apply(theme).toJsArray();
    }

    private Element scriptSrc(StaticAsset asset) {
        return document.createElement("script").attr("src", asset.url(options));
    }

    private Element stylesheet(StaticAsset asset) {
        return document.createElement("link").attr("rel", "stylesheet").attr("href", asset.url(options));
    }
}
