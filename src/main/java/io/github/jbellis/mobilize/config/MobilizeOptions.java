package io.github.jbellis.mobilize.config;

import org.jetbrains.annotations.Nullable;

/**
 * Immutable settings for one mobilization pass.
 *
 * <h3>Defaults</h3>
 * Navigation is on, layout mode is off, the device type is {@code mobile} and
 * static assets are served from {@code /psajs/} with version {@code 0}.
 * {@code debugMode} defaults to the {@code mobilize.debug} system property.
 */
public record MobilizeOptions(boolean layoutMode,
                              boolean navEnabled,
                              boolean alwaysMobilize,
                              String phoneNumber,
                              long conversionId,
                              String phoneConversionLabel,
                              String beaconUrl,
                              @Nullable String beaconCategory,
                              @Nullable MobileTheme theme,
                              boolean debugMode,
                              boolean staticJs,
                              String deviceType,
                              String assetPrefix,
                              String assetVersion) {

    public static final String DEFAULT_DEVICE_TYPE = "mobile";
    public static final String DEFAULT_ASSET_PREFIX = "/psajs/";
    public static final String DEFAULT_ASSET_VERSION = "0";

    public MobilizeOptions {
        requireValue("phoneNumber", phoneNumber);
        requireValue("phoneConversionLabel", phoneConversionLabel);
        requireValue("beaconUrl", beaconUrl);
        requireNonBlank("deviceType", deviceType);
        requireNonBlank("assetPrefix", assetPrefix);
        requireNonBlank("assetVersion", assetVersion);
        if (conversionId < 0) {
            throw new InvalidOptionException("conversionId", "must not be negative: " + conversionId);
        }
        if (beaconCategory != null && beaconCategory.isEmpty()) {
            beaconCategory = null;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .layoutMode(layoutMode)
                .navEnabled(navEnabled)
                .alwaysMobilize(alwaysMobilize)
                .phoneNumber(phoneNumber)
                .conversionId(conversionId)
                .phoneConversionLabel(phoneConversionLabel)
                .beaconUrl(beaconUrl)
                .beaconCategory(beaconCategory)
                .theme(theme)
                .debugMode(debugMode)
                .staticJs(staticJs)
                .deviceType(deviceType)
                .assetPrefix(assetPrefix)
                .assetVersion(assetVersion);
    }

    private static void requireValue(String name, @Nullable String value) {
        if (value == null) {
            throw new InvalidOptionException(name, "must be set");
        }
    }

    private static void requireNonBlank(String name, @Nullable String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidOptionException(name, "must not be blank");
        }
    }

    public static final class Builder {
        private boolean layoutMode;
        private boolean navEnabled = true;
        private boolean alwaysMobilize;
        private String phoneNumber = "";
        private long conversionId;
        private String phoneConversionLabel = "";
        private String beaconUrl = "";
        private @Nullable String beaconCategory;
        private @Nullable MobileTheme theme;
        private boolean debugMode = Boolean.getBoolean("mobilize.debug");
        private boolean staticJs;
        private String deviceType = DEFAULT_DEVICE_TYPE;
        private String assetPrefix = DEFAULT_ASSET_PREFIX;
        private String assetVersion = DEFAULT_ASSET_VERSION;

        private Builder() {}

        public Builder layoutMode(boolean layoutMode) {
            this.layoutMode = layoutMode;
            return this;
        }

        public Builder navEnabled(boolean navEnabled) {
            this.navEnabled = navEnabled;
            return this;
        }

        public Builder alwaysMobilize(boolean alwaysMobilize) {
            this.alwaysMobilize = alwaysMobilize;
            return this;
        }

        public Builder phoneNumber(String phoneNumber) {
            this.phoneNumber = phoneNumber;
            return this;
        }

        public Builder conversionId(long conversionId) {
            this.conversionId = conversionId;
            return this;
        }

        public Builder phoneConversionLabel(String phoneConversionLabel) {
            this.phoneConversionLabel = phoneConversionLabel;
            return this;
        }

        public Builder beaconUrl(String beaconUrl) {
            this.beaconUrl = beaconUrl;
            return this;
        }

        public Builder beaconCategory(@Nullable String beaconCategory) {
            this.beaconCategory = beaconCategory;
            return this;
        }

        public Builder theme(@Nullable MobileTheme theme) {
            this.theme = theme;
            return this;
        }

        /**
         * Parses and sets the theme from its string form.
         *
         * @throws InvalidOptionException if the string is malformed
         */
        public Builder themeSpec(String themeSpec) {
            this.theme = MobileTheme.parse(themeSpec);
            return this;
        }

        public Builder debugMode(boolean debugMode) {
            this.debugMode = debugMode;
            return this;
        }

        public Builder staticJs(boolean staticJs) {
            this.staticJs = staticJs;
            return this;
        }

        public Builder deviceType(String deviceType) {
            this.deviceType = deviceType;
            return this;
        }

        public Builder assetPrefix(String assetPrefix) {
            this.assetPrefix = assetPrefix;
            return this;
        }

        public Builder assetVersion(String assetVersion) {
            this.assetVersion = assetVersion;
            return this;
        }

        public MobilizeOptions build() {
            return new MobilizeOptions(layoutMode, navEnabled, alwaysMobilize, phoneNumber, conversionId,
                                       phoneConversionLabel, beaconUrl, beaconCategory, theme, debugMode,
                                       staticJs, deviceType, assetPrefix, assetVersion);
        }
    }
}
