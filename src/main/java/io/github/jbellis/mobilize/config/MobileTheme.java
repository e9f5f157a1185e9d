package io.github.jbellis.mobilize.config;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Colors applied to the injected mobile chrome, parsed from a theme string of
 * the form {@code "#rrggbb #rrggbb [logoUrl]"}: background first, then
 * foreground. The logo URL is retained for callers but does not influence the
 * rewritten markup.
 */
public record MobileTheme(RgbColor background, RgbColor foreground, @Nullable String logoUrl) {

    private static final Splitter TOKENIZER =
            Splitter.on(CharMatcher.whitespace()).omitEmptyStrings().trimResults();

    public MobileTheme {
        Objects.requireNonNull(background, "background");
        Objects.requireNonNull(foreground, "foreground");
    }

    public static MobileTheme parse(String themeString) {
        List<String> tokens = TOKENIZER.splitToList(themeString);
        if (tokens.size() < 2 || tokens.size() > 3) {
            throw new InvalidOptionException("theme",
                    "expected '<background> <foreground> [logoUrl]' but got '" + themeString + "'");
        }
        try {
            var background = RgbColor.fromHex(tokens.get(0));
            var foreground = RgbColor.fromHex(tokens.get(1));
            var logo = tokens.size() == 3 ? tokens.get(2) : null;
            return new MobileTheme(background, foreground, logo);
        } catch (InvalidOptionException e) {
            throw new InvalidOptionException("theme", e.getMessage(), e);
        }
    }
}
