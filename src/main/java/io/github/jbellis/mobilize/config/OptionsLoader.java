package io.github.jbellis.mobilize.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import io.github.jbellis.mobilize.util.Json;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads {@link MobilizeOptions} from JSON. Keys match the option names, and the
 * theme is given in its string form:
 *
 * <pre>{@code
 * {
 *   "layoutMode": true,
 *   "phoneNumber": "16175551212",
 *   "conversionId": 42,
 *   "beaconUrl": "/beacon",
 *   "theme": "#ff0000 #0000ff"
 * }
 * }</pre>
 *
 * Absent keys keep the {@link MobilizeOptions.Builder} defaults. Unknown keys
 * and invalid values are rejected with {@link InvalidOptionException}.
 */
public final class OptionsLoader {
    private static final Logger logger = LogManager.getLogger(OptionsLoader.class);

    private OptionsLoader() {}

    /**
     * Mirror of the JSON document. Every field is optional so that defaults can
     * be told apart from explicit values.
     */
    record OptionsDto(Optional<Boolean> layoutMode,
                      Optional<Boolean> navEnabled,
                      Optional<Boolean> alwaysMobilize,
                      Optional<String> phoneNumber,
                      Optional<Long> conversionId,
                      Optional<String> phoneConversionLabel,
                      Optional<String> beaconUrl,
                      Optional<String> beaconCategory,
                      Optional<String> theme,
                      Optional<Boolean> debugMode,
                      Optional<Boolean> staticJs,
                      Optional<String> deviceType,
                      Optional<String> assetPrefix,
                      Optional<String> assetVersion) {
    }

    public static MobilizeOptions load(Path file) throws IOException {
        logger.debug("Loading mobilize options from {}", file);
        return parse(Files.readString(file));
    }

    public static MobilizeOptions parse(String json) {
        OptionsDto dto;
        try {
            dto = Json.mapper.readValue(json, OptionsDto.class);
        } catch (JsonMappingException e) {
            var path = e.getPath().isEmpty() ? "options" : e.getPath().get(0).getFieldName();
            logger.warn("Rejected mobilize options: {}", e.getOriginalMessage());
            throw new InvalidOptionException(path == null ? "options" : path, e.getOriginalMessage(), e);
        } catch (JsonProcessingException e) {
            logger.warn("Malformed mobilize options: {}", e.getOriginalMessage());
            throw new InvalidOptionException("options", "malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (dto == null) {
            throw new InvalidOptionException("options", "document is empty");
        }
        return toOptions(dto);
    }

    private static MobilizeOptions toOptions(OptionsDto dto) {
        var builder = MobilizeOptions.builder();
        // Records bind absent keys as null rather than Optional.empty()
        orEmpty(dto.layoutMode()).ifPresent(builder::layoutMode);
        orEmpty(dto.navEnabled()).ifPresent(builder::navEnabled);
        orEmpty(dto.alwaysMobilize()).ifPresent(builder::alwaysMobilize);
        orEmpty(dto.phoneNumber()).ifPresent(builder::phoneNumber);
        orEmpty(dto.conversionId()).ifPresent(builder::conversionId);
        orEmpty(dto.phoneConversionLabel()).ifPresent(builder::phoneConversionLabel);
        orEmpty(dto.beaconUrl()).ifPresent(builder::beaconUrl);
        orEmpty(dto.beaconCategory()).ifPresent(builder::beaconCategory);
        orEmpty(dto.theme()).ifPresent(builder::themeSpec);
        orEmpty(dto.debugMode()).ifPresent(builder::debugMode);
        orEmpty(dto.staticJs()).ifPresent(builder::staticJs);
        orEmpty(dto.deviceType()).ifPresent(builder::deviceType);
        orEmpty(dto.assetPrefix()).ifPresent(builder::assetPrefix);
        orEmpty(dto.assetVersion()).ifPresent(builder::assetVersion);
        return builder.build();
    }

    private static <T> Optional<T> orEmpty(Optional<T> value) {
        return value == null ? Optional.empty() : value;
    }
}
