package org.Aayush.tracksync.collection;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.tracksync.core.ValidationException;

import java.util.Map;

/**
 * Location and options for opening a collection through {@link CollectionRegistry}.
 *
 * <p>The url has the form {@code <scheme>:<name>}, for example {@code memory:scratch}.</p>
 */
@Value
@Builder
public class CollectionConfig {
    String url;
    @Singular
    Map<String, String> options;

    public static CollectionConfig of(String url) {
        return CollectionConfig.builder().url(url).build();
    }

    /**
     * Provider scheme, the url part before the first colon.
     *
     * @throws ValidationException if the url has no scheme.
     */
    public String scheme() {
        return url.substring(0, separatorIndex());
    }

    /**
     * Provider-specific location, the url part after the first colon.
     */
    public String location() {
        return url.substring(separatorIndex() + 1);
    }

    public String option(String key, String defaultValue) {
        return options.getOrDefault(key, defaultValue);
    }

    private int separatorIndex() {
        int index = url == null ? -1 : url.indexOf(':');
        if (index <= 0) {
            throw new ValidationException(
                    ValidationException.REASON_INVALID_CONFIG, "collection url must look like <scheme>:<name>, got " + url);
        }
        return index;
    }
}
