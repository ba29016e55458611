package com.phillippitts.truthtell.service.audio;

import com.phillippitts.truthtell.exception.InvalidRequestException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps a source URL to the name of the platform hosting it.
 *
 * <p>The first known domain contained in the URL's host wins; hosts matching no known
 * domain map to {@link #UNKNOWN}.
 */
public final class PlatformDetector {

    public static final String UNKNOWN = "unknown";

    private static final Map<String, String> PLATFORMS = new LinkedHashMap<>();

    static {
        PLATFORMS.put("youtube.com", "youtube");
        PLATFORMS.put("youtu.be", "youtube");
        PLATFORMS.put("instagram.com", "instagram");
        PLATFORMS.put("facebook.com", "facebook");
        PLATFORMS.put("fb.com", "facebook");
        PLATFORMS.put("tiktok.com", "tiktok");
        PLATFORMS.put("twitter.com", "twitter");
        PLATFORMS.put("vimeo.com", "vimeo");
    }

    private PlatformDetector() {
    }

    /**
     * @param url absolute source URL
     * @return platform name, or {@link #UNKNOWN}
     * @throws InvalidRequestException if {@code url} is not an absolute URL with a host
     */
    public static String detect(String url) {
        String host = hostOf(url);
        for (Map.Entry<String, String> entry : PLATFORMS.entrySet()) {
            if (host.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return UNKNOWN;
    }

    private static String hostOf(String url) {
        if (url == null || url.isBlank()) {
            throw new InvalidRequestException("url", "Invalid URL format");
        }
        try {
            URI uri = new URI(url.strip());
            if (uri.getHost() == null) {
                throw new InvalidRequestException("url", "Invalid URL format");
            }
            return uri.getHost().toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            throw new InvalidRequestException("url", "Invalid URL format");
        }
    }
}
