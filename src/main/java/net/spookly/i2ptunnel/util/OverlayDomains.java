package net.spookly.i2ptunnel.util;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Recognises host names that only resolve inside the overlay network.
 */
public final class OverlayDomains {
    public static final String I2P_SUFFIX = ".i2p";
    public static final OverlayDomains DEFAULT = new OverlayDomains(List.of(I2P_SUFFIX));

    private final List<String> suffixes;

    public OverlayDomains(List<String> suffixes) {
        if (suffixes == null || suffixes.isEmpty()) {
            throw new IllegalArgumentException("at least one overlay domain suffix is required");
        }
        List<String> normalized = new ArrayList<>(suffixes.size());
        for (String suffix : suffixes) {
            if (suffix == null || suffix.isBlank()) {
                continue;
            }
            String value = suffix.trim().toLowerCase(Locale.ROOT);
            normalized.add(value.startsWith(".") ? value : "." + value);
        }
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("at least one overlay domain suffix is required");
        }
        this.suffixes = List.copyOf(normalized);
    }

    public List<String> suffixes() {
        return suffixes;
    }

    /**
     * True when the host carries an overlay suffix and a non-empty label in front of it.
     */
    public boolean isOverlayHost(String host) {
        if (host == null) {
            return false;
        }
        String value = host.trim().toLowerCase(Locale.ROOT);
        if (value.endsWith(".")) {
            value = value.substring(0, value.length() - 1);
        }
        for (String suffix : suffixes) {
            if (value.length() > suffix.length() && value.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when the URL parses and its host is an overlay host.
     */
    public boolean isOverlayUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            return isOverlayHost(URI.create(url.trim()).getHost());
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
