package net.spookly.i2ptunnel.discovery;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import net.spookly.i2ptunnel.util.OverlayDomains;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts outproxy records from the directory page.
 *
 * <p>Table rows of at least four cells are read as (address, port, uptime, type) and are
 * authoritative. Links and free text are scanned afterwards and may only add endpoints that the
 * table did not already list. The first occurrence of a (host, port) pair wins.
 */
public final class DirectoryPageParser {
    private static final Logger log = LoggerFactory.getLogger(DirectoryPageParser.class);

    /**
     * Ports accepted for bare {@code host:port} mentions in free text.
     */
    static final Set<Integer> BARE_HOST_PORTS = Set.of(443, 4447, 8443, 1080);

    private static final int MIN_ROW_CELLS = 4;
    private static final int DEFAULT_HTTPS_PORT = 443;

    private final OverlayDomains domains;
    private final Pattern httpsUrlPattern;
    private final Pattern bareHostPattern;

    public DirectoryPageParser() {
        this(OverlayDomains.DEFAULT);
    }

    public DirectoryPageParser(OverlayDomains domains) {
        this.domains = Objects.requireNonNull(domains, "domains");
        String host = overlayHostRegex(domains);
        this.httpsUrlPattern = Pattern.compile("https://(" + host + ")(?::(\\d{1,5}))?",
                Pattern.CASE_INSENSITIVE);
        this.bareHostPattern = Pattern.compile("(?<![a-z0-9./@-])(" + host + "):(\\d{1,5})(?!\\d)",
                Pattern.CASE_INSENSITIVE);
    }

    public List<ProxyRecord> parse(String html) {
        if (html == null || html.isBlank()) {
            log.warn("Directory page is empty");
            return List.of();
        }
        Document document = Jsoup.parse(html);
        Map<String, ProxyRecord> found = new LinkedHashMap<>();

        int fromRows = parseRows(document, found);
        int fromLinks = parseLinks(document, found);
        String text = document.text();
        int fromUrls = parseHttpsUrls(text, found);
        int fromBareHosts = parseBareHosts(text, found);

        log.debug("Directory records: {} from table, {} from links, {} from URLs, {} from bare hosts",
                fromRows, fromLinks, fromUrls, fromBareHosts);
        if (found.isEmpty()) {
            log.warn("No outproxies found on directory page");
        }
        return List.copyOf(found.values());
    }

    private int parseRows(Document document, Map<String, ProxyRecord> found) {
        int added = 0;
        for (Element row : document.select("tr")) {
            List<Element> cells = cells(row, "td");
            if (cells.isEmpty()) {
                cells = cells(row, "th");
            }
            if (cells.size() < MIN_ROW_CELLS) {
                continue;
            }
            Optional<ProxyRecord> record = fromRow(
                    cells.get(0).text(),
                    cells.get(1).text(),
                    cells.get(3).text()
            );
            if (record.isPresent() && add(found, record.get())) {
                added++;
            }
        }
        return added;
    }

    Optional<ProxyRecord> fromRow(String addressCell, String portCell, String typeCell) {
        Optional<ProxyKind> kind = ProxyKind.fromType(typeCell);
        if (kind.isEmpty() || kind.get() == ProxyKind.PLAIN) {
            return Optional.empty();
        }
        String host = bareHost(addressCell);
        if (!domains.isOverlayHost(host)) {
            return Optional.empty();
        }
        Integer port = parsePort(portCell);
        if (port == null) {
            return Optional.empty();
        }
        return Optional.of(ProxyRecord.of(host, port, kind.get()));
    }

    private int parseLinks(Document document, Map<String, ProxyRecord> found) {
        int added = 0;
        for (Element link : document.select("a[href]")) {
            URI uri;
            try {
                uri = URI.create(link.attr("href").trim());
            } catch (IllegalArgumentException e) {
                continue;
            }
            if (!"https".equalsIgnoreCase(uri.getScheme()) || !domains.isOverlayHost(uri.getHost())) {
                continue;
            }
            int port = uri.getPort() == -1 ? DEFAULT_HTTPS_PORT : uri.getPort();
            if (port < 1 || port > 65535) {
                continue;
            }
            if (add(found, ProxyRecord.of(uri.getHost(), port, ProxyKind.ENCRYPTED))) {
                added++;
            }
        }
        return added;
    }

    private int parseHttpsUrls(String text, Map<String, ProxyRecord> found) {
        int added = 0;
        Matcher matcher = httpsUrlPattern.matcher(text);
        while (matcher.find()) {
            Integer port = matcher.group(2) == null ? Integer.valueOf(DEFAULT_HTTPS_PORT) : parsePort(matcher.group(2));
            if (port == null) {
                continue;
            }
            if (add(found, ProxyRecord.of(matcher.group(1), port, ProxyKind.ENCRYPTED))) {
                added++;
            }
        }
        return added;
    }

    private int parseBareHosts(String text, Map<String, ProxyRecord> found) {
        int added = 0;
        Matcher matcher = bareHostPattern.matcher(text);
        while (matcher.find()) {
            Integer port = parsePort(matcher.group(2));
            if (port == null || !BARE_HOST_PORTS.contains(port)) {
                continue;
            }
            if (add(found, ProxyRecord.of(matcher.group(1), port))) {
                added++;
            }
        }
        return added;
    }

    private static boolean add(Map<String, ProxyRecord> found, ProxyRecord record) {
        if (found.putIfAbsent(record.key(), record) != null) {
            return false;
        }
        log.debug("Found outproxy {}", record);
        return true;
    }

    private static List<Element> cells(Element row, String tag) {
        List<Element> cells = new ArrayList<>();
        for (Element child : row.children()) {
            if (tag.equalsIgnoreCase(child.tagName())) {
                cells.add(child);
            }
        }
        return cells;
    }

    /**
     * Strip scheme, path and port from an address cell.
     */
    static String bareHost(String address) {
        if (address == null) {
            return "";
        }
        String value = address.trim().toLowerCase(Locale.ROOT);
        int schemeEnd = value.indexOf("://");
        if (schemeEnd >= 0) {
            value = value.substring(schemeEnd + 3);
        }
        int slash = value.indexOf('/');
        if (slash >= 0) {
            value = value.substring(0, slash);
        }
        int colon = value.indexOf(':');
        if (colon >= 0) {
            value = value.substring(0, colon);
        }
        return value;
    }

    private static Integer parsePort(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            int port = Integer.parseInt(raw.trim());
            return port >= 1 && port <= 65535 ? port : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String overlayHostRegex(OverlayDomains domains) {
        StringBuilder suffixes = new StringBuilder();
        for (String suffix : domains.suffixes()) {
            if (suffixes.length() > 0) {
                suffixes.append('|');
            }
            suffixes.append(Pattern.quote(suffix.substring(1)));
        }
        return "(?:[a-z0-9](?:[a-z0-9-]*[a-z0-9])?\\.)+(?:" + suffixes + ")(?![a-z0-9-]|\\.[a-z0-9])";
    }
}
