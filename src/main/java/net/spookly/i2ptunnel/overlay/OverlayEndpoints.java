package net.spookly.i2ptunnel.overlay;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.i2ptunnel.config.ConfigDefaults;
import net.spookly.i2ptunnel.config.TunnelConfig;
import net.spookly.i2ptunnel.util.HostPort;
import net.spookly.i2ptunnel.util.OverlayDomains;

/**
 * Local proxy endpoints exposed by the overlay router and the domains that must go through them.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class OverlayEndpoints {
    public static final OverlayEndpoints DEFAULT = new OverlayEndpoints(
            HostPort.parse(ConfigDefaults.OVERLAY_HTTP_PROXY),
            HostPort.parse(ConfigDefaults.OVERLAY_HTTPS_PROXY),
            OverlayDomains.DEFAULT
    );

    /**
     * Plain HTTP forward proxy, used for http targets and for the directory fetch.
     */
    private final HostPort httpProxy;
    /**
     * CONNECT-capable proxy used for https targets.
     */
    private final HostPort httpsProxy;
    private final OverlayDomains domains;

    public static OverlayEndpoints fromConfig(TunnelConfig.OverlayConfig overlay) {
        if (overlay == null) {
            return DEFAULT;
        }
        return new OverlayEndpoints(
                HostPort.parse(overlay.httpProxy),
                HostPort.parse(overlay.httpsProxy),
                new OverlayDomains(overlay.domainSuffixes)
        );
    }
}
