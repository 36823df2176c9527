package com.acme.leadflow.audit.security;

import com.acme.leadflow.audit.util.AuditDefaults;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * SSRF guard for outbound webhook targets. Runs once, when a URL is registered.
 */
public final class WebhookUrlValidator {
    private static final Set<String> BLOCKED_HOSTS = Set.of(
        "localhost",
        "metadata",
        "metadata.google.internal"
    );

    private final HostResolver resolver;

    public WebhookUrlValidator() {
        this(HostResolver.SYSTEM);
    }

    public WebhookUrlValidator(HostResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * Returns the parsed URI of an acceptable target.
     *
     * @throws AuditValidationException if the URL is malformed, not https, or points at a
     *                                  non-public address
     */
    public URI validate(String url) {
        if (url == null || url.isBlank() || url.length() > AuditDefaults.MAX_WEBHOOK_URL_LENGTH) {
            throw invalid("invalid webhook URL length");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new AuditValidationException(ValidationErrorCode.INVALID_WEBHOOK_URL, "invalid webhook URL format", e);
        }
        if (!"https".equalsIgnoreCase(uri.getScheme())) {
            throw invalid("webhook scheme must be https");
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw invalid("webhook URL must have a hostname");
        }
        if (uri.getRawUserInfo() != null || (uri.getRawAuthority() != null && uri.getRawAuthority().contains("@"))) {
            throw invalid("webhook URL must not carry credentials");
        }
        String normalizedHost = stripBrackets(host.toLowerCase(Locale.ROOT));
        if (BLOCKED_HOSTS.contains(normalizedHost) || normalizedHost.endsWith(".localhost")) {
            throw blocked("webhook host is blocked: " + normalizedHost);
        }

        InetAddress[] addresses;
        try {
            addresses = resolver.resolve(normalizedHost);
        } catch (UnknownHostException e) {
            throw new AuditValidationException(
                ValidationErrorCode.WEBHOOK_HOST_UNRESOLVABLE,
                "cannot resolve webhook host: " + normalizedHost,
                e
            );
        }
        if (addresses == null || addresses.length == 0) {
            throw new AuditValidationException(
                ValidationErrorCode.WEBHOOK_HOST_UNRESOLVABLE,
                "cannot resolve webhook host: " + normalizedHost
            );
        }
        for (InetAddress address : addresses) {
            if (!isPublic(address)) {
                throw blocked("webhook host resolves to a blocked network: " + normalizedHost);
            }
        }
        return uri;
    }

    static boolean isPublic(InetAddress address) {
        if (address.isLoopbackAddress()
            || address.isAnyLocalAddress()
            || address.isLinkLocalAddress()
            || address.isSiteLocalAddress()
            || address.isMulticastAddress()) {
            return false;
        }
        byte[] raw = address.getAddress();
        if (address instanceof Inet4Address) {
            int first = raw[0] & 0xFF;
            int second = raw[1] & 0xFF;
            // 0/8 and 100.64/10 (carrier-grade NAT)
            if (first == 0 || (first == 100 && second >= 64 && second <= 127)) {
                return false;
            }
        } else if (address instanceof Inet6Address) {
            // fc00::/7 unique local
            if ((raw[0] & 0xFE) == 0xFC) {
                return false;
            }
        }
        return true;
    }

    private static String stripBrackets(String host) {
        if (host.startsWith("[") && host.endsWith("]")) {
            return host.substring(1, host.length() - 1);
        }
        return host;
    }

    private static AuditValidationException invalid(String message) {
        return new AuditValidationException(ValidationErrorCode.INVALID_WEBHOOK_URL, message);
    }

    private static AuditValidationException blocked(String message) {
        return new AuditValidationException(ValidationErrorCode.WEBHOOK_HOST_BLOCKED, message);
    }
}
