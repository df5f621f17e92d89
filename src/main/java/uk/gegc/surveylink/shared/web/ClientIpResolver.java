package uk.gegc.surveylink.shared.web;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Resolves the address a survey response came from. {@code X-Forwarded-For} is only honoured
 * when forwarded headers are enabled and the direct peer is a trusted proxy.
 */
@Component
public class ClientIpResolver {

    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})$");
    private static final Pattern IPV6 = Pattern.compile("^[0-9a-fA-F:]+$");

    private final boolean forwardedHeadersEnabled;
    private final List<String> trustedProxies;

    public ClientIpResolver(
            @Value("${surveylink.web.enable-forwarded-headers:false}") boolean forwardedHeadersEnabled,
            @Value("${surveylink.web.trusted-proxies:127.0.0.1,::1}") String trustedProxies) {
        this.forwardedHeadersEnabled = forwardedHeadersEnabled;
        this.trustedProxies = Arrays.stream(trustedProxies.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    public String resolve(HttpServletRequest request) {
        String remoteAddr = request.getRemoteAddr();
        if (!forwardedHeadersEnabled || !trustedProxies.contains(remoteAddr)) {
            return remoteAddr;
        }
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor == null || forwardedFor.isBlank()) {
            return remoteAddr;
        }
        String candidate = forwardedFor.split(",")[0].trim();
        return isIpAddress(candidate) ? candidate : remoteAddr;
    }

    static boolean isIpAddress(String value) {
        var ipv4 = IPV4.matcher(value);
        if (ipv4.matches()) {
            for (int i = 1; i <= 4; i++) {
                if (Integer.parseInt(ipv4.group(i)) > 255) {
                    return false;
                }
            }
            return true;
        }
        return value.contains(":") && IPV6.matcher(value).matches();
    }
}
