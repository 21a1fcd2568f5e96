package com.example.hookregistry.utils;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 订阅目标地址校验
 * 注册时拒绝非 HTTP(S) 协议、黑名单主机以及指向内网/回环的 IP 字面量。
 * 这里不做 DNS 解析：解析结果会随时间变化，投递时的 DNS 固定由中继负责。
 */
@Component
@Slf4j
public class UrlValidator {

    private final List<String> blockedIps;

    public UrlValidator(
            @Value("${app.security.ssrf.blocked-ips:127.0.0.1,localhost,10.0.0.0/8,172.16.0.0/12,192.168.0.0/16,169.254.169.254}") String blockedIpsConfig) {
        this.blockedIps = Arrays.stream(blockedIpsConfig.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * 校验订阅目标 URL。
     *
     * @param url 目标 URL
     * @throws IllegalArgumentException 如果 URL 不合法或指向受限地址
     */
    public void validate(String url) {
        try {
            if (url == null || url.isBlank()) {
                throw new IllegalArgumentException("Url cannot be empty");
            }

            URI uri = URI.create(url.trim()).normalize();

            String scheme = uri.getScheme();
            if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
                throw new IllegalArgumentException("Blocked protocol: " + scheme);
            }

            String host = uri.getHost();
            if (host == null || host.isEmpty()) {
                throw new IllegalArgumentException("Host cannot be empty");
            }

            // 通配/零地址
            if (host.equals("0.0.0.0") || host.equals("::") || host.equals("[::]")) {
                throw new IllegalArgumentException("Blocked wildcard address: " + host);
            }

            // "localhost." 与 "localhost" 等价
            String normalizedHost = stripTrailingDots(stripBrackets(host)).toLowerCase(Locale.ROOT);
            if (normalizedHost.isEmpty() || blockedIps.contains(normalizedHost)) {
                throw new IllegalArgumentException("Blocked host: " + host);
            }

            if (isIpLiteral(normalizedHost)) {
                // 不含字母的主机（含 2130706433 这类单整数写法）按 IP 解析，不会触发 DNS 查询
                InetAddress addr = InetAddress.getByName(normalizedHost);
                if (isBlockedAddress(addr)) {
                    throw new IllegalArgumentException("Blocked IP detected: " + addr.getHostAddress());
                }
            }
        } catch (IllegalArgumentException e) {
            log.warn("[SSRF] Validation failed for {}: {}", url, e.getMessage());
            throw e;
        } catch (UnknownHostException e) {
            log.warn("[SSRF] Invalid address for {}: {}", url, e.getMessage());
            throw new IllegalArgumentException("Invalid address: " + url, e);
        }
    }

    /**
     * 快速判断 URL 是否安全。
     *
     * @param url 目标 URL
     * @return true 表示安全
     */
    public boolean isSafeUrl(String url) {
        try {
            validate(url);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static boolean isIpLiteral(String host) {
        return host.contains(":") || host.chars().noneMatch(Character::isLetter);
    }

    private static String stripTrailingDots(String host) {
        int end = host.length();
        while (end > 0 && host.charAt(end - 1) == '.') {
            end--;
        }
        return host.substring(0, end);
    }

    private static String stripBrackets(String host) {
        if (host.startsWith("[") && host.endsWith("]")) {
            return host.substring(1, host.length() - 1);
        }
        return host;
    }

    /**
     * 判断 IP 是否属于受限范围。
     *
     * @param addr IP 地址
     * @return true 表示受限，false 表示允许
     */
    private boolean isBlockedAddress(InetAddress addr) {
        if (addr.isLoopbackAddress() || addr.isSiteLocalAddress() || addr.isLinkLocalAddress()
                || addr.isMulticastAddress() || addr.isAnyLocalAddress()) {
            return true;
        }

        byte[] bytes = addr.getAddress();

        // IPv6 ULA（唯一本地地址）：fc00::/7
        if (bytes.length == 16 && (bytes[0] & 0xFE) == (byte) 0xFC) {
            return true;
        }

        String ip = addr.getHostAddress();
        for (String blocked : blockedIps) {
            if (blocked.contains("/")) {
                if (isInSubnet(addr, blocked)) {
                    return true;
                }
            } else if (ip.equals(blocked)) {
                return true;
            }
        }

        return false;
    }

    /**
     * 判断 IP 是否落入指定 CIDR。
     *
     * @param addr IP 地址
     * @param cidr CIDR 表示
     * @return true 表示命中
     */
    private boolean isInSubnet(InetAddress addr, String cidr) {
        try {
            String[] parts = cidr.split("/");
            int bits = Integer.parseInt(parts[1]);

            byte[] ipBytes = addr.getAddress();
            byte[] subnetBytes = InetAddress.getByName(parts[0]).getAddress();
            if (ipBytes.length != subnetBytes.length) {
                return false;
            }

            int fullBytes = bits / 8;
            for (int i = 0; i < fullBytes; i++) {
                if (ipBytes[i] != subnetBytes[i]) {
                    return false;
                }
            }

            int remainingBits = bits % 8;
            if (remainingBits > 0) {
                int mask = (0xFF << (8 - remainingBits)) & 0xFF;
                return (ipBytes[fullBytes] & mask) == (subnetBytes[fullBytes] & mask);
            }

            return true;
        } catch (UnknownHostException | NumberFormatException | ArrayIndexOutOfBoundsException e) {
            log.warn("[SSRF] Ignoring malformed CIDR entry: {}", cidr);
            return false;
        }
    }
}
