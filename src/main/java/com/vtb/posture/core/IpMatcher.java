package com.vtb.posture.core;

import lombok.extern.slf4j.Slf4j;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Проверка IP-адреса по списку whitelist (адреса и CIDR, IPv4 и IPv6).
 * Разбирает только литералы адресов, DNS не трогает.
 */
@Slf4j
final class IpMatcher {
    
    private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");
    private static final Pattern IPV6 = Pattern.compile("^[0-9a-fA-F:.]+$");
    
    private final List<Rule> rules;
    private final boolean matchAll;
    
    private IpMatcher(List<Rule> rules, boolean matchAll) {
        this.rules = rules;
        this.matchAll = matchAll;
    }
    
    static IpMatcher of(Collection<String> entries) {
        List<Rule> rules = new ArrayList<>();
        boolean matchAll = false;
        if (entries != null) {
            for (String raw : entries) {
                if (raw == null || raw.isBlank()) {
                    continue;
                }
                String entry = raw.trim();
                if ("*".equals(entry) || "0.0.0.0/0".equals(entry) || "::/0".equals(entry)) {
                    matchAll = true;
                    continue;
                }
                Rule rule = parseRule(entry);
                if (rule != null) {
                    rules.add(rule);
                } else {
                    log.debug("Пропущена некорректная запись whitelist: {}", entry);
                }
            }
        }
        return new IpMatcher(rules, matchAll);
    }
    
    boolean matches(String ip) {
        if (ip == null || ip.isBlank()) {
            return false;
        }
        if (matchAll) {
            return true;
        }
        byte[] address = toBytes(ip.trim());
        if (address == null) {
            return false;
        }
        for (Rule rule : rules) {
            if (rule.matches(address)) {
                return true;
            }
        }
        return false;
    }
    
    private static Rule parseRule(String entry) {
        int slash = entry.indexOf('/');
        String host = slash >= 0 ? entry.substring(0, slash) : entry;
        byte[] network = toBytes(host);
        if (network == null) {
            return null;
        }
        int prefix = network.length * 8;
        if (slash >= 0) {
            try {
                prefix = Integer.parseInt(entry.substring(slash + 1).trim());
            } catch (NumberFormatException e) {
                return null;
            }
            if (prefix < 0 || prefix > network.length * 8) {
                return null;
            }
        }
        return new Rule(network, prefix);
    }
    
    static byte[] toBytes(String literal) {
        if (literal == null || literal.isEmpty()) {
            return null;
        }
        boolean v4 = IPV4.matcher(literal).matches();
        boolean v6 = !v4 && literal.indexOf(':') >= 0 && IPV6.matcher(literal).matches();
        if (!v4 && !v6) {
            return null;
        }
        if (v4) {
            for (String octet : literal.split("\\.")) {
                if (Integer.parseInt(octet) > 255) {
                    return null;
                }
            }
        }
        try {
            return InetAddress.getByName(literal).getAddress();
        } catch (UnknownHostException e) {
            return null;
        }
    }
    
    private static final class Rule {
        private final byte[] network;
        private final int prefix;
        
        private Rule(byte[] network, int prefix) {
            this.network = network;
            this.prefix = prefix;
        }
        
        boolean matches(byte[] address) {
            if (address.length != network.length) {
                return false;
            }
            int fullBytes = prefix / 8;
            int remainingBits = prefix % 8;
            for (int i = 0; i < fullBytes; i++) {
                if (address[i] != network[i]) {
                    return false;
                }
            }
            if (remainingBits == 0) {
                return true;
            }
            int mask = 0xFF << (8 - remainingBits);
            return (address[fullBytes] & mask) == (network[fullBytes] & mask);
        }
    }
}
