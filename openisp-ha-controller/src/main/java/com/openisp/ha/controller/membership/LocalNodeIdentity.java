package com.openisp.ha.controller.membership;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.Enumeration;
import java.util.Objects;

/**
 * Identity this server presents when it creates or joins a cluster.
 *
 * The hardware id is the MAC address of the first interface that is up and not
 * loopback, unless one is configured. It keys the roster row, so it must stay
 * stable across restarts.
 *
 * Thread Safety: This class is immutable and thread-safe.
 */
@Slf4j
@Getter
@Builder(toBuilder = true)
@ToString
public final class LocalNodeIdentity {

    static final String UNKNOWN_HARDWARE_ID = "unknown";
    static final String LOOPBACK_ADDRESS = "127.0.0.1";

    private final String hardwareId;
    private final String serverIp;
    private final String serverName;

    private LocalNodeIdentity(String hardwareId, String serverIp, String serverName) {
        this.hardwareId = Objects.requireNonNull(hardwareId, "hardwareId must not be null");
        this.serverIp = Objects.requireNonNull(serverIp, "serverIp must not be null");
        this.serverName = serverName;
    }

    /**
     * Builds the identity from configured values, detecting whatever is missing.
     *
     * @param hardwareId configured hardware id, or null to use the MAC address
     * @param serverIp configured address, or null to use the first IPv4 address
     * @param serverName configured display name, may be null
     */
    public static LocalNodeIdentity resolve(String hardwareId, String serverIp, String serverName) {
        return LocalNodeIdentity.builder()
                .hardwareId(isBlank(hardwareId) ? detectHardwareId() : hardwareId)
                .serverIp(isBlank(serverIp) ? detectIpAddress() : serverIp)
                .serverName(serverName)
                .build();
    }

    /**
     * Returns this identity with the address and name an operator supplied, where given.
     */
    public LocalNodeIdentity withOverrides(String ip, String name) {
        return toBuilder()
                .serverIp(isBlank(ip) ? serverIp : ip)
                .serverName(isBlank(name) ? serverName : name)
                .build();
    }

    // ========== Detection Methods ==========

    private static String detectHardwareId() {
        try {
            Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
            while (interfaces != null && interfaces.hasMoreElements()) {
                NetworkInterface iface = interfaces.nextElement();
                if (iface.isLoopback() || !iface.isUp()) {
                    continue;
                }
                byte[] mac = iface.getHardwareAddress();
                if (mac != null && mac.length > 0) {
                    return formatMac(mac);
                }
            }
        } catch (SocketException e) {
            log.warn("Could not read network interfaces: {}", e.getMessage());
        }
        return UNKNOWN_HARDWARE_ID;
    }

    private static String detectIpAddress() {
        try {
            Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
            while (interfaces != null && interfaces.hasMoreElements()) {
                NetworkInterface iface = interfaces.nextElement();
                if (iface.isLoopback() || !iface.isUp()) {
                    continue;
                }
                Enumeration<InetAddress> addresses = iface.getInetAddresses();
                while (addresses.hasMoreElements()) {
                    InetAddress address = addresses.nextElement();
                    if (!address.isLoopbackAddress() && address instanceof Inet4Address) {
                        return address.getHostAddress();
                    }
                }
            }
        } catch (SocketException e) {
            log.warn("Could not read network interfaces: {}", e.getMessage());
        }
        return LOOPBACK_ADDRESS;
    }

    static String formatMac(byte[] mac) {
        StringBuilder formatted = new StringBuilder();
        for (int i = 0; i < mac.length; i++) {
            if (i > 0) {
                formatted.append(':');
            }
            formatted.append(String.format("%02x", mac[i]));
        }
        return formatted.toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
